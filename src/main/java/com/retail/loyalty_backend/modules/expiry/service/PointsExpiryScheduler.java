package com.retail.loyalty_backend.modules.expiry.service;

import com.retail.loyalty_backend.modules.expiry.vo.ExpirySweepResultVo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 积分过期扫描：找出已到期且仍有余量的积分批次，逐个在独立事务中转为 EXPIRE 流水。
 * <p>
 * 单个批次失败只记录日志，不影响其他批次；失败的批次保持原状，下次扫描重试。
 */
@Service
@Slf4j
public class PointsExpiryScheduler {

    private final PointsExpiryTxService expiryTxService;
    private final Clock clock;
    private final int batchSize;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public PointsExpiryScheduler(PointsExpiryTxService expiryTxService,
                                 Clock clock,
                                 @Value("${app.loyalty.expiry.batch-size:500}") int batchSize) {
        this.expiryTxService = expiryTxService;
        this.clock = clock;
        this.batchSize = Math.max(1, batchSize);
    }

    @Scheduled(cron = "${app.loyalty.expiry.cron:0 0 1 * * ?}", zone = "${app.loyalty.time-zone:Asia/Tashkent}")
    public void expirePointsDaily() {
        runSweep();
    }

    public ExpirySweepResultVo runSweep() {
        ExpirySweepResultVo result = new ExpirySweepResultVo();
        if (!running.compareAndSet(false, true)) {
            log.info("Points expiry sweep skipped: previous run still in progress");
            result.setAlreadyRunning(true);
            return result;
        }
        try {
            LocalDateTime now = LocalDateTime.now(clock);
            log.info("Points expiry sweep started at {}", now);
            long afterId = 0L;
            while (true) {
                List<Long> lotIds = expiryTxService.findExpiredLotIds(now, afterId, batchSize);
                if (lotIds.isEmpty()) {
                    break;
                }
                for (Long lotId : lotIds) {
                    try {
                        long expired = expiryTxService.expireLot(lotId, now);
                        if (expired > 0) {
                            result.setExpiredEntries(result.getExpiredEntries() + 1);
                            result.setExpiredPoints(result.getExpiredPoints() + expired);
                        } else {
                            result.setSkipped(result.getSkipped() + 1);
                        }
                    } catch (Exception ex) {
                        result.setFailed(result.getFailed() + 1);
                        log.warn("Failed to expire points lot {}", lotId, ex);
                    }
                }
                afterId = lotIds.get(lotIds.size() - 1);
                if (lotIds.size() < batchSize) {
                    break;
                }
            }
            log.info("Points expiry sweep finished: expiredEntries={}, expiredPoints={}, skipped={}, failed={}",
                    result.getExpiredEntries(), result.getExpiredPoints(), result.getSkipped(), result.getFailed());
            return result;
        } finally {
            running.set(false);
        }
    }
}
