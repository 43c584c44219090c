package com.retail.loyalty_backend.modules.expiry.service;

import com.retail.loyalty_backend.modules.account.entity.LoyaltyAccount;
import com.retail.loyalty_backend.modules.ledger.entity.PointsTransaction;
import com.retail.loyalty_backend.modules.ledger.enums.PointsSource;
import com.retail.loyalty_backend.modules.ledger.enums.PointsTransactionType;
import com.retail.loyalty_backend.modules.ledger.mapper.PointsTransactionMapper;
import com.retail.loyalty_backend.modules.points.event.PointsExpiredEvent;
import com.retail.loyalty_backend.modules.points.service.PointsLedgerWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 单个积分批次过期（独立事务）。
 * <p>
 * 与获得/消费使用同一把账户行锁，加锁后复核批次状态，因此与并发消费交错执行时不会重复扣减，
 * 重复执行也只会在第一次生效。
 */
@Service
@Slf4j
public class PointsExpiryTxService {

    static final String REFERENCE_TYPE_LOT = "points_transaction";

    private final PointsTransactionMapper transactionMapper;
    private final PointsLedgerWriter ledgerWriter;
    private final ApplicationEventPublisher eventPublisher;

    public PointsExpiryTxService(PointsTransactionMapper transactionMapper,
                                 PointsLedgerWriter ledgerWriter,
                                 ApplicationEventPublisher eventPublisher) {
        this.transactionMapper = transactionMapper;
        this.ledgerWriter = ledgerWriter;
        this.eventPublisher = eventPublisher;
    }

    /**
     * 候选批次 ID（无锁读取，按 id 升序游标分页）；是否真正过期以 {@link #expireLot} 加锁后的复核为准。
     */
    public List<Long> findExpiredLotIds(LocalDateTime now, long afterId, int limit) {
        return transactionMapper.selectExpiredLotIds(now, afterId, limit);
    }

    /**
     * @return 实际过期的积分数；批次已不满足过期条件时返回 0
     */
    @Transactional
    public long expireLot(Long lotId, LocalDateTime now) {
        Optional<PointsTransaction> candidate = transactionMapper.selectById(lotId);
        if (candidate.isEmpty()) {
            return 0L;
        }
        // 先账户、后批次
        LoyaltyAccount account = ledgerWriter.lockAccount(candidate.get().getUserId());
        PointsTransaction lot = transactionMapper.lockByIdForUpdate(lotId).orElse(null);
        if (!isExpirable(lot, now)) {
            return 0L;
        }

        long remaining = lot.getRemainingAmount();
        long balance = account.getPointsBalance() == null ? 0L : account.getPointsBalance();
        if (remaining > balance) {
            log.warn("Lot {} of user {} has remaining {} above balance {}, expiring only the balance",
                    lotId, account.getUserId(), remaining, balance);
        }
        long expired = Math.min(remaining, balance);
        long newBalance = balance - expired;

        PointsTransaction entry = new PointsTransaction();
        entry.setTenantId(account.getTenantId());
        entry.setUserId(account.getUserId());
        entry.setType(PointsTransactionType.EXPIRE);
        entry.setAmount(-expired);
        entry.setBalanceAfter(newBalance);
        entry.setSource(PointsSource.EXPIRY);
        entry.setReferenceId(String.valueOf(lotId));
        entry.setReferenceType(REFERENCE_TYPE_LOT);
        entry.setDescription("Points expired (-" + expired + ")");
        entry.setIsExpired(false);
        entry.setCreatedAt(now);
        ledgerWriter.append(entry);

        if (transactionMapper.markExpired(lotId) != 1) {
            throw new IllegalStateException("Lot " + lotId + " was expired concurrently");
        }
        ledgerWriter.applyBalance(account, newBalance);

        eventPublisher.publishEvent(new PointsExpiredEvent(account.getTenantId(), account.getUserId(),
                lotId, expired, newBalance));
        log.info("Expired {} points of lot {} for user {}, balance {}", expired, lotId, account.getUserId(), newBalance);
        return expired;
    }

    static boolean isExpirable(PointsTransaction lot, LocalDateTime now) {
        return lot != null
                && lot.isCreditLot()
                && !Boolean.TRUE.equals(lot.getIsExpired())
                && lot.getRemainingAmount() > 0
                && lot.getExpiresAt() != null
                && lot.getExpiresAt().isBefore(now);
    }
}
