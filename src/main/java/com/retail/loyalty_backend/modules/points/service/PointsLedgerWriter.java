package com.retail.loyalty_backend.modules.points.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.retail.loyalty_backend.common.exception.BizException;
import com.retail.loyalty_backend.modules.account.entity.LoyaltyAccount;
import com.retail.loyalty_backend.modules.account.mapper.LoyaltyAccountMapper;
import com.retail.loyalty_backend.modules.ledger.entity.PointsTransaction;
import com.retail.loyalty_backend.modules.ledger.mapper.PointsTransactionMapper;
import com.retail.loyalty_backend.modules.points.event.TierChangedEvent;
import com.retail.loyalty_backend.modules.tier.domain.Tier;
import com.retail.loyalty_backend.modules.tier.domain.TierChange;
import com.retail.loyalty_backend.modules.tier.service.TierService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;

import java.util.List;
import java.util.Map;

/**
 * 积分流水 + 账户投影的写入原语。
 * <p>
 * 调用方必须处于事务中，且先通过 {@link #lockAccount(Long)} 锁定账户行：
 * 同一用户的追加流水、FIFO 消费、余额更新在同一把行锁下完成，不同用户互不阻塞。
 * 加锁顺序固定为"先账户、后流水"，过期任务遵循相同顺序。
 */
@Component
@Slf4j
public class PointsLedgerWriter {

    /** FIFO 单批扫描的积分批次数 */
    static final int FIFO_BATCH_SIZE = 50;

    private final LoyaltyAccountMapper accountMapper;
    private final PointsTransactionMapper transactionMapper;
    private final TierService tierService;
    private final ApplicationEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;

    public PointsLedgerWriter(LoyaltyAccountMapper accountMapper,
                              PointsTransactionMapper transactionMapper,
                              TierService tierService,
                              ApplicationEventPublisher eventPublisher,
                              ObjectMapper objectMapper) {
        this.accountMapper = accountMapper;
        this.transactionMapper = transactionMapper;
        this.tierService = tierService;
        this.eventPublisher = eventPublisher;
        this.objectMapper = objectMapper;
    }

    /**
     * 锁定用户积分账户行，不存在时抛出 404。
     */
    public LoyaltyAccount lockAccount(Long userId) {
        if (userId == null) {
            throw new BizException("userId is required");
        }
        return accountMapper.lockByUserIdForUpdate(userId)
                .orElseThrow(() -> BizException.notFound("Loyalty account not found for user " + userId));
    }

    public PointsTransaction append(PointsTransaction entry) {
        transactionMapper.insert(entry);
        return entry;
    }

    /**
     * 写入新余额并按余额重算等级；等级变化时发布 {@link TierChangedEvent}。
     */
    public TierChange applyBalance(LoyaltyAccount account, long newBalance) {
        if (newBalance < 0) {
            throw new IllegalStateException("Negative balance for user " + account.getUserId() + ": " + newBalance);
        }
        Tier oldTier = tierService.byCode(account.getTierCode());
        Tier newTier = tierService.resolve(newBalance);
        int updated = accountMapper.updateBalanceAndTier(account.getUserId(), newBalance, newTier.code());
        if (updated != 1) {
            throw new IllegalStateException("Loyalty account update affected " + updated + " rows for user " + account.getUserId());
        }
        account.setPointsBalance(newBalance);
        account.setTierCode(newTier.code());

        TierChange change = new TierChange(oldTier, newTier, tierService.isUpgrade(oldTier, newTier));
        if (change.changed()) {
            log.info("Tier changed for user {}: {} -> {} (balance {})",
                    account.getUserId(), oldTier.code(), newTier.code(), newBalance);
            eventPublisher.publishEvent(new TierChangedEvent(account.getTenantId(), account.getUserId(),
                    oldTier.code(), newTier.code(), change.upgrade(), newBalance));
        }
        return change;
    }

    /**
     * 按创建时间从旧到新消费积分批次的余量，直到覆盖 amount 或批次耗尽。
     * 只重新分配"哪些批次仍支撑余额"，不修改账户余额。
     *
     * @return 实际分配到批次上的积分数
     */
    public long consumeFifo(Long userId, long amount) {
        long remaining = amount;
        while (remaining > 0) {
            List<PointsTransaction> lots = transactionMapper.selectOpenLotsForUpdate(userId, FIFO_BATCH_SIZE);
            if (CollectionUtils.isEmpty(lots)) {
                break;
            }
            for (PointsTransaction lot : lots) {
                if (remaining <= 0) {
                    break;
                }
                long available = lot.getRemainingAmount() == null ? 0L : lot.getRemainingAmount();
                if (available <= 0) {
                    continue;
                }
                long take = Math.min(remaining, available);
                int updated = transactionMapper.updateRemainingAmount(lot.getId(), available - take);
                if (updated != 1) {
                    throw new IllegalStateException("Lot " + lot.getId() + " remaining update affected " + updated + " rows");
                }
                lot.setRemainingAmount(available - take);
                remaining -= take;
            }
            if (lots.size() < FIFO_BATCH_SIZE) {
                break;
            }
        }
        if (remaining > 0) {
            // 剩余部分由正数调整等不过期的积分承担
            log.debug("FIFO consumption for user {} covered {} of {} points from lots", userId, amount - remaining, amount);
        }
        return amount - remaining;
    }

    public String toMetadataJson(Map<String, Object> metadata) {
        if (CollectionUtils.isEmpty(metadata)) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Ledger metadata is not serialisable: " + e.getOriginalMessage(), e);
        }
    }
}
