package com.retail.loyalty_backend.modules.points.service;

import com.retail.loyalty_backend.common.exception.BizException;
import com.retail.loyalty_backend.modules.account.entity.LoyaltyAccount;
import com.retail.loyalty_backend.modules.ledger.entity.PointsTransaction;
import com.retail.loyalty_backend.modules.ledger.enums.PointsSource;
import com.retail.loyalty_backend.modules.ledger.enums.PointsTransactionType;
import com.retail.loyalty_backend.modules.points.config.PointsRulesProperties;
import com.retail.loyalty_backend.modules.points.dto.AdjustPointsDto;
import com.retail.loyalty_backend.modules.points.vo.AdjustPointsResultVo;
import com.retail.loyalty_backend.modules.tier.domain.TierChange;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 管理员积分调整（审计：记录操作人与原因）。
 * <p>
 * 正数调整只记录有效期供展示，不是积分批次：不参与过期扫描，也不被 FIFO 消费。
 * 负数调整与消费一样按 FIFO 扣减批次余量，保证之后的过期任务不会再次扣掉已被扣减的积分。
 */
@Service
@Validated
@Slf4j
public class PointsAdjustmentService {

    private final PointsLedgerWriter ledgerWriter;
    private final PointsRulesProperties rules;
    private final Clock clock;

    public PointsAdjustmentService(PointsLedgerWriter ledgerWriter,
                                   PointsRulesProperties rules,
                                   Clock clock) {
        this.ledgerWriter = ledgerWriter;
        this.rules = rules;
        this.clock = clock;
    }

    @Transactional
    public AdjustPointsResultVo adjust(@Valid AdjustPointsDto dto) {
        long delta = dto.getDelta() == null ? 0L : dto.getDelta();
        if (delta == 0) {
            throw new BizException("Adjustment amount must not be zero");
        }
        if (!StringUtils.hasText(dto.getReason()) || !StringUtils.hasText(dto.getActorId())) {
            throw new BizException("Adjustment reason and actor are required");
        }

        LoyaltyAccount account = ledgerWriter.lockAccount(dto.getUserId());
        long balance = account.getPointsBalance() == null ? 0L : account.getPointsBalance();
        long newBalance = Math.addExact(balance, delta);
        if (newBalance < 0) {
            throw new BizException("Adjustment would make balance negative: balance " + balance + ", delta " + delta);
        }
        LocalDateTime now = LocalDateTime.now(clock);

        PointsTransaction entry = new PointsTransaction();
        entry.setTenantId(account.getTenantId());
        entry.setUserId(account.getUserId());
        entry.setType(PointsTransactionType.ADJUST);
        entry.setAmount(delta);
        entry.setBalanceAfter(newBalance);
        entry.setSource(PointsSource.ADMIN);
        entry.setDescription("Adjustment: " + dto.getReason());
        entry.setActorId(dto.getActorId());
        entry.setIsExpired(false);
        entry.setCreatedAt(now);
        if (delta > 0) {
            entry.setExpiresAt(now.plusDays(rules.getExpiryDays()));
        }
        ledgerWriter.append(entry);

        TierChange tierChange = ledgerWriter.applyBalance(account, newBalance);
        if (delta < 0) {
            ledgerWriter.consumeFifo(account.getUserId(), -delta);
        }

        log.info("Admin {} adjusted {} points for user {}: {} (balance {})",
                dto.getActorId(), delta, account.getUserId(), dto.getReason(), newBalance);

        AdjustPointsResultVo result = new AdjustPointsResultVo();
        result.setEntryId(entry.getId());
        result.setDelta(delta);
        result.setNewBalance(newBalance);
        result.setTierCode(tierChange.to().code());
        result.setTierChanged(tierChange.changed());
        return result;
    }
}
