package com.retail.loyalty_backend.modules.points.service;

import com.retail.loyalty_backend.common.exception.BizException;
import com.retail.loyalty_backend.modules.account.entity.LoyaltyAccount;
import com.retail.loyalty_backend.modules.ledger.entity.PointsTransaction;
import com.retail.loyalty_backend.modules.ledger.enums.PointsSource;
import com.retail.loyalty_backend.modules.ledger.enums.PointsTransactionType;
import com.retail.loyalty_backend.modules.points.config.PointsRulesProperties;
import com.retail.loyalty_backend.modules.points.dto.SpendPointsDto;
import com.retail.loyalty_backend.modules.points.event.PointsSpentEvent;
import com.retail.loyalty_backend.modules.points.vo.SpendPointsResultVo;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 积分抵扣：校验门槛与余额，追加 SPEND 流水，并按 FIFO 消费最早的积分批次。
 */
@Service
@Validated
@Slf4j
public class PointsSpendingService {

    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100L);

    private final PointsLedgerWriter ledgerWriter;
    private final PointsRulesProperties rules;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public PointsSpendingService(PointsLedgerWriter ledgerWriter,
                                 PointsRulesProperties rules,
                                 ApplicationEventPublisher eventPublisher,
                                 Clock clock) {
        this.ledgerWriter = ledgerWriter;
        this.rules = rules;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    @Transactional
    public SpendPointsResultVo spend(@Valid SpendPointsDto dto) {
        long amount = dto.getAmount() == null ? 0L : dto.getAmount();
        if (amount <= 0) {
            throw new BizException("Points amount must be positive");
        }
        if (amount < rules.getMinPointsToSpend()) {
            throw new BizException("Minimum " + rules.getMinPointsToSpend() + " points required to spend");
        }

        LoyaltyAccount account = ledgerWriter.lockAccount(dto.getUserId());
        long balance = account.getPointsBalance() == null ? 0L : account.getPointsBalance();
        if (amount > balance) {
            throw BizException.conflict("Insufficient points: available " + balance + ", requested " + amount);
        }
        long newBalance = balance - amount;
        LocalDateTime now = LocalDateTime.now(clock);

        PointsTransaction entry = new PointsTransaction();
        entry.setTenantId(account.getTenantId());
        entry.setUserId(account.getUserId());
        entry.setType(PointsTransactionType.SPEND);
        entry.setAmount(-amount);
        entry.setBalanceAfter(newBalance);
        entry.setSource(PointsSource.PURCHASE);
        entry.setReferenceId(dto.getReferenceId());
        entry.setReferenceType(dto.getReferenceType());
        entry.setDescription(StringUtils.hasText(dto.getDescription())
                ? dto.getDescription()
                : PointsDescriptions.forSource(PointsSource.PURCHASE, amount));
        entry.setIsExpired(false);
        entry.setCreatedAt(now);
        ledgerWriter.append(entry);

        ledgerWriter.applyBalance(account, newBalance);
        ledgerWriter.consumeFifo(account.getUserId(), amount);

        BigDecimal monetaryValue = rules.getPointsValue().multiply(BigDecimal.valueOf(amount));
        eventPublisher.publishEvent(new PointsSpentEvent(account.getTenantId(), account.getUserId(),
                amount, dto.getReferenceId(), newBalance));
        log.info("Spent {} points for user {} (ref {}), balance {}",
                amount, account.getUserId(), dto.getReferenceId(), newBalance);

        SpendPointsResultVo result = new SpendPointsResultVo();
        result.setDebitedAmount(amount);
        result.setNewBalance(newBalance);
        result.setMonetaryValue(monetaryValue);
        result.setEntryId(entry.getId());
        return result;
    }

    /**
     * 订单可用积分上限：floor(订单金额 * maxPointsPercent% / pointsValue)，且不超过余额。
     * 供下单方在调用 {@link #spend(SpendPointsDto)} 前校验。
     */
    public long maxSpendableForOrder(BigDecimal orderAmount, long balance) {
        if (orderAmount == null || orderAmount.signum() <= 0 || balance <= 0) {
            return 0L;
        }
        long cap = orderAmount.multiply(BigDecimal.valueOf(rules.getMaxPointsPercent()))
                .divide(ONE_HUNDRED.multiply(rules.getPointsValue()), 0, RoundingMode.FLOOR)
                .longValue();
        return Math.min(cap, balance);
    }
}
