package com.retail.loyalty_backend.modules.points.service;

import com.retail.loyalty_backend.common.exception.BizException;
import com.retail.loyalty_backend.modules.account.entity.LoyaltyAccount;
import com.retail.loyalty_backend.modules.ledger.entity.PointsTransaction;
import com.retail.loyalty_backend.modules.ledger.enums.PointsTransactionType;
import com.retail.loyalty_backend.modules.points.config.PointsRulesProperties;
import com.retail.loyalty_backend.modules.points.dto.EarnPointsDto;
import com.retail.loyalty_backend.modules.points.event.PointsEarnedEvent;
import com.retail.loyalty_backend.modules.points.vo.EarnPointsResultVo;
import com.retail.loyalty_backend.modules.tier.domain.Tier;
import com.retail.loyalty_backend.modules.tier.domain.TierChange;
import com.retail.loyalty_backend.modules.tier.service.TierService;
import com.retail.loyalty_backend.modules.tier.vo.TierInfoVo;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 积分入账：按当前等级倍率换算，追加 EARN 批次（带过期时间），更新余额与等级。
 */
@Service
@Validated
@Slf4j
public class PointsEarningService {

    private final PointsLedgerWriter ledgerWriter;
    private final TierService tierService;
    private final PointsRulesProperties rules;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public PointsEarningService(PointsLedgerWriter ledgerWriter,
                                TierService tierService,
                                PointsRulesProperties rules,
                                ApplicationEventPublisher eventPublisher,
                                Clock clock) {
        this.ledgerWriter = ledgerWriter;
        this.tierService = tierService;
        this.rules = rules;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    @Transactional
    public EarnPointsResultVo earn(@Valid EarnPointsDto dto) {
        if (dto.getAmount() == null || dto.getAmount() <= 0) {
            throw new BizException("Points amount must be positive");
        }
        LoyaltyAccount account = ledgerWriter.lockAccount(dto.getUserId());
        long balance = account.getPointsBalance() == null ? 0L : account.getPointsBalance();

        // 倍率取入账前的等级
        Tier currentTier = tierService.resolve(balance);
        long credited = currentTier.applyMultiplier(dto.getAmount());
        long newBalance = Math.addExact(balance, credited);
        LocalDateTime now = LocalDateTime.now(clock);

        PointsTransaction entry = new PointsTransaction();
        entry.setTenantId(account.getTenantId());
        entry.setUserId(account.getUserId());
        entry.setType(PointsTransactionType.EARN);
        entry.setAmount(credited);
        entry.setBalanceAfter(newBalance);
        entry.setSource(dto.getSource());
        entry.setReferenceId(dto.getReferenceId());
        entry.setReferenceType(dto.getReferenceType());
        entry.setDescription(StringUtils.hasText(dto.getDescription())
                ? dto.getDescription()
                : PointsDescriptions.forSource(dto.getSource(), credited));
        entry.setMetadata(ledgerWriter.toMetadataJson(dto.getMetadata()));
        entry.setExpiresAt(now.plusDays(rules.getExpiryDays()));
        entry.setRemainingAmount(credited);
        entry.setIsExpired(false);
        entry.setCreatedAt(now);
        ledgerWriter.append(entry);

        TierChange tierChange = ledgerWriter.applyBalance(account, newBalance);

        eventPublisher.publishEvent(new PointsEarnedEvent(account.getTenantId(), account.getUserId(),
                credited, dto.getSource(), dto.getReferenceId(), newBalance));
        log.info("Earned {} points (raw {}, x{}) for user {} from {}, balance {}",
                credited, dto.getAmount(), currentTier.earnMultiplier(), account.getUserId(), dto.getSource(), newBalance);

        EarnPointsResultVo result = new EarnPointsResultVo();
        result.setCreditedAmount(credited);
        result.setNewBalance(newBalance);
        result.setEntryId(entry.getId());
        result.setMessage("Credited " + credited + " points");
        if (tierChange.changed() && tierChange.upgrade()) {
            result.setTierChanged(true);
            result.setTierInfo(TierInfoVo.from(tierChange.to()));
        }
        return result;
    }
}
