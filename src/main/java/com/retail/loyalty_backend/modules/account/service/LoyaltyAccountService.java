package com.retail.loyalty_backend.modules.account.service;

import com.retail.loyalty_backend.common.exception.BizException;
import com.retail.loyalty_backend.modules.account.entity.LoyaltyAccount;
import com.retail.loyalty_backend.modules.account.mapper.LoyaltyAccountMapper;
import com.retail.loyalty_backend.modules.account.vo.LoyaltyBalanceVo;
import com.retail.loyalty_backend.modules.ledger.enums.PointsTransactionType;
import com.retail.loyalty_backend.modules.ledger.mapper.PointsTransactionMapper;
import com.retail.loyalty_backend.modules.points.config.PointsRulesProperties;
import com.retail.loyalty_backend.modules.points.service.LoyaltyBonusService;
import com.retail.loyalty_backend.modules.tier.service.TierService;
import com.retail.loyalty_backend.modules.tier.vo.TierCatalogVo;
import com.retail.loyalty_backend.modules.tier.vo.TierProgressVo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;

@Service
@Slf4j
public class LoyaltyAccountService {

    private final LoyaltyAccountMapper accountMapper;
    private final PointsTransactionMapper transactionMapper;
    private final TierService tierService;
    private final LoyaltyBonusService bonusService;
    private final PointsRulesProperties rules;
    private final Clock clock;

    public LoyaltyAccountService(LoyaltyAccountMapper accountMapper,
                                 PointsTransactionMapper transactionMapper,
                                 TierService tierService,
                                 LoyaltyBonusService bonusService,
                                 PointsRulesProperties rules,
                                 Clock clock) {
        this.accountMapper = accountMapper;
        this.transactionMapper = transactionMapper;
        this.tierService = tierService;
        this.bonusService = bonusService;
        this.rules = rules;
        this.clock = clock;
    }

    /**
     * 开通积分账户（幂等）；grantWelcome=true 时同时发放欢迎奖励（只发一次）。
     */
    @Transactional
    public LoyaltyBalanceVo openAccount(Long userId, String tenantId, boolean grantWelcome) {
        if (userId == null) {
            throw new BizException("userId is required");
        }
        LoyaltyAccount account = new LoyaltyAccount();
        account.setUserId(userId);
        account.setTenantId(tenantId);
        account.setPointsBalance(0L);
        account.setTierCode(tierService.getTierTable().defaultTier().code());
        account.setCurrentStreak(0);
        account.setLongestStreak(0);
        account.setWelcomeBonusGranted(false);
        account.setTotalOrders(0);
        account.setTotalOrderAmount(BigDecimal.ZERO);
        LocalDateTime now = LocalDateTime.now(clock);
        account.setCreatedAt(now);
        account.setUpdatedAt(now);
        if (accountMapper.insertIgnore(account) == 1) {
            log.info("Opened loyalty account for user {} (tenant {})", userId, tenantId);
        }
        if (grantWelcome) {
            bonusService.grantWelcomeBonus(userId);
        }
        return getBalance(userId);
    }

    public LoyaltyBalanceVo getBalance(Long userId) {
        LoyaltyAccount account = requireAccount(userId);
        long balance = account.getPointsBalance() == null ? 0L : account.getPointsBalance();
        TierProgressVo progress = tierService.progress(balance);

        LoyaltyBalanceVo vo = new LoyaltyBalanceVo();
        vo.setUserId(userId);
        vo.setPointsBalance(balance);
        vo.setCurrentTier(progress.getCurrentTier());
        vo.setNextTier(progress.getNextTier());
        vo.setPointsToNextTier(progress.getPointsToNextTier());
        vo.setProgressPercent(progress.getProgressPercent());
        vo.setTotalEarned(nvl(transactionMapper.sumAbsAmountByType(userId, PointsTransactionType.EARN)));
        vo.setTotalSpent(nvl(transactionMapper.sumAbsAmountByType(userId, PointsTransactionType.SPEND)));
        vo.setTotalExpired(nvl(transactionMapper.sumAbsAmountByType(userId, PointsTransactionType.EXPIRE)));
        LocalDateTime warningHorizon = LocalDateTime.now(clock).plusDays(rules.getExpiryWarningDays());
        vo.setExpiringSoon(nvl(transactionMapper.sumOpenRemaining(userId, warningHorizon)));
        vo.setExpiryWarningDays(rules.getExpiryWarningDays());
        vo.setCurrentStreak(account.getCurrentStreak() == null ? 0 : account.getCurrentStreak());
        vo.setLongestStreak(account.getLongestStreak() == null ? 0 : account.getLongestStreak());
        vo.setWelcomeBonusGranted(Boolean.TRUE.equals(account.getWelcomeBonusGranted()));
        return vo;
    }

    /**
     * 等级目录；userId 为空时只返回等级列表。
     */
    public TierCatalogVo listTiers(Long userId) {
        if (userId == null) {
            return tierService.catalog(null, 0L);
        }
        LoyaltyAccount account = requireAccount(userId);
        long balance = account.getPointsBalance() == null ? 0L : account.getPointsBalance();
        return tierService.catalog(tierService.resolve(balance).code(), balance);
    }

    private LoyaltyAccount requireAccount(Long userId) {
        return accountMapper.selectByUserId(userId)
                .orElseThrow(() -> BizException.notFound("Loyalty account not found for user " + userId));
    }

    private static long nvl(Long value) {
        return value == null ? 0L : value;
    }
}
