package com.retail.loyalty_backend.modules.points.service;

import com.retail.loyalty_backend.common.exception.BizException;
import com.retail.loyalty_backend.modules.account.entity.LoyaltyAccount;
import com.retail.loyalty_backend.modules.account.mapper.LoyaltyAccountMapper;
import com.retail.loyalty_backend.modules.ledger.enums.PointsSource;
import com.retail.loyalty_backend.modules.points.config.BonusProperties;
import com.retail.loyalty_backend.modules.points.config.PointsRulesProperties;
import com.retail.loyalty_backend.modules.points.dto.EarnPointsDto;
import com.retail.loyalty_backend.modules.points.entity.LoyaltyOrder;
import com.retail.loyalty_backend.modules.points.mapper.LoyaltyOrderMapper;
import com.retail.loyalty_backend.modules.points.vo.EarnPointsResultVo;
import com.retail.loyalty_backend.modules.points.vo.OrderPointsResultVo;
import com.retail.loyalty_backend.modules.streak.service.StreakService;
import com.retail.loyalty_backend.modules.streak.vo.StreakResultVo;
import com.retail.loyalty_backend.modules.tier.domain.Tier;
import com.retail.loyalty_backend.modules.tier.service.TierService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * 订单积分：订单完成后由订单模块调用。
 * <p>
 * 一次调用在同一事务内完成：订单统计、连续天数、订单积分、里程碑奖励、首单奖励。
 */
@Service
@Slf4j
public class OrderPointsService {

    static final String REFERENCE_TYPE_ORDER = "order";

    private final PointsLedgerWriter ledgerWriter;
    private final PointsEarningService earningService;
    private final StreakService streakService;
    private final TierService tierService;
    private final LoyaltyAccountMapper accountMapper;
    private final LoyaltyOrderMapper orderMapper;
    private final PointsRulesProperties rules;
    private final BonusProperties bonuses;
    private final Clock clock;

    public OrderPointsService(PointsLedgerWriter ledgerWriter,
                              PointsEarningService earningService,
                              StreakService streakService,
                              TierService tierService,
                              LoyaltyAccountMapper accountMapper,
                              LoyaltyOrderMapper orderMapper,
                              PointsRulesProperties rules,
                              BonusProperties bonuses,
                              Clock clock) {
        this.ledgerWriter = ledgerWriter;
        this.earningService = earningService;
        this.streakService = streakService;
        this.tierService = tierService;
        this.accountMapper = accountMapper;
        this.orderMapper = orderMapper;
        this.rules = rules;
        this.bonuses = bonuses;
        this.clock = clock;
    }

    @Transactional
    public OrderPointsResultVo earnForOrder(Long userId, String orderId, BigDecimal orderAmount) {
        if (!StringUtils.hasText(orderId)) {
            throw new BizException("orderId is required");
        }
        if (orderAmount == null || orderAmount.signum() < 0) {
            throw new BizException("Order amount must not be negative");
        }
        LoyaltyAccount account = ledgerWriter.lockAccount(userId);
        long rawPoints = calculateRawPoints(orderAmount);
        LocalDateTime now = LocalDateTime.now(clock);

        LoyaltyOrder order = new LoyaltyOrder();
        order.setTenantId(account.getTenantId());
        order.setUserId(userId);
        order.setOrderId(orderId);
        order.setOrderAmount(orderAmount);
        order.setRawPoints(rawPoints);
        order.setCreatedAt(now);
        if (orderMapper.insertIgnore(order) == 0) {
            throw BizException.conflict("Order " + orderId + " was already processed");
        }

        int totalOrders = (account.getTotalOrders() == null ? 0 : account.getTotalOrders()) + 1;
        BigDecimal totalAmount = (account.getTotalOrderAmount() == null ? BigDecimal.ZERO : account.getTotalOrderAmount())
                .add(orderAmount);
        accountMapper.updateOrderStats(userId, totalOrders, totalAmount, now);

        StreakResultVo streak = streakService.applyActivity(account, LocalDate.now(clock));

        OrderPointsResultVo result = new OrderPointsResultVo();
        result.setCurrentStreak(streak.getCurrentStreak());
        result.setFirstOrderBonus(0L);
        long balance = account.getPointsBalance() == null ? 0L : account.getPointsBalance();

        EarnPointsResultVo orderPoints;
        if (rawPoints > 0) {
            orderPoints = earningService.earn(EarnPointsDto.builder()
                    .userId(userId)
                    .amount(rawPoints)
                    .source(PointsSource.ORDER)
                    .referenceId(orderId)
                    .referenceType(REFERENCE_TYPE_ORDER)
                    .description("Points for order #" + abbreviate(orderId))
                    .metadata(Map.of("orderAmount", orderAmount))
                    .build());
            balance = orderPoints.getNewBalance();
            result.setTierChanged(orderPoints.isTierChanged());
        } else {
            orderPoints = new EarnPointsResultVo();
            orderPoints.setCreditedAmount(0L);
            orderPoints.setNewBalance(balance);
            orderPoints.setMessage("Order amount is below the minimum for earning points");
        }
        result.setOrderPoints(orderPoints);

        if (streak.getMilestoneBonus() != null && streak.getMilestoneBonus().getBonus() > 0) {
            result.setStreakBonus(streak.getMilestoneBonus());
            EarnPointsResultVo bonus = earningService.earn(EarnPointsDto.builder()
                    .userId(userId)
                    .amount(streak.getMilestoneBonus().getBonus())
                    .source(PointsSource.STREAK_BONUS)
                    .referenceId(orderId)
                    .referenceType(REFERENCE_TYPE_ORDER)
                    .description(streak.getMilestoneBonus().getMessage())
                    .build());
            balance = bonus.getNewBalance();
            result.setTierChanged(result.isTierChanged() || bonus.isTierChanged());
        }

        if (totalOrders == 1 && bonuses.getFirstOrder() > 0) {
            EarnPointsResultVo bonus = earningService.earn(EarnPointsDto.builder()
                    .userId(userId)
                    .amount(bonuses.getFirstOrder())
                    .source(PointsSource.FIRST_ORDER)
                    .referenceId(orderId)
                    .referenceType(REFERENCE_TYPE_ORDER)
                    .build());
            balance = bonus.getNewBalance();
            result.setFirstOrderBonus(bonus.getCreditedAmount());
            result.setTierChanged(result.isTierChanged() || bonus.isTierChanged());
        }

        result.setNewBalance(balance);
        log.info("Order {} of user {} processed: amount {}, raw points {}, streak {}, balance {}",
                orderId, userId, orderAmount, rawPoints, streak.getCurrentStreak(), balance);
        return result;
    }

    /**
     * 原始订单积分：低于最低金额为 0；floor(金额 / 每积分金额)；不超过单笔上限。
     */
    public long calculateRawPoints(BigDecimal orderAmount) {
        if (orderAmount == null || orderAmount.compareTo(rules.getMinOrderAmount()) < 0) {
            return 0L;
        }
        long raw = orderAmount.divide(rules.getPointsPerCurrencyUnit(), 0, RoundingMode.FLOOR).longValue();
        return Math.min(raw, rules.getMaxPointsPerOrder());
    }

    /**
     * 按用户当前等级的返现比例报价。
     */
    public BigDecimal quoteCashback(Long userId, BigDecimal orderAmount) {
        LoyaltyAccount account = accountMapper.selectByUserId(userId)
                .orElseThrow(() -> BizException.notFound("Loyalty account not found for user " + userId));
        Tier tier = tierService.resolve(account.getPointsBalance() == null ? 0L : account.getPointsBalance());
        return tierService.cashbackFor(tier, orderAmount);
    }

    private static String abbreviate(String orderId) {
        return orderId.length() <= 8 ? orderId : orderId.substring(0, 8);
    }
}
