package com.retail.loyalty_backend.support;

import com.retail.loyalty_backend.modules.account.entity.LoyaltyAccount;
import com.retail.loyalty_backend.modules.ledger.entity.PointsTransaction;
import com.retail.loyalty_backend.modules.ledger.enums.PointsSource;
import com.retail.loyalty_backend.modules.ledger.enums.PointsTransactionType;
import com.retail.loyalty_backend.modules.tier.domain.Tier;
import com.retail.loyalty_backend.modules.tier.domain.TierTable;
import com.retail.loyalty_backend.modules.tier.service.TierService;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;

/**
 * 单元测试公共数据：默认等级表、固定时钟、账户与积分批次。
 */
public final class LoyaltyTestFixtures {

    public static final ZoneId ZONE = ZoneId.of("Asia/Tashkent");
    /** 2026-03-10 12:00 Asia/Tashkent */
    public static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2026-03-10T07:00:00Z"), ZONE);
    public static final LocalDateTime NOW = LocalDateTime.now(FIXED_CLOCK);

    private LoyaltyTestFixtures() {
    }

    public static TierTable defaultTierTable() {
        return new TierTable(List.of(
                new Tier("BRONZE", "Bronze", 0L, new BigDecimal("1"), new BigDecimal("1.0")),
                new Tier("SILVER", "Silver", 1000L, new BigDecimal("2"), new BigDecimal("1.2")),
                new Tier("GOLD", "Gold", 5000L, new BigDecimal("3"), new BigDecimal("1.5")),
                new Tier("PLATINUM", "Platinum", 20000L, new BigDecimal("5"), new BigDecimal("2.0"))
        ));
    }

    public static TierService defaultTierService() {
        return new TierService(defaultTierTable());
    }

    public static LoyaltyAccount account(Long userId, long balance) {
        LoyaltyAccount account = new LoyaltyAccount();
        account.setId(userId);
        account.setTenantId("tenant-1");
        account.setUserId(userId);
        account.setPointsBalance(balance);
        account.setTierCode(defaultTierTable().resolve(balance).code());
        account.setCurrentStreak(0);
        account.setLongestStreak(0);
        account.setWelcomeBonusGranted(false);
        account.setTotalOrders(0);
        account.setTotalOrderAmount(BigDecimal.ZERO);
        return account;
    }

    public static PointsTransaction lot(Long id, Long userId, long amount, long remaining,
                                        LocalDateTime createdAt, LocalDateTime expiresAt) {
        PointsTransaction lot = new PointsTransaction();
        lot.setId(id);
        lot.setTenantId("tenant-1");
        lot.setUserId(userId);
        lot.setType(PointsTransactionType.EARN);
        lot.setSource(PointsSource.ORDER);
        lot.setAmount(amount);
        lot.setBalanceAfter(amount);
        lot.setRemainingAmount(remaining);
        lot.setIsExpired(false);
        lot.setCreatedAt(createdAt);
        lot.setExpiresAt(expiresAt);
        return lot;
    }
}
