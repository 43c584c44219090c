package com.retail.loyalty_backend.modules.account.mapper;

import com.retail.loyalty_backend.modules.account.entity.LoyaltyAccount;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * MyBatis mapper：loyalty_account 表。
 */
@Mapper
public interface LoyaltyAccountMapper {

    Optional<LoyaltyAccount> selectByUserId(@Param("userId") Long userId);

    /**
     * SELECT ... FOR UPDATE 锁定账户行。
     * 同一用户的所有余额变动（获得/消费/调整/过期）都必须在事务内先调用此方法，以串行化读-改-写。
     */
    Optional<LoyaltyAccount> lockByUserIdForUpdate(@Param("userId") Long userId);

    /**
     * 幂等开户：user_id 唯一键冲突时忽略（返回 0）。
     */
    int insertIgnore(LoyaltyAccount account);

    int updateBalanceAndTier(@Param("userId") Long userId,
                             @Param("pointsBalance") long pointsBalance,
                             @Param("tierCode") String tierCode);

    int updateStreak(@Param("userId") Long userId,
                     @Param("currentStreak") int currentStreak,
                     @Param("longestStreak") int longestStreak,
                     @Param("lastActivityDate") LocalDate lastActivityDate);

    int updateOrderStats(@Param("userId") Long userId,
                         @Param("totalOrders") int totalOrders,
                         @Param("totalOrderAmount") BigDecimal totalOrderAmount,
                         @Param("lastOrderAt") LocalDateTime lastOrderAt);

    /**
     * 仅当尚未发放时置位，返回 1 表示本次抢到发放资格。
     */
    int markWelcomeBonusGranted(@Param("userId") Long userId);

    /**
     * 将最近活动早于 activeSince 的用户 current_streak 清零，返回影响行数。
     */
    int resetStreaksInactiveSince(@Param("activeSince") LocalDate activeSince);
}
