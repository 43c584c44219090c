package com.retail.loyalty_backend.modules.account.vo;

import com.retail.loyalty_backend.modules.tier.vo.TierInfoVo;
import lombok.Data;

/**
 * 积分账户快照（只读）
 */
@Data
public class LoyaltyBalanceVo {
    private Long userId;
    private Long pointsBalance;
    private TierInfoVo currentTier;
    /** 已是最高等级时为 null */
    private TierInfoVo nextTier;
    private Long pointsToNextTier;
    private Integer progressPercent;

    private Long totalEarned;
    private Long totalSpent;
    private Long totalExpired;
    /** expiryWarningDays 天内将过期的积分 */
    private Long expiringSoon;
    private Integer expiryWarningDays;

    private Integer currentStreak;
    private Integer longestStreak;
    private Boolean welcomeBonusGranted;
}
