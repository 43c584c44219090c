package com.retail.loyalty_backend.modules.streak.vo;

import lombok.Data;

@Data
public class StreakResultVo {
    private Integer currentStreak;
    private Integer longestStreak;
    /** 本次活动命中里程碑时非空 */
    private StreakBonusVo milestoneBonus;
}
