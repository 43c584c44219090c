package com.retail.loyalty_backend.modules.stats.vo;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * 积分计划统计（运营报表）
 */
@Data
public class LoyaltyStatsVo {
    private LocalDate from;
    private LocalDate to;

    private Long totalMembers;
    private Long activeMembers;
    private Long newMembers;
    private List<TierDistributionItemVo> tierDistribution;

    private Long totalEarned;
    private Long totalSpent;
    private Long totalExpired;
    private Long averageBalance;
    /** 已使用积分占获得积分的百分比，两位小数 */
    private BigDecimal redemptionRate;
    private List<SourceTotalVo> topEarnSources;
}
