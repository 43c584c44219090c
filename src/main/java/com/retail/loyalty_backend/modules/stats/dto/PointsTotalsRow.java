package com.retail.loyalty_backend.modules.stats.dto;

import lombok.Data;

/**
 * 时间窗口内按类型汇总的积分（均为绝对值）
 */
@Data
public class PointsTotalsRow {
    private Long totalEarned;
    private Long totalSpent;
    private Long totalExpired;
}
