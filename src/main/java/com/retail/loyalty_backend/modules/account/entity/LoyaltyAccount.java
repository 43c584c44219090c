package com.retail.loyalty_backend.modules.account.entity;

import lombok.Data;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 用户积分账户（流水的物化投影）。对应 loyalty_account 表，每个用户一行。
 * <p>
 * pointsBalance 恒等于该用户全部流水 amount 之和；tierCode 恒为门槛 <= pointsBalance 的最高等级。
 */
@Data
public class LoyaltyAccount implements Serializable {
    private static final long serialVersionUID = 1L;

    private Long id;
    private String tenantId;
    private Long userId;
    private Long pointsBalance;
    private String tierCode;
    private Integer currentStreak;
    private Integer longestStreak;
    /** 最近一次有效活动的自然日（业务时区） */
    private LocalDate lastActivityDate;
    private Boolean welcomeBonusGranted;
    /** 订单累计 */
    private Integer totalOrders;
    private BigDecimal totalOrderAmount;
    private LocalDateTime lastOrderAt;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
