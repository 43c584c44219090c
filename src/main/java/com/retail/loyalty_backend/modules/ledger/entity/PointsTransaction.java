package com.retail.loyalty_backend.modules.ledger.entity;

import com.retail.loyalty_backend.modules.ledger.enums.PointsSource;
import com.retail.loyalty_backend.modules.ledger.enums.PointsTransactionType;
import lombok.Data;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * 积分流水（只追加）。对应 points_transaction 表。
 * <p>
 * 写入后不可修改，唯一例外是"积分批次"（EARN）的 remainingAmount / isExpired：
 * remainingAmount 从 amount 单调递减至 0，永不为负。
 */
@Data
public class PointsTransaction implements Serializable {
    private static final long serialVersionUID = 1L;

    private Long id;
    private String tenantId;
    private Long userId;
    private PointsTransactionType type;
    /** 带符号：获得/正向调整为正，消费/过期/负向调整为负 */
    private Long amount;
    /** 写入时的余额快照，仅用于展示与审计 */
    private Long balanceAfter;
    private PointsSource source;
    private String referenceId;
    private String referenceType;
    private String description;
    /** 附加信息（JSON 文本），如订单金额 */
    private String metadata;
    /** 管理员调整的操作人 */
    private String actorId;
    /** 积分批次与正数调整有值；只有积分批次会被过期任务处理 */
    private LocalDateTime expiresAt;
    /** 仅积分批次有值：尚未被消费或过期的部分 */
    private Long remainingAmount;
    private Boolean isExpired;
    private LocalDateTime createdAt;

    /**
     * 是否为可被 FIFO 消费、可过期的积分批次。
     */
    public boolean isCreditLot() {
        return remainingAmount != null
                && amount != null && amount > 0
                && type == PointsTransactionType.EARN;
    }
}
