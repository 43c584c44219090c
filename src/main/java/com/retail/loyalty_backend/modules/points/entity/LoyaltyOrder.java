package com.retail.loyalty_backend.modules.points.entity;

import lombok.Data;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 已入账的订单。对应 loyalty_order 表，(user_id, order_id) 唯一。
 * 低于最低金额、未产生积分的订单同样记录，订单统计只累加一次。
 */
@Data
public class LoyaltyOrder implements Serializable {
    private static final long serialVersionUID = 1L;

    private Long id;
    private String tenantId;
    private Long userId;
    private String orderId;
    private BigDecimal orderAmount;
    /** 倍率前的原始订单积分，可能为 0 */
    private Long rawPoints;
    private LocalDateTime createdAt;
}
