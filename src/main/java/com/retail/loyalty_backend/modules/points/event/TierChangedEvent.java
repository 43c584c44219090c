package com.retail.loyalty_backend.modules.points.event;

/**
 * 等级变化信号；upgrade=false 表示因消费/过期/扣减而降级。
 */
public record TierChangedEvent(String tenantId,
                               Long userId,
                               String oldTier,
                               String newTier,
                               boolean upgrade,
                               long newBalance) {
}
