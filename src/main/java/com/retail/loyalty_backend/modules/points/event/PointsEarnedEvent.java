package com.retail.loyalty_backend.modules.points.event;

import com.retail.loyalty_backend.modules.ledger.enums.PointsSource;

/**
 * 积分入账信号，任务/成就模块据此推进进度。
 */
public record PointsEarnedEvent(String tenantId,
                                Long userId,
                                long amount,
                                PointsSource source,
                                String referenceId,
                                long newBalance) {
}
