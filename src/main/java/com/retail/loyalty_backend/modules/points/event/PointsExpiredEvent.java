package com.retail.loyalty_backend.modules.points.event;

public record PointsExpiredEvent(String tenantId,
                                 Long userId,
                                 Long lotId,
                                 long amount,
                                 long newBalance) {
}
