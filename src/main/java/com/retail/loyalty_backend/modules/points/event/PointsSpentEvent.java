package com.retail.loyalty_backend.modules.points.event;

public record PointsSpentEvent(String tenantId,
                               Long userId,
                               long amount,
                               String referenceId,
                               long newBalance) {
}
