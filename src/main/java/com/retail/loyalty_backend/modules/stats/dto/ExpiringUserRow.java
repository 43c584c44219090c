package com.retail.loyalty_backend.modules.stats.dto;

import lombok.Data;

import java.time.LocalDateTime;

@Data
public class ExpiringUserRow {
    private Long userId;
    private Long expiringPoints;
    private LocalDateTime earliestExpiry;
}
