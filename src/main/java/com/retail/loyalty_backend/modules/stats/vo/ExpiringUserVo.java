package com.retail.loyalty_backend.modules.stats.vo;

import lombok.Data;

import java.time.LocalDateTime;

@Data
public class ExpiringUserVo {
    private Long userId;
    private Long expiringPoints;
    private LocalDateTime earliestExpiry;
}
