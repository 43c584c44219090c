package com.retail.loyalty_backend.modules.stats.dto;

import lombok.Data;

@Data
public class TierCountRow {
    private String tierCode;
    private Long memberCount;
}
