package com.retail.loyalty_backend.modules.stats.dto;

import com.retail.loyalty_backend.modules.ledger.enums.PointsSource;
import lombok.Data;

@Data
public class SourceTotalRow {
    private PointsSource source;
    private Long total;
}
