package com.retail.loyalty_backend.modules.ledger.dto;

import com.retail.loyalty_backend.modules.ledger.enums.PointsSource;
import com.retail.loyalty_backend.modules.ledger.enums.PointsTransactionType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;

import java.time.LocalDate;

/**
 * 积分流水查询条件；日期为业务时区下的自然日（含首尾）。
 */
@Data
public class PointsHistoryQuery {
    private PointsTransactionType type;
    private PointsSource source;
    private LocalDate dateFrom;
    private LocalDate dateTo;

    @Min(1)
    private int page = 1;

    @Min(1)
    @Max(100)
    private int size = 20;
}
