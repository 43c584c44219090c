package com.retail.loyalty_backend.modules.stats.vo;

import com.retail.loyalty_backend.modules.ledger.enums.PointsSource;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SourceTotalVo {
    private PointsSource source;
    private Long total;
    /** 占区间内获得总量的百分比 */
    private BigDecimal percent;
}
