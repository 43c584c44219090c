package com.retail.loyalty_backend.modules.stats.vo;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TierDistributionItemVo {
    private String tierCode;
    private Long count;
    /** 占全部会员百分比，两位小数 */
    private BigDecimal percent;
}
