package com.retail.loyalty_backend.modules.points.vo;

import lombok.Data;

import java.math.BigDecimal;

@Data
public class SpendPointsResultVo {
    private Long debitedAmount;
    private Long newBalance;
    /** 抵扣的货币金额 = 积分 * pointsValue */
    private BigDecimal monetaryValue;
    private Long entryId;
}
