package com.retail.loyalty_backend.modules.points.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

@Component
@ConfigurationProperties(prefix = "app.loyalty.rules")
@Data
public class PointsRulesProperties {

    /** 每多少货币单位折合 1 个原始积分 */
    private BigDecimal pointsPerCurrencyUnit = new BigDecimal("100");
    /** 订单金额低于该值不积分 */
    private BigDecimal minOrderAmount = new BigDecimal("5000");
    /** 单笔订单原始积分上限（倍率之前） */
    private long maxPointsPerOrder = 1000L;

    /** 积分有效期（天） */
    private int expiryDays = 365;
    /** 余额快照中"即将过期"的统计窗口（天） */
    private int expiryWarningDays = 30;

    /** 单次最少抵扣积分 */
    private long minPointsToSpend = 100L;
    /** 积分最多抵扣订单金额的百分比（由下单方在调用前校验） */
    private int maxPointsPercent = 50;
    /** 1 积分折合的货币金额 */
    private BigDecimal pointsValue = BigDecimal.ONE;
}
