package com.retail.loyalty_backend.modules.tier.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 会员等级（静态配置）。
 */
public record Tier(String code, String name, long minPoints, BigDecimal cashbackPercent, BigDecimal earnMultiplier) {

    /**
     * 按倍率换算实际入账积分，向下取整。
     */
    public long applyMultiplier(long rawAmount) {
        return BigDecimal.valueOf(rawAmount)
                .multiply(earnMultiplier)
                .setScale(0, RoundingMode.FLOOR)
                .longValueExact();
    }
}
