package com.retail.loyalty_backend.modules.tier.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "app.loyalty.tier")
@Data
public class TierProperties {

    /**
     * 会员等级表，按 minPoints 升序；必须包含 minPoints=0 的默认等级。
     */
    private List<Level> levels = new ArrayList<>();

    @Data
    public static class Level {
        private String code;
        private String name;
        /** 达到该等级所需的最低积分余额 */
        private long minPoints;
        /** 返现比例（百分比，如 2 表示 2%） */
        private BigDecimal cashbackPercent = BigDecimal.ZERO;
        /** 积分倍率，至少为 1 */
        private BigDecimal earnMultiplier = BigDecimal.ONE;
    }
}
