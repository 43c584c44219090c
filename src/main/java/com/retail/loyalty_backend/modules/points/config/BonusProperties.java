package com.retail.loyalty_backend.modules.points.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 一次性奖励积分（原始积分，入账时同样按等级倍率换算）。
 */
@Component
@ConfigurationProperties(prefix = "app.loyalty.bonuses")
@Data
public class BonusProperties {
    private long welcome = 100L;
    private long firstOrder = 50L;
    /** 邀请人 */
    private long referrer = 200L;
    /** 被邀请人 */
    private long referee = 100L;
    private long birthday = 500L;
}
