package com.retail.loyalty_backend.modules.tier.vo;

import com.retail.loyalty_backend.modules.tier.domain.Tier;
import lombok.Data;

import java.math.BigDecimal;

/**
 * 等级信息视图对象
 */
@Data
public class TierInfoVo {
    private String code;
    private String name;
    private Long minPoints;
    private BigDecimal cashbackPercent;
    private BigDecimal earnMultiplier;

    public static TierInfoVo from(Tier tier) {
        if (tier == null) {
            return null;
        }
        TierInfoVo vo = new TierInfoVo();
        vo.setCode(tier.code());
        vo.setName(tier.name());
        vo.setMinPoints(tier.minPoints());
        vo.setCashbackPercent(tier.cashbackPercent());
        vo.setEarnMultiplier(tier.earnMultiplier());
        return vo;
    }
}
