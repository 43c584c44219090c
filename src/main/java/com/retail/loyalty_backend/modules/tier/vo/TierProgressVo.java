package com.retail.loyalty_backend.modules.tier.vo;

import lombok.Data;

@Data
public class TierProgressVo {
    private TierInfoVo currentTier;
    /** 已是最高等级时为 null */
    private TierInfoVo nextTier;
    private Long pointsToNextTier;
    /** 0-100 */
    private Integer progressPercent;
}
