package com.retail.loyalty_backend.modules.points.vo;

import lombok.Data;

@Data
public class ReferralBonusResultVo {
    private EarnPointsResultVo referrer;
    private EarnPointsResultVo referee;
}
