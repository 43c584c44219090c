package com.retail.loyalty_backend.modules.points.vo;

import com.retail.loyalty_backend.modules.tier.vo.TierInfoVo;
import lombok.Data;

/**
 * 入账结果
 */
@Data
public class EarnPointsResultVo {
    /** 实际入账积分（已乘倍率） */
    private Long creditedAmount;
    private Long newBalance;
    /** 本次入账是否导致升级 */
    private boolean tierChanged;
    /** 升级后的等级，未升级时为 null */
    private TierInfoVo tierInfo;
    /** 未入账（如订单金额不足）时为 null */
    private Long entryId;
    private String message;
}
