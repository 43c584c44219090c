package com.retail.loyalty_backend.modules.points.vo;

import com.retail.loyalty_backend.modules.streak.vo.StreakBonusVo;
import lombok.Data;

/**
 * 订单积分结果：订单积分 + 连续天数奖励 + 首单奖励
 */
@Data
public class OrderPointsResultVo {
    private EarnPointsResultVo orderPoints;
    /** 未达到里程碑时为 null */
    private StreakBonusVo streakBonus;
    /** 首单奖励实际入账积分，未发放时为 0 */
    private Long firstOrderBonus;
    private Integer currentStreak;
    private Long newBalance;
    private boolean tierChanged;
}
