package com.retail.loyalty_backend.modules.streak.vo;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 连续天数里程碑奖励
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StreakBonusVo {
    private Integer days;
    /** 原始积分，由调用方通过入账发放 */
    private Long bonus;
    private String message;
}
