package com.retail.loyalty_backend.modules.ledger.enums;

/**
 * 积分来源
 */
public enum PointsSource {
    // 获得
    ORDER,            // 订单
    WELCOME_BONUS,    // 开户奖励
    FIRST_ORDER,      // 首单奖励
    REFERRAL,         // 邀请人奖励
    REFERRAL_BONUS,   // 被邀请人奖励
    ACHIEVEMENT,      // 成就
    DAILY_QUEST,      // 每日任务
    WEEKLY_QUEST,     // 每周任务
    MONTHLY_QUEST,    // 每月任务
    STREAK_BONUS,     // 连续天数奖励
    PROMO,            // 活动
    BIRTHDAY,         // 生日

    // 调整
    ADMIN,            // 管理员调整

    // 扣减
    PURCHASE,         // 下单抵扣
    REFUND,           // 退款回收
    EXPIRY            // 过期
}
