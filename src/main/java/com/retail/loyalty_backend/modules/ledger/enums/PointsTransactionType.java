package com.retail.loyalty_backend.modules.ledger.enums;

/**
 * 积分流水类型
 */
public enum PointsTransactionType {
    EARN,    // 获得
    SPEND,   // 消费抵扣
    ADJUST,  // 管理员调整
    EXPIRE   // 过期清零
}
