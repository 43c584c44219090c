package com.retail.loyalty_backend.modules.points.service;

import com.retail.loyalty_backend.modules.ledger.enums.PointsSource;

/**
 * 流水默认描述
 */
final class PointsDescriptions {

    private PointsDescriptions() {
    }

    static String forSource(PointsSource source, long amount) {
        return switch (source) {
            case ORDER -> "Points for purchase (+" + amount + ")";
            case WELCOME_BONUS -> "Welcome bonus";
            case FIRST_ORDER -> "First order bonus";
            case REFERRAL -> "Bonus for inviting a friend";
            case REFERRAL_BONUS -> "Referral welcome bonus";
            case ACHIEVEMENT -> "Achievement reward";
            case DAILY_QUEST -> "Daily quest reward";
            case WEEKLY_QUEST -> "Weekly quest reward";
            case MONTHLY_QUEST -> "Monthly quest reward";
            case STREAK_BONUS -> "Streak bonus";
            case PROMO -> "Promotion";
            case BIRTHDAY -> "Happy birthday!";
            case ADMIN -> "Adjustment";
            case PURCHASE -> "Points redeemed (-" + amount + ")";
            case REFUND -> "Points refunded";
            case EXPIRY -> "Points expired (-" + amount + ")";
        };
    }
}
