package com.retail.loyalty_backend.modules.tier.domain;

/**
 * 一次余额变动前后的等级。
 */
public record TierChange(Tier from, Tier to, boolean upgrade) {

    public boolean changed() {
        return !from.code().equals(to.code());
    }
}
