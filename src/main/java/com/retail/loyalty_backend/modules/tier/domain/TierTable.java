package com.retail.loyalty_backend.modules.tier.domain;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 有序的等级表，纯查找，无状态。
 * <p>
 * 构造时校验：非空、最低等级门槛为 0、门槛严格递增、code 唯一、倍率 >= 1。
 */
public final class TierTable {

    private final List<Tier> tiers;

    public TierTable(List<Tier> definitions) {
        if (definitions == null || definitions.isEmpty()) {
            throw new IllegalArgumentException("Tier table must not be empty");
        }
        List<Tier> sorted = new ArrayList<>(definitions);
        sorted.sort(Comparator.comparingLong(Tier::minPoints));
        if (sorted.get(0).minPoints() != 0) {
            throw new IllegalArgumentException("Tier table must contain a zero-threshold default tier");
        }
        Set<String> codes = new HashSet<>();
        long previous = -1;
        for (Tier tier : sorted) {
            if (tier.code() == null || tier.code().isBlank() || !codes.add(tier.code())) {
                throw new IllegalArgumentException("Tier codes must be present and unique: " + tier.code());
            }
            if (tier.minPoints() <= previous) {
                throw new IllegalArgumentException("Tier thresholds must be strictly ascending at " + tier.code());
            }
            if (tier.earnMultiplier() == null || tier.earnMultiplier().compareTo(BigDecimal.ONE) < 0) {
                throw new IllegalArgumentException("Earn multiplier of " + tier.code() + " must be >= 1");
            }
            previous = tier.minPoints();
        }
        this.tiers = List.copyOf(sorted);
    }

    public List<Tier> all() {
        return tiers;
    }

    public Tier defaultTier() {
        return tiers.get(0);
    }

    /**
     * 门槛 <= balance 的最高等级；负数余额按 0 处理。
     */
    public Tier resolve(long balance) {
        Tier result = tiers.get(0);
        for (Tier tier : tiers) {
            if (tier.minPoints() <= balance) {
                result = tier;
            } else {
                break;
            }
        }
        return result;
    }

    public Optional<Tier> findByCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        for (Tier tier : tiers) {
            if (tier.code().equalsIgnoreCase(code)) {
                return Optional.of(tier);
            }
        }
        return Optional.empty();
    }

    public Optional<Tier> next(Tier current) {
        int index = tiers.indexOf(current);
        if (index < 0 || index == tiers.size() - 1) {
            return Optional.empty();
        }
        return Optional.of(tiers.get(index + 1));
    }

    /**
     * 距离下一等级还差的积分；已是最高等级时为 0。
     */
    public long pointsToNext(long balance) {
        return next(resolve(balance))
                .map(next -> Math.max(0L, next.minPoints() - balance))
                .orElse(0L);
    }

    /**
     * 当前等级区间内的进度：等级门槛处为 0，下一等级门槛处为 100，最高等级恒为 100。
     */
    public int progressPercent(long balance) {
        Tier current = resolve(balance);
        Optional<Tier> next = next(current);
        if (next.isEmpty()) {
            return 100;
        }
        long range = next.get().minPoints() - current.minPoints();
        long progress = Math.max(0L, balance - current.minPoints());
        return (int) Math.min(100L, progress * 100L / range);
    }

    public int rank(Tier tier) {
        return tiers.indexOf(tier);
    }
}
