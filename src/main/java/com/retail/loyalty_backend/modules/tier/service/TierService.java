package com.retail.loyalty_backend.modules.tier.service;

import com.retail.loyalty_backend.modules.tier.config.TierProperties;
import com.retail.loyalty_backend.modules.tier.domain.Tier;
import com.retail.loyalty_backend.modules.tier.domain.TierTable;
import com.retail.loyalty_backend.modules.tier.vo.TierCatalogVo;
import com.retail.loyalty_backend.modules.tier.vo.TierInfoVo;
import com.retail.loyalty_backend.modules.tier.vo.TierProgressVo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 等级解析：等级是余额的纯函数。
 */
@Service
@Slf4j
public class TierService {

    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100L);

    private final TierTable tierTable;

    @Autowired
    public TierService(TierProperties tierProperties) {
        this(new TierTable(tierProperties.getLevels().stream()
                .map(level -> new Tier(level.getCode(), level.getName(), level.getMinPoints(),
                        level.getCashbackPercent(), level.getEarnMultiplier()))
                .collect(Collectors.toList())));
    }

    public TierService(TierTable tierTable) {
        this.tierTable = tierTable;
        log.info("Loaded {} loyalty tiers: {}", tierTable.all().size(),
                tierTable.all().stream().map(Tier::code).collect(Collectors.joining(",")));
    }

    public TierTable getTierTable() {
        return tierTable;
    }

    public Tier resolve(long balance) {
        return tierTable.resolve(balance);
    }

    /**
     * 按存储的等级 code 查找；code 未知（配置调整后的历史数据）时回落到默认等级。
     */
    public Tier byCode(String code) {
        return tierTable.findByCode(code).orElse(tierTable.defaultTier());
    }

    public boolean isUpgrade(Tier from, Tier to) {
        return tierTable.rank(to) > tierTable.rank(from);
    }

    public TierProgressVo progress(long balance) {
        Tier current = tierTable.resolve(balance);
        TierProgressVo vo = new TierProgressVo();
        vo.setCurrentTier(TierInfoVo.from(current));
        vo.setNextTier(TierInfoVo.from(tierTable.next(current).orElse(null)));
        vo.setPointsToNextTier(tierTable.pointsToNext(balance));
        vo.setProgressPercent(tierTable.progressPercent(balance));
        return vo;
    }

    public TierCatalogVo catalog(String currentTierCode, long currentPoints) {
        List<TierInfoVo> levels = tierTable.all().stream().map(TierInfoVo::from).collect(Collectors.toList());
        TierCatalogVo vo = new TierCatalogVo();
        vo.setLevels(levels);
        vo.setCurrentTier(currentTierCode != null ? currentTierCode : tierTable.defaultTier().code());
        vo.setCurrentPoints(currentPoints);
        return vo;
    }

    /**
     * 按等级返现比例计算返现金额，向下取整到整数货币单位。
     */
    public BigDecimal cashbackFor(Tier tier, BigDecimal orderAmount) {
        if (orderAmount == null || orderAmount.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return orderAmount.multiply(tier.cashbackPercent())
                .divide(ONE_HUNDRED, 0, RoundingMode.FLOOR);
    }
}
