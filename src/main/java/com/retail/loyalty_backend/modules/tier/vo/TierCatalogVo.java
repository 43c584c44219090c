package com.retail.loyalty_backend.modules.tier.vo;

import lombok.Data;

import java.util.List;

/**
 * 全部等级 + 当前用户所处等级
 */
@Data
public class TierCatalogVo {
    private List<TierInfoVo> levels;
    private String currentTier;
    private Long currentPoints;
}
