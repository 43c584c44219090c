package com.retail.loyalty_backend.modules.points.dto;

import com.retail.loyalty_backend.modules.ledger.enums.PointsSource;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 积分入账请求（内部调用：订单、邀请、任务等模块）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EarnPointsDto {

    @NotNull
    private Long userId;

    /** 原始积分，入账时按当前等级倍率换算 */
    @NotNull
    private Long amount;

    @NotNull
    private PointsSource source;

    private String referenceId;
    private String referenceType;
    /** 为空时按来源生成默认描述 */
    private String description;
    private Map<String, Object> metadata;
}
