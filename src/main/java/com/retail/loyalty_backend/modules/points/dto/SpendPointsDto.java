package com.retail.loyalty_backend.modules.points.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 积分抵扣请求。"最多抵扣订单金额的 N%" 由调用方在调用前校验。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SpendPointsDto {

    @NotNull
    private Long userId;

    @NotNull
    private Long amount;

    private String referenceId;
    private String referenceType;
    private String description;
}
