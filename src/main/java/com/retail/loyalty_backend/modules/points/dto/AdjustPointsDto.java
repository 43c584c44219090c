package com.retail.loyalty_backend.modules.points.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 管理员积分调整：delta 正数为补发，负数为扣减；不适用等级倍率。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdjustPointsDto {

    @NotNull
    private Long userId;

    @NotNull
    private Long delta;

    @NotBlank
    private String reason;

    @NotBlank
    private String actorId;
}
