package com.retail.loyalty_backend.modules.points.vo;

import lombok.Data;

@Data
public class AdjustPointsResultVo {
    private Long entryId;
    private Long delta;
    private Long newBalance;
    private String tierCode;
    private boolean tierChanged;
}
