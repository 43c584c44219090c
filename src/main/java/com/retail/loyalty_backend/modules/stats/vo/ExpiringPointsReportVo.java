package com.retail.loyalty_backend.modules.stats.vo;

import lombok.Data;

import java.util.List;

@Data
public class ExpiringPointsReportVo {
    private Integer days;
    private Integer totalUsers;
    private Long totalExpiringPoints;
    private List<ExpiringUserVo> users;
}
