package com.retail.loyalty_backend.modules.stats.mapper;

import com.retail.loyalty_backend.modules.stats.dto.ExpiringUserRow;
import com.retail.loyalty_backend.modules.stats.dto.PointsTotalsRow;
import com.retail.loyalty_backend.modules.stats.dto.SourceTotalRow;
import com.retail.loyalty_backend.modules.stats.dto.TierCountRow;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 统计报表查询（只读）。tenantId 为 null 时统计全部租户；时间区间左闭右开。
 */
@Mapper
public interface LoyaltyStatsMapper {

    long countMembers(@Param("tenantId") String tenantId);

    long countNewMembers(@Param("tenantId") String tenantId,
                         @Param("from") LocalDateTime from,
                         @Param("to") LocalDateTime to);

    /**
     * 区间内有任意流水的用户数
     */
    long countActiveMembers(@Param("tenantId") String tenantId,
                            @Param("from") LocalDateTime from,
                            @Param("to") LocalDateTime to);

    List<TierCountRow> selectTierDistribution(@Param("tenantId") String tenantId);

    PointsTotalsRow selectPointsTotals(@Param("tenantId") String tenantId,
                                       @Param("from") LocalDateTime from,
                                       @Param("to") LocalDateTime to);

    BigDecimal selectAverageBalance(@Param("tenantId") String tenantId);

    List<SourceTotalRow> selectTopEarnSources(@Param("tenantId") String tenantId,
                                              @Param("from") LocalDateTime from,
                                              @Param("to") LocalDateTime to,
                                              @Param("limit") int limit);

    /**
     * 在 expiresBefore 之前到期、尚未过期且仍有余量的积分，按用户汇总，余量多的在前。
     */
    List<ExpiringUserRow> selectExpiringByUser(@Param("tenantId") String tenantId,
                                               @Param("expiresBefore") LocalDateTime expiresBefore);
}
