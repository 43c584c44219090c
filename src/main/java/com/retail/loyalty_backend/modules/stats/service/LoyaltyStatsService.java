package com.retail.loyalty_backend.modules.stats.service;

import com.retail.loyalty_backend.common.exception.BizException;
import com.retail.loyalty_backend.modules.stats.dto.ExpiringUserRow;
import com.retail.loyalty_backend.modules.stats.dto.PointsTotalsRow;
import com.retail.loyalty_backend.modules.stats.dto.TierCountRow;
import com.retail.loyalty_backend.modules.stats.mapper.LoyaltyStatsMapper;
import com.retail.loyalty_backend.modules.stats.vo.ExpiringPointsReportVo;
import com.retail.loyalty_backend.modules.stats.vo.ExpiringUserVo;
import com.retail.loyalty_backend.modules.stats.vo.LoyaltyStatsVo;
import com.retail.loyalty_backend.modules.stats.vo.SourceTotalVo;
import com.retail.loyalty_backend.modules.stats.vo.TierDistributionItemVo;
import com.retail.loyalty_backend.modules.tier.domain.Tier;
import com.retail.loyalty_backend.modules.tier.service.TierService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 运营统计：全部由流水和账户投影推导，只读。
 */
@Service
@Slf4j
public class LoyaltyStatsService {

    static final int DEFAULT_WINDOW_DAYS = 30;
    static final int TOP_SOURCES = 5;
    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100L);

    private final LoyaltyStatsMapper statsMapper;
    private final TierService tierService;
    private final Clock clock;

    public LoyaltyStatsService(LoyaltyStatsMapper statsMapper, TierService tierService, Clock clock) {
        this.statsMapper = statsMapper;
        this.tierService = tierService;
        this.clock = clock;
    }

    /**
     * @param from 含，默认 to 之前 30 天
     * @param to   含，默认今天
     */
    public LoyaltyStatsVo getStats(String tenantId, LocalDate from, LocalDate to) {
        LocalDate end = to != null ? to : LocalDate.now(clock);
        LocalDate start = from != null ? from : end.minusDays(DEFAULT_WINDOW_DAYS);
        if (start.isAfter(end)) {
            throw new BizException("from must not be after to");
        }
        LocalDateTime windowStart = start.atStartOfDay();
        LocalDateTime windowEnd = end.plusDays(1).atStartOfDay();

        long totalMembers = statsMapper.countMembers(tenantId);
        LoyaltyStatsVo vo = new LoyaltyStatsVo();
        vo.setFrom(start);
        vo.setTo(end);
        vo.setTotalMembers(totalMembers);
        vo.setActiveMembers(statsMapper.countActiveMembers(tenantId, windowStart, windowEnd));
        vo.setNewMembers(statsMapper.countNewMembers(tenantId, windowStart, windowEnd));
        vo.setTierDistribution(tierDistribution(statsMapper.selectTierDistribution(tenantId), totalMembers));

        PointsTotalsRow totals = statsMapper.selectPointsTotals(tenantId, windowStart, windowEnd);
        long earned = totals == null ? 0L : nvl(totals.getTotalEarned());
        long spent = totals == null ? 0L : nvl(totals.getTotalSpent());
        long expired = totals == null ? 0L : nvl(totals.getTotalExpired());
        vo.setTotalEarned(earned);
        vo.setTotalSpent(spent);
        vo.setTotalExpired(expired);
        vo.setRedemptionRate(percent(spent, earned));

        BigDecimal average = statsMapper.selectAverageBalance(tenantId);
        vo.setAverageBalance(average == null ? 0L : average.setScale(0, RoundingMode.HALF_UP).longValue());

        List<SourceTotalVo> topSources = statsMapper.selectTopEarnSources(tenantId, windowStart, windowEnd, TOP_SOURCES)
                .stream()
                .map(row -> new SourceTotalVo(row.getSource(), nvl(row.getTotal()), percent(nvl(row.getTotal()), earned)))
                .collect(Collectors.toList());
        vo.setTopEarnSources(topSources);
        return vo;
    }

    public ExpiringPointsReportVo getExpiringReport(String tenantId, int days) {
        if (days <= 0) {
            throw new BizException("days must be positive");
        }
        LocalDateTime horizon = LocalDateTime.now(clock).plusDays(days);
        List<ExpiringUserRow> rows = statsMapper.selectExpiringByUser(tenantId, horizon);

        List<ExpiringUserVo> users = new ArrayList<>(rows.size());
        long total = 0L;
        for (ExpiringUserRow row : rows) {
            ExpiringUserVo user = new ExpiringUserVo();
            user.setUserId(row.getUserId());
            user.setExpiringPoints(nvl(row.getExpiringPoints()));
            user.setEarliestExpiry(row.getEarliestExpiry());
            users.add(user);
            total += user.getExpiringPoints();
        }
        ExpiringPointsReportVo vo = new ExpiringPointsReportVo();
        vo.setDays(days);
        vo.setTotalUsers(users.size());
        vo.setTotalExpiringPoints(total);
        vo.setUsers(users);
        return vo;
    }

    /**
     * 按等级表顺序输出，没有会员的等级计 0。
     */
    private List<TierDistributionItemVo> tierDistribution(List<TierCountRow> rows, long totalMembers) {
        Map<String, Long> counts = rows.stream()
                .filter(row -> row.getTierCode() != null)
                .collect(Collectors.toMap(TierCountRow::getTierCode, row -> nvl(row.getMemberCount()), Long::sum));
        List<TierDistributionItemVo> items = new ArrayList<>();
        for (Tier tier : tierService.getTierTable().all()) {
            long count = counts.getOrDefault(tier.code(), 0L);
            items.add(new TierDistributionItemVo(tier.code(), count, percent(count, totalMembers)));
        }
        return items;
    }

    static BigDecimal percent(long part, long whole) {
        if (whole <= 0) {
            return BigDecimal.ZERO.setScale(2);
        }
        return BigDecimal.valueOf(part)
                .multiply(ONE_HUNDRED)
                .divide(BigDecimal.valueOf(whole), 2, RoundingMode.HALF_UP);
    }

    private static long nvl(Long value) {
        return value == null ? 0L : value;
    }
}
