package com.retail.loyalty_backend.modules.ledger.mapper;

import com.retail.loyalty_backend.modules.ledger.dto.PointsHistoryQuery;
import com.retail.loyalty_backend.modules.ledger.entity.PointsTransaction;
import com.retail.loyalty_backend.modules.ledger.enums.PointsSource;
import com.retail.loyalty_backend.modules.ledger.enums.PointsTransactionType;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * MyBatis mapper：points_transaction 表（只追加的积分流水）。
 */
@Mapper
public interface PointsTransactionMapper {

    /**
     * 追加一条流水，自增 ID 回填到 entry.id。
     */
    int insert(PointsTransaction entry);

    Optional<PointsTransaction> selectById(@Param("id") Long id);

    /**
     * 行锁读取单条流水（过期任务在锁定账户后复核批次状态）。
     */
    Optional<PointsTransaction> lockByIdForUpdate(@Param("id") Long id);

    /**
     * FIFO 扫描：按 created_at, id 升序取未过期且 remaining_amount > 0 的积分批次，并加行锁。
     * 走 (user_id, created_at) 索引，limit 控制单批扫描量。
     */
    List<PointsTransaction> selectOpenLotsForUpdate(@Param("userId") Long userId,
                                                    @Param("limit") int limit);

    /**
     * 仅修改 remaining_amount；条件中要求新值不大于旧值且不小于 0。
     */
    int updateRemainingAmount(@Param("id") Long id,
                              @Param("remainingAmount") long remainingAmount);

    /**
     * 标记为已过期并清零余量；已过期的行不受影响（返回 0）。
     */
    int markExpired(@Param("id") Long id);

    /**
     * 过期任务候选：id > afterId 的已到期、未过期、仍有余量的积分批次 ID。
     */
    List<Long> selectExpiredLotIds(@Param("now") LocalDateTime now,
                                   @Param("afterId") long afterId,
                                   @Param("limit") int limit);

    long countHistory(@Param("userId") Long userId,
                      @Param("query") PointsHistoryQuery query,
                      @Param("createdFrom") LocalDateTime createdFrom,
                      @Param("createdTo") LocalDateTime createdTo);

    List<PointsTransaction> selectHistory(@Param("userId") Long userId,
                                          @Param("query") PointsHistoryQuery query,
                                          @Param("createdFrom") LocalDateTime createdFrom,
                                          @Param("createdTo") LocalDateTime createdTo,
                                          @Param("offset") int offset,
                                          @Param("limit") int limit);

    /**
     * 同一来源 + 关联单据的流水条数（订单防重复入账）。
     */
    long countByReference(@Param("userId") Long userId,
                          @Param("source") PointsSource source,
                          @Param("referenceType") String referenceType,
                          @Param("referenceId") String referenceId);

    long countBySourceBetween(@Param("userId") Long userId,
                              @Param("source") PointsSource source,
                              @Param("start") LocalDateTime start,
                              @Param("end") LocalDateTime end);

    /**
     * 某类型流水 |amount| 之和。
     */
    Long sumAbsAmountByType(@Param("userId") Long userId,
                         @Param("type") PointsTransactionType type);

    /**
     * 全部流水带符号之和，应与账户余额一致。
     */
    Long sumAmount(@Param("userId") Long userId);

    /**
     * 未过期积分批次的余量之和；expiresBefore 非空时仅统计在该时间之前到期的批次。
     */
    Long sumOpenRemaining(@Param("userId") Long userId,
                          @Param("expiresBefore") LocalDateTime expiresBefore);

    List<PointsTransaction> selectByUserId(@Param("userId") Long userId);
}
