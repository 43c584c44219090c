package com.retail.loyalty_backend.modules.ledger.service;

import com.retail.loyalty_backend.common.exception.BizException;
import com.retail.loyalty_backend.common.vo.PageVo;
import com.retail.loyalty_backend.modules.account.mapper.LoyaltyAccountMapper;
import com.retail.loyalty_backend.modules.ledger.dto.PointsHistoryQuery;
import com.retail.loyalty_backend.modules.ledger.enums.PointsTransactionType;
import com.retail.loyalty_backend.modules.ledger.mapper.PointsTransactionMapper;
import com.retail.loyalty_backend.modules.ledger.vo.LedgerReconciliationVo;
import com.retail.loyalty_backend.modules.ledger.vo.PointsTransactionVo;
import com.retail.loyalty_backend.support.LoyaltyTestFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static com.retail.loyalty_backend.support.LoyaltyTestFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PointsHistoryServiceTest {

    private static final Long USER_ID = 51L;

    @Mock
    private PointsTransactionMapper transactionMapper;
    @Mock
    private LoyaltyAccountMapper accountMapper;

    @InjectMocks
    private PointsHistoryService historyService;

    @Test
    void getHistory_shouldTurnCalendarDaysIntoHalfOpenRange() {
        PointsHistoryQuery query = new PointsHistoryQuery();
        query.setType(PointsTransactionType.EARN);
        query.setDateFrom(LocalDate.of(2026, 3, 1));
        query.setDateTo(LocalDate.of(2026, 3, 10));
        query.setPage(2);
        query.setSize(2);
        LocalDateTime from = LocalDateTime.of(2026, 3, 1, 0, 0);
        LocalDateTime to = LocalDateTime.of(2026, 3, 11, 0, 0);
        when(transactionMapper.countHistory(USER_ID, query, from, to)).thenReturn(5L);
        when(transactionMapper.selectHistory(USER_ID, query, from, to, 2, 2)).thenReturn(List.of(
                LoyaltyTestFixtures.lot(3L, USER_ID, 30L, 30L, NOW.minusDays(2), NOW.plusDays(363)),
                LoyaltyTestFixtures.lot(2L, USER_ID, 20L, 20L, NOW.minusDays(3), NOW.plusDays(362))));

        PageVo<PointsTransactionVo> page = historyService.getHistory(USER_ID, query);

        assertEquals(5L, page.getTotal());
        assertEquals(3, page.getTotalPages());
        assertThat(page.getList()).extracting(PointsTransactionVo::getId).containsExactly(3L, 2L);
    }

    @Test
    void getHistory_emptyResult_shouldSkipPageQuery() {
        PointsHistoryQuery query = new PointsHistoryQuery();
        when(transactionMapper.countHistory(eq(USER_ID), eq(query), isNull(), isNull())).thenReturn(0L);

        PageVo<PointsTransactionVo> page = historyService.getHistory(USER_ID, query);

        assertThat(page.getList()).isEmpty();
        verify(transactionMapper, never()).selectHistory(eq(USER_ID), eq(query), isNull(), isNull(), anyInt(), anyInt());
    }

    @Test
    void getHistory_invertedRange_shouldBeRejected() {
        PointsHistoryQuery query = new PointsHistoryQuery();
        query.setDateFrom(LocalDate.of(2026, 3, 10));
        query.setDateTo(LocalDate.of(2026, 3, 1));

        assertThrows(BizException.class, () -> historyService.getHistory(USER_ID, query));
    }

    @Test
    void reconcile_shouldReportDrift() {
        when(accountMapper.selectByUserId(USER_ID)).thenReturn(Optional.of(LoyaltyTestFixtures.account(USER_ID, 500L)));
        when(transactionMapper.sumAmount(USER_ID)).thenReturn(500L);
        when(transactionMapper.sumOpenRemaining(USER_ID, null)).thenReturn(550L);

        LedgerReconciliationVo vo = historyService.reconcile(USER_ID);

        assertThat(vo.isBalanceConsistent()).isTrue();
        assertThat(vo.isLotsConsistent()).isFalse();
        assertEquals(550L, vo.getOpenLotRemaining());
    }

    @Test
    void reconcile_balanceAboveOpenLots_shouldBeConsistent() {
        // 200 分来自不过期的管理员调整
        when(accountMapper.selectByUserId(USER_ID)).thenReturn(Optional.of(LoyaltyTestFixtures.account(USER_ID, 500L)));
        when(transactionMapper.sumAmount(USER_ID)).thenReturn(500L);
        when(transactionMapper.sumOpenRemaining(USER_ID, null)).thenReturn(300L);

        LedgerReconciliationVo vo = historyService.reconcile(USER_ID);

        assertThat(vo.isBalanceConsistent()).isTrue();
        assertThat(vo.isLotsConsistent()).isTrue();
    }
}
