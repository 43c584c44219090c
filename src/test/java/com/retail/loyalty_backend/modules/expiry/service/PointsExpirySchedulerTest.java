package com.retail.loyalty_backend.modules.expiry.service;

import com.retail.loyalty_backend.modules.expiry.vo.ExpirySweepResultVo;
import com.retail.loyalty_backend.support.LoyaltyTestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.retail.loyalty_backend.support.LoyaltyTestFixtures.NOW;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PointsExpirySchedulerTest {

    @Mock
    private PointsExpiryTxService expiryTxService;

    private PointsExpiryScheduler scheduler;

    @BeforeEach
    void setup() {
        scheduler = new PointsExpiryScheduler(expiryTxService, LoyaltyTestFixtures.FIXED_CLOCK, 2);
    }

    @Test
    void runSweep_shouldPageThroughCandidatesAndContinueAfterFailures() {
        when(expiryTxService.findExpiredLotIds(NOW, 0L, 2)).thenReturn(List.of(1L, 2L));
        when(expiryTxService.findExpiredLotIds(NOW, 2L, 2)).thenReturn(List.of(3L));
        when(expiryTxService.expireLot(1L, NOW)).thenReturn(100L);
        when(expiryTxService.expireLot(2L, NOW)).thenThrow(new IllegalStateException("lock timeout"));
        when(expiryTxService.expireLot(3L, NOW)).thenReturn(0L);

        ExpirySweepResultVo result = scheduler.runSweep();

        assertEquals(1, result.getExpiredEntries());
        assertEquals(100L, result.getExpiredPoints());
        assertEquals(1, result.getFailed());
        assertEquals(1, result.getSkipped());
        assertFalse(result.isAlreadyRunning());
        verify(expiryTxService).expireLot(3L, NOW);
    }

    @Test
    void runSweep_nothingDue_shouldReturnEmptyResult() {
        when(expiryTxService.findExpiredLotIds(NOW, 0L, 2)).thenReturn(List.of());

        ExpirySweepResultVo result = scheduler.runSweep();

        assertEquals(0, result.getExpiredEntries());
        assertEquals(0L, result.getExpiredPoints());
    }
}
