package com.retail.loyalty_backend.modules.points.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.retail.loyalty_backend.common.exception.BizException;
import com.retail.loyalty_backend.modules.account.entity.LoyaltyAccount;
import com.retail.loyalty_backend.modules.account.mapper.LoyaltyAccountMapper;
import com.retail.loyalty_backend.modules.ledger.entity.PointsTransaction;
import com.retail.loyalty_backend.modules.ledger.enums.PointsSource;
import com.retail.loyalty_backend.modules.ledger.enums.PointsTransactionType;
import com.retail.loyalty_backend.modules.ledger.mapper.PointsTransactionMapper;
import com.retail.loyalty_backend.modules.points.config.PointsRulesProperties;
import com.retail.loyalty_backend.modules.points.dto.EarnPointsDto;
import com.retail.loyalty_backend.modules.points.event.PointsEarnedEvent;
import com.retail.loyalty_backend.modules.points.event.TierChangedEvent;
import com.retail.loyalty_backend.modules.points.vo.EarnPointsResultVo;
import com.retail.loyalty_backend.modules.tier.service.TierService;
import com.retail.loyalty_backend.support.LoyaltyTestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PointsEarningServiceTest {

    private static final Long USER_ID = 7L;

    @Mock
    private LoyaltyAccountMapper accountMapper;
    @Mock
    private PointsTransactionMapper transactionMapper;
    @Mock
    private ApplicationEventPublisher eventPublisher;

    @Captor
    private ArgumentCaptor<PointsTransaction> entryCaptor;
    @Captor
    private ArgumentCaptor<Object> eventCaptor;

    private PointsEarningService earningService;

    @BeforeEach
    void setup() {
        TierService tierService = LoyaltyTestFixtures.defaultTierService();
        PointsLedgerWriter writer = new PointsLedgerWriter(accountMapper, transactionMapper, tierService,
                eventPublisher, new ObjectMapper());
        earningService = new PointsEarningService(writer, tierService, new PointsRulesProperties(),
                eventPublisher, LoyaltyTestFixtures.FIXED_CLOCK);
    }

    private void givenAccount(long balance) {
        LoyaltyAccount account = LoyaltyTestFixtures.account(USER_ID, balance);
        when(accountMapper.lockByUserIdForUpdate(USER_ID)).thenReturn(Optional.of(account));
    }

    private void givenWritesSucceed() {
        doAnswer(invocation -> {
            PointsTransaction entry = invocation.getArgument(0);
            entry.setId(100L);
            return 1;
        }).when(transactionMapper).insert(any(PointsTransaction.class));
        when(accountMapper.updateBalanceAndTier(any(), anyLong(), any())).thenReturn(1);
    }

    @Test
    void earn_crossingThreshold_shouldUpgradeTierAndPublishSignals() {
        givenAccount(950L);
        givenWritesSucceed();

        EarnPointsResultVo result = earningService.earn(EarnPointsDto.builder()
                .userId(USER_ID)
                .amount(100L)
                .source(PointsSource.ORDER)
                .referenceId("order-1")
                .referenceType("order")
                .build());

        // BRONZE 倍率 1.0：按入账前等级换算
        assertEquals(100L, result.getCreditedAmount());
        assertEquals(1050L, result.getNewBalance());
        assertEquals(100L, result.getEntryId());
        assertThat(result.isTierChanged()).isTrue();
        assertThat(result.getTierInfo().getCode()).isEqualTo("SILVER");

        verify(accountMapper).updateBalanceAndTier(USER_ID, 1050L, "SILVER");
        verify(transactionMapper).insert(entryCaptor.capture());
        PointsTransaction entry = entryCaptor.getValue();
        assertEquals(PointsTransactionType.EARN, entry.getType());
        assertEquals(100L, entry.getAmount());
        assertEquals(1050L, entry.getBalanceAfter());
        assertEquals(100L, entry.getRemainingAmount());
        assertEquals(LoyaltyTestFixtures.NOW.plusDays(365), entry.getExpiresAt());
        assertThat(entry.getIsExpired()).isFalse();

        verify(eventPublisher, times(2)).publishEvent(eventCaptor.capture());
        List<Object> events = eventCaptor.getAllValues();
        assertThat(events).hasAtLeastOneElementOfType(TierChangedEvent.class);
        TierChangedEvent tierChanged = (TierChangedEvent) events.stream()
                .filter(TierChangedEvent.class::isInstance).findFirst().orElseThrow();
        assertEquals("BRONZE", tierChanged.oldTier());
        assertEquals("SILVER", tierChanged.newTier());
        assertThat(tierChanged.upgrade()).isTrue();
        PointsEarnedEvent earned = (PointsEarnedEvent) events.stream()
                .filter(PointsEarnedEvent.class::isInstance).findFirst().orElseThrow();
        assertEquals(100L, earned.amount());
        assertEquals(1050L, earned.newBalance());
    }

    @Test
    void earn_shouldApplyCurrentTierMultiplierRoundingDown() {
        givenAccount(1000L);
        givenWritesSucceed();

        EarnPointsResultVo result = earningService.earn(EarnPointsDto.builder()
                .userId(USER_ID)
                .amount(55L)
                .source(PointsSource.PROMO)
                .metadata(Map.of("campaign", "spring"))
                .build());

        assertEquals(66L, result.getCreditedAmount());
        assertEquals(1066L, result.getNewBalance());
        assertThat(result.isTierChanged()).isFalse();
        assertThat(result.getTierInfo()).isNull();

        verify(transactionMapper).insert(entryCaptor.capture());
        assertEquals("Promotion", entryCaptor.getValue().getDescription());
        assertEquals("{\"campaign\":\"spring\"}", entryCaptor.getValue().getMetadata());
        verify(eventPublisher, never()).publishEvent(any(TierChangedEvent.class));
    }

    @Test
    void earn_nonPositiveAmount_shouldRejectBeforeTouchingStorage() {
        BizException ex = assertThrows(BizException.class, () -> earningService.earn(EarnPointsDto.builder()
                .userId(USER_ID)
                .amount(0L)
                .source(PointsSource.ORDER)
                .build()));

        assertEquals(BizException.BAD_REQUEST, ex.getCode());
        verifyNoInteractions(accountMapper, transactionMapper, eventPublisher);
    }

    @Test
    void earn_unknownUser_shouldFailWithNotFound() {
        when(accountMapper.lockByUserIdForUpdate(USER_ID)).thenReturn(Optional.empty());

        BizException ex = assertThrows(BizException.class, () -> earningService.earn(EarnPointsDto.builder()
                .userId(USER_ID)
                .amount(10L)
                .source(PointsSource.ORDER)
                .build()));

        assertEquals(BizException.NOT_FOUND, ex.getCode());
        verifyNoInteractions(transactionMapper);
    }
}
