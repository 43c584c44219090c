package com.retail.loyalty_backend.modules.streak.service;

import com.retail.loyalty_backend.modules.account.entity.LoyaltyAccount;
import com.retail.loyalty_backend.modules.account.mapper.LoyaltyAccountMapper;
import com.retail.loyalty_backend.modules.streak.config.StreakProperties;
import com.retail.loyalty_backend.modules.streak.vo.StreakResultVo;
import com.retail.loyalty_backend.support.LoyaltyTestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class StreakServiceTest {

    private static final Long USER_ID = 41L;
    private static final LocalDate MONDAY = LocalDate.of(2026, 3, 9);

    @Mock
    private LoyaltyAccountMapper accountMapper;

    private StreakService streakService;

    @BeforeEach
    void setup() {
        streakService = new StreakService(accountMapper, new StreakProperties(), LoyaltyTestFixtures.FIXED_CLOCK);
    }

    @Test
    void advance_shouldFollowCalendarDays() {
        assertEquals(1, StreakService.advance(0, null, MONDAY));
        assertEquals(5, StreakService.advance(4, MONDAY, MONDAY.plusDays(1)));
        assertEquals(4, StreakService.advance(4, MONDAY, MONDAY));
        assertEquals(1, StreakService.advance(4, MONDAY, MONDAY.plusDays(2)));
        assertEquals(4, StreakService.advance(4, MONDAY, MONDAY.minusDays(1)));
    }

    @Test
    void applyActivity_threeConsecutiveDays_shouldReturnBonusOnThirdDayOnly() {
        LoyaltyAccount account = LoyaltyTestFixtures.account(USER_ID, 0L);

        StreakResultVo day1 = streakService.applyActivity(account, MONDAY);
        StreakResultVo day2 = streakService.applyActivity(account, MONDAY.plusDays(1));
        StreakResultVo day3 = streakService.applyActivity(account, MONDAY.plusDays(2));

        assertEquals(1, day1.getCurrentStreak());
        assertNull(day1.getMilestoneBonus());
        assertEquals(2, day2.getCurrentStreak());
        assertNull(day2.getMilestoneBonus());
        assertEquals(3, day3.getCurrentStreak());
        assertThat(day3.getMilestoneBonus()).isNotNull();
        assertEquals(10L, day3.getMilestoneBonus().getBonus());
        assertEquals(3, account.getLongestStreak());
        verify(accountMapper).updateStreak(USER_ID, 3, 3, MONDAY.plusDays(2));
    }

    @Test
    void applyActivity_sameDayRepeat_shouldNotChangeStreakOrReAward() {
        LoyaltyAccount account = LoyaltyTestFixtures.account(USER_ID, 0L);
        account.setCurrentStreak(3);
        account.setLongestStreak(3);
        account.setLastActivityDate(MONDAY);

        StreakResultVo result = streakService.applyActivity(account, MONDAY);

        assertEquals(3, result.getCurrentStreak());
        assertNull(result.getMilestoneBonus());
        verify(accountMapper, never()).updateStreak(any(), anyInt(), anyInt(), any());
    }

    @Test
    void applyActivity_lateEventForEarlierDay_shouldKeepRunningStreak() {
        LoyaltyAccount account = LoyaltyTestFixtures.account(USER_ID, 0L);
        account.setCurrentStreak(4);
        account.setLongestStreak(4);
        account.setLastActivityDate(MONDAY);

        StreakResultVo result = streakService.applyActivity(account, MONDAY.minusDays(2));

        assertEquals(4, result.getCurrentStreak());
        assertEquals(4, result.getLongestStreak());
        assertNull(result.getMilestoneBonus());
        assertEquals(MONDAY, account.getLastActivityDate());
        verify(accountMapper, never()).updateStreak(any(), anyInt(), anyInt(), any());
    }

    @Test
    void applyActivity_afterGap_shouldResetButKeepLongest() {
        LoyaltyAccount account = LoyaltyTestFixtures.account(USER_ID, 0L);
        account.setCurrentStreak(6);
        account.setLongestStreak(9);
        account.setLastActivityDate(MONDAY);

        StreakResultVo result = streakService.applyActivity(account, MONDAY.plusDays(3));

        assertEquals(1, result.getCurrentStreak());
        assertEquals(9, result.getLongestStreak());
        verify(accountMapper).updateStreak(USER_ID, 1, 9, MONDAY.plusDays(3));
    }

    @Test
    void applyActivity_reachingMilestoneAgainAfterReset_shouldReAward() {
        LoyaltyAccount account = LoyaltyTestFixtures.account(USER_ID, 0L);
        account.setCurrentStreak(2);
        account.setLongestStreak(10);
        account.setLastActivityDate(MONDAY);

        StreakResultVo result = streakService.applyActivity(account, MONDAY.plusDays(1));

        assertEquals(3, result.getCurrentStreak());
        assertThat(result.getMilestoneBonus()).isNotNull();
    }

    @Test
    void resetBrokenStreaks_shouldClearStreaksInactiveBeforeYesterday() {
        streakService.resetBrokenStreaks();

        // 固定时钟的“今天”是 2026-03-10
        verify(accountMapper).resetStreaksInactiveSince(LocalDate.of(2026, 3, 9));
    }
}
