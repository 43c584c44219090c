package com.retail.loyalty_backend.modules.streak.service;

import com.retail.loyalty_backend.common.exception.BizException;
import com.retail.loyalty_backend.modules.account.entity.LoyaltyAccount;
import com.retail.loyalty_backend.modules.account.mapper.LoyaltyAccountMapper;
import com.retail.loyalty_backend.modules.streak.config.StreakProperties;
import com.retail.loyalty_backend.modules.streak.vo.StreakBonusVo;
import com.retail.loyalty_backend.modules.streak.vo.StreakResultVo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Objects;

/**
 * 连续活跃天数。
 * <p>
 * 规则：活动日 = 上次活动日 + 1 天则 +1；同一天或更早的活动（迟到、重放的事件）不变；间隔超过一天重置为 1。
 * 里程碑按数值判断，连续天数中断后再次达到同一天数会再次发放。
 */
@Service
@Slf4j
public class StreakService {

    private final LoyaltyAccountMapper accountMapper;
    private final StreakProperties streakProperties;
    private final Clock clock;

    public StreakService(LoyaltyAccountMapper accountMapper,
                         StreakProperties streakProperties,
                         Clock clock) {
        this.accountMapper = accountMapper;
        this.streakProperties = streakProperties;
        this.clock = clock;
    }

    /**
     * 记录一次活动（独立入口，锁定账户行）。
     */
    @Transactional
    public StreakResultVo recordActivity(Long userId, LocalDate activityDate) {
        LoyaltyAccount account = accountMapper.lockByUserIdForUpdate(userId)
                .orElseThrow(() -> BizException.notFound("Loyalty account not found for user " + userId));
        return applyActivity(account, activityDate != null ? activityDate : LocalDate.now(clock));
    }

    /**
     * 在调用方已持有账户行锁的事务内更新连续天数。
     */
    public StreakResultVo applyActivity(LoyaltyAccount account, LocalDate activityDate) {
        Objects.requireNonNull(activityDate, "activityDate");
        int current = account.getCurrentStreak() == null ? 0 : account.getCurrentStreak();
        int longest = account.getLongestStreak() == null ? 0 : account.getLongestStreak();
        LocalDate last = account.getLastActivityDate();

        StreakResultVo result = new StreakResultVo();
        if (last != null && !activityDate.isAfter(last)) {
            result.setCurrentStreak(current);
            result.setLongestStreak(longest);
            return result;
        }

        int newStreak = advance(current, last, activityDate);
        int newLongest = Math.max(longest, newStreak);
        accountMapper.updateStreak(account.getUserId(), newStreak, newLongest, activityDate);
        account.setCurrentStreak(newStreak);
        account.setLongestStreak(newLongest);
        account.setLastActivityDate(activityDate);

        result.setCurrentStreak(newStreak);
        result.setLongestStreak(newLongest);
        result.setMilestoneBonus(milestoneFor(newStreak));
        if (result.getMilestoneBonus() != null) {
            log.info("User {} reached a {}-day streak", account.getUserId(), newStreak);
        }
        return result;
    }

    static int advance(int currentStreak, LocalDate lastActivityDate, LocalDate activityDate) {
        if (lastActivityDate == null) {
            return 1;
        }
        if (!activityDate.isAfter(lastActivityDate)) {
            return currentStreak;
        }
        if (activityDate.equals(lastActivityDate.plusDays(1))) {
            return currentStreak + 1;
        }
        return 1;
    }

    public StreakBonusVo milestoneFor(int streak) {
        return streakProperties.getMilestones().stream()
                .filter(m -> m.getDays() == streak)
                .findFirst()
                .map(m -> new StreakBonusVo(m.getDays(), m.getBonus(), m.getMessage()))
                .orElse(null);
    }

    /**
     * 每日清零已中断的连续天数：最近活动早于昨天的用户无法再续上。
     */
    @Scheduled(cron = "${app.loyalty.streak.reset-cron:0 30 0 * * ?}", zone = "${app.loyalty.time-zone:Asia/Tashkent}")
    public void resetBrokenStreaks() {
        LocalDate yesterday = LocalDate.now(clock).minusDays(1);
        try {
            int reset = accountMapper.resetStreaksInactiveSince(yesterday);
            log.info("Streak reset finished: {} accounts inactive since before {}", reset, yesterday);
        } catch (Exception ex) {
            log.warn("Streak reset failed", ex);
        }
    }
}
