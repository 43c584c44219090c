package com.retail.loyalty_backend.modules.points.service;

import com.retail.loyalty_backend.common.exception.BizException;
import com.retail.loyalty_backend.modules.account.mapper.LoyaltyAccountMapper;
import com.retail.loyalty_backend.modules.ledger.enums.PointsSource;
import com.retail.loyalty_backend.modules.ledger.mapper.PointsTransactionMapper;
import com.retail.loyalty_backend.modules.points.config.BonusProperties;
import com.retail.loyalty_backend.modules.points.dto.EarnPointsDto;
import com.retail.loyalty_backend.modules.points.vo.EarnPointsResultVo;
import com.retail.loyalty_backend.modules.points.vo.ReferralBonusResultVo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 一次性奖励：欢迎、邀请、生日。均通过普通入账发放（同样乘等级倍率、同样会过期）。
 */
@Service
@Slf4j
public class LoyaltyBonusService {

    static final String REFERENCE_TYPE_REFERRAL = "referral";

    private final PointsLedgerWriter ledgerWriter;
    private final PointsEarningService earningService;
    private final LoyaltyAccountMapper accountMapper;
    private final PointsTransactionMapper transactionMapper;
    private final BonusProperties bonuses;
    private final Clock clock;

    public LoyaltyBonusService(PointsLedgerWriter ledgerWriter,
                               PointsEarningService earningService,
                               LoyaltyAccountMapper accountMapper,
                               PointsTransactionMapper transactionMapper,
                               BonusProperties bonuses,
                               Clock clock) {
        this.ledgerWriter = ledgerWriter;
        this.earningService = earningService;
        this.accountMapper = accountMapper;
        this.transactionMapper = transactionMapper;
        this.bonuses = bonuses;
        this.clock = clock;
    }

    /**
     * 欢迎奖励，每个账户只发一次；已发放时返回 null。
     */
    @Transactional
    public EarnPointsResultVo grantWelcomeBonus(Long userId) {
        ledgerWriter.lockAccount(userId);
        if (accountMapper.markWelcomeBonusGranted(userId) == 0) {
            log.debug("Welcome bonus already granted to user {}", userId);
            return null;
        }
        if (bonuses.getWelcome() <= 0) {
            return null;
        }
        return earningService.earn(EarnPointsDto.builder()
                .userId(userId)
                .amount(bonuses.getWelcome())
                .source(PointsSource.WELCOME_BONUS)
                .build());
    }

    /**
     * 邀请奖励：邀请人与被邀请人各入账一笔。按 userId 升序加锁，避免两个方向同时发放时死锁。
     */
    @Transactional
    public ReferralBonusResultVo grantReferralBonuses(Long referrerId, Long refereeId, String referralId) {
        if (referrerId == null || refereeId == null || referrerId.equals(refereeId)) {
            throw new BizException("Referrer and referee must be two different users");
        }
        if (!StringUtils.hasText(referralId)) {
            throw new BizException("referralId is required");
        }
        ledgerWriter.lockAccount(Math.min(referrerId, refereeId));
        ledgerWriter.lockAccount(Math.max(referrerId, refereeId));
        if (transactionMapper.countByReference(referrerId, PointsSource.REFERRAL, REFERENCE_TYPE_REFERRAL, referralId) > 0) {
            throw BizException.conflict("Referral " + referralId + " was already rewarded");
        }

        ReferralBonusResultVo result = new ReferralBonusResultVo();
        result.setReferrer(earningService.earn(EarnPointsDto.builder()
                .userId(referrerId)
                .amount(bonuses.getReferrer())
                .source(PointsSource.REFERRAL)
                .referenceId(referralId)
                .referenceType(REFERENCE_TYPE_REFERRAL)
                .build()));
        result.setReferee(earningService.earn(EarnPointsDto.builder()
                .userId(refereeId)
                .amount(bonuses.getReferee())
                .source(PointsSource.REFERRAL_BONUS)
                .referenceId(referralId)
                .referenceType(REFERENCE_TYPE_REFERRAL)
                .build()));
        return result;
    }

    /**
     * 生日奖励，每个自然年最多一次；本年已发放时返回 null。
     */
    @Transactional
    public EarnPointsResultVo grantBirthdayBonus(Long userId) {
        ledgerWriter.lockAccount(userId);
        LocalDate today = LocalDate.now(clock);
        LocalDateTime yearStart = today.withDayOfYear(1).atStartOfDay();
        LocalDateTime nextYearStart = yearStart.plusYears(1);
        if (transactionMapper.countBySourceBetween(userId, PointsSource.BIRTHDAY, yearStart, nextYearStart) > 0) {
            log.debug("Birthday bonus for {} already granted to user {}", today.getYear(), userId);
            return null;
        }
        return earningService.earn(EarnPointsDto.builder()
                .userId(userId)
                .amount(bonuses.getBirthday())
                .source(PointsSource.BIRTHDAY)
                .referenceId(String.valueOf(today.getYear()))
                .referenceType("birthday")
                .build());
    }
}
