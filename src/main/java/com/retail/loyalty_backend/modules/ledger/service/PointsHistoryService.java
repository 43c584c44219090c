package com.retail.loyalty_backend.modules.ledger.service;

import com.retail.loyalty_backend.common.exception.BizException;
import com.retail.loyalty_backend.common.vo.PageVo;
import com.retail.loyalty_backend.modules.account.entity.LoyaltyAccount;
import com.retail.loyalty_backend.modules.account.mapper.LoyaltyAccountMapper;
import com.retail.loyalty_backend.modules.ledger.dto.PointsHistoryQuery;
import com.retail.loyalty_backend.modules.ledger.entity.PointsTransaction;
import com.retail.loyalty_backend.modules.ledger.mapper.PointsTransactionMapper;
import com.retail.loyalty_backend.modules.ledger.vo.LedgerReconciliationVo;
import com.retail.loyalty_backend.modules.ledger.vo.PointsTransactionVo;
import jakarta.validation.Valid;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 积分流水查询与对账（只读）。
 */
@Service
@Validated
public class PointsHistoryService {

    static final int MAX_PAGE_SIZE = 100;

    private final PointsTransactionMapper transactionMapper;
    private final LoyaltyAccountMapper accountMapper;

    public PointsHistoryService(PointsTransactionMapper transactionMapper,
                                LoyaltyAccountMapper accountMapper) {
        this.transactionMapper = transactionMapper;
        this.accountMapper = accountMapper;
    }

    /**
     * 分页流水，最新在前。dateTo 当天整天包含在内。
     */
    public PageVo<PointsTransactionVo> getHistory(Long userId, @Valid PointsHistoryQuery query) {
        if (userId == null) {
            throw new BizException("userId is required");
        }
        PointsHistoryQuery q = query != null ? query : new PointsHistoryQuery();
        if (q.getDateFrom() != null && q.getDateTo() != null && q.getDateFrom().isAfter(q.getDateTo())) {
            throw new BizException("dateFrom must not be after dateTo");
        }
        int page = Math.max(1, q.getPage());
        int size = Math.min(MAX_PAGE_SIZE, Math.max(1, q.getSize()));
        LocalDateTime createdFrom = q.getDateFrom() != null ? q.getDateFrom().atStartOfDay() : null;
        LocalDateTime createdTo = q.getDateTo() != null ? q.getDateTo().plusDays(1).atStartOfDay() : null;

        long total = transactionMapper.countHistory(userId, q, createdFrom, createdTo);
        if (total == 0) {
            return PageVo.of(0, page, size, Collections.emptyList());
        }
        int offset = (page - 1) * size;
        List<PointsTransactionVo> list = transactionMapper.selectHistory(userId, q, createdFrom, createdTo, offset, size)
                .stream()
                .map(PointsTransactionVo::from)
                .collect(Collectors.toList());
        return PageVo.of(total, page, size, list);
    }

    /**
     * 对账：账户余额应同时等于流水合计与未过期批次余量合计。
     */
    public LedgerReconciliationVo reconcile(Long userId) {
        LoyaltyAccount account = accountMapper.selectByUserId(userId)
                .orElseThrow(() -> BizException.notFound("Loyalty account not found for user " + userId));
        long balance = account.getPointsBalance() == null ? 0L : account.getPointsBalance();
        long ledgerSum = nvl(transactionMapper.sumAmount(userId));
        long openRemaining = nvl(transactionMapper.sumOpenRemaining(userId, null));

        LedgerReconciliationVo vo = new LedgerReconciliationVo();
        vo.setUserId(userId);
        vo.setAccountBalance(balance);
        vo.setLedgerSum(ledgerSum);
        vo.setOpenLotRemaining(openRemaining);
        vo.setBalanceConsistent(balance == ledgerSum);
        vo.setLotsConsistent(openRemaining <= balance);
        return vo;
    }

    public List<PointsTransaction> listEntries(Long userId) {
        return transactionMapper.selectByUserId(userId);
    }

    private static long nvl(Long value) {
        return value == null ? 0L : value;
    }
}
