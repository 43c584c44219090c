package com.retail.loyalty_backend.modules.ledger.vo;

import lombok.Data;

/**
 * 余额对账结果：账户余额 vs 流水合计 vs 未消费批次余量合计。
 */
@Data
public class LedgerReconciliationVo {
    private Long userId;
    private Long accountBalance;
    /** 全部流水 amount 之和 */
    private Long ledgerSum;
    /** 未过期积分批次 remainingAmount 之和 */
    private Long openLotRemaining;
    /** accountBalance == ledgerSum */
    private boolean balanceConsistent;
    /** openLotRemaining <= accountBalance：差额是正数调整等不过期的积分 */
    private boolean lotsConsistent;
}
