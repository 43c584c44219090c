package com.retail.loyalty_backend.modules.ledger.vo;

import com.retail.loyalty_backend.modules.ledger.entity.PointsTransaction;
import com.retail.loyalty_backend.modules.ledger.enums.PointsSource;
import com.retail.loyalty_backend.modules.ledger.enums.PointsTransactionType;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 积分流水展示对象
 */
@Data
public class PointsTransactionVo {
    private Long id;
    private PointsTransactionType type;
    private Long amount;
    private Long balanceAfter;
    private PointsSource source;
    private String referenceId;
    private String referenceType;
    private String description;
    private LocalDateTime createdAt;
    private LocalDateTime expiresAt;
    private Long remainingAmount;

    public static PointsTransactionVo from(PointsTransaction entity) {
        PointsTransactionVo vo = new PointsTransactionVo();
        vo.setId(entity.getId());
        vo.setType(entity.getType());
        vo.setAmount(entity.getAmount());
        vo.setBalanceAfter(entity.getBalanceAfter());
        vo.setSource(entity.getSource());
        vo.setReferenceId(entity.getReferenceId());
        vo.setReferenceType(entity.getReferenceType());
        vo.setDescription(entity.getDescription());
        vo.setCreatedAt(entity.getCreatedAt());
        vo.setExpiresAt(entity.getExpiresAt());
        vo.setRemainingAmount(entity.getRemainingAmount());
        return vo;
    }
}
