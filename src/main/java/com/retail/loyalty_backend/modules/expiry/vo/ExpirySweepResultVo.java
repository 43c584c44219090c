package com.retail.loyalty_backend.modules.expiry.vo;

import lombok.Data;

/**
 * 一次过期扫描的汇总
 */
@Data
public class ExpirySweepResultVo {
    /** 本次转为 EXPIRE 流水的批次数 */
    private int expiredEntries;
    private long expiredPoints;
    /** 处理失败（已记录日志，下次扫描重试）的批次数 */
    private int failed;
    /** 复核时已不符合条件（被并发消费或已处理）的批次数 */
    private int skipped;
    /** 上一次扫描仍在运行，本次未执行 */
    private boolean alreadyRunning;
}
