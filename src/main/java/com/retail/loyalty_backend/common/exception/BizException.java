package com.retail.loyalty_backend.common.exception;

/**
 * 业务异常：携带可直接展示给调用方的错误信息与错误码。
 */
public class BizException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** 参数/业务规则校验失败 */
    public static final int BAD_REQUEST = 400;
    /** 用户尚未开通积分账户、或记录不存在 */
    public static final int NOT_FOUND = 404;
    /** 积分余额不足、或重复入账 */
    public static final int CONFLICT = 409;

    private final int code;

    public BizException(String message) {
        super(message);
        this.code = BAD_REQUEST; // 默认400 - 业务错误
    }

    public BizException(int code, String message) {
        super(message);
        this.code = code;
    }

    public static BizException notFound(String message) {
        return new BizException(NOT_FOUND, message);
    }

    public static BizException conflict(String message) {
        return new BizException(CONFLICT, message);
    }

    public int getCode() {
        return code;
    }
}
