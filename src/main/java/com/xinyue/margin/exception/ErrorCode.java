package com.xinyue.margin.exception;

/**
 * 账本错误码。
 * <p>
 * 每个错误码对应一个 HTTP 风格的状态码，供 Web 层映射响应。
 */
public enum ErrorCode {
    INVALID_AMOUNT(400, "金额非法"),
    INVALID_IDENTITY(400, "身份标识非法"),
    UNAUTHORIZED(401, "没有代该账户提取保证金的权限"),
    INSUFFICIENT_BALANCE(409, "保证金余额不足"),
    UNDERCOLLATERALIZED(422, "账户抵押不足"),
    TRANSFER_FAILED(502, "托管划转失败"),
    PRICE_UNAVAILABLE(503, "价格预言机不可用"),
    INTERNAL_INVARIANT_VIOLATION(500, "账本内部不变量被破坏"),
    LEDGER_HALTED(503, "账本已熔断，拒绝所有变更操作");

    private final int status;
    private final String description;

    ErrorCode(int status, String description) {
        this.status = status;
        this.description = description;
    }

    public int status() {
        return status;
    }

    public String description() {
        return description;
    }

    /**
     * 是否属于确定性拒绝（重试没有意义）。
     */
    public boolean definitive() {
        return this != TRANSFER_FAILED && this != PRICE_UNAVAILABLE;
    }
}
