package com.xinyue.margin.core.gateway;

/**
 * 托管划转结果。
 */
public enum TransferResult {
    SUCCESS,
    REJECTED,       // 确定性失败，例如付款方余额或授权额度不足
    UNAVAILABLE;    // 暂时性失败，例如托管服务超时，可重试

    public boolean isSuccess() {
        return this == SUCCESS;
    }

    public boolean isTransient() {
        return this == UNAVAILABLE;
    }
}
