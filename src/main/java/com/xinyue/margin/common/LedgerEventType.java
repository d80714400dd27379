package com.xinyue.margin.common;

public enum LedgerEventType {
    NONE,
    DEPOSIT,
    WITHDRAW,
    SETTLE_TRADE,          // 撮合引擎提交的成交结算
    SET_GLOBAL_OPERATOR,
    SET_LOCAL_OPERATOR,
    QUERY_BALANCE,
    QUERY_TOTAL_MARGIN,
    QUERY_SNAPSHOT,
    QUERY_GLOBAL_OPERATOR,
    QUERY_LOCAL_OPERATOR;

    /**
     * 是否会改变账本或授权状态。熔断后此类请求一律拒绝。
     */
    public boolean mutating() {
        return switch (this) {
            case DEPOSIT, WITHDRAW, SETTLE_TRADE, SET_GLOBAL_OPERATOR, SET_LOCAL_OPERATOR -> true;
            default -> false;
        };
    }
}
