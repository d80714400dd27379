package com.xinyue.margin.core.auth;

/**
 * 调用方代某账户出金的授权来源。三种授权互不依赖。
 */
public enum WithdrawGrant {
    SELF,
    GLOBAL_OPERATOR,
    LOCAL_OPERATOR,
    NONE;

    public boolean permitted() {
        return this != NONE;
    }
}
