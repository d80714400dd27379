package com.xinyue.margin.core.account;

import com.xinyue.margin.common.ScaleConstants;

import java.math.BigDecimal;

/**
 * 账户余额的不可变快照，也用作变更前计算出的"拟提交状态"。
 *
 * @param account    账户标识
 * @param marginE8   保证金（放大 1e8）
 * @param positionE8 仓位（放大 1e8，正数多头，负数空头）
 */
public record AccountBalance(String account, long marginE8, long positionE8) {

    public static AccountBalance empty(String account) {
        return new AccountBalance(account, 0, 0);
    }

    public BigDecimal margin() {
        return ScaleConstants.fromE8(marginE8);
    }

    public BigDecimal position() {
        return ScaleConstants.fromE8(positionE8);
    }

    public boolean hasPosition() {
        return positionE8 != 0;
    }
}
