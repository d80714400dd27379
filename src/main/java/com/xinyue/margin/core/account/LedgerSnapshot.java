package com.xinyue.margin.core.account;

import java.util.Map;

/**
 * 同一时刻的全量账本视图：所有账户余额、总保证金以及账本索引。
 */
public record LedgerSnapshot(Map<String, AccountBalance> accounts, long totalMarginE8, long index) {

    public AccountBalance balanceOf(String account) {
        AccountBalance balance = accounts.get(account);
        return balance != null ? balance : AccountBalance.empty(account);
    }

    public long sumOfMarginsE8() {
        long sum = 0;
        for (AccountBalance balance : accounts.values()) {
            sum = Math.addExact(sum, balance.marginE8());
        }
        return sum;
    }

    public long sumOfPositionsE8() {
        long sum = 0;
        for (AccountBalance balance : accounts.values()) {
            sum = Math.addExact(sum, balance.positionE8());
        }
        return sum;
    }
}
