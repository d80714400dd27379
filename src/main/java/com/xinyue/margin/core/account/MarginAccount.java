package com.xinyue.margin.core.account;

/**
 * 单个账户的可变余额，只允许账本线程读写。
 */
final class MarginAccount {
    final String owner;

    // 使用 long 存储，放大 1e8 (例如 1.5 USDC = 150_000_000)
    long marginE8;
    long positionE8;    // 正数为多头，负数为空头

    MarginAccount(String owner) {
        this.owner = owner;
    }

    AccountBalance toBalance() {
        return new AccountBalance(owner, marginE8, positionE8);
    }
}
