package com.xinyue.margin.core;

import com.xinyue.margin.core.account.AccountBalance;

/**
 * 入金/出金成功后的回执。
 *
 * @param index    本次操作推进后的账本索引
 * @param account  目标账户
 * @param amountE8 金额（放大 1e8）
 * @param balance  提交后的账户余额
 */
public record LedgerReceipt(long index, String account, long amountE8, AccountBalance balance) {
}
