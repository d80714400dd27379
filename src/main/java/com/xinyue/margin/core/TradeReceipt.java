package com.xinyue.margin.core;

import com.xinyue.margin.core.account.AccountBalance;

/**
 * 成交结算成功后的回执，包含双方提交后的余额。
 */
public record TradeReceipt(long index, AccountBalance buyer, AccountBalance seller) {
}
