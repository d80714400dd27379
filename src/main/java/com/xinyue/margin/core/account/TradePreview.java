package com.xinyue.margin.core.account;

/**
 * 一笔成交结算后买卖双方的拟提交状态。
 */
public record TradePreview(AccountBalance buyer, AccountBalance seller) {
}
