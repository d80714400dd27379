package com.xinyue.margin.io.oracle;

/**
 * 一条标记价格推送。
 *
 * @param symbol    交易对（小写，如 btcusdt）
 * @param priceE8   标记价格（放大 1e8）
 * @param eventTime 交易所事件时间（毫秒）
 */
public record MarkPrice(String symbol, long priceE8, long eventTime) {
}
