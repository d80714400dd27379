package com.xinyue.margin.exception;

/**
 * 预言机暂时无法给出价格（未连接、无数据或数据过期）。
 */
public class PriceUnavailableException extends LedgerException {

    public PriceUnavailableException(String message) {
        super(ErrorCode.PRICE_UNAVAILABLE, message);
    }

    public PriceUnavailableException(String message, Throwable cause) {
        super(ErrorCode.PRICE_UNAVAILABLE, message, cause);
    }
}
