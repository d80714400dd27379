package com.xinyue.margin.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("错误码")
class ErrorCodeTest {

    @Test
    @DisplayName("只有托管与预言机失败属于暂时性错误")
    void definitiveCodes() {
        for (ErrorCode code : ErrorCode.values()) {
            boolean transientFailure = code == ErrorCode.TRANSFER_FAILED || code == ErrorCode.PRICE_UNAVAILABLE;
            assertEquals(!transientFailure, code.definitive(), code.name());
        }
    }

    @Test
    @DisplayName("异常携带错误码")
    void exceptionCarriesCode() {
        LedgerException e = new PriceUnavailableException("stale");

        assertEquals(ErrorCode.PRICE_UNAVAILABLE, e.errorCode());
        assertEquals(503, e.errorCode().status());
    }
}
