package com.xinyue.margin.common;

import com.xinyue.margin.exception.ErrorCode;
import com.xinyue.margin.exception.LedgerException;

/**
 * 账户/操作员身份标识校验。标识按原样比较，不做大小写归一化。
 */
public final class Identities {

    private Identities() {
    }

    public static String require(String identity, String name) {
        if (identity == null || identity.isBlank()) {
            throw new LedgerException(ErrorCode.INVALID_IDENTITY, name + " 不能为空");
        }
        return identity;
    }
}
