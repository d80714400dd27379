package com.xinyue.margin.web.controller;

import com.xinyue.margin.common.ScaleConstants;
import com.xinyue.margin.core.account.AccountBalance;
import com.xinyue.margin.exception.ErrorCode;
import com.xinyue.margin.exception.LedgerException;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 统一响应结构：{code, message, success, data}。
 */
final class ApiResponse {

    private ApiResponse() {
    }

    static Map<String, Object> ok(Object data) {
        Map<String, Object> result = new HashMap<>();
        result.put("code", 200);
        result.put("message", "成功");
        result.put("success", true);
        result.put("data", data);
        return result;
    }

    static Map<String, Object> fail(int code, String message) {
        Map<String, Object> result = new HashMap<>();
        result.put("code", code);
        result.put("message", message);
        result.put("success", false);
        return result;
    }

    static Map<String, Object> fail(LedgerException e) {
        Map<String, Object> result = fail(e.errorCode().status(), e.getMessage());
        result.put("error", e.errorCode().name());
        result.put("description", e.errorCode().description());
        return result;
    }

    static Map<String, Object> balance(AccountBalance balance) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("account", balance.account());
        data.put("margin", balance.margin().toPlainString());
        data.put("position", balance.position().toPlainString());
        data.put("marginE8", balance.marginE8());
        data.put("positionE8", balance.positionE8());
        return data;
    }

    /**
     * 解析请求中的十进制金额，缺失或格式错误返回 INVALID_AMOUNT。
     */
    static long amountE8(Map<String, Object> params, String key) {
        Object value = params == null ? null : params.get(key);
        if (value == null) {
            throw new LedgerException(ErrorCode.INVALID_AMOUNT, "缺少参数: " + key);
        }
        return ScaleConstants.toE8(value.toString());
    }

    static String string(Map<String, Object> params, String key) {
        Object value = params == null ? null : params.get(key);
        return value == null ? null : value.toString();
    }

    static boolean flag(Map<String, Object> params, String key) {
        Object value = params == null ? null : params.get(key);
        if (value == null) {
            throw new IllegalArgumentException("缺少参数: " + key);
        }
        return Boolean.parseBoolean(value.toString());
    }
}
