package com.xinyue.margin.web.controller;

import com.xinyue.margin.config.LedgerConfig;
import com.xinyue.margin.web.context.AppContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 直接调用控制器方法，验证请求解析与统一响应结构，不启动 HTTP 服务。
 */
@DisplayName("保证金与授权接口")
class MarginControllerTest {

    private AppContext appContext;
    private MarginController margin;
    private OperatorController operators;
    private HealthController health;

    @BeforeEach
    void setUp() {
        Properties props = new Properties();
        props.setProperty("oracle.fixedPrice", "100");
        props.setProperty("ledger.retry.backoffMs", "0");
        props.setProperty("operator.global.1", "matcher");
        props.setProperty("custody.mint.1", "alice,1000");
        props.setProperty("custody.mint.2", "bob,1000");
        appContext = new AppContext();
        appContext.init(LedgerConfig.fromProperties(props));

        margin = new MarginController(appContext);
        operators = new OperatorController(appContext);
        health = new HealthController(appContext);
    }

    @AfterEach
    void tearDown() {
        appContext.shutdown();
    }

    private static Map<String, Object> body(Object... kv) {
        Map<String, Object> params = new HashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            params.put((String) kv[i], kv[i + 1]);
        }
        return params;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> data(Map<String, Object> response) {
        assertEquals(true, response.get("success"), String.valueOf(response));
        assertEquals(200, response.get("code"));
        return (Map<String, Object>) response.get("data");
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> balanceOf(Map<String, Object> data) {
        return (Map<String, Object>) data.get("balance");
    }

    @Test
    @DisplayName("入金后查询余额与总保证金")
    void depositThenQuery() {
        Map<String, Object> deposit = data(margin.deposit("bob", body("owner", "alice", "amount", "150.5")));

        assertEquals(1L, deposit.get("index"));
        assertEquals("150.50000000", balanceOf(deposit).get("margin"));

        Map<String, Object> balance = data(margin.balance("alice"));
        assertEquals(15_050_000_000L, balance.get("marginE8"));
        assertEquals("0.00000000", balance.get("position"));

        Map<String, Object> total = data(margin.total());
        assertEquals("150.50000000", total.get("totalMargin"));
        assertEquals(84_950_000_000L, appContext.getCustody().balanceOf("bob"));
    }

    @Test
    @DisplayName("数字类型金额同样可以解析")
    void numericAmount() {
        Map<String, Object> deposit = data(margin.deposit("alice", body("owner", "alice", "amount", 10)));

        assertEquals("10.00000000", deposit.get("amount"));
    }

    @Test
    @DisplayName("金额格式错误返回 400 与错误码")
    void invalidAmount() {
        Map<String, Object> response = margin.deposit("alice", body("owner", "alice", "amount", "1.000000001"));

        assertEquals(false, response.get("success"));
        assertEquals(400, response.get("code"));
        assertEquals("INVALID_AMOUNT", response.get("error"));

        Map<String, Object> missing = margin.deposit("alice", body("owner", "alice"));
        assertEquals("INVALID_AMOUNT", missing.get("error"));
    }

    @Test
    @DisplayName("未授权出金返回 401，授予本地操作员后成功")
    void withdrawAuthorization() {
        data(margin.deposit("alice", body("owner", "alice", "amount", "100")));

        Map<String, Object> denied = margin.withdraw("bob", body("owner", "alice", "amount", "10"));
        assertEquals(401, denied.get("code"));
        assertEquals("UNAUTHORIZED", denied.get("error"));

        data(operators.setLocal("alice", body("operator", "bob", "enabled", true)));
        assertEquals(true, data(operators.isLocal("alice", "bob")).get("enabled"));

        Map<String, Object> withdrawn = data(margin.withdraw("bob",
                body("owner", "alice", "amount", "10", "destination", "bob")));
        assertEquals("90.00000000", balanceOf(withdrawn).get("margin"));
        assertEquals(101_000_000_000L, appContext.getCustody().balanceOf("bob"));
    }

    @Test
    @DisplayName("缺少 X-Caller 的出金返回 INVALID_IDENTITY")
    void missingCaller() {
        Map<String, Object> response = margin.withdraw(null, body("owner", "alice", "amount", "1"));

        assertEquals("INVALID_IDENTITY", response.get("error"));
    }

    @Test
    @DisplayName("成交结算只允许全局操作员提交")
    @SuppressWarnings("unchecked")
    void tradeRequiresGlobalOperator() {
        data(margin.deposit("alice", body("owner", "alice", "amount", "850")));
        data(margin.deposit("bob", body("owner", "bob", "amount", "850")));
        Map<String, Object> trade = body("buyer", "bob", "seller", "alice", "position", "10", "margin", "250");

        assertEquals("UNAUTHORIZED", margin.trade("alice", trade).get("error"));

        Map<String, Object> settled = data(margin.trade("matcher", trade));
        Map<String, Object> seller = (Map<String, Object>) settled.get("seller");
        assertEquals("1100.00000000", seller.get("margin"));
        assertEquals("-10.00000000", seller.get("position"));

        Map<String, Object> undercollateralized = margin.withdraw("alice", body("owner", "alice", "amount", "100.00000001"));
        assertEquals(422, undercollateralized.get("code"));

        Map<String, Object> snapshot = data(margin.snapshot());
        assertEquals(2, ((List<Object>) snapshot.get("accounts")).size());
    }

    @Test
    @DisplayName("全局操作员管理")
    void globalOperators() {
        assertEquals("UNAUTHORIZED", operators.setGlobal("alice", body("operator", "alice", "enabled", true)).get("error"));

        data(operators.setGlobal("matcher", body("operator", "ops", "enabled", true)));
        assertEquals(true, data(operators.isGlobal("ops")).get("enabled"));
        assertEquals(400, operators.setGlobal("matcher", body("operator", "ops")).get("code"));
    }

    @Test
    @DisplayName("健康检查包含熔断状态与计数")
    @SuppressWarnings("unchecked")
    void healthReportsMetrics() {
        data(margin.deposit("alice", body("owner", "alice", "amount", "1")));

        Map<String, Object> result = health.health();
        assertEquals("UP", result.get("status"));
        assertEquals(1L, ((Map<String, Long>) result.get("metrics")).get("deposits"));
    }
}
