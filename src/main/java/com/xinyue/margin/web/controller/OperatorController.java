package com.xinyue.margin.web.controller;

import com.xinyue.margin.core.LedgerEngine;
import com.xinyue.margin.exception.ErrorCode;
import com.xinyue.margin.exception.LedgerException;
import com.xinyue.margin.web.context.AppContext;
import org.noear.solon.annotation.Body;
import org.noear.solon.annotation.Controller;
import org.noear.solon.annotation.Get;
import org.noear.solon.annotation.Header;
import org.noear.solon.annotation.Inject;
import org.noear.solon.annotation.Mapping;
import org.noear.solon.annotation.Param;
import org.noear.solon.annotation.Post;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 出金授权管理接口。
 */
@Controller
@Mapping("/api/operators")
public class OperatorController {

    @Inject
    private AppContext appContext;

    public OperatorController() {
    }

    OperatorController(AppContext appContext) {
        this.appContext = appContext;
    }

    /**
     * 设置全局操作员，只有现任全局操作员可以调用（初始名单来自配置 operator.global.N）。
     * POST /api/operators/global
     * <p>
     * 请求体：{"operator": "ops", "enabled": true}
     */
    @Post
    @Mapping("/global")
    public Map<String, Object> setGlobal(@Header(MarginController.CALLER_HEADER) String caller,
                                         @Body Map<String, Object> params) {
        return MarginController.handle("设置全局操作员", () -> {
            if (caller == null || !engine().isGlobalOperator(caller)) {
                throw new LedgerException(ErrorCode.UNAUTHORIZED, "只有全局操作员可以修改全局授权: " + caller);
            }
            String operator = ApiResponse.string(params, "operator");
            boolean enabled = ApiResponse.flag(params, "enabled");
            engine().setGlobalOperator(operator, enabled);
            return grant(null, operator, enabled);
        });
    }

    /**
     * 调用方为自己的账户设置本地操作员。
     * POST /api/operators/local
     * <p>
     * 请求体：{"operator": "bot", "enabled": true}
     */
    @Post
    @Mapping("/local")
    public Map<String, Object> setLocal(@Header(MarginController.CALLER_HEADER) String caller,
                                        @Body Map<String, Object> params) {
        return MarginController.handle("设置本地操作员", () -> {
            String operator = ApiResponse.string(params, "operator");
            boolean enabled = ApiResponse.flag(params, "enabled");
            engine().setLocalOperator(caller, operator, enabled);
            return grant(caller, operator, enabled);
        });
    }

    /**
     * GET /api/operators/global?operator=ops
     */
    @Get
    @Mapping("/global")
    public Map<String, Object> isGlobal(@Param("operator") String operator) {
        return MarginController.handle("查询全局操作员",
                () -> grant(null, operator, engine().isGlobalOperator(operator)));
    }

    /**
     * GET /api/operators/local?owner=alice&amp;operator=bot
     */
    @Get
    @Mapping("/local")
    public Map<String, Object> isLocal(@Param("owner") String owner, @Param("operator") String operator) {
        return MarginController.handle("查询本地操作员",
                () -> grant(owner, operator, engine().isLocalOperator(owner, operator)));
    }

    private LedgerEngine engine() {
        return appContext.getLedgerEngine();
    }

    private static Map<String, Object> grant(String owner, String operator, boolean enabled) {
        Map<String, Object> data = new LinkedHashMap<>();
        if (owner != null) {
            data.put("owner", owner);
        }
        data.put("operator", operator);
        data.put("enabled", enabled);
        return data;
    }
}
