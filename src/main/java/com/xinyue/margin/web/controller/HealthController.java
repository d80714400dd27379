package com.xinyue.margin.web.controller;

import com.xinyue.margin.core.LedgerEngine;
import com.xinyue.margin.web.context.AppContext;
import org.noear.solon.annotation.Controller;
import org.noear.solon.annotation.Get;
import org.noear.solon.annotation.Inject;
import org.noear.solon.annotation.Mapping;

import java.util.HashMap;
import java.util.Map;

/**
 * 健康检查控制器。
 */
@Controller
public class HealthController {

    @Inject
    private AppContext appContext;

    public HealthController() {
    }

    HealthController(AppContext appContext) {
        this.appContext = appContext;
    }

    /**
     * 健康检查接口。账本熔断后 status 为 HALTED。
     * GET /health
     */
    @Get
    @Mapping("/health")
    public Map<String, Object> health() {
        LedgerEngine engine = appContext.getLedgerEngine();
        boolean halted = engine.isHalted();

        Map<String, Object> result = new HashMap<>();
        result.put("status", halted ? "HALTED" : "UP");
        result.put("timestamp", System.currentTimeMillis());
        if (halted) {
            result.put("haltReason", engine.haltReason());
        }
        result.put("metrics", appContext.getMetricsService().snapshot());
        return result;
    }
}
