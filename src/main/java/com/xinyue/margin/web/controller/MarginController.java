package com.xinyue.margin.web.controller;

import com.xinyue.margin.common.ScaleConstants;
import com.xinyue.margin.core.LedgerEngine;
import com.xinyue.margin.core.LedgerReceipt;
import com.xinyue.margin.core.TradeReceipt;
import com.xinyue.margin.core.account.AccountBalance;
import com.xinyue.margin.core.account.LedgerSnapshot;
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * 保证金账户接口：入金、出金、成交结算与余额查询。
 * <p>
 * 调用方身份通过请求头 X-Caller 传入，身份认证由网关层负责。
 */
@Controller
@Mapping("/api/margin")
public class MarginController {

    private static final Logger LOG = LoggerFactory.getLogger(MarginController.class);

    static final String CALLER_HEADER = "X-Caller";

    @Inject
    private AppContext appContext;

    public MarginController() {
    }

    MarginController(AppContext appContext) {
        this.appContext = appContext;
    }

    /**
     * 入金。
     * POST /api/margin/deposit
     * <p>
     * 请求体：{"owner": "alice", "amount": "100.5"}，资产由 X-Caller 支付。
     */
    @Post
    @Mapping("/deposit")
    public Map<String, Object> deposit(@Header(CALLER_HEADER) String caller,
                                       @Body Map<String, Object> params) {
        return handle("入金", () -> {
            String owner = ApiResponse.string(params, "owner");
            long amountE8 = ApiResponse.amountE8(params, "amount");
            return receipt(engine().deposit(owner, amountE8, caller));
        });
    }

    /**
     * 出金。
     * POST /api/margin/withdraw
     * <p>
     * 请求体：{"owner": "alice", "amount": "10", "destination": "bob"}，destination 缺省为 owner。
     */
    @Post
    @Mapping("/withdraw")
    public Map<String, Object> withdraw(@Header(CALLER_HEADER) String caller,
                                        @Body Map<String, Object> params) {
        return handle("出金", () -> {
            String owner = ApiResponse.string(params, "owner");
            String destination = ApiResponse.string(params, "destination");
            long amountE8 = ApiResponse.amountE8(params, "amount");
            return receipt(engine().withdraw(owner, destination, amountE8, caller));
        });
    }

    /**
     * 成交结算，仅限全局操作员（撮合引擎）调用。
     * POST /api/margin/trade
     * <p>
     * 请求体：{"buyer": "alice", "seller": "bob", "position": "1", "margin": "100"}
     */
    @Post
    @Mapping("/trade")
    public Map<String, Object> trade(@Header(CALLER_HEADER) String caller,
                                     @Body Map<String, Object> params) {
        return handle("成交结算", () -> {
            if (caller == null || !engine().isGlobalOperator(caller)) {
                throw new LedgerException(ErrorCode.UNAUTHORIZED, "只有全局操作员可以提交成交: " + caller);
            }
            String buyer = ApiResponse.string(params, "buyer");
            String seller = ApiResponse.string(params, "seller");
            long positionE8 = ApiResponse.amountE8(params, "position");
            long marginE8 = ApiResponse.amountE8(params, "margin");
            TradeReceipt receipt = engine().settleTrade(buyer, seller, positionE8, marginE8);
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("index", receipt.index());
            data.put("buyer", ApiResponse.balance(receipt.buyer()));
            data.put("seller", ApiResponse.balance(receipt.seller()));
            return data;
        });
    }

    /**
     * 查询账户余额。未出现过的账户返回零余额。
     * GET /api/margin/balance?account=alice
     */
    @Get
    @Mapping("/balance")
    public Map<String, Object> balance(@Param("account") String account) {
        return handle("查询余额", () -> ApiResponse.balance(engine().getAccountBalance(account)));
    }

    /**
     * 查询总保证金。
     * GET /api/margin/total
     */
    @Get
    @Mapping("/total")
    public Map<String, Object> total() {
        return handle("查询总保证金", () -> {
            long totalE8 = engine().getTotalMarginE8();
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("totalMargin", ScaleConstants.fromE8(totalE8).toPlainString());
            data.put("totalMarginE8", totalE8);
            return data;
        });
    }

    /**
     * 全量账户快照。
     * GET /api/margin/snapshot
     */
    @Get
    @Mapping("/snapshot")
    public Map<String, Object> snapshot() {
        return handle("查询快照", () -> {
            LedgerSnapshot snapshot = engine().snapshot();
            List<Map<String, Object>> accounts = new ArrayList<>();
            for (AccountBalance balance : snapshot.accounts().values()) {
                accounts.add(ApiResponse.balance(balance));
            }
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("index", snapshot.index());
            data.put("totalMarginE8", snapshot.totalMarginE8());
            data.put("accounts", accounts);
            return data;
        });
    }

    private LedgerEngine engine() {
        return appContext.getLedgerEngine();
    }

    private static Map<String, Object> receipt(LedgerReceipt receipt) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("index", receipt.index());
        data.put("amount", ScaleConstants.fromE8(receipt.amountE8()).toPlainString());
        data.put("balance", ApiResponse.balance(receipt.balance()));
        return data;
    }

    static Map<String, Object> handle(String action, Supplier<Object> body) {
        try {
            return ApiResponse.ok(body.get());
        } catch (LedgerException e) {
            LOG.warn("{}被拒绝: code={}, message={}", action, e.errorCode(), e.getMessage());
            return ApiResponse.fail(e);
        } catch (IllegalArgumentException e) {
            return ApiResponse.fail(400, e.getMessage());
        } catch (IllegalStateException e) {
            LOG.error("{}失败: 账本不可用", action, e);
            return ApiResponse.fail(503, e.getMessage());
        }
    }
}
