package com.xinyue.margin.core;

import com.lmax.disruptor.EventHandler;
import com.xinyue.margin.common.Identities;
import com.xinyue.margin.common.LedgerEvent;
import com.xinyue.margin.common.LedgerNotification;
import com.xinyue.margin.core.account.AccountBalance;
import com.xinyue.margin.core.account.AccountLedger;
import com.xinyue.margin.core.account.TradePreview;
import com.xinyue.margin.core.auth.AuthorizationModel;
import com.xinyue.margin.core.auth.WithdrawGrant;
import com.xinyue.margin.core.gateway.EventSink;
import com.xinyue.margin.core.gateway.PriceOracle;
import com.xinyue.margin.core.gateway.TransferGateway;
import com.xinyue.margin.core.gateway.TransferResult;
import com.xinyue.margin.core.risk.CollateralizationEngine;
import com.xinyue.margin.exception.ErrorCode;
import com.xinyue.margin.exception.LedgerException;
import com.xinyue.margin.exception.PriceUnavailableException;
import com.xinyue.margin.infra.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;

/**
 * 账本唯一的写线程。
 * <p>
 * 所有请求（包括查询）都在这里串行执行，因此：
 * 1. 同一账户上的入金、出金、成交结算不会交错
 * 2. 查询只会看到已提交的状态
 * <p>
 * 每个变更请求按 "校验 -> 计算拟提交状态 -> 抵押率校验 -> 托管划转 -> 提交 -> 通知" 的顺序执行，
 * 提交之前的任何失败都不会改变账本。
 * 一旦发现内部不变量被破坏或出现未预期异常，立即熔断：之后的变更请求全部拒绝，查询照常。
 */
public final class LedgerEventHandler implements EventHandler<LedgerEvent> {

    private static final Logger LOG = LoggerFactory.getLogger(LedgerEventHandler.class);

    private static final long SLOW_QUEUE_NANOS = 1_000_000_000L;

    private final AccountLedger ledger;
    private final AuthorizationModel authorization;
    private final CollateralizationEngine collateralization;
    private final TransferGateway transferGateway;
    private final PriceOracle priceOracle;
    private final EventSink eventSink;
    private final MetricsService metricsService;
    private final boolean verifyEveryOperation;
    private final LedgerIndex index = new LedgerIndex();

    private volatile boolean halted;
    private volatile String haltReason;

    public LedgerEventHandler(AccountLedger ledger,
                              AuthorizationModel authorization,
                              CollateralizationEngine collateralization,
                              TransferGateway transferGateway,
                              PriceOracle priceOracle,
                              EventSink eventSink,
                              MetricsService metricsService,
                              boolean verifyEveryOperation) {
        this.ledger = ledger;
        this.authorization = authorization;
        this.collateralization = collateralization;
        this.transferGateway = transferGateway;
        this.priceOracle = priceOracle;
        this.eventSink = eventSink;
        this.metricsService = metricsService;
        this.verifyEveryOperation = verifyEveryOperation;
    }

    @Override
    public void onEvent(LedgerEvent event, long sequence, boolean endOfBatch) {
        CompletableFuture<Object> reply = event.reply;
        long queuedNanos = System.nanoTime() - event.submitTime;
        if (queuedNanos > SLOW_QUEUE_NANOS) {
            LOG.warn("{} 在队列中等待 {}ms, sequence={}", event.type, queuedNanos / 1_000_000, sequence);
        }
        try {
            if (event.type.mutating() && halted) {
                throw new LedgerException(ErrorCode.LEDGER_HALTED, "账本已熔断: " + haltReason);
            }
            Object result = switch (event.type) {
                case DEPOSIT -> handleDeposit(event);
                case WITHDRAW -> handleWithdraw(event);
                case SETTLE_TRADE -> handleTrade(event);
                case SET_GLOBAL_OPERATOR -> handleSetGlobalOperator(event);
                case SET_LOCAL_OPERATOR -> handleSetLocalOperator(event);
                case QUERY_BALANCE -> ledger.balanceOf(Identities.require(event.owner, "owner"));
                case QUERY_TOTAL_MARGIN -> ledger.totalMarginE8();
                case QUERY_SNAPSHOT -> ledger.snapshot(index.value());
                case QUERY_GLOBAL_OPERATOR -> authorization.isGlobalOperator(event.counterparty);
                case QUERY_LOCAL_OPERATOR -> authorization.isLocalOperator(event.owner, event.counterparty);
                case NONE -> throw new IllegalStateException("未填充类型的账本事件, sequence=" + sequence);
            };
            if (reply != null) {
                reply.complete(result);
            }
        } catch (LedgerException e) {
            metricsService.recordRejection(e.errorCode());
            if (e.errorCode() == ErrorCode.INTERNAL_INVARIANT_VIOLATION) {
                killSwitch(e.getMessage());
            } else {
                LOG.warn("{} 被拒绝: owner={}, caller={}, amountE8={}, code={}, reason={}",
                        event.type, event.owner, event.caller, event.amountE8, e.errorCode(), e.getMessage());
            }
            if (reply != null) {
                reply.completeExceptionally(e);
            }
        } catch (Throwable t) {
            LOG.error("处理 {} 时发生未预期异常, sequence={}", event.type, sequence, t);
            killSwitch("处理 " + event.type + " 时发生未预期异常: " + t);
            metricsService.recordRejection(ErrorCode.INTERNAL_INVARIANT_VIOLATION);
            if (reply != null) {
                reply.completeExceptionally(new LedgerException(ErrorCode.INTERNAL_INVARIANT_VIOLATION,
                        "账本内部错误，已熔断", t));
            }
        } finally {
            event.reset();
        }
    }

    public boolean isHalted() {
        return halted;
    }

    public String haltReason() {
        return haltReason;
    }

    private LedgerReceipt handleDeposit(LedgerEvent event) {
        String owner = Identities.require(event.owner, "owner");
        String payer = Identities.require(event.caller, "payer");
        long amountE8 = event.amountE8;

        AccountBalance postState = ledger.previewDeposit(owner, amountE8);
        TransferResult transfer = pull(payer, amountE8);
        if (!transfer.isSuccess()) {
            throw new LedgerException(ErrorCode.TRANSFER_FAILED,
                    "从 " + payer + " 拉取 " + amountE8 + " 失败: " + transfer);
        }

        ledger.commit(postState);
        verifyAfterCommit();
        long idx = index.advance(System.currentTimeMillis());
        publish(LedgerNotification.indexUpdated(idx, owner, amountE8, index.timestamp()));
        publish(LedgerNotification.deposit(idx, owner, amountE8, index.timestamp()));
        metricsService.recordDeposit(amountE8);
        LOG.info("入金成功: owner={}, payer={}, amountE8={}, marginE8={}, index={}",
                owner, payer, amountE8, postState.marginE8(), idx);
        return new LedgerReceipt(idx, owner, amountE8, postState);
    }

    private LedgerReceipt handleWithdraw(LedgerEvent event) {
        String owner = Identities.require(event.owner, "owner");
        String caller = Identities.require(event.caller, "caller");
        String destination = event.counterparty != null ? Identities.require(event.counterparty, "destination") : owner;
        long amountE8 = event.amountE8;
        if (amountE8 < 0) {
            throw new LedgerException(ErrorCode.INVALID_AMOUNT, "金额不能为负: " + amountE8);
        }

        WithdrawGrant grant = authorization.grantFor(owner, caller);
        if (!grant.permitted()) {
            throw new LedgerException(ErrorCode.UNAUTHORIZED,
                    "调用方 " + caller + " 没有代账户 " + owner + " 出金的权限");
        }

        AccountBalance postState = ledger.previewWithdraw(owner, amountE8);
        if (postState.hasPosition()) {
            long priceE8 = currentPrice();
            if (!collateralization.isCollateralized(postState, priceE8)) {
                throw new LedgerException(ErrorCode.UNDERCOLLATERALIZED,
                        "出金后账户 " + owner + " 抵押不足: marginE8=" + postState.marginE8()
                                + ", positionE8=" + postState.positionE8() + ", priceE8=" + priceE8
                                + ", equity=" + collateralization.equity(postState.marginE8(), postState.positionE8(), priceE8).toPlainString());
            }
        }

        TransferResult transfer = push(destination, amountE8);
        if (!transfer.isSuccess()) {
            throw new LedgerException(ErrorCode.TRANSFER_FAILED,
                    "向 " + destination + " 推送 " + amountE8 + " 失败: " + transfer);
        }

        ledger.commit(postState);
        verifyAfterCommit();
        long idx = index.advance(System.currentTimeMillis());
        publish(LedgerNotification.indexUpdated(idx, owner, amountE8, index.timestamp()));
        publish(LedgerNotification.withdrawal(idx, owner, amountE8, index.timestamp()));
        metricsService.recordWithdrawal(amountE8);
        LOG.info("出金成功: owner={}, caller={}, grant={}, destination={}, amountE8={}, marginE8={}, index={}",
                owner, caller, grant, destination, amountE8, postState.marginE8(), idx);
        return new LedgerReceipt(idx, owner, amountE8, postState);
    }

    private TradeReceipt handleTrade(LedgerEvent event) {
        String buyer = Identities.require(event.owner, "buyer");
        String seller = Identities.require(event.counterparty, "seller");
        if (buyer.equals(seller)) {
            throw new LedgerException(ErrorCode.INVALID_IDENTITY, "成交双方不能是同一账户: " + buyer);
        }

        TradePreview preview = ledger.previewTrade(buyer, seller, event.positionE8, event.amountE8);
        long priceE8 = currentPrice();
        requireSolvent(preview.buyer(), priceE8);
        requireSolvent(preview.seller(), priceE8);

        ledger.commit(preview);
        verifyAfterCommit();
        long idx = index.advance(System.currentTimeMillis());
        publish(LedgerNotification.indexUpdated(idx, buyer, event.amountE8, index.timestamp()));
        publish(LedgerNotification.trade(idx, buyer, seller, event.amountE8, event.positionE8, index.timestamp()));
        metricsService.recordTrade();
        LOG.info("成交结算成功: buyer={}, seller={}, positionE8={}, marginE8={}, priceE8={}, index={}",
                buyer, seller, event.positionE8, event.amountE8, priceE8, idx);
        return new TradeReceipt(idx, preview.buyer(), preview.seller());
    }

    private Boolean handleSetGlobalOperator(LedgerEvent event) {
        String operator = Identities.require(event.counterparty, "operator");
        authorization.setGlobalOperator(operator, event.enabled);
        publish(LedgerNotification.globalOperatorSet(index.value(), operator, event.enabled, System.currentTimeMillis()));
        metricsService.recordOperatorChange();
        LOG.info("全局操作员变更: operator={}, enabled={}", operator, event.enabled);
        return event.enabled;
    }

    private Boolean handleSetLocalOperator(LedgerEvent event) {
        String owner = Identities.require(event.owner, "owner");
        String operator = Identities.require(event.counterparty, "operator");
        authorization.setLocalOperator(owner, operator, event.enabled);
        publish(LedgerNotification.localOperatorSet(index.value(), owner, operator, event.enabled, System.currentTimeMillis()));
        metricsService.recordOperatorChange();
        LOG.info("本地操作员变更: owner={}, operator={}, enabled={}", owner, operator, event.enabled);
        return event.enabled;
    }

    /**
     * 成交后账户必须抵押充足；无仓位的账户保证金不能为负。
     */
    private void requireSolvent(AccountBalance postState, long priceE8) {
        boolean solvent = postState.hasPosition()
                ? collateralization.isCollateralized(postState, priceE8)
                : postState.marginE8() >= 0;
        if (!solvent) {
            throw new LedgerException(ErrorCode.UNDERCOLLATERALIZED,
                    "成交后账户 " + postState.account() + " 抵押不足: marginE8=" + postState.marginE8()
                            + ", positionE8=" + postState.positionE8() + ", priceE8=" + priceE8);
        }
    }

    private long currentPrice() {
        long priceE8;
        try {
            priceE8 = priceOracle.currentPriceE8();
        } catch (LedgerException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PriceUnavailableException("预言机调用异常: " + e.getMessage(), e);
        }
        if (priceE8 < 0) {
            throw new PriceUnavailableException("预言机返回负价格: " + priceE8);
        }
        return priceE8;
    }

    private TransferResult pull(String from, long amountE8) {
        try {
            return transferGateway.pull(from, amountE8);
        } catch (RuntimeException e) {
            throw new LedgerException(ErrorCode.TRANSFER_FAILED, "托管拉取异常: " + e.getMessage(), e);
        }
    }

    private TransferResult push(String to, long amountE8) {
        try {
            return transferGateway.push(to, amountE8);
        } catch (RuntimeException e) {
            throw new LedgerException(ErrorCode.TRANSFER_FAILED, "托管推送异常: " + e.getMessage(), e);
        }
    }

    private void verifyAfterCommit() {
        if (!verifyEveryOperation) {
            return;
        }
        ledger.verifyInvariants();
        OptionalLong custody = transferGateway.custodyBalanceE8();
        if (custody.isPresent() && custody.getAsLong() != ledger.totalMarginE8()) {
            throw new LedgerException(ErrorCode.INTERNAL_INVARIANT_VIOLATION,
                    "总保证金 " + ledger.totalMarginE8() + " 与托管余额 " + custody.getAsLong() + " 不一致");
        }
    }

    private void publish(LedgerNotification notification) {
        // 投递失败不回滚已提交的状态
        try {
            eventSink.publish(notification);
        } catch (RuntimeException e) {
            LOG.error("事件投递失败: {}", notification, e);
        }
    }

    private void killSwitch(String reason) {
        if (!halted) {
            haltReason = reason;
            halted = true;
            LOG.error("账本熔断，停止所有变更操作: {}", reason);
        }
    }
}
