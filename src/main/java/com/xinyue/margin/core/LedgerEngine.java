package com.xinyue.margin.core;

import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.xinyue.margin.common.LedgerEvent;
import com.xinyue.margin.common.LedgerEventType;
import com.xinyue.margin.common.ScaleConstants;
import com.xinyue.margin.config.LedgerConfig;
import com.xinyue.margin.core.account.AccountBalance;
import com.xinyue.margin.core.account.AccountLedger;
import com.xinyue.margin.core.account.LedgerSnapshot;
import com.xinyue.margin.core.auth.AuthorizationModel;
import com.xinyue.margin.core.gateway.EventSink;
import com.xinyue.margin.core.gateway.PriceOracle;
import com.xinyue.margin.core.gateway.RetryingPriceOracle;
import com.xinyue.margin.core.gateway.RetryingTransferGateway;
import com.xinyue.margin.core.gateway.TransferGateway;
import com.xinyue.margin.core.risk.CollateralizationEngine;
import com.xinyue.margin.exception.LedgerException;
import com.xinyue.margin.infra.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 账本对外入口。
 * <p>
 * 所有请求都写入 Disruptor 环形队列，由 {@link LedgerEventHandler} 单线程处理，
 * 调用方拿到 CompletableFuture（*Async 方法）或同步等待结果。
 * 失败统一以 {@link LedgerException} 抛出。
 */
public final class LedgerEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(LedgerEngine.class);

    private final Disruptor<LedgerEvent> disruptor;
    private final RingBuffer<LedgerEvent> ringBuffer;
    private final LedgerEventHandler handler;
    // 提交持读锁、启停持写锁：close 返回后不会再有事件进入已停止的环形队列
    private final ReentrantReadWriteLock lifecycleLock = new ReentrantReadWriteLock();
    private boolean running;

    public LedgerEngine(LedgerConfig config,
                        TransferGateway transferGateway,
                        PriceOracle priceOracle,
                        EventSink eventSink,
                        MetricsService metricsService) {
        AuthorizationModel authorization = new AuthorizationModel();
        // 启动前写入，此时账本线程尚未运行
        for (String operator : config.globalOperators) {
            authorization.setGlobalOperator(operator, true);
        }
        this.handler = new LedgerEventHandler(
                new AccountLedger(),
                authorization,
                new CollateralizationEngine(config.minCollateral),
                new RetryingTransferGateway(transferGateway, config.retryMaxAttempts, config.retryBackoffMs),
                new RetryingPriceOracle(priceOracle, config.retryMaxAttempts, config.retryBackoffMs),
                eventSink,
                metricsService,
                config.verifyEveryOperation
        );
        this.disruptor = bootstrapDisruptor(new LedgerEventFactory(), handler, config.ringBufferSize, ledgerThreadFactory());
        this.ringBuffer = disruptor.getRingBuffer();
    }

    public static Disruptor<LedgerEvent> bootstrapDisruptor(LedgerEventFactory factory,
                                                            EventHandler<LedgerEvent> handler,
                                                            int ringBufferSize,
                                                            ThreadFactory threadFactory) {
        Disruptor<LedgerEvent> disruptor = new Disruptor<LedgerEvent>(factory, ringBufferSize, threadFactory);
        disruptor.handleEventsWith(handler);
        return disruptor;
    }

    public LedgerEngine start() {
        lifecycleLock.writeLock().lock();
        try {
            if (!running) {
                disruptor.start();
                running = true;
                LOG.info("账本引擎已启动, ringBufferSize={}", ringBuffer.getBufferSize());
            }
            return this;
        } finally {
            lifecycleLock.writeLock().unlock();
        }
    }

    /**
     * 处理完队列中已提交的请求后停止账本线程。
     */
    @Override
    public void close() {
        lifecycleLock.writeLock().lock();
        try {
            if (running) {
                running = false;
                disruptor.shutdown();
                LOG.info("账本引擎已停止");
            }
        } finally {
            lifecycleLock.writeLock().unlock();
        }
    }

    public boolean isHalted() {
        return handler.isHalted();
    }

    public String haltReason() {
        return handler.haltReason();
    }

    // === 变更 ===

    /**
     * 由账户所有者本人入金。
     */
    public LedgerReceipt deposit(String owner, long amountE8) {
        return deposit(owner, amountE8, owner);
    }

    /**
     * 入金到 owner 账户，资产由 payer 支付。任何人都可以为任意账户入金。
     */
    public LedgerReceipt deposit(String owner, long amountE8, String payer) {
        return await(depositAsync(owner, amountE8, payer));
    }

    public CompletableFuture<LedgerReceipt> depositAsync(String owner, long amountE8, String payer) {
        return submit(LedgerEventType.DEPOSIT, owner, payer, null, amountE8, 0, false)
                .thenApply(LedgerReceipt.class::cast);
    }

    /**
     * 从 owner 账户出金到 owner 本人。
     */
    public LedgerReceipt withdraw(String owner, long amountE8, String caller) {
        return await(withdrawAsync(owner, null, amountE8, caller));
    }

    /**
     * 从 owner 账户出金到指定目的地。
     */
    public LedgerReceipt withdraw(String owner, String destination, long amountE8, String caller) {
        return await(withdrawAsync(owner, destination, amountE8, caller));
    }

    public CompletableFuture<LedgerReceipt> withdrawAsync(String owner, String destination, long amountE8, String caller) {
        return submit(LedgerEventType.WITHDRAW, owner, caller, destination, amountE8, 0, false)
                .thenApply(LedgerReceipt.class::cast);
    }

    /**
     * 撮合引擎提交的成交结算：买方仓位 +positionE8、保证金 -marginE8，卖方相反。
     */
    public TradeReceipt settleTrade(String buyer, String seller, long positionE8, long marginE8) {
        return await(settleTradeAsync(buyer, seller, positionE8, marginE8));
    }

    public CompletableFuture<TradeReceipt> settleTradeAsync(String buyer, String seller, long positionE8, long marginE8) {
        return submit(LedgerEventType.SETTLE_TRADE, buyer, null, seller, marginE8, positionE8, false)
                .thenApply(TradeReceipt.class::cast);
    }

    /**
     * 设置全局操作员。管理员身份校验由上层负责。
     */
    public void setGlobalOperator(String operator, boolean enabled) {
        await(submit(LedgerEventType.SET_GLOBAL_OPERATOR, null, null, operator, 0, 0, enabled));
    }

    /**
     * 账户所有者设置自己的本地操作员。owner 即调用方本人。
     */
    public void setLocalOperator(String owner, String operator, boolean enabled) {
        await(submit(LedgerEventType.SET_LOCAL_OPERATOR, owner, owner, operator, 0, 0, enabled));
    }

    // === 查询 ===

    public AccountBalance getAccountBalance(String owner) {
        return await(submit(LedgerEventType.QUERY_BALANCE, owner, null, null, 0, 0, false)
                .thenApply(AccountBalance.class::cast));
    }

    public long getTotalMarginE8() {
        return await(submit(LedgerEventType.QUERY_TOTAL_MARGIN, null, null, null, 0, 0, false)
                .thenApply(Long.class::cast));
    }

    public BigDecimal getTotalMargin() {
        return ScaleConstants.fromE8(getTotalMarginE8());
    }

    /**
     * 所有账户余额与总保证金的一致性快照。
     */
    public LedgerSnapshot snapshot() {
        return await(submit(LedgerEventType.QUERY_SNAPSHOT, null, null, null, 0, 0, false)
                .thenApply(LedgerSnapshot.class::cast));
    }

    public boolean isGlobalOperator(String operator) {
        return await(submit(LedgerEventType.QUERY_GLOBAL_OPERATOR, null, null, operator, 0, 0, false)
                .thenApply(Boolean.class::cast));
    }

    public boolean isLocalOperator(String owner, String operator) {
        return await(submit(LedgerEventType.QUERY_LOCAL_OPERATOR, owner, null, operator, 0, 0, false)
                .thenApply(Boolean.class::cast));
    }

    private CompletableFuture<Object> submit(LedgerEventType type,
                                             String owner,
                                             String caller,
                                             String counterparty,
                                             long amountE8,
                                             long positionE8,
                                             boolean enabled) {
        lifecycleLock.readLock().lock();
        try {
            if (!running) {
                throw new IllegalStateException("账本引擎未启动或已停止");
            }
            CompletableFuture<Object> reply = new CompletableFuture<>();
            long seq = ringBuffer.next();
            try {
                LedgerEvent event = ringBuffer.get(seq);
                event.type = type;
                event.submitTime = System.nanoTime();
                event.owner = owner;
                event.caller = caller;
                event.counterparty = counterparty;
                event.amountE8 = amountE8;
                event.positionE8 = positionE8;
                event.enabled = enabled;
                event.reply = reply;
            } finally {
                ringBuffer.publish(seq);
            }
            return reply;
        } finally {
            lifecycleLock.readLock().unlock();
        }
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof LedgerException ledgerException) {
                throw ledgerException;
            }
            throw e;
        }
    }

    private static ThreadFactory ledgerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "ledger-core-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }
}
