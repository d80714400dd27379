package com.xinyue.margin.common;

import java.util.concurrent.CompletableFuture;

/**
 * 账本热路径中流转的请求载体。
 * <p>
 * 特性：
 * 1. 由 Disruptor 预分配并循环复用
 * 2. 联合体模式：一个对象复用于入金、出金、成交结算、授权变更和查询
 * 3. 公有字段：生产者直接填充，消费者（唯一的账本线程）直接读取
 */
public final class LedgerEvent {

    // === 元数据 ===
    public LedgerEventType type = LedgerEventType.NONE;    // 请求类型
    public long submitTime;         // 生产者提交时间

    // === 身份 ===
    public String owner;            // 目标账户（成交结算时为买方）
    public String caller;           // 调用方（入金时为付款方）
    public String counterparty;     // 出金目的地 / 成交卖方 / 被授权的操作员

    // === 数值 ===
    public long amountE8;           // 金额（放大 1e8）
    public long positionE8;         // 成交仓位数量（放大 1e8）
    public boolean enabled;         // 授权开关

    // === 回执 ===
    // 由账本线程完成；失败时以 LedgerException 异常完成
    public CompletableFuture<Object> reply;

    /**
     * 账本线程处理完后调用，防止复用时读到上一次的脏数据。
     */
    public void reset() {
        type = LedgerEventType.NONE;
        submitTime = 0;
        owner = null;
        caller = null;
        counterparty = null;
        amountE8 = 0;
        positionE8 = 0;
        enabled = false;
        reply = null;
    }
}
