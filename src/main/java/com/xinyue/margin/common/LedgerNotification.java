package com.xinyue.margin.common;

/**
 * 推送给 EventSink 的状态变更通知。
 *
 * @param index        账本索引（每次成功的余额类操作递增）
 * @param type         通知类型
 * @param account      主账户（入金/出金账户、成交买方、被授权的操作员）
 * @param counterparty 对手方（成交卖方、本地授权的账户所有者），可为 null
 * @param amountE8     金额（放大 1e8）
 * @param positionE8   成交仓位数量（放大 1e8）
 * @param enabled      授权开关，仅授权类通知有意义
 * @param timestamp    索引更新时间（毫秒）
 */
public record LedgerNotification(long index,
                                 NotificationType type,
                                 String account,
                                 String counterparty,
                                 long amountE8,
                                 long positionE8,
                                 boolean enabled,
                                 long timestamp) {

    public static LedgerNotification indexUpdated(long index, String account, long amountE8, long timestamp) {
        return new LedgerNotification(index, NotificationType.INDEX_UPDATED, account, null, amountE8, 0, false, timestamp);
    }

    public static LedgerNotification deposit(long index, String account, long amountE8, long timestamp) {
        return new LedgerNotification(index, NotificationType.DEPOSIT, account, null, amountE8, 0, false, timestamp);
    }

    public static LedgerNotification withdrawal(long index, String account, long amountE8, long timestamp) {
        return new LedgerNotification(index, NotificationType.WITHDRAWAL, account, null, amountE8, 0, false, timestamp);
    }

    public static LedgerNotification trade(long index, String buyer, String seller,
                                           long marginE8, long positionE8, long timestamp) {
        return new LedgerNotification(index, NotificationType.TRADE, buyer, seller, marginE8, positionE8, false, timestamp);
    }

    public static LedgerNotification globalOperatorSet(long index, String operator, boolean enabled, long timestamp) {
        return new LedgerNotification(index, NotificationType.GLOBAL_OPERATOR_SET, operator, null, 0, 0, enabled, timestamp);
    }

    public static LedgerNotification localOperatorSet(long index, String owner, String operator,
                                                      boolean enabled, long timestamp) {
        return new LedgerNotification(index, NotificationType.LOCAL_OPERATOR_SET, operator, owner, 0, 0, enabled, timestamp);
    }
}
