package com.xinyue.margin.core.gateway;

import com.xinyue.margin.common.LedgerNotification;

/**
 * 状态变更通知的接收方。账本只负责按顺序推送，不控制投递。
 */
public interface EventSink {

    void publish(LedgerNotification notification);
}
