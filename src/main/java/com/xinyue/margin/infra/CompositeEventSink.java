package com.xinyue.margin.infra;

import com.xinyue.margin.common.LedgerNotification;
import com.xinyue.margin.core.gateway.EventSink;

import java.util.List;

/**
 * 按注册顺序将通知转发给多个接收方。某个接收方失败不影响其余接收方。
 */
public final class CompositeEventSink implements EventSink {

    private final List<EventSink> delegates;

    public CompositeEventSink(List<EventSink> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public void publish(LedgerNotification notification) {
        RuntimeException first = null;
        for (EventSink delegate : delegates) {
            try {
                delegate.publish(notification);
            } catch (RuntimeException e) {
                if (first == null) {
                    first = e;
                } else {
                    first.addSuppressed(e);
                }
            }
        }
        if (first != null) {
            throw first;
        }
    }
}
