package com.xinyue.margin.infra;

import com.xinyue.margin.common.LedgerNotification;
import com.xinyue.margin.core.gateway.EventSink;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * 内存中保留最近 capacity 条通知，超出后丢弃最旧的。供查询接口和测试使用。
 */
public final class RecordingEventSink implements EventSink {

    private final int capacity;
    private final ArrayDeque<LedgerNotification> buffer;

    public RecordingEventSink(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity 必须大于 0");
        }
        this.capacity = capacity;
        this.buffer = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    @Override
    public synchronized void publish(LedgerNotification notification) {
        if (buffer.size() == capacity) {
            buffer.pollFirst();
        }
        buffer.addLast(notification);
    }

    /**
     * 按发布顺序返回当前保留的通知副本。
     */
    public synchronized List<LedgerNotification> events() {
        return new ArrayList<>(buffer);
    }

    public synchronized void clear() {
        buffer.clear();
    }
}
