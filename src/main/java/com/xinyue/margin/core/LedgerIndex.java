package com.xinyue.margin.core;

/**
 * 全局账本索引：每次成功的余额类操作推进一次，随 INDEX_UPDATED 通知发出。
 * 只允许账本线程访问。
 */
final class LedgerIndex {

    private long value;
    private long timestamp;

    long advance(long now) {
        value++;
        // 时间戳单调不减，防止系统时钟回拨
        timestamp = Math.max(timestamp, now);
        return value;
    }

    long value() {
        return value;
    }

    long timestamp() {
        return timestamp;
    }
}
