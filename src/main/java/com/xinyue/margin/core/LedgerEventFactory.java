package com.xinyue.margin.core;

import com.lmax.disruptor.EventFactory;
import com.xinyue.margin.common.LedgerEvent;

public final class LedgerEventFactory implements EventFactory<LedgerEvent> {
    @Override
    public LedgerEvent newInstance() {
        return new LedgerEvent();
    }
}
