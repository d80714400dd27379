package com.xinyue.margin.infra;

import com.xinyue.margin.common.LedgerNotification;
import com.xinyue.margin.core.gateway.EventSink;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("通知接收方")
class EventSinkTest {

    @Test
    @DisplayName("内存接收方只保留最近 capacity 条")
    void recordingSinkIsBounded() {
        RecordingEventSink sink = new RecordingEventSink(2);
        sink.publish(LedgerNotification.deposit(1, "alice", 1, 0));
        sink.publish(LedgerNotification.deposit(2, "alice", 2, 0));
        sink.publish(LedgerNotification.deposit(3, "alice", 3, 0));

        List<LedgerNotification> events = sink.events();
        assertEquals(2, events.size());
        assertEquals(2, events.get(0).index());
        assertEquals(3, events.get(1).index());

        sink.clear();
        assertTrue(sink.events().isEmpty());
    }

    @Test
    @DisplayName("组合接收方：单个失败不影响其余接收方，异常在最后抛出")
    void compositeContinuesAfterFailure() {
        RecordingEventSink first = new RecordingEventSink(10);
        EventSink broken = notification -> {
            throw new IllegalStateException("db down");
        };
        RecordingEventSink last = new RecordingEventSink(10);
        CompositeEventSink composite = new CompositeEventSink(List.of(first, broken, last));

        assertThrows(IllegalStateException.class,
                () -> composite.publish(LedgerNotification.withdrawal(1, "alice", 5, 0)));
        assertEquals(1, first.events().size());
        assertEquals(1, last.events().size());
    }
}
