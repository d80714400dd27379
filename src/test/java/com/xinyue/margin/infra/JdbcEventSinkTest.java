package com.xinyue.margin.infra;

import com.xinyue.margin.common.LedgerNotification;
import com.xinyue.margin.common.NotificationType;
import com.xinyue.margin.config.LedgerConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 使用 H2 内存库验证落库顺序与关闭时的剩余通知写出。
 */
@DisplayName("JDBC 事件落库")
class JdbcEventSinkTest {

    private String url;
    private Connection keepAlive;
    private JdbcEventSink sink;

    @BeforeEach
    void setUp() throws SQLException {
        url = "jdbc:h2:mem:ledger_" + System.nanoTime() + ";DB_CLOSE_DELAY=-1";
        // 保持一个连接，防止内存库在连接池关闭后被销毁
        keepAlive = DriverManager.getConnection(url, "sa", "");
        try (Statement st = keepAlive.createStatement()) {
            st.execute("CREATE TABLE ledger_event ("
                    + "id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
                    + "ledger_index BIGINT, event_type VARCHAR(32), account VARCHAR(64), counterparty VARCHAR(64), "
                    + "amount_e8 BIGINT, position_e8 BIGINT, enabled BOOLEAN, event_time TIMESTAMP)");
        }
        Properties props = new Properties();
        props.setProperty("sink.type", "jdbc");
        props.setProperty("sink.jdbc.url", url);
        props.setProperty("sink.jdbc.user", "sa");
        props.setProperty("sink.jdbc.password", "");
        sink = new JdbcEventSink(LedgerConfig.fromProperties(props));
    }

    @AfterEach
    void tearDown() throws SQLException {
        sink.shutdown();
        keepAlive.close();
    }

    @Test
    @DisplayName("关闭时写完未满批次的通知，落库顺序与发布顺序一致")
    void drainsQueueInOrderOnShutdown() throws SQLException {
        // 120 条：两个满批次加一个未满批次，未满批次只能靠关闭时写出
        for (long i = 1; i <= 60; i++) {
            sink.publish(LedgerNotification.indexUpdated(i, "alice", i, 1_700_000_000_000L));
            sink.publish(LedgerNotification.deposit(i, "alice", i, 1_700_000_000_000L));
        }
        sink.shutdown();

        List<String> rows = new ArrayList<>();
        try (Statement st = keepAlive.createStatement();
             ResultSet rs = st.executeQuery("SELECT ledger_index, event_type FROM ledger_event ORDER BY id")) {
            while (rs.next()) {
                rows.add(rs.getLong(1) + ":" + rs.getString(2));
            }
        }

        assertEquals(120, rows.size());
        for (int i = 0; i < 60; i++) {
            assertEquals((i + 1) + ":" + NotificationType.INDEX_UPDATED, rows.get(2 * i));
            assertEquals((i + 1) + ":" + NotificationType.DEPOSIT, rows.get(2 * i + 1));
        }
        assertEquals(new JdbcEventSink.Stats(120, 0, 0), sink.getStats());
    }

    @Test
    @DisplayName("成交通知的对手方与仓位落库，关闭后发布的通知被丢弃")
    void persistsTradeAndIgnoresLatePublish() throws SQLException {
        sink.publish(LedgerNotification.trade(3, "bob", "alice", 25_000_000_000L, 1_000_000_000L, 1_700_000_000_000L));
        sink.shutdown();
        sink.publish(LedgerNotification.deposit(4, "alice", 1, 1_700_000_000_000L));

        try (Statement st = keepAlive.createStatement();
             ResultSet rs = st.executeQuery("SELECT account, counterparty, amount_e8, position_e8 FROM ledger_event")) {
            assertTrue(rs.next());
            assertEquals("bob", rs.getString(1));
            assertEquals("alice", rs.getString(2));
            assertEquals(25_000_000_000L, rs.getLong(3));
            assertEquals(1_000_000_000L, rs.getLong(4));
            assertFalse(rs.next());
        }
    }
}
