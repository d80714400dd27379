package com.xinyue.margin.infra;

import com.xinyue.margin.common.LedgerNotification;
import com.xinyue.margin.common.NotificationType;
import com.xinyue.margin.config.LedgerConfig;
import com.xinyue.margin.core.gateway.EventSink;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 将账本通知异步批量写入数据库。
 * <p>
 * 账本线程只负责入队；单个写库线程按 FIFO 顺序取出并批量插入，保证落库顺序与账本序号一致。
 * 批量失败时按顺序逐条降级插入。
 */
public final class JdbcEventSink implements EventSink {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcEventSink.class);

    private static final int BATCH_SIZE = 50;
    private static final long BATCH_TIMEOUT_MS = 1000;

    // 停止标记，按引用比较；写库线程取到它即写完剩余通知并退出
    private static final LedgerNotification STOP =
            new LedgerNotification(-1, NotificationType.INDEX_UPDATED, "", null, 0, 0, false, 0);

    private final HikariDataSource dataSource;
    private final String insertSql;
    private final ExecutorService writer;
    private final BlockingQueue<LedgerNotification> queue = new LinkedBlockingQueue<>();
    private volatile boolean closed;

    private final AtomicLong totalInserted = new AtomicLong(0);
    private final AtomicLong totalFailed = new AtomicLong(0);

    public JdbcEventSink(LedgerConfig config) {
        if (config.sinkJdbcUrl == null || config.sinkJdbcUrl.isBlank()) {
            throw new IllegalArgumentException("sink.jdbc.url 未配置");
        }
        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(config.sinkJdbcUrl);
        hikari.setUsername(config.sinkJdbcUser);
        hikari.setPassword(config.sinkJdbcPassword);
        hikari.setMaximumPoolSize(2);
        hikari.setMinimumIdle(1);
        hikari.setConnectionTimeout(3000);
        hikari.setIdleTimeout(600000);
        hikari.setMaxLifetime(1800000);
        hikari.setAutoCommit(false);
        hikari.setPoolName("ledger-event-sink");
        this.dataSource = new HikariDataSource(hikari);

        this.insertSql = String.format(
                "INSERT INTO %s (ledger_index, event_type, account, counterparty, amount_e8, position_e8, enabled, event_time)"
                        + " VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
                config.sinkJdbcTable);

        this.writer = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "ledger-event-writer");
            t.setDaemon(true);
            return t;
        });
        startBatchProcessor();
        LOG.info("JDBC 事件落库已启用: table={}", config.sinkJdbcTable);
    }

    @Override
    public void publish(LedgerNotification notification) {
        if (closed) {
            LOG.warn("JDBC 事件落库已关闭，丢弃通知: {}", notification);
            return;
        }
        queue.offer(notification);
    }

    private void startBatchProcessor() {
        writer.submit(() -> {
            List<LedgerNotification> batch = new ArrayList<>(BATCH_SIZE);
            long lastFlushTime = System.currentTimeMillis();
            try {
                while (true) {
                    LedgerNotification next = queue.poll(10, TimeUnit.MILLISECONDS);
                    if (next == STOP) {
                        break;
                    }
                    if (next != null) {
                        batch.add(next);
                    }
                    long now = System.currentTimeMillis();
                    boolean full = batch.size() >= BATCH_SIZE;
                    boolean timedOut = !batch.isEmpty() && now - lastFlushTime >= BATCH_TIMEOUT_MS;
                    if (full || timedOut) {
                        insertBatch(batch);
                        batch.clear();
                        lastFlushTime = now;
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("写库线程被中断，写完剩余通知后退出");
            }
            // 停止标记之后仍可能有并发入队的通知，一并写完
            queue.drainTo(batch);
            batch.removeIf(record -> record == STOP);
            if (!batch.isEmpty()) {
                insertBatch(batch);
            }
        });
    }

    private void insertBatch(List<LedgerNotification> records) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(insertSql)) {
            for (LedgerNotification record : records) {
                bind(ps, record);
                ps.addBatch();
            }
            int[] results = ps.executeBatch();
            conn.commit();

            int successCount = 0;
            for (int result : results) {
                if (result > 0 || result == Statement.SUCCESS_NO_INFO) {
                    successCount++;
                }
            }
            totalInserted.addAndGet(successCount);
            if (successCount < records.size()) {
                totalFailed.addAndGet(records.size() - successCount);
                LOG.warn("批量落库部分失败: {} 条", records.size() - successCount);
            }
        } catch (SQLException e) {
            LOG.error("批量落库失败，降级为逐条插入: size={}", records.size(), e);
            for (LedgerNotification record : records) {
                insertSingle(record);
            }
        }
    }

    private void insertSingle(LedgerNotification record) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(insertSql)) {
            bind(ps, record);
            int rows = ps.executeUpdate();
            conn.commit();
            if (rows > 0) {
                totalInserted.incrementAndGet();
            } else {
                totalFailed.incrementAndGet();
            }
        } catch (SQLException e) {
            totalFailed.incrementAndGet();
            LOG.error("单条落库失败: index={}, type={}", record.index(), record.type(), e);
        }
    }

    private static void bind(PreparedStatement ps, LedgerNotification record) throws SQLException {
        ps.setLong(1, record.index());
        ps.setString(2, record.type().name());
        ps.setString(3, record.account());
        if (record.counterparty() != null) {
            ps.setString(4, record.counterparty());
        } else {
            ps.setNull(4, Types.VARCHAR);
        }
        ps.setLong(5, record.amountE8());
        ps.setLong(6, record.positionE8());
        ps.setBoolean(7, record.enabled());
        ps.setTimestamp(8, new Timestamp(record.timestamp()));
    }

    public Stats getStats() {
        return new Stats(totalInserted.get(), totalFailed.get(), queue.size());
    }

    public record Stats(long totalInserted, long totalFailed, int queueSize) {
    }

    /**
     * 停止接收新通知，等待写库线程写完队列中的全部通知后关闭连接池。
     */
    public void shutdown() {
        if (closed) {
            return;
        }
        closed = true;
        queue.offer(STOP);
        writer.shutdown();
        try {
            if (!writer.awaitTermination(30, TimeUnit.SECONDS)) {
                LOG.error("写库线程未在 30 秒内退出, 剩余 {} 条未落库", queue.size());
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            writer.shutdownNow();
            Thread.currentThread().interrupt();
        }
        if (!dataSource.isClosed()) {
            dataSource.close();
        }
    }
}
