package com.xinyue.margin.config;

import com.xinyue.margin.common.ScaleConstants;
import com.xinyue.margin.exception.LedgerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * 账本配置读取器。
 * 从 classpath 下的 ledger.properties 读取，文件缺失时全部使用默认值。
 */
public final class LedgerConfig {

    private static final Logger LOG = LoggerFactory.getLogger(LedgerConfig.class);

    public static final String DEFAULT_RESOURCE = "ledger.properties";

    public static final String ORACLE_FIXED = "fixed";
    public static final String ORACLE_BINANCE = "binance";
    public static final String SINK_MEMORY = "memory";
    public static final String SINK_JDBC = "jdbc";

    // 核心
    public final int ringBufferSize;
    public final BigDecimal minCollateral;
    public final boolean verifyEveryOperation;
    public final int retryMaxAttempts;
    public final long retryBackoffMs;

    // 预言机
    public final String oracleType;
    public final long oracleFixedPriceE8;       // -1 表示未配置
    public final String oracleBinanceSymbol;
    public final long oracleMaxStalenessMs;

    // 事件落地
    public final String sinkType;
    public final int sinkMemoryCapacity;
    public final String sinkJdbcUrl;
    public final String sinkJdbcUser;
    public final String sinkJdbcPassword;
    public final String sinkJdbcTable;

    // 启动时授予全局操作员的身份
    public final List<String> globalOperators;

    // 启动时注入进程内托管的初始资产：身份 -> 数量（放大 1e8）
    public final Map<String, Long> custodySeedE8;

    private LedgerConfig(Properties props) {
        this.ringBufferSize = parseInt(props, "ledger.ringBufferSize", 1024);
        if (ringBufferSize <= 0 || Integer.bitCount(ringBufferSize) != 1) {
            throw new IllegalArgumentException("ledger.ringBufferSize 必须是 2 的幂: " + ringBufferSize);
        }
        this.minCollateral = parseDecimal(props, "ledger.minCollateral", BigDecimal.ONE);
        if (minCollateral.compareTo(BigDecimal.ONE) < 0) {
            throw new IllegalArgumentException("ledger.minCollateral 必须大于等于 1: " + minCollateral);
        }
        this.verifyEveryOperation = Boolean.parseBoolean(props.getProperty("ledger.verifyEveryOperation", "true").trim());
        this.retryMaxAttempts = parseInt(props, "ledger.retry.maxAttempts", 3);
        if (retryMaxAttempts < 1) {
            throw new IllegalArgumentException("ledger.retry.maxAttempts 必须大于 0");
        }
        this.retryBackoffMs = parseLong(props, "ledger.retry.backoffMs", 50);

        this.oracleType = props.getProperty("oracle.type", ORACLE_FIXED).trim();
        if (!ORACLE_FIXED.equals(oracleType) && !ORACLE_BINANCE.equals(oracleType)) {
            throw new IllegalArgumentException("未知 oracle.type: " + oracleType);
        }
        String fixedPrice = props.getProperty("oracle.fixedPrice");
        this.oracleFixedPriceE8 = fixedPrice == null ? -1 : toE8("oracle.fixedPrice", fixedPrice);
        if (fixedPrice != null && oracleFixedPriceE8 < 0) {
            throw new IllegalArgumentException("oracle.fixedPrice 不能为负: " + fixedPrice);
        }
        this.oracleBinanceSymbol = props.getProperty("oracle.binance.symbol", "btcusdt").trim();
        this.oracleMaxStalenessMs = parseLong(props, "oracle.maxStalenessMs", 10_000);

        this.sinkType = props.getProperty("sink.type", SINK_MEMORY).trim();
        if (!SINK_MEMORY.equals(sinkType) && !SINK_JDBC.equals(sinkType)) {
            throw new IllegalArgumentException("未知 sink.type: " + sinkType);
        }
        this.sinkMemoryCapacity = parseInt(props, "sink.memory.capacity", 1000);
        this.sinkJdbcUrl = props.getProperty("sink.jdbc.url", "");
        this.sinkJdbcUser = props.getProperty("sink.jdbc.user", "");
        this.sinkJdbcPassword = props.getProperty("sink.jdbc.password", "");
        this.sinkJdbcTable = props.getProperty("sink.jdbc.table", "ledger_event");

        this.globalOperators = Collections.unmodifiableList(loadGlobalOperators(props));
        this.custodySeedE8 = Collections.unmodifiableMap(loadCustodySeed(props));
    }

    /**
     * 从默认的 ledger.properties 读取配置。
     */
    public static LedgerConfig load() {
        return load(DEFAULT_RESOURCE);
    }

    public static LedgerConfig load(String resource) {
        Properties props = new Properties();
        try (InputStream is = LedgerConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                LOG.warn("{} 文件未找到，使用默认账本配置", resource);
                return new LedgerConfig(props);
            }
            props.load(is);
        } catch (IOException e) {
            throw new UncheckedIOException("读取账本配置失败: " + resource, e);
        }
        return new LedgerConfig(props);
    }

    public static LedgerConfig fromProperties(Properties props) {
        return new LedgerConfig(props);
    }

    public static LedgerConfig defaults() {
        return new LedgerConfig(new Properties());
    }

    private static List<String> loadGlobalOperators(Properties props) {
        List<String> operators = new ArrayList<>();
        // 遍历所有索引（从 1 开始），遇到第一个缺失的索引即停止
        for (int index = 1; ; index++) {
            String value = props.getProperty("operator.global." + index);
            if (value == null) {
                break;
            }
            if (value.isBlank()) {
                LOG.warn("operator.global.{} 为空，跳过", index);
                continue;
            }
            operators.add(value.trim());
        }
        return operators;
    }

    private static Map<String, Long> loadCustodySeed(Properties props) {
        Map<String, Long> seed = new LinkedHashMap<>();
        for (int index = 1; ; index++) {
            String key = "custody.mint." + index;
            String value = props.getProperty(key);
            if (value == null) {
                break;
            }
            // 格式：身份,数量
            int comma = value.indexOf(',');
            if (comma <= 0 || comma == value.length() - 1) {
                throw new IllegalArgumentException(key + " 格式应为 identity,amount: " + value);
            }
            String identity = value.substring(0, comma).trim();
            long amountE8 = toE8(key, value.substring(comma + 1));
            seed.merge(identity, amountE8, Math::addExact);
        }
        return seed;
    }

    private static int parseInt(Properties props, String key, int defaultValue) {
        String value = props.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " 不是合法整数: " + value, e);
        }
    }

    private static long parseLong(Properties props, String key, long defaultValue) {
        String value = props.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " 不是合法整数: " + value, e);
        }
    }

    private static BigDecimal parseDecimal(Properties props, String key, BigDecimal defaultValue) {
        String value = props.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " 不是合法数值: " + value, e);
        }
    }

    private static long toE8(String key, String value) {
        try {
            return ScaleConstants.toE8(value);
        } catch (LedgerException e) {
            throw new IllegalArgumentException(key + " 不是合法金额: " + value, e);
        }
    }
}
