package com.xinyue.margin.web.context;

import com.xinyue.margin.config.LedgerConfig;
import com.xinyue.margin.core.LedgerEngine;
import com.xinyue.margin.core.gateway.EventSink;
import com.xinyue.margin.core.gateway.PriceOracle;
import com.xinyue.margin.infra.CompositeEventSink;
import com.xinyue.margin.infra.JdbcEventSink;
import com.xinyue.margin.infra.MetricsService;
import com.xinyue.margin.infra.RecordingEventSink;
import com.xinyue.margin.io.custody.InMemoryCustody;
import com.xinyue.margin.io.oracle.BinanceMarkPriceOracle;
import com.xinyue.margin.io.oracle.FixedPriceOracle;
import org.noear.solon.annotation.Component;
import org.noear.solon.annotation.Init;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 应用上下文管理器。
 * 负责按配置装配托管、预言机、通知接收方与账本引擎。
 */
@Component
public class AppContext {

    private static final Logger LOG = LoggerFactory.getLogger(AppContext.class);

    private LedgerConfig config;
    private MetricsService metricsService;
    private InMemoryCustody custody;
    private PriceOracle priceOracle;
    private BinanceMarkPriceOracle binanceOracle;
    private RecordingEventSink recordingSink;
    private JdbcEventSink jdbcSink;
    private LedgerEngine ledgerEngine;

    @Init
    public void init() {
        init(LedgerConfig.load());
        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "ledger-shutdown"));
    }

    public void init(LedgerConfig config) {
        LOG.info("正在初始化应用上下文...");
        try {
            this.config = config;
            this.metricsService = new MetricsService();

            custody = new InMemoryCustody();
            for (Map.Entry<String, Long> seed : config.custodySeedE8.entrySet()) {
                custody.mint(seed.getKey(), seed.getValue());
            }

            priceOracle = createPriceOracle(config);

            recordingSink = new RecordingEventSink(config.sinkMemoryCapacity);
            List<EventSink> sinks = new ArrayList<>();
            sinks.add(recordingSink);
            if (LedgerConfig.SINK_JDBC.equals(config.sinkType)) {
                jdbcSink = new JdbcEventSink(config);
                sinks.add(jdbcSink);
            }

            ledgerEngine = new LedgerEngine(config, custody, priceOracle, new CompositeEventSink(sinks), metricsService)
                    .start();

            LOG.info("应用上下文初始化完成: oracle={}, sink={}, globalOperators={}",
                    config.oracleType, config.sinkType, config.globalOperators.size());
        } catch (Exception e) {
            LOG.error("应用上下文初始化失败", e);
            throw new IllegalStateException("应用上下文初始化失败", e);
        }
    }

    private PriceOracle createPriceOracle(LedgerConfig config) {
        if (LedgerConfig.ORACLE_BINANCE.equals(config.oracleType)) {
            binanceOracle = new BinanceMarkPriceOracle(config.oracleBinanceSymbol, config.oracleMaxStalenessMs);
            binanceOracle.start();
            return binanceOracle;
        }
        return config.oracleFixedPriceE8 >= 0
                ? new FixedPriceOracle(config.oracleFixedPriceE8)
                : new FixedPriceOracle();
    }

    public void shutdown() {
        if (ledgerEngine != null) {
            ledgerEngine.close();
        }
        if (binanceOracle != null) {
            binanceOracle.stop();
        }
        if (jdbcSink != null) {
            jdbcSink.shutdown();
        }
    }

    public LedgerConfig getConfig() {
        return config;
    }

    public LedgerEngine getLedgerEngine() {
        return ledgerEngine;
    }

    public MetricsService getMetricsService() {
        return metricsService;
    }

    public InMemoryCustody getCustody() {
        return custody;
    }

    public PriceOracle getPriceOracle() {
        return priceOracle;
    }

    public RecordingEventSink getRecordingSink() {
        return recordingSink;
    }
}
