package com.xinyue.margin.io.oracle;

import com.xinyue.margin.core.gateway.PriceOracle;
import com.xinyue.margin.exception.PriceUnavailableException;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolHandler;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.codec.http.websocketx.extensions.compression.WebSocketClientCompressionHandler;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.net.URI;
import java.util.Locale;
import java.util.Optional;

/**
 * 订阅 Binance 合约标记价格的预言机。
 * <p>
 * 网络线程只更新最新价格，账本线程读取时校验是否过期：超过 maxStalenessMs 未更新即视为不可用。
 * 价格与接收时间放在同一个不可变样本里整体发布，读线程不会看到新价格配旧时间。
 */
public final class BinanceMarkPriceOracle implements PriceOracle {

    private static final Logger LOG = LoggerFactory.getLogger(BinanceMarkPriceOracle.class);

    public static final URI BINANCE_FUTURES_WS_URI = URI.create("wss://fstream.binance.com:443/ws");

    private final URI uri;
    private final String symbol;
    private final long maxStalenessMs;
    private final MarkPriceParser parser = new MarkPriceParser();

    private volatile PriceSample latest;

    private EventLoopGroup eventLoopGroup;
    private Channel channel;

    public BinanceMarkPriceOracle(String symbol, long maxStalenessMs) {
        this(BINANCE_FUTURES_WS_URI, symbol, maxStalenessMs);
    }

    public BinanceMarkPriceOracle(URI uri, String symbol, long maxStalenessMs) {
        if (maxStalenessMs <= 0) {
            throw new IllegalArgumentException("maxStalenessMs 必须大于 0");
        }
        this.uri = uri;
        this.symbol = symbol.toLowerCase(Locale.ROOT);
        this.maxStalenessMs = maxStalenessMs;
    }

    @Override
    public long currentPriceE8() {
        PriceSample sample = latest;
        if (sample == null) {
            throw new PriceUnavailableException("尚未收到 " + symbol + " 标记价格");
        }
        long age = System.currentTimeMillis() - sample.receivedAtMs();
        if (age > maxStalenessMs) {
            throw new PriceUnavailableException(symbol + " 标记价格已过期 " + age + "ms");
        }
        return sample.priceE8();
    }

    public synchronized void start() {
        if (channel != null && channel.isActive()) {
            return;
        }
        try {
            bootstrapNetty();
            LOG.info("标记价格预言机已连接: uri={}, symbol={}", uri, symbol);
        } catch (SSLException e) {
            throw new IllegalStateException("初始化 Binance WebSocket 失败", e);
        }
    }

    public synchronized void stop() {
        if (channel != null) {
            channel.close();
            channel = null;
        }
        if (eventLoopGroup != null) {
            eventLoopGroup.shutdownGracefully();
            eventLoopGroup = null;
        }
    }

    /**
     * 处理一条文本推送。解析失败只记录日志，保留上一次的价格。
     */
    void onMessage(String text) {
        try {
            Optional<MarkPrice> markPrice = parser.parse(text);
            if (markPrice.isPresent() && symbol.equals(markPrice.get().symbol())) {
                latest = new PriceSample(markPrice.get().priceE8(), System.currentTimeMillis());
            }
        } catch (Exception e) {
            LOG.warn("无法解析标记价格推送: {}", text, e);
        }
    }

    private void bootstrapNetty() throws SSLException {
        String scheme = uri.getScheme();
        String host = uri.getHost();
        boolean ssl = "wss".equalsIgnoreCase(scheme);
        int port = uri.getPort() == -1 ? (ssl ? 443 : 80) : uri.getPort();
        SslContext sslCtx = ssl ? SslContextBuilder.forClient().build() : null;

        eventLoopGroup = new NioEventLoopGroup(1);

        WebSocketClientHandshaker handshaker = WebSocketClientHandshakerFactory.newHandshaker(
                uri,
                WebSocketVersion.V13,
                null,
                true,
                new DefaultHttpHeaders()
        );

        MarkPriceFrameHandler handler = new MarkPriceFrameHandler(this, symbol);

        Bootstrap bootstrap = new Bootstrap()
                .group(eventLoopGroup)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<Channel>() {
                    @Override
                    protected void initChannel(Channel ch) {
                        ChannelPipeline pipeline = ch.pipeline();
                        if (sslCtx != null) {
                            pipeline.addLast(sslCtx.newHandler(ch.alloc(), host, port));
                        }
                        pipeline.addLast(
                                new HttpClientCodec(),
                                new HttpObjectAggregator(8192),
                                WebSocketClientCompressionHandler.INSTANCE,
                                new WebSocketClientProtocolHandler(handshaker),
                                handler
                        );
                    }
                });

        channel = bootstrap.connect(host, port).syncUninterruptibly().channel();
        handler.subscribed().syncUninterruptibly();
    }

    private record PriceSample(long priceE8, long receivedAtMs) {
    }
}
