package com.xinyue.margin.io.oracle;

import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPromise;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolHandler.ClientHandshakeStateEvent;
import io.netty.handler.codec.http.websocketx.WebSocketHandshakeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 标记价格推送的帧处理器。
 * <p>
 * 握手、PING/PONG 与关闭帧由前面的 WebSocketClientProtocolHandler 处理，这里只负责握手完成后发送订阅，
 * 并把文本帧交给预言机。
 */
final class MarkPriceFrameHandler extends SimpleChannelInboundHandler<TextWebSocketFrame> {

    private static final Logger LOG = LoggerFactory.getLogger(MarkPriceFrameHandler.class);

    private static final String SUBSCRIBE_TEMPLATE = """
            {
              "method": "SUBSCRIBE",
              "params": [
                "%s@markPrice@1s"
              ],
              "id": 1
            }
            """;

    private final BinanceMarkPriceOracle oracle;
    private final String symbol;
    private ChannelPromise subscribed;

    MarkPriceFrameHandler(BinanceMarkPriceOracle oracle, String symbol) {
        this.oracle = oracle;
        this.symbol = symbol;
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        subscribed = ctx.newPromise();
    }

    /**
     * 握手完成且订阅请求写出后成功；握手超时、连接断开或异常时失败。
     */
    ChannelFuture subscribed() {
        return subscribed;
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt == ClientHandshakeStateEvent.HANDSHAKE_COMPLETE) {
            ctx.writeAndFlush(new TextWebSocketFrame(String.format(SUBSCRIBE_TEMPLATE, symbol)))
                    .addListener(future -> {
                        if (future.isSuccess()) {
                            subscribed.trySuccess();
                        } else {
                            subscribed.tryFailure(future.cause());
                        }
                    });
            LOG.info("标记价格握手完成，已发送订阅: symbol={}", symbol);
        } else if (evt == ClientHandshakeStateEvent.HANDSHAKE_TIMEOUT) {
            subscribed.tryFailure(new WebSocketHandshakeException("WebSocket 握手超时"));
            ctx.close();
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame) {
        oracle.onMessage(frame.text());
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        subscribed.tryFailure(new IllegalStateException("WebSocket 连接已关闭"));
        LOG.warn("标记价格连接断开: symbol={}", symbol);
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LOG.error("标记价格连接异常: symbol={}", symbol, cause);
        subscribed.tryFailure(cause);
        ctx.close();
    }
}
