package com.xinyue.margin.io.oracle;

import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolHandler.ClientHandshakeStateEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 用 EmbeddedChannel 模拟协议处理器发出的握手事件与文本帧。
 */
@DisplayName("标记价格帧处理器")
class MarkPriceFrameHandlerTest {

    private BinanceMarkPriceOracle oracle;
    private MarkPriceFrameHandler handler;
    private EmbeddedChannel channel;

    @BeforeEach
    void setUp() {
        oracle = new BinanceMarkPriceOracle("BTCUSDT", 10_000);
        handler = new MarkPriceFrameHandler(oracle, "btcusdt");
        channel = new EmbeddedChannel(handler);
    }

    @AfterEach
    void tearDown() {
        channel.finishAndReleaseAll();
    }

    @Test
    @DisplayName("握手完成后发送订阅，文本帧更新预言机价格")
    void subscribesAndForwardsText() {
        assertFalse(handler.subscribed().isDone());

        channel.pipeline().fireUserEventTriggered(ClientHandshakeStateEvent.HANDSHAKE_COMPLETE);

        TextWebSocketFrame subscribe = channel.readOutbound();
        try {
            assertTrue(subscribe.text().contains("\"SUBSCRIBE\""));
            assertTrue(subscribe.text().contains("btcusdt@markPrice@1s"));
        } finally {
            subscribe.release();
        }
        assertTrue(handler.subscribed().isSuccess());

        channel.writeInbound(new TextWebSocketFrame(
                "{\"e\":\"markPriceUpdate\",\"E\":1,\"s\":\"BTCUSDT\",\"p\":\"60000.1\"}"));

        assertEquals(6_000_010_000_000L, oracle.currentPriceE8());
    }

    @Test
    @DisplayName("握手超时则订阅失败并关闭连接")
    void handshakeTimeoutFailsSubscription() {
        channel.pipeline().fireUserEventTriggered(ClientHandshakeStateEvent.HANDSHAKE_TIMEOUT);

        assertTrue(handler.subscribed().isDone());
        assertFalse(handler.subscribed().isSuccess());
        assertFalse(channel.isOpen());
        assertNull(channel.readOutbound());
    }

    @Test
    @DisplayName("握手前连接断开则订阅失败")
    void closeBeforeHandshakeFailsSubscription() {
        channel.close();

        assertFalse(handler.subscribed().isSuccess());
        assertNotNull(handler.subscribed().cause());
    }
}
