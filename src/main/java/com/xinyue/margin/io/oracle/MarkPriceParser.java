package com.xinyue.margin.io.oracle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xinyue.margin.common.ScaleConstants;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Optional;

/**
 * 解析 Binance 合约 markPriceUpdate 推送：
 * <pre>
 * {"e":"markPriceUpdate","E":1562305380000,"s":"BTCUSDT","p":"11794.15000000", ...}
 * </pre>
 * 订阅回执等其他消息返回 empty。
 */
public final class MarkPriceParser {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final String MARK_PRICE_EVENT = "markPriceUpdate";

    public Optional<MarkPrice> parse(String json) throws JsonProcessingException {
        JsonNode root = OBJECT_MAPPER.readTree(json);
        // 组合流格式：{"stream":"btcusdt@markPrice","data":{...}}
        if (root.has("data")) {
            root = root.get("data");
        }
        if (!MARK_PRICE_EVENT.equals(root.path("e").asText())) {
            return Optional.empty();
        }
        String symbol = root.path("s").asText("").toLowerCase(Locale.ROOT);
        String price = root.path("p").asText("");
        if (symbol.isEmpty() || price.isEmpty()) {
            return Optional.empty();
        }
        BigDecimal decimal = new BigDecimal(price);
        if (decimal.signum() < 0) {
            return Optional.empty();
        }
        // 价格只是一次采样，超出 8 位小数时按银行家舍入对齐到 1e8
        long priceE8 = ScaleConstants.toE8(decimal.setScale(ScaleConstants.SCALE_DIGITS, RoundingMode.HALF_EVEN));
        return Optional.of(new MarkPrice(symbol, priceE8, root.path("E").asLong(System.currentTimeMillis())));
    }
}
