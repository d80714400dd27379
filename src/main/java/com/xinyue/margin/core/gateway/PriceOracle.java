package com.xinyue.margin.core.gateway;

import com.xinyue.margin.exception.PriceUnavailableException;

/**
 * 价格预言机：同步返回交易标的当前价格。价格的计算与过期策略由预言机自行负责。
 */
public interface PriceOracle {

    /**
     * @return 当前价格（放大 1e8，非负）
     * @throws PriceUnavailableException 暂时无法给出价格
     */
    long currentPriceE8();
}
