package com.xinyue.margin.core.gateway;

import java.util.OptionalLong;

/**
 * 资产托管网关：在外部持有人与系统托管账户之间划转抵押资产。
 * 账本只信任其成功/失败信号，不关心划转的具体实现。
 */
public interface TransferGateway {

    /**
     * 从外部持有人处拉取资产到系统托管账户（入金）。
     */
    TransferResult pull(String from, long amountE8);

    /**
     * 从系统托管账户推送资产到外部持有人（出金）。
     */
    TransferResult push(String to, long amountE8);

    /**
     * 系统托管账户当前持有的资产总量（放大 1e8）。
     * 能提供时账本用它校验 总保证金 == 托管余额。
     */
    default OptionalLong custodyBalanceE8() {
        return OptionalLong.empty();
    }
}
