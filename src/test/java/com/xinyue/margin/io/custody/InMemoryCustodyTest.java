package com.xinyue.margin.io.custody;

import com.xinyue.margin.core.gateway.TransferResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("进程内托管")
class InMemoryCustodyTest {

    @Test
    @DisplayName("拉取与推送在持有人和托管账户之间转移资产")
    void pullAndPush() {
        InMemoryCustody custody = new InMemoryCustody();
        custody.mint("alice", 100);

        assertEquals(TransferResult.SUCCESS, custody.pull("alice", 100));
        assertEquals(0, custody.balanceOf("alice"));
        assertEquals(100, custody.custodyE8());

        assertEquals(TransferResult.SUCCESS, custody.push("bob", 30));
        assertEquals(30, custody.balanceOf("bob"));
        assertEquals(OptionalLong.of(70), custody.custodyBalanceE8());
    }

    @Test
    @DisplayName("余额不足时拒绝")
    void insufficientFundsRejected() {
        InMemoryCustody custody = new InMemoryCustody();
        custody.mint("alice", 10);

        assertEquals(TransferResult.REJECTED, custody.pull("alice", 11));
        assertEquals(TransferResult.REJECTED, custody.push("alice", 1));
        assertEquals(10, custody.balanceOf("alice"));
        assertEquals(0, custody.balanceOf("nobody"));
    }

    @Test
    @DisplayName("服务中断时返回 UNAVAILABLE 且不改变余额")
    void unavailable() {
        InMemoryCustody custody = new InMemoryCustody();
        custody.mint("alice", 10);
        custody.setAvailable(false);

        assertEquals(TransferResult.UNAVAILABLE, custody.pull("alice", 1));
        assertTrue(TransferResult.UNAVAILABLE.isTransient());
        assertEquals(10, custody.balanceOf("alice"));
    }

    @Test
    @DisplayName("铸造 0 与负数")
    void mintEdgeCases() {
        InMemoryCustody custody = new InMemoryCustody();
        custody.mint("alice", 0);

        assertEquals(0, custody.balanceOf("alice"));
        assertThrows(IllegalArgumentException.class, () -> custody.mint("alice", -1));
    }
}
