package com.xinyue.margin.core.auth;

import com.xinyue.margin.exception.ErrorCode;
import com.xinyue.margin.exception.LedgerException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("出金授权模型")
class AuthorizationModelTest {

    private AuthorizationModel model;

    @BeforeEach
    void setUp() {
        model = new AuthorizationModel();
    }

    @Test
    @DisplayName("账户所有者总是可以出金")
    void ownerCanWithdraw() {
        assertEquals(WithdrawGrant.SELF, model.grantFor("alice", "alice"));
    }

    @Test
    @DisplayName("陌生调用方不能出金")
    void strangerCannotWithdraw() {
        assertEquals(WithdrawGrant.NONE, model.grantFor("alice", "mallory"));
        assertFalse(model.canWithdraw("alice", "mallory"));
    }

    @Test
    @DisplayName("全局操作员可以代任意账户出金，撤销后失效")
    void globalOperator() {
        model.setGlobalOperator("ops", true);

        assertEquals(WithdrawGrant.GLOBAL_OPERATOR, model.grantFor("alice", "ops"));
        assertEquals(WithdrawGrant.GLOBAL_OPERATOR, model.grantFor("bob", "ops"));

        model.setGlobalOperator("ops", false);

        assertFalse(model.canWithdraw("alice", "ops"));
        assertFalse(model.isGlobalOperator("ops"));
    }

    @Test
    @DisplayName("本地操作员只对授权的账户有效")
    void localOperatorScopedToOwner() {
        model.setLocalOperator("alice", "bot", true);

        assertEquals(WithdrawGrant.LOCAL_OPERATOR, model.grantFor("alice", "bot"));
        assertEquals(WithdrawGrant.NONE, model.grantFor("bob", "bot"));
        assertTrue(model.isLocalOperator("alice", "bot"));
        assertFalse(model.isLocalOperator("bob", "bot"));
    }

    @Test
    @DisplayName("重复设置是幂等的，撤销未授权的操作员不报错")
    void settersAreIdempotent() {
        model.setLocalOperator("alice", "bot", true);
        model.setLocalOperator("alice", "bot", true);
        model.setLocalOperator("alice", "bot", false);

        assertFalse(model.isLocalOperator("alice", "bot"));
        assertDoesNotThrow(() -> model.setLocalOperator("alice", "ghost", false));
        assertDoesNotThrow(() -> model.setGlobalOperator("ghost", false));
    }

    @Test
    @DisplayName("空身份被拒绝")
    void blankIdentityRejected() {
        LedgerException e = assertThrows(LedgerException.class, () -> model.setGlobalOperator(" ", true));
        assertEquals(ErrorCode.INVALID_IDENTITY, e.errorCode());
        assertThrows(LedgerException.class, () -> model.setLocalOperator(null, "bot", true));
        assertEquals(WithdrawGrant.NONE, model.grantFor("alice", null));
    }

    @Test
    @DisplayName("身份比较区分大小写")
    void identitiesAreExact() {
        model.setLocalOperator("alice", "Bot", true);

        assertFalse(model.canWithdraw("alice", "bot"));
        assertFalse(model.canWithdraw("Alice", "alice"));
    }

    @Test
    @DisplayName("同时持有全局与本地授权时，撤销其中一个不影响另一个")
    void overlappingGrantsAreIndependent() {
        model.setGlobalOperator("x", true);
        model.setLocalOperator("alice", "x", true);

        model.setGlobalOperator("x", false);
        assertEquals(WithdrawGrant.LOCAL_OPERATOR, model.grantFor("alice", "x"));
        assertFalse(model.canWithdraw("bob", "x"));

        model.setGlobalOperator("x", true);
        model.setLocalOperator("alice", "x", false);
        assertEquals(WithdrawGrant.GLOBAL_OPERATOR, model.grantFor("alice", "x"));
        assertTrue(model.canWithdraw("bob", "x"));

        model.setGlobalOperator("x", false);
        assertFalse(model.canWithdraw("alice", "x"));
    }
}
