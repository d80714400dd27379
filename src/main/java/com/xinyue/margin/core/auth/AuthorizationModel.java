package com.xinyue.margin.core.auth;

import com.xinyue.margin.common.Identities;
import org.agrona.collections.Object2ObjectHashMap;
import org.agrona.collections.ObjectHashSet;

/**
 * 出金授权模型。
 * <p>
 * 授权判定顺序：
 * 1. 调用方就是账户所有者
 * 2. 调用方是全局操作员（可代任意账户出金）
 * 3. 调用方是该账户所有者授权的本地操作员
 * <p>
 * 全局操作员由管理员维护（管理员鉴权由上层负责），本地操作员只能由账户所有者本人维护。
 * 非线程安全，只允许账本线程访问。
 */
public final class AuthorizationModel {

    private final ObjectHashSet<String> globalOperators = new ObjectHashSet<>();

    // 账户所有者 -> 其授权的本地操作员
    private final Object2ObjectHashMap<String, ObjectHashSet<String>> localOperators = new Object2ObjectHashMap<>();

    public WithdrawGrant grantFor(String owner, String caller) {
        if (caller == null || owner == null) {
            return WithdrawGrant.NONE;
        }
        if (caller.equals(owner)) {
            return WithdrawGrant.SELF;
        }
        if (globalOperators.contains(caller)) {
            return WithdrawGrant.GLOBAL_OPERATOR;
        }
        if (isLocalOperator(owner, caller)) {
            return WithdrawGrant.LOCAL_OPERATOR;
        }
        return WithdrawGrant.NONE;
    }

    public boolean canWithdraw(String owner, String caller) {
        return grantFor(owner, caller).permitted();
    }

    public void setGlobalOperator(String operator, boolean enabled) {
        Identities.require(operator, "operator");
        if (enabled) {
            globalOperators.add(operator);
        } else {
            globalOperators.remove(operator);
        }
    }

    /**
     * 由账户所有者本人设置或撤销本地操作员。
     */
    public void setLocalOperator(String owner, String operator, boolean enabled) {
        Identities.require(owner, "owner");
        Identities.require(operator, "operator");
        if (enabled) {
            localOperators.computeIfAbsent(owner, k -> new ObjectHashSet<>()).add(operator);
            return;
        }
        ObjectHashSet<String> operators = localOperators.get(owner);
        if (operators != null) {
            operators.remove(operator);
            if (operators.isEmpty()) {
                localOperators.remove(owner);
            }
        }
    }

    public boolean isGlobalOperator(String operator) {
        return operator != null && globalOperators.contains(operator);
    }

    public boolean isLocalOperator(String owner, String operator) {
        if (owner == null || operator == null) {
            return false;
        }
        ObjectHashSet<String> operators = localOperators.get(owner);
        return operators != null && operators.contains(operator);
    }
}
