package com.xinyue.margin.core.account;

import com.xinyue.margin.exception.ErrorCode;
import com.xinyue.margin.exception.LedgerException;
import org.agrona.collections.Object2ObjectHashMap;

import java.util.Map;
import java.util.TreeMap;

/**
 * 保证金账本：账户标识 -> (保证金, 仓位)，以及全局总保证金。
 * <p>
 * 所有变更分两步完成：
 * 1. preview*：纯计算，得到拟提交状态，不触碰共享数据
 * 2. commit：一次性写入
 * 两步之间由调用方完成授权、抵押率和托管划转校验，任何一步失败都不会留下中间状态。
 * <p>
 * 非线程安全，只允许账本线程访问。
 */
public final class AccountLedger {

    private final Object2ObjectHashMap<String, MarginAccount> accounts = new Object2ObjectHashMap<>();
    private long totalMarginE8;

    /**
     * 查询账户余额。不存在的账户返回零余额，但不会创建账户。
     */
    public AccountBalance balanceOf(String owner) {
        MarginAccount account = accounts.get(owner);
        return account != null ? account.toBalance() : AccountBalance.empty(owner);
    }

    public long totalMarginE8() {
        return totalMarginE8;
    }

    public int accountCount() {
        return accounts.size();
    }

    /**
     * 计算入金后的拟提交状态。入金只改变保证金。
     */
    public AccountBalance previewDeposit(String owner, long amountE8) {
        requireNonNegative(amountE8);
        AccountBalance current = balanceOf(owner);
        try {
            Math.addExact(totalMarginE8, amountE8);
            return new AccountBalance(owner, Math.addExact(current.marginE8(), amountE8), current.positionE8());
        } catch (ArithmeticException e) {
            throw new LedgerException(ErrorCode.INVALID_AMOUNT, "入金金额导致保证金溢出: " + amountE8, e);
        }
    }

    /**
     * 计算出金后的拟提交状态。出金只改变保证金，且不能超过当前保证金。
     */
    public AccountBalance previewWithdraw(String owner, long amountE8) {
        requireNonNegative(amountE8);
        AccountBalance current = balanceOf(owner);
        if (amountE8 > 0 && amountE8 > current.marginE8()) {
            throw new LedgerException(ErrorCode.INSUFFICIENT_BALANCE,
                    "出金金额 " + amountE8 + " 超过账户 " + owner + " 的保证金 " + current.marginE8());
        }
        return new AccountBalance(owner, current.marginE8() - amountE8, current.positionE8());
    }

    /**
     * 计算成交结算后双方的拟提交状态。
     * 买方仓位增加 positionE8、保证金减少 marginE8；卖方相反。
     */
    public TradePreview previewTrade(String buyer, String seller, long positionE8, long marginE8) {
        if (positionE8 <= 0) {
            throw new LedgerException(ErrorCode.INVALID_AMOUNT, "成交数量必须大于 0: " + positionE8);
        }
        requireNonNegative(marginE8);
        AccountBalance buyerNow = balanceOf(buyer);
        AccountBalance sellerNow = balanceOf(seller);
        try {
            return new TradePreview(
                    new AccountBalance(buyer,
                            Math.subtractExact(buyerNow.marginE8(), marginE8),
                            Math.addExact(buyerNow.positionE8(), positionE8)),
                    new AccountBalance(seller,
                            Math.addExact(sellerNow.marginE8(), marginE8),
                            Math.subtractExact(sellerNow.positionE8(), positionE8)));
        } catch (ArithmeticException e) {
            throw new LedgerException(ErrorCode.INVALID_AMOUNT, "成交结算导致余额溢出", e);
        }
    }

    /**
     * 写入拟提交状态，首次出现的账户在此隐式创建。
     */
    public void commit(AccountBalance postState) {
        MarginAccount account = accounts.computeIfAbsent(postState.account(), MarginAccount::new);
        totalMarginE8 += postState.marginE8() - account.marginE8;
        account.marginE8 = postState.marginE8();
        account.positionE8 = postState.positionE8();
    }

    public void commit(TradePreview preview) {
        commit(preview.buyer());
        commit(preview.seller());
    }

    /**
     * 生成按账户标识排序的全量快照。
     */
    public LedgerSnapshot snapshot(long index) {
        Map<String, AccountBalance> copy = new TreeMap<>();
        for (MarginAccount account : accounts.values()) {
            copy.put(account.owner, account.toBalance());
        }
        return new LedgerSnapshot(copy, totalMarginE8, index);
    }

    /**
     * 校验账本内部不变量：
     * 1. 所有账户保证金之和等于记录的总保证金
     * 2. 无仓位的账户保证金不能为负
     *
     * @throws LedgerException INTERNAL_INVARIANT_VIOLATION
     */
    public void verifyInvariants() {
        long sum = 0;
        for (MarginAccount account : accounts.values()) {
            if (account.positionE8 == 0 && account.marginE8 < 0) {
                throw new LedgerException(ErrorCode.INTERNAL_INVARIANT_VIOLATION,
                        "账户 " + account.owner + " 无仓位但保证金为负: " + account.marginE8);
            }
            sum += account.marginE8;
        }
        if (sum != totalMarginE8) {
            throw new LedgerException(ErrorCode.INTERNAL_INVARIANT_VIOLATION,
                    "账户保证金之和 " + sum + " 与总保证金 " + totalMarginE8 + " 不一致");
        }
    }

    private static void requireNonNegative(long amountE8) {
        if (amountE8 < 0) {
            throw new LedgerException(ErrorCode.INVALID_AMOUNT, "金额不能为负: " + amountE8);
        }
    }
}
