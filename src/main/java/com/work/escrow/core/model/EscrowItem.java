package com.work.escrow.core.model;

/**
 * 可被托管交易的物品能力接口：拥有稳定唯一标识，且所有权可转移。
 * <p>协议对具体物品类型保持泛型，只依赖该接口。</p>
 */
public interface EscrowItem {

    /**
     * 物品唯一标识，在上架期间保持不变。
     */
    String getItemId();

    String getOwner();

    /**
     * 结算时由 ledger 调用，把物品所有权交给买家。
     */
    void transferOwnership(String newOwner);
}
