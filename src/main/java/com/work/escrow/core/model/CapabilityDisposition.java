package com.work.escrow.core.model;

/**
 * 销毁一条预留后，其可选独占凭证的实际去向，随结果返回给调用方。
 * 调用方请求的处置方式见 {@code com.work.escrow.core.service.CapabilityResolution}，其中没有 NONE。
 */
public enum CapabilityDisposition {
    /**
     * 预留未携带凭证，无需处置。
     */
    NONE,
    /**
     * 结算时被 ledger 的独占购买路径消耗。
     */
    CONSUMED_BY_SETTLEMENT,
    /**
     * 退款、撤回、下架/取回时原样归还给买家。
     */
    RETURNED_TO_BUYER
}
