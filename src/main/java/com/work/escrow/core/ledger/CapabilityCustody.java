package com.work.escrow.core.ledger;

import com.work.escrow.core.model.ExclusivePurchaseCapability;

import java.util.Optional;

/**
 * 买家持有独占凭证的保管处。purchase 时协议从买家处领走凭证，
 * 未结算时再归还回来。
 */
public interface CapabilityCustody {

    Optional<ExclusivePurchaseCapability> find(String holder, String capabilityId);

    /**
     * 从 holder 处取走凭证；凭证不存在时返回 empty。
     */
    Optional<ExclusivePurchaseCapability> claim(String holder, String capabilityId);

    void deliver(ExclusivePurchaseCapability capability, String recipient);
}
