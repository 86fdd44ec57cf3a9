package com.work.escrow.core.service;

import com.work.escrow.core.ledger.CapabilityCustody;
import com.work.escrow.core.model.CapabilityDisposition;
import com.work.escrow.core.model.ExclusivePurchaseCapability;

/**
 * 销毁一条携带独占凭证的预留时，调用方要求的处置方式。
 *
 * <p>只有两种取值且每个常量各自实现 {@link #dispose}，新增常量时编译器会强制给出实现；
 * "无凭证" 不是可请求的处置，只会作为结果 {@link CapabilityDisposition#NONE} 出现。</p>
 */
public enum CapabilityResolution {

    /**
     * 结算路径：ledger 的独占购买已消耗凭证，这里只记录结果。
     */
    CONSUME {
        @Override
        CapabilityDisposition dispose(ExclusivePurchaseCapability capability, String buyerAddress,
                                      CapabilityCustody custody) {
            return CapabilityDisposition.CONSUMED_BY_SETTLEMENT;
        }
    },

    /**
     * 退款、撤回、下架/取回：凭证原样交还买家保管。
     */
    RETURN_TO_BUYER {
        @Override
        CapabilityDisposition dispose(ExclusivePurchaseCapability capability, String buyerAddress,
                                      CapabilityCustody custody) {
            custody.deliver(capability, buyerAddress);
            return CapabilityDisposition.RETURNED_TO_BUYER;
        }
    };

    abstract CapabilityDisposition dispose(ExclusivePurchaseCapability capability, String buyerAddress,
                                           CapabilityCustody custody);
}
