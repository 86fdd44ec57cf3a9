package com.work.escrow.core.ledger;

import com.work.escrow.core.model.EscrowItem;
import com.work.escrow.core.model.ExclusivePurchaseCapability;
import com.work.escrow.core.model.Listing;
import com.work.escrow.core.model.Payment;
import com.work.escrow.core.model.PurchaseResult;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * 底层挂牌账本（外部协作方）。负责上架/下架/取回/锁价、维护价格与锁定状态，
 * 并在购买时原子地完成“付款换物品”并给卖家入账。
 *
 * <p>托管协议只通过该接口驱动账本，不关心其存储与事务实现。</p>
 */
public interface ListingLedger<I extends EscrowItem> {

    /**
     * 以 price 挂牌 item，账本在挂牌期间托管物品。
     */
    void list(String seller, I item, BigInteger price);

    void delist(String itemId);

    /**
     * 下架并把物品交还卖家。
     */
    I take(String itemId);

    /**
     * 普通路径：按挂牌价购买，payment 金额必须等于挂牌价。
     */
    PurchaseResult<I> purchase(String itemId, Payment payment);

    /**
     * 独占路径：凭卖家签发的凭证购买，金额不低于凭证的最低价。凭证在此被消耗。
     */
    PurchaseResult<I> purchaseWithCapability(ExclusivePurchaseCapability capability, Payment payment);

    boolean isListed(String itemId);

    Optional<Listing> findListing(String itemId);

    List<String> listedItemIds();

    /**
     * 锁价：为 buyer 签发独占凭证，此后该挂牌只能走独占路径购买。
     */
    ExclusivePurchaseCapability issueExclusiveCapability(String itemId, String buyerAddress, BigInteger minimumPrice);
}
