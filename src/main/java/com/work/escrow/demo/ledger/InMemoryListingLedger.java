package com.work.escrow.demo.ledger;

import com.work.escrow.core.exception.EscrowException;
import com.work.escrow.core.exception.ItemNotListedException;
import com.work.escrow.core.ledger.ListingLedger;
import com.work.escrow.core.ledger.PaymentTransfer;
import com.work.escrow.core.model.EscrowItem;
import com.work.escrow.core.model.ExclusivePurchaseCapability;
import com.work.escrow.core.model.Listing;
import com.work.escrow.core.model.Payment;
import com.work.escrow.core.model.PurchaseReceipt;
import com.work.escrow.core.model.PurchaseResult;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static com.work.escrow.core.support.ValidationUtils.requireNonEmpty;
import static com.work.escrow.core.support.ValidationUtils.requireNonNull;
import static com.work.escrow.core.support.ValidationUtils.requirePositive;

/**
 * 纯内存挂牌账本，仅用于 demo 与测试，不具备持久化与跨进程一致性。
 *
 * <p>购买成功时挂牌被移除、物品所有权转给付款人、付款入账给卖家；
 * 下架/取回时该挂牌签发过的独占凭证随之失效（凭证有效性以挂牌上的 lockedCapabilityId 为准）。</p>
 */
public class InMemoryListingLedger<I extends EscrowItem> implements ListingLedger<I> {

    private static final class Entry<I> {
        Listing listing;
        final I item;

        Entry(Listing listing, I item) {
            this.listing = listing;
            this.item = item;
        }
    }

    private final Map<String, Entry<I>> entries = new LinkedHashMap<>();
    private final PaymentTransfer paymentTransfer;

    public InMemoryListingLedger(PaymentTransfer paymentTransfer) {
        this.paymentTransfer = requireNonNull(paymentTransfer, "paymentTransfer");
    }

    @Override
    public synchronized void list(String seller, I item, BigInteger price) {
        requireNonEmpty(seller, "seller");
        requireNonNull(item, "item");
        requirePositive(price, "price");
        String itemId = item.getItemId();
        if (entries.containsKey(itemId)) {
            throw new EscrowException("item 已上架: " + itemId);
        }
        if (!seller.equals(item.getOwner())) {
            throw new EscrowException("只有物品所有者可以上架: item=" + itemId + ", owner=" + item.getOwner());
        }
        entries.put(itemId, new Entry<>(new Listing(itemId, seller, price, Instant.now(), null), item));
    }

    @Override
    public synchronized void delist(String itemId) {
        requireEntry(itemId);
        entries.remove(itemId);
    }

    @Override
    public synchronized I take(String itemId) {
        Entry<I> entry = requireEntry(itemId);
        entries.remove(itemId);
        return entry.item;
    }

    @Override
    public synchronized PurchaseResult<I> purchase(String itemId, Payment payment) {
        requireNonNull(payment, "payment");
        Entry<I> entry = requireEntry(itemId);
        Listing listing = entry.listing;
        if (listing.isLocked()) {
            throw new EscrowException("item 已锁价，普通路径不可购买: " + itemId);
        }
        if (payment.getAmount().compareTo(listing.getPrice()) != 0) {
            throw new EscrowException("付款金额与挂牌价不符: price=" + listing.getPrice() + ", amount=" + payment.getAmount());
        }
        return completeSale(entry, payment);
    }

    @Override
    public synchronized PurchaseResult<I> purchaseWithCapability(ExclusivePurchaseCapability capability, Payment payment) {
        requireNonNull(capability, "capability");
        requireNonNull(payment, "payment");
        Entry<I> entry = requireEntry(capability.getItemId());
        if (!capability.getCapabilityId().equals(entry.listing.getLockedCapabilityId())) {
            throw new EscrowException("独占凭证已失效: " + capability.getCapabilityId());
        }
        if (!capability.getBuyerAddress().equals(payment.getPayer())) {
            throw new EscrowException("付款人不是凭证持有者: " + payment.getPayer());
        }
        if (payment.getAmount().compareTo(capability.getMinimumPrice()) < 0) {
            throw new EscrowException("付款金额低于凭证最低价: minimumPrice=" + capability.getMinimumPrice()
                    + ", amount=" + payment.getAmount());
        }
        return completeSale(entry, payment);
    }

    @Override
    public synchronized boolean isListed(String itemId) {
        return entries.containsKey(itemId);
    }

    @Override
    public synchronized Optional<Listing> findListing(String itemId) {
        Entry<I> entry = entries.get(itemId);
        return entry == null ? Optional.empty() : Optional.of(entry.listing);
    }

    @Override
    public synchronized List<String> listedItemIds() {
        return Collections.unmodifiableList(new ArrayList<>(entries.keySet()));
    }

    @Override
    public synchronized ExclusivePurchaseCapability issueExclusiveCapability(String itemId, String buyerAddress,
                                                                             BigInteger minimumPrice) {
        requireNonEmpty(buyerAddress, "buyerAddress");
        requirePositive(minimumPrice, "minimumPrice");
        Entry<I> entry = requireEntry(itemId);
        if (entry.listing.isLocked()) {
            throw new EscrowException("item 已锁价: " + itemId);
        }
        ExclusivePurchaseCapability capability = new ExclusivePurchaseCapability(
                UUID.randomUUID().toString(), itemId, entry.listing.getSeller(), buyerAddress, minimumPrice, Instant.now());
        entry.listing = entry.listing.withLock(capability.getCapabilityId());
        return capability;
    }

    private PurchaseResult<I> completeSale(Entry<I> entry, Payment payment) {
        Listing listing = entry.listing;
        entries.remove(listing.getItemId());
        entry.item.transferOwnership(payment.getPayer());
        paymentTransfer.deposit(payment, listing.getSeller());
        PurchaseReceipt receipt = new PurchaseReceipt(UUID.randomUUID(), listing.getItemId(), listing.getSeller(),
                payment.getPayer(), payment.getAmount(), Instant.now());
        return new PurchaseResult<>(entry.item, receipt);
    }

    private Entry<I> requireEntry(String itemId) {
        requireNonEmpty(itemId, "itemId");
        Entry<I> entry = entries.get(itemId);
        if (entry == null) {
            throw new ItemNotListedException(itemId);
        }
        return entry;
    }
}
