package com.work.escrow.demo.ledger;

import com.work.escrow.core.exception.EscrowException;
import com.work.escrow.core.exception.ItemNotListedException;
import com.work.escrow.core.model.ExclusivePurchaseCapability;
import com.work.escrow.core.model.Payment;
import com.work.escrow.core.model.PurchaseResult;
import com.work.escrow.demo.item.CollectibleItem;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class InMemoryListingLedgerTest {

    private final InMemoryPaymentTransfer payments = new InMemoryPaymentTransfer();
    private final InMemoryListingLedger<CollectibleItem> ledger = new InMemoryListingLedger<>(payments);

    @Test
    public void sale_moves_item_and_pays_seller() {
        CollectibleItem item = new CollectibleItem("item-1", "card", "seller-1");
        ledger.list("seller-1", item, BigInteger.TEN);

        PurchaseResult<CollectibleItem> result = ledger.purchase("item-1", new Payment("buyer-1", BigInteger.TEN));

        assertSame(item, result.getItem());
        assertEquals("buyer-1", item.getOwner());
        assertEquals(BigInteger.TEN, payments.balanceOf("seller-1"));
        assertEquals("seller-1", result.getReceipt().getSeller());
        assertFalse(ledger.isListed("item-1"));
    }

    @Test
    public void wrong_amount_or_missing_listing_is_rejected() {
        ledger.list("seller-1", new CollectibleItem("item-1", "card", "seller-1"), BigInteger.TEN);

        assertThrows(EscrowException.class, () -> ledger.purchase("item-1", new Payment("buyer-1", BigInteger.ONE)));
        assertThrows(ItemNotListedException.class, () -> ledger.purchase("item-2", new Payment("buyer-1", BigInteger.TEN)));
        assertTrue(ledger.isListed("item-1"));
    }

    @Test
    public void list_requires_owner_and_no_duplicate() {
        CollectibleItem item = new CollectibleItem("item-1", "card", "seller-1");
        assertThrows(EscrowException.class, () -> ledger.list("someone", item, BigInteger.TEN));

        ledger.list("seller-1", item, BigInteger.TEN);
        assertThrows(EscrowException.class, () -> ledger.list("seller-1", item, BigInteger.TEN));
        assertEquals(1, ledger.listedItemIds().size());
    }

    @Test
    public void capability_locks_listing_and_dies_with_it() {
        ledger.list("seller-1", new CollectibleItem("item-1", "card", "seller-1"), BigInteger.TEN);
        ExclusivePurchaseCapability cap = ledger.issueExclusiveCapability("item-1", "buyer-1", BigInteger.valueOf(5));

        assertTrue(ledger.findListing("item-1").get().isLocked());
        assertEquals(cap.getCapabilityId(), ledger.findListing("item-1").get().getLockedCapabilityId());
        assertThrows(EscrowException.class, () -> ledger.purchase("item-1", new Payment("buyer-2", BigInteger.TEN)));
        assertThrows(EscrowException.class,
                () -> ledger.issueExclusiveCapability("item-1", "buyer-2", BigInteger.ONE));

        CollectibleItem taken = ledger.take("item-1");
        assertEquals("seller-1", taken.getOwner());
        ledger.list("seller-1", taken, BigInteger.TEN);
        assertThrows(EscrowException.class,
                () -> ledger.purchaseWithCapability(cap, new Payment("buyer-1", BigInteger.TEN)));
    }

    @Test
    public void capability_purchase_checks_payer_and_minimum() {
        ledger.list("seller-1", new CollectibleItem("item-1", "card", "seller-1"), BigInteger.TEN);
        ExclusivePurchaseCapability cap = ledger.issueExclusiveCapability("item-1", "buyer-1", BigInteger.valueOf(5));

        assertThrows(EscrowException.class,
                () -> ledger.purchaseWithCapability(cap, new Payment("buyer-2", BigInteger.valueOf(5))));
        assertThrows(EscrowException.class,
                () -> ledger.purchaseWithCapability(cap, new Payment("buyer-1", BigInteger.valueOf(4))));

        PurchaseResult<CollectibleItem> result =
                ledger.purchaseWithCapability(cap, new Payment("buyer-1", BigInteger.valueOf(5)));
        assertEquals("buyer-1", result.getItem().getOwner());
        assertEquals(BigInteger.valueOf(5), payments.balanceOf("seller-1"));
    }
}
