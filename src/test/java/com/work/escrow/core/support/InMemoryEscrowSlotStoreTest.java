package com.work.escrow.core.support;

import com.work.escrow.core.exception.DuplicateSlotException;
import com.work.escrow.core.exception.ItemNotListedException;
import com.work.escrow.core.exception.ItemReservedException;
import com.work.escrow.core.exception.NothingReservedException;
import com.work.escrow.core.model.EscrowSlotView;
import com.work.escrow.core.model.HeldFunds;
import com.work.escrow.core.model.PurchaseIntent;
import com.work.escrow.core.model.SlotState;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class InMemoryEscrowSlotStoreTest {

    private static PurchaseIntent intent(String itemId, String buyer) {
        HeldFunds held = new HeldFunds(UUID.randomUUID(), buyer, BigInteger.TEN, Instant.now());
        return new PurchaseIntent(itemId, new byte[16], new byte[64], held, buyer, null, Instant.now());
    }

    @Test
    public void reserve_take_cycle() {
        InMemoryEscrowSlotStore store = new InMemoryEscrowSlotStore();
        store.createSlot("a");
        assertTrue(store.isPurchasable("a"));

        PurchaseIntent intent = intent("a", "buyer-1");
        store.reserve("a", intent);
        assertFalse(store.isPurchasable("a"));
        assertSame(intent, store.peekIntent("a").get());

        assertSame(intent, store.takeIntent("a"));
        assertTrue(store.isPurchasable("a"));
        assertThrows(NothingReservedException.class, () -> store.takeIntent("a"));
    }

    @Test
    public void occupied_slot_rejects_second_reservation() {
        InMemoryEscrowSlotStore store = new InMemoryEscrowSlotStore();
        store.createSlot("a");
        PurchaseIntent first = intent("a", "buyer-1");
        store.reserve("a", first);

        assertThrows(ItemReservedException.class, () -> store.reserve("a", intent("a", "buyer-2")));
        assertSame(first, store.peekIntent("a").get());
    }

    @Test
    public void missing_slot_and_duplicate_slot() {
        InMemoryEscrowSlotStore store = new InMemoryEscrowSlotStore();
        assertThrows(ItemNotListedException.class, () -> store.reserve("a", intent("a", "buyer-1")));
        assertFalse(store.isPurchasable("a"));

        store.createSlot("a");
        assertThrows(DuplicateSlotException.class, () -> store.createSlot("a"));
    }

    @Test
    public void reserve_rejects_intent_for_other_item() {
        InMemoryEscrowSlotStore store = new InMemoryEscrowSlotStore();
        store.createSlot("a");
        assertThrows(IllegalArgumentException.class, () -> store.reserve("a", intent("b", "buyer-1")));
    }

    @Test
    public void remove_refuses_occupied_slot() {
        InMemoryEscrowSlotStore store = new InMemoryEscrowSlotStore();
        store.createSlot("a");
        store.reserve("a", intent("a", "buyer-1"));

        assertThrows(IllegalStateException.class, () -> store.removeSlot("a"));
        assertTrue(store.hasSlot("a"));

        store.takeIntent("a");
        assertTrue(store.removeSlot("a"));
        assertFalse(store.removeSlot("a"));
    }

    @Test
    public void snapshot_is_sorted_by_item() {
        InMemoryEscrowSlotStore store = new InMemoryEscrowSlotStore();
        store.createSlot("c");
        store.createSlot("a");
        store.createSlot("b");
        store.reserve("b", intent("b", "buyer-1"));

        List<EscrowSlotView> views = store.snapshot();

        assertEquals(3, views.size());
        assertEquals("a", views.get(0).getItemId());
        assertEquals(SlotState.RESERVED, views.get(1).getState());
        assertEquals("buyer-1", views.get(1).getBuyerAddress());
        assertEquals(SlotState.AVAILABLE, views.get(2).getState());
    }

    @Test
    public void removed_items_leave_no_state_behind() {
        InMemoryEscrowSlotStore store = new InMemoryEscrowSlotStore();
        for (int i = 0; i < 1000; i++) {
            String itemId = "item-" + i;
            store.createSlot(itemId);
            store.reserve(itemId, intent(itemId, "buyer-1"));
            store.takeIntent(itemId);
            assertTrue(store.removeSlot(itemId));
        }

        assertEquals(0, store.slotCount());
        assertTrue(store.snapshot().isEmpty());
    }

    @Test
    public void relisted_item_gets_fresh_empty_slot() {
        InMemoryEscrowSlotStore store = new InMemoryEscrowSlotStore();
        store.createSlot("a");
        assertTrue(store.removeSlot("a"));
        assertThrows(NothingReservedException.class, () -> store.takeIntent("a"));
        assertFalse(store.peekIntent("a").isPresent());

        store.createSlot("a");
        assertTrue(store.isPurchasable("a"));
        PurchaseIntent intent = intent("a", "buyer-2");
        store.reserve("a", intent);
        assertSame(intent, store.takeIntent("a"));
        assertEquals(1, store.slotCount());
    }
}
