package com.work.escrow.demo.event;

import com.work.escrow.core.event.ChallengeIssuedEvent;
import com.work.escrow.core.event.ChallengeWithdrawnEvent;
import com.work.escrow.core.event.EscrowEventType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class InMemoryEscrowEventStoreTest {

    @Test
    public void events_are_polled_by_seq_cursor() {
        InMemoryEscrowEventStore store = new InMemoryEscrowEventStore();
        store.publish(new ChallengeIssuedEvent("item-1", new byte[]{0x01, (byte) 0xab}, "buyer-1", Instant.now()));
        store.publish(new ChallengeWithdrawnEvent("item-1", "buyer-1", Instant.now()));
        store.publish(new ChallengeIssuedEvent("item-2", new byte[]{0x02}, "buyer-2", Instant.now()));

        List<StoredEscrowEvent> first = store.listAfterSeq(null, 2);
        assertEquals(2, first.size());
        assertEquals(1L, first.get(0).getSeq());
        assertEquals("0x01ab", first.get(0).getChallengeHex());
        assertEquals(EscrowEventType.CHALLENGE_WITHDRAWN, first.get(1).getType());
        assertNull(first.get(1).getChallengeHex());

        List<StoredEscrowEvent> rest = store.listAfterSeq(first.get(1).getSeq(), 50);
        assertEquals(1, rest.size());
        assertEquals("item-2", rest.get(0).getItemId());

        assertTrue(store.listAfterSeq(3L, 50).isEmpty());
    }

    @Test
    public void limit_is_normalized() {
        assertEquals(EscrowEventStore.DEFAULT_LIMIT, EscrowEventStore.normalizeLimit(0));
        assertEquals(EscrowEventStore.MAX_LIMIT, EscrowEventStore.normalizeLimit(10_000));
        assertEquals(7, EscrowEventStore.normalizeLimit(7));
    }
}
