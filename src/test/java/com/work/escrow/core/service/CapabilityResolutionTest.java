package com.work.escrow.core.service;

import com.work.escrow.core.ledger.CapabilityCustody;
import com.work.escrow.core.model.CapabilityDisposition;
import com.work.escrow.core.model.ExclusivePurchaseCapability;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

public class CapabilityResolutionTest {

    private final ExclusivePurchaseCapability capability = new ExclusivePurchaseCapability(
            "cap-1", "item-1", "seller-1", "buyer-1", BigInteger.TEN, Instant.now());

    @Test
    public void consume_leaves_custody_untouched() {
        CapabilityCustody custody = mock(CapabilityCustody.class);

        assertEquals(CapabilityDisposition.CONSUMED_BY_SETTLEMENT,
                CapabilityResolution.CONSUME.dispose(capability, "buyer-1", custody));
        verifyNoInteractions(custody);
    }

    @Test
    public void return_to_buyer_delivers_capability_back() {
        CapabilityCustody custody = mock(CapabilityCustody.class);

        assertEquals(CapabilityDisposition.RETURNED_TO_BUYER,
                CapabilityResolution.RETURN_TO_BUYER.dispose(capability, "buyer-1", custody));
        verify(custody).deliver(capability, "buyer-1");
    }

    @Test
    public void every_resolution_yields_a_concrete_disposition() {
        for (CapabilityResolution resolution : CapabilityResolution.values()) {
            CapabilityDisposition d = resolution.dispose(capability, "buyer-1", mock(CapabilityCustody.class));
            assertFalse(d == CapabilityDisposition.NONE, resolution.name());
        }
        assertFalse(Arrays.stream(CapabilityResolution.values()).anyMatch(r -> r.name().equals("NONE")));
    }
}
