package com.work.escrow.demo.ledger;

import com.work.escrow.core.ledger.CapabilityCustody;
import com.work.escrow.core.model.ExclusivePurchaseCapability;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static com.work.escrow.core.support.ValidationUtils.requireNonEmpty;
import static com.work.escrow.core.support.ValidationUtils.requireNonNull;

/**
 * 按持有者地址保管独占凭证的内存实现。
 */
public class InMemoryCapabilityCustody implements CapabilityCustody {

    private final Map<String, Map<String, ExclusivePurchaseCapability>> byHolder = new ConcurrentHashMap<>();

    @Override
    public Optional<ExclusivePurchaseCapability> find(String holder, String capabilityId) {
        requireNonEmpty(holder, "holder");
        requireNonEmpty(capabilityId, "capabilityId");
        Map<String, ExclusivePurchaseCapability> held = byHolder.get(holder);
        return held == null ? Optional.empty() : Optional.ofNullable(held.get(capabilityId));
    }

    @Override
    public Optional<ExclusivePurchaseCapability> claim(String holder, String capabilityId) {
        requireNonEmpty(holder, "holder");
        requireNonEmpty(capabilityId, "capabilityId");
        Map<String, ExclusivePurchaseCapability> held = byHolder.get(holder);
        return held == null ? Optional.empty() : Optional.ofNullable(held.remove(capabilityId));
    }

    @Override
    public void deliver(ExclusivePurchaseCapability capability, String recipient) {
        requireNonNull(capability, "capability");
        requireNonEmpty(recipient, "recipient");
        byHolder.computeIfAbsent(recipient, key -> new ConcurrentHashMap<>())
                .put(capability.getCapabilityId(), capability);
    }

    public List<ExclusivePurchaseCapability> heldBy(String holder) {
        Map<String, ExclusivePurchaseCapability> held = byHolder.get(holder);
        if (held == null) {
            return Collections.emptyList();
        }
        return new ArrayList<>(held.values());
    }
}
