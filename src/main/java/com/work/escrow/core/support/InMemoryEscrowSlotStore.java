package com.work.escrow.core.support;

import com.work.escrow.core.exception.DuplicateSlotException;
import com.work.escrow.core.exception.ItemNotListedException;
import com.work.escrow.core.exception.ItemReservedException;
import com.work.escrow.core.exception.NothingReservedException;
import com.work.escrow.core.model.EscrowSlotView;
import com.work.escrow.core.model.PurchaseIntent;
import com.work.escrow.core.slot.EscrowSlotStore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static com.work.escrow.core.support.ValidationUtils.requireNonEmpty;
import static com.work.escrow.core.support.ValidationUtils.requireNonNull;

/**
 * 纯内存实现：以槽对象自身作为 mutex，槽的读改写都在该 mutex 内完成。
 * 槽被删除后不会再放回 map，重新上架会创建新的槽对象；因此拿到 mutex 后需确认槽仍在 map 中。
 * 注意：该实现不具备跨进程一致性，多节点部署需配合 item 维度的分布式锁。
 */
public class InMemoryEscrowSlotStore implements EscrowSlotStore {

    /**
     * 槽本身；intent 为 null 表示空槽。
     */
    private static final class Slot {
        PurchaseIntent intent;
    }

    private final Map<String, Slot> slots = new ConcurrentHashMap<>();

    /**
     * 调用方须持有 slot 的 mutex。
     */
    private boolean isCurrent(String itemId, Slot slot) {
        return slots.get(itemId) == slot;
    }

    @Override
    public void createSlot(String itemId) {
        requireNonEmpty(itemId, "itemId");
        if (slots.putIfAbsent(itemId, new Slot()) != null) {
            throw new DuplicateSlotException(itemId);
        }
    }

    @Override
    public void reserve(String itemId, PurchaseIntent intent) {
        requireNonEmpty(itemId, "itemId");
        requireNonNull(intent, "intent");
        if (!itemId.equals(intent.getItemId())) {
            throw new IllegalArgumentException("intent.itemId 与槽不一致: " + intent.getItemId() + " != " + itemId);
        }
        Slot slot = slots.get(itemId);
        if (slot == null) {
            throw new ItemNotListedException(itemId);
        }
        synchronized (slot) {
            if (!isCurrent(itemId, slot)) {
                throw new ItemNotListedException(itemId);
            }
            if (slot.intent != null) {
                throw new ItemReservedException(itemId);
            }
            slot.intent = intent;
        }
    }

    @Override
    public PurchaseIntent takeIntent(String itemId) {
        requireNonEmpty(itemId, "itemId");
        Slot slot = slots.get(itemId);
        if (slot == null) {
            throw new NothingReservedException(itemId);
        }
        synchronized (slot) {
            if (!isCurrent(itemId, slot) || slot.intent == null) {
                throw new NothingReservedException(itemId);
            }
            PurchaseIntent taken = slot.intent;
            slot.intent = null;
            return taken;
        }
    }

    @Override
    public boolean removeSlot(String itemId) {
        requireNonEmpty(itemId, "itemId");
        Slot slot = slots.get(itemId);
        if (slot == null) {
            return false;
        }
        synchronized (slot) {
            if (slot.intent != null) {
                // 调用方未先退款：拒绝删除，避免资金悬空
                throw new IllegalStateException("槽中仍有未处置的预留，不能删除: " + itemId);
            }
            return slots.remove(itemId, slot);
        }
    }

    @Override
    public boolean isPurchasable(String itemId) {
        requireNonEmpty(itemId, "itemId");
        Slot slot = slots.get(itemId);
        if (slot == null) {
            return false;
        }
        synchronized (slot) {
            return isCurrent(itemId, slot) && slot.intent == null;
        }
    }

    @Override
    public boolean hasSlot(String itemId) {
        requireNonEmpty(itemId, "itemId");
        return slots.containsKey(itemId);
    }

    @Override
    public Optional<PurchaseIntent> peekIntent(String itemId) {
        requireNonEmpty(itemId, "itemId");
        Slot slot = slots.get(itemId);
        if (slot == null) {
            return Optional.empty();
        }
        synchronized (slot) {
            return isCurrent(itemId, slot) ? Optional.ofNullable(slot.intent) : Optional.empty();
        }
    }

    @Override
    public List<EscrowSlotView> snapshot() {
        List<EscrowSlotView> views = new ArrayList<>();
        for (Map.Entry<String, Slot> e : slots.entrySet()) {
            Slot slot = e.getValue();
            synchronized (slot) {
                if (!isCurrent(e.getKey(), slot)) {
                    continue;
                }
                views.add(slot.intent == null ? EscrowSlotView.available(e.getKey()) : EscrowSlotView.reserved(slot.intent));
            }
        }
        views.sort(Comparator.comparing(EscrowSlotView::getItemId));
        return views;
    }

    /**
     * 当前持有的槽数量，只随上架/删除增减。
     */
    int slotCount() {
        return slots.size();
    }
}
