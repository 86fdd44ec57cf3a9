package com.work.escrow.demo.item;

import com.work.escrow.core.model.EscrowItem;

import java.util.Objects;

import static com.work.escrow.core.support.ValidationUtils.requireNonEmpty;
import static com.work.escrow.core.support.ValidationUtils.requireValidIdentifier;

/**
 * demo 用的收藏品：一个带名称的唯一物品。
 */
public class CollectibleItem implements EscrowItem {

    private final String itemId;
    private final String name;
    private volatile String owner;

    public CollectibleItem(String itemId, String name, String owner) {
        this.itemId = requireValidIdentifier(itemId, "itemId");
        this.name = name == null ? "" : name;
        this.owner = requireNonEmpty(owner, "owner");
    }

    @Override
    public String getItemId() {
        return itemId;
    }

    public String getName() {
        return name;
    }

    @Override
    public String getOwner() {
        return owner;
    }

    @Override
    public void transferOwnership(String newOwner) {
        this.owner = requireNonEmpty(newOwner, "newOwner");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return itemId.equals(((CollectibleItem) o).itemId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(itemId);
    }

    @Override
    public String toString() {
        return "CollectibleItem{itemId='" + itemId + "', name='" + name + "', owner='" + owner + "'}";
    }
}
