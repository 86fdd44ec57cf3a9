package com.work.escrow.core.model;

import static com.work.escrow.core.support.ValidationUtils.requireNonNull;

public final class PurchaseResult<I extends EscrowItem> {

    private final I item;
    private final PurchaseReceipt receipt;

    public PurchaseResult(I item, PurchaseReceipt receipt) {
        this.item = requireNonNull(item, "item");
        this.receipt = requireNonNull(receipt, "receipt");
    }

    public I getItem() {
        return item;
    }

    public PurchaseReceipt getReceipt() {
        return receipt;
    }
}
