package com.work.escrow.core;

import com.work.escrow.core.execution.ItemExecutor;
import com.work.escrow.core.lock.ItemLockCoordinator;
import com.work.escrow.core.model.EscrowItem;
import com.work.escrow.core.model.EscrowSlotView;
import com.work.escrow.core.model.ExclusivePurchaseCapability;
import com.work.escrow.core.model.ResponseOutcome;
import com.work.escrow.core.service.PurchaseIntentLifecycle;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import static com.work.escrow.core.support.ValidationUtils.requireNonEmpty;
import static com.work.escrow.core.support.ValidationUtils.requireNonNull;

/**
 * 门面（Facade）层，对业务侧暴露托管协议的全部调用面。
 * <p>每个修改状态的操作都先按 item 路由到串行执行器，再在 item 锁内执行，
 * 从而形成“单 item、单次调用、全有或全无”的执行单元。</p>
 */
public class EscrowComponent<I extends EscrowItem> {

    private final PurchaseIntentLifecycle<I> lifecycle;
    private final ItemExecutor itemExecutor;
    private final ItemLockCoordinator lockCoordinator;

    public EscrowComponent(PurchaseIntentLifecycle<I> lifecycle,
                           ItemExecutor itemExecutor,
                           ItemLockCoordinator lockCoordinator) {
        this.lifecycle = requireNonNull(lifecycle, "lifecycle");
        this.itemExecutor = requireNonNull(itemExecutor, "itemExecutor");
        this.lockCoordinator = requireNonNull(lockCoordinator, "lockCoordinator");
    }

    public void list(String seller, I item, BigInteger price) {
        requireNonNull(item, "item");
        inItemScope(item.getItemId(), () -> {
            lifecycle.list(seller, item, price);
            return null;
        });
    }

    public ExclusivePurchaseCapability issueExclusiveCapability(String itemId, String seller,
                                                                String buyerAddress, BigInteger minimumPrice) {
        return inItemScope(itemId, () -> lifecycle.issueExclusiveCapability(itemId, seller, buyerAddress, minimumPrice));
    }

    /**
     * 按挂牌价预留。竞争失败的买家立即收到
     * {@link com.work.escrow.core.exception.ItemReservedException}，不会排队。
     */
    public void purchase(String itemId, String buyerAddress, byte[] challenge, byte[] buyerPublicKey, BigInteger amount) {
        purchase(itemId, buyerAddress, challenge, buyerPublicKey, amount, null);
    }

    /**
     * 凭独占凭证预留；capabilityId 为 null 时等同普通预留。
     */
    public void purchase(String itemId, String buyerAddress, byte[] challenge, byte[] buyerPublicKey,
                         BigInteger amount, String capabilityId) {
        inItemScope(itemId, () -> {
            lifecycle.purchase(itemId, buyerAddress, challenge, buyerPublicKey, amount, capabilityId);
            return null;
        });
    }

    public ResponseOutcome<I> submitResponse(String itemId, String seller, byte[] signature) {
        return inItemScope(itemId, () -> lifecycle.submitResponse(itemId, seller, signature));
    }

    public void withdraw(String itemId, String callerAddress) {
        inItemScope(itemId, () -> {
            lifecycle.withdraw(itemId, callerAddress);
            return null;
        });
    }

    public void delist(String itemId, String seller) {
        inItemScope(itemId, () -> {
            lifecycle.delist(itemId, seller);
            return null;
        });
    }

    public I take(String itemId, String seller) {
        return inItemScope(itemId, () -> lifecycle.take(itemId, seller));
    }

    public boolean isPurchasable(String itemId) {
        return lifecycle.isPurchasable(itemId);
    }

    public Optional<EscrowSlotView> slotView(String itemId) {
        return lifecycle.slotView(itemId);
    }

    public List<EscrowSlotView> snapshot() {
        return lifecycle.snapshot();
    }

    private <T> T inItemScope(String itemId, Supplier<T> work) {
        requireNonEmpty(itemId, "itemId");
        return itemExecutor.execute(itemId, () -> lockCoordinator.executeWithLock(itemId, owner -> work.get()));
    }
}
