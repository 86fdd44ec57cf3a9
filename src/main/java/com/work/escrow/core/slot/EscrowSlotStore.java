package com.work.escrow.core.slot;

import com.work.escrow.core.model.EscrowSlotView;
import com.work.escrow.core.model.PurchaseIntent;

import java.util.List;
import java.util.Optional;

/**
 * 按 item 维度保存托管槽：每个已上架 item 恰好一个槽，槽中至多一条预留。
 *
 * <p>槽只能通过 {@link #reserve}、{@link #takeIntent}、{@link #removeSlot} 修改，
 * 实现必须保证这三个操作各自原子，避免“先读后写”带来的重复预留/重复结算。</p>
 */
public interface EscrowSlotStore {

    /**
     * 上架时创建空槽。
     *
     * @throws com.work.escrow.core.exception.DuplicateSlotException 槽已存在
     */
    void createSlot(String itemId);

    /**
     * 把预留放入空槽。
     *
     * @throws com.work.escrow.core.exception.ItemReservedException  槽已被占用
     * @throws com.work.escrow.core.exception.ItemNotListedException 槽不存在
     */
    void reserve(String itemId, PurchaseIntent intent);

    /**
     * 原子地取出并移除预留，槽变为空。
     *
     * @throws com.work.escrow.core.exception.NothingReservedException 槽为空或不存在
     */
    PurchaseIntent takeIntent(String itemId);

    /**
     * 删除整个槽。若槽中仍有预留，调用方必须已经先处置（退款）。
     *
     * @return 槽是否存在
     */
    boolean removeSlot(String itemId);

    /**
     * 槽存在且为空。
     */
    boolean isPurchasable(String itemId);

    boolean hasSlot(String itemId);

    /**
     * 只读查看当前预留，不改变槽状态。
     */
    Optional<PurchaseIntent> peekIntent(String itemId);

    List<EscrowSlotView> snapshot();
}
