package com.work.escrow.core.model;

/**
 * 单个 item 托管槽的状态。槽不存在（item 未上架）由调用方以 empty 表示。
 */
public enum SlotState {
    /**
     * 槽为空，item 可被购买。
     */
    AVAILABLE,
    /**
     * 槽中有一条待处理的预留，其他买家无法购买。
     */
    RESERVED
}
