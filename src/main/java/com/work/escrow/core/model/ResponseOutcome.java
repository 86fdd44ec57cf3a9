package com.work.escrow.core.model;

import java.math.BigInteger;

import static com.work.escrow.core.support.ValidationUtils.requireNonEmpty;
import static com.work.escrow.core.support.ValidationUtils.requireNonNull;

/**
 * 卖家响应挑战后的结果，只有两种：{@link Settled} 或 {@link Refunded}。
 * <p>验证失败不是异常，而是以 Refunded 正常返回。</p>
 */
public abstract class ResponseOutcome<I extends EscrowItem> {

    private final String itemId;
    private final String buyerAddress;
    private final BigInteger amount;
    private final CapabilityDisposition capabilityDisposition;

    private ResponseOutcome(String itemId, String buyerAddress, BigInteger amount,
                            CapabilityDisposition capabilityDisposition) {
        this.itemId = requireNonEmpty(itemId, "itemId");
        this.buyerAddress = requireNonEmpty(buyerAddress, "buyerAddress");
        this.amount = requireNonNull(amount, "amount");
        this.capabilityDisposition = requireNonNull(capabilityDisposition, "capabilityDisposition");
    }

    public static <I extends EscrowItem> Settled<I> settled(String itemId, String buyerAddress,
                                                             PurchaseResult<I> result,
                                                             CapabilityDisposition disposition) {
        return new Settled<>(itemId, buyerAddress, result, disposition);
    }

    public static <I extends EscrowItem> Refunded<I> refunded(String itemId, String buyerAddress,
                                                               BigInteger refundedAmount,
                                                               CapabilityDisposition disposition) {
        return new Refunded<>(itemId, buyerAddress, refundedAmount, disposition);
    }

    public String getItemId() {
        return itemId;
    }

    public String getBuyerAddress() {
        return buyerAddress;
    }

    /**
     * 结算时为转给卖家的金额，退款时为退回买家的金额；两者都等于托管金额。
     */
    public BigInteger getAmount() {
        return amount;
    }

    public CapabilityDisposition getCapabilityDisposition() {
        return capabilityDisposition;
    }

    public abstract boolean isSettled();

    /**
     * 验证通过：物品与付款已原子交换。
     */
    public static final class Settled<I extends EscrowItem> extends ResponseOutcome<I> {

        private final PurchaseResult<I> result;

        private Settled(String itemId, String buyerAddress, PurchaseResult<I> result,
                        CapabilityDisposition disposition) {
            super(itemId, buyerAddress, requireNonNull(result, "result").getReceipt().getAmount(), disposition);
            if (disposition == CapabilityDisposition.RETURNED_TO_BUYER) {
                throw new IllegalArgumentException("结算路径不能归还独占凭证");
            }
            this.result = result;
        }

        public I getItem() {
            return result.getItem();
        }

        public PurchaseReceipt getReceipt() {
            return result.getReceipt();
        }

        @Override
        public boolean isSettled() {
            return true;
        }
    }

    /**
     * 验证失败：托管资金全额退回买家，物品仍在挂牌中。
     */
    public static final class Refunded<I extends EscrowItem> extends ResponseOutcome<I> {

        private Refunded(String itemId, String buyerAddress, BigInteger refundedAmount,
                         CapabilityDisposition disposition) {
            super(itemId, buyerAddress, refundedAmount, disposition);
            if (disposition == CapabilityDisposition.CONSUMED_BY_SETTLEMENT) {
                throw new IllegalArgumentException("退款路径不能消耗独占凭证");
            }
        }

        @Override
        public boolean isSettled() {
            return false;
        }
    }
}
