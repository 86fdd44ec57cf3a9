package com.work.escrow.core.service;

import com.work.escrow.core.cache.ChallengeReplayGuard;
import com.work.escrow.core.config.EscrowConfig;
import com.work.escrow.core.event.ChallengeIssuedEvent;
import com.work.escrow.core.event.ChallengeWithdrawnEvent;
import com.work.escrow.core.event.EscrowEvent;
import com.work.escrow.core.event.EscrowEventPublisher;
import com.work.escrow.core.exception.ChallengeReusedException;
import com.work.escrow.core.exception.DuplicateSlotException;
import com.work.escrow.core.exception.EscrowInvariantViolationException;
import com.work.escrow.core.exception.InvalidPurchaseException;
import com.work.escrow.core.exception.ItemNotListedException;
import com.work.escrow.core.exception.ItemReservedException;
import com.work.escrow.core.exception.NotBuyerException;
import com.work.escrow.core.exception.NotSellerException;
import com.work.escrow.core.exception.NothingReservedException;
import com.work.escrow.core.ledger.CapabilityCustody;
import com.work.escrow.core.ledger.ListingLedger;
import com.work.escrow.core.ledger.PaymentTransfer;
import com.work.escrow.core.metrics.EscrowMetrics;
import com.work.escrow.core.model.CapabilityDisposition;
import com.work.escrow.core.model.EscrowItem;
import com.work.escrow.core.model.EscrowSlotView;
import com.work.escrow.core.model.ExclusivePurchaseCapability;
import com.work.escrow.core.model.HeldFunds;
import com.work.escrow.core.model.Listing;
import com.work.escrow.core.model.Payment;
import com.work.escrow.core.model.PurchaseIntent;
import com.work.escrow.core.model.PurchaseResult;
import com.work.escrow.core.model.ResponseOutcome;
import com.work.escrow.core.slot.EscrowSlotStore;
import com.work.escrow.core.verify.SignatureVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.work.escrow.core.support.ValidationUtils.requireNonEmpty;
import static com.work.escrow.core.support.ValidationUtils.requireNonNull;
import static com.work.escrow.core.support.ValidationUtils.requirePositive;
import static com.work.escrow.core.support.ValidationUtils.requireValidIdentifier;

/**
 * 单个 item 托管槽的状态机：Available -> Reserved -> (Settled | Refunded) -> Available / NoSlot。
 *
 * <p>线程模型：本类不做任何并发控制，调用方（{@link com.work.escrow.core.EscrowComponent}）
 * 保证同一 item 的操作在临界区内串行执行。每个方法要么完整生效，要么在产生副作用前失败；
 * 少数在副作用之后才可能失败的步骤会先补偿再抛出。</p>
 *
 * <p>资金安全：每条被创建的预留，恰好经历一次结算或一次退款；
 * 销毁预留的每条路径都必须同时处置资金与可选的独占凭证。</p>
 */
public class PurchaseIntentLifecycle<I extends EscrowItem> {

    private static final Logger log = LoggerFactory.getLogger(PurchaseIntentLifecycle.class);

    private final EscrowSlotStore slotStore;
    private final ListingLedger<I> ledger;
    private final PaymentTransfer paymentTransfer;
    private final CapabilityCustody capabilityCustody;
    private final SignatureVerifier verifier;
    private final EscrowEventPublisher eventPublisher;
    private final ChallengeReplayGuard replayGuard;
    private final EscrowConfig config;
    private final EscrowMetrics metrics;

    public PurchaseIntentLifecycle(EscrowSlotStore slotStore,
                                   ListingLedger<I> ledger,
                                   PaymentTransfer paymentTransfer,
                                   CapabilityCustody capabilityCustody,
                                   SignatureVerifier verifier,
                                   EscrowEventPublisher eventPublisher,
                                   ChallengeReplayGuard replayGuard,
                                   EscrowConfig config,
                                   EscrowMetrics metrics) {
        this.slotStore = requireNonNull(slotStore, "slotStore");
        this.ledger = requireNonNull(ledger, "ledger");
        this.paymentTransfer = requireNonNull(paymentTransfer, "paymentTransfer");
        this.capabilityCustody = requireNonNull(capabilityCustody, "capabilityCustody");
        this.verifier = requireNonNull(verifier, "verifier");
        this.eventPublisher = requireNonNull(eventPublisher, "eventPublisher");
        this.replayGuard = requireNonNull(replayGuard, "replayGuard");
        this.config = requireNonNull(config, "config");
        this.metrics = requireNonNull(metrics, "metrics");
    }

    /**
     * 上架：ledger 挂牌后创建空槽。
     */
    public void list(String seller, I item, BigInteger price) {
        requireValidIdentifier(seller, "seller");
        requireNonNull(item, "item");
        requirePositive(price, "price");
        String itemId = requireValidIdentifier(item.getItemId(), "itemId");
        if (!seller.equals(item.getOwner())) {
            throw new NotSellerException(itemId, seller);
        }
        if (slotStore.hasSlot(itemId)) {
            throw new DuplicateSlotException(itemId);
        }
        ledger.list(seller, item, price);
        slotStore.createSlot(itemId);
        log.info("[escrow] listed item={} seller={} price={}", itemId, seller, price);
    }

    /**
     * 锁价：卖家为指定买家签发独占凭证，凭证交由买家保管。
     * 有待处理预留时不允许锁价，否则已托管的普通预留将无法结算。
     */
    public ExclusivePurchaseCapability issueExclusiveCapability(String itemId, String seller,
                                                                String buyerAddress, BigInteger minimumPrice) {
        requireValidIdentifier(itemId, "itemId");
        requireValidIdentifier(seller, "seller");
        requireValidIdentifier(buyerAddress, "buyerAddress");
        requirePositive(minimumPrice, "minimumPrice");
        Listing listing = requireListing(itemId);
        requireSeller(listing, seller);
        if (!slotStore.isPurchasable(itemId)) {
            throw new ItemReservedException(itemId);
        }
        ExclusivePurchaseCapability capability = ledger.issueExclusiveCapability(itemId, buyerAddress, minimumPrice);
        capabilityCustody.deliver(capability, buyerAddress);
        log.info("[escrow] exclusive capability issued item={} buyer={} minimumPrice={} capabilityId={}",
                itemId, buyerAddress, minimumPrice, capability.getCapabilityId());
        return capability;
    }

    /**
     * Available -> Reserved：托管买家资金、保存预留并发出 ChallengeIssued。
     *
     * @param capabilityId 可选，买家持有的独占凭证 id；为 null 时走普通挂牌价路径
     */
    public void purchase(String itemId, String buyerAddress, byte[] challenge, byte[] buyerPublicKey,
                         BigInteger amount, String capabilityId) {
        requireValidIdentifier(itemId, "itemId");
        requireValidIdentifier(buyerAddress, "buyerAddress");
        requireNonEmpty(buyerPublicKey, "buyerPublicKey");
        requirePositive(amount, "amount");
        requireChallengeShape(challenge);

        Listing listing = requireListing(itemId);
        if (listing.getSeller().equals(buyerAddress)) {
            throw new InvalidPurchaseException("卖家不能预留自己的 item: " + itemId);
        }
        if (!slotStore.isPurchasable(itemId)) {
            metrics.reservation("reserved");
            throw new ItemReservedException(itemId);
        }
        ExclusivePurchaseCapability capability = capabilityId == null
                ? requireStandardPurchase(listing, amount)
                : requireExclusivePurchase(listing, buyerAddress, capabilityId, amount);

        if (!replayGuard.tryClaim(itemId, challenge)) {
            metrics.reservation("challenge_reused");
            throw new ChallengeReusedException(itemId);
        }

        HeldFunds held = null;
        ExclusivePurchaseCapability claimed = null;
        PurchaseIntent intent;
        try {
            held = paymentTransfer.escrow(buyerAddress, amount);
            if (capability != null) {
                claimed = capabilityCustody.claim(buyerAddress, capability.getCapabilityId())
                        .orElseThrow(() -> new InvalidPurchaseException("独占凭证已不在买家处: " + capabilityId));
            }
            intent = new PurchaseIntent(itemId, challenge, buyerPublicKey, held, buyerAddress, claimed, Instant.now());
            slotStore.reserve(itemId, intent);
        } catch (RuntimeException e) {
            rollbackPurchase(itemId, buyerAddress, challenge, held, claimed);
            throw e;
        }

        metrics.reservation("ok");
        log.info("[escrow] reserved item={} buyer={} amount={} exclusive={}",
                itemId, buyerAddress, amount, claimed != null);
        publishSafely(new ChallengeIssuedEvent(itemId, challenge, buyerAddress, intent.getReservedAt()));
    }

    /**
     * Reserved -> Available / NoSlot：先原子取出预留，再对存储的挑战调用一次验证原语。
     * 验证通过则结算，否则全额退款；验证失败不是异常。
     *
     * <p>没有待处理预留时（从未预留、已结算、已退款或已下架）一律抛出 NothingReserved，
     * 先于上架与卖家校验，重复提交响应的结果与第一次调用的结局无关。</p>
     */
    public ResponseOutcome<I> submitResponse(String itemId, String seller, byte[] signature) {
        requireValidIdentifier(itemId, "itemId");
        requireValidIdentifier(seller, "seller");
        requireNonNull(signature, "signature");
        if (!slotStore.peekIntent(itemId).isPresent()) {
            throw new NothingReservedException(itemId);
        }
        Listing listing = requireListing(itemId);
        requireSeller(listing, seller);

        PurchaseIntent intent = slotStore.takeIntent(itemId);
        boolean verified = verifySafely(intent, signature);
        ResponseOutcome<I> outcome = verified ? settle(intent) : refund(intent);
        metrics.response(outcome.isSettled() ? "settled" : "refunded");
        return outcome;
    }

    /**
     * Reserved -> Available：买家无条件撤回，全额退款并发出 ChallengeWithdrawn。
     * 非买家调用时预留保持不变。
     */
    public void withdraw(String itemId, String callerAddress) {
        requireValidIdentifier(itemId, "itemId");
        requireValidIdentifier(callerAddress, "callerAddress");
        if (!slotStore.hasSlot(itemId)) {
            throw new ItemNotListedException(itemId);
        }
        PurchaseIntent pending = slotStore.peekIntent(itemId)
                .orElseThrow(() -> new NothingReservedException(itemId));
        if (!pending.getBuyerAddress().equals(callerAddress)) {
            throw new NotBuyerException(itemId, callerAddress);
        }

        PurchaseIntent intent = slotStore.takeIntent(itemId);
        paymentTransfer.release(intent.getEscrowedFunds(), intent.getBuyerAddress());
        CapabilityDisposition disposition = disposeCapability(intent, CapabilityResolution.RETURN_TO_BUYER);

        metrics.withdrawal();
        log.info("[escrow] withdrawn item={} buyer={} refunded={} capability={}",
                itemId, callerAddress, intent.getEscrowedFunds().getAmount(), disposition);
        publishSafely(new ChallengeWithdrawnEvent(itemId, callerAddress, Instant.now()));
    }

    /**
     * 卖家下架：先退款待处理预留，再由 ledger 下架并删除槽。
     */
    public void delist(String itemId, String seller) {
        requireValidIdentifier(itemId, "itemId");
        requireValidIdentifier(seller, "seller");
        Listing listing = requireListing(itemId);
        requireSeller(listing, seller);

        boolean hadReservation = refundPendingBeforeRemoval(itemId);
        ledger.delist(itemId);
        slotStore.removeSlot(itemId);
        metrics.removal("delist", hadReservation);
        log.info("[escrow] delisted item={} seller={} refundedPending={}", itemId, seller, hadReservation);
    }

    /**
     * 卖家取回：语义同 {@link #delist}，并把物品交还卖家。
     */
    public I take(String itemId, String seller) {
        requireValidIdentifier(itemId, "itemId");
        requireValidIdentifier(seller, "seller");
        Listing listing = requireListing(itemId);
        requireSeller(listing, seller);

        boolean hadReservation = refundPendingBeforeRemoval(itemId);
        I item = ledger.take(itemId);
        slotStore.removeSlot(itemId);
        metrics.removal("take", hadReservation);
        log.info("[escrow] taken item={} seller={} refundedPending={}", itemId, seller, hadReservation);
        return item;
    }

    /**
     * 已上架且槽为空。
     */
    public boolean isPurchasable(String itemId) {
        requireNonEmpty(itemId, "itemId");
        return ledger.isListed(itemId) && slotStore.isPurchasable(itemId);
    }

    public Optional<EscrowSlotView> slotView(String itemId) {
        requireNonEmpty(itemId, "itemId");
        if (!slotStore.hasSlot(itemId)) {
            return Optional.empty();
        }
        return Optional.of(slotStore.peekIntent(itemId)
                .map(EscrowSlotView::reserved)
                .orElseGet(() -> EscrowSlotView.available(itemId)));
    }

    public List<EscrowSlotView> snapshot() {
        return slotStore.snapshot();
    }

    private ResponseOutcome<I> settle(PurchaseIntent intent) {
        String itemId = intent.getItemId();
        Optional<ExclusivePurchaseCapability> capability = intent.getExclusiveCapability();
        Payment payment = paymentTransfer.forward(intent.getEscrowedFunds());
        PurchaseResult<I> result;
        try {
            result = capability.isPresent()
                    ? ledger.purchaseWithCapability(capability.get(), payment)
                    : ledger.purchase(itemId, payment);
        } catch (RuntimeException e) {
            // 验证已通过却无法结算：付款与凭证还给买家，资金不得悬空
            paymentTransfer.deposit(payment, intent.getBuyerAddress());
            CapabilityDisposition disposition = disposeCapability(intent, CapabilityResolution.RETURN_TO_BUYER);
            log.error("[escrow] ledger rejected verified settlement, buyer refunded. item={} buyer={} amount={} capability={}",
                    itemId, intent.getBuyerAddress(), payment.getAmount(), disposition, e);
            throw new EscrowInvariantViolationException("ledger 拒绝已验证的结算: " + itemId, e);
        }
        CapabilityDisposition disposition = disposeCapability(intent, CapabilityResolution.CONSUME);
        if (!ledger.isListed(itemId)) {
            slotStore.removeSlot(itemId);
        }
        log.info("[escrow] settled item={} buyer={} amount={} receipt={}",
                itemId, intent.getBuyerAddress(), payment.getAmount(), result.getReceipt().getReceiptId());
        return ResponseOutcome.settled(itemId, intent.getBuyerAddress(), result, disposition);
    }

    private ResponseOutcome<I> refund(PurchaseIntent intent) {
        paymentTransfer.release(intent.getEscrowedFunds(), intent.getBuyerAddress());
        CapabilityDisposition disposition = disposeCapability(intent, CapabilityResolution.RETURN_TO_BUYER);
        log.info("[escrow] verification failed, refunded item={} buyer={} amount={} capability={}",
                intent.getItemId(), intent.getBuyerAddress(), intent.getEscrowedFunds().getAmount(), disposition);
        return ResponseOutcome.refunded(intent.getItemId(), intent.getBuyerAddress(),
                intent.getEscrowedFunds().getAmount(), disposition);
    }

    /**
     * @return 是否存在并退款了一条待处理预留
     */
    private boolean refundPendingBeforeRemoval(String itemId) {
        if (!slotStore.peekIntent(itemId).isPresent()) {
            return false;
        }
        PurchaseIntent intent = slotStore.takeIntent(itemId);
        paymentTransfer.release(intent.getEscrowedFunds(), intent.getBuyerAddress());
        CapabilityDisposition disposition = disposeCapability(intent, CapabilityResolution.RETURN_TO_BUYER);
        log.info("[escrow] pending reservation refunded before removal item={} buyer={} amount={} capability={}",
                itemId, intent.getBuyerAddress(), intent.getEscrowedFunds().getAmount(), disposition);
        return true;
    }

    /**
     * 销毁预留时处置其独占凭证：未携带凭证时结果为 NONE，否则按要求消耗或归还买家。
     */
    private CapabilityDisposition disposeCapability(PurchaseIntent intent, CapabilityResolution resolution) {
        requireNonNull(resolution, "resolution");
        return intent.getExclusiveCapability()
                .map(capability -> resolution.dispose(capability, intent.getBuyerAddress(), capabilityCustody))
                .orElse(CapabilityDisposition.NONE);
    }

    private void rollbackPurchase(String itemId, String buyerAddress, byte[] challenge,
                                  HeldFunds held, ExclusivePurchaseCapability claimed) {
        if (held != null) {
            paymentTransfer.release(held, buyerAddress);
        }
        if (claimed != null) {
            capabilityCustody.deliver(claimed, buyerAddress);
        }
        replayGuard.release(itemId, challenge);
        log.info("[escrow] purchase aborted, effects reverted item={} buyer={} fundsReleased={}",
                itemId, buyerAddress, held != null);
    }

    private boolean verifySafely(PurchaseIntent intent, byte[] signature) {
        try {
            return verifier.verify(intent.getBuyerPublicKey(), signature, intent.getChallenge());
        } catch (RuntimeException e) {
            // 预留已取出，验证器异常按验证失败处理，走退款
            log.warn("[escrow] verifier threw, treated as failed proof. item={}", intent.getItemId(), e);
            return false;
        }
    }

    private void publishSafely(EscrowEvent event) {
        try {
            eventPublisher.publish(event);
        } catch (RuntimeException e) {
            metrics.eventPublishFailed(event.getType().name());
            log.warn("[escrow] publish event failed, type={} item={}", event.getType(), event.getItemId(), e);
        }
    }

    private void requireChallengeShape(byte[] challenge) {
        requireNonEmpty(challenge, "challenge");
        if (challenge.length < config.getChallengeMinBytes() || challenge.length > config.getChallengeMaxBytes()) {
            throw new InvalidPurchaseException("challenge 长度必须在 " + config.getChallengeMinBytes()
                    + "~" + config.getChallengeMaxBytes() + " 字节之间，实际 " + challenge.length);
        }
    }

    private ExclusivePurchaseCapability requireStandardPurchase(Listing listing, BigInteger amount) {
        if (listing.isLocked()) {
            throw new InvalidPurchaseException("item 已锁价，只能凭独占凭证购买: " + listing.getItemId());
        }
        if (amount.compareTo(listing.getPrice()) != 0) {
            throw new InvalidPurchaseException("托管金额必须等于挂牌价: item=" + listing.getItemId()
                    + ", price=" + listing.getPrice() + ", amount=" + amount);
        }
        return null;
    }

    private ExclusivePurchaseCapability requireExclusivePurchase(Listing listing, String buyerAddress,
                                                                 String capabilityId, BigInteger amount) {
        ExclusivePurchaseCapability capability = capabilityCustody.find(buyerAddress, capabilityId)
                .orElseThrow(() -> new InvalidPurchaseException("买家未持有独占凭证: " + capabilityId));
        if (!capability.getItemId().equals(listing.getItemId())
                || !capability.getBuyerAddress().equals(buyerAddress)
                || !capability.getCapabilityId().equals(listing.getLockedCapabilityId())) {
            throw new InvalidPurchaseException("独占凭证与 item/买家不匹配或已失效: " + capabilityId);
        }
        if (amount.compareTo(capability.getMinimumPrice()) < 0) {
            throw new InvalidPurchaseException("托管金额低于独占凭证最低价: minimumPrice="
                    + capability.getMinimumPrice() + ", amount=" + amount);
        }
        return capability;
    }

    private Listing requireListing(String itemId) {
        return ledger.findListing(itemId).orElseThrow(() -> new ItemNotListedException(itemId));
    }

    private static void requireSeller(Listing listing, String caller) {
        if (!listing.getSeller().equals(caller)) {
            throw new NotSellerException(listing.getItemId(), caller);
        }
    }
}
