package com.work.escrow.demo.service;

import com.work.escrow.core.EscrowComponent;
import com.work.escrow.core.ledger.ListingLedger;
import com.work.escrow.core.model.EscrowSlotView;
import com.work.escrow.core.model.ExclusivePurchaseCapability;
import com.work.escrow.core.model.Listing;
import com.work.escrow.core.model.ResponseOutcome;
import com.work.escrow.core.model.SlotState;
import com.work.escrow.demo.event.EscrowEventStore;
import com.work.escrow.demo.event.StoredEscrowEvent;
import com.work.escrow.demo.item.CollectibleItem;
import com.work.escrow.demo.ledger.InMemoryCapabilityCustody;
import com.work.escrow.demo.ledger.InMemoryPaymentTransfer;
import com.work.escrow.demo.web.dto.AccountView;
import com.work.escrow.demo.web.dto.CapabilityView;
import com.work.escrow.demo.web.dto.CollectibleView;
import com.work.escrow.demo.web.dto.ItemView;
import com.work.escrow.demo.web.dto.OutcomeView;
import org.springframework.stereotype.Service;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * REST 层与托管组件之间的薄适配：十六进制解码、视图组装与 demo 账户操作。
 * 协议语义全部由 {@link EscrowComponent} 保证。
 */
@Service
public class EscrowDemoService {

    private final EscrowComponent<CollectibleItem> escrowComponent;
    private final ListingLedger<CollectibleItem> ledger;
    private final InMemoryPaymentTransfer paymentTransfer;
    private final InMemoryCapabilityCustody capabilityCustody;
    private final EscrowEventStore eventStore;

    public EscrowDemoService(EscrowComponent<CollectibleItem> escrowComponent,
                             ListingLedger<CollectibleItem> ledger,
                             InMemoryPaymentTransfer paymentTransfer,
                             InMemoryCapabilityCustody capabilityCustody,
                             EscrowEventStore eventStore) {
        this.escrowComponent = escrowComponent;
        this.ledger = ledger;
        this.paymentTransfer = paymentTransfer;
        this.capabilityCustody = capabilityCustody;
        this.eventStore = eventStore;
    }

    public ItemView list(String itemId, String name, String seller, BigInteger price) {
        String displayName = name == null || name.trim().isEmpty() ? itemId : name.trim();
        escrowComponent.list(seller, new CollectibleItem(itemId, displayName, seller), price);
        return view(itemId);
    }

    public CapabilityView issueCapability(String itemId, String seller, String buyer, BigInteger minimumPrice) {
        return toView(escrowComponent.issueExclusiveCapability(itemId, seller, buyer, minimumPrice));
    }

    public ItemView purchase(String itemId, String buyer, String challengeHex, String publicKeyHex,
                             BigInteger amount, String capabilityId) {
        String capability = capabilityId == null || capabilityId.trim().isEmpty() ? null : capabilityId.trim();
        escrowComponent.purchase(itemId, buyer, Numeric.hexStringToByteArray(challengeHex),
                Numeric.hexStringToByteArray(publicKeyHex), amount, capability);
        return view(itemId);
    }

    public OutcomeView submitResponse(String itemId, String seller, String signatureHex) {
        ResponseOutcome<CollectibleItem> outcome =
                escrowComponent.submitResponse(itemId, seller, Numeric.hexStringToByteArray(signatureHex));
        OutcomeView v = new OutcomeView();
        v.setOutcome(outcome.isSettled() ? "SETTLED" : "REFUNDED");
        v.setItemId(outcome.getItemId());
        v.setBuyer(outcome.getBuyerAddress());
        v.setAmount(outcome.getAmount());
        v.setCapabilityDisposition(outcome.getCapabilityDisposition().name());
        if (outcome instanceof ResponseOutcome.Settled) {
            ResponseOutcome.Settled<CollectibleItem> settled = (ResponseOutcome.Settled<CollectibleItem>) outcome;
            v.setReceiptId(settled.getReceipt().getReceiptId());
            v.setNewOwner(settled.getItem().getOwner());
        }
        return v;
    }

    public ItemView withdraw(String itemId, String caller) {
        escrowComponent.withdraw(itemId, caller);
        return view(itemId);
    }

    public ItemView delist(String itemId, String seller) {
        escrowComponent.delist(itemId, seller);
        return view(itemId);
    }

    public CollectibleView take(String itemId, String seller) {
        CollectibleItem item = escrowComponent.take(itemId, seller);
        CollectibleView v = new CollectibleView();
        v.setItemId(item.getItemId());
        v.setName(item.getName());
        v.setOwner(item.getOwner());
        return v;
    }

    public ItemView view(String itemId) {
        ItemView v = new ItemView();
        v.setItemId(itemId);
        Optional<Listing> listing = ledger.findListing(itemId);
        listing.ifPresent(l -> {
            v.setListed(true);
            v.setSeller(l.getSeller());
            v.setPrice(l.getPrice());
            v.setLocked(l.isLocked());
        });
        Optional<EscrowSlotView> slot = escrowComponent.slotView(itemId);
        slot.ifPresent(s -> {
            v.setSlotState(s.getState().name());
            if (s.getState() == SlotState.RESERVED) {
                v.setBuyer(s.getBuyerAddress());
                v.setEscrowedAmount(s.getEscrowedAmount());
                v.setReservedAt(s.getReservedAt());
                v.setExclusive(s.isExclusive());
            }
        });
        v.setPurchasable(listing.isPresent() && escrowComponent.isPurchasable(itemId));
        return v;
    }

    public List<ItemView> listAll() {
        List<String> ids = ledger.listedItemIds();
        List<ItemView> out = new ArrayList<>(ids.size());
        for (String id : ids) {
            out.add(view(id));
        }
        return out;
    }

    public List<StoredEscrowEvent> events(Long afterSeq, int limit) {
        return eventStore.listAfterSeq(afterSeq, limit);
    }

    public AccountView credit(String account, BigInteger amount) {
        paymentTransfer.credit(account, amount);
        return account(account);
    }

    public AccountView account(String account) {
        AccountView v = new AccountView();
        v.setAccount(account);
        v.setBalance(paymentTransfer.balanceOf(account));
        List<CapabilityView> capabilities = new ArrayList<>();
        for (ExclusivePurchaseCapability c : capabilityCustody.heldBy(account)) {
            capabilities.add(toView(c));
        }
        v.setCapabilities(capabilities);
        return v;
    }

    private static CapabilityView toView(ExclusivePurchaseCapability c) {
        CapabilityView v = new CapabilityView();
        v.setCapabilityId(c.getCapabilityId());
        v.setItemId(c.getItemId());
        v.setIssuer(c.getIssuer());
        v.setBuyer(c.getBuyerAddress());
        v.setMinimumPrice(c.getMinimumPrice());
        v.setIssuedAt(c.getIssuedAt());
        return v;
    }
}
