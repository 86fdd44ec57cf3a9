package com.work.escrow.demo.web;

import com.work.escrow.demo.event.StoredEscrowEvent;
import com.work.escrow.demo.service.EscrowDemoService;
import com.work.escrow.demo.web.dto.CallerRequest;
import com.work.escrow.demo.web.dto.CapabilityRequest;
import com.work.escrow.demo.web.dto.CapabilityView;
import com.work.escrow.demo.web.dto.CollectibleView;
import com.work.escrow.demo.web.dto.ItemView;
import com.work.escrow.demo.web.dto.ListItemRequest;
import com.work.escrow.demo.web.dto.OutcomeView;
import com.work.escrow.demo.web.dto.PurchaseRequest;
import com.work.escrow.demo.web.dto.ResponseRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 托管协议的 REST 入口。错误码映射见 {@link EscrowExceptionHandler}。
 */
@RestController
@RequestMapping("/api/v1/escrow")
public class EscrowController {

    private final EscrowDemoService escrowDemoService;

    public EscrowController(EscrowDemoService escrowDemoService) {
        this.escrowDemoService = escrowDemoService;
    }

    @PostMapping("/items")
    public ResponseEntity<ItemView> list(@Validated @RequestBody ListItemRequest req) {
        ItemView view = escrowDemoService.list(req.getItemId(), req.getName(), req.getSeller(), req.getPrice());
        return ResponseEntity.status(HttpStatus.CREATED).body(view);
    }

    @GetMapping("/items")
    public ResponseEntity<List<ItemView>> listAll() {
        return ResponseEntity.ok(escrowDemoService.listAll());
    }

    @GetMapping("/items/{itemId}")
    public ResponseEntity<ItemView> get(@PathVariable String itemId) {
        ItemView view = escrowDemoService.view(itemId);
        if (!view.isListed() && view.getSlotState() == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(view);
    }

    @PostMapping("/items/{itemId}/capabilities")
    public ResponseEntity<CapabilityView> issueCapability(@PathVariable String itemId,
                                                          @Validated @RequestBody CapabilityRequest req) {
        CapabilityView view = escrowDemoService.issueCapability(itemId, req.getSeller(), req.getBuyer(),
                req.getMinimumPrice());
        return ResponseEntity.status(HttpStatus.CREATED).body(view);
    }

    @PostMapping("/items/{itemId}/purchase")
    public ResponseEntity<ItemView> purchase(@PathVariable String itemId,
                                             @Validated @RequestBody PurchaseRequest req) {
        ItemView view = escrowDemoService.purchase(itemId, req.getBuyer(), req.getChallenge(), req.getPublicKey(),
                req.getAmount(), req.getCapabilityId());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(view);
    }

    @PostMapping("/items/{itemId}/response")
    public ResponseEntity<OutcomeView> submitResponse(@PathVariable String itemId,
                                                      @Validated @RequestBody ResponseRequest req) {
        return ResponseEntity.ok(escrowDemoService.submitResponse(itemId, req.getSeller(), req.getSignature()));
    }

    @PostMapping("/items/{itemId}/withdraw")
    public ResponseEntity<ItemView> withdraw(@PathVariable String itemId,
                                             @Validated @RequestBody CallerRequest req) {
        return ResponseEntity.ok(escrowDemoService.withdraw(itemId, req.getCaller()));
    }

    @PostMapping("/items/{itemId}/delist")
    public ResponseEntity<ItemView> delist(@PathVariable String itemId,
                                           @Validated @RequestBody CallerRequest req) {
        return ResponseEntity.ok(escrowDemoService.delist(itemId, req.getCaller()));
    }

    @PostMapping("/items/{itemId}/take")
    public ResponseEntity<CollectibleView> take(@PathVariable String itemId,
                                                @Validated @RequestBody CallerRequest req) {
        return ResponseEntity.ok(escrowDemoService.take(itemId, req.getCaller()));
    }

    /**
     * poll-only 事件流：按 seq 游标读取 ChallengeIssued / ChallengeWithdrawn。
     */
    @GetMapping("/events")
    public ResponseEntity<List<StoredEscrowEvent>> events(@RequestParam(value = "afterSeq", required = false) Long afterSeq,
                                                          @RequestParam(value = "limit", required = false) Integer limit) {
        int l = limit == null ? 50 : limit;
        return ResponseEntity.ok(escrowDemoService.events(afterSeq, l));
    }
}
