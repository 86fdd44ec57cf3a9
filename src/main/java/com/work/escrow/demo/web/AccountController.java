package com.work.escrow.demo.web;

import com.work.escrow.demo.service.EscrowDemoService;
import com.work.escrow.demo.web.dto.AccountView;
import com.work.escrow.demo.web.dto.CreditRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * demo 账户：查询余额与持有的独占凭证，以及充值。
 */
@RestController
@RequestMapping("/api/v1/accounts")
public class AccountController {

    private final EscrowDemoService escrowDemoService;

    public AccountController(EscrowDemoService escrowDemoService) {
        this.escrowDemoService = escrowDemoService;
    }

    @GetMapping("/{account}")
    public ResponseEntity<AccountView> get(@PathVariable String account) {
        return ResponseEntity.ok(escrowDemoService.account(account));
    }

    @PostMapping("/{account}/credit")
    public ResponseEntity<AccountView> credit(@PathVariable String account,
                                              @Validated @RequestBody CreditRequest req) {
        return ResponseEntity.ok(escrowDemoService.credit(account, req.getAmount()));
    }
}
