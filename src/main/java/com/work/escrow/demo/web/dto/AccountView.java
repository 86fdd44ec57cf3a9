package com.work.escrow.demo.web.dto;

import java.math.BigInteger;
import java.util.List;

public class AccountView {

    private String account;
    private BigInteger balance;
    private List<CapabilityView> capabilities;

    public String getAccount() {
        return account;
    }

    public void setAccount(String account) {
        this.account = account;
    }

    public BigInteger getBalance() {
        return balance;
    }

    public void setBalance(BigInteger balance) {
        this.balance = balance;
    }

    public List<CapabilityView> getCapabilities() {
        return capabilities;
    }

    public void setCapabilities(List<CapabilityView> capabilities) {
        this.capabilities = capabilities;
    }
}
