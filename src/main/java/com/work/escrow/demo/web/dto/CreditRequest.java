package com.work.escrow.demo.web.dto;

import javax.validation.constraints.NotNull;
import javax.validation.constraints.Positive;
import java.math.BigInteger;

/**
 * demo 充值（faucet），生产环境由真实账本替代。
 */
public class CreditRequest {

    @NotNull(message = "amount 不能为空")
    @Positive(message = "amount 必须大于 0")
    private BigInteger amount;

    public BigInteger getAmount() {
        return amount;
    }

    public void setAmount(BigInteger amount) {
        this.amount = amount;
    }
}
