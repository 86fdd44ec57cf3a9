package com.work.escrow.demo.web.dto;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Positive;
import java.math.BigInteger;

public class CapabilityRequest {

    @NotBlank(message = "seller 不能为空")
    private String seller;

    @NotBlank(message = "buyer 不能为空")
    private String buyer;

    @NotNull(message = "minimumPrice 不能为空")
    @Positive(message = "minimumPrice 必须大于 0")
    private BigInteger minimumPrice;

    public String getSeller() {
        return seller;
    }

    public void setSeller(String seller) {
        this.seller = seller;
    }

    public String getBuyer() {
        return buyer;
    }

    public void setBuyer(String buyer) {
        this.buyer = buyer;
    }

    public BigInteger getMinimumPrice() {
        return minimumPrice;
    }

    public void setMinimumPrice(BigInteger minimumPrice) {
        this.minimumPrice = minimumPrice;
    }
}
