package com.work.escrow.demo.web.dto;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Positive;
import java.math.BigInteger;

/**
 * 上架请求：demo 中物品随上架一起创建，初始所有者即卖家。
 */
public class ListItemRequest {

    @NotBlank(message = "itemId 不能为空")
    private String itemId;

    private String name;

    @NotBlank(message = "seller 不能为空")
    private String seller;

    @NotNull(message = "price 不能为空")
    @Positive(message = "price 必须大于 0")
    private BigInteger price;

    public String getItemId() {
        return itemId;
    }

    public void setItemId(String itemId) {
        this.itemId = itemId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getSeller() {
        return seller;
    }

    public void setSeller(String seller) {
        this.seller = seller;
    }

    public BigInteger getPrice() {
        return price;
    }

    public void setPrice(BigInteger price) {
        this.price = price;
    }
}
