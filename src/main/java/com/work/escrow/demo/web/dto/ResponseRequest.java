package com.work.escrow.demo.web.dto;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Pattern;

/**
 * 卖家提交对挑战的签名（r || s || v，65 字节十六进制）。
 */
public class ResponseRequest {

    @NotBlank(message = "seller 不能为空")
    private String seller;

    @NotBlank(message = "signature 不能为空")
    @Pattern(regexp = HexFormats.HEX_BYTES, message = "signature 必须是偶数长度的十六进制串")
    private String signature;

    public String getSeller() {
        return seller;
    }

    public void setSeller(String seller) {
        this.seller = seller;
    }

    public String getSignature() {
        return signature;
    }

    public void setSignature(String signature) {
        this.signature = signature;
    }
}
