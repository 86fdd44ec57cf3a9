package com.work.escrow.demo.web.dto;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Pattern;
import javax.validation.constraints.Positive;
import java.math.BigInteger;

/**
 * 预留请求。challenge / publicKey 以十六进制传入（可带 0x 前缀）。
 */
public class PurchaseRequest {

    @NotBlank(message = "buyer 不能为空")
    private String buyer;

    @NotBlank(message = "challenge 不能为空")
    @Pattern(regexp = HexFormats.HEX_BYTES, message = "challenge 必须是偶数长度的十六进制串")
    private String challenge;

    /**
     * 64/65 字节未压缩公钥，或 20 字节地址。
     */
    @NotBlank(message = "publicKey 不能为空")
    @Pattern(regexp = HexFormats.HEX_BYTES, message = "publicKey 必须是偶数长度的十六进制串")
    private String publicKey;

    @NotNull(message = "amount 不能为空")
    @Positive(message = "amount 必须大于 0")
    private BigInteger amount;

    /**
     * 可选：凭独占凭证购买时传入。
     */
    private String capabilityId;

    public String getBuyer() {
        return buyer;
    }

    public void setBuyer(String buyer) {
        this.buyer = buyer;
    }

    public String getChallenge() {
        return challenge;
    }

    public void setChallenge(String challenge) {
        this.challenge = challenge;
    }

    public String getPublicKey() {
        return publicKey;
    }

    public void setPublicKey(String publicKey) {
        this.publicKey = publicKey;
    }

    public BigInteger getAmount() {
        return amount;
    }

    public void setAmount(BigInteger amount) {
        this.amount = amount;
    }

    public String getCapabilityId() {
        return capabilityId;
    }

    public void setCapabilityId(String capabilityId) {
        this.capabilityId = capabilityId;
    }
}
