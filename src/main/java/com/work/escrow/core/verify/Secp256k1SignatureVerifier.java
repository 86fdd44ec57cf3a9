package com.work.escrow.core.verify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.security.SignatureException;
import java.util.Arrays;

/**
 * 基于 web3j 的 secp256k1 ECDSA 验证器：从 65 字节签名（r || s || v）恢复公钥，再与买家给出的凭据比对。
 *
 * 支持的公钥形式：
 * - 64 字节原始公钥（x || y）
 * - 65 字节带 0x04 前缀的非压缩公钥
 * - 20 字节以太坊地址
 *
 * prefixed=true 时按 EIP-191 personal_sign 规则先加 "\x19Ethereum Signed Message:\n" 前缀再哈希。
 */
public class Secp256k1SignatureVerifier implements SignatureVerifier {

    private static final Logger log = LoggerFactory.getLogger(Secp256k1SignatureVerifier.class);

    private static final int SIGNATURE_LENGTH = 65;
    private static final int RAW_PUBLIC_KEY_LENGTH = 64;
    private static final int ADDRESS_LENGTH = 20;

    private final boolean prefixed;

    public Secp256k1SignatureVerifier(boolean prefixed) {
        this.prefixed = prefixed;
    }

    public boolean isPrefixed() {
        return prefixed;
    }

    @Override
    public boolean verify(byte[] publicKey, byte[] signature, byte[] message) {
        if (publicKey == null || signature == null || message == null) {
            return false;
        }
        if (signature.length != SIGNATURE_LENGTH) {
            log.debug("[escrow] signature length mismatch, expected={} actual={}", SIGNATURE_LENGTH, signature.length);
            return false;
        }
        byte v = signature[64];
        // 兼容 v=0/1 的紧凑写法
        if (v < 27) {
            v = (byte) (v + 27);
        }
        Sign.SignatureData data = new Sign.SignatureData(v,
                Arrays.copyOfRange(signature, 0, 32),
                Arrays.copyOfRange(signature, 32, 64));
        try {
            BigInteger recovered = prefixed
                    ? Sign.signedPrefixedMessageToKey(message, data)
                    : Sign.signedMessageToKey(message, data);
            return matches(recovered, publicKey);
        } catch (SignatureException | RuntimeException e) {
            log.debug("[escrow] signature recovery failed: {}", e.getMessage());
            return false;
        }
    }

    private boolean matches(BigInteger recovered, byte[] publicKey) {
        if (publicKey.length == ADDRESS_LENGTH) {
            String recoveredAddress = Keys.getAddress(recovered);
            return recoveredAddress.equalsIgnoreCase(Numeric.toHexStringNoPrefix(publicKey));
        }
        byte[] raw = publicKey;
        if (publicKey.length == RAW_PUBLIC_KEY_LENGTH + 1 && publicKey[0] == 0x04) {
            raw = Arrays.copyOfRange(publicKey, 1, publicKey.length);
        }
        if (raw.length != RAW_PUBLIC_KEY_LENGTH) {
            return false;
        }
        return Arrays.equals(Numeric.toBytesPadded(recovered, RAW_PUBLIC_KEY_LENGTH), raw);
    }
}
