package com.work.escrow.core.verify;

/**
 * 验证原语：判断 signature 是否证明了 publicKey 持有者对 message 的知情/可解。
 *
 * <p>约束：纯函数、确定性、无副作用，不得修改协议状态；对畸形输入返回 false 而不是抛异常。
 * 这是扩展信任模型的唯一接缝，替换为其他签名体系或零知识验证器不需要改动生命周期逻辑。</p>
 */
@FunctionalInterface
public interface SignatureVerifier {

    boolean verify(byte[] publicKey, byte[] signature, byte[] message);
}
