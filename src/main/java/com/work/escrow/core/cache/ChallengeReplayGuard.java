package com.work.escrow.core.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.work.escrow.core.config.EscrowConfig;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import static com.work.escrow.core.support.ValidationUtils.requireNonEmpty;

/**
 * 封装 Caffeine 缓存，记录重放窗口内出现过的挑战（按 keccak256 摘要存储），保证挑战一次性使用。
 *
 * <p>purchase 在产生任何副作用之前 {@link #tryClaim}，若后续步骤失败则 {@link #release} 归还占用。</p>
 */
public class ChallengeReplayGuard {

    private final Cache<String, String> seen;

    public ChallengeReplayGuard(EscrowConfig config) {
        this.seen = Caffeine.newBuilder()
                .maximumSize(config.getReplayCacheSize())
                .expireAfterWrite(config.getReplayWindow())
                .build();
    }

    /**
     * @return true 表示挑战首次出现并已被 itemId 占用
     */
    public boolean tryClaim(String itemId, byte[] challenge) {
        requireNonEmpty(itemId, "itemId");
        return seen.asMap().putIfAbsent(digest(challenge), itemId) == null;
    }

    /**
     * 仅当挑战仍由 itemId 占用时才释放，避免误删其他 item 的记录。
     */
    public void release(String itemId, byte[] challenge) {
        seen.asMap().remove(digest(challenge), itemId);
    }

    public boolean isSeen(byte[] challenge) {
        return seen.getIfPresent(digest(challenge)) != null;
    }

    private static String digest(byte[] challenge) {
        requireNonEmpty(challenge, "challenge");
        return Numeric.toHexStringNoPrefix(Hash.sha3(challenge));
    }
}
