package com.work.escrow.core.config;

import java.time.Duration;

import static com.work.escrow.core.support.ValidationUtils.requirePositive;

/**
 * 纯组件侧的配置定义，不依赖任意框架。宿主应用（如 Spring Boot）只需在装配时
 * 将自身读取到的配置参数注入即可，确保 core 包保持与业务、框架解耦。
 */
public class EscrowConfig {

    private final Duration lockTtl;
    private final int challengeMinBytes;
    private final int challengeMaxBytes;
    private final Duration replayWindow;
    private final long replayCacheSize;

    public EscrowConfig(Duration lockTtl,
                        int challengeMinBytes,
                        int challengeMaxBytes,
                        Duration replayWindow,
                        long replayCacheSize) {
        this.lockTtl = requirePositive(lockTtl, "lockTtl");
        this.replayWindow = requirePositive(replayWindow, "replayWindow");
        if (challengeMinBytes <= 0) {
            throw new IllegalArgumentException("challengeMinBytes 必须大于0");
        }
        if (challengeMaxBytes < challengeMinBytes) {
            throw new IllegalArgumentException("challengeMaxBytes 不能小于 challengeMinBytes");
        }
        if (replayCacheSize <= 0) {
            throw new IllegalArgumentException("replayCacheSize 必须大于0");
        }
        this.challengeMinBytes = challengeMinBytes;
        this.challengeMaxBytes = challengeMaxBytes;
        this.replayCacheSize = replayCacheSize;
    }

    public static EscrowConfig defaultConfig() {
        return new EscrowConfig(Duration.ofSeconds(10), 16, 1024, Duration.ofHours(24), 100_000L);
    }

    public Duration getLockTtl() {
        return lockTtl;
    }

    public int getChallengeMinBytes() {
        return challengeMinBytes;
    }

    public int getChallengeMaxBytes() {
        return challengeMaxBytes;
    }

    public Duration getReplayWindow() {
        return replayWindow;
    }

    public long getReplayCacheSize() {
        return replayCacheSize;
    }
}
