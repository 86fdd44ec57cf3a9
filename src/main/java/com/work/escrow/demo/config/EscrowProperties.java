package com.work.escrow.demo.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 仅存在于 demo/宿主包，用于从 application.yml 读取配置。
 * 再由配置类转换为 core 包所需的 {@link com.work.escrow.core.config.EscrowConfig}。
 */
@ConfigurationProperties(prefix = "escrow")
public class EscrowProperties {

    /**
     * basic 或 worker-queue
     */
    private String executorMode = "worker-queue";

    private int executorWorkers = 16;

    private int executorQueueCapacity = 1024;

    private Duration executorDispatchTimeout = Duration.ofSeconds(5);

    /**
     * memory 或 redis（多节点部署时必须为 redis）
     */
    private String lockMode = "memory";

    private Duration lockTtl = Duration.ofSeconds(10);

    private int challengeMinBytes = 16;

    private int challengeMaxBytes = 1024;

    /**
     * 挑战去重窗口：窗口内同一挑战只能被使用一次。
     */
    private Duration challengeReplayWindow = Duration.ofHours(24);

    private long challengeReplayCacheSize = 100_000L;

    /**
     * secp256k1（keccak256(message)）或 secp256k1-prefixed（EIP-191 personal_sign）
     */
    private String verifierScheme = "secp256k1";

    /**
     * memory 或 jdbc
     */
    private String eventStore = "memory";

    /**
     * 预留超过该时长仍未处理时告警。协议本身不做自动过期。
     */
    private Duration staleReservationThreshold = Duration.ofMinutes(30);

    public String getExecutorMode() {
        return executorMode;
    }

    public void setExecutorMode(String executorMode) {
        this.executorMode = executorMode;
    }

    public int getExecutorWorkers() {
        return executorWorkers;
    }

    public void setExecutorWorkers(int executorWorkers) {
        this.executorWorkers = executorWorkers;
    }

    public int getExecutorQueueCapacity() {
        return executorQueueCapacity;
    }

    public void setExecutorQueueCapacity(int executorQueueCapacity) {
        this.executorQueueCapacity = executorQueueCapacity;
    }

    public Duration getExecutorDispatchTimeout() {
        return executorDispatchTimeout;
    }

    public void setExecutorDispatchTimeout(Duration executorDispatchTimeout) {
        this.executorDispatchTimeout = executorDispatchTimeout;
    }

    public String getLockMode() {
        return lockMode;
    }

    public void setLockMode(String lockMode) {
        this.lockMode = lockMode;
    }

    public Duration getLockTtl() {
        return lockTtl;
    }

    public void setLockTtl(Duration lockTtl) {
        this.lockTtl = lockTtl;
    }

    public int getChallengeMinBytes() {
        return challengeMinBytes;
    }

    public void setChallengeMinBytes(int challengeMinBytes) {
        this.challengeMinBytes = challengeMinBytes;
    }

    public int getChallengeMaxBytes() {
        return challengeMaxBytes;
    }

    public void setChallengeMaxBytes(int challengeMaxBytes) {
        this.challengeMaxBytes = challengeMaxBytes;
    }

    public Duration getChallengeReplayWindow() {
        return challengeReplayWindow;
    }

    public void setChallengeReplayWindow(Duration challengeReplayWindow) {
        this.challengeReplayWindow = challengeReplayWindow;
    }

    public long getChallengeReplayCacheSize() {
        return challengeReplayCacheSize;
    }

    public void setChallengeReplayCacheSize(long challengeReplayCacheSize) {
        this.challengeReplayCacheSize = challengeReplayCacheSize;
    }

    public String getVerifierScheme() {
        return verifierScheme;
    }

    public void setVerifierScheme(String verifierScheme) {
        this.verifierScheme = verifierScheme;
    }

    public String getEventStore() {
        return eventStore;
    }

    public void setEventStore(String eventStore) {
        this.eventStore = eventStore;
    }

    public Duration getStaleReservationThreshold() {
        return staleReservationThreshold;
    }

    public void setStaleReservationThreshold(Duration staleReservationThreshold) {
        this.staleReservationThreshold = staleReservationThreshold;
    }
}
