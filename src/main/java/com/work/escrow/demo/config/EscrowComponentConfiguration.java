package com.work.escrow.demo.config;

import com.work.escrow.core.EscrowComponent;
import com.work.escrow.core.cache.ChallengeReplayGuard;
import com.work.escrow.core.config.EscrowConfig;
import com.work.escrow.core.execution.DirectItemExecutor;
import com.work.escrow.core.execution.ItemExecutor;
import com.work.escrow.core.execution.WorkerQueueItemExecutor;
import com.work.escrow.core.ledger.CapabilityCustody;
import com.work.escrow.core.ledger.ListingLedger;
import com.work.escrow.core.ledger.PaymentTransfer;
import com.work.escrow.core.lock.ItemLockCoordinator;
import com.work.escrow.core.lock.ItemLockManager;
import com.work.escrow.core.metrics.EscrowMetrics;
import com.work.escrow.core.metrics.NoopEscrowMetrics;
import com.work.escrow.core.service.PurchaseIntentLifecycle;
import com.work.escrow.core.slot.EscrowSlotStore;
import com.work.escrow.core.support.InMemoryEscrowSlotStore;
import com.work.escrow.core.support.InMemoryItemLockManager;
import com.work.escrow.core.verify.Secp256k1SignatureVerifier;
import com.work.escrow.core.verify.SignatureVerifier;
import com.work.escrow.demo.event.EscrowEventStore;
import com.work.escrow.demo.event.InMemoryEscrowEventStore;
import com.work.escrow.demo.item.CollectibleItem;
import com.work.escrow.demo.ledger.InMemoryCapabilityCustody;
import com.work.escrow.demo.ledger.InMemoryListingLedger;
import com.work.escrow.demo.ledger.InMemoryPaymentTransfer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 将核心组件装配为 Spring Bean，方便通过依赖注入复用。
 * ledger / 支付 / 凭证保管使用内存实现，业务方接入真实账本时替换对应 Bean 即可。
 */
@Configuration
@EnableConfigurationProperties(EscrowProperties.class)
public class EscrowComponentConfiguration {

    @Bean
    public EscrowConfig escrowConfig(EscrowProperties properties) {
        return new EscrowConfig(
                properties.getLockTtl(),
                properties.getChallengeMinBytes(),
                properties.getChallengeMaxBytes(),
                properties.getChallengeReplayWindow(),
                properties.getChallengeReplayCacheSize()
        );
    }

    @Bean
    @ConditionalOnMissingBean(EscrowSlotStore.class)
    public EscrowSlotStore escrowSlotStore() {
        return new InMemoryEscrowSlotStore();
    }

    @Bean
    public InMemoryPaymentTransfer paymentTransfer() {
        return new InMemoryPaymentTransfer();
    }

    @Bean
    public InMemoryCapabilityCustody capabilityCustody() {
        return new InMemoryCapabilityCustody();
    }

    @Bean
    public ListingLedger<CollectibleItem> listingLedger(PaymentTransfer paymentTransfer) {
        return new InMemoryListingLedger<>(paymentTransfer);
    }

    /**
     * 验证原语是唯一的信任模型扩展点：提供自定义 SignatureVerifier Bean 即可替换。
     */
    @Bean
    @ConditionalOnMissingBean(SignatureVerifier.class)
    public SignatureVerifier signatureVerifier(EscrowProperties properties) {
        String scheme = properties.getVerifierScheme() == null ? "" : properties.getVerifierScheme().trim();
        if ("secp256k1-prefixed".equalsIgnoreCase(scheme)) {
            return new Secp256k1SignatureVerifier(true);
        }
        if ("secp256k1".equalsIgnoreCase(scheme)) {
            return new Secp256k1SignatureVerifier(false);
        }
        throw new IllegalStateException("不支持的 escrow.verifier-scheme: " + scheme);
    }

    @Bean
    public ChallengeReplayGuard challengeReplayGuard(EscrowConfig config) {
        return new ChallengeReplayGuard(config);
    }

    @Bean
    @ConditionalOnMissingBean(EscrowMetrics.class)
    public EscrowMetrics escrowMetrics() {
        return new NoopEscrowMetrics();
    }

    @Bean
    @ConditionalOnProperty(prefix = "escrow", name = "lock-mode", havingValue = "memory", matchIfMissing = true)
    public ItemLockManager inMemoryItemLockManager() {
        return new InMemoryItemLockManager();
    }

    @Bean
    public ItemLockCoordinator itemLockCoordinator(ItemLockManager lockManager, EscrowConfig config) {
        return new ItemLockCoordinator(lockManager, config);
    }

    @Bean
    public ItemExecutor itemExecutor(EscrowProperties properties) {
        if ("basic".equalsIgnoreCase(properties.getExecutorMode())) {
            return new DirectItemExecutor();
        }
        return new WorkerQueueItemExecutor(
                properties.getExecutorWorkers(),
                properties.getExecutorQueueCapacity(),
                properties.getExecutorDispatchTimeout(),
                "escrow-worker-");
    }

    @Bean
    @ConditionalOnProperty(prefix = "escrow", name = "event-store", havingValue = "memory", matchIfMissing = true)
    public EscrowEventStore inMemoryEscrowEventStore() {
        return new InMemoryEscrowEventStore();
    }

    @Bean
    public PurchaseIntentLifecycle<CollectibleItem> purchaseIntentLifecycle(EscrowSlotStore slotStore,
                                                                            ListingLedger<CollectibleItem> ledger,
                                                                            PaymentTransfer paymentTransfer,
                                                                            CapabilityCustody capabilityCustody,
                                                                            SignatureVerifier verifier,
                                                                            EscrowEventStore eventStore,
                                                                            ChallengeReplayGuard replayGuard,
                                                                            EscrowConfig config,
                                                                            EscrowMetrics metrics) {
        return new PurchaseIntentLifecycle<>(slotStore, ledger, paymentTransfer, capabilityCustody, verifier,
                eventStore, replayGuard, config, metrics);
    }

    @Bean
    public EscrowComponent<CollectibleItem> escrowComponent(PurchaseIntentLifecycle<CollectibleItem> lifecycle,
                                                            ItemExecutor itemExecutor,
                                                            ItemLockCoordinator lockCoordinator) {
        return new EscrowComponent<>(lifecycle, itemExecutor, lockCoordinator);
    }
}
