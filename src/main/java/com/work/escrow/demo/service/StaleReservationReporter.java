package com.work.escrow.demo.service;

import com.work.escrow.core.EscrowComponent;
import com.work.escrow.core.model.EscrowSlotView;
import com.work.escrow.core.model.SlotState;
import com.work.escrow.demo.config.EscrowProperties;
import com.work.escrow.demo.item.CollectibleItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * 长时间未处理的预留巡检：
 * - 只记录 WARN 日志，不做任何退款或释放（协议没有超时，资金只能经由响应/撤回/下架/取回离开托管）
 * - 可通过 escrow.stale-reservation-enabled=false 关闭
 */
@Component
@ConditionalOnProperty(prefix = "escrow", name = "stale-reservation-enabled", havingValue = "true", matchIfMissing = true)
public class StaleReservationReporter {

    private static final Logger log = LoggerFactory.getLogger(StaleReservationReporter.class);

    private final EscrowComponent<CollectibleItem> escrowComponent;
    private final EscrowProperties properties;

    public StaleReservationReporter(EscrowComponent<CollectibleItem> escrowComponent, EscrowProperties properties) {
        this.escrowComponent = escrowComponent;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${escrow.stale-reservation-scan-interval-ms:60000}")
    public void runOnce() {
        runOnce(Instant.now());
    }

    /**
     * @return 本轮发现的超时预留数量
     */
    int runOnce(Instant now) {
        Duration threshold = properties.getStaleReservationThreshold();
        int stale = 0;
        for (EscrowSlotView slot : escrowComponent.snapshot()) {
            if (slot.getState() != SlotState.RESERVED || slot.getReservedAt() == null) {
                continue;
            }
            Duration age = Duration.between(slot.getReservedAt(), now);
            if (age.compareTo(threshold) > 0) {
                stale++;
                log.warn("[escrow] reservation pending for {}s item={} buyer={} amount={}",
                        age.getSeconds(), slot.getItemId(), slot.getBuyerAddress(), slot.getEscrowedAmount());
            }
        }
        return stale;
    }
}
