package com.work.escrow.demo.event;

import com.work.escrow.core.event.ChallengeIssuedEvent;
import com.work.escrow.core.event.EscrowEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.utils.Numeric;

import java.util.ArrayList;
import java.util.List;

import static com.work.escrow.core.support.ValidationUtils.requireNonNull;

/**
 * 只追加的内存事件日志（默认实现），进程重启后丢失。
 */
public class InMemoryEscrowEventStore implements EscrowEventStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEscrowEventStore.class);

    private final List<StoredEscrowEvent> events = new ArrayList<>();

    @Override
    public synchronized void publish(EscrowEvent event) {
        requireNonNull(event, "event");
        String challengeHex = event instanceof ChallengeIssuedEvent
                ? Numeric.toHexString(((ChallengeIssuedEvent) event).getChallenge())
                : null;
        StoredEscrowEvent stored = new StoredEscrowEvent(events.size() + 1L, event.getType(), event.getItemId(),
                event.getBuyerAddress(), challengeHex, event.getOccurredAt());
        events.add(stored);
        log.info("[escrow] event seq={} type={} item={} buyer={}",
                stored.getSeq(), stored.getType(), stored.getItemId(), stored.getBuyerAddress());
    }

    @Override
    public synchronized List<StoredEscrowEvent> listAfterSeq(Long afterSeq, int limit) {
        int l = EscrowEventStore.normalizeLimit(limit);
        // seq 从 1 开始且连续，可直接换算为下标
        int from = afterSeq == null ? 0 : (int) Math.max(0L, Math.min(afterSeq, events.size()));
        int to = Math.min(events.size(), from + l);
        return new ArrayList<>(events.subList(from, to));
    }
}
