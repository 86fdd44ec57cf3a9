package com.work.escrow.demo.event;

import com.work.escrow.core.event.EscrowEventPublisher;

import java.util.List;

/**
 * 事件发布 + 按 seq 游标轮询（poll-only 对外契约）。
 */
public interface EscrowEventStore extends EscrowEventPublisher {

    int DEFAULT_LIMIT = 50;
    int MAX_LIMIT = 200;

    /**
     * @param afterSeq 为 null 时从头读取
     */
    List<StoredEscrowEvent> listAfterSeq(Long afterSeq, int limit);

    static int normalizeLimit(int limit) {
        return Math.max(1, Math.min(limit <= 0 ? DEFAULT_LIMIT : limit, MAX_LIMIT));
    }
}
