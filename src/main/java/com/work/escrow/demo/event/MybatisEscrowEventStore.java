package com.work.escrow.demo.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.work.escrow.core.event.ChallengeIssuedEvent;
import com.work.escrow.core.event.EscrowEvent;
import com.work.escrow.core.event.EscrowEventType;
import com.work.escrow.core.exception.EscrowException;
import com.work.escrow.demo.repository.entity.EscrowEventEntity;
import com.work.escrow.demo.repository.mapper.EscrowEventMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.utils.Numeric;

import java.util.ArrayList;
import java.util.List;

import static com.work.escrow.core.support.ValidationUtils.requireNonNull;

/**
 * 基于 MyBatis-Plus 的事件表实现（escrow.event-store=jdbc）。
 * 负载以 JSON 落库：{"itemId", "buyerAddress", "challenge"?}。
 */
public class MybatisEscrowEventStore implements EscrowEventStore {

    private static final Logger log = LoggerFactory.getLogger(MybatisEscrowEventStore.class);

    private final EscrowEventMapper mapper;
    private final ObjectMapper objectMapper;

    public MybatisEscrowEventStore(EscrowEventMapper mapper, ObjectMapper objectMapper) {
        this.mapper = requireNonNull(mapper, "mapper");
        this.objectMapper = requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public void publish(EscrowEvent event) {
        requireNonNull(event, "event");
        EscrowEventEntity entity = new EscrowEventEntity();
        entity.setEventType(event.getType().name());
        entity.setItemId(event.getItemId());
        entity.setBuyerAddress(event.getBuyerAddress());
        entity.setPayload(toPayload(event));
        entity.setOccurredAt(event.getOccurredAt());
        mapper.insert(entity);
        log.info("[escrow] event persisted seq={} type={} item={}", entity.getSeq(), event.getType(), event.getItemId());
    }

    @Override
    public List<StoredEscrowEvent> listAfterSeq(Long afterSeq, int limit) {
        List<EscrowEventEntity> rows = mapper.listAfterSeq(afterSeq, EscrowEventStore.normalizeLimit(limit));
        List<StoredEscrowEvent> out = new ArrayList<>(rows.size());
        for (EscrowEventEntity row : rows) {
            out.add(new StoredEscrowEvent(row.getSeq(), EscrowEventType.valueOf(row.getEventType()), row.getItemId(),
                    row.getBuyerAddress(), challengeOf(row), row.getOccurredAt()));
        }
        return out;
    }

    private String toPayload(EscrowEvent event) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("itemId", event.getItemId());
        node.put("buyerAddress", event.getBuyerAddress());
        if (event instanceof ChallengeIssuedEvent) {
            node.put("challenge", Numeric.toHexString(((ChallengeIssuedEvent) event).getChallenge()));
        }
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new EscrowException("事件序列化失败: " + event.getType(), e);
        }
    }

    private String challengeOf(EscrowEventEntity row) {
        if (row.getPayload() == null) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(row.getPayload());
            JsonNode challenge = node.get("challenge");
            return challenge == null || challenge.isNull() ? null : challenge.asText();
        } catch (JsonProcessingException e) {
            throw new EscrowException("事件负载解析失败: seq=" + row.getSeq(), e);
        }
    }
}
