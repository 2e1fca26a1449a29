package io.graphsync.worker;

import io.graphsync.failed.FailedEventManager;
import io.graphsync.model.OutboxEvent;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;
import org.springframework.boot.actuate.endpoint.annotation.Selector;
import org.springframework.boot.actuate.endpoint.annotation.WriteOperation;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operator view of FAILED outbox events.
 *
 * <pre>
 * GET  /actuator/graphsyncfailed?aggregateType=household   - count and oldest failures
 * POST /actuator/graphsyncfailed/{eventId}                 - replay one event
 * POST /actuator/graphsyncfailed                           - replay all (optionally by type)
 * </pre>
 */
@Component
@Endpoint(id = "graphsyncfailed")
public class FailedEventsEndpoint {
    private static final int LIST_LIMIT = 50;
    private static final int REPLAY_BATCH = 500;

    private final FailedEventManager failedEvents;

    public FailedEventsEndpoint(FailedEventManager failedEvents) {
        this.failedEvents = failedEvents;
    }

    @ReadOperation
    public Map<String, Object> failed(@Nullable String aggregateType) {
        List<Map<String, Object>> events = failedEvents.query(aggregateType, LIST_LIMIT).stream()
                .map(FailedEventsEndpoint::describe)
                .toList();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("count", failedEvents.count(aggregateType));
        body.put("events", events);
        return body;
    }

    @WriteOperation
    public Map<String, Object> replay(@Selector long eventId) {
        return Map.of("eventId", eventId, "replayed", failedEvents.replay(eventId));
    }

    @WriteOperation
    public Map<String, Object> replayAll(@Nullable String aggregateType) {
        return Map.of("replayed", failedEvents.replayAll(aggregateType, REPLAY_BATCH));
    }

    private static Map<String, Object> describe(OutboxEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", event.id());
        row.put("tableName", event.tableName());
        row.put("aggregateType", event.aggregateType());
        row.put("aggregateId", event.aggregateId());
        row.put("op", event.op().name());
        row.put("attempts", event.attempts());
        row.put("lastError", event.lastError());
        row.put("createdAt", event.createdAt().toString());
        return row;
    }
}
