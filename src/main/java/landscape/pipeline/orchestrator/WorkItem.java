package landscape.pipeline.orchestrator;

import java.util.Map;

/**
 * One discrete unit of phase work: a keyword triple, a domain, a URL.
 *
 * @param itemId  identifier unique within (execution, phase)
 * @param payload phase-specific input, stored as JSON with the item
 */
public record WorkItem(String itemId, Map<String, Object> payload) {

    public WorkItem {
        if (itemId == null || itemId.isBlank()) {
            throw new IllegalArgumentException("itemId is required");
        }
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public static WorkItem of(String itemId) {
        return new WorkItem(itemId, Map.of());
    }

    public String string(String key) {
        Object value = payload.get(key);
        return value != null ? value.toString() : null;
    }
}
