package landscape.pipeline.service;

import landscape.pipeline.model.Checkpoint;
import landscape.pipeline.model.ErrorCategory;
import landscape.pipeline.model.ItemState;
import landscape.pipeline.model.ItemStatus;
import landscape.pipeline.model.PhaseName;
import landscape.pipeline.model.PhaseProgress;
import landscape.pipeline.repository.CheckpointRepository;
import landscape.pipeline.repository.ItemStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Durable item-level progress ledger.
 *
 * Every write goes straight to the store, so the set of remaining items after a crash is
 * exactly what {@link #pendingItems} returns. It is the only place that decides which
 * items still need work.
 */
public class StateTracker {

    private static final Logger log = LoggerFactory.getLogger(StateTracker.class);

    private final ItemStateRepository items;
    private final CheckpointRepository checkpoints;
    private final Clock clock;

    public StateTracker(ItemStateRepository items, CheckpointRepository checkpoints, Clock clock) {
        this.items = items;
        this.checkpoints = checkpoints;
        this.clock = clock;
    }

    /**
     * Register enumerated work. Items already known keep their status and attempts.
     *
     * @param payloads item id to JSON payload, in enumeration order
     * @return number of newly registered items
     */
    public int register(String executionId, PhaseName phase, Map<String, String> payloads, int maxAttempts) {
        List<ItemState> rows = new ArrayList<>(payloads.size());
        for (Map.Entry<String, String> entry : payloads.entrySet()) {
            rows.add(ItemState.builder()
                    .executionId(executionId)
                    .phase(phase)
                    .itemId(entry.getKey())
                    .status(ItemStatus.PENDING)
                    .maxAttempts(maxAttempts)
                    .progressData(entry.getValue())
                    .build());
        }
        int inserted = items.insertMissing(rows);
        log.debug("Registered {} new of {} items for {} {}", inserted, rows.size(), executionId, phase);
        return inserted;
    }

    /**
     * Keyed, idempotent status write. PROCESSING starts a new attempt.
     *
     * @return false if a PROCESSING transition was refused (item done or out of attempts)
     */
    public boolean record(String executionId, PhaseName phase, String itemId, ItemStatus status, String error) {
        if (status == ItemStatus.PROCESSING) {
            return beginAttempt(executionId, phase, itemId);
        }
        items.upsert(ItemState.builder()
                .executionId(executionId)
                .phase(phase)
                .itemId(itemId)
                .status(status)
                .lastError(error)
                .build());
        return true;
    }

    public boolean beginAttempt(String executionId, PhaseName phase, String itemId) {
        return items.markProcessing(executionId, phase, itemId, clock.instant());
    }

    public void recordCompleted(String executionId, PhaseName phase, String itemId, String output,
            boolean degraded, String warning) {
        items.upsert(ItemState.builder()
                .executionId(executionId)
                .phase(phase)
                .itemId(itemId)
                .status(ItemStatus.COMPLETED)
                .degraded(degraded)
                .lastError(warning)
                .errorCategory(degraded ? ErrorCategory.DEGRADED : null)
                .progressData(output)
                .build());
    }

    public void recordFailed(String executionId, PhaseName phase, String itemId, String error,
            ErrorCategory category) {
        items.upsert(ItemState.builder()
                .executionId(executionId)
                .phase(phase)
                .itemId(itemId)
                .status(ItemStatus.FAILED)
                .lastError(error)
                .errorCategory(category)
                .build());
    }

    public int markQueued(String executionId, PhaseName phase, List<String> itemIds) {
        return items.markQueued(executionId, phase, itemIds);
    }

    /**
     * Items that still need work: in flight, or failed under the attempt ceiling.
     */
    public List<ItemState> pendingItems(String executionId, PhaseName phase) {
        return items.findRemaining(executionId, phase);
    }

    public Optional<ItemState> item(String executionId, PhaseName phase, String itemId) {
        return items.find(executionId, phase, itemId);
    }

    public List<ItemState> items(String executionId, PhaseName phase) {
        return items.findByPhase(executionId, phase);
    }

    public List<ItemState> failedItems(String executionId, PhaseName phase, int limit) {
        return items.findFailed(executionId, phase, limit);
    }

    public PhaseProgress progress(String executionId, PhaseName phase) {
        return items.progress(executionId, phase);
    }

    public Map<PhaseName, PhaseProgress> progressByPhase(String executionId) {
        return items.progressByExecution(executionId);
    }

    /**
     * Share of all registered items, across phases, that reached a terminal state.
     */
    public double overallProgress(String executionId) {
        int total = 0;
        int terminal = 0;
        for (PhaseProgress progress : items.progressByExecution(executionId).values()) {
            total += progress.total();
            terminal += progress.terminal();
        }
        return total == 0 ? 0.0 : (terminal * 100.0) / total;
    }

    public Optional<Instant> lastActivity(String executionId, PhaseName phase) {
        return items.lastActivity(executionId, phase);
    }

    // Checkpoints

    public void saveCheckpoint(String executionId, PhaseName phase, String name, int processed, int total,
            String stateData) {
        checkpoints.save(new Checkpoint(executionId, phase, name, processed, total, stateData, clock.instant()));
    }

    public Optional<Checkpoint> checkpoint(String executionId, PhaseName phase, String name) {
        return checkpoints.find(executionId, phase, name);
    }

    /**
     * The final checkpoint if the phase has one, otherwise its latest progress checkpoint.
     */
    public Optional<Checkpoint> latestCheckpoint(String executionId, PhaseName phase) {
        Optional<Checkpoint> fin = checkpoints.find(executionId, phase, Checkpoint.FINAL);
        return fin.isPresent() ? fin : checkpoints.find(executionId, phase, Checkpoint.PROGRESS);
    }

    public List<Checkpoint> checkpoints(String executionId) {
        return checkpoints.findByExecution(executionId);
    }

    // Item identifiers

    /** {@code keyword:region:content-type}, e.g. {@code crm software:us:organic} */
    public static String keywordItemId(String keyword, String region, String contentType) {
        if (keyword == null || keyword.isBlank()) {
            throw new IllegalArgumentException("keyword is required");
        }
        return keyword.trim().toLowerCase(Locale.ROOT) + ":"
                + normalizePart(region) + ":" + normalizePart(contentType);
    }

    /**
     * Bare lowercase host without {@code www.}, from either a domain or a URL.
     */
    public static String domainItemId(String domainOrUrl) {
        if (domainOrUrl == null || domainOrUrl.isBlank()) {
            throw new IllegalArgumentException("domain is required");
        }
        String value = domainOrUrl.trim().toLowerCase(Locale.ROOT);
        if (value.contains("://")) {
            String host = URI.create(value).getHost();
            if (host == null) {
                throw new IllegalArgumentException("URL has no host: " + domainOrUrl);
            }
            value = host;
        } else {
            int slash = value.indexOf('/');
            if (slash >= 0) {
                value = value.substring(0, slash);
            }
        }
        return value.startsWith("www.") ? value.substring(4) : value;
    }

    /** The URL without its fragment */
    public static String urlItemId(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url is required");
        }
        String value = url.trim();
        int hash = value.indexOf('#');
        return hash >= 0 ? value.substring(0, hash) : value;
    }

    private static String normalizePart(String part) {
        return part == null || part.isBlank() ? "any" : part.trim().toLowerCase(Locale.ROOT);
    }
}
