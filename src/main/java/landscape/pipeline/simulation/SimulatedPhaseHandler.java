package landscape.pipeline.simulation;

import landscape.pipeline.config.PhaseSettings;
import landscape.pipeline.model.PhaseName;
import landscape.pipeline.orchestrator.ExecutionContext;
import landscape.pipeline.orchestrator.ItemOutcome;
import landscape.pipeline.orchestrator.PhaseHandler;
import landscape.pipeline.orchestrator.WorkItem;
import landscape.pipeline.resilience.ExternalServiceException;
import landscape.pipeline.service.StateTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Stand-in for a real data-collection phase.
 * Produces a fixed number of items, sleeps a random time per item and fails a share of them
 * with an upstream error, 503 unless {@code sim.failStatus} says otherwise. Item ids take the
 * shape of the phase's real unit of work: keywords, company domains or page URLs.
 *
 * Per-phase overrides come from the phase settings parameters:
 * {@code sim.items}, {@code sim.delayMinMs}, {@code sim.delayMaxMs}, {@code sim.failRate},
 * {@code sim.failStatus}.
 */
public final class SimulatedPhaseHandler implements PhaseHandler {

    private static final Logger log = LoggerFactory.getLogger(SimulatedPhaseHandler.class);

    private static final int DEFAULT_FAIL_STATUS = 503;

    private final PhaseName phase;
    private final String serviceName;
    private final int items;
    private final int delayMinMs;
    private final int delayMaxMs;
    private final double failRate;

    public SimulatedPhaseHandler(PhaseName phase, String serviceName, int items, int delayMinMs, int delayMaxMs,
            double failRate) {
        if (items < 0 || delayMinMs < 0 || delayMaxMs < delayMinMs || failRate < 0 || failRate > 1) {
            throw new IllegalArgumentException("invalid simulation settings for " + phase.key());
        }
        this.phase = phase;
        this.serviceName = serviceName;
        this.items = items;
        this.delayMinMs = delayMinMs;
        this.delayMaxMs = delayMaxMs;
        this.failRate = failRate;
    }

    @Override
    public PhaseName phase() {
        return phase;
    }

    @Override
    public String serviceName() {
        return serviceName;
    }

    @Override
    public List<WorkItem> enumerate(ExecutionContext context) {
        int count = intSetting(context, "sim.items", items);
        String region = context.parameter("region");
        List<WorkItem> work = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            work.add(new WorkItem(itemId(phase, i, region), Map.of("index", i)));
        }
        log.info("Simulated {} enumerated {} items for {}", phase.key(), count, context.executionId());
        return work;
    }

    @Override
    public ItemOutcome execute(WorkItem item, ExecutionContext context) throws Exception {
        int min = intSetting(context, "sim.delayMinMs", delayMinMs);
        int max = Math.max(min, intSetting(context, "sim.delayMaxMs", delayMaxMs));
        double rate = doubleSetting(context, "sim.failRate", failRate);
        int failStatus = intSetting(context, "sim.failStatus", DEFAULT_FAIL_STATUS);

        ThreadLocalRandom random = ThreadLocalRandom.current();
        Thread.sleep(min == max ? min : random.nextInt(min, max + 1));

        if (random.nextDouble() < rate) {
            throw new ExternalServiceException(failStatus, serviceName + " unavailable for " + item.itemId());
        }
        return ItemOutcome.completed(Map.of("item", item.itemId(), "source", serviceName));
    }

    static String itemId(PhaseName phase, int index, String region) {
        switch (phase) {
            case KEYWORD_METRICS:
            case SERP_COLLECTION:
                return StateTracker.keywordItemId("keyword " + index, region, "organic");
            case COMPANY_ENRICHMENT:
                return StateTracker.domainItemId("https://www.company-" + index + ".example/about");
            case VIDEO_ENRICHMENT:
                return StateTracker.urlItemId("https://video.example/watch?v=" + index + "#t=0");
            case CONTENT_SCRAPING:
            case CONTENT_ANALYSIS:
                return StateTracker.urlItemId("https://site-" + index + ".example/article#main");
            default:
                // aggregate steps have no natural key
                return phase.key() + "-" + index;
        }
    }

    private int intSetting(ExecutionContext context, String key, int fallback) {
        String value = settings(context).parameters().get(key);
        return value == null ? fallback : Integer.parseInt(value.trim());
    }

    private double doubleSetting(ExecutionContext context, String key, double fallback) {
        String value = settings(context).parameters().get(key);
        return value == null ? fallback : Double.parseDouble(value.trim());
    }

    private PhaseSettings settings(ExecutionContext context) {
        return context.config().settingsFor(phase);
    }
}
