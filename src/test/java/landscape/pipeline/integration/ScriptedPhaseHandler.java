package landscape.pipeline.integration;

import landscape.pipeline.model.PhaseName;
import landscape.pipeline.orchestrator.ExecutionContext;
import landscape.pipeline.orchestrator.ItemOutcome;
import landscape.pipeline.orchestrator.PhaseHandler;
import landscape.pipeline.orchestrator.WorkItem;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Phase handler for tests: a fixed number of items and a scripted outcome per call.
 */
final class ScriptedPhaseHandler implements PhaseHandler {

    @FunctionalInterface
    interface Script {
        /**
         * @param call 1 for the first call on this item
         */
        ItemOutcome run(WorkItem item, int call) throws Exception;
    }

    private final PhaseName phase;
    private final int items;
    private final Script script;
    private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();

    ScriptedPhaseHandler(PhaseName phase, int items, Script script) {
        this.phase = phase;
        this.items = items;
        this.script = script;
    }

    static ScriptedPhaseHandler completing(PhaseName phase, int items) {
        return new ScriptedPhaseHandler(phase, items, (item, call) -> ItemOutcome.completed(Map.of("ok", true)));
    }

    static ScriptedPhaseHandler failing(PhaseName phase, int items) {
        return new ScriptedPhaseHandler(phase, items, (item, call) -> ItemOutcome.failed("bad input " + item.itemId()));
    }

    static ScriptedPhaseHandler slow(PhaseName phase, int items, long delayMs) {
        return new ScriptedPhaseHandler(phase, items, (item, call) -> {
            Thread.sleep(delayMs);
            return ItemOutcome.completed(Map.of("ok", true));
        });
    }

    @Override
    public PhaseName phase() {
        return phase;
    }

    @Override
    public String serviceName() {
        return "test-" + phase.key();
    }

    @Override
    public List<WorkItem> enumerate(ExecutionContext context) {
        List<WorkItem> work = new ArrayList<>();
        for (int i = 1; i <= items; i++) {
            work.add(new WorkItem(phase.key() + "-" + i, Map.of("index", i)));
        }
        return work;
    }

    @Override
    public ItemOutcome execute(WorkItem item, ExecutionContext context) throws Exception {
        int call = calls.computeIfAbsent(item.itemId(), k -> new AtomicInteger()).incrementAndGet();
        return script.run(item, call);
    }

    int calls(String itemId) {
        AtomicInteger count = calls.get(itemId);
        return count == null ? 0 : count.get();
    }

    int totalCalls() {
        return calls.values().stream().mapToInt(AtomicInteger::get).sum();
    }
}
