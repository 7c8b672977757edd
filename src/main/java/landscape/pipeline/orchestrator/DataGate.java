package landscape.pipeline.orchestrator;

import landscape.pipeline.model.PhaseName;

/**
 * Entry condition on live data: {@code count(dataset) >= minCount}.
 *
 * @param source  phase that produces the dataset; the gate is waived when that phase is disabled
 * @param dataset name understood by the {@link DataAvailabilityQuery}
 */
public record DataGate(PhaseName source, String dataset, long minCount) {

    public DataGate {
        if (source == null || dataset == null || dataset.isBlank()) {
            throw new IllegalArgumentException("data gate needs a source phase and a dataset");
        }
        if (minCount < 1) {
            throw new IllegalArgumentException("minCount must be >= 1");
        }
    }

    /** At least one completed item of the given phase */
    public static DataGate resultsOf(PhaseName phase) {
        return new DataGate(phase, phase.key(), 1);
    }

    public String describe() {
        return "requires at least " + minCount + " " + dataset + " result" + (minCount == 1 ? "" : "s");
    }
}
