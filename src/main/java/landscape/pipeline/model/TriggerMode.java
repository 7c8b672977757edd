package landscape.pipeline.model;

/**
 * How an execution was started.
 */
public enum TriggerMode {
    MANUAL,
    SCHEDULED,
    API
}
