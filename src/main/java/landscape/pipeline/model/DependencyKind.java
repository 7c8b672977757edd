package landscape.pipeline.model;

/**
 * Kind of edge between two phases.
 */
public enum DependencyKind {
    /** Dependent runs only after the dependency completed */
    HARD,
    /** Dependent runs once the dependency settled, whatever the outcome */
    SOFT
}
