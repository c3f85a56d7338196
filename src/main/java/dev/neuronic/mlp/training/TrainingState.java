package dev.neuronic.mlp.training;

/**
 * Lifecycle of a single trainer call.
 *
 * <p>A call starts in {@link #TRAINING} and ends in exactly one of the terminal states.
 */
public enum TrainingState {

    /** No call has run yet, or a call is in progress. */
    TRAINING,

    /** The stopping condition (tolerance or predicate) was met. */
    CONVERGED,

    /** The iteration budget ran out first. */
    EXHAUSTED;

    public boolean isTerminal() {
        return this != TRAINING;
    }
}
