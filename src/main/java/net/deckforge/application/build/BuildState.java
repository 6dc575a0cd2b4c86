package net.deckforge.application.build;

/**
 * Phases of one build run.
 *
 * <p>{@code VALIDATING} ends in {@code REJECTED} or continues through
 * {@code ALLOCATING_VERSION}, {@code CARRYING_FORWARD}, {@code MATERIALIZING}
 * and {@code FINALIZING} to {@code DONE}. A structural error moves any phase
 * to {@code FAILED}.</p>
 */
public enum BuildState {
    VALIDATING,
    REJECTED,
    ALLOCATING_VERSION,
    CARRYING_FORWARD,
    MATERIALIZING,
    FINALIZING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == REJECTED || this == DONE || this == FAILED;
    }
}
