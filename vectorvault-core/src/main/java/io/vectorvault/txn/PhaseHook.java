package io.vectorvault.txn;

/**
 * Observes an operation as it moves through its phases. Throwing from the hook makes the
 * operation fail at that point, which is how tests simulate a crash at each transition.
 */
@FunctionalInterface
public interface PhaseHook {

    PhaseHook NONE = (kind, phase, step) -> {};

    String ENTER = "enter";

    /**
     * @param step {@link #ENTER} when the phase is entered, otherwise the name of the step
     *             just completed inside {@link OperationPhase#EXECUTING}
     */
    void on(OperationKind kind, OperationPhase phase, String step);
}
