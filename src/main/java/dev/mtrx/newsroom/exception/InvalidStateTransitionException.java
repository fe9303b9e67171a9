package dev.mtrx.newsroom.exception;

import lombok.Getter;

/**
 * A status change that the issue or job state machine does not allow. No side effect has been applied.
 */
@Getter
public class InvalidStateTransitionException extends PipelineException {

    private final String entity;
    private final Object entityId;
    private final String currentState;
    private final String attemptedTransition;

    public InvalidStateTransitionException(String entity, Object entityId, String currentState, String attemptedTransition) {
        super(ErrorKind.INVALID_STATE_TRANSITION, String.format("Cannot %s %s %s in state %s",
                attemptedTransition, entity, entityId, currentState));
        this.entity = entity;
        this.entityId = entityId;
        this.currentState = currentState;
        this.attemptedTransition = attemptedTransition;
    }
}
