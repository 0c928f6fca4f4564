package dev.postrelay.exception;

import dev.postrelay.model.LifecycleState;
import dev.postrelay.model.LifecycleTransition;
import lombok.Getter;

/**
 * Thrown when a lifecycle transition is not legal from the item's current state.
 * The item is left unchanged.
 */
@Getter
public class PreconditionViolationException extends RelayException {

    private final Long itemId;
    private final LifecycleState state;

    public PreconditionViolationException(Long itemId, LifecycleState state, String message) {
        super(message);
        this.itemId = itemId;
        this.state = state;
    }

    public static PreconditionViolationException of(Long itemId, LifecycleState state,
                                                    LifecycleTransition transition) {
        return new PreconditionViolationException(itemId, state,
                String.format("Cannot %s item %d in state %s",
                        transition.name().toLowerCase().replace('_', ' '), itemId, state));
    }
}
