package dev.univer.kuberan.conversation;

import lombok.Getter;
import lombok.Setter;

import java.time.Duration;
import java.time.Instant;

/**
 * A live multi-step conversation. Mutated only by the handler of the current event,
 * the dispatcher guarantees there is at most one such handler per chat and user.
 */
@Getter
public abstract class Session {

    private final SessionKey key;
    private final Duration timeout;

    private ConversationState state;

    /** Message carrying the buttons of the current step, edited in place on button presses. */
    @Setter
    private Integer promptMessageId;

    private volatile Instant lastActivity = Instant.EPOCH;

    protected Session(SessionKey key, ConversationState state, Duration timeout) {
        if (state.family() != key.family()) {
            throw new IllegalArgumentException(state + " does not belong to " + key.family());
        }
        this.key = key;
        this.state = state;
        this.timeout = timeout;
    }

    public void setState(ConversationState state) {
        if (state.family() != key.family()) {
            throw new IllegalArgumentException(state + " does not belong to " + key.family());
        }
        this.state = state;
    }

    void touch(Instant now) {
        this.lastActivity = now;
    }

    public boolean isExpired(Instant now) {
        return now.isAfter(lastActivity.plus(timeout));
    }
}
