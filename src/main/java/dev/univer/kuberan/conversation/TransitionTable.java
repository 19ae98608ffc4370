package dev.univer.kuberan.conversation;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Handler per (state, input kind). Built once at startup and checked for completeness:
 * every input a state accepts has a handler and no handler exists for input it does not.
 */
public final class TransitionTable {

    private final Map<ConversationState, Map<InputKind, StateHandler>> handlers;

    private TransitionTable(Map<ConversationState, Map<InputKind, StateHandler>> handlers) {
        this.handlers = handlers;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<StateHandler> find(ConversationState state, InputKind kind) {
        return Optional.ofNullable(handlers.getOrDefault(state, Map.of()).get(kind));
    }

    public static final class Builder {

        private final Map<ConversationState, Map<InputKind, StateHandler>> handlers = new EnumMap<>(ConversationState.class);

        private Builder() {}

        public Builder on(ConversationState state, InputKind kind, StateHandler handler) {
            StateHandler previous = handlers.computeIfAbsent(state, s -> new EnumMap<>(InputKind.class)).put(kind, handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handler for " + state + "/" + kind);
            }
            return this;
        }

        /** Registers the handler for every state. */
        public Builder onEvery(InputKind kind, StateHandler handler) {
            for (ConversationState state : ConversationState.values()) on(state, kind, handler);
            return this;
        }

        public Builder with(Consumer<Builder> registrar) {
            registrar.accept(this);
            return this;
        }

        public TransitionTable build() {
            for (ConversationState state : ConversationState.values()) {
                Map<InputKind, StateHandler> row = handlers.getOrDefault(state, Map.of());
                for (InputKind kind : InputKind.values()) {
                    if (state.accepts(kind) && !row.containsKey(kind)) {
                        throw new IllegalStateException("No handler for " + state + "/" + kind);
                    }
                    if (!state.accepts(kind) && row.containsKey(kind)) {
                        throw new IllegalStateException(state + " does not accept " + kind);
                    }
                }
            }
            Map<ConversationState, Map<InputKind, StateHandler>> frozen = new EnumMap<>(ConversationState.class);
            handlers.forEach((state, row) -> frozen.put(state, new EnumMap<>(row)));
            return new TransitionTable(frozen);
        }
    }
}
