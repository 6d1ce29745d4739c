package ai.schemaflow.store.statemachine;

import ai.schemaflow.model.db.exceptions.InvalidTransitionException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Legal status edges of one entity kind. A state without outgoing edges is terminal.
 *
 * <p>Staying in the current state is always allowed, so a patch that repeats the stored status is a no-op
 * rather than an error.
 */
public final class TransitionTable<S extends Enum<S>> {
    private final Class<S> type;
    private final Map<S, Set<S>> edges;

    private TransitionTable(Class<S> type, Map<S, Set<S>> edges) {
        this.type = type;
        this.edges = edges;
    }

    public static <S extends Enum<S>> Builder<S> builder(Class<S> type) {
        return new Builder<>(type);
    }

    public boolean isAllowed(S from, S to) {
        return from == to || edges.get(from).contains(to);
    }

    public boolean isTerminal(S state) {
        return edges.get(state).isEmpty();
    }

    public Set<S> next(S from) {
        return Collections.unmodifiableSet(edges.get(from));
    }

    public void check(String entity, long id, S from, S to) throws InvalidTransitionException {
        if (isAllowed(from, to)) {
            return;
        }
        throw new InvalidTransitionException(entity, id, from, to,
            isTerminal(from) ? "%s is a terminal state".formatted(from) : "transition is not allowed");
    }

    @Override
    public String toString() {
        return "TransitionTable<" + type.getSimpleName() + ">" + edges;
    }

    public static final class Builder<S extends Enum<S>> {
        private final Class<S> type;
        private final EnumMap<S, EnumSet<S>> edges;

        private Builder(Class<S> type) {
            this.type = type;
            this.edges = new EnumMap<>(type);
            for (S state : type.getEnumConstants()) {
                edges.put(state, EnumSet.noneOf(type));
            }
        }

        @SafeVarargs
        public final Builder<S> allow(S from, S... to) {
            Collections.addAll(edges.get(from), to);
            return this;
        }

        public TransitionTable<S> build() {
            var copy = new EnumMap<S, Set<S>>(type);
            edges.forEach((from, to) -> copy.put(from, Collections.unmodifiableSet(EnumSet.copyOf(to))));
            return new TransitionTable<>(type, copy);
        }
    }
}
