package com.typeresolve.engine.dynamic;

import com.typeresolve.engine.graph.Symbol;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a dynamic class-name lookup. Callers switch on {@link #kind()} and must handle
 * all three shapes: ambiguity and unresolvability are answers, not errors.
 */
public interface Resolution {

    ResolutionKind kind();

    /** Matching symbols: one when resolved, several when ambiguous, none otherwise. */
    List<Symbol> candidates();

    record Resolved(Symbol symbol) implements Resolution {
        public Resolved {
            Objects.requireNonNull(symbol, "symbol");
        }

        @Override public ResolutionKind kind() { return ResolutionKind.RESOLVED; }
        @Override public List<Symbol> candidates() { return List.of(symbol); }
    }

    /** Candidates ordered by module name. */
    record AmbiguousMatch(List<Symbol> candidates) implements Resolution {
        public AmbiguousMatch {
            candidates = List.copyOf(candidates);
            if (candidates.size() < 2) {
                throw new IllegalArgumentException("An ambiguous match needs at least two candidates");
            }
        }

        @Override public ResolutionKind kind() { return ResolutionKind.AMBIGUOUS; }
    }

    record Unresolvable(Reason reason) implements Resolution {
        public Unresolvable {
            Objects.requireNonNull(reason, "reason");
        }

        @Override public ResolutionKind kind() { return ResolutionKind.UNRESOLVABLE; }
        @Override public List<Symbol> candidates() { return List.of(); }
    }

    enum Reason {
        /** The value was not proven to be a compile-time literal. */
        NOT_STATIC,
        /** No symbol carries the literal's name. */
        NO_MATCH,
        /** No binding was observed for the key. */
        NO_BINDING
    }
}
