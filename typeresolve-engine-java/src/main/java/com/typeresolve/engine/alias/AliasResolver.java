package com.typeresolve.engine.alias;

import com.typeresolve.engine.ResolutionException;
import com.typeresolve.engine.graph.DeclarationGraph;
import com.typeresolve.engine.graph.Symbol;
import com.typeresolve.engine.graph.SymbolKind;
import com.typeresolve.engine.graph.SymbolRef;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Expands typealias-style indirection to a canonical target.
 *
 * Aliases of aliases are followed; composition members are resolved recursively and
 * flattened in place (first-seen order, duplicates dropped). The alias symbols on the
 * current recursion path are tracked, so a cycle fails fast instead of looping and
 * recursion depth never exceeds the number of symbols in the graph.
 */
public class AliasResolver {

    public static class CyclicAliasException extends ResolutionException {
        private final List<SymbolRef> cycle;

        public CyclicAliasException(List<SymbolRef> cycle) {
            super("Cyclic alias: " + cycle.stream().map(SymbolRef::id).collect(Collectors.joining(" -> ")));
            this.cycle = List.copyOf(cycle);
        }

        /** The cycle, starting and ending with the same alias. */
        public List<SymbolRef> getCycle() { return cycle; }
    }

    private final DeclarationGraph graph;

    public AliasResolver(DeclarationGraph graph) {
        this.graph = graph;
    }

    /**
     * Identity for anything but an alias.
     *
     * @throws CyclicAliasException if the alias chain loops back on itself
     */
    public AliasResolution resolveAlias(Symbol symbol) {
        return graph.read(() -> resolve(symbol, new ArrayList<>()));
    }

    /** Resolves an already-resolved result again. Returns an equal value. */
    public AliasResolution normalize(AliasResolution resolution) {
        if (!resolution.isComposition()) {
            return resolveAlias(resolution.members().get(0));
        }
        Set<Symbol> flattened = new LinkedHashSet<>();
        for (Symbol member : resolution.members()) {
            flattened.addAll(resolveAlias(member).members());
        }
        return new CompositionTarget(new ArrayList<>(flattened));
    }

    private AliasResolution resolve(Symbol symbol, List<Symbol> path) {
        if (symbol.kind() != SymbolKind.ALIAS) {
            return new SingleTarget(symbol);
        }
        int seenAt = indexOf(path, symbol.ref());
        if (seenAt >= 0) {
            List<SymbolRef> cycle = new ArrayList<>();
            for (Symbol s : path.subList(seenAt, path.size())) cycle.add(s.ref());
            cycle.add(symbol.ref());
            throw new CyclicAliasException(cycle);
        }

        path.add(symbol);
        try {
            if (!symbol.composition()) {
                return resolve(graph.lookup(symbol.aliasTarget().get(0)), path);
            }
            Set<Symbol> flattened = new LinkedHashSet<>();
            for (SymbolRef memberRef : symbol.aliasTarget()) {
                flattened.addAll(resolve(graph.lookup(memberRef), path).members());
            }
            return new CompositionTarget(new ArrayList<>(flattened));
        } finally {
            path.remove(path.size() - 1);
        }
    }

    private static int indexOf(List<Symbol> path, SymbolRef ref) {
        for (int i = 0; i < path.size(); i++) {
            if (path.get(i).ref().equals(ref)) return i;
        }
        return -1;
    }
}
