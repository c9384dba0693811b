package com.typeresolve.engine.resolve;

import com.typeresolve.engine.ResolutionException;
import com.typeresolve.engine.alias.AliasResolution;
import com.typeresolve.engine.alias.AliasResolver;
import com.typeresolve.engine.graph.DeclarationGraph;
import com.typeresolve.engine.graph.RevisionCache;
import com.typeresolve.engine.graph.Symbol;
import com.typeresolve.engine.graph.SymbolKind;
import com.typeresolve.engine.graph.SymbolRef;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Computes the superclass chain and the effective protocol set of a class symbol,
 * resolving every reference through the {@link AliasResolver}.
 *
 * The chain stops at the first opaque ancestor: what an opaque type inherits from is
 * left to the caller. Results are memoized per (symbol, graph revision).
 */
public class TypeResolver {

    public static class NotAClassException extends ResolutionException {
        private final SymbolRef ref;

        public NotAClassException(SymbolRef ref, String detail) {
            super("Not a class: " + ref.id() + " (" + detail + ")");
            this.ref = ref;
        }

        public SymbolRef getRef() { return ref; }
    }

    public static class InvalidSuperclassAliasException extends ResolutionException {
        public InvalidSuperclassAliasException(SymbolRef subclass, SymbolRef alias) {
            super("Superclass of " + subclass.id() + " is the protocol composition " + alias.id());
        }
    }

    public static class CyclicInheritanceException extends ResolutionException {
        private final List<SymbolRef> cycle;

        public CyclicInheritanceException(List<SymbolRef> cycle) {
            super("Cyclic inheritance: " + cycle.stream().map(SymbolRef::id).collect(Collectors.joining(" -> ")));
            this.cycle = List.copyOf(cycle);
        }

        public List<SymbolRef> getCycle() { return cycle; }
    }

    private final DeclarationGraph graph;
    private final AliasResolver aliasResolver;
    private final RevisionCache<SymbolRef, ResolvedType> cache;

    public TypeResolver(DeclarationGraph graph, AliasResolver aliasResolver, boolean cacheEnabled) {
        this.graph = graph;
        this.aliasResolver = aliasResolver;
        this.cache = new RevisionCache<>(graph, cacheEnabled);
    }

    public TypeResolver(DeclarationGraph graph) {
        this(graph, new AliasResolver(graph), true);
    }

    /**
     * @throws NotAClassException              if {@code classSymbol} is not a CLASS, or an ancestor resolves to a protocol
     * @throws InvalidSuperclassAliasException if a superclass reference resolves to a composition
     * @throws CyclicInheritanceException      if the chain or a protocol refinement loops
     */
    public ResolvedType resolveType(Symbol classSymbol) {
        if (classSymbol.kind() != SymbolKind.CLASS) {
            throw new NotAClassException(classSymbol.ref(), "kind is " + classSymbol.kind());
        }
        return cache.get(classSymbol.ref(), ref -> compute(classSymbol));
    }

    private ResolvedType compute(Symbol classSymbol) {
        List<Symbol> chain = new ArrayList<>();
        List<SymbolRef> visited = new ArrayList<>();
        visited.add(classSymbol.ref());

        boolean terminatedAtOpaque = false;
        Symbol current = classSymbol;
        while (current.declaredSuperclass() != null) {
            Symbol declared = graph.lookup(current.declaredSuperclass());
            AliasResolution resolution = aliasResolver.resolveAlias(declared);
            if (resolution.isComposition()) {
                throw new InvalidSuperclassAliasException(current.ref(), declared.ref());
            }
            Symbol next = resolution.members().get(0);

            int seenAt = visited.indexOf(next.ref());
            if (seenAt >= 0) {
                List<SymbolRef> cycle = new ArrayList<>(visited.subList(seenAt, visited.size()));
                cycle.add(next.ref());
                throw new CyclicInheritanceException(cycle);
            }
            if (next.isOpaque()) {
                chain.add(next);
                terminatedAtOpaque = true;
                break;
            }
            if (next.kind() != SymbolKind.CLASS) {
                throw new NotAClassException(next.ref(),
                        "superclass of " + current.id() + " resolves to a " + next.kind());
            }
            chain.add(next);
            visited.add(next.ref());
            current = next;
        }

        Set<Symbol> protocols = new LinkedHashSet<>();
        Set<SymbolRef> expanded = new HashSet<>();
        collectProtocols(classSymbol.declaredProtocols(), protocols, expanded, new ArrayList<>());
        for (Symbol ancestor : chain) {
            if (!ancestor.isOpaque()) {
                collectProtocols(ancestor.declaredProtocols(), protocols, expanded, new ArrayList<>());
            }
        }

        return new ResolvedType(classSymbol, chain, protocols, terminatedAtOpaque);
    }

    private void collectProtocols(List<SymbolRef> refs, Set<Symbol> out, Set<SymbolRef> expanded, List<SymbolRef> path) {
        for (SymbolRef ref : refs) {
            for (Symbol member : aliasResolver.resolveAlias(graph.lookup(ref)).members()) {
                int seenAt = path.indexOf(member.ref());
                if (seenAt >= 0) {
                    List<SymbolRef> cycle = new ArrayList<>(path.subList(seenAt, path.size()));
                    cycle.add(member.ref());
                    throw new CyclicInheritanceException(cycle);
                }
                out.add(member);
                // Refinements of a known protocol are required too
                if (member.kind() == SymbolKind.PROTOCOL && expanded.add(member.ref())) {
                    path.add(member.ref());
                    collectProtocols(member.declaredProtocols(), out, expanded, path);
                    path.remove(path.size() - 1);
                }
            }
        }
    }
}
