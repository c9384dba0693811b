package com.typeresolve.engine.dynamic;

import com.typeresolve.engine.graph.DeclarationGraph;
import com.typeresolve.engine.graph.Symbol;
import com.typeresolve.engine.graph.SymbolKind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Resolves string-keyed class lookups (the NSClassFromString / storyboard-identifier pattern)
 * by matching statically proven literals against declared symbol names.
 *
 * Only CLASS and OPAQUE symbols are candidates: a runtime class lookup cannot produce a protocol
 * or a typealias. Values that were not proven static are never guessed at.
 */
public class DynamicReferenceResolver {

    private static final Comparator<Symbol> BY_MODULE_THEN_NAME =
            Comparator.comparing(Symbol::module).thenComparing(Symbol::name);

    private final DeclarationGraph graph;
    private final String localModule;
    private final Set<String> moduleScope;

    /**
     * @param localModule module whose match wins when a name exists in several modules
     * @param moduleScope modules searched for candidates; empty means every module
     */
    public DynamicReferenceResolver(DeclarationGraph graph, String localModule, Collection<String> moduleScope) {
        this.graph = graph;
        this.localModule = localModule;
        this.moduleScope = Set.copyOf(moduleScope);
    }

    public Resolution resolveDynamicClassRef(DynamicBinding binding) {
        Optional<String> literal = binding.literal();
        if (literal.isEmpty()) {
            return new Resolution.Unresolvable(Resolution.Reason.NOT_STATIC);
        }
        return graph.read(() -> pick(candidatesNamed(literal.get())));
    }

    /**
     * Resolves a lookup through {@code key} using every binding observed for it.
     * One unproven binding, or one literal that names no visible class, makes the whole lookup
     * unresolvable; distinct literals that name different symbols produce an ambiguous match.
     */
    public Resolution resolveKey(String key, Collection<DynamicBinding> bindings) {
        List<DynamicBinding> forKey = bindings.stream()
                .filter(b -> b.key().equals(key))
                .collect(Collectors.toList());
        if (forKey.isEmpty()) {
            return new Resolution.Unresolvable(Resolution.Reason.NO_BINDING);
        }
        Set<String> literals = new LinkedHashSet<>();
        for (DynamicBinding binding : forKey) {
            if (binding.literal().isEmpty()) {
                return new Resolution.Unresolvable(Resolution.Reason.NOT_STATIC);
            }
            literals.add(binding.literalValue());
        }
        if (literals.size() == 1) {
            return resolveDynamicClassRef(forKey.get(0));
        }

        return graph.read(() -> {
            Set<Symbol> merged = new LinkedHashSet<>();
            for (String literal : literals) {
                Resolution resolution = pick(candidatesNamed(literal));
                // A site naming an unseen class leaves the whole key open
                if (resolution.kind() == ResolutionKind.UNRESOLVABLE) {
                    return resolution;
                }
                merged.addAll(resolution.candidates());
            }
            List<Symbol> ordered = new ArrayList<>(merged);
            ordered.sort(BY_MODULE_THEN_NAME);
            if (ordered.size() == 1) return new Resolution.Resolved(ordered.get(0));
            return new Resolution.AmbiguousMatch(ordered);
        });
    }

    private List<Symbol> candidatesNamed(String name) {
        return graph.symbolsNamed(name).stream()
                .filter(s -> s.kind() == SymbolKind.CLASS || s.kind() == SymbolKind.OPAQUE)
                .filter(s -> moduleScope.isEmpty() || moduleScope.contains(s.module()))
                .sorted(BY_MODULE_THEN_NAME)
                .collect(Collectors.toList());
    }

    private Resolution pick(List<Symbol> candidates) {
        if (candidates.isEmpty()) {
            return new Resolution.Unresolvable(Resolution.Reason.NO_MATCH);
        }
        if (candidates.size() == 1) {
            return new Resolution.Resolved(candidates.get(0));
        }
        // (module, name) is unique, so at most one local candidate
        for (Symbol candidate : candidates) {
            if (candidate.module().equals(localModule)) {
                return new Resolution.Resolved(candidate);
            }
        }
        return new Resolution.AmbiguousMatch(candidates);
    }
}
