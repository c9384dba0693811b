package com.typeresolve.engine.query;

import com.typeresolve.engine.alias.AliasResolution;
import com.typeresolve.engine.alias.AliasResolver;
import com.typeresolve.engine.config.EngineConfig;
import com.typeresolve.engine.dynamic.DynamicBinding;
import com.typeresolve.engine.dynamic.DynamicReferenceResolver;
import com.typeresolve.engine.dynamic.Resolution;
import com.typeresolve.engine.graph.DeclarationGraph;
import com.typeresolve.engine.graph.RevisionCache;
import com.typeresolve.engine.graph.Symbol;
import com.typeresolve.engine.graph.SymbolRef;
import com.typeresolve.engine.resolve.ResolvedType;
import com.typeresolve.engine.resolve.TypeResolver;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Query surface used by classifiers: ancestry, conformance and dynamic-name lookups.
 *
 * Every method is a pure read over the graph's current revision. Answers that depend on
 * an opaque symbol come back as {@link Verdict#UNKNOWN}, never as {@link Verdict#FALSE}.
 * Schema-integrity problems surface as the resolvers' exceptions and only fail the query at hand.
 */
public class ClassificationEngine {

    /** Cache key for a (subject, candidate) pair. */
    record PairKey(SymbolRef subject, SymbolRef candidate) {}

    private final DeclarationGraph graph;
    private final EngineConfig config;
    private final AliasResolver aliasResolver;
    private final TypeResolver typeResolver;
    private final DynamicReferenceResolver dynamicResolver;
    private final List<DynamicBinding> bindings;

    private final RevisionCache<PairKey, Verdict> descentCache;
    private final RevisionCache<DynamicBinding, Resolution> bindingCache;
    private final RevisionCache<String, Resolution> keyCache;

    public ClassificationEngine(DeclarationGraph graph, EngineConfig config, List<DynamicBinding> bindings) {
        this.graph = graph;
        this.config = config;
        this.bindings = bindings != null ? List.copyOf(bindings) : Collections.emptyList();
        this.aliasResolver = new AliasResolver(graph);
        this.typeResolver = new TypeResolver(graph, aliasResolver, config.isCacheEnabled());
        this.dynamicResolver = new DynamicReferenceResolver(graph, config.getLocalModule(), config.getModuleScope());
        this.descentCache = new RevisionCache<>(graph, config.isCacheEnabled());
        this.bindingCache = new RevisionCache<>(graph, config.isCacheEnabled());
        this.keyCache = new RevisionCache<>(graph, config.isCacheEnabled());
    }

    public ClassificationEngine(DeclarationGraph graph) {
        this(graph, EngineConfig.defaults(), Collections.emptyList());
    }

    // --- Pass-throughs ---

    public Optional<Symbol> findSymbol(String module, String name) {
        return graph.getSymbol(module, name);
    }

    public AliasResolution resolveAlias(Symbol symbol) {
        return aliasResolver.resolveAlias(symbol);
    }

    public ResolvedType resolveType(Symbol classSymbol) {
        return typeResolver.resolveType(subjectOf(classSymbol));
    }

    public DeclarationGraph graph() { return graph; }
    public EngineConfig config() { return config; }
    public List<DynamicBinding> bindings() { return bindings; }

    // --- Ancestry ---

    /**
     * TRUE if {@code candidateBase} (after alias resolution) is in the subject's superclass chain,
     * UNKNOWN if the chain ends at an opaque symbol before reaching it, FALSE otherwise.
     * A type is not its own descendant.
     *
     * @throws TypeResolver.NotAClassException if the candidate resolves to a protocol composition,
     *                                         or the subject is not a class
     */
    public Verdict isDescendantOf(Symbol symbol, Symbol candidateBase) {
        Symbol subject = subjectOf(symbol);
        Symbol base = subjectOf(candidateBase);
        return descentCache.get(new PairKey(subject.ref(), base.ref()), key -> {
            if (subject.isOpaque()) {
                return subject.ref().equals(base.ref()) ? Verdict.FALSE : Verdict.UNKNOWN;
            }
            ResolvedType resolved = typeResolver.resolveType(subject);
            if (resolved.hasAncestor(base.ref())) return Verdict.TRUE;
            return resolved.terminatedAtOpaque() ? Verdict.UNKNOWN : Verdict.FALSE;
        });
    }

    // --- Conformance ---

    /**
     * Membership of {@code protocol} in the effective protocol set. A composition counts only
     * if every member is required. Opaque subjects are never known to conform.
     * Use {@link #conformance} where the open-world distinction matters.
     */
    public boolean conformsTo(Symbol symbol, Symbol protocol) {
        return conformance(symbol, protocol) == Verdict.TRUE;
    }

    /**
     * TRUE on membership; UNKNOWN when membership fails but an opaque ancestor or opaque
     * protocol could still bring the requirement in; FALSE otherwise.
     */
    public Verdict conformance(Symbol symbol, Symbol protocol) {
        Symbol subject = subjectOf(symbol);
        if (subject.isOpaque()) {
            return Verdict.UNKNOWN;
        }
        ResolvedType resolved = typeResolver.resolveType(subject);
        List<Symbol> required = aliasResolver.resolveAlias(protocol).members();
        boolean all = required.stream().allMatch(p -> resolved.requiresProtocol(p.ref()));
        if (all) return Verdict.TRUE;
        return resolved.terminatedAtOpaque() || resolved.hasOpaqueProtocol() ? Verdict.UNKNOWN : Verdict.FALSE;
    }

    // --- Dynamic references ---

    public Resolution resolveDynamicName(DynamicBinding binding) {
        return bindingCache.get(binding, dynamicResolver::resolveDynamicClassRef);
    }

    /** Resolves a lookup through {@code key} against every ingested binding for it. */
    public Resolution resolveDynamicKey(String key) {
        return keyCache.get(key, k -> dynamicResolver.resolveKey(k, bindings));
    }

    // --- Helpers ---

    private Symbol subjectOf(Symbol symbol) {
        AliasResolution resolution = aliasResolver.resolveAlias(symbol);
        if (resolution.isComposition()) {
            throw new TypeResolver.NotAClassException(symbol.ref(), "resolves to a protocol composition");
        }
        return resolution.members().get(0);
    }
}
