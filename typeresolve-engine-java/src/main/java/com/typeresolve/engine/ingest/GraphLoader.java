package com.typeresolve.engine.ingest;

import com.typeresolve.engine.graph.DeclarationGraph;
import com.typeresolve.engine.graph.Symbol;
import com.typeresolve.engine.graph.SymbolKind;
import com.typeresolve.engine.graph.SymbolRef;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Builds a {@link DeclarationGraph} from a deserialized graph.json.
 *
 * References may point forward to symbols declared later in the file. References that
 * never resolve are reported on stderr; the engine treats them as opaque.
 */
public class GraphLoader {

    private final String localModule;

    public GraphLoader(String localModule) {
        this.localModule = localModule;
    }

    /**
     * @throws GraphReadException                        for a symbol without a name, or with an unknown kind or invalid shape
     * @throws DeclarationGraph.DuplicateSymbolException if (module, name) appears twice
     */
    public DeclarationGraph load(GraphDocument document) {
        DeclarationGraph graph = new DeclarationGraph();
        Set<SymbolRef> referenced = new LinkedHashSet<>();

        int index = 0;
        for (GraphDocument.SymbolDoc doc : document.getSymbols()) {
            index++;
            Symbol symbol = toSymbol(doc, index);
            graph.addSymbol(symbol);
            if (symbol.declaredSuperclass() != null) referenced.add(symbol.declaredSuperclass());
            referenced.addAll(symbol.declaredProtocols());
            referenced.addAll(symbol.aliasTarget());
        }

        for (SymbolRef ref : referenced) {
            if (graph.getSymbol(ref).isEmpty()) {
                System.err.println("[typeresolve] WARNING: reference to undeclared symbol treated as opaque: " + ref.id());
            }
        }
        return graph;
    }

    private Symbol toSymbol(GraphDocument.SymbolDoc doc, int index) {
        if (doc == null || doc.name == null || doc.name.isBlank()) {
            throw new GraphReadException("Symbol #" + index + " has no name");
        }
        String module = doc.module != null ? doc.module : localModule;
        SymbolKind kind = parseKind(doc.kind, module + "::" + doc.name);

        List<SymbolRef> aliasTarget = toRefs(doc.aliasTarget);
        try {
            return new Symbol(
                    module,
                    doc.name,
                    kind,
                    doc.superclass != null ? toRef(doc.superclass) : null,
                    toRefs(doc.protocols),
                    aliasTarget,
                    doc.composition
            );
        } catch (IllegalArgumentException e) {
            throw new GraphReadException("Invalid symbol #" + index + ": " + e.getMessage(), e);
        }
    }

    private SymbolKind parseKind(String kind, String id) {
        if (kind == null) {
            throw new GraphReadException("Symbol " + id + " has no kind");
        }
        try {
            return SymbolKind.valueOf(kind.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new GraphReadException("Symbol " + id + " has unknown kind: " + kind, e);
        }
    }

    private List<SymbolRef> toRefs(List<GraphDocument.RefDoc> docs) {
        List<SymbolRef> refs = new ArrayList<>();
        if (docs == null) return refs;
        for (GraphDocument.RefDoc doc : docs) {
            refs.add(toRef(doc));
        }
        return refs;
    }

    private SymbolRef toRef(GraphDocument.RefDoc doc) {
        if (doc == null || doc.name == null || doc.name.isBlank()) {
            throw new GraphReadException("Reference without a name");
        }
        return new SymbolRef(doc.module != null ? doc.module : localModule, doc.name);
    }
}
