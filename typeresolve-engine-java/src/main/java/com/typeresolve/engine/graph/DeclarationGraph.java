package com.typeresolve.engine.graph;

import com.typeresolve.engine.ResolutionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * In-memory registry of every known type, protocol, alias and opaque declaration.
 *
 * Single writer, many readers: {@link #addSymbol} takes the write lock and bumps the revision,
 * reads take the read lock. Resolvers wrap a whole query in {@link #read} so that a query never
 * sees a half-applied mutation; the read lock is reentrant, so nested lookups are fine.
 */
public class DeclarationGraph {

    public static class DuplicateSymbolException extends ResolutionException {
        private final SymbolRef ref;

        public DuplicateSymbolException(SymbolRef ref) {
            super("Symbol already registered: " + ref.id());
            this.ref = ref;
        }

        public SymbolRef getRef() { return ref; }
    }

    private final Map<SymbolRef, Symbol> symbols = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicLong revision = new AtomicLong();

    /**
     * Registers {@code symbol}.
     *
     * @throws DuplicateSymbolException if (module, name) is already registered
     */
    public void addSymbol(Symbol symbol) {
        lock.writeLock().lock();
        try {
            SymbolRef ref = symbol.ref();
            if (symbols.containsKey(ref)) {
                throw new DuplicateSymbolException(ref);
            }
            symbols.put(ref, symbol);
            revision.incrementAndGet();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Returns empty for unknown references instead of failing (forward references). */
    public Optional<Symbol> getSymbol(String module, String name) {
        return read(() -> Optional.ofNullable(symbols.get(new SymbolRef(module, name))));
    }

    public Optional<Symbol> getSymbol(SymbolRef ref) {
        return getSymbol(ref.module(), ref.name());
    }

    /**
     * Resolves a raw reference to its symbol. A dangling reference yields an opaque placeholder:
     * a symbol nobody declared is one the engine knows nothing about.
     */
    public Symbol lookup(SymbolRef ref) {
        return getSymbol(ref).orElseGet(() -> Symbol.opaque(ref.module(), ref.name()));
    }

    /**
     * Class symbols in registration order. Each {@code iterator()} call takes a fresh snapshot,
     * so the sequence can be walked any number of times.
     */
    public Iterable<Symbol> allClassSymbols() {
        return () -> snapshot(SymbolKind.CLASS).iterator();
    }

    /** Every symbol named {@code name}, ordered by module. */
    public List<Symbol> symbolsNamed(String name) {
        return read(() -> symbols.values().stream()
                .filter(s -> s.name().equals(name))
                .sorted(Comparator.comparing(Symbol::module))
                .collect(Collectors.toList()));
    }

    public int size() {
        return read(symbols::size);
    }

    /** Incremented on every mutation; caches compare against it. */
    public long revision() {
        return revision.get();
    }

    /** Runs {@code query} under the read lock. */
    public <T> T read(Supplier<T> query) {
        lock.readLock().lock();
        try {
            return query.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<Symbol> snapshot(SymbolKind kind) {
        return read(() -> {
            List<Symbol> result = new ArrayList<>();
            for (Symbol s : symbols.values()) {
                if (s.kind() == kind) result.add(s);
            }
            return Collections.unmodifiableList(result);
        });
    }

    @Override
    public String toString() {
        return "DeclarationGraph{symbols=" + size() + ", revision=" + revision() + "}";
    }
}
