package com.typeresolve.engine;

import com.typeresolve.engine.alias.AliasResolver;
import com.typeresolve.engine.graph.DeclarationGraph;
import com.typeresolve.engine.graph.Symbol;
import com.typeresolve.engine.graph.SymbolRef;
import com.typeresolve.engine.resolve.ResolvedType;
import com.typeresolve.engine.resolve.TypeResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TypeResolverTest {

    private DeclarationGraph graph;
    private TypeResolver resolver;

    private static SymbolRef local(String name) {
        return SymbolRef.of("local", name);
    }

    private Symbol get(String name) {
        return graph.getSymbol("local", name).orElseThrow();
    }

    @BeforeEach
    void setUp() {
        graph = new DeclarationGraph();
        resolver = new TypeResolver(graph);
    }

    // --- Superclass chain ---

    @Test
    void aliasedSuperclassRecordsResolvedTargetNotAliasName() {
        graph.addSymbol(Symbol.opaque("external", "UIViewController"));
        graph.addSymbol(Symbol.alias("local", "BaseController", SymbolRef.of("external", "UIViewController")));
        graph.addSymbol(Symbol.classSymbol("local", "AliasedInheritanceController", local("BaseController"), List.of()));

        ResolvedType resolved = resolver.resolveType(get("AliasedInheritanceController"));
        assertEquals(List.of("external::UIViewController"), resolved.chainIds());
        assertTrue(resolved.canonicalSuperclassChain().get(0).isOpaque());
        assertTrue(resolved.terminatedAtOpaque());
    }

    @Test
    void chainStopsAtFirstOpaqueAncestor() {
        graph.addSymbol(Symbol.opaque("ExternalFramework", "BaseView"));
        graph.addSymbol(Symbol.classSymbol("local", "MyCustomView",
                SymbolRef.of("ExternalFramework", "BaseView"), List.of()));

        ResolvedType resolved = resolver.resolveType(get("MyCustomView"));
        assertEquals(List.of("ExternalFramework::BaseView"), resolved.chainIds());
        assertTrue(resolved.terminatedAtOpaque());
    }

    @Test
    void fullyLocalChainEndsAtRoot() {
        graph.addSymbol(Symbol.classSymbol("local", "Root", null, List.of()));
        graph.addSymbol(Symbol.classSymbol("local", "Middle", local("Root"), List.of()));
        graph.addSymbol(Symbol.classSymbol("local", "Leaf", local("Middle"), List.of()));

        ResolvedType resolved = resolver.resolveType(get("Leaf"));
        assertEquals(List.of("local::Middle", "local::Root"), resolved.chainIds());
        assertFalse(resolved.terminatedAtOpaque());
    }

    @Test
    void rootClassHasEmptyChain() {
        graph.addSymbol(Symbol.classSymbol("local", "Root", null, List.of()));

        ResolvedType resolved = resolver.resolveType(get("Root"));
        assertTrue(resolved.canonicalSuperclassChain().isEmpty());
        assertFalse(resolved.terminatedAtOpaque());
    }

    @Test
    void undeclaredSuperclassTreatedAsOpaque() {
        graph.addSymbol(Symbol.classSymbol("local", "Orphan", SymbolRef.of("Vendor", "Mystery"), List.of()));

        ResolvedType resolved = resolver.resolveType(get("Orphan"));
        assertEquals(List.of("Vendor::Mystery"), resolved.chainIds());
        assertTrue(resolved.terminatedAtOpaque());
    }

    // --- Errors ---

    @Test
    void nonClassSubjectRejected() {
        graph.addSymbol(Symbol.protocol("local", "Trackable", List.of()));
        graph.addSymbol(Symbol.opaque("UIKit", "UIView"));

        assertThrows(TypeResolver.NotAClassException.class, () -> resolver.resolveType(get("Trackable")));
        assertThrows(TypeResolver.NotAClassException.class,
                () -> resolver.resolveType(graph.getSymbol("UIKit", "UIView").orElseThrow()));
    }

    @Test
    void compositionAliasAsSuperclassRejected() {
        graph.addSymbol(Symbol.protocol("local", "A", List.of()));
        graph.addSymbol(Symbol.protocol("local", "B", List.of()));
        graph.addSymbol(Symbol.composition("local", "AB", List.of(local("A"), local("B"))));
        graph.addSymbol(Symbol.classSymbol("local", "Broken", local("AB"), List.of()));

        assertThrows(TypeResolver.InvalidSuperclassAliasException.class, () -> resolver.resolveType(get("Broken")));
    }

    @Test
    void protocolAsSuperclassRejected() {
        graph.addSymbol(Symbol.protocol("local", "Trackable", List.of()));
        graph.addSymbol(Symbol.classSymbol("local", "Wrong", local("Trackable"), List.of()));

        TypeResolver.NotAClassException ex = assertThrows(
                TypeResolver.NotAClassException.class, () -> resolver.resolveType(get("Wrong")));
        assertEquals(local("Trackable"), ex.getRef());
    }

    @Test
    void inheritanceCycleDetected() {
        graph.addSymbol(Symbol.classSymbol("local", "A", local("B"), List.of()));
        graph.addSymbol(Symbol.classSymbol("local", "B", local("C"), List.of()));
        graph.addSymbol(Symbol.classSymbol("local", "C", local("A"), List.of()));

        TypeResolver.CyclicInheritanceException ex = assertThrows(
                TypeResolver.CyclicInheritanceException.class, () -> resolver.resolveType(get("A")));
        assertEquals(List.of(local("A"), local("B"), local("C"), local("A")), ex.getCycle());
    }

    @Test
    void inheritanceCycleThroughAliasDetected() {
        graph.addSymbol(Symbol.alias("local", "Parent", local("Self")));
        graph.addSymbol(Symbol.classSymbol("local", "Self", local("Parent"), List.of()));

        assertThrows(TypeResolver.CyclicInheritanceException.class, () -> resolver.resolveType(get("Self")));
    }

    @Test
    void cyclicAliasInSuperclassPropagates() {
        graph.addSymbol(Symbol.alias("local", "X", local("Y")));
        graph.addSymbol(Symbol.alias("local", "Y", local("X")));
        graph.addSymbol(Symbol.classSymbol("local", "Victim", local("X"), List.of()));
        graph.addSymbol(Symbol.classSymbol("local", "Bystander", null, List.of()));

        assertThrows(AliasResolver.CyclicAliasException.class, () -> resolver.resolveType(get("Victim")));
        assertDoesNotThrow(() -> resolver.resolveType(get("Bystander")), "Other symbols stay resolvable");
    }

    // --- Protocol closure ---

    @Test
    void compositionProtocolsFlattenThroughAliases() {
        graph.addSymbol(Symbol.opaque("Swift", "Codable"));
        graph.addSymbol(Symbol.protocol("local", "Trackable", List.of()));
        graph.addSymbol(Symbol.alias("local", "Serializable", SymbolRef.of("Swift", "Codable")));
        graph.addSymbol(Symbol.composition("local", "AnalyticsEvent",
                List.of(local("Serializable"), local("Trackable"))));
        graph.addSymbol(Symbol.classSymbol("local", "UserLoginEvent", null, List.of(local("AnalyticsEvent"))));

        ResolvedType resolved = resolver.resolveType(get("UserLoginEvent"));
        assertEquals(List.of("Swift::Codable", "local::Trackable"), resolved.protocolIds());
    }

    @Test
    void protocolsInheritedFromSuperclassChain() {
        graph.addSymbol(Symbol.protocol("local", "Drawable", List.of()));
        graph.addSymbol(Symbol.protocol("local", "Tappable", List.of()));
        graph.addSymbol(Symbol.classSymbol("local", "Base", null, List.of(local("Drawable"))));
        graph.addSymbol(Symbol.classSymbol("local", "Button", local("Base"), List.of(local("Tappable"))));

        ResolvedType resolved = resolver.resolveType(get("Button"));
        assertEquals(List.of("local::Tappable", "local::Drawable"), resolved.protocolIds());
    }

    @Test
    void refinedProtocolsAreRequired() {
        graph.addSymbol(Symbol.protocol("local", "Identifiable", List.of()));
        graph.addSymbol(Symbol.protocol("local", "Entity", List.of(local("Identifiable"))));
        graph.addSymbol(Symbol.classSymbol("local", "User", null, List.of(local("Entity"))));

        ResolvedType resolved = resolver.resolveType(get("User"));
        assertEquals(List.of("local::Entity", "local::Identifiable"), resolved.protocolIds());
    }

    @Test
    void diamondProtocolRefinementIsNotACycle() {
        graph.addSymbol(Symbol.protocol("local", "Base", List.of()));
        graph.addSymbol(Symbol.protocol("local", "Left", List.of(local("Base"))));
        graph.addSymbol(Symbol.protocol("local", "Right", List.of(local("Base"))));
        graph.addSymbol(Symbol.classSymbol("local", "Both", null, List.of(local("Left"), local("Right"))));

        ResolvedType resolved = resolver.resolveType(get("Both"));
        assertEquals(List.of("local::Left", "local::Base", "local::Right"), resolved.protocolIds());
    }

    @Test
    void protocolRefinementCycleDetected() {
        graph.addSymbol(Symbol.protocol("local", "P", List.of(local("Q"))));
        graph.addSymbol(Symbol.protocol("local", "Q", List.of(local("P"))));
        graph.addSymbol(Symbol.classSymbol("local", "C", null, List.of(local("P"))));

        assertThrows(TypeResolver.CyclicInheritanceException.class, () -> resolver.resolveType(get("C")));
    }

    @Test
    void opaqueAncestorContributesNoProtocols() {
        graph.addSymbol(Symbol.opaque("ExternalFramework", "BaseView"));
        graph.addSymbol(Symbol.classSymbol("local", "MyCustomView",
                SymbolRef.of("ExternalFramework", "BaseView"), List.of()));

        assertTrue(resolver.resolveType(get("MyCustomView")).effectiveProtocols().isEmpty());
    }

    // --- Caching ---

    @Test
    void resultIsMemoizedUntilGraphChanges() {
        graph.addSymbol(Symbol.classSymbol("local", "Leaf", local("Parent"), List.of()));

        ResolvedType before = resolver.resolveType(get("Leaf"));
        assertSame(before, resolver.resolveType(get("Leaf")), "Same revision should hit the cache");
        assertTrue(before.terminatedAtOpaque(), "Undeclared parent is opaque");

        graph.addSymbol(Symbol.classSymbol("local", "Parent", null, List.of()));

        ResolvedType after = resolver.resolveType(get("Leaf"));
        assertNotSame(before, after);
        assertFalse(after.terminatedAtOpaque(), "Parent is now a known root");
        assertEquals(List.of("local::Parent"), after.chainIds());
    }

    @Test
    void cacheCanBeDisabled() {
        TypeResolver uncached = new TypeResolver(graph, new AliasResolver(graph), false);
        graph.addSymbol(Symbol.classSymbol("local", "Root", null, List.of()));

        ResolvedType first = uncached.resolveType(get("Root"));
        ResolvedType second = uncached.resolveType(get("Root"));
        assertNotSame(first, second);
        assertEquals(first, second);
    }
}
