package com.connections.engine;

import com.connections.api.Couple;
import com.connections.api.Identifier;
import org.junit.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.Assert.*;

public class SubgraphTest {
    private static final Identifier A = Identifier.of("A");
    private static final Identifier B = Identifier.of("B");
    private static final Identifier C = Identifier.of("C");
    private static final Identifier D = Identifier.of("D");
    private static final Identifier E = Identifier.of("E");

    // A =2= B - C, D isolated-ish: C - D, E isolated
    private UndirectedGraph graph() {
        UndirectedGraph g = new UndirectedGraph();
        g.addNode(A, Map.of("name", "a"));
        g.addNode(E);
        g.addEdge(A, B, Identifier.of("ab1"), Map.of("w", 1));
        g.addEdge(A, B, Identifier.of("ab2"), Map.of("w", 2));
        g.addEdge(B, C);
        g.addEdge(C, D);
        return g;
    }

    @Test
    public void testFullmatchKeepsCouplesInsideSelection() {
        AbstractGraph sub = graph().getSubgraph(List.of(A, B));

        assertTrue(sub instanceof UndirectedGraph);
        assertEquals(Set.of(A, B), sub.nodes().identifiers());
        assertEquals(Set.of(new Couple(A, B)), sub.edges().couples());
        assertEquals(Map.of("w", 2), sub.edges().attributes(new Couple(A, B), Identifier.of("ab2")));
        assertEquals(Map.of("name", "a"), sub.nodes().attributes(A));
        assertEquals(2, sub.degree(A));
        assertFalse(sub.isStale());
    }

    @Test
    public void testPartialMatchKeepsCouplesTouchingSelection() {
        AbstractGraph sub = graph().getSubgraph(List.of(B), false);

        assertEquals(Set.of(A, B, C), sub.nodes().identifiers());
        assertEquals(2, sub.edges().size());
        assertEquals(3, sub.degree(B));
        assertEquals(1, sub.degree(C));
    }

    @Test
    public void testIsolatedSelectionGivesEmptyGraph() {
        AbstractGraph sub = graph().getSubgraph(List.of(A, C));

        assertEquals(0, sub.size());
        assertEquals(0, sub.edges().size());
    }

    @Test
    public void testSelectedNodeWithoutKeptCoupleIsDropped() {
        AbstractGraph sub = graph().getSubgraph(List.of(A, B, E));

        assertFalse(sub.nodes().contains(E));
        assertEquals(2, sub.size());
    }

    @Test
    public void testUnknownIdentifiersAreIgnored() {
        AbstractGraph sub = graph().getSubgraph(List.of(C, D, Identifier.of("missing")));

        assertEquals(Set.of(C, D), sub.nodes().identifiers());
    }

    @Test
    public void testAttributesAreCopied() {
        UndirectedGraph g = graph();
        AbstractGraph sub = g.getSubgraph(List.of(A, B));
        sub.addNode(A, true, Map.of("name", "changed"));

        assertEquals(Map.of("name", "a"), g.nodes().attributes(A));
    }

    @Test
    public void testDirectedSubgraphKeepsBothDirections() {
        DirectedGraph g = new DirectedGraph();
        g.addEdge(A, B);
        g.addEdge(B, A);
        g.addEdge(B, C);

        AbstractGraph sub = g.getSubgraph(Set.of(A, B));
        assertTrue(sub instanceof DirectedGraph);
        assertEquals(2, sub.edges().size());
        assertEquals(Set.of(B), sub.neighbors(A));
        assertEquals(Set.of(A), sub.neighbors(B));
    }

    @Test
    public void testFullSelectionEqualsSourceGraph() {
        DirectedGraph g = new DirectedGraph();
        g.addEdge(A, B, Identifier.of("e1"), Map.of("k", "v"));
        g.addEdge(B, C);

        assertEquals(g, g.getSubgraph(g.nodes().identifiers()));
    }
}
