package com.connections.util;

import com.connections.api.Identifier;
import com.connections.engine.DirectedGraph;
import com.connections.engine.UndirectedGraph;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class GraphExplainTest {
    private static final Identifier X = Identifier.of("X");
    private static final Identifier Y = Identifier.of("Y");
    private static final Identifier Z = Identifier.of("Z");

    private static DirectedGraph scenario() {
        DirectedGraph g = new DirectedGraph(List.of(X, Y, Z), null);
        g.addEdge(X, Y, Identifier.of("e1"), Map.of());
        g.addEdge(X, Y, Identifier.of("e2"), Map.of());
        g.addEdge(Y, Z, Identifier.of("e3"), Map.of());
        return g;
    }

    @Test
    public void testSummarySingular() {
        UndirectedGraph g = new UndirectedGraph();
        g.addEdge(Identifier.of("A"), Identifier.of("B"));

        assertEquals("Complete Undirected Graph with 2 nodes and 1 edge", GraphExplain.summarize(g.describe()));
    }

    @Test
    public void testSummaryEmpty() {
        assertEquals("Complete Directed Graph with 0 node and 0 edge", new DirectedGraph().toString());
    }

    @Test
    public void testSummaryScenario() {
        assertEquals("Multi Directed Graph with 3 nodes and 2 edges",
                GraphExplain.summarize(scenario().describe()));
    }

    @Test
    public void testExplainNode() {
        DirectedGraph g = scenario();
        g.addNode(Y, true, Map.of("label", "middle"));
        String text = new GraphExplain(g).explainNode(Y);

        assertTrue(text.startsWith("Node: Y"));
        assertTrue(text.contains("Attributes: {label=middle}"));
        assertTrue(text.contains("Degree: 3"));
        assertTrue(text.contains("Neighbors: [Z]"));
        assertFalse(text.contains("stale"));
    }

    @Test
    public void testExplainNodeReportsStaleness() {
        DirectedGraph g = scenario();
        g.addEdge(X, Z, null, false, true, false, Map.of());
        String text = new GraphExplain(g).explainNode(X);

        assertTrue(text.contains("Degree: 2"));
        assertTrue(text.contains("stale"));
    }

    @Test
    public void testDumpTopology() {
        String text = new GraphExplain(scenario()).dumpTopology();

        assertTrue(text.startsWith("Multi Directed Graph with 3 nodes and 2 edges:"));
        assertTrue(text.contains("X -> Y [e1, e2]"));
        assertTrue(text.contains("Y (degree 3)"));
    }

    @Test
    public void testMermaid() {
        String mermaid = new GraphExplain(scenario()).toMermaid();

        assertTrue(mermaid.startsWith("graph LR;"));
        assertTrue(mermaid.contains("  X[\"X\"];"));
        assertTrue(mermaid.contains("  X -->|x2| Y;"));
        assertTrue(mermaid.contains("  Y --> Z;"));
    }

    @Test
    public void testMermaidUndirectedWithNumericIdentifiers() {
        UndirectedGraph g = new UndirectedGraph();
        g.addEdge(Identifier.of("a-b"), Identifier.of(7L));
        String mermaid = new GraphExplain(g).toMermaid();

        assertTrue(mermaid.contains("  n7[\"7\"];"));
        assertTrue(mermaid.contains("  n7 --- a_b;"));
    }

    @Test
    public void testMermaidIdsStayDistinct() {
        DirectedGraph g = new DirectedGraph();
        g.addEdge(Identifier.of("a-b"), Identifier.of("a_b"));
        g.addEdge(Identifier.of(7L), Identifier.of("n7"));
        String mermaid = new GraphExplain(g).toMermaid();

        assertTrue(mermaid.contains("  a_b[\"a-b\"];"));
        assertTrue(mermaid.contains("  a_b_1[\"a_b\"];"));
        assertTrue(mermaid.contains("  n7[\"7\"];"));
        assertTrue(mermaid.contains("  n7_1[\"n7\"];"));
        assertTrue(mermaid.contains("  a_b --> a_b_1;"));
        assertTrue(mermaid.contains("  n7 --> n7_1;"));
    }

    @Test
    public void testMermaidEscapesQuotesInLabels() {
        DirectedGraph g = new DirectedGraph();
        g.addNode(Identifier.of("say \"hi\""));
        String mermaid = new GraphExplain(g).toMermaid();

        assertTrue(mermaid.contains("[\"say #quot;hi#quot;\"];"));
    }
}
