package com.connections.io;

import com.connections.api.Couple;
import com.connections.api.ErrorKind;
import com.connections.api.GraphException;
import com.connections.api.Identifier;
import com.connections.engine.AbstractGraph;
import com.connections.engine.DirectedGraph;
import com.connections.engine.UndirectedGraph;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class JsonGraphCodecTest {
    private static final Identifier A = Identifier.of("A");
    private static final Identifier B = Identifier.of("B");

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final JsonGraphCodec codec = new JsonGraphCodec();

    private static DirectedGraph directed() {
        DirectedGraph g = new DirectedGraph();
        g.addNode(A, Map.of("age", 19, "tags", List.of("x", "y")));
        g.addNode(Identifier.of(3L));
        g.addEdge(A, B, Identifier.of("e1"), Map.of("amount", 1400));
        g.addEdge(A, B, Identifier.of(5L), Map.of("path", List.of(1, 2, 3)));
        g.addEdge(B, B, Identifier.of("loop"), Map.of());
        return g;
    }

    @Test
    public void testDirectedRoundTrip() {
        DirectedGraph g = directed();
        AbstractGraph restored = codec.importFromJson(codec.exportToJson(g));

        assertTrue(restored instanceof DirectedGraph);
        assertEquals(g, restored);
        assertEquals(g.degree(A), restored.degree(A));
        assertEquals(g.neighbors(B), restored.neighbors(B));
    }

    @Test
    public void testUndirectedRoundTrip() {
        UndirectedGraph g = new UndirectedGraph();
        g.addEdge(B, A, Identifier.of("e1"), Map.of("w", 1));
        g.addEdge(Identifier.of(1L), A);

        AbstractGraph restored = codec.importFromJson(codec.exportToJson(g));
        assertTrue(restored instanceof UndirectedGraph);
        assertEquals(g, restored);
        assertTrue(restored.edges().contains(new Couple(A, B)));
    }

    @Test
    public void testExportedDocument() {
        String json = codec.exportToJson(directed());

        assertTrue(json.contains("\"type\" : \"DIRECTED\""));
        assertTrue(json.contains("\"couple\" : [ \"A\", \"B\" ]"));
        assertTrue(json.contains("\"identifier\" : 5"));
        assertFalse(json.contains("degree"));
    }

    @Test
    public void testRepeatedCouplesAreMerged() {
        String json = "{\"type\":\"directed\",\"edges\":["
                + "{\"couple\":[\"A\",\"B\"],\"multiples\":[{\"identifier\":\"e1\"}]},"
                + "{\"couple\":[\"A\",\"B\"],\"multiples\":[{\"identifier\":\"e2\"}]}]}";
        AbstractGraph g = codec.importFromJson(json);

        assertEquals(2, g.multiples(A, B).size());
        assertEquals(2, g.degree(A));
    }

    @Test
    public void testDuplicateEdgeIdentifier() {
        String json = "{\"type\":\"DIRECTED\",\"edges\":["
                + "{\"couple\":[\"A\",\"B\"],\"multiples\":[{\"identifier\":\"e1\"},{\"identifier\":\"e1\"}]}]}";
        try {
            codec.importFromJson(json);
            fail("Should have thrown DUPLICATION_IN_EDGE_IDENTIFIERS");
        } catch (GraphException e) {
            assertEquals(ErrorKind.DUPLICATION_IN_EDGE_IDENTIFIERS, e.kind());
            assertEquals(new Couple(A, B), e.couple());
            assertTrue(e.getCause() instanceof GraphException);
            GraphException cause = (GraphException) e.getCause();
            assertEquals(ErrorKind.EDGE_ALREADY_EXISTS, cause.kind());
            assertEquals(Identifier.of("e1"), cause.identifier());
        }
    }

    @Test
    public void testDuplicateEdgeIdentifierAcrossReversedUndirectedCouples() {
        String json = "{\"type\":\"UNDIRECTED\",\"edges\":["
                + "{\"couple\":[\"A\",\"B\"],\"multiples\":[{\"identifier\":\"e1\"}]},"
                + "{\"couple\":[\"B\",\"A\"],\"multiples\":[{\"identifier\":\"e1\"}]}]}";
        try {
            codec.importFromJson(json);
            fail("Should have thrown DUPLICATION_IN_EDGE_IDENTIFIERS");
        } catch (GraphException e) {
            assertEquals(ErrorKind.DUPLICATION_IN_EDGE_IDENTIFIERS, e.kind());
            assertEquals(new Couple(A, B), e.couple());
            assertEquals(ErrorKind.EDGE_ALREADY_EXISTS, ((GraphException) e.getCause()).kind());
        }
    }

    @Test
    public void testDuplicateNode() {
        String json = "{\"type\":\"DIRECTED\",\"nodes\":[{\"identifier\":\"A\"},{\"identifier\":\"A\"}]}";
        try {
            codec.importFromJson(json);
            fail("Should have thrown NODE_ALREADY_EXISTS");
        } catch (GraphException e) {
            assertEquals(ErrorKind.NODE_ALREADY_EXISTS, e.kind());
            assertEquals(A, e.identifier());
        }
    }

    @Test
    public void testNodeTypeCheckPrecedesDuplicateCheck() {
        String json = "{\"type\":\"DIRECTED\",\"nodes\":[{\"identifier\":1.5},{\"identifier\":1.5}]}";
        try {
            codec.importFromJson(json);
            fail("Should have thrown WRONG_TYPE_OF_NODE_IDENTIFIER");
        } catch (GraphException e) {
            assertEquals(ErrorKind.WRONG_TYPE_OF_NODE_IDENTIFIER, e.kind());
        }
    }

    @Test
    public void testEdgeValidationPrecedesDuplicateNode() {
        String json = "{\"type\":\"DIRECTED\",\"nodes\":[{\"identifier\":\"A\"},{\"identifier\":\"A\"}],"
                + "\"edges\":[{\"couple\":[\"A\",\"B\",\"C\"],\"multiples\":[]}]}";
        try {
            codec.importFromJson(json);
            fail("Should have thrown WRONG_LENGTH_OF_COUPLE");
        } catch (GraphException e) {
            assertEquals(ErrorKind.WRONG_LENGTH_OF_COUPLE, e.kind());
        }
    }

    @Test
    public void testDanglingCouplesGainEndpointsOnImport() {
        DirectedGraph g = new DirectedGraph();
        g.addEdge(A, B, Identifier.of("e1"), false, false, true, Map.of());
        assertEquals(0, g.size());

        AbstractGraph restored = codec.importFromJson(codec.exportToJson(g));
        assertEquals(2, restored.size());
        assertEquals(Map.of(), restored.nodes().attributes(A));
        assertEquals(g.edges().couples(), restored.edges().couples());
        assertNotEquals(g, restored);
    }

    @Test
    public void testMalformedCoupleGoesThroughValidation() {
        String json = "{\"type\":\"UNDIRECTED\",\"edges\":[{\"couple\":[\"A\"],\"multiples\":[]}]}";
        try {
            codec.importFromJson(json);
            fail("Should have thrown WRONG_LENGTH_OF_COUPLE");
        } catch (GraphException e) {
            assertEquals(ErrorKind.WRONG_LENGTH_OF_COUPLE, e.kind());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownType() {
        codec.importFromJson("{\"type\":\"HYPER\"}");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingType() {
        codec.importFromJson("{\"nodes\":[]}");
    }

    @Test(expected = UncheckedIOException.class)
    public void testInvalidJson() {
        codec.importFromJson("{\"type\":");
    }

    @Test
    public void testFileRoundTrip() throws Exception {
        Path file = folder.newFile("graph.json").toPath();
        DirectedGraph g = directed();
        codec.exportToFile(g, file);

        assertEquals(g, codec.importFromFile(file));
    }

    @Test
    public void testWrongFileExtension() throws Exception {
        Path file = folder.newFile("graph.txt").toPath();
        try {
            codec.exportToFile(directed(), file);
            fail("Should have thrown WRONG_FILE_EXTENSION");
        } catch (GraphException e) {
            assertEquals(ErrorKind.WRONG_FILE_EXTENSION, e.kind());
            assertEquals(ErrorKind.Family.SNAPSHOT, e.family());
        }
        try {
            codec.importFromFile(file);
            fail("Should have thrown WRONG_FILE_EXTENSION");
        } catch (GraphException e) {
            assertEquals(ErrorKind.WRONG_FILE_EXTENSION, e.kind());
        }
    }

    @Test(expected = UncheckedIOException.class)
    public void testMissingFile() {
        codec.importFromFile(folder.getRoot().toPath().resolve("absent.json"));
    }
}
