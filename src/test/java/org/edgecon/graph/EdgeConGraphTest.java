package org.edgecon.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

final class EdgeConGraphTest {

    /** 0,1 rossi collegati; 2,4 blu collegati; 3 rosso isolato dal punto di vista omogeneo. */
    private static EdgeConGraph sample() {
        Graph graph = new Graph(5, List.of(Edge.of(0, 1), Edge.of(1, 2), Edge.of(2, 4), Edge.of(3, 4)));
        return new EdgeConGraph(graph, List.of("red", "red", "blue", "red", "blue"));
    }

    @Test
    void edgesAreCanonical() {
        assertEquals(Edge.of(1, 3), Edge.of(3, 1));
        assertEquals("(1,3)", Edge.of(3, 1).toString());
        assertEquals(1, Edge.of(3, 1).opposite(3));
        assertThrows(IllegalArgumentException.class, () -> Edge.of(2, 2));
    }

    @Test
    void graphAnswersAdjacencyQueries() {
        Graph graph = new Graph(3, List.of(Edge.of(2, 1), Edge.of(0, 1), Edge.of(1, 2)));

        assertEquals(2, graph.numEdges());
        assertEquals(List.of(Edge.of(0, 1), Edge.of(1, 2)), graph.getEdges());
        assertTrue(graph.isEdge(2, 1));
        assertFalse(graph.isEdge(0, 2));
        assertFalse(graph.isEdge(0, 7));
        assertEquals(List.of(0, 2), graph.neighbours(1));
        assertThrows(IllegalArgumentException.class, () -> new Graph(2, List.of(Edge.of(0, 2))));
    }

    @Test
    void componentsFollowHomogeneousEdgesAndSmallestVertexOrder() {
        EdgeConGraph graph = sample();

        assertEquals(3, graph.numComponents());
        assertEquals(0, graph.componentOf(0));
        assertEquals(0, graph.componentOf(1));
        assertEquals(1, graph.componentOf(2));
        assertEquals(2, graph.componentOf(3));
        assertTrue(graph.isVertexInComponent(4, 1));
        assertEquals(List.of(2, 4), graph.verticesOf(1));
    }

    @Test
    void translatorsRequireAnExistingEdge() {
        EdgeConGraph graph = sample();

        assertThrows(IllegalArgumentException.class, () -> graph.addTranslator(0, 4));
        graph.addTranslator(2, 1);
        assertTrue(graph.hasTranslator(1, 2));
        assertEquals(List.of(Edge.of(1, 2)), List.copyOf(graph.getTranslators()));
    }

    @Test
    void hierarchyIsRebuiltFromTranslators() {
        EdgeConGraph graph = sample();
        assertEquals(0, graph.hierarchyDepth());
        assertEquals(-1, graph.getLevel(1));

        graph.addTranslator(1, 2);
        graph.recomputeComponents();
        assertEquals(0, graph.getParent(1));
        assertEquals(1, graph.getLevel(1));
        assertEquals(-1, graph.getLevel(2));
        assertFalse(graph.isHierarchyConnected());

        graph.addTranslator(3, 4);
        graph.recomputeComponents();
        assertEquals(1, graph.getParent(2));
        assertEquals(2, graph.getLevel(2));
        assertEquals(2, graph.hierarchyDepth());
        assertTrue(graph.isHierarchyConnected());
    }

    @Test
    void explicitPartitionKeepsItsLabels() {
        Graph graph = new Graph(3, List.of(Edge.of(0, 1), Edge.of(1, 2)));
        EdgeConGraph partitioned = EdgeConGraph.fromPartition(graph, new int[] {0, 0, 1}, 2);

        assertEquals(2, partitioned.numComponents());
        assertFalse(partitioned.hasColours());
        assertThrows(IllegalStateException.class, () -> partitioned.getColour(0));

        partitioned.addTranslator(1, 2);
        partitioned.recomputeComponents();
        assertEquals(1, partitioned.componentOf(2));
        assertEquals(1, partitioned.hierarchyDepth());
    }
}
