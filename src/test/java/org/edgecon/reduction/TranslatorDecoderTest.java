package org.edgecon.reduction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.edgecon.cdcl.CDCLSolver;
import org.edgecon.cdcl.SATResult;
import org.edgecon.formula.FormulaContext;
import org.edgecon.graph.Edge;
import org.edgecon.graph.EdgeConGraph;
import org.edgecon.graph.Graph;
import org.junit.jupiter.api.Test;

final class TranslatorDecoderTest {

    private static EdgeConGraph path3() {
        return new EdgeConGraph(new Graph(3, List.of(Edge.of(0, 1), Edge.of(1, 2))), List.of("a", "b", "c"));
    }

    @Test
    void trueEdgeVariablesBecomeTranslators() {
        EdgeConGraph graph = new EdgeConGraph(new Graph(2, List.of(Edge.of(0, 1))), List.of("red", "blue"));

        Map<Edge, Integer> placement = TranslatorDecoder.decodeModel(name -> name.equals("x_[(0,1),0]"), graph);

        assertEquals(Map.of(Edge.of(0, 1), 0), placement);
        assertTrue(graph.hasTranslator(0, 1));
        assertEquals(0, graph.getParent(1));
        assertEquals(1, graph.hierarchyDepth());
    }

    @Test
    void edgeWithTwoIndicesIsAnInternalFault() {
        Set<String> trueNames = Set.of("x_[(0,1),0]", "x_[(0,1),1]");
        EdgeConGraph graph = path3();

        assertThrows(IllegalStateException.class,
                () -> TranslatorDecoder.decodeModel(trueNames::contains, graph));
        assertTrue(graph.getTranslators().isEmpty());
    }

    @Test
    void indexOnTwoEdgesIsAnInternalFault() {
        Set<String> trueNames = Set.of("x_[(0,1),0]", "x_[(1,2),0]");
        EdgeConGraph graph = path3();

        assertThrows(IllegalStateException.class,
                () -> TranslatorDecoder.decodeModel(trueNames::contains, graph));
        assertTrue(graph.getTranslators().isEmpty(), "nessun traduttore parziale dopo un modello incoerente");
        assertEquals(-1, graph.getLevel(1));
    }

    @Test
    void decodedSolverModelRespectsUniqueness() throws Exception {
        EdgeConGraph graph = path3();
        SATResult result = new CDCLSolver().solve(EdgeConReduction.buildReduction(new FormulaContext(), graph, 1));
        assertTrue(result.isSatisfiable());

        Map<Edge, Integer> placement = TranslatorDecoder.decodeModel(result.getModel(), graph);

        assertTrue(placement.containsKey(Edge.of(1, 2)), "la componente 2 può avere solo 1 come genitore");
        assertEquals(placement.size(), new HashSet<>(placement.values()).size());
        assertEquals(placement.keySet(), graph.getTranslators());
        for (int index : placement.values()) {
            assertTrue(index >= 0 && index < 2);
        }
    }
}
