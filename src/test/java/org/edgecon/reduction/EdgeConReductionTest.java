package org.edgecon.reduction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.edgecon.cdcl.CDCLSolver;
import org.edgecon.cdcl.SATResult;
import org.edgecon.formula.Formula;
import org.edgecon.formula.FormulaContext;
import org.edgecon.formula.Model;
import org.edgecon.graph.Edge;
import org.edgecon.graph.EdgeConGraph;
import org.edgecon.graph.Graph;
import org.junit.jupiter.api.Test;

final class EdgeConReductionTest {

    /** Due vertici, un arco, due componenti: {0} radice e {1}. */
    private static EdgeConGraph twoVertices() {
        return new EdgeConGraph(new Graph(2, List.of(Edge.of(0, 1))), List.of("red", "blue"));
    }

    /** Cammino 0 -- 1 -- 2 con tre colori: tre componenti. */
    private static EdgeConGraph path3() {
        return new EdgeConGraph(new Graph(3, List.of(Edge.of(0, 1), Edge.of(1, 2))), List.of("a", "b", "c"));
    }

    private static SATResult solve(EdgeConGraph graph, int k) throws Exception {
        Formula phi = EdgeConReduction.buildReduction(new FormulaContext(), graph, k);
        return new CDCLSolver().solve(phi);
    }

    //region SCENARI

    @Test
    void twoVerticesWithZeroBoundForceTheOnlyTranslator() throws Exception {
        FormulaContext context = new FormulaContext();
        Formula phi = EdgeConReduction.buildReduction(context, twoVertices(), 0);

        SATResult result = new CDCLSolver().solve(phi);

        assertTrue(result.isSatisfiable());
        Model model = result.getModel();
        assertTrue(model.valueOf("p_[1,0]"));
        assertTrue(model.valueOf("l_[1,0]"));
        assertTrue(model.valueOf("x_[(0,1),0]"));
        assertTrue(phi.evaluate(model));
    }

    @Test
    void twoVerticesWithBoundOneAreUnsatisfiable() throws Exception {
        assertFalse(solve(twoVertices(), 1).isSatisfiable());
    }

    @Test
    void singleComponentIsUnsatisfiable() throws Exception {
        EdgeConGraph single = new EdgeConGraph(new Graph(2, List.of(Edge.of(0, 1))), List.of("red", "red"));

        assertFalse(solve(single, 0).isSatisfiable());
    }

    @Test
    void pathModelsSatisfyEveryStructuralProperty() throws Exception {
        EdgeConGraph graph = path3();
        int components = 3;
        int translators = components - 1;

        for (int k = 0; k < translators; k++) {
            SATResult result = solve(graph, k);
            assertTrue(result.isSatisfiable(), "k=" + k);
            Model model = result.getModel();

            // Al più un indice per arco, al più un arco per indice
            for (Edge edge : graph.getGraph().getEdges()) {
                assertTrue(countTrue(model, edgeNames(edge, translators)) <= 1);
            }
            for (int i = 0; i < translators; i++) {
                List<String> names = new ArrayList<>();
                for (Edge edge : graph.getGraph().getEdges()) {
                    names.add(VariableNames.edgeVariable(edge.getFirst(), edge.getSecond(), i));
                }
                assertTrue(countTrue(model, names) <= 1);
            }

            // Esattamente un genitore per le non radici, esattamente un livello per tutte
            for (int j = 1; j < components; j++) {
                List<String> parents = new ArrayList<>();
                for (int j1 = 0; j1 < components; j1++) {
                    if (j1 != j) {
                        parents.add(VariableNames.parentVariable(j, j1));
                    }
                }
                assertEquals(1, countTrue(model, parents), "genitori di " + j);
            }
            int deepest = -1;
            for (int c = 0; c < components; c++) {
                List<String> levels = new ArrayList<>();
                for (int h = 0; h < translators; h++) {
                    levels.add(VariableNames.levelVariable(c, h));
                    if (model.valueOf(VariableNames.levelVariable(c, h))) {
                        deepest = Math.max(deepest, h);
                    }
                }
                assertEquals(1, countTrue(model, levels), "livelli di " + c);
            }
            assertTrue(deepest >= k, "profondità oltre il bound k=" + k);

            // Genitore: arco con traduttore tra le due componenti e livello del figlio = livello del genitore + 1
            for (int child = 0; child < components; child++) {
                for (int parent = 0; parent < components; parent++) {
                    if (child == parent || !model.valueOf(VariableNames.parentVariable(child, parent))) {
                        continue;
                    }
                    boolean crossing = false;
                    for (Edge edge : graph.getGraph().getEdges()) {
                        int cu = graph.componentOf(edge.getFirst());
                        int cv = graph.componentOf(edge.getSecond());
                        boolean joins = (cu == child && cv == parent) || (cu == parent && cv == child);
                        if (joins && countTrue(model, edgeNames(edge, translators)) == 1) {
                            crossing = true;
                        }
                    }
                    assertTrue(crossing, "arco con traduttore tra " + child + " e " + parent);
                    for (int h = 1; h < translators; h++) {
                        if (model.valueOf(VariableNames.levelVariable(child, h))) {
                            assertTrue(model.valueOf(VariableNames.levelVariable(parent, h - 1)));
                        }
                    }
                }
            }
        }

        assertFalse(solve(graph, translators).isSatisfiable());
    }

    @Test
    void reductionLeavesTheGraphUntouched() throws Exception {
        EdgeConGraph graph = path3();

        EdgeConReduction.buildReduction(new FormulaContext(), graph, 1);

        assertTrue(graph.getTranslators().isEmpty());
        assertEquals(3, graph.numComponents());
    }

    //endregion

    //region PRECONDIZIONI

    @Test
    void negativeBoundIsRejected() {
        assertThrows(ReductionException.class,
                () -> EdgeConReduction.buildReduction(new FormulaContext(), twoVertices(), -1));
    }

    @Test
    void malformedPartitionsAreRejectedBeforeBuilding() {
        Graph graph = new Graph(3, List.of(Edge.of(0, 1), Edge.of(1, 2)));

        assertRejected(EdgeConGraph.fromPartition(graph, new int[] {0, 0, 0}, 0));
        assertRejected(EdgeConGraph.fromPartition(graph, new int[] {0, EdgeConGraph.NO_COMPONENT, 1}, 2));
        assertRejected(EdgeConGraph.fromPartition(graph, new int[] {0, 1, 5}, 2));
        assertRejected(EdgeConGraph.fromPartition(graph, new int[] {0, 0, 2}, 3));
        assertRejected(EdgeConGraph.fromPartition(graph, new int[] {0, 0, 1}, VariableNames.MAX_INDEX + 2));
    }

    @Test
    void rejectionDeclaresNoVariables() {
        FormulaContext context = new FormulaContext();
        EdgeConGraph graph = EdgeConGraph.fromPartition(new Graph(2, List.of(Edge.of(0, 1))), new int[] {0, 2}, 2);

        assertThrows(ReductionException.class, () -> EdgeConReduction.buildReduction(context, graph, 0));
        assertEquals(0, context.getVariableCount());
    }

    private static void assertRejected(EdgeConGraph graph) {
        assertThrows(ReductionException.class,
                () -> EdgeConReduction.buildReduction(new FormulaContext(), graph, 0));
    }

    //endregion

    //region COSTRUTTORI SINGOLI

    @Test
    void depthConstraintIsFalseWhenBoundReachesTranslatorCount() {
        try (ReductionContext ctx = new ReductionContext(new FormulaContext(), twoVertices(), 1)) {
            assertEquals(Formula.Type.FALSE, EdgeConReduction.buildPhi5(ctx).getType());
        }
        try (ReductionContext ctx = new ReductionContext(new FormulaContext(), twoVertices(), 0)) {
            assertEquals(Formula.Type.OR, EdgeConReduction.buildPhi5(ctx).getType());
        }
    }

    @Test
    void levelConstraintIsFalseWithoutLevels() {
        EdgeConGraph single = new EdgeConGraph(new Graph(1, List.of()), List.of("red"));

        try (ReductionContext ctx = new ReductionContext(new FormulaContext(), single, 0)) {
            assertEquals(Formula.Type.FALSE, EdgeConReduction.buildPhi4(ctx).getType());
            assertEquals(Formula.Type.TRUE, EdgeConReduction.buildPhi3(ctx).getType());
            assertTrue(EdgeConReduction.buildPhi2(ctx).evaluate(name -> false));
        }
    }

    @Test
    void crossingConstraintIsFalseWithoutCrossingEdge() {
        try (ReductionContext ctx = new ReductionContext(new FormulaContext(), path3(), 0)) {
            assertEquals(Formula.Type.FALSE, EdgeConReduction.buildPhi6(ctx, 0, 2).getType());

            Formula forward = EdgeConReduction.buildPhi6(ctx, 0, 1);
            Formula backward = EdgeConReduction.buildPhi6(ctx, 1, 0);
            assertEquals(Formula.Type.OR, forward.getType());
            assertEquals(2, forward.getOperands().size());
            assertEquals(forward.toString(), backward.toString());
        }
    }

    @Test
    void levelConsistencyLinksChildToParentLevel() {
        try (ReductionContext ctx = new ReductionContext(new FormulaContext(), path3(), 0)) {
            Formula phi7 = EdgeConReduction.buildPhi7(ctx, 2, 1);

            assertEquals("(!l_[2,1] | l_[1,0])", phi7.toString());
        }
        try (ReductionContext ctx = new ReductionContext(new FormulaContext(), twoVertices(), 0)) {
            assertEquals(Formula.Type.TRUE, EdgeConReduction.buildPhi7(ctx, 1, 0).getType());
        }
    }

    @Test
    void uniquenessConstraintsCoverEveryPair() {
        try (ReductionContext ctx = new ReductionContext(new FormulaContext(), path3(), 0)) {
            // 2 indici × 1 coppia di archi
            assertEquals(2, EdgeConReduction.atMostOneEdgePerIndex(ctx).getOperands().size());
            // 2 archi × 1 coppia di indici
            assertEquals(2, EdgeConReduction.atMostOneIndexPerEdge(ctx).getOperands().size());
        }
    }

    @Test
    void closedContextRejectsAccess() {
        ReductionContext ctx = new ReductionContext(new FormulaContext(), twoVertices(), 0);
        ctx.close();

        assertTrue(ctx.isClosed());
        assertThrows(IllegalStateException.class, ctx::componentCount);
        assertThrows(IllegalStateException.class, () -> EdgeConReduction.buildPhi3(ctx));
    }

    //endregion

    private static List<String> edgeNames(Edge edge, int translators) {
        List<String> names = new ArrayList<>();
        for (int i = 0; i < translators; i++) {
            names.add(VariableNames.edgeVariable(edge.getFirst(), edge.getSecond(), i));
        }
        return names;
    }

    private static int countTrue(Model model, List<String> names) {
        int count = 0;
        for (String name : names) {
            if (model.valueOf(name)) {
                count++;
            }
        }
        return count;
    }
}
