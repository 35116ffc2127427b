package org.edgecon;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.edgecon.cdcl.CDCLSolver;
import org.edgecon.graph.Edge;
import org.edgecon.graph.EdgeConGraph;
import org.edgecon.graph.Graph;
import org.edgecon.reduction.ReductionException;
import org.edgecon.support.CNFFormula;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

final class EdgeConProblemSolverTest {

    private static EdgeConGraph twoVertices() {
        return new EdgeConGraph(new Graph(2, List.of(Edge.of(0, 1))), List.of("red", "blue"));
    }

    @Test
    void satisfiableInstanceIsDecoded() throws Exception {
        EdgeConGraph graph = twoVertices();

        EdgeConResult result = new EdgeConProblemSolver().solve(graph, 0);

        assertEquals(EdgeConResult.Status.SAT, result.getStatus());
        assertEquals(0, result.getCostBound());
        assertEquals(2, result.getComponentCount());
        assertTrue(result.getReductionTimeMs() >= 0);
        assertEquals(Map.of(Edge.of(0, 1), 0), result.getPlacement());
        assertEquals(1, result.getHierarchyDepth());
        assertTrue(graph.hasTranslator(0, 1));
        assertTrue(result.toReport().contains("(0,1) -> traduttore 0"));
    }

    @Test
    void unsatisfiableInstanceLeavesGraphUntouched() throws Exception {
        EdgeConGraph graph = twoVertices();

        EdgeConResult result = new EdgeConProblemSolver().solve(graph, 1);

        assertEquals(EdgeConResult.Status.UNSAT, result.getStatus());
        assertTrue(result.getPlacement().isEmpty());
        assertTrue(graph.getTranslators().isEmpty());
        assertTrue(result.getCnf().hasEmptyClause());
    }

    @Test
    void preconditionViolationsPropagate() {
        assertThrows(ReductionException.class, () -> new EdgeConProblemSolver().solve(twoVertices(), -3));
        assertThrows(IllegalArgumentException.class, () -> new EdgeConProblemSolver(new CDCLSolver(), 0));
    }

    @Test
    @Timeout(30)
    void slowSolverTimesOut() throws Exception {
        EdgeConProblemSolver solver = new EdgeConProblemSolver(formula -> {
            Thread.sleep(60_000);
            throw new IllegalStateException("non raggiungibile");
        }, 1);

        EdgeConResult result = solver.solve(twoVertices(), 0);

        assertEquals(EdgeConResult.Status.TIMEOUT, result.getStatus());
        assertNull(result.getStatistics());
        assertTrue(result.getCnf().getClausesCount() > 0);
    }

    @Test
    void solverReceivesTheExportedCnf() throws Exception {
        AtomicReference<CNFFormula> received = new AtomicReference<>();
        CDCLSolver cdcl = new CDCLSolver();
        EdgeConProblemSolver solver = new EdgeConProblemSolver(cnf -> {
            received.set(cnf);
            return cdcl.solve(cnf);
        }, 10);

        EdgeConResult result = solver.solve(twoVertices(), 0);

        assertEquals(EdgeConResult.Status.SAT, result.getStatus());
        assertSame(result.getCnf(), received.get());
    }

    @Test
    @Timeout(30)
    void timeoutIsReportedOnlyAfterTheSearchStops() throws Exception {
        AtomicBoolean stopped = new AtomicBoolean(false);
        EdgeConProblemSolver solver = new EdgeConProblemSolver(cnf -> {
            try {
                Thread.sleep(60_000);
                throw new IllegalStateException("non raggiungibile");
            } finally {
                stopped.set(true);
            }
        }, 1);

        EdgeConResult result = solver.solve(twoVertices(), 0);

        assertEquals(EdgeConResult.Status.TIMEOUT, result.getStatus());
        assertTrue(stopped.get());
    }
}
