package org.edgecon.reduction;

import org.edgecon.formula.Formula;
import org.edgecon.formula.FormulaFactory;
import org.edgecon.graph.Edge;
import org.edgecon.graph.EdgeConGraph;

import java.util.List;
import java.util.logging.Logger;

/**
 * CONTESTO DI RIDUZIONE - Istantanea immutabile dei parametri del problema
 *
 * Parametri: n (vertici), m (archi), C_H (componenti), N = C_H - 1
 * (traduttori e livelli), k (bound di costo). Espone inoltre gli archi in
 * forma canonica, l'appartenenza dei vertici alle componenti e le famiglie
 * di variabili X, P, L materializzate tramite la fabbrica.
 *
 * La vita del contesto coincide con una singola chiamata di riduzione: dopo
 * {@link #close()} ogni accesso solleva IllegalStateException.
 */
final class ReductionContext implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(ReductionContext.class.getName());

    private FormulaFactory factory;
    private EdgeConGraph graph;
    private List<Edge> edges;

    private final int vertexCount;
    private final int edgeCount;
    private final int componentCount;
    private final int k;

    private boolean closed = false;

    /**
     * La partizione deve essere già stata validata: ogni vertice appartiene a
     * una componente in 0..C_H-1.
     */
    ReductionContext(FormulaFactory factory, EdgeConGraph graph, int k) {
        this.factory = factory;
        this.graph = graph;
        this.vertexCount = graph.numVertices();
        this.edgeCount = graph.numEdges();
        this.componentCount = graph.numComponents();
        this.k = k;
        this.edges = graph.getGraph().getEdges();

        LOGGER.fine(String.format("Contesto di riduzione: n=%d, m=%d, C_H=%d, N=%d, k=%d",
                vertexCount, edgeCount, componentCount, componentCount - 1, k));
    }

    //region PARAMETRI

    int vertexCount() {
        checkOpen();
        return vertexCount;
    }

    int edgeCount() {
        checkOpen();
        return edgeCount;
    }

    int componentCount() {
        checkOpen();
        return componentCount;
    }

    /**
     * @return N = C_H - 1, numero di indici di traduttore e di livelli
     */
    int translatorCount() {
        checkOpen();
        return componentCount - 1;
    }

    int costBound() {
        checkOpen();
        return k;
    }

    List<Edge> edges() {
        checkOpen();
        return edges;
    }

    boolean isVertexInComponent(int vertex, int component) {
        checkOpen();
        return graph.isVertexInComponent(vertex, component);
    }

    FormulaFactory factory() {
        checkOpen();
        return factory;
    }

    //endregion

    //region VARIABILI

    /** X(e,i) */
    Formula edgeVar(Edge edge, int index) {
        return factory().declareBoolVariable(VariableNames.edgeVariable(edge.getFirst(), edge.getSecond(), index));
    }

    /** P(child,parent) */
    Formula parentVar(int child, int parent) {
        return factory().declareBoolVariable(VariableNames.parentVariable(child, parent));
    }

    /** L(component,level) */
    Formula levelVar(int component, int level) {
        return factory().declareBoolVariable(VariableNames.levelVariable(component, level));
    }

    //endregion

    //region CICLO DI VITA

    boolean isClosed() {
        return closed;
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Contesto di riduzione già chiuso");
        }
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            factory = null;
            graph = null;
            edges = null;
            LOGGER.finest("Contesto di riduzione rilasciato");
        }
    }

    //endregion
}
