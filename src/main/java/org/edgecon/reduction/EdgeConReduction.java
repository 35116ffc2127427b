package org.edgecon.reduction;

import org.edgecon.formula.Formula;
import org.edgecon.formula.FormulaFactory;
import org.edgecon.graph.Edge;
import org.edgecon.graph.EdgeConGraph;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * RIDUZIONE EDGECON - Costruzione della formula φ = φ2 ∧ φ3 ∧ φ4 ∧ φ5 ∧ φ8
 *
 * VINCOLI CODIFICATI:
 * • φ2: ogni indice di traduttore etichetta al più un arco, ogni arco porta al più un indice
 * • φ3: ogni componente non radice ha esattamente un genitore
 * • φ4: ogni componente ha esattamente un livello in 0..N-1
 * • φ5: almeno una componente si trova a un livello ≥ k
 * • φ8: se P(j1,j2) allora esiste un arco con traduttore tra j1 e j2 (φ6)
 *       e il livello di j2 è quello di j1 meno uno (φ7)
 *
 * Gli intervalli vuoti sono risolti esplicitamente: congiunzione vuota = vero,
 * disgiunzione vuota = falso. La fabbrica non riceve mai liste vuote.
 */
public final class EdgeConReduction {

    private static final Logger LOGGER = Logger.getLogger(EdgeConReduction.class.getName());

    private EdgeConReduction() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region ORCHESTRAZIONE

    /**
     * Costruisce la riduzione completa. Non modifica il grafo.
     *
     * @param factory fabbrica delle variabili e dei connettivi
     * @param graph grafo partizionato
     * @param k bound di costo (≥ 0)
     * @return φ2 ∧ φ3 ∧ φ4 ∧ φ5 ∧ φ8
     * @throws ReductionException se il grafo o k violano le precondizioni
     */
    public static Formula buildReduction(FormulaFactory factory, EdgeConGraph graph, int k) throws ReductionException {
        if (factory == null || graph == null) {
            throw new IllegalArgumentException("Fabbrica e grafo non possono essere null");
        }
        validatePreconditions(graph, k);

        try (ReductionContext ctx = new ReductionContext(factory, graph, k)) {
            Formula phi = factory.and(
                    buildPhi2(ctx),
                    buildPhi3(ctx),
                    buildPhi4(ctx),
                    buildPhi5(ctx),
                    buildPhi8(ctx));

            LOGGER.info(String.format("Riduzione costruita: n=%d, m=%d, C_H=%d, N=%d, k=%d",
                    ctx.vertexCount(), ctx.edgeCount(), ctx.componentCount(), ctx.translatorCount(), k));
            return phi;
        }
    }

    /**
     * Rifiuta gli ingressi malformati prima di costruire qualsiasi vincolo.
     */
    static void validatePreconditions(EdgeConGraph graph, int k) throws ReductionException {
        if (k < 0) {
            throw new ReductionException("Bound di costo negativo: " + k);
        }

        int componentCount = graph.numComponents();
        if (componentCount <= 0) {
            throw new ReductionException("Numero di componenti non positivo: " + componentCount);
        }
        if (componentCount - 1 > VariableNames.MAX_INDEX) {
            throw new ReductionException("Troppe componenti per lo schema di nomi: " + componentCount);
        }

        int vertexCount = graph.numVertices();
        if (vertexCount - 1 > VariableNames.MAX_INDEX) {
            throw new ReductionException("Troppi vertici per lo schema di nomi: " + vertexCount);
        }

        int[] sizes = new int[componentCount];
        for (int v = 0; v < vertexCount; v++) {
            int component = graph.componentOf(v);
            if (component == EdgeConGraph.NO_COMPONENT) {
                throw new ReductionException("Il vertice " + v + " non appartiene ad alcuna componente");
            }
            if (component < 0 || component >= componentCount) {
                throw new ReductionException("Componente " + component + " del vertice " + v
                        + " fuori range 0.." + (componentCount - 1));
            }
            sizes[component]++;
        }

        for (int c = 0; c < componentCount; c++) {
            if (sizes[c] == 0) {
                throw new ReductionException("Identificatori di componente non contigui: la componente " + c + " è vuota");
            }
        }
    }

    //endregion

    //region φ2 - UNICITÀ TRADUTTORE/ARCO

    static Formula buildPhi2(ReductionContext ctx) {
        return ctx.factory().and(atMostOneEdgePerIndex(ctx), atMostOneIndexPerEdge(ctx));
    }

    /** φ2_1: per ogni indice i e ogni coppia di archi distinti e,f: ¬X(e,i) ∨ ¬X(f,i) */
    static Formula atMostOneEdgePerIndex(ReductionContext ctx) {
        FormulaFactory f = ctx.factory();
        List<Edge> edges = ctx.edges();
        List<Formula> clauses = new ArrayList<>();

        for (int i = 0; i < ctx.translatorCount(); i++) {
            for (int a = 0; a < edges.size(); a++) {
                for (int b = a + 1; b < edges.size(); b++) {
                    clauses.add(f.or(f.not(ctx.edgeVar(edges.get(a), i)), f.not(ctx.edgeVar(edges.get(b), i))));
                }
            }
        }
        return conjunction(f, clauses);
    }

    /** φ2_2: per ogni arco e e ogni coppia di indici i < j: ¬X(e,i) ∨ ¬X(e,j) */
    static Formula atMostOneIndexPerEdge(ReductionContext ctx) {
        FormulaFactory f = ctx.factory();
        List<Formula> clauses = new ArrayList<>();

        for (Edge edge : ctx.edges()) {
            for (int i = 0; i < ctx.translatorCount(); i++) {
                for (int j = i + 1; j < ctx.translatorCount(); j++) {
                    clauses.add(f.or(f.not(ctx.edgeVar(edge, i)), f.not(ctx.edgeVar(edge, j))));
                }
            }
        }
        return conjunction(f, clauses);
    }

    //endregion

    //region φ3 - ESATTAMENTE UN GENITORE

    static Formula buildPhi3(ReductionContext ctx) {
        FormulaFactory f = ctx.factory();
        int components = ctx.componentCount();
        List<Formula> clauses = new ArrayList<>();

        // La radice (componente 0) non riceve vincoli sul genitore
        for (int j = 1; j < components; j++) {
            List<Formula> candidates = new ArrayList<>();
            for (int j1 = 0; j1 < components; j1++) {
                if (j1 != j) {
                    candidates.add(ctx.parentVar(j, j1));
                }
            }
            clauses.add(disjunction(f, candidates));

            for (int j1 = 0; j1 < components; j1++) {
                for (int j2 = j1 + 1; j2 < components; j2++) {
                    if (j1 != j && j2 != j) {
                        clauses.add(f.or(f.not(ctx.parentVar(j, j1)), f.not(ctx.parentVar(j, j2))));
                    }
                }
            }
        }
        return conjunction(f, clauses);
    }

    //endregion

    //region φ4 - ESATTAMENTE UN LIVELLO

    static Formula buildPhi4(ReductionContext ctx) {
        FormulaFactory f = ctx.factory();
        int levels = ctx.translatorCount();
        List<Formula> clauses = new ArrayList<>();

        for (int c = 0; c < ctx.componentCount(); c++) {
            List<Formula> candidates = new ArrayList<>();
            for (int h = 0; h < levels; h++) {
                candidates.add(ctx.levelVar(c, h));
            }
            // Con N = 0 la disgiunzione è vuota: falso
            clauses.add(disjunction(f, candidates));

            for (int h1 = 0; h1 < levels; h1++) {
                for (int h2 = h1 + 1; h2 < levels; h2++) {
                    clauses.add(f.or(f.not(ctx.levelVar(c, h1)), f.not(ctx.levelVar(c, h2))));
                }
            }
        }
        return conjunction(f, clauses);
    }

    //endregion

    //region φ5 - PROFONDITÀ OLTRE IL BOUND

    static Formula buildPhi5(ReductionContext ctx) {
        FormulaFactory f = ctx.factory();
        List<Formula> candidates = new ArrayList<>();

        for (int c = 0; c < ctx.componentCount(); c++) {
            for (int h = ctx.costBound(); h < ctx.translatorCount(); h++) {
                candidates.add(ctx.levelVar(c, h));
            }
        }
        if (candidates.isEmpty()) {
            LOGGER.fine("φ5 vuota (k ≥ N): formula insoddisfacibile per costruzione");
        }
        return disjunction(f, candidates);
    }

    //endregion

    //region φ6, φ7, φ8 - COERENZA GENITORE/FIGLIO

    /**
     * φ6(j1,j2): qualche arco tra un vertice di j1 e uno di j2 porta un traduttore.
     */
    static Formula buildPhi6(ReductionContext ctx, int j1, int j2) {
        FormulaFactory f = ctx.factory();
        List<Formula> candidates = new ArrayList<>();

        for (Edge edge : ctx.edges()) {
            if (crosses(ctx, edge, j1, j2)) {
                for (int i = 0; i < ctx.translatorCount(); i++) {
                    candidates.add(ctx.edgeVar(edge, i));
                }
            }
        }
        return disjunction(f, candidates);
    }

    private static boolean crosses(ReductionContext ctx, Edge edge, int j1, int j2) {
        int u = edge.getFirst();
        int v = edge.getSecond();
        return (ctx.isVertexInComponent(u, j1) && ctx.isVertexInComponent(v, j2))
                || (ctx.isVertexInComponent(u, j2) && ctx.isVertexInComponent(v, j1));
    }

    /**
     * φ7(j1,j2): per h in 1..N-1, ¬L(j1,h) ∨ L(j2,h-1).
     */
    static Formula buildPhi7(ReductionContext ctx, int j1, int j2) {
        FormulaFactory f = ctx.factory();
        List<Formula> clauses = new ArrayList<>();

        for (int h = 1; h < ctx.translatorCount(); h++) {
            clauses.add(f.or(f.not(ctx.levelVar(j1, h)), ctx.levelVar(j2, h - 1)));
        }
        return conjunction(f, clauses);
    }

    static Formula buildPhi8(ReductionContext ctx) {
        FormulaFactory f = ctx.factory();
        int components = ctx.componentCount();
        List<Formula> clauses = new ArrayList<>();

        for (int j1 = 0; j1 < components; j1++) {
            for (int j2 = 0; j2 < components; j2++) {
                if (j1 == j2) {
                    continue;
                }
                Formula consistent = f.and(buildPhi6(ctx, j1, j2), buildPhi7(ctx, j1, j2));
                clauses.add(f.or(f.not(ctx.parentVar(j1, j2)), consistent));
            }
        }
        return conjunction(f, clauses);
    }

    //endregion

    //region INTERVALLI VUOTI

    private static Formula conjunction(FormulaFactory f, List<Formula> operands) {
        return operands.isEmpty() ? f.mkTrue() : f.and(operands);
    }

    private static Formula disjunction(FormulaFactory f, List<Formula> operands) {
        return operands.isEmpty() ? f.mkFalse() : f.or(operands);
    }

    //endregion
}
