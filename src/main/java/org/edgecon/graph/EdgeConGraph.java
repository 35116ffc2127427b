package org.edgecon.graph;

import java.util.*;
import java.util.logging.Logger;

/**
 * GRAFO PARTIZIONATO EDGECON - Grafo + componenti omogenee + traduttori
 *
 * COMPONENTI OMOGENEE:
 * • Calcolate dai colori: classi connesse del sottografo degli archi omogenei
 *   (estremi con lo stesso colore)
 * • Numerate 0..C_H-1 nell'ordine del loro vertice minimo: il vertice 0 sta
 *   sempre nella componente 0, la radice
 * • In alternativa fornite esplicitamente con {@link #fromPartition}; in quel
 *   caso le etichette non vengono validate qui ma dalla riduzione
 *
 * GERARCHIA DERIVATA:
 * • Visita in ampiezza dalla radice attraverso gli archi con traduttore
 * • Ogni componente raggiunta riceve genitore e livello; le altre restano a -1
 */
public class EdgeConGraph {

    private static final Logger LOGGER = Logger.getLogger(EdgeConGraph.class.getName());

    /** Colore assegnato ai vertici privi di colore esplicito */
    public static final String DEFAULT_COLOUR = "default";

    /** Etichetta dei vertici privi di componente nelle partizioni esplicite */
    public static final int NO_COMPONENT = -1;

    //region STATO

    private final Graph graph;

    /** Colore per vertice, null per partizioni esplicite */
    private final List<String> colours;

    private int[] componentOf;

    private int componentCount;

    /** Archi con traduttore, in forma canonica */
    private final SortedSet<Edge> translators = new TreeSet<>();

    private int[] parent;
    private int[] level;

    //endregion

    //region COSTRUZIONE

    /**
     * Crea il grafo partizionato calcolando le componenti omogenee dai colori.
     *
     * @param graph grafo sottostante
     * @param colours un colore per vertice (null ammesso, vale {@link #DEFAULT_COLOUR})
     * @throws IllegalArgumentException se il numero di colori non coincide con i vertici
     */
    public EdgeConGraph(Graph graph, List<String> colours) {
        this.graph = Objects.requireNonNull(graph, "Grafo non può essere null");
        Objects.requireNonNull(colours, "Lista colori non può essere null");
        if (colours.size() != graph.numVertices()) {
            throw new IllegalArgumentException("Attesi " + graph.numVertices() + " colori, trovati " + colours.size());
        }

        List<String> normalized = new ArrayList<>(colours.size());
        for (String colour : colours) {
            normalized.add(colour != null ? colour : DEFAULT_COLOUR);
        }
        this.colours = Collections.unmodifiableList(normalized);

        recomputeComponents();
    }

    private EdgeConGraph(Graph graph, int[] labels, int componentCount) {
        this.graph = graph;
        this.colours = null;
        this.componentOf = labels;
        this.componentCount = componentCount;
        rebuildHierarchy();
    }

    /**
     * Crea un grafo partizionato con etichette di componente esplicite.
     * Le etichette possono essere incoerenti (vertici senza componente,
     * etichette fuori range, componenti vuote): la riduzione le rifiuta.
     *
     * @param graph grafo sottostante
     * @param labels componente per vertice ({@link #NO_COMPONENT} se assente)
     * @param componentCount numero dichiarato di componenti
     */
    public static EdgeConGraph fromPartition(Graph graph, int[] labels, int componentCount) {
        Objects.requireNonNull(graph, "Grafo non può essere null");
        Objects.requireNonNull(labels, "Etichette non possono essere null");
        if (labels.length != graph.numVertices()) {
            throw new IllegalArgumentException("Attese " + graph.numVertices() + " etichette, trovate " + labels.length);
        }
        return new EdgeConGraph(graph, labels.clone(), componentCount);
    }

    //endregion

    //region INTERROGAZIONE GRAFO E PARTIZIONE

    public Graph getGraph() {
        return graph;
    }

    public int numVertices() {
        return graph.numVertices();
    }

    public int numEdges() {
        return graph.numEdges();
    }

    public boolean isEdge(int u, int v) {
        return graph.isEdge(u, v);
    }

    public int numComponents() {
        return componentCount;
    }

    /**
     * @return etichetta di componente del vertice (può essere {@link #NO_COMPONENT})
     */
    public int componentOf(int vertex) {
        checkVertex(vertex);
        return componentOf[vertex];
    }

    public boolean isVertexInComponent(int vertex, int component) {
        return componentOf(vertex) == component;
    }

    /**
     * @return vertici della componente in ordine crescente
     */
    public List<Integer> verticesOf(int component) {
        List<Integer> vertices = new ArrayList<>();
        for (int v = 0; v < componentOf.length; v++) {
            if (componentOf[v] == component) {
                vertices.add(v);
            }
        }
        return vertices;
    }

    public boolean hasColours() {
        return colours != null;
    }

    /**
     * @throws IllegalStateException se la partizione è esplicita
     */
    public String getColour(int vertex) {
        checkVertex(vertex);
        if (colours == null) {
            throw new IllegalStateException("Partizione esplicita: nessun colore disponibile");
        }
        return colours.get(vertex);
    }

    private void checkVertex(int vertex) {
        if (vertex < 0 || vertex >= graph.numVertices()) {
            throw new IllegalArgumentException("Vertice inesistente: " + vertex);
        }
    }

    //endregion

    //region TRADUTTORI

    /**
     * Posiziona un traduttore sull'arco (u,v).
     *
     * @throws IllegalArgumentException se (u,v) non è un arco del grafo
     */
    public void addTranslator(int u, int v) {
        if (!graph.isEdge(u, v)) {
            throw new IllegalArgumentException("Impossibile posizionare un traduttore: (" + u + "," + v + ") non è un arco");
        }
        if (translators.add(Edge.of(u, v))) {
            LOGGER.finest("Traduttore aggiunto sull'arco " + Edge.of(u, v));
        }
    }

    public boolean hasTranslator(int u, int v) {
        return graph.isEdge(u, v) && translators.contains(Edge.of(u, v));
    }

    public SortedSet<Edge> getTranslators() {
        return Collections.unmodifiableSortedSet(translators);
    }

    //endregion

    //region RICALCOLO COMPONENTI E GERARCHIA

    /**
     * Ricalcola le componenti omogenee (solo per partizioni da colori) e
     * ricostruisce la gerarchia a partire dall'insieme corrente di traduttori.
     */
    public void recomputeComponents() {
        if (colours != null) {
            computeHomogeneousComponents();
        }
        rebuildHierarchy();
        LOGGER.fine(String.format("Componenti ricalcolate: C_H=%d, traduttori=%d, profondità=%d",
                componentCount, translators.size(), hierarchyDepth()));
    }

    private void computeHomogeneousComponents() {
        int n = graph.numVertices();
        int[] labels = new int[n];
        Arrays.fill(labels, NO_COMPONENT);
        int next = 0;

        // Vertici visitati in ordine crescente: la numerazione segue il vertice minimo
        for (int start = 0; start < n; start++) {
            if (labels[start] != NO_COMPONENT) {
                continue;
            }
            Deque<Integer> queue = new ArrayDeque<>();
            labels[start] = next;
            queue.add(start);
            while (!queue.isEmpty()) {
                int vertex = queue.poll();
                for (int neighbour : graph.neighbours(vertex)) {
                    if (labels[neighbour] == NO_COMPONENT && colours.get(neighbour).equals(colours.get(vertex))) {
                        labels[neighbour] = next;
                        queue.add(neighbour);
                    }
                }
            }
            next++;
        }

        this.componentOf = labels;
        this.componentCount = next;
    }

    private void rebuildHierarchy() {
        int size = Math.max(componentCount, 0);
        this.parent = new int[size];
        this.level = new int[size];
        Arrays.fill(parent, -1);
        Arrays.fill(level, -1);
        if (size == 0) {
            return;
        }

        // Adiacenza tra componenti indotta dagli archi con traduttore
        Map<Integer, SortedSet<Integer>> links = new HashMap<>();
        for (Edge edge : translators) {
            int a = componentOf[edge.getFirst()];
            int b = componentOf[edge.getSecond()];
            if (a != b && isValidComponent(a) && isValidComponent(b)) {
                links.computeIfAbsent(a, c -> new TreeSet<>()).add(b);
                links.computeIfAbsent(b, c -> new TreeSet<>()).add(a);
            }
        }

        level[0] = 0;
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(0);
        while (!queue.isEmpty()) {
            int current = queue.poll();
            for (int next : links.getOrDefault(current, Collections.emptySortedSet())) {
                if (level[next] == -1) {
                    parent[next] = current;
                    level[next] = level[current] + 1;
                    queue.add(next);
                }
            }
        }
    }

    private boolean isValidComponent(int component) {
        return component >= 0 && component < componentCount;
    }

    /**
     * @return genitore della componente nella gerarchia, -1 per la radice o componenti non raggiunte
     */
    public int getParent(int component) {
        checkComponent(component);
        return parent[component];
    }

    /**
     * @return livello della componente, -1 se non raggiunta dalla radice
     */
    public int getLevel(int component) {
        checkComponent(component);
        return level[component];
    }

    /**
     * @return livello massimo tra le componenti raggiunte (0 se c'è solo la radice o nessuna componente)
     */
    public int hierarchyDepth() {
        int depth = 0;
        for (int l : level) {
            depth = Math.max(depth, l);
        }
        return depth;
    }

    /**
     * @return true se ogni componente è raggiunta dalla radice
     */
    public boolean isHierarchyConnected() {
        for (int l : level) {
            if (l == -1) {
                return false;
            }
        }
        return true;
    }

    private void checkComponent(int component) {
        if (!isValidComponent(component)) {
            throw new IllegalArgumentException("Componente inesistente: " + component);
        }
    }

    //endregion

    @Override
    public String toString() {
        return "EdgeConGraph[n=" + numVertices() + ", m=" + numEdges() + ", C_H=" + componentCount
                + ", traduttori=" + translators + "]";
    }
}
