package org.edgecon.graph;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.edgecon.antlr.EdgeConGraphBaseVisitor;
import org.edgecon.antlr.EdgeConGraphLexer;
import org.edgecon.antlr.EdgeConGraphParser;
import org.edgecon.antlr.EdgeConGraphParser.AttributeContext;
import org.edgecon.antlr.EdgeConGraphParser.EdgeStatementContext;
import org.edgecon.antlr.EdgeConGraphParser.GraphFileContext;
import org.edgecon.antlr.EdgeConGraphParser.VertexStatementContext;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Logger;

/**
 * LETTORE GRAFI DOT - Convertitore da albero sintattico ANTLR a {@link EdgeConGraph}
 *
 * Visita l'albero prodotto dalla grammatica EdgeConGraph raccogliendo vertici,
 * colori e archi. Gli errori (sintattici e semantici) vengono accumulati e
 * segnalati tutti insieme con una {@link GraphFormatException} al termine
 * della visita.
 *
 * VINCOLI SEMANTICI:
 * - Identificatori dei vertici contigui 0..n-1
 * - Nessun cappio (u -- u)
 * - Un solo colore per vertice; i vertici senza colore ricevono "default"
 */
public class DotGraphReader extends EdgeConGraphBaseVisitor<Void> {

    private static final Logger LOGGER = Logger.getLogger(DotGraphReader.class.getName());

    private static final Set<String> COLOUR_KEYS = Set.of("color", "colour");

    //region STATO DELLA VISITA

    private final SortedSet<Integer> vertices = new TreeSet<>();
    private final Map<Integer, String> colours = new HashMap<>();
    private final List<Edge> edges = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();
    private String graphName;

    private DotGraphReader() {
    }

    //endregion

    //region PUNTI DI INGRESSO

    /**
     * Legge un grafo partizionato da file.
     *
     * @throws IOException se il file non è leggibile
     * @throws GraphFormatException se il contenuto non è un grafo valido
     */
    public static EdgeConGraph read(Path file) throws IOException, GraphFormatException {
        LOGGER.fine("Lettura grafo da " + file);
        return parse(CharStreams.fromPath(file, StandardCharsets.UTF_8));
    }

    /**
     * Legge un grafo partizionato da testo.
     *
     * @throws GraphFormatException se il testo non è un grafo valido
     */
    public static EdgeConGraph parse(String text) throws GraphFormatException {
        if (text == null) {
            throw new IllegalArgumentException("Testo del grafo non può essere null");
        }
        return parse(CharStreams.fromString(text));
    }

    private static EdgeConGraph parse(CharStream input) throws GraphFormatException {
        DotGraphReader reader = new DotGraphReader();
        BaseErrorListener collector = reader.new SyntaxErrorCollector();

        EdgeConGraphLexer lexer = new EdgeConGraphLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(collector);

        EdgeConGraphParser parser = new EdgeConGraphParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(collector);

        GraphFileContext tree = parser.graphFile();
        if (!reader.errors.isEmpty()) {
            throw new GraphFormatException("Errori di sintassi: " + String.join("; ", reader.errors));
        }

        reader.visit(tree);
        return reader.buildGraph();
    }

    //endregion

    //region VISITA

    @Override
    public Void visitGraphFile(GraphFileContext ctx) {
        if (ctx.name != null) {
            graphName = unquote(ctx.name.getText());
        }
        return visitChildren(ctx);
    }

    @Override
    public Void visitVertexStatement(VertexStatementContext ctx) {
        Integer vertex = parseVertex(ctx.INT());
        if (vertex == null) {
            return null;
        }
        vertices.add(vertex);

        if (ctx.attributeList() != null) {
            for (AttributeContext attribute : ctx.attributeList().attribute()) {
                applyAttribute(vertex, attribute);
            }
        }
        return null;
    }

    @Override
    public Void visitEdgeStatement(EdgeStatementContext ctx) {
        List<Integer> chain = new ArrayList<>();
        for (TerminalNode node : ctx.INT()) {
            Integer vertex = parseVertex(node);
            if (vertex == null) {
                return null;
            }
            chain.add(vertex);
        }

        for (int i = 0; i + 1 < chain.size(); i++) {
            int u = chain.get(i);
            int v = chain.get(i + 1);
            if (u == v) {
                errors.add("riga " + ctx.getStart().getLine() + ": cappio sul vertice " + u);
                continue;
            }
            edges.add(Edge.of(u, v));
        }
        vertices.addAll(chain);
        return null;
    }

    private void applyAttribute(int vertex, AttributeContext attribute) {
        String key = attribute.key.getText();
        if (!COLOUR_KEYS.contains(key)) {
            LOGGER.warning("Attributo ignorato sul vertice " + vertex + ": " + key);
            return;
        }

        String colour = unquote(attribute.value.getText());
        String previous = colours.putIfAbsent(vertex, colour);
        if (previous != null && !previous.equals(colour)) {
            errors.add("riga " + attribute.getStart().getLine() + ": colori in conflitto per il vertice "
                    + vertex + " (" + previous + ", " + colour + ")");
        }
    }

    private Integer parseVertex(TerminalNode node) {
        try {
            return Integer.parseInt(node.getText());
        } catch (NumberFormatException e) {
            errors.add("riga " + node.getSymbol().getLine() + ": identificatore di vertice fuori range " + node.getText());
            return null;
        }
    }

    private static String unquote(String text) {
        if (text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"")) {
            return text.substring(1, text.length() - 1);
        }
        return text;
    }

    //endregion

    //region COSTRUZIONE GRAFO

    private EdgeConGraph buildGraph() throws GraphFormatException {
        int n = vertices.isEmpty() ? 0 : vertices.last() + 1;
        if (vertices.size() != n) {
            List<Integer> missing = new ArrayList<>();
            for (int v = 0; v < n && missing.size() < 10; v++) {
                if (!vertices.contains(v)) {
                    missing.add(v);
                }
            }
            errors.add("identificatori non contigui, mancano i vertici " + missing);
        }
        if (!errors.isEmpty()) {
            throw new GraphFormatException("Grafo non valido: " + String.join("; ", errors));
        }

        List<String> vertexColours = new ArrayList<>(n);
        for (int v = 0; v < n; v++) {
            vertexColours.add(colours.getOrDefault(v, EdgeConGraph.DEFAULT_COLOUR));
        }

        EdgeConGraph result = new EdgeConGraph(new Graph(n, edges), vertexColours);
        LOGGER.info(String.format("Grafo %s letto: %d vertici, %d archi, %d componenti omogenee",
                graphName != null ? graphName : "<anonimo>", n, result.numEdges(), result.numComponents()));
        return result;
    }

    //endregion

    /**
     * Raccoglie gli errori di lexer e parser invece di stamparli su console.
     */
    private class SyntaxErrorCollector extends BaseErrorListener {
        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg, RecognitionException e) {
            errors.add("riga " + line + ":" + charPositionInLine + " " + msg);
        }
    }
}
