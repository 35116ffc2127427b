package org.edgecon;

import org.edgecon.cdcl.CDCLSolver;
import org.edgecon.graph.DotGraphReader;
import org.edgecon.graph.EdgeConGraph;
import org.edgecon.graph.GraphFormatException;
import org.edgecon.reduction.ReductionException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * RIDUZIONE EDGECON - Punto di ingresso da linea di comando
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: grafo partizionato in formato DOT (sottoinsieme) letto con ANTLR
 * 2. RIDUZIONE: costruzione di φ = φ2 ∧ φ3 ∧ φ4 ∧ φ5 ∧ φ8 per il bound k
 * 3. RISOLUZIONE: codifica di Tseitin + CDCL, con timeout
 * 4. DECODIFICA: posizionamento dei traduttori e gerarchia delle componenti
 * 5. OUTPUT: report su console e, con -o, file DIMACS e file di risultato
 *
 * ESEMPI:
 * - java -jar edgecon-reduction.jar -f grafo.dot -k 1
 * - java -jar edgecon-reduction.jar -f grafo.dot -k 2 -t 30 -o risultati
 */
public final class Main {

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    private static final String HELP_PARAM = "-h";
    private static final String FILE_PARAM = "-f";
    private static final String COST_PARAM = "-k";
    private static final String TIMEOUT_PARAM = "-t";
    private static final String OUTPUT_PARAM = "-o";

    private static final int MIN_TIMEOUT_SECONDS = 1;

    private static final String CNF_EXTENSION = ".cnf";
    private static final String RESULT_EXTENSION = ".result.txt";

    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        System.out.println("---> AVVIO RIDUZIONE EDGECON <---");
        int exitCode = 0;

        try {
            if (args.length == 0) {
                System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
                exitCode = 1;
            } else {
                RunConfiguration config = parseAndValidateArguments(args);
                // null: help mostrato o errore già segnalato
                if (config != null) {
                    displayConfigurationSummary(config);
                    exitCode = run(config);
                }
            }

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.out.println("[E] Esecuzione interrotta");
            exitCode = 1;
        } finally {
            System.out.println("---> FINE ESECUZIONE RIDUZIONE EDGECON <---");
        }

        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /**
     * Esegue la pipeline sul file configurato.
     *
     * @return codice di uscita (0 successo, 1 errore)
     */
    static int run(RunConfiguration config) throws InterruptedException {
        EdgeConGraph graph;
        try {
            graph = DotGraphReader.read(Paths.get(config.inputPath));
        } catch (IOException e) {
            System.out.println("[E] Impossibile leggere " + config.inputPath + ": " + e.getMessage());
            return 1;
        } catch (GraphFormatException e) {
            System.out.println("[E] Grafo non valido: " + e.getMessage());
            return 1;
        }

        System.out.println("[I] Grafo letto: " + graph.numVertices() + " vertici, " + graph.numEdges()
                + " archi, " + graph.numComponents() + " componenti omogenee");

        EdgeConResult result;
        try {
            result = new EdgeConProblemSolver(new CDCLSolver(), config.timeoutSeconds)
                    .solve(graph, config.costBound);
        } catch (ReductionException e) {
            System.out.println("[E] Riduzione non applicabile: " + e.getMessage());
            return 1;
        }

        if (result.getStatus() == EdgeConResult.Status.TIMEOUT) {
            System.out.println("[W] Timeout raggiunto dopo " + config.timeoutSeconds + " secondi");
        }
        System.out.println();
        System.out.print(result.toReport());

        if (config.outputPath != null) {
            try {
                saveResults(result, config);
            } catch (IOException e) {
                System.out.println("[E] Errore nel salvataggio dei risultati: " + e.getMessage());
                return 1;
            }
        }
        return 0;
    }

    //endregion

    //region GESTIONE DELL'OUTPUT E SALVATAGGIO DEI FILE

    /**
     * Scrive il file DIMACS .cnf e il file .result.txt nella directory di output.
     */
    private static void saveResults(EdgeConResult result, RunConfiguration config) throws IOException {
        Path outputDir = Paths.get(config.outputPath);
        Files.createDirectories(outputDir);
        String baseName = getBaseFileName(config.inputPath);

        Path cnfFile = outputDir.resolve(baseName + CNF_EXTENSION);
        Files.writeString(cnfFile, result.getCnf().toDimacs(), StandardCharsets.UTF_8);

        Path resultFile = outputDir.resolve(baseName + RESULT_EXTENSION);
        Files.writeString(resultFile, "File: " + config.inputPath + "\n" + result.toReport(), StandardCharsets.UTF_8);

        System.out.println("[I] Risultati salvati in " + cnfFile + " e " + resultFile);
    }

    /**
     * @return nome file senza estensione
     */
    static String getBaseFileName(String filePath) {
        String fileName = Paths.get(filePath).getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }

    //endregion

    //region PARSING E VALIDAZIONE PARAMETRI

    private static RunConfiguration parseAndValidateArguments(String[] args) {
        try {
            return new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            return null;
        }
    }

    private static void displayConfigurationSummary(RunConfiguration config) {
        System.out.println("\n-->> CONFIGURAZIONE RIDUZIONE EDGECON <<--");
        System.out.println("Input: " + config.inputPath);
        System.out.println("Bound di costo k: " + config.costBound);
        System.out.println("Timeout: " + config.timeoutSeconds + " secondi");
        System.out.println("Output: " + (config.outputPath != null ? config.outputPath : "Solo console"));
        System.out.println("====================================\n");
    }

    //endregion

    //region HELP E DOCUMENTAZIONE

    private static void printApplicationHelp() {
        System.out.println("\n::>> RIDUZIONE EDGECON <<::");
        System.out.println("Decide se al più C_H-1 traduttori possono rendere la gerarchia");
        System.out.println("delle componenti omogenee più profonda di k, tramite riduzione a SAT\n");

        System.out.println("UTILIZZO:");
        System.out.println("  java -jar edgecon-reduction.jar -f <file.dot> -k <costo> [opzioni]\n");

        System.out.println("PARAMETRI:");
        System.out.println("  -f <file>       Grafo partizionato in formato DOT (obbligatorio)");
        System.out.println("  -k <costo>      Bound di costo k >= 0 (obbligatorio)");
        System.out.println("  -t <secondi>    Timeout della risoluzione (default: "
                + EdgeConProblemSolver.DEFAULT_TIMEOUT_SECONDS + ", minimo: " + MIN_TIMEOUT_SECONDS + ")");
        System.out.println("  -o <directory>  Salva <nome>.cnf e <nome>.result.txt nella directory");
        System.out.println("  -h              Mostra questo help\n");

        System.out.println("FORMATO INPUT:");
        System.out.println("  graph esempio {");
        System.out.println("      0 [color=red];");
        System.out.println("      1 [color=blue];");
        System.out.println("      0 -- 1;");
        System.out.println("  }");
        System.out.println("  Vertici numerati 0..n-1 senza buchi; colore di default: "
                + EdgeConGraph.DEFAULT_COLOUR + "\n");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Configurazione validata e immutabile dell'esecuzione.
     */
    static final class RunConfiguration {
        final String inputPath;
        final int costBound;
        final int timeoutSeconds;
        final String outputPath;

        RunConfiguration(String inputPath, int costBound, int timeoutSeconds, String outputPath) {
            this.inputPath = inputPath;
            this.costBound = costBound;
            this.timeoutSeconds = timeoutSeconds;
            this.outputPath = outputPath;
        }
    }

    /**
     * Parser dei parametri di linea di comando.
     */
    static final class ArgumentParser {

        /**
         * @return configurazione validata, null se è stato richiesto l'help
         * @throws IllegalArgumentException per parametri mancanti, sconosciuti o non validi
         */
        RunConfiguration parse(String[] args) {
            String inputPath = null;
            String outputPath = null;
            Integer costBound = null;
            int timeoutSeconds = EdgeConProblemSolver.DEFAULT_TIMEOUT_SECONDS;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }
                    case FILE_PARAM -> {
                        inputPath = getNextArgument(args, ++i, "file");
                        validateFileExists(inputPath);
                    }
                    case COST_PARAM -> costBound = parseNonNegative(getNextArgument(args, ++i, "costo"), "costo");
                    case TIMEOUT_PARAM -> {
                        timeoutSeconds = parseNonNegative(getNextArgument(args, ++i, "timeout"), "timeout");
                        if (timeoutSeconds < MIN_TIMEOUT_SECONDS) {
                            throw new IllegalArgumentException("Timeout minimo: " + MIN_TIMEOUT_SECONDS + " secondi");
                        }
                    }
                    case OUTPUT_PARAM -> outputPath = getNextArgument(args, ++i, "directory output");
                    default -> throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                }
            }

            if (inputPath == null) {
                throw new IllegalArgumentException("Specificare il file del grafo con " + FILE_PARAM);
            }
            if (costBound == null) {
                throw new IllegalArgumentException("Specificare il bound di costo con " + COST_PARAM);
            }
            return new RunConfiguration(inputPath, costBound, timeoutSeconds, outputPath);
        }

        private String getNextArgument(String[] args, int index, String paramName) {
            if (index >= args.length || args[index].startsWith("-")) {
                throw new IllegalArgumentException("Valore mancante per il parametro " + paramName);
            }
            return args[index];
        }

        private int parseNonNegative(String value, String paramName) {
            try {
                int parsed = Integer.parseInt(value);
                if (parsed < 0) {
                    throw new IllegalArgumentException("Valore negativo per " + paramName + ": " + value);
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Valore numerico non valido per " + paramName + ": " + value);
            }
        }

        private void validateFileExists(String path) {
            if (!Files.isRegularFile(Paths.get(path))) {
                throw new IllegalArgumentException("File non trovato: " + path);
            }
        }
    }

    //endregion
}
