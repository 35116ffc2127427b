package org.edgecon;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class MainTest {

    @TempDir
    Path workDir;

    private Path writeGraph(String name, String content) throws Exception {
        Path file = workDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void parserAppliesDefaultsAndValidates() throws Exception {
        Path graph = writeGraph("g.dot", "graph { 0 -- 1; }");
        Main.ArgumentParser parser = new Main.ArgumentParser();

        Main.RunConfiguration config = parser.parse(new String[] {"-f", graph.toString(), "-k", "2"});
        assertEquals(2, config.costBound);
        assertEquals(EdgeConProblemSolver.DEFAULT_TIMEOUT_SECONDS, config.timeoutSeconds);
        assertNull(config.outputPath);

        assertThrows(IllegalArgumentException.class, () -> parser.parse(new String[] {"-f", graph.toString()}));
        assertThrows(IllegalArgumentException.class,
                () -> parser.parse(new String[] {"-f", graph.toString(), "-k", "1", "-t", "0"}));
        assertThrows(IllegalArgumentException.class,
                () -> parser.parse(new String[] {"-f", graph.toString(), "-k", "uno"}));
        assertThrows(IllegalArgumentException.class,
                () -> parser.parse(new String[] {"-f", workDir.resolve("assente.dot").toString(), "-k", "0"}));
        assertThrows(IllegalArgumentException.class, () -> parser.parse(new String[] {"-x"}));
    }

    @Test
    void runWritesDimacsAndResultFiles() throws Exception {
        Path graph = writeGraph("coppia.dot", "graph coppia { 0 [color=red]; 1 [color=blue]; 0 -- 1; }");
        Path output = workDir.resolve("out");

        int exitCode = Main.run(new Main.RunConfiguration(graph.toString(), 0, 5, output.toString()));

        assertEquals(0, exitCode);
        String dimacs = Files.readString(output.resolve("coppia.cnf"));
        String report = Files.readString(output.resolve("coppia.result.txt"));
        assertTrue(dimacs.contains("p cnf "));
        assertTrue(dimacs.contains("x_[(0,1),0]"));
        assertTrue(report.contains("RISULTATO: SAT"));
    }

    @Test
    void runReportsInvalidInput() throws Exception {
        Path graph = writeGraph("rotto.dot", "graph { 0 -- 2; }");

        assertEquals(1, Main.run(new Main.RunConfiguration(graph.toString(), 0, 5, null)));
        assertEquals("coppia", Main.getBaseFileName("/tmp/coppia.dot"));
    }
}
