package DFAKit;

import DFAKit.Model.TabulatedDfa;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertThrows;

class DFACommandLineTest {
  private static TabulatedDfa<Integer, Integer> load(String resourcePath) throws URISyntaxException {
    return BAFormat.readDfa(BAFormatTest.getFilePath(resourcePath).toAbsolutePath().toString());
  }

  @Test
  void testStats() throws URISyntaxException {
    List<String> lines = DFACommandLine.runCommand("stats", List.of(load("div3.ba")));
    Assertions.assertEquals(List.of(
        "Size: 3",
        "Nodes/edges: 3/6",
        "Nodes/edges without trap states: 3/6",
        "Cyclomatic complexity: 5",
        "Dead states: 0",
        "Sync states: 0"), lines);
  }

  @Test
  void testStatsWithTrapStates() {
    List<String> lines = DFACommandLine.stats(Canonicalizer.rename(Examples.withTrapStates(), 0));
    Assertions.assertEquals("Size: 3", lines.get(0));
    Assertions.assertEquals("Nodes/edges without trap states: 2/2", lines.get(2));
    Assertions.assertEquals("Dead states: 1", lines.get(4));
  }

  @Test
  void testEquiv() throws URISyntaxException {
    Assertions.assertEquals(List.of("Equivalent: true"),
        DFACommandLine.runCommand("equiv", List.of(load("div3.ba"), load("div3-redundant.ba"))));
    Assertions.assertEquals(List.of("Equivalent: false"),
        DFACommandLine.runCommand("EQUIV", List.of(load("div3.ba"), load("even.ba"))));
  }

  @Test
  void testBadCommands() throws URISyntaxException {
    List<TabulatedDfa<Integer, Integer>> one = List.of(load("even.ba"));
    assertThrows(IllegalStateException.class, () -> DFACommandLine.runCommand("equiv", one));
    assertThrows(IllegalStateException.class, () -> DFACommandLine.runCommand("minimize", one));
  }

  @Test
  void testWriteBA(@TempDir Path dir) throws URISyntaxException, IOException {
    Path output = dir.resolve("renamed.ba");
    String input = BAFormatTest.getFilePath("div3-redundant.ba").toAbsolutePath().toString();
    DFACommandLine.main(new String[] {"--writeBA", output.toString(), "stats", input});
    Assertions.assertTrue(Files.exists(output));

    // the written automaton is the renamed first input
    TabulatedDfa<Integer, Integer> written = BAFormat.readDfa(output.toString());
    Assertions.assertTrue(DfaEquivalence.equivalent(written, load("div3.ba")));
    Assertions.assertEquals(4, written.size());
  }
}
