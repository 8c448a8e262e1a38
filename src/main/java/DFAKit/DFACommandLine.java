package DFAKit;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;

import DFAKit.Model.Dfa;
import DFAKit.Model.TabulatedDfa;
import it.unimi.dsi.fastutil.ints.IntIntPair;

public class DFACommandLine {
  public static void main(String[] args) {
    String filename = null;
    List<String> positional = new ArrayList<>(3);

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if ("--debug".equalsIgnoreCase(arg)) {
        Fixpoint.DEBUG = true;
      } else if ("--writeBA".equalsIgnoreCase(arg)) {
        // Require a value that isn't another flag
        if (i + 1 >= args.length || args[i + 1].startsWith("-")) {
          System.err.println("Missing value for --writeBA");
          printUsageAndExit(); // exits
        }
        filename = args[++i]; // consume the value
      } else if (arg.startsWith("-")) {
        // Unknown flag
        printUsageAndExit();
      } else {
        positional.add(arg);
      }
    }

    if (positional.size() < 2) {
      printUsageAndExit();
    }

    String command = positional.get(0);
    List<TabulatedDfa<Integer, Integer>> dfas = new ArrayList<>();
    for (String filePath : positional.subList(1, positional.size())) {
      TabulatedDfa<Integer, Integer> dfa = BAFormat.readDfa(filePath);
      System.out.println(filePath + ": DFA size: " + dfa.size() + ", alphabet size: " + dfa.getVocabulary().size());
      dfas.add(dfa);
    }

    long before = System.currentTimeMillis();
    for (String line : runCommand(command, dfas)) {
      System.out.println(line);
    }
    long after = System.currentTimeMillis();
    System.out.println(command + " duration: " + ((after - before) / 1000f) + "s");

    if (filename != null) {
      writeBAFile(filename, Canonicalizer.beautify(dfas.get(0)));
    }
  }

  private static void printUsageAndExit() {
    System.out.println(
        "DFAKit [--debug] [--writeBA <BA output file>] <command> <BA input file> [<BA input file>]");
    System.out.println("[--debug] : Additional debug/progress output");
    System.out.println("[--writeBA <BA output file>] : Write the renamed DFA of the first input to the specified file");
    System.out.println();
    System.out.println("<command> : one of the choices below:");
    System.out.println("  stats: size, edges, trap-free size, cyclomatic complexity, dead and sync states.");
    System.out.println("  equiv: language equivalence of two automata (minimized, then renamed).");
    System.out.println();
    System.out.println("<BA file> : finite automaton (in the BA format), determinized on input.");
    System.out.println("  BA format described here: https://languageinclusion.org/doku.php?id=tools");
    System.exit(0);
  }

  /**
   * Run a command on the loaded automata.
   * @param command - command passed in from command-line
   * @param dfas - loaded automata
   * @return - report lines
   */
  static List<String> runCommand(String command, List<TabulatedDfa<Integer, Integer>> dfas) {
    System.out.println();
    System.out.println("Invoking command:" + command);
    return switch (command.toLowerCase()) {
      case "stats" -> stats(Canonicalizer.beautify(dfas.get(0)));
      case "equiv" -> {
        if (dfas.size() != 2) {
          throw new IllegalStateException("equiv needs two automata, got " + dfas.size());
        }
        yield List.of("Equivalent: " + DfaEquivalence.equivalent(dfas.get(0), dfas.get(1)));
      }
      default -> throw new IllegalStateException("Unexpected command choice: " + command);
    };
  }

  /**
   * Structural report of one automaton.
   * @param dfa - automaton
   * @return - report lines
   */
  static <S extends Comparable<? super S>, I extends Comparable<? super I>> List<String> stats(Dfa<S, I> dfa) {
    List<String> lines = new ArrayList<>();
    IntIntPair all = StructuralAnalyzer.nodesAndEdges(dfa);
    IntIntPair meaningful = StructuralAnalyzer.nodesAndEdgesExcludingTrapStates(dfa);
    lines.add("Size: " + StructuralAnalyzer.size(dfa));
    lines.add("Nodes/edges: " + all.leftInt() + "/" + all.rightInt());
    lines.add("Nodes/edges without trap states: " + meaningful.leftInt() + "/" + meaningful.rightInt());
    lines.add("Cyclomatic complexity: " + StructuralAnalyzer.cyclomaticComplexity(dfa));
    lines.add("Dead states: " + StructuralAnalyzer.deadStates(dfa).size());
    lines.add("Sync states: " + StructuralAnalyzer.syncStates(dfa).size());
    return lines;
  }

  private static void writeBAFile(String filename, Dfa<Integer, Integer> dfa) {
    System.out.println("Writing to file: " + filename);
    try (OutputStream os = new FileOutputStream(filename)) {
      BAFormat.writeDfa(os, dfa);
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
  }
}
