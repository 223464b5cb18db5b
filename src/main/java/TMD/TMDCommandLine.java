package TMD;

import TMD.Grammar.ContextFreeGrammar;
import TMD.Grammar.GrammarEmptiness;
import TMD.Machine.SimulationResult;
import TMD.Machine.TMEnumerator;
import TMD.Machine.TMValidator;
import TMD.Machine.TuringMachine;
import TMD.Model.EpsilonNFA;
import TMD.Model.MachineAlphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

public class TMDCommandLine {
  private static final String DEFAULT_WORD = "abb";

  public static void main(String[] args) {
    String filename = null;
    boolean trace = false;
    int maxSteps = TapeSimulator.NO_STEP_LIMIT;
    List<String> positional = new ArrayList<>(2);

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if ("--debug".equalsIgnoreCase(arg)) {
        Determinizer.DEBUG = true;
      } else if ("--trace".equalsIgnoreCase(arg)) {
        trace = true;
      } else if ("--writeBA".equalsIgnoreCase(arg)) {
        // Require a value that isn't another flag
        if (i + 1 >= args.length || args[i + 1].startsWith("-")) {
          System.err.println("Missing value for --writeBA");
          printUsageAndExit(); // exits
        }
        filename = args[++i];
      } else if ("--max-steps".equalsIgnoreCase(arg)) {
        if (i + 1 >= args.length) {
          System.err.println("Missing value for --max-steps");
          printUsageAndExit();
        }
        maxSteps = parseCount(args[++i]);
      } else if (arg.startsWith("-")) {
        // Unknown flag
        printUsageAndExit();
      } else {
        positional.add(arg);
      }
    }

    if (positional.isEmpty()) {
      printUsageAndExit();
    }

    run(positional, filename, trace, maxSteps, System.out);
  }

  private static void printUsageAndExit() {
    System.out.println(
        "TMD [--debug] [--trace] [--max-steps <n>] [--writeBA <BA output file>] <command> [args]");
    System.out.println("[--debug] : Additional debug/progress output");
    System.out.println("[--trace] : Print every tape configuration of each simulation");
    System.out.println("[--max-steps <n>] : Reject a simulation after n steps");
    System.out.println("[--writeBA <BA output file>] : Write DFA to specified output file");
    System.out.println();
    System.out.println("<command> : one of the choices below:");
    System.out.println("  example [word ...] : NFA -> DFA -> TM decider for the built-in example NFA, decide each word.");
    System.out.println("  decide <BA file> [word ...] : same, for an NFA read from a BA file. Edges labelled eps are epsilon moves.");
    System.out.println("  enumerate <count> : print the first <count> Turing machines over {a,b,_}.");
    System.out.println("  validate : validate enumerated Turing machines and broken variants of them.");
    System.out.println("  cfg : decide emptiness of the example context-free grammars.");
    System.out.println();
    System.out.println("Words are written as plain strings, one symbol per character; \"\" is the empty word.");
    System.exit(0);
  }

  /**
   * Run one command.
   * @param positional - command followed by its arguments
   * @param filename - BA output file for the DFA, or null
   * @param trace - whether to print simulation traces
   * @param maxSteps - step budget for each simulation
   * @param out - output stream
   */
  static void run(List<String> positional, String filename, boolean trace, int maxSteps, PrintStream out) {
    String command = positional.get(0).toLowerCase();
    List<String> rest = positional.subList(1, positional.size());
    switch (command) {
      case "example" -> decide(exampleNFA(), rest, filename, trace, maxSteps, out);
      case "decide" -> {
        if (rest.isEmpty()) {
          throw new IllegalStateException("decide needs a BA file");
        }
        EpsilonNFA<String> nfa = BAFormat.getBAFile(rest.get(0));
        out.println("Original NFA size: " + nfa.size());
        out.println("Alphabet size:" + nfa.getInputAlphabet().size());
        decide(nfa, rest.subList(1, rest.size()), filename, trace, maxSteps, out);
      }
      case "enumerate" -> enumerate(rest.isEmpty() ? 20 : parseCount(rest.get(0)), out);
      case "validate" -> validate(out);
      case "cfg" -> emptiness(out);
      default -> throw new IllegalStateException("Unexpected command: " + command);
    }
  }

  /**
   * NFA -> DFA -> TM decider, then simulate the decider on every word.
   * @return verdict bit (1 accept, 0 reject) per word
   */
  static List<Integer> decide(EpsilonNFA<String> nfa, List<String> words, String filename, boolean trace,
                              int maxSteps, PrintStream out) {
    long before = System.currentTimeMillis();
    CompactDFA<String> dfa = Determinizer.determinize(nfa);
    long after = System.currentTimeMillis();
    out.println("Constructed DFA from NFA (" + ((after - before) / 1000f) + "s):");
    Printer.printDFA(dfa, dfa.getInputAlphabet(), out);

    TuringMachine<String> tm = TMDeciderBuilder.toTMDecider(dfa, MachineAlphabet.STANDARD_BLANK);
    out.println("Constructed TM decider from DFA:");
    Printer.printTM(tm, out);

    if (filename != null) {
      out.println("Writing to file: " + filename);
      BAFormat.writeBAFile(filename, dfa);
    }

    List<String> toDecide = words.isEmpty() ? List.of(DEFAULT_WORD) : words;
    List<Integer> results = new ArrayList<>(toDecide.size());
    for (String word : toDecide) {
      SimulationResult<String> result = TapeSimulator.simulate(tm, MachineAlphabet.symbolsOf(word), maxSteps);
      out.println("Simulating TM on input: \"" + word + "\"");
      if (trace) {
        Printer.printTrace(result, out);
      } else {
        out.println("\tResult: " + result.verdict().asBit() + " after " + result.steps() + " steps");
      }
      results.add(result.verdict().asBit());
    }
    return results;
  }

  private static void enumerate(int count, PrintStream out) {
    MachineAlphabet<String> alphabet = MachineAlphabet.standard();
    out.println("First " + count + " Turing machines with " + alphabet.inputAlphabet()
        + " as the alphabet and " + alphabet.tapeAlphabet() + " as the tape alphabet.");
    out.println();
    Iterator<TuringMachine<String>> machines = new TMEnumerator<>(alphabet).iterator();
    for (int i = 1; i <= count; i++) {
      out.println("TM #" + i);
      Printer.printTM(machines.next(), out);
    }
  }

  private static void validate(PrintStream out) {
    MachineAlphabet<String> alphabet = MachineAlphabet.standard();
    Iterator<TuringMachine<String>> machines = new TMEnumerator<>(alphabet).iterator();
    TuringMachine<String> valid1 = machines.next();
    TuringMachine<String> valid2 = machines.next();
    TuringMachine<String> missingTransition = valid1.toBuilder()
        .removeTransition(0, alphabet.tapeAlphabet().get(0))
        .build();
    TuringMachine<String> badBlank = valid2.toBuilder()
        .alphabet(new MachineAlphabet<>(alphabet.inputAlphabet(), "x"))
        .build();

    int index = 1;
    for (TuringMachine<String> tm : List.of(valid1, valid2, missingTransition, badBlank)) {
      out.println("TM #" + index++);
      Printer.printTM(tm, out);
      List<String> problems = TMValidator.problems(tm, alphabet);
      for (String problem : problems) {
        out.println("  problem: " + problem);
      }
      out.println("  valid: " + (problems.isEmpty() ? 1 : 0));
      out.println();
    }
  }

  private static void emptiness(PrintStream out) {
    int index = 1;
    for (ContextFreeGrammar cfg : List.of(emptyExampleGrammar(), nonEmptyExampleGrammar())) {
      out.println("CFG #" + index++);
      Printer.printGrammar(cfg, out);
      out.println("  generating: " + GrammarEmptiness.generatingNonterminals(cfg));
      out.println("  result: " + (GrammarEmptiness.isEmpty(cfg) ? 1 : 0));
      out.println();
    }
  }

  private static int parseCount(String value) {
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Expected a number, got: " + value, e);
    }
  }

  /**
   * δ(0,a)={0,1}, δ(0,b)={0}, δ(1,b)={2}, start 0, accepting {2}: the words over {a, b} ending in "ab".
   */
  static EpsilonNFA<String> exampleNFA() {
    EpsilonNFA<String> nfa = new EpsilonNFA<>(MachineAlphabet.standard().inputAlphabet(), 3);
    nfa.addInitialState(false);
    nfa.addState(false);
    nfa.addState(true);
    nfa.addTransition(0, "a", 0);
    nfa.addTransition(0, "a", 1);
    nfa.addTransition(0, "b", 0);
    nfa.addTransition(1, "b", 2);
    return nfa;
  }

  // S -> A, with no production for A
  static ContextFreeGrammar emptyExampleGrammar() {
    return ContextFreeGrammar.builder("S")
        .nonterminals("A")
        .terminals("a", "b")
        .production("S", "A")
        .build();
  }

  // S -> A | eps, A -> aA | a
  static ContextFreeGrammar nonEmptyExampleGrammar() {
    return ContextFreeGrammar.builder("S")
        .nonterminals("A")
        .terminals("a", "b")
        .production("S", "A")
        .production("S", ContextFreeGrammar.EPSILON)
        .production("A", "a", "A")
        .production("A", "a")
        .build();
  }
}
