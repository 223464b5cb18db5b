package TMD;

import java.io.PrintStream;
import java.util.List;
import java.util.Map;

import TMD.Grammar.ContextFreeGrammar;
import TMD.Machine.Configuration;
import TMD.Machine.SimulationResult;
import TMD.Machine.Transition;
import TMD.Machine.TuringMachine;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.DFA;

/**
 * Plain-text listings of automata, machines, traces and grammars.
 */
public class Printer {

    public static <I> void printDFA(DFA<Integer, I> dfa, Alphabet<I> alphabet, PrintStream out) {
        out.println("DFA states: " + dfa.getStates());
        out.println("DFA start state: " + dfa.getInitialState());
        out.print("DFA accept states: [");
        String sep = "";
        for (int state = 0; state < dfa.size(); state++) {
            if (dfa.isAccepting(state)) {
                out.print(sep + state);
                sep = ", ";
            }
        }
        out.println("]");
        out.println("DFA transitions:");
        for (int state = 0; state < dfa.size(); state++) {
            for (I sym : alphabet) {
                final Integer target = dfa.getTransition(state, sym);
                if (target != null) {
                    out.println("\tδ(" + state + ", " + sym + ") = " + target);
                }
            }
        }
        out.println();
    }

    public static <I> void printTM(TuringMachine<I> tm, PrintStream out) {
        out.println("TM number of states: " + (tm.getNumStates() + 2));
        out.println("TM start state: " + stateName(tm, tm.getStartState()));
        out.println("TM accept state: " + tm.getAcceptState());
        out.println("TM reject state: " + tm.getRejectState());
        out.println("TM blank symbol: " + tm.getBlank());
        out.println("TM transitions:");
        for (int state = 0; state < tm.getNumStates(); state++) {
            for (Map.Entry<I, Transition<I>> e : tm.getTransitions(state).entrySet()) {
                out.println("\t" + formatTransition(tm, state, e.getKey(), e.getValue()));
            }
        }
        out.println();
    }

    public static <I> String formatTransition(TuringMachine<I> tm, int state, I read, Transition<I> t) {
        return "δ(" + stateName(tm, state) + ", " + read + ") = ("
            + stateName(tm, t.nextState()) + ", " + t.write() + ", " + t.direction().getLabel() + ")";
    }

    public static String stateName(TuringMachine<?> tm, int state) {
        if (!tm.isTerminal(state)) {
            return "q" + state;
        }
        return state == tm.getAcceptState() ? "ACCEPT" : "REJECT";
    }

    public static <I> void printTrace(SimulationResult<I> result, PrintStream out) {
        final List<Configuration<I>> trace = result.trace();
        for (int i = 0; i < trace.size(); i++) {
            out.println("\tStep " + (i + 1) + ": " + trace.get(i));
        }
        out.println("\tResult: " + result.verdict().asBit() + " (" + result.reason() + ")");
    }

    public static void printGrammar(ContextFreeGrammar cfg, PrintStream out) {
        out.println("  Nonterminals: " + cfg.nonterminals());
        out.println("  Terminals: " + cfg.terminals());
        out.println("  Start symbol: " + cfg.startSymbol());
        out.println("  Productions:");
        for (String head : cfg.nonterminals()) {
            for (List<String> rightSide : cfg.productionsOf(head)) {
                final String body = ContextFreeGrammar.isEpsilon(rightSide)
                    ? ContextFreeGrammar.EPSILON : String.join("", rightSide);
                out.println("    " + head + " -> " + body);
            }
        }
    }
}
