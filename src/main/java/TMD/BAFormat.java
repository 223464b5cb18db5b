package TMD;

import TMD.Model.EpsilonNFA;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.exception.FormatException;
import net.automatalib.serialization.ba.BAParsers;
import net.automatalib.serialization.ba.BAWriter;

import java.io.*;
import java.util.*;

public class BAFormat {
    /*
    Parsing is Automatalib's; we only split the "eps" label off into epsilon moves.
     */
    public static EpsilonNFA<String> convertBAToEpsilonNFA(InputStream is) throws IOException, FormatException {
        final CompactNFA<String> automaton = BAParsers.nfa().readModel(is).model;
        final Alphabet<String> baAlphabet = automaton.getInputAlphabet();
        final Set<Integer> initialStates = automaton.getInitialStates();
        if (initialStates.size() > 1) {
            throw new IllegalArgumentException("BA automaton has " + initialStates.size() + " initial states, expected one");
        }

        if (!baAlphabet.containsSymbol(EpsilonNFA.EPSILON)) {
            return EpsilonNFA.copyOf(automaton, baAlphabet);
        }

        final List<String> symbols = new ArrayList<>(baAlphabet.size());
        for (String sym : baAlphabet) {
            if (!EpsilonNFA.EPSILON.equals(sym)) {
                symbols.add(sym);
            }
        }

        final int states = automaton.size();
        final EpsilonNFA<String> nfa = new EpsilonNFA<>(Alphabets.fromList(symbols), states);
        for (int i = 0; i < states; i++) {
            nfa.addState(automaton.isAccepting(i));
            if (initialStates.contains(i)) {
                nfa.setInitial(i, true);
            }
        }
        for (int i = 0; i < states; i++) {
            for (String sym : baAlphabet) {
                if (EpsilonNFA.EPSILON.equals(sym)) {
                    for (Integer target : automaton.getTransitions(i, sym)) {
                        nfa.addEpsilonTransition(i, target);
                    }
                } else {
                    nfa.addTransitions(i, sym, automaton.getTransitions(i, sym));
                }
            }
        }
        return nfa;
    }

    static EpsilonNFA<String> getBAFile(String filePath) {
        try (InputStream is = new FileInputStream(filePath)) {
            return convertBAToEpsilonNFA(is);
        } catch (FormatException ex) {
            throw new IllegalArgumentException("Malformed BA file " + filePath, ex);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    static void writeBAFile(String filename, CompactDFA<String> dfa) {
        final BAWriter<String> baWriter = new BAWriter<>();
        try (OutputStream os = new FileOutputStream(filename)) {
            baWriter.writeModel(os, dfa, dfa.getInputAlphabet());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
