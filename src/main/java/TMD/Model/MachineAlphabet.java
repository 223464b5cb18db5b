package TMD.Model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;

/**
 * Input alphabet plus blank symbol of a Turing machine. The tape alphabet is the input alphabet followed by the blank.
 * @param <I> - Symbol type, e.g., String
 */
public record MachineAlphabet<I>(Alphabet<I> inputAlphabet, I blank) {
    public static final String STANDARD_BLANK = "_";

    public MachineAlphabet {
        Objects.requireNonNull(inputAlphabet, "inputAlphabet");
        Objects.requireNonNull(blank, "blank");
        if (inputAlphabet.containsSymbol(blank)) {
            throw new IllegalArgumentException("Blank symbol " + blank + " must not be an input symbol");
        }
    }

    /**
     * The conventional machine alphabet: inputs {a, b}, blank _.
     */
    public static MachineAlphabet<String> standard() {
        return new MachineAlphabet<>(Alphabets.fromArray("a", "b"), STANDARD_BLANK);
    }

    public List<I> tapeAlphabet() {
        final List<I> tape = new ArrayList<>(inputAlphabet.size() + 1);
        tape.addAll(inputAlphabet);
        tape.add(blank);
        return tape;
    }

    public boolean isTapeSymbol(I symbol) {
        return blank.equals(symbol) || inputAlphabet.containsSymbol(symbol);
    }

    /**
     * Split a word into one-character symbols, e.g. "abb" into [a, b, b].
     */
    public static List<String> symbolsOf(String word) {
        final List<String> symbols = new ArrayList<>(word.length());
        for (int i = 0; i < word.length(); i++) {
            symbols.add(String.valueOf(word.charAt(i)));
        }
        return symbols;
    }
}
