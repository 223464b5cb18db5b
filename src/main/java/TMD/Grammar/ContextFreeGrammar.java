package TMD.Grammar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Context-free grammar over string symbols. A right side [eps] (or an empty right side) derives the empty string.
 */
public record ContextFreeGrammar(Set<String> nonterminals, Set<String> terminals, String startSymbol,
                                 Map<String, List<List<String>>> productions) {
    public static final String EPSILON = "eps";

    public ContextFreeGrammar {
        nonterminals = Collections.unmodifiableSet(new LinkedHashSet<>(nonterminals));
        terminals = Collections.unmodifiableSet(new LinkedHashSet<>(terminals));
        if (!nonterminals.contains(startSymbol)) {
            throw new IllegalArgumentException("Start symbol " + startSymbol + " is not a nonterminal");
        }
        final Map<String, List<List<String>>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, List<List<String>>> e : productions.entrySet()) {
            if (!nonterminals.contains(e.getKey())) {
                throw new IllegalArgumentException("Production head " + e.getKey() + " is not a nonterminal");
            }
            final List<List<String>> rightSides = new ArrayList<>();
            for (List<String> rightSide : e.getValue()) {
                rightSides.add(List.copyOf(rightSide));
            }
            copy.put(e.getKey(), Collections.unmodifiableList(rightSides));
        }
        productions = Collections.unmodifiableMap(copy);
    }

    public List<List<String>> productionsOf(String nonterminal) {
        return productions.getOrDefault(nonterminal, Collections.emptyList());
    }

    public boolean isNonterminal(String symbol) {
        return nonterminals.contains(symbol);
    }

    public static boolean isEpsilon(List<String> rightSide) {
        return rightSide.isEmpty() || (rightSide.size() == 1 && EPSILON.equals(rightSide.get(0)));
    }

    public static Builder builder(String startSymbol) {
        return new Builder(startSymbol);
    }

    public static class Builder {
        private final String startSymbol;
        private final Set<String> nonterminals = new LinkedHashSet<>();
        private final Set<String> terminals = new LinkedHashSet<>();
        private final Map<String, List<List<String>>> productions = new LinkedHashMap<>();

        private Builder(String startSymbol) {
            this.startSymbol = startSymbol;
            this.nonterminals.add(startSymbol);
        }

        public Builder nonterminals(String... symbols) {
            nonterminals.addAll(Arrays.asList(symbols));
            return this;
        }

        public Builder terminals(String... symbols) {
            terminals.addAll(Arrays.asList(symbols));
            return this;
        }

        /**
         * Add head -> rightSide. Pass EPSILON alone for an epsilon production.
         */
        public Builder production(String head, String... rightSide) {
            productions.computeIfAbsent(head, h -> new ArrayList<>()).add(Arrays.asList(rightSide));
            return this;
        }

        public ContextFreeGrammar build() {
            return new ContextFreeGrammar(nonterminals, terminals, startSymbol, productions);
        }
    }
}
