package TMD.Grammar;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class GrammarEmptiness {
    /**
     * Nonterminals that derive at least one terminal string (possibly the empty one).
     * Fixed point: a nonterminal is added once one of its right sides is epsilon or consists of terminals and
     * nonterminals already known to be generating; stops after a round without additions.
     */
    public static Set<String> generatingNonterminals(ContextFreeGrammar cfg) {
        final Set<String> generating = new LinkedHashSet<>();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (String nonterminal : cfg.nonterminals()) {
                if (generating.contains(nonterminal)) {
                    continue;
                }
                for (List<String> rightSide : cfg.productionsOf(nonterminal)) {
                    if (derivesTerminalString(cfg, rightSide, generating)) {
                        generating.add(nonterminal);
                        changed = true;
                        break;
                    }
                }
            }
        }
        return generating;
    }

    /**
     * @return true iff L(cfg) is empty, i.e. the start symbol is not generating
     */
    public static boolean isEmpty(ContextFreeGrammar cfg) {
        return !generatingNonterminals(cfg).contains(cfg.startSymbol());
    }

    private static boolean derivesTerminalString(ContextFreeGrammar cfg, List<String> rightSide, Set<String> generating) {
        if (ContextFreeGrammar.isEpsilon(rightSide)) {
            return true;
        }
        for (String sym : rightSide) {
            if (cfg.isNonterminal(sym) && !generating.contains(sym)) {
                return false;
            }
        }
        return true;
    }
}
