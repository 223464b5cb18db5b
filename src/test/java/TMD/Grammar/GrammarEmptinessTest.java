package TMD.Grammar;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Set;

public class GrammarEmptinessTest {
  @Test
  void testStartWithoutGeneratingProductionIsEmpty() {
    // S -> A, A has no productions
    ContextFreeGrammar cfg = ContextFreeGrammar.builder("S")
        .nonterminals("A")
        .terminals("a", "b")
        .production("S", "A")
        .build();
    Assertions.assertTrue(GrammarEmptiness.generatingNonterminals(cfg).isEmpty());
    Assertions.assertTrue(GrammarEmptiness.isEmpty(cfg));
  }

  @Test
  void testEpsilonAndRecursiveProductions() {
    // S -> A | eps, A -> aA | a
    ContextFreeGrammar cfg = ContextFreeGrammar.builder("S")
        .nonterminals("A")
        .terminals("a", "b")
        .production("S", "A")
        .production("S", ContextFreeGrammar.EPSILON)
        .production("A", "a", "A")
        .production("A", "a")
        .build();
    Assertions.assertEquals(Set.of("S", "A"), GrammarEmptiness.generatingNonterminals(cfg));
    Assertions.assertFalse(GrammarEmptiness.isEmpty(cfg));
  }

  @Test
  void testOnlySelfRecursionIsEmpty() {
    // S -> aS has no base case
    ContextFreeGrammar cfg = ContextFreeGrammar.builder("S")
        .terminals("a")
        .production("S", "a", "S")
        .build();
    Assertions.assertTrue(GrammarEmptiness.isEmpty(cfg));
  }

  @Test
  void testGeneratingPropagatesThroughSeveralRounds() {
    // S -> AB, A -> B, B -> C b, C -> eps; D -> D is never generating
    ContextFreeGrammar cfg = ContextFreeGrammar.builder("S")
        .nonterminals("A", "B", "C", "D")
        .terminals("b")
        .production("S", "A", "B")
        .production("A", "B")
        .production("B", "C", "b")
        .production("C")
        .production("D", "D")
        .build();
    Assertions.assertEquals(Set.of("S", "A", "B", "C"), GrammarEmptiness.generatingNonterminals(cfg));
    Assertions.assertFalse(GrammarEmptiness.isEmpty(cfg));
  }

  @Test
  void testMalformedGrammar() {
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> ContextFreeGrammar.builder("S").production("X", "a").build());
  }
}
