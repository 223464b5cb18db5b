package TMD;

import TMD.Model.EpsilonNFA;
import net.automatalib.alphabet.impl.Alphabets;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.BitSet;

public class EpsilonClosureTest {
  private static BitSet bits(int... states) {
    BitSet b = new BitSet();
    for (int s : states) {
      b.set(s);
    }
    return b;
  }

  private static EpsilonNFA<String> chainWithCycle() {
    // 0 -eps-> 1 -eps-> 2 -eps-> 1, 3 isolated, 0 -a-> 3, 1 -a-> 2, 2 -b-> 0
    EpsilonNFA<String> nfa = new EpsilonNFA<>(Alphabets.fromArray("a", "b"));
    for (int i = 0; i < 4; i++) {
      nfa.addState(false);
    }
    nfa.setInitial(0, true);
    nfa.addEpsilonTransition(0, 1);
    nfa.addEpsilonTransition(1, 2);
    nfa.addEpsilonTransition(2, 1);
    nfa.addTransition(0, "a", 3);
    nfa.addTransition(1, "a", 2);
    nfa.addTransition(2, "b", 0);
    return nfa;
  }

  @Test
  void testClosureFollowsChainsAndCycles() {
    EpsilonNFA<String> nfa = chainWithCycle();
    Assertions.assertEquals(bits(0, 1, 2), EpsilonClosure.closure(nfa, 0));
    Assertions.assertEquals(bits(1, 2), EpsilonClosure.closure(nfa, 2));
    Assertions.assertEquals(bits(3), EpsilonClosure.closure(nfa, 3)); // no epsilon moves
    Assertions.assertEquals(bits(1, 2, 3), EpsilonClosure.closure(nfa, bits(2, 3)));
  }

  @Test
  void testClosureOfEmptySetIsEmpty() {
    Assertions.assertTrue(EpsilonClosure.closure(chainWithCycle(), new BitSet()).isEmpty());
  }

  @Test
  void testClosureDoesNotModifyInput() {
    BitSet input = bits(0);
    BitSet closed = EpsilonClosure.closure(chainWithCycle(), input);
    Assertions.assertEquals(bits(0), input);
    Assertions.assertNotSame(input, closed);
  }

  @Test
  void testClosureIsIdempotent() {
    EpsilonNFA<String> nfa = chainWithCycle();
    BitSet once = EpsilonClosure.closure(nfa, bits(0, 3));
    Assertions.assertEquals(once, EpsilonClosure.closure(nfa, once));
  }

  @Test
  void testMoveUnionsDirectSuccessors() {
    EpsilonNFA<String> nfa = chainWithCycle();
    Assertions.assertEquals(bits(2, 3), SubsetMove.move(nfa, bits(0, 1, 2), "a"));
    Assertions.assertEquals(bits(0), SubsetMove.move(nfa, bits(0, 1, 2), "b"));
  }

  @Test
  void testMoveIgnoresEpsilonMoves() {
    // 0 only reaches 1 and 2 by epsilon moves, so "a" from {0} is just {3}
    Assertions.assertEquals(bits(3), SubsetMove.move(chainWithCycle(), bits(0), "a"));
  }

  @Test
  void testMoveWithoutSuccessorsIsEmpty() {
    EpsilonNFA<String> nfa = chainWithCycle();
    Assertions.assertTrue(SubsetMove.move(nfa, bits(3), "a").isEmpty());
    Assertions.assertTrue(SubsetMove.move(nfa, new BitSet(), "b").isEmpty());
    Assertions.assertTrue(SubsetMove.move(nfa, bits(0, 1, 2), "c").isEmpty()); // not in alphabet
  }
}
