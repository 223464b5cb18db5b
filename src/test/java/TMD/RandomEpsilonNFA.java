package TMD;

import TMD.Model.EpsilonNFA;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.common.util.random.RandomUtil;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Random NFAs in the style of Tabakov and Vardi, with additional epsilon moves,
 * plus a backtracking acceptance check that shares no code with the closure/move implementation.
 */
public class RandomEpsilonNFA {
  /**
   * @param r
   *      random instance
   * @param size
   *      number of states
   * @param edgeNum
   *      number of edges per letter
   * @param epsilonNum
   *      number of epsilon edges
   * @param acceptNum
   *      number of accepting states (at least one)
   * @param alphabet
   *      alphabet
   * @return
   *      a random NFA with start state 0, not necessarily connected
   */
  public static EpsilonNFA<Integer> generateNFA(
      Random r, int size, int edgeNum, int epsilonNum, int acceptNum, Alphabet<Integer> alphabet) {
    assert acceptNum > 0 && acceptNum <= size;
    assert edgeNum >= 0 && edgeNum <= size * size;
    assert epsilonNum >= 0 && epsilonNum <= size * size;

    EpsilonNFA<Integer> result = new EpsilonNFA<>(alphabet, size);
    for (int i = 0; i < size; i++) {
      result.addState(false);
    }
    result.setInitial(0, true);

    for (int f : RandomUtil.distinctIntegers(r, acceptNum, 0, size)) {
      result.setAccepting(f, true);
    }
    for (int a : alphabet) {
      for (int edgeIndex : RandomUtil.distinctIntegers(r, edgeNum, size * size)) {
        result.addTransition(edgeIndex / size, a, edgeIndex % size);
      }
    }
    for (int edgeIndex : RandomUtil.distinctIntegers(r, epsilonNum, size * size)) {
      result.addEpsilonTransition(edgeIndex / size, edgeIndex % size);
    }
    return result;
  }

  public static EpsilonNFA<Integer> getRandomAutomaton(int randomSeed, int size, boolean withEpsilons) {
    final Random random = new Random(randomSeed);
    final Alphabet<Integer> alphabet = Alphabets.integers(0, 1);
    final int edgeNum = Math.round(1.25f * size);
    final int epsilonNum = withEpsilons ? Math.max(1, size / 2) : 0;
    final int acceptNum = Math.max(1, Math.round(0.3f * size));
    return generateNFA(random, size, edgeNum, epsilonNum, acceptNum, alphabet);
  }

  /**
   * Depth-first search over (state, position) pairs, following epsilon moves and real moves directly.
   */
  public static <I> boolean acceptsByBacktracking(EpsilonNFA<I> nfa, List<I> word) {
    Set<Long> visited = new HashSet<>();
    for (int init : nfa.getInitialStates()) {
      if (search(nfa, word, init, 0, visited)) {
        return true;
      }
    }
    return false;
  }

  private static <I> boolean search(EpsilonNFA<I> nfa, List<I> word, int state, int pos, Set<Long> visited) {
    if (!visited.add(((long) pos << 32) | state)) {
      return false;
    }
    if (pos == word.size() && nfa.isAccepting(state)) {
      return true;
    }
    for (int next : nfa.getEpsilonTransitions(state)) {
      if (search(nfa, word, next, pos, visited)) {
        return true;
      }
    }
    if (pos < word.size()) {
      for (Integer next : nfa.getTransitions(state, word.get(pos))) {
        if (search(nfa, word, next, pos + 1, visited)) {
          return true;
        }
      }
    }
    return false;
  }

  /**
   * All words over alphabet of length 0..maxLength, shortest first.
   */
  public static <I> List<List<I>> allWords(Alphabet<I> alphabet, int maxLength) {
    List<List<I>> words = new ArrayList<>();
    List<List<I>> layer = new ArrayList<>();
    layer.add(new ArrayList<>());
    words.addAll(layer);
    for (int len = 1; len <= maxLength; len++) {
      List<List<I>> nextLayer = new ArrayList<>();
      for (List<I> prefix : layer) {
        for (I sym : alphabet) {
          List<I> word = new ArrayList<>(prefix);
          word.add(sym);
          nextLayer.add(word);
        }
      }
      words.addAll(nextLayer);
      layer = nextLayer;
    }
    return words;
  }
}
