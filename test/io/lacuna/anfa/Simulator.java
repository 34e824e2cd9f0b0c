package io.lacuna.anfa;

import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearSet;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks a finished automaton over an input, following unlabeled edges freely and labeled edges on matching
 * signals. The input is accepted if the final state is active once it is exhausted.
 */
public class Simulator {

  public static <S> boolean accepts(ANFA<S> anfa, Iterable<S> input) {
    Delta<S> delta = anfa.delta();
    ISet<Integer> active = delta.epsilonClosure(LinearSet.of(anfa.q0()));
    for (S signal : input) {
      active = delta.epsilonClosure(delta.step(active, signal));
    }
    return active.contains(anfa.f());
  }

  public static boolean accepts(ANFA<Character> anfa, String input) {
    return accepts(anfa, chars(input));
  }

  public static List<Character> chars(String s) {
    List<Character> result = new ArrayList<>();
    for (char c : s.toCharArray()) {
      result.add(c);
    }
    return result;
  }

  public static <S> List<Transition<S>> snapshot(ANFA<S> anfa) {
    List<Transition<S>> result = new ArrayList<>();
    anfa.delta().forEach(result::add);
    return result;
  }
}
