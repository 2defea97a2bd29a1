package io.lacuna.breakrules;

import io.lacuna.bifurcan.*;

import java.util.SortedSet;
import java.util.TreeSet;

/**
 * One row of a state table under construction.
 */
class StateDescriptor {

  /**
   * 0 if not accepting, -1 if accepting, otherwise the number of the lookahead rule that accepts here
   */
  int accepting;

  /**
   * 0, or the number of the lookahead rule whose '/' position this state is at
   */
  int lookAhead;

  /**
   * index of this state's group in the {@link RuleStatusTable}
   */
  int tagsIdx;

  final SortedSet<Integer> tagVals = new TreeSet<>();

  /**
   * the parse tree positions this state represents
   */
  final ISet<RuleNode> positions;

  /**
   * next state for each category
   */
  int[] next;

  StateDescriptor(ISet<RuleNode> positions, int categories) {
    this.positions = positions;
    this.next = new int[categories];
  }

  /**
   * @return true if {@code this} and {@code other} behave identically, treating references to either of
   * the states {@code a} or {@code b} as equivalent
   */
  boolean equivalent(StateDescriptor other, int a, int b) {
    if (accepting != other.accepting || lookAhead != other.lookAhead || tagsIdx != other.tagsIdx) {
      return false;
    }

    for (int col = 0; col < next.length; col++) {
      int x = next[col];
      int y = other.next[col];
      if (x != y && !((x == a || x == b) && (y == a || y == b))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(String.format("%5d %5d %5d |", accepting, lookAhead, tagsIdx));
    for (int n : next) {
      sb.append(String.format(" %3d", n));
    }
    return sb.toString();
  }
}
