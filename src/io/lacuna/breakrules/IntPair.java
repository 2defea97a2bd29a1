package io.lacuna.breakrules;

/**
 * An ordered pair of indices, {@code first < second}, naming two categories or two states.
 */
public final class IntPair {

  public final int first;
  public final int second;

  public IntPair(int first, int second) {
    this.first = first;
    this.second = second;
  }

  @Override
  public boolean equals(Object o) {
    if (o instanceof IntPair) {
      IntPair p = (IntPair) o;
      return first == p.first && second == p.second;
    }
    return false;
  }

  @Override
  public int hashCode() {
    return 31 * first + second;
  }

  @Override
  public String toString() {
    return "(" + first + ", " + second + ")";
  }
}
