package io.lacuna.breakrules;

import io.lacuna.bifurcan.*;

import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Collection and array helpers shared by the builders.
 */
public class Utils {

  public static <V> LinearSet<V> toSet(Stream<V> s) {
    return s.collect(Sets.linearCollector());
  }

  public static <K, V> IMap<K, ISet<V>> groupBy(Iterable<V> vals, Function<V, K> f) {
    LinearMap<K, ISet<V>> m = new LinearMap<>();
    vals.forEach(v -> m.getOrCreate(f.apply(v), LinearSet::new).add(v));
    return m;
  }

  /**
   * Adds every element of {@code src} to {@code dst}.
   */
  public static <V> void addAll(LinearSet<V> dst, ISet<V> src) {
    src.forEach(dst::add);
  }

  /**
   * @return a copy of {@code a} without the element at {@code idx}
   */
  public static int[] removeIndex(int[] a, int idx) {
    int[] result = new int[a.length - 1];
    System.arraycopy(a, 0, result, 0, idx);
    System.arraycopy(a, idx + 1, result, idx, a.length - idx - 1);
    return result;
  }

  /**
   * @return {@code n} rounded up to the next multiple of 8
   */
  public static int align8(int n) {
    return (n + 7) & ~7;
  }
}
