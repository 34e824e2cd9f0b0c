package io.lacuna.anfa;

import io.lacuna.bifurcan.IMap;
import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearMap;
import io.lacuna.bifurcan.LinearSet;
import io.lacuna.bifurcan.Sets;

import java.util.function.Function;
import java.util.stream.IntStream;
import java.util.stream.Stream;

public class Utils {

  private Utils() {
  }

  public static <V> LinearSet<V> toSet(Stream<V> s) {
    return s.collect(Sets.linearCollector());
  }

  /**
   * @return the ids in {@code [start, end)}
   */
  public static LinearSet<Integer> range(int start, int end) {
    return toSet(IntStream.range(start, end).boxed());
  }

  public static <K, V> IMap<K, ISet<V>> groupBy(Iterable<V> vals, Function<V, K> f) {
    LinearMap<K, ISet<V>> m = new LinearMap<>();
    vals.forEach(v -> m.getOrCreate(f.apply(v), LinearSet::new).add(v));
    return m;
  }
}
