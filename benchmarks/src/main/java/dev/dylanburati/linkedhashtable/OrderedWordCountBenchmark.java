package dev.dylanburati.linkedhashtable;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import it.unimi.dsi.fastutil.objects.Object2ObjectLinkedOpenHashMap;

/**
 * Counts simulated words while remembering the order each word first appeared,
 * then walks the result in that order.
 */
@State(Scope.Benchmark)
public class OrderedWordCountBenchmark {
  @Param({"100000", "1000000"})
  public int wordCount;

  private String[] words;

  @Setup(Level.Trial)
  public void generateWords() {
    byte[] alph = "pfscxkde".getBytes(StandardCharsets.US_ASCII);
    byte[] wbuf = new byte[32];
    Random r = new Random(0L);
    this.words = new String[this.wordCount];
    for (int i = 0; i < this.wordCount; i++) {
      double uniform = r.nextDouble();
      int wlen = genWordLen(uniform);
      for (int wid = genWordId(uniform), j = 0; j < wlen; j++) {
        wbuf[j] = alph[(wid >> (3 * (j%9))) & 7];
      }
      this.words[i] = new String(wbuf, 0, wlen, StandardCharsets.US_ASCII);
    }
    System.out.println("Size: " + countByMerge(new LinkedHashTable<>()).size());
  }

  @Benchmark
  @BenchmarkMode(Mode.AverageTime)
  @OutputTimeUnit(TimeUnit.MILLISECONDS)
  public void countLinkedHashTable(Blackhole bh) {
    LinkedHashTable<String, int[]> m = new LinkedHashTable<>(16, String::hashCode, String::equals, () -> new int[1]);
    for (String w : this.words) {
      m.getOrCreate(w)[0]++;
    }
    long checksum = 0;
    for (ReadOnlyPosition<String, int[]> p = m.readOnlyBegin(); !p.isEnd(); p = p.next()) {
      checksum = checksum * 31 + p.getValue()[0];
    }
    bh.consume(checksum);
  }

  @Benchmark
  @BenchmarkMode(Mode.AverageTime)
  @OutputTimeUnit(TimeUnit.MILLISECONDS)
  public void countLinkedHashTableMerge(Blackhole bh) {
    bh.consume(checksum(countByMerge(new LinkedHashTable<>())));
  }

  @Benchmark
  @BenchmarkMode(Mode.AverageTime)
  @OutputTimeUnit(TimeUnit.MILLISECONDS)
  public void countLinkedHashMap(Blackhole bh) {
    bh.consume(checksum(countByMerge(new LinkedHashMap<>())));
  }

  @Benchmark
  @BenchmarkMode(Mode.AverageTime)
  @OutputTimeUnit(TimeUnit.MILLISECONDS)
  public void countObject2ObjectLinkedOpenHashMap(Blackhole bh) {
    bh.consume(checksum(countByMerge(new Object2ObjectLinkedOpenHashMap<>())));
  }

  private Map<String, Integer> countByMerge(Map<String, Integer> m) {
    for (String w : this.words) {
      m.merge(w, 1, (v1, v2) -> v1 + v2);
    }
    return m;
  }

  private static long checksum(Map<String, Integer> m) {
    long checksum = 0;
    for (Map.Entry<String, Integer> e : m.entrySet()) {
      checksum = checksum * 31 + e.getValue();
    }
    return checksum;
  }

  private static int genWordId(double uniform) {
    // Prob of returning x is proportional to (x+3.7) ** -1.01
    // Similar distribution to English
    return (int) Math.pow(-0.01 * 15.768233989819334 * uniform + 0.9870018865063785, -100.0);
  }

  private static final double[] LENGTH_CDF = new double[]{
    2.55402880e-15, 3.73483535e-07, 2.06251620e-04, 4.60037401e-03,
    2.77018313e-02, 8.59221455e-02, 1.82026193e-01, 3.04121079e-01,
    4.34720260e-01, 5.58784740e-01, 6.67021855e-01, 7.55676596e-01,
    8.24886736e-01, 8.76934270e-01, 9.14931000e-01, 9.42014131e-01,
    9.60943967e-01, 9.73962076e-01, 9.82793792e-01, 9.88716864e-01,
    9.92650419e-01, 9.95240748e-01, 9.96934095e-01, 9.98034022e-01,
    9.98744497e-01, 9.99201152e-01, 9.99493382e-01, 9.99679661e-01,
    9.99797989e-01, 9.99872918e-01, 9.99920231e-01, 9.99950030e-01
  };

  private static int genWordLen(double uniform) {
    int i = Arrays.binarySearch(LENGTH_CDF, uniform);
    return i >= 0 ? i : -i - 1;
  }

  public static void main(String[] args) throws RunnerException {
    Options opt = new OptionsBuilder()
        .include(OrderedWordCountBenchmark.class.getSimpleName())
        .forks(1)
        .build();
    new Runner(opt).run();
  }
}
