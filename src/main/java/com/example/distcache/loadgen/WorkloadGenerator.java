package com.example.distcache.loadgen;

import com.example.distcache.core.Cache;
import com.example.distcache.core.CacheSettings;
import com.example.distcache.core.CacheStats;
import com.example.distcache.eviction.EvictionPolicy;
import com.example.distcache.memory.InMemoryCache;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;
import org.apache.commons.math3.distribution.ZipfDistribution;
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

/**
 * Read-through workload against a {@link Cache}: Zipf-distributed hot keys mixed with one-off
 * scan keys, a write on every miss. Used to compare eviction policies under the same load.
 *
 * Usage: WorkloadGenerator &lt;lru|sieve|all&gt; [threads] [opsPerThread] [universe] [alpha] [scanRatio] [maxSize]
 */
public class WorkloadGenerator {

    public static final class Workload {
        final int threads;
        final int operationsPerThread;
        final int universe;
        final double alpha;
        final double scanRatio;
        final long seed;

        public Workload(int threads, int operationsPerThread, int universe, double alpha, double scanRatio, long seed) {
            if (threads < 1 || operationsPerThread < 1 || universe < 1) {
                throw new IllegalArgumentException("threads, operations and universe must be positive");
            }
            if (scanRatio < 0.0 || scanRatio > 1.0) {
                throw new IllegalArgumentException("scanRatio must be within [0, 1]: " + scanRatio);
            }
            this.threads = threads;
            this.operationsPerThread = operationsPerThread;
            this.universe = universe;
            this.alpha = alpha;
            this.scanRatio = scanRatio;
            this.seed = seed;
        }

        public long totalOperations() {
            return (long) threads * operationsPerThread;
        }
    }

    public static final class Report {
        public final long operations;
        public final long misses;
        public final CacheStats stats;
        public final double p50Micros;
        public final double p99Micros;
        public final double maxMicros;

        Report(long operations, long misses, CacheStats stats, DescriptiveStatistics latencies) {
            this.operations = operations;
            this.misses = misses;
            this.stats = stats;
            this.p50Micros = latencies.getN() == 0 ? 0.0 : latencies.getPercentile(50);
            this.p99Micros = latencies.getN() == 0 ? 0.0 : latencies.getPercentile(99);
            this.maxMicros = latencies.getN() == 0 ? 0.0 : latencies.getMax();
        }

        public double hitRate() {
            return operations == 0 ? 0.0 : (double) (operations - misses) / operations;
        }

        @Override
        public String toString() {
            return String.format(Locale.ROOT,
                "ops=%d, hitRate=%.3f, evictions=%d, size=%d, P50=%.1fus, P99=%.1fus, Max=%.1fus",
                operations, hitRate(), stats.getEvictions(), stats.getSize(), p50Micros, p99Micros, maxMicros);
        }
    }

    public static Report run(Cache cache, Workload workload) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(workload.threads);
        ConcurrentLinkedQueue<Double> latencies = new ConcurrentLinkedQueue<>();
        AtomicLong misses = new AtomicLong();
        AtomicLong scanIndex = new AtomicLong(workload.universe + 10_000L);
        List<Future<?>> futures = new ArrayList<>();

        for (int i = 0; i < workload.threads; i++) {
            long threadSeed = workload.seed + i;
            futures.add(executor.submit(() -> {
                ZipfDistribution zipf = new ZipfDistribution(new Well19937c(threadSeed), workload.universe, workload.alpha);
                Random rand = new Random(threadSeed);
                for (int op = 0; op < workload.operationsPerThread; op++) {
                    String key = rand.nextDouble() < workload.scanRatio
                        ? "scan-" + scanIndex.getAndIncrement()
                        : "key-" + zipf.sample();
                    long start = System.nanoTime();
                    if (cache.get(key).isEmpty()) {
                        misses.incrementAndGet();
                        cache.set(key, "value-for-" + key);
                    }
                    latencies.add((System.nanoTime() - start) / 1_000.0);
                }
            }));
        }
        executor.shutdown();
        try {
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (ExecutionException e) {
            executor.shutdownNow();
            throw new IllegalStateException("workload thread failed", e.getCause());
        }

        DescriptiveStatistics stats = new DescriptiveStatistics();
        latencies.forEach(stats::addValue);
        return new Report(workload.totalOperations(), misses.get(), cache.cacheStats(), stats);
    }

    public static void main(String[] args) throws Exception {
        if (args.length < 1) {
            System.out.println("Usage: WorkloadGenerator <lru|sieve|all> [threads] [opsPerThread] [universe] [alpha] [scanRatio] [maxSize]");
            return;
        }
        int threads = args.length > 1 ? Integer.parseInt(args[1]) : 8;
        int ops = args.length > 2 ? Integer.parseInt(args[2]) : 100_000;
        int universe = args.length > 3 ? Integer.parseInt(args[3]) : 100_000;
        double alpha = args.length > 4 ? Double.parseDouble(args[4]) : 0.9;
        double scanRatio = args.length > 5 ? Double.parseDouble(args[5]) : 0.0;
        int maxSize = args.length > 6 ? Integer.parseInt(args[6]) : 10_000;

        List<EvictionPolicy> policies = "all".equalsIgnoreCase(args[0])
            ? List.of(EvictionPolicy.values())
            : List.of(EvictionPolicy.valueOf(args[0].toUpperCase(Locale.ROOT)));
        Workload workload = new Workload(threads, ops, universe, alpha, scanRatio, 42L);

        System.out.println(String.format(Locale.ROOT,
            "Workload: threads=%d, opsPerThread=%d, universe=%d, alpha=%.2f, scanRatio=%.2f, maxSize=%d",
            threads, ops, universe, alpha, scanRatio, maxSize));
        for (EvictionPolicy policy : policies) {
            CacheSettings settings = CacheSettings.defaults()
                .withMaxSize(maxSize)
                .withEvictionPolicy(policy)
                .withSweepInterval(Duration.ZERO);
            try (InMemoryCache cache = new InMemoryCache(settings)) {
                System.out.println(policy + ": " + run(cache, workload));
            }
        }
    }
}
