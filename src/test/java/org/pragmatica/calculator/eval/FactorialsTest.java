package org.pragmatica.calculator.eval;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class FactorialsTest {
    private static ExecutorService executor;

    @BeforeAll
    static void startPool() {
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterAll
    static void stopPool() {
        executor.shutdownNow();
    }

    @Test
    void sequential_smallValues() {
        assertEquals(BigInteger.ONE, Factorials.sequential(0));
        assertEquals(BigInteger.ONE, Factorials.sequential(1));
        assertEquals(BigInteger.valueOf(120), Factorials.sequential(5));
        assertEquals(new BigInteger("2432902008176640000"), Factorials.sequential(20));
    }

    // === Partition Tests ===

    @Test
    void partition_limitedByDigitCount() {
        assertThat(Factorials.partition(7, 3)).containsExactly(new Factorials.Chunk(1, 7));
        assertThat(Factorials.partition(10, 4)).containsExactly(new Factorials.Chunk(1, 5),
                                                                new Factorials.Chunk(6, 10));
    }

    @Test
    void partition_lastChunkTakesRemainder() {
        assertThat(Factorials.partition(12345, 3)).containsExactly(new Factorials.Chunk(1, 4115),
                                                                   new Factorials.Chunk(4116, 8230),
                                                                   new Factorials.Chunk(8231, 12345));
        assertThat(Factorials.partition(1003, 4)).last()
                                                 .isEqualTo(new Factorials.Chunk(751, 1003));
    }

    @Test
    void partition_zero_isEmpty() {
        assertThat(Factorials.partition(0, 4)).isEmpty();
    }

    @Test
    void partition_coversRangeContiguously() {
        for (long n : List.of(1L, 9L, 10L, 99L, 1000L, 54321L, 1_000_003L)) {
            for (int parts = 1; parts <= 8; parts++) {
                var chunks = Factorials.partition(n, parts);
                long next = 1;
                for (var chunk : chunks) {
                    assertEquals(next, chunk.from());
                    next = chunk.to() + 1;
                }
                assertEquals(n + 1, next);
            }
        }
    }

    // === Parallel Tests ===

    @Test
    void parallel_matchesSequential() {
        for (long n : List.of(0L, 1L, 5L, 17L, 100L, 257L, 1000L)) {
            for (int parts = 1; parts <= 6; parts++) {
                assertEquals(Factorials.sequential(n), Factorials.parallel(n, parts, executor).join(),
                             "n=" + n + ", parts=" + parts);
            }
        }
    }
}
