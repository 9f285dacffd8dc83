package org.pragmatica.calculator.eval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Factorial computed as a product of contiguous ranges which may be multiplied in parallel.
 */
public final class Factorials {
    private static final Logger log = LoggerFactory.getLogger(Factorials.class);

    /**
     * Inclusive range of factors.
     */
    public record Chunk(long from, long to) {
        public BigInteger product() {
            var product = BigInteger.ONE;
            for (long factor = from; factor <= to; factor++) {
                product = product.multiply(BigInteger.valueOf(factor));
            }
            return product;
        }
    }

    private Factorials() {}

    public static BigInteger sequential(long n) {
        return new Chunk(1, n).product();
    }

    /**
     * Split {@code [1, n]} into {@code min(parts, digits(n))} contiguous ranges.
     * The last range takes the remainder. Zero yields no ranges.
     */
    public static List<Chunk> partition(long n, int parts) {
        if (n < 1) {
            return List.of();
        }
        int count = Math.max(1, Math.min(parts, Long.toString(n).length()));
        long size = n / count;
        var chunks = new ArrayList<Chunk>(count);
        for (int i = 0; i < count; i++) {
            long to = i == count - 1
                      ? n
                      : size * (i + 1);
            chunks.add(new Chunk(size * i + 1, to));
        }
        return chunks;
    }

    /**
     * Multiply every chunk on the executor, then combine the chunk products in order.
     */
    public static CompletableFuture<BigInteger> parallel(long n, int parts, Executor executor) {
        var chunks = partition(n, parts);
        log.debug("Factorial of {} split into {}", n, chunks);

        var products = chunks.stream()
                             .map(chunk -> CompletableFuture.supplyAsync(chunk::product, executor))
                             .toList();
        return CompletableFuture.allOf(products.toArray(CompletableFuture[]::new))
                                .thenApply(ignored -> products.stream()
                                                              .map(CompletableFuture::join)
                                                              .reduce(BigInteger.ONE, BigInteger::multiply));
    }
}
