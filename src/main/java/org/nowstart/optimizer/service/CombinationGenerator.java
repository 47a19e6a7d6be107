package org.nowstart.optimizer.service;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.nowstart.optimizer.data.dto.Candidate;
import org.nowstart.optimizer.data.dto.StrategyConfig;
import org.nowstart.optimizer.data.exception.OptimizationValidationException;
import org.springframework.stereotype.Service;

/**
 * Enumerates every combination of strategies whose size lies in the accepted range.
 * <p>
 * With only a minimum size the range is exactly that size; an explicit maximum sweeps every
 * size from minimum to maximum. Candidates come out ordered by size, then lexicographically
 * by input index, so repeated runs over the same list see the same order.
 */
@Service
public class CombinationGenerator {

    public static final int MIN_CANDIDATE_SIZE = 2;

    public Stream<Candidate> generate(List<StrategyConfig> strategies, int minSize) {
        return generate(strategies, minSize, null);
    }

    public Stream<Candidate> generate(List<StrategyConfig> strategies, int minSize, Integer maxSize) {
        if (strategies == null) {
            throw new OptimizationValidationException("strategies must not be null");
        }
        SizeRange range = resolveRange(strategies.size(), minSize, maxSize);
        requireDistinct(strategies);
        List<StrategyConfig> source = List.copyOf(strategies);
        Iterator<Candidate> iterator = new CombinationIterator(source, range);
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
                false
        );
    }

    /**
     * Number of candidates {@link #generate} yields, saturated at {@link Long#MAX_VALUE} when the
     * exact total does not fit in a long.
     */
    public long count(int strategyCount, int minSize, Integer maxSize) {
        SizeRange range = resolveRange(strategyCount, minSize, maxSize);
        BigInteger total = BigInteger.ZERO;
        for (int size = range.min(); size <= range.max(); size++) {
            total = total.add(binomial(strategyCount, size));
        }
        return total.bitLength() < Long.SIZE ? total.longValue() : Long.MAX_VALUE;
    }

    public void validateRange(int strategyCount, int minSize, Integer maxSize) {
        resolveRange(strategyCount, minSize, maxSize);
    }

    SizeRange resolveRange(int strategyCount, int minSize, Integer maxSize) {
        if (minSize < MIN_CANDIDATE_SIZE) {
            throw new OptimizationValidationException("minSize must be at least " + MIN_CANDIDATE_SIZE + ", got: " + minSize);
        }
        if (minSize > strategyCount) {
            throw new OptimizationValidationException(
                    "minSize cannot be greater than the number of strategies (" + strategyCount + "), got: " + minSize
            );
        }
        if (maxSize == null) {
            return new SizeRange(minSize, minSize);
        }
        if (maxSize < minSize) {
            throw new OptimizationValidationException("maxSize must be >= minSize (" + minSize + "), got: " + maxSize);
        }
        if (maxSize > strategyCount) {
            throw new OptimizationValidationException(
                    "maxSize cannot be greater than the number of strategies (" + strategyCount + "), got: " + maxSize
            );
        }
        return new SizeRange(minSize, maxSize);
    }

    private static void requireDistinct(List<StrategyConfig> strategies) {
        Set<StrategyConfig> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (StrategyConfig strategy : strategies) {
            if (strategy == null) {
                throw new OptimizationValidationException("strategies must not contain null");
            }
            if (!seen.add(strategy)) {
                throw new OptimizationValidationException("strategy listed twice: " + strategy.strategyId());
            }
        }
    }

    private static BigInteger binomial(int n, int k) {
        int r = Math.min(k, n - k);
        BigInteger result = BigInteger.ONE;
        for (int i = 1; i <= r; i++) {
            result = result.multiply(BigInteger.valueOf(n - r + i)).divide(BigInteger.valueOf(i));
        }
        return result;
    }

    record SizeRange(int min, int max) {
    }

    private static final class CombinationIterator implements Iterator<Candidate> {

        private final List<StrategyConfig> source;
        private final int maxSize;
        private int size;
        private int[] indices;

        private CombinationIterator(List<StrategyConfig> source, SizeRange range) {
            this.source = source;
            this.maxSize = range.max();
            this.size = range.min();
            this.indices = firstIndices(size);
        }

        @Override
        public boolean hasNext() {
            return indices != null;
        }

        @Override
        public Candidate next() {
            if (indices == null) {
                throw new NoSuchElementException();
            }
            List<StrategyConfig> members = new ArrayList<>(size);
            for (int index : indices) {
                members.add(source.get(index));
            }
            advance();
            return new Candidate(members);
        }

        private void advance() {
            int n = source.size();
            int i = size - 1;
            while (i >= 0 && indices[i] == n - size + i) {
                i--;
            }
            if (i >= 0) {
                indices[i]++;
                for (int j = i + 1; j < size; j++) {
                    indices[j] = indices[j - 1] + 1;
                }
                return;
            }
            size++;
            indices = size <= maxSize ? firstIndices(size) : null;
        }

        private static int[] firstIndices(int size) {
            int[] first = new int[size];
            for (int i = 0; i < size; i++) {
                first[i] = i;
            }
            return first;
        }
    }
}
