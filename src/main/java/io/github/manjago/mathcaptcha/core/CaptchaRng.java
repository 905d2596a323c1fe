package io.github.manjago.mathcaptcha.core;

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;

import java.util.List;

/**
 * Seedable random number generator used for expression synthesis.
 * <p>
 * Uses Apache Commons RNG XO_RO_SHI_RO_128_PP. A fixed seed makes the sequence
 * of generated expressions reproducible, which is handy for tests and for the
 * {@code sample} command.
 * <p>
 * Not thread-safe; callers that share an instance must synchronize.
 */
public final class CaptchaRng {

    private static final RandomSource ALGORITHM = RandomSource.XO_RO_SHI_RO_128_PP;

    private final long seed;
    private final UniformRandomProvider rng;

    /**
     * Create new RNG with given seed.
     */
    public CaptchaRng(long seed) {
        this.seed = seed;
        this.rng = ALGORITHM.create(seed);
    }

    /**
     * Create RNG with a random seed.
     */
    public static CaptchaRng randomlySeeded() {
        return new CaptchaRng(RandomSource.createLong());
    }

    /**
     * Create RNG for a configured seed, where 0 means "pick one".
     */
    public static CaptchaRng forSeed(long seed) {
        return seed == 0 ? randomlySeeded() : new CaptchaRng(seed);
    }

    /**
     * Returns uniformly distributed int in [0, bound).
     */
    public int nextInt(int bound) {
        return rng.nextInt(bound);
    }

    /**
     * Returns uniformly distributed int in [min, max], both inclusive.
     */
    public int nextIntInclusive(int min, int max) {
        if (min > max) {
            throw new IllegalArgumentException("min > max: " + min + " > " + max);
        }
        return min + rng.nextInt(max - min + 1);
    }

    /**
     * Returns a uniformly chosen element.
     *
     * @throws IllegalArgumentException if the list is empty
     */
    public <T> T pick(List<T> items) {
        if (items.isEmpty()) {
            throw new IllegalArgumentException("Cannot pick from an empty list");
        }
        return items.get(rng.nextInt(items.size()));
    }

    /**
     * Get the seed (for logging/debugging).
     */
    public long getSeed() {
        return seed;
    }
}
