package com.geons.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * RandomSource over ThreadLocalRandom, safe to share between request threads without contention.
 */
public final class ThreadLocalRandomSource implements RandomSource {

    @Override
    public int nextIndex(int bound) {
        return ThreadLocalRandom.current().nextInt(bound);
    }
}
