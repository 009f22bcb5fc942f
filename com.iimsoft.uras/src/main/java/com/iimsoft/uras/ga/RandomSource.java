package com.iimsoft.uras.ga;

import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 随机数来源。seed = 0 表示使用 ThreadLocalRandom（不可复现），否则固定种子可复现。
 * 只在单线程的繁殖阶段使用，并行评估阶段不取随机数。
 */
final class RandomSource {

    private final Random rnd;

    RandomSource(long seed) {
        this.rnd = (seed == 0L) ? null : new Random(seed);
    }

    int randomInt(int inclusive, int exclusive) {
        if (rnd != null) return inclusive + rnd.nextInt(exclusive - inclusive);
        return ThreadLocalRandom.current().nextInt(inclusive, exclusive);
    }

    boolean randomBoolean() {
        if (rnd != null) return rnd.nextBoolean();
        return ThreadLocalRandom.current().nextBoolean();
    }

    double randomDouble() {
        if (rnd != null) return rnd.nextDouble();
        return ThreadLocalRandom.current().nextDouble();
    }
}
