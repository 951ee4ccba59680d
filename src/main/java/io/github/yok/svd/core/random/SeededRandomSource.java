package io.github.yok.svd.core.random;

import java.util.SplittableRandom;
import java.util.concurrent.ThreadLocalRandom;
import lombok.Getter;

/**
 * シード値から生成する {@link RandomSource} の実装です。
 *
 * <p>
 * 単一スレッドからの利用を前提とします。 スレッドをまたぐ場合は {@link #derive(int)} で派生させてください。
 * </p>
 */
public final class SeededRandomSource implements RandomSource {

    /**
     * 派生ストリームのシード混合に使う定数（黄金比由来）です。
     */
    private static final long STREAM_MIX = 0x9E3779B97F4A7C15L;

    /**
     * 生成時のシード値です。
     */
    @Getter
    private final long seed;

    private final SplittableRandom random;

    /**
     * 乱数源を生成します。
     *
     * @param seed シード値です
     */
    public SeededRandomSource(long seed) {
        this.seed = seed;
        this.random = new SplittableRandom(seed);
    }

    /**
     * 実行ごとに異なるシードを持つ乱数源を生成します。
     *
     * @return 乱数源です
     */
    public static SeededRandomSource unseeded() {
        return new SeededRandomSource(ThreadLocalRandom.current().nextLong());
    }

    @Override
    public double nextDouble() {
        return random.nextDouble();
    }

    @Override
    public RandomSource derive(int stream) {
        return new SeededRandomSource(seed + STREAM_MIX * (stream + 1L));
    }
}
