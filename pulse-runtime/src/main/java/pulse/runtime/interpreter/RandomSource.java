package pulse.runtime.interpreter;

import java.util.Random;

/**
 * {@code Math.random()} 的随机源
 */
public interface RandomSource {

    /** 取值 [0, 1) */
    double nextDouble();

    /** 每次运行结果不同 */
    static RandomSource system() {
        final Random random = new Random();
        return random::nextDouble;
    }

    /** 固定种子，序列可复现 */
    static RandomSource seeded(long seed) {
        final Random random = new Random(seed);
        return random::nextDouble;
    }
}
