package io.pitwall.telemetry.infrastructure.source.demo;

/**
 * Small deterministic 32-bit generator (mulberry32). Two instances built from the same seed produce the
 * same sequence on every platform.
 *
 * <p>Not thread-safe.</p>
 *
 * @since PITWALL 0.1.0
 */
final class SeededRandom {
  private static final double TWO_POW_32 = 4294967296d;

  private int state;

  SeededRandom(int seed) {
    this.state = seed;
  }

  /**
   * Derives a seed from text using the 31-multiplier string hash, made non-negative.
   *
   * @param text seed text
   * @return seeded generator
   */
  static SeededRandom fromText(String text) {
    return new SeededRandom(Math.abs(text.hashCode()));
  }

  /**
   * Returns the next value.
   *
   * @return uniformly distributed double in {@code [0, 1)}
   */
  double nextDouble() {
    state += 0x6D2B79F5;
    int t = state;
    t = (t ^ (t >>> 15)) * (t | 1);
    t ^= t + (t ^ (t >>> 7)) * (t | 61);
    return ((t ^ (t >>> 14)) & 0xFFFFFFFFL) / TWO_POW_32;
  }

  /**
   * Returns the next value scaled to an index.
   *
   * @param bound exclusive upper bound; must be positive
   * @return integer in {@code [0, bound)}
   */
  int nextInt(int bound) {
    return (int) Math.floor(nextDouble() * bound);
  }
}
