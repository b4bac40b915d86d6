package dpgen.generator;

import java.util.List;
import java.util.Random;

/**
 * The pseudo-random stream of one generation run. Seeded once; every draw of the generator goes through this class.
 */
public class GeneratorRandom {
  private final Random rand;

  public GeneratorRandom(long seed) { this.rand = new Random(seed); }

  /** Uniform integer in [min, max], both inclusive. */
  public int randomInt(int min, int max) {
    if (max < min)
      throw new IllegalArgumentException("Empty range [" + min + ", " + max + "]");
    return min + rand.nextInt(max - min + 1);
  }

  /** Returns true with the given probability. */
  public boolean randomBool(double probability) { return rand.nextDouble() < probability; }

  /** Uniform double in [0, 1). */
  public double nextDouble() { return rand.nextDouble(); }

  /**
   * Picks a uniformly random element (with replacement).
   * @param candidates the candidates; must not be empty
   */
  public <T> T pick(List<T> candidates) {
    if (candidates.isEmpty())
      throw new IllegalArgumentException("Cannot pick from an empty candidate list");
    return candidates.get(rand.nextInt(candidates.size()));
  }
}
