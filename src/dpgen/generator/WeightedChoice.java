package dpgen.generator;

import java.util.ArrayList;
import java.util.List;

/**
 * Discrete distribution over a fixed candidate list with unnormalized weights.
 * Candidates with a weight of zero or less are excluded entirely.
 */
public class WeightedChoice<T> {
  private final ArrayList<T> candidates = new ArrayList<>();
  private final ArrayList<Double> cumulative = new ArrayList<>();
  private double total = 0.0;

  /**
   * @param values the candidates in draw order
   * @param weights the weight of each candidate, same length as values
   */
  public WeightedChoice(List<T> values, double[] weights) {
    if (values.size() != weights.length)
      throw new IllegalArgumentException("Got " + values.size() + " candidates but " + weights.length + " weights");
    for (int i = 0; i < weights.length; ++i) {
      if (!(weights[i] > 0.0))
        continue;
      total += weights[i];
      candidates.add(values.get(i));
      cumulative.add(total);
    }
  }

  /**
   * Draws one candidate, consuming one double from the stream.
   * @throws IllegalStateException if no candidate has a positive weight
   */
  public T draw(GeneratorRandom rand) {
    if (candidates.isEmpty())
      throw new IllegalStateException("No candidate with a positive weight");
    double r = rand.nextDouble() * total;
    for (int i = 0; i < candidates.size(); ++i) {
      if (r < cumulative.get(i))
        return candidates.get(i);
    }
    return candidates.get(candidates.size() - 1); // rounding at the upper end
  }
}
