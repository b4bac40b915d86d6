package dpgen.generator;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class WeightedChoiceTest {

  @Test
  void testNonPositiveWeightsExcluded() {
    WeightedChoice<String> choice = new WeightedChoice<>(List.of("a", "b", "c", "d"), new double[] {0.0, 2.0, -1.0, 1.0});

    GeneratorRandom rand = new GeneratorRandom(1);
    Set<String> seen = new HashSet<>();
    for (int i = 0; i < 1000; ++i)
      seen.add(choice.draw(rand));
    Assertions.assertEquals(Set.of("b", "d"), seen);
  }

  @Test
  void testDistribution() {
    WeightedChoice<String> choice = new WeightedChoice<>(List.of("rare", "common"), new double[] {1.0, 3.0});
    GeneratorRandom rand = new GeneratorRandom(12345);
    int common = 0;
    final int draws = 20000;
    for (int i = 0; i < draws; ++i)
      if (choice.draw(rand).equals("common"))
        ++common;
    Assertions.assertEquals(0.75, (double)common / draws, 0.02);
  }

  @Test
  void testEmpty() {
    WeightedChoice<String> choice = new WeightedChoice<>(List.of("a", "b"), new double[] {0.0, 0.0});
    Assertions.assertThrows(IllegalStateException.class, () -> choice.draw(new GeneratorRandom(0)));
  }

  @Test
  void testLengthMismatch() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> new WeightedChoice<>(List.of("a"), new double[] {1.0, 1.0}));
  }

  @Test
  void testRandomInt() {
    GeneratorRandom rand = new GeneratorRandom(77);
    boolean sawMin = false, sawMax = false;
    for (int i = 0; i < 1000; ++i) {
      int value = rand.randomInt(2, 4);
      Assertions.assertTrue(value >= 2 && value <= 4);
      sawMin |= value == 2;
      sawMax |= value == 4;
    }
    Assertions.assertTrue(sawMin && sawMax);
    Assertions.assertEquals(5, rand.randomInt(5, 5));
    Assertions.assertThrows(IllegalArgumentException.class, () -> rand.randomInt(3, 2));
    Assertions.assertThrows(IllegalArgumentException.class, () -> rand.pick(List.of()));
  }

  @Test
  void testSameSeedSameStream() {
    GeneratorRandom a = new GeneratorRandom(-5);
    GeneratorRandom b = new GeneratorRandom(-5);
    for (int i = 0; i < 100; ++i) {
      Assertions.assertEquals(a.randomInt(0, 1000), b.randomInt(0, 1000));
      Assertions.assertEquals(a.randomBool(0.5), b.randomBool(0.5));
    }
  }
}
