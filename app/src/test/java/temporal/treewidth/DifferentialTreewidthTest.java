package temporal.treewidth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import temporal.core.InvalidWindowException;
import temporal.core.model.TemporalGraph;
import temporal.generator.RandomGraphConfig;
import temporal.generator.RandomGraphGenerator;
import temporal.testing.Graphs;

final class DifferentialTreewidthTest {
  private static final int[][] K4 = {{0, 1}, {0, 2}, {0, 3}, {1, 2}, {1, 3}, {2, 3}};

  private final DifferentialTreewidth sequential = new DifferentialTreewidth();

  @Test
  void oneEntryPerValidStart() {
    TemporalGraph graph = Graphs.repeated(3, 5, new int[][] {{0, 1}});

    for (int delta = 1; delta <= 5; delta++) {
      DifferentialTreewidthReport report = sequential.compute(graph, delta);
      assertEquals(5 - delta + 1, report.perStart().size(), "delta " + delta);
      assertEquals(delta, report.delta());
      for (int i = 0; i < report.perStart().size(); i++) {
        assertEquals(i, report.perStart().get(i).start(), "ascending start order");
      }
    }
  }

  @Test
  void minimumPicksTheSparsestWindow() {
    TemporalGraph graph = Graphs.of(4, K4, new int[][] {}, new int[][] {});

    DifferentialTreewidthReport single = sequential.compute(graph, 1);
    assertEquals(
        List.of(3, 0, 0), single.perStart().stream().map(WindowTreewidth::width).toList());
    assertEquals(0, single.minimum());
    assertEquals(1, single.argMinimum());

    DifferentialTreewidthReport pairs = sequential.compute(graph, 2);
    assertEquals(
        List.of(3, 1), pairs.perStart().stream().map(WindowTreewidth::width).toList());
    assertEquals(1, pairs.minimum(), "only the red matching is left in the second window");
    assertTrue(pairs.allExact());
  }

  @Test
  void minimumIsNeverAboveAnyWindow() {
    RandomGraphGenerator generator = new RandomGraphGenerator();
    for (long seed = 0; seed < 5; seed++) {
      TemporalGraph graph = generator.generate(new RandomGraphConfig(4, 5, 0.5, seed));
      DifferentialTreewidthReport report = sequential.compute(graph, 2);
      for (WindowTreewidth window : report.perStart()) {
        assertTrue(report.minimum() <= window.width(), "seed " + seed);
      }
    }
  }

  @Test
  void rejectsDeltaOutsideLifetime() {
    TemporalGraph graph = Graphs.pathAndMatching();

    InvalidWindowException tooLarge =
        assertThrows(InvalidWindowException.class, () -> sequential.compute(graph, 3));
    assertEquals("delta", tooLarge.field());
    assertThrows(InvalidWindowException.class, () -> sequential.compute(graph, 0));
  }

  @Test
  void parallelMatchesSequential() {
    TemporalGraph graph =
        new RandomGraphGenerator().generate(new RandomGraphConfig(5, 8, 0.4, 19L));
    DifferentialTreewidth parallel =
        new DifferentialTreewidth(new TreewidthEngine(), DifferentialTreewidth.Config.parallel(3));

    DifferentialTreewidthReport expected = sequential.compute(graph, 2);
    DifferentialTreewidthReport actual = parallel.compute(graph, 2);
    assertEquals(
        expected.perStart().stream().map(WindowTreewidth::width).toList(),
        actual.perStart().stream().map(WindowTreewidth::width).toList());
    assertEquals(
        expected.perStart().stream().map(WindowTreewidth::start).toList(),
        actual.perStart().stream().map(WindowTreewidth::start).toList());
  }

  @Test
  void parallelismMustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> DifferentialTreewidth.Config.parallel(0));
  }
}
