package com.scholary.video.splitter.splitting;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class SplitPlannerTest {

  private final SplitPlanner planner = new SplitPlanner();

  @ParameterizedTest
  @ValueSource(ints = {2, 3, 4})
  void planParts_shouldProduceContiguousPartsCoveringTheSource(int parts) {
    double duration = 125.37;

    List<TimeRange> ranges = planner.planParts(duration, parts);

    assertThat(ranges).hasSize(parts);
    assertThat(ranges.get(0).start()).isEqualTo(0.0);
    assertThat(ranges.get(parts - 1).end()).isEqualTo(duration);
    for (int i = 1; i < parts; i++) {
      assertThat(ranges.get(i).start()).isCloseTo(ranges.get(i - 1).end(), within(1e-9));
    }

    double partLength = duration / parts;
    double expectedLast = duration - (parts - 1) * partLength;
    assertThat(ranges.get(parts - 1).duration()).isCloseTo(expectedLast, within(1e-6));
  }

  @Test
  void planParts_shouldSplitNineSecondsIntoThreeSecondParts() {
    List<TimeRange> ranges = planner.planParts(9.0, 3);

    assertThat(ranges)
        .extracting(TimeRange::duration)
        .allSatisfy(length -> assertThat(length).isCloseTo(3.0, within(1e-9)));
    assertThat(ranges.get(1).start()).isCloseTo(3.0, within(1e-9));
    assertThat(ranges.get(2).start()).isCloseTo(6.0, within(1e-9));
  }

  @Test
  void planParts_shouldRejectNonPositiveDuration() {
    assertThatThrownBy(() -> planner.planParts(0.0, 2))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Duration must be positive");
    assertThatThrownBy(() -> planner.planParts(Double.NaN, 2))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void planParts_shouldRejectNonPositivePartCount() {
    assertThatThrownBy(() -> planner.planParts(10.0, 0))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Part count");
  }
}
