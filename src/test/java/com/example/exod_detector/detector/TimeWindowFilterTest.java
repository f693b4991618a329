package com.example.exod_detector.detector;

import com.example.exod_detector.model.DeadTimeInterval;
import com.example.exod_detector.model.TimeWindow;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TimeWindowFilterTest {

    private final TimeWindowFilter filter = new TimeWindowFilter();

    @ParameterizedTest
    @ValueSource(doubles = {1.0, 7.5, 100.0, 333.0})
    void withoutDeadTimeEveryWindowIsAcceptedAtFullRatio(double width) {
        List<TimeWindow> all = filter.windows(0.0, 1000.0, width, List.of());
        List<TimeWindow> accepted = filter.acceptedWindows(0.0, 1000.0, width, List.of(), 1.0);

        assertThat(accepted).hasSameSizeAs(all);
        assertThat(accepted).allMatch(w -> w.validDurationRatio() == 1.0);
        assertThat(accepted.get(accepted.size() - 1).end()).isCloseTo(1000.0, within(1e-9));
    }

    @Test
    void lastWindowIsShorterAndStillAccepted() {
        List<TimeWindow> accepted = filter.acceptedWindows(10.0, 260.0, 100.0, List.of(), 1.0);

        assertThat(accepted).extracting(TimeWindow::start).containsExactly(10.0, 110.0, 210.0);
        assertThat(accepted.get(2).duration()).isEqualTo(50.0);
    }

    @Test
    void computesValidRatioFromOverlappingDeadTime() {
        List<DeadTimeInterval> dead = List.of(
                new DeadTimeInterval(20, 40),
                new DeadTimeInterval(30, 50),   // overlaps the first one
                new DeadTimeInterval(90, 130)); // straddles two windows

        List<TimeWindow> all = filter.windows(0, 200, 100, dead);

        assertThat(all.get(0).validDurationRatio()).isCloseTo(0.60, within(1e-12));
        assertThat(all.get(1).validDurationRatio()).isCloseTo(0.70, within(1e-12));
    }

    @Test
    void thresholdIsInclusive() {
        List<DeadTimeInterval> dead = List.of(new DeadTimeInterval(0, 50));

        assertThat(filter.acceptedWindows(0, 200, 100, dead, 0.5)).hasSize(2);
        assertThat(filter.acceptedWindows(0, 200, 100, dead, 0.5000001)).hasSize(1);
    }

    @Test
    void raisingRatioNeverAddsWindows() {
        List<DeadTimeInterval> dead = List.of(
                new DeadTimeInterval(5, 25), new DeadTimeInterval(140, 150),
                new DeadTimeInterval(260, 390), new DeadTimeInterval(512, 513));
        int previous = Integer.MAX_VALUE;
        for (double gtr = 0.0; gtr <= 1.0; gtr += 0.05) {
            int count = filter.acceptedWindows(0, 600, 100, dead, gtr).size();
            assertThat(count).isLessThanOrEqualTo(previous);
            previous = count;
        }
    }

    @Test
    void degenerateWindowIsRejected() {
        List<TimeWindow> all = filter.windows(50, 50, 100, List.of());

        assertThat(all).hasSize(1);
        assertThat(all.get(0).duration()).isZero();
        assertThat(filter.acceptedWindows(50, 50, 100, List.of(), 0.0)).isEmpty();
    }

    @Test
    void windowsAreOrderedByStart() {
        List<TimeWindow> all = filter.windows(0, 1000, 30, List.of(new DeadTimeInterval(100, 300)));
        for (int i = 1; i < all.size(); i++) {
            assertThat(all.get(i).start()).isGreaterThan(all.get(i - 1).start());
            assertThat(all.get(i).index()).isEqualTo(i);
        }
    }
}
