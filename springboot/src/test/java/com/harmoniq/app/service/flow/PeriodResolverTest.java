package com.harmoniq.app.service.flow;

import com.harmoniq.app.dto.flow.Period;
import com.harmoniq.app.exception.FlowConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDateTime;
import java.util.List;

import static com.harmoniq.app.service.flow.TestTracks.period;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PeriodResolverTest {

    private final PeriodResolver resolver = new PeriodResolver();

    private final List<Period> periods = List.of(
            period("Night", 23),
            period("Morning", 6),
            period("Evening", 18));

    @Test
    void wrapsToLastPeriodBeforeFirstStartHour() {
        Period active = resolver.resolve(LocalDateTime.of(2024, 1, 1, 3, 0), periods);

        assertThat(active.getName()).isEqualTo("Night");
    }

    @Test
    void picksGreatestStartHourNotAfterCurrentHour() {
        assertThat(resolver.resolve(6, periods).getName()).isEqualTo("Morning");
        assertThat(resolver.resolve(17, periods).getName()).isEqualTo("Morning");
        assertThat(resolver.resolve(18, periods).getName()).isEqualTo("Evening");
        assertThat(resolver.resolve(22, periods).getName()).isEqualTo("Evening");
        assertThat(resolver.resolve(23, periods).getName()).isEqualTo("Night");
    }

    @Test
    void everyHourResolvesToExactlyOneConfiguredPeriod() {
        for (int hour = 0; hour < 24; hour++) {
            Period active = resolver.resolve(hour, periods);

            assertThat(periods).contains(active);
            boolean startsBefore = active.getStartHour() <= hour;
            boolean wrapped = hour < 6 && active.getName().equals("Night");
            assertThat(startsBefore || wrapped).as("hour %d -> %s", hour, active.getName()).isTrue();
        }
    }

    @Test
    void singlePeriodCoversWholeDay() {
        List<Period> single = List.of(period("Always", 12));

        for (int hour = 0; hour < 24; hour++) {
            assertThat(resolver.resolve(hour, single).getName()).isEqualTo("Always");
        }
    }

    @Test
    void rejectsDuplicateStartHours() {
        List<Period> clashing = List.of(period("Morning", 6), period("Dawn", 6));

        assertThatThrownBy(() -> resolver.resolve(7, clashing))
                .isInstanceOf(FlowConfigurationException.class)
                .hasMessageContaining("hour 6");
    }

    @Test
    void rejectsDuplicateNamesIgnoringCase() {
        List<Period> clashing = List.of(period("Morning", 6), period("morning", 9));

        assertThatThrownBy(() -> resolver.validateAndSort(clashing))
                .isInstanceOf(FlowConfigurationException.class);
    }

    @Test
    void rejectsEmptyPeriodList() {
        assertThatThrownBy(() -> resolver.resolve(7, List.of()))
                .isInstanceOf(FlowConfigurationException.class);
    }

    @ParameterizedTest
    @ValueSource(ints = {-1, 24})
    void rejectsStartHourOutsideDay(int hour) {
        assertThatThrownBy(() -> resolver.validateAndSort(List.of(period("Odd", hour))))
                .isInstanceOf(FlowConfigurationException.class);
    }

    @Test
    void rejectsHourOutsideDay() {
        assertThatThrownBy(() -> resolver.resolve(24, periods))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
