package com.harmoniq.app.service.flow;

import com.harmoniq.app.dto.flow.Period;
import com.harmoniq.app.exception.FlowConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Component
@Slf4j
public class PeriodResolver {

    public Period resolve(LocalDateTime now, List<Period> periods) {
        return resolve(now.getHour(), periods);
    }

    /**
     * The period with the greatest start hour not after {@code hour}. Before the first period of the
     * day, the last period of the day is still active.
     */
    public Period resolve(int hour, List<Period> periods) {
        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException("Hour must be between 0 and 23, got " + hour);
        }
        List<Period> sorted = validateAndSort(periods);

        Period active = sorted.get(sorted.size() - 1);
        for (Period period : sorted) {
            if (period.getStartHour() > hour) {
                break;
            }
            active = period;
        }
        log.debug("Hour {} resolves to period '{}' (starts at {})", hour, active.getName(), active.getStartHour());
        return active;
    }

    /**
     * Checks the period list and returns it ordered by start hour.
     *
     * @throws FlowConfigurationException on an empty list, a blank or duplicate name, an hour outside
     *                                    0-23, or two periods starting at the same hour
     */
    public List<Period> validateAndSort(List<Period> periods) {
        if (CollectionUtils.isEmpty(periods)) {
            throw new FlowConfigurationException("At least one period must be configured");
        }

        Map<Integer, String> byHour = new HashMap<>();
        Set<String> names = new HashSet<>();
        for (Period period : periods) {
            if (period == null || !StringUtils.hasText(period.getName())) {
                throw new FlowConfigurationException("Every period needs a name");
            }
            if (period.getStartHour() < 0 || period.getStartHour() > 23) {
                throw new FlowConfigurationException(String.format(
                        "Period '%s' has start hour %d, expected 0-23", period.getName(), period.getStartHour()));
            }
            if (!names.add(period.getName().trim().toLowerCase(Locale.ROOT))) {
                throw new FlowConfigurationException("Period name '" + period.getName() + "' is used twice");
            }
            String clash = byHour.putIfAbsent(period.getStartHour(), period.getName());
            if (clash != null) {
                throw new FlowConfigurationException(String.format(
                        "Periods '%s' and '%s' both start at hour %d", clash, period.getName(), period.getStartHour()));
            }
        }

        List<Period> sorted = new ArrayList<>(periods);
        sorted.sort(Comparator.comparingInt(Period::getStartHour));
        return sorted;
    }
}
