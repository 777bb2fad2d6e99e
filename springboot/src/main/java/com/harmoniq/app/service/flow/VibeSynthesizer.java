package com.harmoniq.app.service.flow;

import com.harmoniq.app.dto.flow.Period;
import com.harmoniq.app.dto.flow.VibeCriteria;
import com.harmoniq.app.dto.flow.VibeProfile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
@Slf4j
public class VibeSynthesizer {

    private final Map<String, VibeProfile> defaultPeriodVibes;

    /**
     * Period base vibe (its own tags, else the built-in profile for its name) unioned with the learned tags.
     */
    public VibeCriteria synthesize(Period period, VibeProfile learned) {
        VibeProfile base = baseVibe(period);
        VibeProfile augmentation = learned != null ? learned : VibeProfile.EMPTY;

        VibeCriteria criteria = VibeCriteria.union(
                List.of(base.getMoods(), augmentation.getMoods()),
                List.of(base.getStyles(), augmentation.getStyles()));

        log.info("Vibe for period '{}': {}", period.getName(), criteria.describe());
        return criteria;
    }

    public VibeProfile baseVibe(Period period) {
        if (period.hasVibeOverride()) {
            return VibeProfile.builder()
                    .moods(Period.declaredTags(period.getMoods()))
                    .styles(Period.declaredTags(period.getStyles()))
                    .build();
        }
        VibeProfile builtIn = lookupDefault(period.getName());
        if (builtIn == null) {
            log.warn("Period '{}' declares no moods or styles and has no built-in vibe", period.getName());
            return VibeProfile.EMPTY;
        }
        return builtIn;
    }

    private VibeProfile lookupDefault(String name) {
        VibeProfile profile = defaultPeriodVibes.get(name);
        if (profile != null) {
            return profile;
        }
        return defaultPeriodVibes.entrySet().stream()
                .filter(e -> e.getKey().equalsIgnoreCase(name.trim()))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(null);
    }
}
