package com.harmoniq.app.config;

import com.harmoniq.app.dto.flow.VibeProfile;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Built-in vibes for the usual period names, used when a configured period declares no moods or styles.
 */
@Configuration
public class PeriodVibeConfig {

    @Bean
    public Map<String, VibeProfile> defaultPeriodVibes() {
        Map<String, VibeProfile> vibes = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

        // EARLY MORNING: waking up slowly
        vibes.put("Early Morning", VibeProfile.builder()
                .moods(List.of("Calm", "Peaceful", "Gentle", "Warm"))
                .styles(List.of("Ambient", "Acoustic", "Folk"))
                .build());

        // MORNING: bright, getting going
        vibes.put("Morning", VibeProfile.builder()
                .moods(List.of("Cheerful", "Upbeat", "Sunny", "Optimistic"))
                .styles(List.of("Indie Pop", "Singer-Songwriter", "Soul"))
                .build());

        // AFTERNOON: focused, steady energy
        vibes.put("Afternoon", VibeProfile.builder()
                .moods(List.of("Confident", "Energetic", "Lively", "Playful"))
                .styles(List.of("Pop/Rock", "Funk", "Alternative Pop/Rock"))
                .build());

        // EVENING: winding down
        vibes.put("Evening", VibeProfile.builder()
                .moods(List.of("Relaxed", "Mellow", "Warm", "Reflective"))
                .styles(List.of("Jazz", "Neo-Soul", "Trip-Hop"))
                .build());

        // NIGHT: late, intimate
        vibes.put("Night", VibeProfile.builder()
                .moods(List.of("Atmospheric", "Dreamy", "Brooding", "Sensual"))
                .styles(List.of("Downtempo", "Ambient", "Dream Pop"))
                .build());

        // LATE NIGHT: barely awake
        vibes.put("Late Night", VibeProfile.builder()
                .moods(List.of("Hypnotic", "Ethereal", "Soothing"))
                .styles(List.of("Ambient", "Minimalism", "Chillout"))
                .build());

        return vibes;
    }
}
