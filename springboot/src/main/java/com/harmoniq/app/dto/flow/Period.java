package com.harmoniq.app.dto.flow;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Named time-of-day window. A period starts at {@code startHour} and lasts until the next
 * configured period starts. Moods and styles, when present, override the built-in vibe for the name.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Period {
    private String name;
    private int startHour;        // 0-23

    @Builder.Default
    private List<String> moods = new ArrayList<>();

    @Builder.Default
    private List<String> styles = new ArrayList<>();

    public boolean hasVibeOverride() {
        return !declaredTags(moods).isEmpty() || !declaredTags(styles).isEmpty();
    }

    /**
     * Non-blank entries of a configured tag list; YAML lets {@code - ~} through as a null entry.
     */
    public static List<String> declaredTags(List<String> tags) {
        if (tags == null) {
            return List.of();
        }
        return tags.stream()
                .filter(tag -> tag != null && !tag.isBlank())
                .collect(Collectors.toUnmodifiableList());
    }
}
