package com.harmoniq.app.config;

import com.harmoniq.app.dto.flow.Period;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@ConfigurationProperties(prefix = "app.flow")
public class FlowProperties {

    /**
     * Skip counts at or above this value mean "no skip filter".
     */
    public static final int SKIP_FILTER_DISABLED = 999;

    @NotBlank
    private String playlistName = "Daily Flow";

    @Min(1)
    private int targetSize = 40;

    @NotBlank
    private String timezone = "UTC";

    private int runIntervalMinutes = 1440;

    private Long randomSeed;

    private List<Period> periods = new ArrayList<>();

    @Valid
    private Vibe vibe = new Vibe();

    @Valid
    private Refinement refinement = new Refinement();

    @Valid
    private Anchors anchors = new Anchors();

    @Valid
    private Sonic sonic = new Sonic();

    @Valid
    private Scheduler scheduler = new Scheduler();

    @Data
    public static class Vibe {
        @Min(1)
        private int lookbackDays = 30;
        @Min(0)
        private int topNMoods = 3;
        @Min(0)
        private int topMStyles = 2;
        @Min(1)
        private int minOccurrences = 2;
        private boolean countPerPlay = true;
    }

    @Data
    public static class Refinement {
        @DecimalMin("0.0")
        @DecimalMax("5.0")
        private double minRating = 0.0;     // 0 disables
        @Min(0)
        private int excludePlayedDays = 0;  // 0 disables
        @Min(0)
        private int maxSkipCount = SKIP_FILTER_DISABLED;

        public boolean isRatingFilterActive() {
            return minRating > 0;
        }

        public boolean isRecencyFilterActive() {
            return excludePlayedDays > 0;
        }

        public boolean isSkipFilterActive() {
            return maxSkipCount < SKIP_FILTER_DISABLED;
        }
    }

    @Data
    public static class Anchors {
        @Min(0)
        private int vibeAnchorCount = 10;
        @Min(0)
        private int targetHistoryCount = 10;
        @Min(0)
        private int historyMinPlays = 2;
        @DecimalMin("0.0")
        @DecimalMax("5.0")
        private double historyMinRating = 0.0;
        @Min(1)
        private int historyLookbackDays = 90;
    }

    @Data
    public static class Sonic {
        private boolean expansionEnabled = true;
        @Min(0)
        private int seedTracks = 5;
        @Min(0)
        private int similarTracksPerSeed = 5;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double maxDistance = 0.3;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double finalMixRatio = 0.5;
        private boolean adventureBridging = false;
        @Min(1)
        @Max(500)
        private int sortSimilarityLimit = 10;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double sortMaxDistance = 0.4;
    }

    @Data
    public static class Scheduler {
        private boolean enabled = true;
    }
}
