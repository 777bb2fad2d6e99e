package com.harmoniq.app.service.flow;

import com.harmoniq.app.config.FlowProperties;
import com.harmoniq.app.dto.flow.Track;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * Post-match exclusion rules. Each rule is off when its threshold is at the disabled value.
 */
@Component
public class RefinementFilter {

    /**
     * Unrated tracks always pass.
     */
    public boolean passesRating(Track track, FlowProperties.Refinement refinement) {
        if (!refinement.isRatingFilterActive() || !track.isRated()) {
            return true;
        }
        return track.getRating() >= refinement.getMinRating();
    }

    /**
     * Never-played tracks always pass.
     */
    public boolean passesRecency(Track track, FlowProperties.Refinement refinement, LocalDateTime now) {
        return passesRecency(track.getLastPlayedAt(), refinement, now);
    }

    public boolean passesRecency(LocalDateTime lastPlayedAt, FlowProperties.Refinement refinement, LocalDateTime now) {
        if (!refinement.isRecencyFilterActive() || lastPlayedAt == null) {
            return true;
        }
        LocalDateTime cutoff = now.minusDays(refinement.getExcludePlayedDays());
        return lastPlayedAt.isBefore(cutoff);
    }

    public boolean passesSkips(Track track, FlowProperties.Refinement refinement) {
        if (!refinement.isSkipFilterActive()) {
            return true;
        }
        return track.getSkipCount() <= refinement.getMaxSkipCount();
    }
}
