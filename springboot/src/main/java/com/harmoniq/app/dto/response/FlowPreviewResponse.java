package com.harmoniq.app.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FlowPreviewResponse {
    private LocalDateTime generatedFor;
    private String periodName;
    private Set<String> vibeMoods;
    private Set<String> vibeStyles;
    private String description;
    private Integer targetSize;
    private Integer trackCount;
    private List<TrackResponse> tracks;
}
