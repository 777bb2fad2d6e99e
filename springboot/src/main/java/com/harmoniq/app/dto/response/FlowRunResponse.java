package com.harmoniq.app.dto.response;

import com.harmoniq.app.entity.FlowRunStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FlowRunResponse {
    private Long id;
    private String playlistName;
    private String periodName;
    private String vibe;
    private FlowRunStatus status;
    private Integer trackCount;
    private Integer targetSize;
    private Integer vibeAnchorCount;
    private Integer familiarAnchorCount;
    private Integer bridgeCount;
    private Integer expansionCount;
    private String errorMessage;
    private Long generationTimeMs;
    private LocalDateTime createdAt;
}
