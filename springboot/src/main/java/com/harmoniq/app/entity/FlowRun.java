package com.harmoniq.app.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * Audit record of one flow cycle.
 */
@Entity
@Table(name = "flow_runs")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
@EqualsAndHashCode(of = "id")
public class FlowRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "playlist_name", nullable = false)
    private String playlistName;

    @Column(name = "period_name")
    private String periodName;

    @Column(name = "vibe_tags", columnDefinition = "TEXT")
    private String vibeTags;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private FlowRunStatus status;

    @Column(name = "track_count")
    @Builder.Default
    private Integer trackCount = 0;

    @Column(name = "target_size")
    private Integer targetSize;

    @Column(name = "vibe_anchor_count")
    @Builder.Default
    private Integer vibeAnchorCount = 0;

    @Column(name = "familiar_anchor_count")
    @Builder.Default
    private Integer familiarAnchorCount = 0;

    @Column(name = "bridge_count")
    @Builder.Default
    private Integer bridgeCount = 0;

    @Column(name = "expansion_count")
    @Builder.Default
    private Integer expansionCount = 0;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "generation_time_ms")
    private Long generationTimeMs;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
