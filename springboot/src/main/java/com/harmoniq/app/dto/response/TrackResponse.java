package com.harmoniq.app.dto.response;

import com.harmoniq.app.dto.flow.TrackSource;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrackResponse {
    private String id;
    private String artist;
    private String title;
    private Integer position;
    private TrackSource source;
    private Double rating;
    private Set<String> moods;
    private Set<String> styles;
}
