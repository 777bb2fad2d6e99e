package com.harmoniq.app.dto.plex;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Track, playlist or history item. Which fields are present depends on the endpoint.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PlexMetadata {

    private String ratingKey;
    private String type;
    private String title;
    private String grandparentTitle;    // track artist
    private String originalTitle;       // track artist when it differs from the album artist
    private Double userRating;          // 0 - 10
    private Long lastViewedAt;          // epoch seconds
    private Integer viewCount;
    private Integer skipCount;

    // history items
    private Long viewedAt;              // epoch seconds

    // sonic neighbours
    private Double distance;

    // playlists
    private String playlistType;
    private Boolean smart;
    private String summary;

    @JsonProperty("Mood")
    private List<PlexTag> moods = new ArrayList<>();

    @JsonProperty("Style")
    private List<PlexTag> styles = new ArrayList<>();
}
