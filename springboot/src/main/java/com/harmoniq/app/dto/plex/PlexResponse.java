package com.harmoniq.app.dto.plex;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Envelope of every Plex JSON response.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PlexResponse {

    @JsonProperty("MediaContainer")
    private PlexMediaContainer mediaContainer;
}
