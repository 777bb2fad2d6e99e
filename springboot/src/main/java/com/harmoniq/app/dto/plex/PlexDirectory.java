package com.harmoniq.app.dto.plex;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A library section as listed by {@code /library/sections}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PlexDirectory {
    private String key;
    private String type;    // "artist" for music sections
    private String title;
}
