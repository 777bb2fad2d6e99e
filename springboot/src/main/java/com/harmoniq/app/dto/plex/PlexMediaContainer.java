package com.harmoniq.app.dto.plex;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PlexMediaContainer {

    private Integer size;

    private String machineIdentifier;

    @JsonProperty("Directory")
    private List<PlexDirectory> directories = new ArrayList<>();

    @JsonProperty("Metadata")
    private List<PlexMetadata> metadata = new ArrayList<>();
}
