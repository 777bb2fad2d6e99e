package com.harmoniq.app.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@ConfigurationProperties(prefix = "app.plex")
public class PlexProperties {

    @NotBlank
    private String url;

    @NotBlank
    private String token;

    @NotEmpty
    private List<String> libraryNames = new ArrayList<>(List.of("Music"));

    @Min(1)
    private int timeoutSeconds = 30;

    @Min(1)
    private int sonicNeighbourLimit = 50;
}
