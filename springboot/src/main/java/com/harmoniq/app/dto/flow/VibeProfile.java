package com.harmoniq.app.dto.flow;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class VibeProfile {

    public static final VibeProfile EMPTY = new VibeProfile(List.of(), List.of());

    @Builder.Default
    List<String> moods = List.of();   // strongest first

    @Builder.Default
    List<String> styles = List.of();
}
