package com.harmoniq.app.dto.flow;

/**
 * Why a track is in the flow.
 */
public enum TrackSource {
    VIBE_ANCHOR,
    FAMILIAR_ANCHOR,
    BRIDGE,
    SONIC_EXPANSION
}
