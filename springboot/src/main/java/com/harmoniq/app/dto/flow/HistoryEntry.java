package com.harmoniq.app.dto.flow;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

@Value
@Builder
public class HistoryEntry {
    Track track;
    LocalDateTime playedAt;
    Double rating; // rating at time of play, null when not recorded
}
