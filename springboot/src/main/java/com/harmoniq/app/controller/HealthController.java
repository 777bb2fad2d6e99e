package com.harmoniq.app.controller;

import com.harmoniq.app.config.FlowProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final FlowProperties flowProperties;

    @Value("${spring.application.name}")
    private String appName;

    @GetMapping
    public ResponseEntity<Map<String, Object>> healthCheck() {
        List<String> periods = flowProperties.getPeriods().stream()
                .map(p -> p.getName() + "@" + p.getStartHour())
                .collect(Collectors.toList());
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("application", appName);
        health.put("timestamp", LocalDateTime.now());
        health.put("playlist", flowProperties.getPlaylistName());
        health.put("periods", periods);

        return ResponseEntity.ok(health);
    }
}
