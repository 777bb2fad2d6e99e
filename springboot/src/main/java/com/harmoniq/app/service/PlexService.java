package com.harmoniq.app.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.harmoniq.app.config.FlowProperties;
import com.harmoniq.app.config.PlexProperties;
import com.harmoniq.app.dto.flow.HistoryEntry;
import com.harmoniq.app.dto.flow.Track;
import com.harmoniq.app.dto.plex.PlexDirectory;
import com.harmoniq.app.dto.plex.PlexMediaContainer;
import com.harmoniq.app.dto.plex.PlexMetadata;
import com.harmoniq.app.dto.plex.PlexResponse;
import com.harmoniq.app.dto.plex.PlexTag;
import com.harmoniq.app.exception.LibraryAccessException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.*;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Plex Media Server backed library: tag queries, play history, sonic neighbours and playlist writes.
 */
@Service
@Slf4j
public class PlexService implements LibraryCatalog, PlaylistSync {

    private static final String TOKEN_HEADER = "X-Plex-Token";
    private static final int TRACK_TYPE = 10;
    private static final int METADATA_BATCH_SIZE = 100;
    private static final int MAX_RESPONSE_BYTES = 16 * 1024 * 1024;
    static final Duration NEIGHBOUR_CACHE_TTL = Duration.ofMinutes(10);
    static final long NEIGHBOUR_CACHE_SIZE = 10_000;

    private final WebClient.Builder webClientBuilder;
    private final PlexProperties plexProperties;
    private final FlowProperties flowProperties;
    private final Clock clock;

    private final Cache<String, Map<String, Double>> neighbourCache;

    public PlexService(WebClient.Builder webClientBuilder, PlexProperties plexProperties,
                       FlowProperties flowProperties, Clock clock) {
        this.webClientBuilder = webClientBuilder;
        this.plexProperties = plexProperties;
        this.flowProperties = flowProperties;
        this.clock = clock;
        this.neighbourCache = Caffeine.newBuilder()
                .maximumSize(NEIGHBOUR_CACHE_SIZE)
                .expireAfterWrite(NEIGHBOUR_CACHE_TTL)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .build();
    }

    // --- LibraryCatalog ---

    @Override
    public Set<Track> tracksByTag(Set<String> moods, Set<String> styles) {
        List<PlexDirectory> sections = musicSections();
        Map<String, Track> tracks = new LinkedHashMap<>();

        for (PlexDirectory section : sections) {
            if (!CollectionUtils.isEmpty(moods)) {
                collectTracks(section, "mood", moods, tracks);
            }
            if (!CollectionUtils.isEmpty(styles)) {
                collectTracks(section, "style", styles, tracks);
            }
        }
        log.info("Plex returned {} tracks for moods {} / styles {}", tracks.size(), moods, styles);
        return new LinkedHashSet<>(tracks.values());
    }

    private void collectTracks(PlexDirectory section, String field, Set<String> tags, Map<String, Track> into) {
        String value = String.join(",", tags);
        PlexMediaContainer container = exchange(HttpMethod.GET,
                "fetch tracks by " + field + " from section '" + section.getTitle() + "'",
                uriBuilder -> uriBuilder
                        .path("/library/sections/{key}/all")
                        .queryParam("type", TRACK_TYPE)
                        .queryParam(field, value)
                        .build(section.getKey()));
        for (PlexMetadata metadata : container.getMetadata()) {
            if (StringUtils.hasText(metadata.getRatingKey())) {
                into.putIfAbsent(metadata.getRatingKey(), toTrack(metadata));
            }
        }
    }

    @Override
    public List<HistoryEntry> trackHistory(int lookbackDays) {
        long since = clock.instant().minus(Duration.ofDays(lookbackDays)).getEpochSecond();
        PlexMediaContainer container = exchange(HttpMethod.GET, "fetch play history",
                uriBuilder -> uriBuilder
                        .path("/status/sessions/history/all")
                        .queryParam("sort", "viewedAt:desc")
                        .queryParam("viewedAt>", since)
                        .build());

        List<PlexMetadata> plays = container.getMetadata().stream()
                .filter(m -> "track".equals(m.getType()))
                .filter(m -> StringUtils.hasText(m.getRatingKey()) && m.getViewedAt() != null)
                .collect(Collectors.toList());
        if (plays.isEmpty()) {
            log.info("No track plays in Plex history for the last {} days", lookbackDays);
            return Collections.emptyList();
        }

        List<String> ids = plays.stream().map(PlexMetadata::getRatingKey).distinct().collect(Collectors.toList());
        Map<String, Track> tracks = fetchTracks(ids);

        List<HistoryEntry> history = new ArrayList<>();
        int missing = 0;
        for (PlexMetadata play : plays) {
            Track track = tracks.get(play.getRatingKey());
            if (track == null) {
                missing++;
                continue;
            }
            history.add(HistoryEntry.builder()
                    .track(track)
                    .playedAt(toLocalDateTime(play.getViewedAt()))
                    .build());
        }
        history.sort(Comparator.comparing(HistoryEntry::getPlayedAt).reversed());

        if (missing > 0) {
            log.warn("{} history entries refer to tracks no longer in the library", missing);
        }
        log.info("Loaded {} plays of {} distinct tracks from Plex history", history.size(), tracks.size());
        return history;
    }

    /**
     * Full metadata (tags, ratings, counts) for the given rating keys, fetched in batches.
     */
    private Map<String, Track> fetchTracks(List<String> ids) {
        Map<String, Track> tracks = new HashMap<>();
        for (int i = 0; i < ids.size(); i += METADATA_BATCH_SIZE) {
            List<String> batch = ids.subList(i, Math.min(i + METADATA_BATCH_SIZE, ids.size()));
            String joined = String.join(",", batch);
            PlexMediaContainer container = exchange(HttpMethod.GET, "fetch track metadata",
                    uriBuilder -> uriBuilder.path("/library/metadata/{ids}").build(joined));
            for (PlexMetadata metadata : container.getMetadata()) {
                if (StringUtils.hasText(metadata.getRatingKey())) {
                    tracks.put(metadata.getRatingKey(), toTrack(metadata));
                }
            }
            log.debug("Fetched metadata batch {}-{} of {}", i, i + batch.size(), ids.size());
        }
        return tracks;
    }

    /**
     * Distance from Plex's nearest-neighbour list of {@code a}. The list of {@code b} is only consulted
     * when it is already cached, so measuring one track against many candidates costs one request.
     */
    @Override
    public OptionalDouble distance(Track a, Track b) {
        Double fromA = neighbours(a.getId()).get(b.getId());
        if (fromA != null) {
            return OptionalDouble.of(fromA);
        }
        Map<String, Double> cachedForB = neighbourCache.getIfPresent(b.getId());
        Double fromB = cachedForB != null ? cachedForB.get(a.getId()) : null;
        return fromB != null ? OptionalDouble.of(fromB) : OptionalDouble.empty();
    }

    /**
     * Plex's sonically nearest tracks for one track, keyed by rating key. A failed lookup is cached as
     * "no neighbours" so one unreachable track does not cost a request per pair.
     */
    private Map<String, Double> neighbours(String trackId) {
        return neighbourCache.get(trackId, this::fetchNeighbours);
    }

    private Map<String, Double> fetchNeighbours(String trackId) {
        Map<String, Double> distances = new HashMap<>();
        try {
            PlexMediaContainer container = exchange(HttpMethod.GET, "fetch sonic neighbours of " + trackId,
                    uriBuilder -> uriBuilder
                            .path("/library/metadata/{id}/nearest")
                            .queryParam("limit", plexProperties.getSonicNeighbourLimit())
                            .build(trackId));
            for (PlexMetadata neighbour : container.getMetadata()) {
                if (StringUtils.hasText(neighbour.getRatingKey()) && neighbour.getDistance() != null) {
                    distances.put(neighbour.getRatingKey(), neighbour.getDistance());
                }
            }
        } catch (LibraryAccessException e) {
            log.warn("Sonic neighbours unavailable for track {}: {}", trackId, e.getMessage());
        }
        return Collections.unmodifiableMap(distances);
    }

    long cachedNeighbourLists() {
        neighbourCache.cleanUp();
        return neighbourCache.estimatedSize();
    }

    // --- PlaylistSync ---

    @Override
    public void upsertPlaylist(String name, List<String> orderedTrackIds, String description) {
        if (CollectionUtils.isEmpty(orderedTrackIds)) {
            log.info("No tracks for playlist '{}', leaving it untouched", name);
            return;
        }
        String itemsUri = itemsUri(orderedTrackIds);

        Optional<PlexMetadata> existing = findPlaylist(name);
        String playlistKey;
        if (existing.isPresent()) {
            playlistKey = existing.get().getRatingKey();
            log.info("Replacing items of Plex playlist '{}' ({})", name, playlistKey);
            exchange(HttpMethod.DELETE, "clear playlist '" + name + "'",
                    uriBuilder -> uriBuilder.path("/playlists/{key}/items").build(playlistKey));
            exchange(HttpMethod.PUT, "add items to playlist '" + name + "'",
                    uriBuilder -> uriBuilder
                            .path("/playlists/{key}/items")
                            .queryParam("uri", itemsUri)
                            .build(playlistKey));
        } else {
            log.info("Creating Plex playlist '{}'", name);
            PlexMediaContainer created = exchange(HttpMethod.POST, "create playlist '" + name + "'",
                    uriBuilder -> uriBuilder
                            .path("/playlists")
                            .queryParam("type", "audio")
                            .queryParam("title", name)
                            .queryParam("smart", 0)
                            .queryParam("uri", itemsUri)
                            .build());
            playlistKey = created.getMetadata().stream()
                    .map(PlexMetadata::getRatingKey)
                    .filter(StringUtils::hasText)
                    .findFirst()
                    .orElse(null);
        }

        if (playlistKey != null && StringUtils.hasText(description)) {
            exchange(HttpMethod.PUT, "update summary of playlist '" + name + "'",
                    uriBuilder -> uriBuilder
                            .path("/playlists/{key}")
                            .queryParam("summary", description)
                            .build(playlistKey));
        }
        log.info("Plex playlist '{}' now holds {} tracks", name, orderedTrackIds.size());
    }

    private Optional<PlexMetadata> findPlaylist(String name) {
        PlexMediaContainer container = exchange(HttpMethod.GET, "list playlists",
                uriBuilder -> uriBuilder.path("/playlists").queryParam("playlistType", "audio").build());
        return container.getMetadata().stream()
                .filter(p -> name.equals(p.getTitle()))
                .filter(p -> !Boolean.TRUE.equals(p.getSmart()))
                .findFirst();
    }

    private String itemsUri(List<String> trackIds) {
        PlexMediaContainer identity = exchange(HttpMethod.GET, "fetch server identity",
                uriBuilder -> uriBuilder.path("/identity").build());
        if (!StringUtils.hasText(identity.getMachineIdentifier())) {
            throw new LibraryAccessException("Plex server did not report a machine identifier");
        }
        return "server://" + identity.getMachineIdentifier()
                + "/com.plexapp.plugins.library/library/metadata/" + String.join(",", trackIds);
    }

    // --- helpers ---

    /**
     * Music sections whose title is listed in {@code app.plex.library-names}.
     */
    List<PlexDirectory> musicSections() {
        PlexMediaContainer container = exchange(HttpMethod.GET, "list library sections",
                uriBuilder -> uriBuilder.path("/library/sections").build());
        Set<String> wanted = plexProperties.getLibraryNames().stream()
                .map(n -> n.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());

        List<PlexDirectory> sections = container.getDirectories().stream()
                .filter(d -> "artist".equals(d.getType()))
                .filter(d -> d.getTitle() != null && wanted.contains(d.getTitle().trim().toLowerCase(Locale.ROOT)))
                .collect(Collectors.toList());
        if (sections.isEmpty()) {
            throw new LibraryAccessException("No Plex music library named " + plexProperties.getLibraryNames());
        }
        return sections;
    }

    private PlexMediaContainer exchange(HttpMethod method, String action, Function<UriBuilder, URI> uri) {
        try {
            PlexResponse response = client().method(method)
                    .uri(uri)
                    .retrieve()
                    .onStatus(status -> status.isError(),
                            clientResponse -> clientResponse.bodyToMono(String.class)
                                    .switchIfEmpty(Mono.just(""))
                                    .flatMap(body -> {
                                        log.error("Plex API error trying to {}: {} - Body: {}", action, clientResponse.statusCode(), body);
                                        return Mono.error(new LibraryAccessException(
                                                "Failed to " + action + ", status: " + clientResponse.statusCode()));
                                    }))
                    .bodyToMono(PlexResponse.class)
                    .block(Duration.ofSeconds(plexProperties.getTimeoutSeconds()));

            if (response == null || response.getMediaContainer() == null) {
                return new PlexMediaContainer();
            }
            return response.getMediaContainer();
        } catch (LibraryAccessException e) {
            throw e;
        } catch (Exception e) {
            log.error("Unexpected error trying to {}: {}", action, e.getMessage(), e);
            throw new LibraryAccessException("Failed to " + action + ": " + e.getMessage(), e);
        }
    }

    private WebClient client() {
        return webClientBuilder.clone()
                .baseUrl(plexProperties.getUrl())
                .defaultHeader(TOKEN_HEADER, plexProperties.getToken())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_RESPONSE_BYTES))
                .build();
    }

    Track toTrack(PlexMetadata metadata) {
        return Track.builder()
                .id(metadata.getRatingKey())
                .artist(StringUtils.hasText(metadata.getOriginalTitle()) ? metadata.getOriginalTitle() : metadata.getGrandparentTitle())
                .title(metadata.getTitle())
                .moods(tags(metadata.getMoods()))
                .styles(tags(metadata.getStyles()))
                .rating(metadata.getUserRating() != null ? metadata.getUserRating() / 2.0 : null)
                .lastPlayedAt(metadata.getLastViewedAt() != null ? toLocalDateTime(metadata.getLastViewedAt()) : null)
                .skipCount(metadata.getSkipCount() != null ? metadata.getSkipCount() : 0)
                .playCount(metadata.getViewCount() != null ? metadata.getViewCount() : 0)
                .build();
    }

    private static Set<String> tags(List<PlexTag> tags) {
        if (CollectionUtils.isEmpty(tags)) {
            return Set.of();
        }
        return tags.stream()
                .map(PlexTag::getTag)
                .filter(StringUtils::hasText)
                .collect(Collectors.collectingAndThen(Collectors.toCollection(LinkedHashSet::new), Collections::unmodifiableSet));
    }

    private LocalDateTime toLocalDateTime(long epochSeconds) {
        return LocalDateTime.ofInstant(Instant.ofEpochSecond(epochSeconds), ZoneId.of(flowProperties.getTimezone()));
    }
}
