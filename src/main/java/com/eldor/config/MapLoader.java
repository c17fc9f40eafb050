package com.eldor.config;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.*;
import java.util.*;
import java.util.stream.Stream;

/**
 * Loads all available adventure map definitions at startup.
 * <p>
 * Maps are loaded from two locations (in order):
 * <ol>
 *   <li>Classpath: {@code classpath:maps/*.json} – built-in maps shipped with the app</li>
 *   <li>External folder: {@code eldor.maps.external-dir}, {@code ./maps/} by default – custom maps</li>
 * </ol>
 * If a custom map has the same {@code id} as a built-in map, the custom one wins.
 * Files that cannot be parsed or describe an unusable map are logged and skipped.
 */
@Component
@Slf4j
public class MapLoader {

    private final ObjectMapper objectMapper;
    private final Path externalDir;

    /** All loaded maps keyed by their id. */
    @Getter
    private final Map<String, MapDefinition> maps = new LinkedHashMap<>();

    public MapLoader(ObjectMapper objectMapper,
                     @Value("${eldor.maps.external-dir:maps}") String externalDir) {
        this.objectMapper = objectMapper;
        this.externalDir = Paths.get(externalDir);
    }

    @PostConstruct
    public void loadMaps() {
        loadClasspathMaps();
        loadExternalMaps();

        if (maps.isEmpty()) {
            log.warn("No map definitions found! Movement queries need at least one map.");
        } else {
            log.info("Loaded {} map(s): {}", maps.size(),
                    maps.values().stream().map(MapDefinition::name).toList());
        }
    }

    /**
     * Returns an unmodifiable list of every loaded map definition.
     */
    public List<MapDefinition> getAvailableMaps() {
        return List.copyOf(maps.values());
    }

    /**
     * Get a specific map by its id.
     *
     * @throws IllegalArgumentException if the map id is unknown
     */
    public MapDefinition getMap(String mapId) {
        MapDefinition map = maps.get(mapId);
        if (map == null) {
            throw new IllegalArgumentException("Unknown map: " + mapId
                    + ". Available maps: " + maps.keySet());
        }
        return map;
    }

    // ── classpath maps ──────────────────────────────────────────────────

    private void loadClasspathMaps() {
        try {
            var resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources("classpath:maps/*.json");

            for (Resource resource : resources) {
                try (InputStream is = resource.getInputStream()) {
                    MapDefinition map = objectMapper.readValue(is, MapDefinition.class);
                    if (register(map, resource.getFilename())) {
                        log.info("Loaded built-in map '{}' ({}) from classpath", map.name(), map.id());
                    }
                } catch (IOException | JacksonException e) {
                    log.error("Failed to load classpath map: {}", resource.getFilename(), e);
                }
            }
        } catch (IOException e) {
            log.warn("Could not scan classpath for maps: {}", e.getMessage());
        }
    }

    // ── external maps ───────────────────────────────────────────────────

    private void loadExternalMaps() {
        if (!Files.isDirectory(externalDir)) {
            log.debug("No external maps directory found at '{}'", externalDir.toAbsolutePath());
            return;
        }

        try (Stream<Path> files = Files.list(externalDir)) {
            files.filter(p -> p.toString().endsWith(".json"))
                 .sorted()
                 .forEach(this::loadExternalMapFile);
        } catch (IOException e) {
            log.error("Error reading external maps directory {}", externalDir, e);
        }
    }

    private void loadExternalMapFile(Path path) {
        try {
            MapDefinition map = objectMapper.readValue(path.toFile(), MapDefinition.class);
            if (register(map, path.toString())) {
                log.info("Loaded custom map '{}' ({}) from {}", map.name(), map.id(), path);
            }
        } catch (JacksonException e) {
            log.error("Failed to load custom map: {}", path, e);
        }
    }

    private boolean register(MapDefinition map, String source) {
        if (map.id() == null || map.id().isBlank()) {
            log.error("Map in {} has no id, skipping", source);
            return false;
        }
        if (map.width() <= 0 || map.height() <= 0) {
            log.error("Map '{}' in {} has invalid size {}x{}, skipping",
                    map.id(), source, map.width(), map.height());
            return false;
        }
        maps.put(map.id(), map);
        return true;
    }
}
