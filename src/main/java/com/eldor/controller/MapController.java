package com.eldor.controller;

import com.eldor.dto.HeroMoveRequest;
import com.eldor.dto.HeroMoveResult;
import com.eldor.dto.MapDetailsDTO;
import com.eldor.dto.MapInfoDTO;
import com.eldor.dto.PathDTO;
import com.eldor.dto.ReachabilityStats;
import com.eldor.dto.ReachableDTO;
import com.eldor.model.Position;
import com.eldor.service.MapService;
import com.eldor.service.MovementService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for adventure map inspection and hero movement queries.
 */
@RestController
@RequestMapping("/api/maps")
@RequiredArgsConstructor
@Slf4j
@CrossOrigin(origins = "*")
public class MapController {

    private final MapService mapService;
    private final MovementService movementService;

    /**
     * List available maps.
     */
    @GetMapping
    public ResponseEntity<List<MapInfoDTO>> getAvailableMaps() {
        List<MapInfoDTO> maps = mapService.getAvailableMaps().stream()
                .map(MapInfoDTO::fromDefinition)
                .toList();
        return ResponseEntity.ok(maps);
    }

    /**
     * Current state of a live map.
     */
    @GetMapping("/{mapId}")
    public ResponseEntity<MapDetailsDTO> getMap(@PathVariable String mapId) {
        return ResponseEntity.ok(movementService.getMapDetails(mapId));
    }

    /**
     * Cheapest path between two tiles.
     */
    @GetMapping("/{mapId}/path")
    public ResponseEntity<PathDTO> findPath(@PathVariable String mapId,
                                            @RequestParam int fromX, @RequestParam int fromY,
                                            @RequestParam int toX, @RequestParam int toY) {
        return ResponseEntity.ok(movementService.findPath(mapId,
                new Position(fromX, fromY), new Position(toX, toY)));
    }

    /**
     * Tiles reachable from a start tile with the given movement points.
     */
    @GetMapping("/{mapId}/reachable")
    public ResponseEntity<ReachableDTO> getReachable(@PathVariable String mapId,
                                                     @RequestParam int x, @RequestParam int y,
                                                     @RequestParam int movementPoints) {
        return ResponseEntity.ok(movementService.getReachablePositions(mapId,
                new Position(x, y), movementPoints));
    }

    /**
     * Whether a hero can reach a tile with its remaining movement points.
     */
    @PostMapping("/{mapId}/moves")
    public ResponseEntity<HeroMoveResult> checkMove(@PathVariable String mapId,
                                                    @Valid @RequestBody HeroMoveRequest request) {
        return ResponseEntity.ok(movementService.checkMove(mapId, request));
    }

    /**
     * Reachability statistics from the map's hero spawns.
     */
    @GetMapping("/{mapId}/reachability")
    public ResponseEntity<ReachabilityStats> getReachability(@PathVariable String mapId) {
        return ResponseEntity.ok(movementService.getReachabilityStats(mapId));
    }

    /**
     * Rebuild a live map from its definition.
     */
    @PostMapping("/{mapId}/reset")
    public ResponseEntity<MapDetailsDTO> resetMap(@PathVariable String mapId) {
        log.info("Resetting map {}", mapId);
        mapService.resetMap(mapId);
        return ResponseEntity.ok(movementService.getMapDetails(mapId));
    }
}
