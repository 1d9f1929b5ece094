package com.campussecurity.dispatch.service;

import com.campussecurity.dispatch.dto.BeaconGraphSnapshot;
import com.campussecurity.dispatch.dto.ProximityEdge;
import com.campussecurity.dispatch.entity.BeaconProximity;
import com.campussecurity.dispatch.repository.BeaconProximityRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Read side of the beacon adjacency graph.
 *
 * The whole graph is loaded in one query and cached as a single {@link BeaconGraphSnapshot}.
 * Searches never read proximity rows directly, so an admin reorder is observed either entirely
 * or not at all.
 *
 * Cache lifecycle:
 * 1. First search after startup (or after an eviction) loads the snapshot from PostgreSQL
 * 2. Every later search reads it from the cache
 * 3. Proximity edits evict it once their transaction has committed
 * 4. A periodic eviction bounds staleness from edits made outside this service
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BeaconGraphService {

    public static final String GRAPH_CACHE = "beaconGraph";

    private final BeaconProximityRepository proximityRepository;

    @Cacheable(cacheNames = GRAPH_CACHE, key = "'all'")
    @Transactional(readOnly = true)
    public BeaconGraphSnapshot snapshot() {
        List<BeaconProximity> edges = proximityRepository.findAllByOrderByFromBeaconIdAscPriorityAscIdAsc();

        Map<Long, List<ProximityEdge>> adjacency = new LinkedHashMap<>();
        for (BeaconProximity edge : edges) {
            adjacency.computeIfAbsent(edge.getFromBeaconId(), id -> new ArrayList<>())
                .add(new ProximityEdge(edge.getToBeaconId(), edge.getPriority()));
        }
        adjacency.replaceAll((from, list) -> List.copyOf(list));

        log.info("Loaded beacon graph snapshot: {} beacons with outgoing edges, {} edges",
            adjacency.size(), edges.size());
        return new BeaconGraphSnapshot(adjacency);
    }

    @CacheEvict(cacheNames = GRAPH_CACHE, allEntries = true)
    public void evict() {
        log.debug("Beacon graph snapshot evicted");
    }

    @Scheduled(fixedRate = 30, initialDelay = 30, timeUnit = TimeUnit.MINUTES)
    @CacheEvict(cacheNames = GRAPH_CACHE, allEntries = true)
    public void scheduledEvict() {
        log.debug("Scheduled beacon graph snapshot eviction");
    }
}
