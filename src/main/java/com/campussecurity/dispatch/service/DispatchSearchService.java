package com.campussecurity.dispatch.service;

import com.campussecurity.dispatch.dto.BeaconGraphSnapshot;
import com.campussecurity.dispatch.dto.DispatchCandidate;
import com.campussecurity.dispatch.dto.ProximityEdge;
import com.campussecurity.dispatch.entity.GuardProfile;
import com.campussecurity.dispatch.repository.GuardAssignmentRepository;
import com.campussecurity.dispatch.repository.GuardProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Expanding-radius guard search over the beacon graph.
 *
 * Algorithm (breadth-first, origin at hop priority 0):
 * 1. Dequeue a beacon; skip it if already visited
 * 2. Append eligible guards standing at it, in guard id order, skipping excluded and
 *    already-committed guards
 * 3. Stop as soon as {@code maxGuards} candidates are collected
 * 4. Otherwise enqueue its outgoing edges in ascending priority, skipping visited beacons
 *
 * Each queued entry carries the route taken to reach it and the sum of the edge priorities
 * along that route, so a guard found two hops away reports both intermediate beacons.
 *
 * The graph comes from one cached snapshot per call; guard eligibility is read live.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DispatchSearchService {

    private final BeaconGraphService beaconGraphService;
    private final GuardProfileRepository guardRepository;
    private final GuardAssignmentRepository assignmentRepository;

    @Transactional(readOnly = true)
    public List<DispatchCandidate> findCandidateGuards(Long originBeaconId,
                                                       int maxGuards,
                                                       Collection<Long> excludeGuardIds) {
        if (originBeaconId == null || maxGuards <= 0) {
            return List.of();
        }

        BeaconGraphSnapshot graph = beaconGraphService.snapshot();
        Set<Long> skipped = new HashSet<>(assignmentRepository.findCommittedGuardIds());
        if (excludeGuardIds != null) {
            skipped.addAll(excludeGuardIds);
        }

        List<DispatchCandidate> candidates = new ArrayList<>();
        Set<Long> visited = new HashSet<>();
        Deque<Frontier> queue = new ArrayDeque<>();
        queue.add(new Frontier(originBeaconId, 0, List.of(originBeaconId)));

        while (!queue.isEmpty() && candidates.size() < maxGuards) {
            Frontier current = queue.poll();
            if (!visited.add(current.beaconId())) {
                continue;
            }

            for (GuardProfile guard : guardRepository.findEligibleAtBeacon(current.beaconId())) {
                if (!skipped.add(guard.getId())) {
                    continue;
                }
                candidates.add(new DispatchCandidate(
                    guard.getId(),
                    guard.getDisplayName(),
                    current.beaconId(),
                    current.hopPriority(),
                    current.route()
                ));
                if (candidates.size() >= maxGuards) {
                    break;
                }
            }

            if (candidates.size() < maxGuards) {
                graph.edgesFrom(current.beaconId()).stream()
                    .sorted(Comparator.comparingInt(ProximityEdge::priority))
                    .filter(edge -> !visited.contains(edge.toBeaconId()))
                    .forEach(edge -> queue.add(current.extend(edge)));
            }
        }

        log.debug("Guard search from beacon {}: {} candidate(s), {} beacon(s) visited",
            originBeaconId, candidates.size(), visited.size());
        return candidates;
    }

    private record Frontier(Long beaconId, int hopPriority, List<Long> route) {

        Frontier extend(ProximityEdge edge) {
            List<Long> next = new ArrayList<>(route.size() + 1);
            next.addAll(route);
            next.add(edge.toBeaconId());
            return new Frontier(edge.toBeaconId(), hopPriority + edge.priority(), List.copyOf(next));
        }
    }
}
