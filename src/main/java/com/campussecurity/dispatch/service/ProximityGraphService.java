package com.campussecurity.dispatch.service;

import com.campussecurity.dispatch.dto.ProximityMove;
import com.campussecurity.dispatch.entity.Beacon;
import com.campussecurity.dispatch.entity.BeaconProximity;
import com.campussecurity.dispatch.exception.InvalidProximityException;
import com.campussecurity.dispatch.exception.ProximityNotFoundException;
import com.campussecurity.dispatch.exception.UnknownOrInactiveBeaconException;
import com.campussecurity.dispatch.repository.BeaconProximityRepository;
import com.campussecurity.dispatch.repository.BeaconRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Admin edits of the beacon adjacency graph.
 *
 * Sibling edges (same from-beacon) keep dense priorities 1..n through every edit:
 * - add: shift the insertion point and everything after it down, then insert
 * - change/move: shift the range between old and new position by one, then place the edge
 * - remove: delete, then close the gap
 * - reindex: renumber 1..n in current order, repairing any gap left by direct SQL edits
 *
 * Each edit locks the from-beacon row first, serializing edits of one beacon's edge list,
 * and evicts the cached graph snapshot. The cache manager is transaction-aware, so the
 * eviction lands when the edit commits and is dropped if it rolls back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProximityGraphService {

    private final BeaconRepository beaconRepository;
    private final BeaconProximityRepository proximityRepository;
    private final BeaconGraphService beaconGraphService;

    @Transactional(readOnly = true)
    public List<BeaconProximity> listProximities(Long fromBeaconId) {
        if (!beaconRepository.existsById(fromBeaconId)) {
            throw new UnknownOrInactiveBeaconException(String.valueOf(fromBeaconId));
        }
        return proximityRepository.findByFromBeaconIdOrderByPriorityAscIdAsc(fromBeaconId);
    }

    /**
     * @param priority requested position; null or out of range appends or clamps to 1..n+1
     */
    @Transactional
    public BeaconProximity addProximity(Long fromBeaconId, Long toBeaconId, Integer priority) {
        lockBeacon(fromBeaconId);
        if (fromBeaconId.equals(toBeaconId)) {
            throw new InvalidProximityException("A beacon cannot be its own neighbour: " + fromBeaconId);
        }
        if (!beaconRepository.existsById(toBeaconId)) {
            throw new UnknownOrInactiveBeaconException(String.valueOf(toBeaconId));
        }
        if (proximityRepository.findByFromBeaconIdAndToBeaconId(fromBeaconId, toBeaconId).isPresent()) {
            throw new InvalidProximityException(
                "Proximity " + fromBeaconId + " -> " + toBeaconId + " already exists");
        }

        int size = (int) proximityRepository.countByFromBeaconId(fromBeaconId);
        int position = priority == null ? size + 1 : clamp(priority, 1, size + 1);
        if (position <= size) {
            proximityRepository.shiftDownFrom(fromBeaconId, position);
        }

        BeaconProximity saved = proximityRepository.save(BeaconProximity.builder()
            .fromBeaconId(fromBeaconId)
            .toBeaconId(toBeaconId)
            .priority(position)
            .build());

        beaconGraphService.evict();
        log.info("Proximity added: {} -> {} at priority {}", fromBeaconId, toBeaconId, position);
        return saved;
    }

    @Transactional
    public BeaconProximity changePriority(Long fromBeaconId, Long proximityId, int newPriority) {
        lockBeacon(fromBeaconId);
        BeaconProximity edge = loadEdge(fromBeaconId, proximityId);

        int size = (int) proximityRepository.countByFromBeaconId(fromBeaconId);
        return reposition(edge, clamp(newPriority, 1, size));
    }

    @Transactional
    public BeaconProximity moveProximity(Long fromBeaconId, Long proximityId, ProximityMove direction) {
        lockBeacon(fromBeaconId);
        BeaconProximity edge = loadEdge(fromBeaconId, proximityId);

        int size = (int) proximityRepository.countByFromBeaconId(fromBeaconId);
        int target = switch (direction) {
            case UP -> Math.max(1, edge.getPriority() - 1);
            case DOWN -> Math.min(size, edge.getPriority() + 1);
        };
        return reposition(edge, target);
    }

    @Transactional
    public void removeProximity(Long fromBeaconId, Long proximityId) {
        lockBeacon(fromBeaconId);
        BeaconProximity edge = loadEdge(fromBeaconId, proximityId);
        int removedAt = edge.getPriority();

        proximityRepository.delete(edge);
        proximityRepository.shiftUpAfter(fromBeaconId, removedAt);

        beaconGraphService.evict();
        log.info("Proximity removed: {} -> {} (was priority {})", fromBeaconId, edge.getToBeaconId(), removedAt);
    }

    /**
     * Renumbers a beacon's edges 1..n, keeping their current relative order.
     */
    @Transactional
    public List<BeaconProximity> reindex(Long fromBeaconId) {
        lockBeacon(fromBeaconId);
        List<BeaconProximity> edges = proximityRepository.findByFromBeaconIdOrderByPriorityAscIdAsc(fromBeaconId);

        int changed = 0;
        for (int i = 0; i < edges.size(); i++) {
            BeaconProximity edge = edges.get(i);
            if (edge.getPriority() != i + 1) {
                edge.setPriority(i + 1);
                changed++;
            }
        }
        List<BeaconProximity> saved = proximityRepository.saveAll(edges);

        if (changed > 0) {
            beaconGraphService.evict();
            log.info("Reindexed {} of {} proximities for beacon {}", changed, edges.size(), fromBeaconId);
        }
        return saved;
    }

    private BeaconProximity reposition(BeaconProximity edge, int target) {
        int current = edge.getPriority();
        if (target == current) {
            return edge;
        }

        Long fromBeaconId = edge.getFromBeaconId();
        if (target < current) {
            proximityRepository.shiftRange(fromBeaconId, target, current - 1, 1);
        } else {
            proximityRepository.shiftRange(fromBeaconId, current + 1, target, -1);
        }
        edge.setPriority(target);
        BeaconProximity saved = proximityRepository.save(edge);

        beaconGraphService.evict();
        log.info("Proximity {} -> {} moved from priority {} to {}",
            fromBeaconId, edge.getToBeaconId(), current, target);
        return saved;
    }

    private Beacon lockBeacon(Long beaconId) {
        return beaconRepository.findByIdForUpdate(beaconId)
            .orElseThrow(() -> new UnknownOrInactiveBeaconException(String.valueOf(beaconId)));
    }

    private BeaconProximity loadEdge(Long fromBeaconId, Long proximityId) {
        return proximityRepository.findById(proximityId)
            .filter(edge -> edge.getFromBeaconId().equals(fromBeaconId))
            .orElseThrow(() -> new ProximityNotFoundException(fromBeaconId, proximityId));
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
