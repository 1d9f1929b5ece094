package com.campussecurity.dispatch.dto;

/**
 * One-step reorder of a proximity edge among its siblings. UP moves towards priority 1.
 */
public enum ProximityMove {
    UP,
    DOWN
}
