package com.entity.network.dedup;

/**
 * One surface spelling competing to become the canonical form of a group.
 *
 * @param surfaceName  the spelling
 * @param mentionCount mentions carried by the raw records using this spelling
 */
public record SurfaceCandidate(String surfaceName, long mentionCount) {
}
