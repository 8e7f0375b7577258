package org.operaton.activslot.model.domain;

/**
 * Outcome of scoring a meeting for walk suitability.
 *
 * @param walkable  whether the meeting qualifies under the predicate that produced this result
 * @param score     additive score clamped to [0, 1]
 * @param reason    short user-facing explanation
 * @param oneOnOne  two attendees or fewer
 */
public record WalkabilityResult(boolean walkable, double score, String reason, boolean oneOnOne) {
}
