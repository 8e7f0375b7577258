package org.operaton.activslot.model.domain;

/**
 * How likely a plan closes the step gap, with a user-facing explanation.
 *
 * @param confidence value in [0, 0.95]
 * @param reasoning  explanation derived from step coverage
 */
public record PlanAssessment(double confidence, String reasoning) {
}
