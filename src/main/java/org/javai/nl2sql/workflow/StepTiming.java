package org.javai.nl2sql.workflow;

import java.util.Objects;

/**
 * Wall-clock time spent performing the step of one state.
 *
 * @param state the state whose step ran
 * @param elapsedMillis time the step took
 */
public record StepTiming(WorkflowState state, long elapsedMillis) {

	public StepTiming {
		Objects.requireNonNull(state, "state must not be null");
		if (elapsedMillis < 0) {
			throw new IllegalArgumentException("elapsedMillis must not be negative");
		}
	}
}
