package org.javai.nl2sql.workflow;

/**
 * Bounds of the workflow loops.
 *
 * @param maxRegenerations critique and regenerate cycles allowed per question
 * @param maxClarificationRounds clarification questions allowed per question
 * @param memoryWindow number of memory entries given to the generation prompt
 * @param maxSteps safety cap on transitions per run segment
 * @param failOnClarificationExhausted if true, a question still ambiguous after the last
 *        round fails with MAX_CLARIFICATION_ROUNDS_EXCEEDED; otherwise it proceeds as is
 */
public record WorkflowConfig(
		int maxRegenerations,
		int maxClarificationRounds,
		int memoryWindow,
		int maxSteps,
		boolean failOnClarificationExhausted
) {

	public static final int DEFAULT_MAX_REGENERATIONS = 3;
	public static final int DEFAULT_MAX_CLARIFICATION_ROUNDS = 3;
	public static final int DEFAULT_MEMORY_WINDOW = 5;
	public static final int DEFAULT_MAX_STEPS = 100;

	public WorkflowConfig {
		if (maxRegenerations < 0) {
			throw new IllegalArgumentException("maxRegenerations must be >= 0");
		}
		if (maxClarificationRounds < 0) {
			throw new IllegalArgumentException("maxClarificationRounds must be >= 0");
		}
		if (memoryWindow < 0) {
			throw new IllegalArgumentException("memoryWindow must be >= 0");
		}
		if (maxSteps < 1) {
			throw new IllegalArgumentException("maxSteps must be >= 1");
		}
	}

	public static WorkflowConfig defaults() {
		return new WorkflowConfig(DEFAULT_MAX_REGENERATIONS, DEFAULT_MAX_CLARIFICATION_ROUNDS,
				DEFAULT_MEMORY_WINDOW, DEFAULT_MAX_STEPS, false);
	}

	public static Builder builder() {
		return new Builder();
	}

	public static final class Builder {
		private int maxRegenerations = DEFAULT_MAX_REGENERATIONS;
		private int maxClarificationRounds = DEFAULT_MAX_CLARIFICATION_ROUNDS;
		private int memoryWindow = DEFAULT_MEMORY_WINDOW;
		private int maxSteps = DEFAULT_MAX_STEPS;
		private boolean failOnClarificationExhausted;

		private Builder() {
		}

		public Builder maxRegenerations(int maxRegenerations) {
			this.maxRegenerations = maxRegenerations;
			return this;
		}

		public Builder maxClarificationRounds(int maxClarificationRounds) {
			this.maxClarificationRounds = maxClarificationRounds;
			return this;
		}

		public Builder memoryWindow(int memoryWindow) {
			this.memoryWindow = memoryWindow;
			return this;
		}

		public Builder maxSteps(int maxSteps) {
			this.maxSteps = maxSteps;
			return this;
		}

		public Builder failOnClarificationExhausted(boolean fail) {
			this.failOnClarificationExhausted = fail;
			return this;
		}

		public WorkflowConfig build() {
			return new WorkflowConfig(maxRegenerations, maxClarificationRounds, memoryWindow, maxSteps,
					failOnClarificationExhausted);
		}
	}
}
