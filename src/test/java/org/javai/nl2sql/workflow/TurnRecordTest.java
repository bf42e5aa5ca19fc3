package org.javai.nl2sql.workflow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

import java.util.List;
import org.javai.nl2sql.workflow.TurnRecord.Timings;
import org.junit.jupiter.api.Test;

class TurnRecordTest {

	@Test
	void timingsAreSummedPerState() {
		Timings timings = Timings.of(List.of(
				new StepTiming(WorkflowState.START, 2),
				new StepTiming(WorkflowState.INTENT_PARSED, 900),
				new StepTiming(WorkflowState.CRITIQUING, 700),
				new StepTiming(WorkflowState.INTENT_PARSED, 0),
				new StepTiming(WorkflowState.CRITIQUING, 650)));

		assertThat(timings.perState()).containsExactly(
				entry(WorkflowState.START, 2L),
				entry(WorkflowState.INTENT_PARSED, 900L),
				entry(WorkflowState.CRITIQUING, 1350L));
		assertThat(timings.slowestState()).isEqualTo(WorkflowState.CRITIQUING);
		assertThat(timings.totalMillis()).isEqualTo(2252);
	}

	@Test
	void noStepsMeansNoSlowestState() {
		Timings timings = Timings.of(List.of());

		assertThat(timings.perState()).isEmpty();
		assertThat(timings.slowestState()).isNull();
		assertThat(timings.totalMillis()).isZero();
	}
}
