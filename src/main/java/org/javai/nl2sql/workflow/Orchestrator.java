package org.javai.nl2sql.workflow;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import org.apache.commons.lang3.StringUtils;
import org.javai.nl2sql.catalog.CatalogSnapshot;
import org.javai.nl2sql.clarify.AmbiguityContext;
import org.javai.nl2sql.clarify.AmbiguityDetector;
import org.javai.nl2sql.clarify.AmbiguityFinding;
import org.javai.nl2sql.clarify.Clarifier;
import org.javai.nl2sql.execute.QueryExecutionException;
import org.javai.nl2sql.execute.QueryExecutor;
import org.javai.nl2sql.intent.IntentParser;
import org.javai.nl2sql.intent.ParsedQuestion;
import org.javai.nl2sql.join.JoinPath;
import org.javai.nl2sql.llm.CompletionException;
import org.javai.nl2sql.llm.CompletionTimeoutException;
import org.javai.nl2sql.llm.ModelReply;
import org.javai.nl2sql.llm.TextCompletionClient;
import org.javai.nl2sql.memory.ContextMemory;
import org.javai.nl2sql.memory.MemoryEntry;
import org.javai.nl2sql.sandbox.SqlSandbox;
import org.javai.nl2sql.validate.SqlValidator;
import org.javai.nl2sql.workflow.WorkflowEvent.Advance;
import org.javai.nl2sql.workflow.WorkflowEvent.AmbiguityChecked;
import org.javai.nl2sql.workflow.WorkflowEvent.Answered;
import org.javai.nl2sql.workflow.WorkflowEvent.ChatReplied;
import org.javai.nl2sql.workflow.WorkflowEvent.ClarificationAnswered;
import org.javai.nl2sql.workflow.WorkflowEvent.ClarificationPrepared;
import org.javai.nl2sql.workflow.WorkflowEvent.Executed;
import org.javai.nl2sql.workflow.WorkflowEvent.IntentParsed;
import org.javai.nl2sql.workflow.WorkflowEvent.Regenerated;
import org.javai.nl2sql.workflow.WorkflowEvent.SandboxChecked;
import org.javai.nl2sql.workflow.WorkflowEvent.SqlGenerated;
import org.javai.nl2sql.workflow.WorkflowEvent.StepFailed;
import org.javai.nl2sql.workflow.WorkflowEvent.Validated;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one question through the workflow.
 *
 * <p>For the current state the orchestrator performs that state's step (a model
 * call, a check, a query), turns the outcome into a {@link WorkflowEvent} and lets
 * {@link Transitions} compute the next state. It stops at DONE or FAILED, archiving
 * the turn to the turn log and context memory, or at AWAITING_USER, returning the
 * parked state to the caller.</p>
 *
 * <p>Steps catch the failures of their collaborators; nothing but programming errors
 * leaves {@link #start} or {@link #resume}.</p>
 */
public class Orchestrator {

	private static final Logger logger = LoggerFactory.getLogger(Orchestrator.class);

	private final IntentParser intentParser;
	private final AmbiguityDetector ambiguityDetector;
	private final Clarifier clarifier;
	private final SqlGenerator generator;
	private final SqlCritic critic;
	private final SqlValidator validator;
	private final SqlSandbox sandbox;
	private final QueryExecutor executor;
	private final AnswerBuilder answerBuilder;
	private final ContextMemory memory;
	private final TurnLog turnLog;
	private final WorkflowConfig config;
	private final Clock clock;

	private Orchestrator(Builder builder) {
		TextCompletionClient client = builder.completionClient;
		this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
		this.intentParser = builder.intentParser != null ? builder.intentParser : new IntentParser(clock);
		this.ambiguityDetector = builder.ambiguityDetector != null ? builder.ambiguityDetector : new AmbiguityDetector();
		this.clarifier = new Clarifier(client);
		this.generator = new SqlGenerator(client);
		this.critic = new SqlCritic(client);
		this.answerBuilder = new AnswerBuilder(client);
		this.validator = builder.validator != null ? builder.validator : new SqlValidator();
		this.sandbox = builder.sandbox != null ? builder.sandbox : new SqlSandbox();
		this.executor = builder.executor;
		this.memory = builder.memory != null ? builder.memory : new ContextMemory();
		this.turnLog = builder.turnLog != null ? builder.turnLog : new Slf4jTurnLog();
		this.config = builder.config != null ? builder.config : WorkflowConfig.defaults();
	}

	public static Builder builder() {
		return new Builder();
	}

	public ContextMemory memory() {
		return memory;
	}

	public WorkflowConfig config() {
		return config;
	}

	public Clock clock() {
		return clock;
	}

	/**
	 * Runs a new question until it finishes or needs clarification.
	 */
	public SessionState start(String sessionId, int turnIndex, String question, CatalogSnapshot snapshot) {
		Objects.requireNonNull(snapshot, "snapshot must not be null");
		SessionState state = SessionState.start(sessionId, turnIndex, question);
		logger.debug("[{}#{}] question: {}", sessionId, turnIndex, question);
		return run(state, snapshot);
	}

	/**
	 * Merges the user's answer into a parked run and continues it.
	 *
	 * @throws IllegalStateException if {@code parked} is not awaiting an answer
	 */
	public SessionState resume(SessionState parked, String answer, CatalogSnapshot snapshot) {
		Objects.requireNonNull(parked, "parked must not be null");
		Objects.requireNonNull(snapshot, "snapshot must not be null");
		if (!parked.needsClarification()) {
			throw new IllegalStateException("Session " + parked.sessionId() + " is not awaiting clarification");
		}
		List<String> options = parked.pendingClarification().options();
		String merged = Clarifier.merge(parked.workingQuestion(), answer, options);
		memory.append(parked.sessionId(), MemoryEntry.clarification(parked.turnIndex(),
				"Q: " + parked.pendingClarification().question() + " A: " + Clarifier.resolveAnswer(answer, options),
				clock.instant()));
		ParsedQuestion parsed = intentParser.parse(merged, snapshot.catalog());
		JoinPath joinPath = snapshot.joinSynthesizer().synthesize(parsed.matchedTables());
		SessionState state = apply(parked, new ClarificationAnswered(merged, parsed, joinPath));
		return run(state, snapshot);
	}

	private SessionState run(SessionState initial, CatalogSnapshot snapshot) {
		SessionState state = initial;
		int steps = 0;
		while (!state.isTerminal() && !state.status().isSuspended()) {
			if (++steps > config.maxSteps()) {
				throw new IllegalStateException("Workflow exceeded " + config.maxSteps() + " steps in state " + state.status());
			}
			long started = System.nanoTime();
			WorkflowEvent event = step(state, snapshot);
			long elapsedMillis = (System.nanoTime() - started) / 1_000_000;
			state = apply(state.withStepTiming(new StepTiming(state.status(), elapsedMillis)), event);
		}
		if (state.isTerminal()) {
			archive(state);
		}
		return state;
	}

	private SessionState apply(SessionState state, WorkflowEvent event) {
		SessionState next = Transitions.apply(state, event, config);
		logger.debug("[{}#{}] {} --{}--> {}", state.sessionId(), state.turnIndex(), state.status(),
				event.getClass().getSimpleName(), next.status());
		return next;
	}

	private WorkflowEvent step(SessionState state, CatalogSnapshot snapshot) {
		switch (state.status()) {
			case START:
				return parseIntent(state, snapshot);
			case INTENT_PARSED:
				return generate(state, snapshot);
			case GENERATED:
				return checkAmbiguity(state);
			case CLARIFY_NEEDED:
				return prepareClarification(state);
			case VALIDATING:
				return new Validated(validator.validate(state.candidateSql()));
			case VALID:
			case INVALID:
				return new Advance();
			case CRITIQUING:
				return critiqueAndRegenerate(state, snapshot);
			case SANDBOX_CHECK:
				return new SandboxChecked(sandbox.check(state.candidateSql(), snapshot.catalog()));
			case EXECUTING:
				return execute(state);
			case ANSWERING:
				return answer(state);
			default:
				throw new IllegalStateException("No step for state " + state.status());
		}
	}

	private WorkflowEvent parseIntent(SessionState state, CatalogSnapshot snapshot) {
		ParsedQuestion parsed = intentParser.parse(state.workingQuestion(), snapshot.catalog());
		if (parsed.intent().defaulted()) {
			logger.debug("[{}#{}] {}", state.sessionId(), state.turnIndex(), ErrorCode.INTENT_PARSE_DEFAULT);
		}
		return new IntentParsed(parsed, snapshot.joinSynthesizer().synthesize(parsed.matchedTables()));
	}

	private WorkflowEvent generate(SessionState state, CatalogSnapshot snapshot) {
		if (state.joinPath() != null && !state.joinPath().isFound()) {
			return new StepFailed(ErrorCode.JOIN_PATH_NOT_FOUND,
					"No foreign-key path connects these tables: " + String.join(", ", state.joinPath().unreachable()));
		}
		try {
			ModelReply reply = generator.generate(state, snapshot.catalog(),
					memory.recent(state.sessionId(), config.memoryWindow()));
			return reply.isSql() ? new SqlGenerated(reply.text()) : new ChatReplied(reply.text());
		}
		catch (CompletionException e) {
			return collaboratorFailure(state, "generation", e);
		}
	}

	private WorkflowEvent checkAmbiguity(SessionState state) {
		// a repaired candidate answers the same question; it is not checked again
		if (state.regenerationCount() > 0) {
			return new AmbiguityChecked(null);
		}
		AmbiguityContext context = new AmbiguityContext(state.workingQuestion(), state.intent(),
				memory.recent(state.sessionId(), config.memoryWindow()));
		AmbiguityFinding finding = ambiguityDetector.detect(context).orElse(null);
		if (finding != null && state.clarificationRoundCount() >= config.maxClarificationRounds()) {
			logger.warn("[{}#{}] still ambiguous after {} clarification rounds: {}", state.sessionId(),
					state.turnIndex(), state.clarificationRoundCount(), finding.describe());
		}
		return new AmbiguityChecked(finding);
	}

	private WorkflowEvent prepareClarification(SessionState state) {
		try {
			return new ClarificationPrepared(clarifier.prepare(state.workingQuestion(), state.pendingFinding(),
					memory.recent(state.sessionId(), config.memoryWindow())));
		}
		catch (CompletionException e) {
			return collaboratorFailure(state, "clarification", e);
		}
	}

	private WorkflowEvent critiqueAndRegenerate(SessionState state, CatalogSnapshot snapshot) {
		String critique = critic.critique(state.workingQuestion(), state.candidateSql(),
				SqlGenerator.problem(state), snapshot.catalog());
		try {
			return new Regenerated(generator.regenerate(state, critique, snapshot.catalog()), critique);
		}
		catch (CompletionException e) {
			return collaboratorFailure(state, "regeneration", e);
		}
	}

	private WorkflowEvent execute(SessionState state) {
		try {
			return new Executed(executor.execute(state.sandboxDecision()));
		}
		catch (QueryExecutionException e) {
			logger.warn("[{}#{}] execution failed: {}", state.sessionId(), state.turnIndex(), e.getMessage(), e);
			return new StepFailed(ErrorCode.EXECUTION_ERROR, ErrorCode.EXECUTION_ERROR.message(), e.getMessage());
		}
	}

	private WorkflowEvent answer(SessionState state) {
		if (state.chatReply()) {
			return new Answered(state.finalAnswer() != null ? state.finalAnswer() : "");
		}
		return new Answered(answerBuilder.build(state.workingQuestion(), state.sandboxDecision().normalizedSql(),
				state.executionResult()));
	}

	private StepFailed collaboratorFailure(SessionState state, String step, CompletionException e) {
		logger.warn("[{}#{}] {} failed", state.sessionId(), state.turnIndex(), step, e);
		ErrorCode code = e instanceof CompletionTimeoutException
				? ErrorCode.COLLABORATOR_TIMEOUT
				: ErrorCode.COLLABORATOR_ERROR;
		return new StepFailed(code, code.message());
	}

	private void archive(SessionState state) {
		memory.append(state.sessionId(), MemoryEntry.query(state.turnIndex(), state.rawQuestion(), clock.instant()));
		if (state.status() == WorkflowState.DONE && state.chatReply()) {
			memory.append(state.sessionId(), MemoryEntry.chat(state.turnIndex(), state.finalAnswer(), clock.instant()));
		}
		else if (state.status() == WorkflowState.DONE) {
			memory.append(state.sessionId(), MemoryEntry.answer(state.turnIndex(), state.finalAnswer(),
					state.sandboxDecision().normalizedSql(), state.executionResult().rowCount(), clock.instant()));
		}
		else {
			memory.append(state.sessionId(), MemoryEntry.answer(state.turnIndex(), state.failure().message(),
					null, null, clock.instant()));
		}
		turnLog.record(TurnRecord.of(state, clock.instant()));
		logger.info("[{}#{}] finished {} in {} ms (regenerations={}, clarifications={}{})", state.sessionId(),
				state.turnIndex(), state.status(), state.elapsedMillis(), state.regenerationCount(),
				state.clarificationRoundCount(), state.failure() != null ? ", reason=" + state.failure().code() : "");
		if (logger.isDebugEnabled() && state.candidateSql() != null) {
			logger.debug("[{}#{}] last SQL: {}", state.sessionId(), state.turnIndex(),
					StringUtils.abbreviate(state.candidateSql(), 200));
		}
	}

	public static final class Builder {
		private TextCompletionClient completionClient;
		private QueryExecutor executor;
		private IntentParser intentParser;
		private AmbiguityDetector ambiguityDetector;
		private SqlValidator validator;
		private SqlSandbox sandbox;
		private ContextMemory memory;
		private TurnLog turnLog;
		private WorkflowConfig config;
		private Clock clock;

		private Builder() {
		}

		public Builder completionClient(TextCompletionClient completionClient) {
			this.completionClient = completionClient;
			return this;
		}

		public Builder executor(QueryExecutor executor) {
			this.executor = executor;
			return this;
		}

		public Builder intentParser(IntentParser intentParser) {
			this.intentParser = intentParser;
			return this;
		}

		public Builder ambiguityDetector(AmbiguityDetector ambiguityDetector) {
			this.ambiguityDetector = ambiguityDetector;
			return this;
		}

		public Builder validator(SqlValidator validator) {
			this.validator = validator;
			return this;
		}

		public Builder sandbox(SqlSandbox sandbox) {
			this.sandbox = sandbox;
			return this;
		}

		public Builder memory(ContextMemory memory) {
			this.memory = memory;
			return this;
		}

		public Builder turnLog(TurnLog turnLog) {
			this.turnLog = turnLog;
			return this;
		}

		public Builder config(WorkflowConfig config) {
			this.config = config;
			return this;
		}

		public Builder clock(Clock clock) {
			this.clock = clock;
			return this;
		}

		public Orchestrator build() {
			Objects.requireNonNull(completionClient, "completionClient must not be null");
			Objects.requireNonNull(executor, "executor must not be null");
			return new Orchestrator(this);
		}
	}
}
