package org.javai.nl2sql.workflow;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.javai.nl2sql.catalog.CatalogRegistry;
import org.javai.nl2sql.catalog.CatalogSnapshot;
import org.javai.nl2sql.catalog.SchemaCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for callers: questions, clarification answers and session lifecycle.
 *
 * <p>Calls for the same session id are serialised; calls for different sessions run
 * concurrently. A session parked at AWAITING_USER is held here until it is answered,
 * cancelled, or superseded by a new question.</p>
 *
 * <p>Sessions left idle for longer than the context memory TTL are forgotten, unless a
 * run is parked on them. The sweep runs before each new question.</p>
 */
public class Nl2SqlService {

	private static final Logger logger = LoggerFactory.getLogger(Nl2SqlService.class);

	private final Orchestrator orchestrator;
	private final CatalogRegistry catalogRegistry;
	private final Clock clock;
	private final Duration idleTtl;
	private final Map<String, SessionSlot> sessions = new ConcurrentHashMap<>();

	public Nl2SqlService(Orchestrator orchestrator, CatalogRegistry catalogRegistry) {
		this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator must not be null");
		this.catalogRegistry = Objects.requireNonNull(catalogRegistry, "catalogRegistry must not be null");
		this.clock = orchestrator.clock();
		this.idleTtl = orchestrator.memory().config().ttl();
	}

	/**
	 * Per-session lock, turn counter and parked run. Guarded by its own monitor; the
	 * volatile fields are also read by the idle sweep without taking it.
	 */
	private static final class SessionSlot {
		private int turns;
		private volatile SessionState parked;
		private volatile Instant lastAccess;

		private SessionSlot(Instant now) {
			this.lastAccess = now;
		}

		private SessionSlot touch(Instant now) {
			lastAccess = now;
			return this;
		}

		private boolean idleSince(Instant cutoff) {
			return parked == null && lastAccess.isBefore(cutoff);
		}
	}

	public QueryResponse runQuery(String question, String sessionId) {
		requireSessionId(sessionId);
		if (question == null || question.isBlank()) {
			throw new IllegalArgumentException("question must not be blank");
		}
		evictIdleSessions();
		Instant now = clock.instant();
		SessionSlot slot = sessions.compute(sessionId,
				(id, existing) -> existing != null ? existing.touch(now) : new SessionSlot(now));
		synchronized (slot) {
			if (slot.parked != null) {
				logger.info("[{}#{}] abandoned while awaiting clarification", sessionId, slot.parked.turnIndex());
				slot.parked = null;
			}
			slot.turns++;
			SessionState state = orchestrator.start(sessionId, slot.turns, question.trim(), catalogRegistry.current());
			return settle(slot, state);
		}
	}

	/**
	 * Continues the parked run of a session with the user's answer. A numeric answer
	 * selects the corresponding option.
	 *
	 * @throws IllegalStateException if the session is not awaiting clarification
	 */
	public QueryResponse answerClarification(String sessionId, String answer) {
		requireSessionId(sessionId);
		Instant now = clock.instant();
		SessionSlot slot = sessions.computeIfPresent(sessionId, (id, existing) -> existing.touch(now));
		if (slot == null) {
			throw new IllegalStateException("Unknown session: " + sessionId);
		}
		synchronized (slot) {
			if (slot.parked == null) {
				throw new IllegalStateException("Session " + sessionId + " is not awaiting clarification");
			}
			SessionState parked = slot.parked;
			slot.parked = null;
			return settle(slot, orchestrator.resume(parked, answer, catalogRegistry.current()));
		}
	}

	public boolean isAwaitingClarification(String sessionId) {
		SessionSlot slot = sessions.get(sessionId);
		if (slot == null) {
			return false;
		}
		synchronized (slot) {
			return slot.parked != null;
		}
	}

	/**
	 * Discards a parked run. Memory of completed turns is kept.
	 *
	 * @return true if a parked run was discarded
	 */
	public boolean cancel(String sessionId) {
		SessionSlot slot = sessions.get(sessionId);
		if (slot == null) {
			return false;
		}
		synchronized (slot) {
			boolean wasParked = slot.parked != null;
			slot.parked = null;
			return wasParked;
		}
	}

	/**
	 * Forgets the session entirely, including its context memory.
	 */
	public void endSession(String sessionId) {
		SessionSlot slot = sessions.remove(sessionId);
		if (slot != null) {
			synchronized (slot) {
				slot.parked = null;
			}
		}
		orchestrator.memory().clear(sessionId);
		logger.debug("[{}] session ended", sessionId);
	}

	/**
	 * Forgets sessions with no parked run whose last question or answer is older than
	 * the context memory TTL, then sweeps expired context memory.
	 *
	 * @return the number of sessions forgotten
	 */
	public int evictIdleSessions() {
		Instant cutoff = clock.instant().minus(idleTtl);
		int evicted = 0;
		for (String sessionId : sessions.keySet()) {
			boolean[] removed = new boolean[1];
			sessions.computeIfPresent(sessionId, (id, slot) -> {
				removed[0] = slot.idleSince(cutoff);
				return removed[0] ? null : slot;
			});
			if (removed[0]) {
				logger.debug("[{}] idle session evicted", sessionId);
				evicted++;
			}
		}
		if (evicted > 0) {
			orchestrator.memory().evictExpired();
		}
		return evicted;
	}

	public int sessionCount() {
		return sessions.size();
	}

	/**
	 * Swaps in a new catalog. Runs already in progress finish on the snapshot they started with.
	 */
	public CatalogSnapshot reloadCatalog(SchemaCatalog catalog) {
		return catalogRegistry.reload(catalog);
	}

	public CatalogSnapshot catalog() {
		return catalogRegistry.current();
	}

	private QueryResponse settle(SessionSlot slot, SessionState state) {
		if (state.status().isSuspended()) {
			slot.parked = state;
		}
		slot.touch(clock.instant());
		return QueryResponse.from(state);
	}

	private static void requireSessionId(String sessionId) {
		if (sessionId == null || sessionId.isBlank()) {
			throw new IllegalArgumentException("sessionId must not be blank");
		}
	}
}
