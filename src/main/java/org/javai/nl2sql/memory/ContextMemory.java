package org.javai.nl2sql.memory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded, per-session conversation memory.
 *
 * <p>Each session holds at most {@link ContextMemoryConfig#maxEntries()} entries in
 * chronological order; appending beyond the bound drops the oldest entries. Sessions
 * idle for longer than the configured TTL are evicted. Distinct sessions never share
 * state and may be used concurrently; access to one session is serialised on its
 * buffer.</p>
 */
public class ContextMemory {

	private static final Logger logger = LoggerFactory.getLogger(ContextMemory.class);

	private final ContextMemoryConfig config;
	private final Clock clock;
	private final JsonMemorySerializer serializer;
	private final Map<String, SessionBuffer> buffers = new ConcurrentHashMap<>();

	public ContextMemory() {
		this(ContextMemoryConfig.defaults(), Clock.systemUTC());
	}

	public ContextMemory(ContextMemoryConfig config, Clock clock) {
		this.config = Objects.requireNonNull(config, "config must not be null");
		this.clock = Objects.requireNonNull(clock, "clock must not be null");
		this.serializer = new JsonMemorySerializer();
	}

	public ContextMemoryConfig config() {
		return config;
	}

	/**
	 * Appends an entry and trims the session to its bound.
	 */
	public void append(String sessionId, MemoryEntry entry) {
		requireSession(sessionId);
		Objects.requireNonNull(entry, "entry must not be null");
		evictExpired();
		SessionBuffer buffer = buffers.computeIfAbsent(sessionId, k -> new SessionBuffer(clock.instant()));
		synchronized (buffer) {
			buffer.entries.addLast(entry);
			buffer.touch(clock.instant());
			trimLocked(sessionId, buffer);
		}
	}

	/**
	 * Returns up to {@code n} most recent entries, oldest first.
	 */
	public List<MemoryEntry> recent(String sessionId, int n) {
		SessionBuffer buffer = liveBuffer(sessionId);
		if (buffer == null || n <= 0) {
			return List.of();
		}
		synchronized (buffer) {
			List<MemoryEntry> all = new ArrayList<>(buffer.entries);
			return List.copyOf(all.subList(Math.max(0, all.size() - n), all.size()));
		}
	}

	public List<MemoryEntry> entries(String sessionId) {
		return recent(sessionId, Integer.MAX_VALUE);
	}

	public int size(String sessionId) {
		SessionBuffer buffer = liveBuffer(sessionId);
		if (buffer == null) {
			return 0;
		}
		synchronized (buffer) {
			return buffer.entries.size();
		}
	}

	/**
	 * Enforces the size bound on a session. {@link #append} and {@link #importJson}
	 * trim implicitly.
	 */
	public void trim(String sessionId) {
		SessionBuffer buffer = buffers.get(sessionId);
		if (buffer == null) {
			return;
		}
		synchronized (buffer) {
			trimLocked(sessionId, buffer);
		}
	}

	public void clear(String sessionId) {
		if (sessionId == null || sessionId.isBlank()) {
			return;
		}
		if (buffers.remove(sessionId) != null) {
			logger.debug("Cleared context memory for session {}", sessionId);
		}
	}

	public String exportJson(String sessionId) {
		return serializer.toJson(sessionId, entries(sessionId));
	}

	/**
	 * Replaces the session's memory with the entries of an exported document. The
	 * document's own session id is ignored; entries beyond the bound are trimmed
	 * oldest first.
	 */
	public void importJson(String sessionId, String json) {
		requireSession(sessionId);
		List<MemoryEntry> imported = serializer.fromJson(json);
		SessionBuffer buffer = new SessionBuffer(clock.instant());
		synchronized (buffer) {
			buffer.entries.addAll(imported);
			buffer.touch(clock.instant());
			trimLocked(sessionId, buffer);
		}
		buffers.put(sessionId, buffer);
		logger.debug("Imported {} memory entries into session {}", imported.size(), sessionId);
	}

	/**
	 * Removes every session whose last access is older than the TTL.
	 *
	 * @return the number of sessions evicted
	 */
	public int evictExpired() {
		Instant cutoff = clock.instant().minus(config.ttl());
		int evicted = 0;
		for (Map.Entry<String, SessionBuffer> e : buffers.entrySet()) {
			if (e.getValue().lastAccess().isBefore(cutoff) && buffers.remove(e.getKey(), e.getValue())) {
				evicted++;
				logger.debug("Evicted idle context memory for session {}", e.getKey());
			}
		}
		return evicted;
	}

	private SessionBuffer liveBuffer(String sessionId) {
		if (sessionId == null) {
			return null;
		}
		SessionBuffer buffer = buffers.get(sessionId);
		if (buffer == null) {
			return null;
		}
		Instant now = clock.instant();
		if (buffer.lastAccess().isBefore(now.minus(config.ttl()))) {
			buffers.remove(sessionId, buffer);
			return null;
		}
		buffer.touch(now);
		return buffer;
	}

	private void trimLocked(String sessionId, SessionBuffer buffer) {
		int dropped = 0;
		while (buffer.entries.size() > config.maxEntries()) {
			buffer.entries.removeFirst();
			dropped++;
		}
		if (dropped > 0) {
			logger.debug("Trimmed {} oldest memory entries for session {}", dropped, sessionId);
		}
	}

	private static void requireSession(String sessionId) {
		if (sessionId == null || sessionId.isBlank()) {
			throw new IllegalArgumentException("sessionId must not be blank");
		}
	}

	private static final class SessionBuffer {
		private final Deque<MemoryEntry> entries = new ArrayDeque<>();
		private volatile Instant lastAccess;

		private SessionBuffer(Instant createdAt) {
			this.lastAccess = createdAt;
		}

		private void touch(Instant now) {
			lastAccess = now;
		}

		private Instant lastAccess() {
			return lastAccess;
		}
	}
}
