package org.javai.nl2sql.memory;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for per-session context memory.
 *
 * <pre>{@code
 * ContextMemoryConfig config = ContextMemoryConfig.builder()
 *         .maxEntries(20)
 *         .ttl(Duration.ofHours(1))
 *         .build();
 * }</pre>
 *
 * @param maxEntries maximum entries kept per session; the oldest are dropped first
 * @param ttl idle time after which a whole session's memory is evicted
 */
public record ContextMemoryConfig(
		int maxEntries,
		Duration ttl
) {

	public static final int DEFAULT_MAX_ENTRIES = 10;
	public static final Duration DEFAULT_TTL = Duration.ofMinutes(30);

	public ContextMemoryConfig {
		if (maxEntries < 1) {
			throw new IllegalArgumentException("maxEntries must be >= 1");
		}
		Objects.requireNonNull(ttl, "ttl must not be null");
		if (ttl.isNegative() || ttl.isZero()) {
			throw new IllegalArgumentException("ttl must be positive");
		}
	}

	public static ContextMemoryConfig defaults() {
		return new ContextMemoryConfig(DEFAULT_MAX_ENTRIES, DEFAULT_TTL);
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {
		private int maxEntries = DEFAULT_MAX_ENTRIES;
		private Duration ttl = DEFAULT_TTL;

		private Builder() {}

		public Builder maxEntries(int maxEntries) {
			this.maxEntries = maxEntries;
			return this;
		}

		public Builder ttl(Duration ttl) {
			this.ttl = ttl;
			return this;
		}

		public ContextMemoryConfig build() {
			return new ContextMemoryConfig(maxEntries, ttl);
		}
	}
}
