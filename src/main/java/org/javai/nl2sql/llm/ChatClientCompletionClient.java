package org.javai.nl2sql.llm;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

/**
 * {@link TextCompletionClient} over Spring AI chat clients with retry and fallback.
 *
 * <p>Tiers are tried in order; each tier gets up to {@link CompletionTier#maxAttempts()}
 * calls before the next one is used. The whole completion, retries included, must
 * finish within the configured timeout. A call still running when the budget is spent
 * is cancelled with an interrupt and {@link CompletionTimeoutException} is thrown.</p>
 *
 * <pre>{@code
 * ChatClientCompletionClient client = new ChatClientCompletionClient(
 *         List.of(new CompletionTier(primary, 2, "deepseek-chat"),
 *                 new CompletionTier(fallback, 1, "qwen-plus")),
 *         Duration.ofSeconds(30));
 * }</pre>
 */
public class ChatClientCompletionClient implements TextCompletionClient, AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(ChatClientCompletionClient.class);
	private static final int DEFAULT_MAX_CONCURRENT_CALLS = 8;

	private final List<CompletionTier> tiers;
	private final Duration timeout;
	private final ThreadPoolExecutor executor;
	private volatile Consumer<CompletionAttempt> attemptListener = attempt -> {};

	public ChatClientCompletionClient(List<CompletionTier> tiers, Duration timeout) {
		this(tiers, timeout, DEFAULT_MAX_CONCURRENT_CALLS);
	}

	public ChatClientCompletionClient(List<CompletionTier> tiers, Duration timeout, int maxConcurrentCalls) {
		if (tiers == null || tiers.isEmpty()) {
			throw new IllegalArgumentException("at least one tier is required");
		}
		this.tiers = List.copyOf(tiers);
		this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
		AtomicInteger threadCount = new AtomicInteger();
		this.executor = new ThreadPoolExecutor(maxConcurrentCalls, maxConcurrentCalls, 60, TimeUnit.SECONDS,
				new LinkedBlockingQueue<>(), runnable -> {
					Thread thread = new Thread(runnable, "llm-call-" + threadCount.incrementAndGet());
					thread.setDaemon(true);
					return thread;
				});
		this.executor.allowCoreThreadTimeOut(true);
	}

	/**
	 * Registers a listener notified after every attempt, for metrics or tests.
	 */
	public ChatClientCompletionClient onAttempt(Consumer<CompletionAttempt> listener) {
		this.attemptListener = listener != null ? listener : attempt -> {};
		return this;
	}

	@Override
	public String complete(CompletionRequest request) {
		Objects.requireNonNull(request, "request must not be null");
		long deadline = System.nanoTime() + timeout.toNanos();
		CompletionException lastFailure = null;

		for (int tierIndex = 0; tierIndex < tiers.size(); tierIndex++) {
			CompletionTier tier = tiers.get(tierIndex);
			for (int attempt = 1; attempt <= tier.maxAttempts(); attempt++) {
				long remaining = deadline - System.nanoTime();
				if (remaining <= 0) {
					throw new CompletionTimeoutException(request.purpose(), timeout);
				}
				long start = System.nanoTime();
				Future<String> future;
				try {
					future = executor.submit(() -> invoke(tier.chatClient(), request));
				}
				catch (RejectedExecutionException e) {
					throw new CompletionException("Completion client is closed; cannot run '" + request.purpose() + "'", e);
				}
				try {
					String content = future.get(remaining, TimeUnit.NANOSECONDS);
					if (content == null || content.isBlank()) {
						record(request, tier, tierIndex, attempt, CompletionAttempt.Outcome.EMPTY_RESPONSE, start, "empty response");
						lastFailure = new CompletionException("Model returned an empty response for '" + request.purpose() + "'");
						continue;
					}
					record(request, tier, tierIndex, attempt, CompletionAttempt.Outcome.SUCCESS, start, null);
					logger.debug("Completion '{}' response: {}", request.purpose(), StringUtils.abbreviate(content, 500));
					return content;
				}
				catch (TimeoutException e) {
					future.cancel(true);
					record(request, tier, tierIndex, attempt, CompletionAttempt.Outcome.TIMEOUT, start, "timed out");
					logger.warn("Completion '{}' timed out after {} ms", request.purpose(), timeout.toMillis());
					throw new CompletionTimeoutException(request.purpose(), timeout);
				}
				catch (InterruptedException e) {
					future.cancel(true);
					Thread.currentThread().interrupt();
					throw new CompletionException("Interrupted while waiting for completion '" + request.purpose() + "'", e);
				}
				catch (ExecutionException e) {
					Throwable cause = e.getCause() != null ? e.getCause() : e;
					record(request, tier, tierIndex, attempt, CompletionAttempt.Outcome.ERROR, start, cause.getMessage());
					logger.warn("Completion '{}' failed on tier {} attempt {}: {}", request.purpose(), tierIndex, attempt,
							cause.getMessage(), cause);
					lastFailure = new CompletionException("Completion '" + request.purpose() + "' failed: " + cause.getMessage(), cause);
				}
			}
		}
		throw lastFailure != null ? lastFailure : new CompletionException("No completion tier produced a response");
	}

	private String invoke(ChatClient chatClient, CompletionRequest request) {
		ChatClient.ChatClientRequestSpec spec = chatClient.prompt();
		if (!request.systemPrompt().isBlank()) {
			spec = spec.system(request.systemPrompt());
		}
		return spec.user(request.userPrompt()).call().content();
	}

	private void record(CompletionRequest request, CompletionTier tier, int tierIndex, int attempt,
			CompletionAttempt.Outcome outcome, long startNanos, String error) {
		long millis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
		CompletionAttempt record = new CompletionAttempt(request.purpose(), tier.modelId(), tierIndex, attempt, outcome,
				millis, error);
		try {
			attemptListener.accept(record);
		}
		catch (RuntimeException ex) {
			logger.warn("Attempt listener threw an exception", ex);
		}
	}

	@Override
	public void close() {
		executor.shutdownNow();
	}
}
