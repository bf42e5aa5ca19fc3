package org.javai.nl2sql.clarify;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an ordered list of {@link AmbiguityRule}s; the first rule that reports a
 * finding wins.
 */
public class AmbiguityDetector {

	private static final Logger logger = LoggerFactory.getLogger(AmbiguityDetector.class);

	private final List<AmbiguityRule> rules;

	public AmbiguityDetector() {
		this(AmbiguityRules.defaults());
	}

	public AmbiguityDetector(List<AmbiguityRule> rules) {
		Objects.requireNonNull(rules, "rules must not be null");
		this.rules = List.copyOf(rules);
	}

	public List<AmbiguityRule> rules() {
		return rules;
	}

	public Optional<AmbiguityFinding> detect(AmbiguityContext context) {
		Objects.requireNonNull(context, "context must not be null");
		for (AmbiguityRule rule : rules) {
			Optional<AmbiguityFinding> finding = rule.check(context);
			if (finding.isPresent()) {
				logger.debug("Ambiguity {} ({}) in question: {}", finding.get().kind(), finding.get().rule(),
						context.question());
				return finding;
			}
		}
		return Optional.empty();
	}
}
