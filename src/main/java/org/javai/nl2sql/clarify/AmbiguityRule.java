package org.javai.nl2sql.clarify;

import java.util.Optional;

/**
 * A predicate that recognises one kind of missing specificity.
 */
@FunctionalInterface
public interface AmbiguityRule {

	Optional<AmbiguityFinding> check(AmbiguityContext context);
}
