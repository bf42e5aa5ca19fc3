package org.javai.nl2sql.validate;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class SqlValidatorTest {

	private final SqlValidator validator = new SqlValidator();

	@Test
	void acceptsWellFormedSelect() {
		ValidationResult result = validator.validate("""
				SELECT c.first_name, COUNT(i.invoice_id) AS n
				FROM customer c JOIN invoice i ON i.customer_id = c.customer_id
				GROUP BY c.first_name ORDER BY n DESC LIMIT 5""");

		assertThat(result.valid()).isTrue();
		assertThat(result.diagnostics()).isEmpty();
		assertThat(result.firstDiagnostic()).isNull();
	}

	@Test
	void reportsMisspelledKeywordWithPosition() {
		ValidationResult result = validator.validate("SELECT first_name FORM customer");

		assertThat(result.valid()).isFalse();
		Diagnostic diagnostic = result.firstDiagnostic();
		assertThat(diagnostic.line()).isEqualTo(1);
		assertThat(diagnostic.column()).isGreaterThan(1);
		assertThat(result.describe()).startsWith("- line 1, column ");
	}

	@Test
	void positionsAreRelativeToTheWholeText() {
		ValidationResult result = validator.validate("SELECT 1;\nSELECT * FROM t WHERE;");

		assertThat(result.valid()).isFalse();
		assertThat(result.diagnostics()).hasSize(1);
		assertThat(result.firstDiagnostic().line()).isEqualTo(2);
	}

	@Test
	void emptyOrCommentOnlyTextIsInvalid() {
		assertThat(validator.validate("   ").valid()).isFalse();
		assertThat(validator.validate(null).firstDiagnostic().message()).isEqualTo("SQL is empty");
		assertThat(validator.validate("-- nothing here").firstDiagnostic().message())
				.isEqualTo("SQL contains no statement");
	}

	@Test
	void syntaxOnlyJudgement() {
		// unknown tables and non-SELECT statements are left to the sandbox
		assertThat(validator.validate("SELECT * FROM no_such_table").valid()).isTrue();
		assertThat(validator.validate("DELETE FROM customer").valid()).isTrue();
	}

	@Test
	void maskCommentsKeepsOffsetsAndLiterals() {
		String sql = "SELECT '--not a comment' -- trailing\nFROM t /* block */";

		String masked = SqlText.maskComments(sql);

		assertThat(masked).hasSameSizeAs(sql);
		assertThat(masked).contains("'--not a comment'").doesNotContain("trailing", "block");
		assertThat(SqlText.splitStatements("SELECT ';' FROM t; SELECT 2")).extracting(SqlText.Segment::text)
				.containsExactly("SELECT ';' FROM t", "SELECT 2");
	}
}
