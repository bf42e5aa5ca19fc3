package org.javai.nl2sql.validate;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.parser.ParseException;
import net.sf.jsqlparser.parser.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Syntax check of candidate SQL with JSqlParser.
 *
 * <p>Every statement in the text is parsed; the result lists one diagnostic per
 * statement that failed, positioned in the original text. Only syntax is judged:
 * identifiers and statement kinds are the sandbox's business.</p>
 */
public class SqlValidator {

	private static final Logger logger = LoggerFactory.getLogger(SqlValidator.class);
	private static final Pattern POSITION = Pattern.compile("line (\\d+), column (\\d+)");

	public ValidationResult validate(String sql) {
		if (sql == null || sql.isBlank()) {
			return ValidationResult.failed(new Diagnostic("SQL is empty", "", 1, 1));
		}
		String masked = SqlText.maskComments(sql);
		List<SqlText.Segment> segments = SqlText.splitStatements(masked);
		if (segments.isEmpty()) {
			return ValidationResult.failed(new Diagnostic("SQL contains no statement", "", 1, 1));
		}

		List<Diagnostic> diagnostics = new ArrayList<>();
		for (SqlText.Segment segment : segments) {
			try {
				CCJSqlParserUtil.parse(segment.text());
			}
			catch (JSQLParserException e) {
				diagnostics.add(toDiagnostic(e, sql, segment));
			}
		}
		if (diagnostics.isEmpty()) {
			return ValidationResult.ok();
		}
		logger.debug("SQL failed syntax validation: {}", diagnostics);
		return ValidationResult.failed(diagnostics);
	}

	private static Diagnostic toDiagnostic(JSQLParserException e, String sql, SqlText.Segment segment) {
		String message = firstLine(e.getCause() != null && e.getCause().getMessage() != null
				? e.getCause().getMessage()
				: e.getMessage());
		int localLine = 0;
		int localColumn = 0;
		String fragment = "";

		if (e.getCause() instanceof ParseException pe && pe.currentToken != null) {
			Token token = pe.currentToken.next != null ? pe.currentToken.next : pe.currentToken;
			localLine = token.beginLine;
			localColumn = token.beginColumn;
			fragment = token.image != null ? token.image : "";
		}
		else if (message != null) {
			Matcher m = POSITION.matcher(message);
			if (m.find()) {
				localLine = Integer.parseInt(m.group(1));
				localColumn = Integer.parseInt(m.group(2));
			}
		}

		if (localLine <= 0) {
			return new Diagnostic(message != null ? message : "Invalid SQL", fragment, 0, 0);
		}
		int[] base = SqlText.lineAndColumn(sql, segment.offset());
		int line = base[0] + localLine - 1;
		int column = localLine == 1 ? base[1] + localColumn - 1 : localColumn;
		return new Diagnostic(message, fragment, line, column);
	}

	private static String firstLine(String message) {
		if (message == null) {
			return null;
		}
		String trimmed = message.strip();
		int newline = trimmed.indexOf('\n');
		return newline < 0 ? trimmed : trimmed.substring(0, newline).strip();
	}
}
