package org.javai.nl2sql.clarify;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import org.javai.nl2sql.llm.CompletionException;
import org.javai.nl2sql.llm.CompletionRequest;
import org.javai.nl2sql.llm.TextCompletionClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class ClarifierTest {

	private static final AmbiguityFinding TIME = new AmbiguityFinding(AmbiguityKind.TIME_RANGE, "most",
			"superlative-without-time-bound");

	@Nested
	@DisplayName("Preparing a question")
	class Prepare {

		private final TextCompletionClient client = mock(TextCompletionClient.class);
		private final Clarifier clarifier = new Clarifier(client);

		@Test
		void readsQuestionAndOptionsFromModel() {
			when(client.complete(any())).thenReturn("""
					QUESTION: Which period should the ranking cover?
					1. This year
					2. Last year
					3) All time
					""");

			ClarificationRequest request = clarifier.prepare("most popular genre", TIME, List.of());

			assertThat(request.question()).isEqualTo("Which period should the ranking cover?");
			assertThat(request.options()).containsExactly("This year", "Last year", "All time");
			assertThat(request.kind()).isEqualTo(AmbiguityKind.TIME_RANGE);

			ArgumentCaptor<CompletionRequest> sent = ArgumentCaptor.forClass(CompletionRequest.class);
			verify(client).complete(sent.capture());
			assertThat(sent.getValue().purpose()).isEqualTo("clarify");
			assertThat(sent.getValue().userPrompt()).contains("most popular genre", "\"most\"");
		}

		@Test
		void modelFailurePropagates() {
			when(client.complete(any())).thenThrow(new CompletionException("down"));

			assertThatThrownBy(() -> clarifier.prepare("most popular genre", TIME, List.of()))
					.isInstanceOf(CompletionException.class);
		}
	}

	@Nested
	@DisplayName("Parsing model output")
	class Parse {

		@Test
		void capsOptionsAtFive() {
			ClarificationRequest request = Clarifier.parse("""
					问题：您想查询哪个时间范围？
					- 今年
					- 去年
					- 最近7天
					- 最近30天
					- 最近90天
					- 全部时间
					""", AmbiguityKind.TIME_RANGE, true);

			assertThat(request.question()).isEqualTo("您想查询哪个时间范围？");
			assertThat(request.options()).hasSize(ClarificationRequest.MAX_OPTIONS).startsWith("今年");
		}

		@Test
		void firstUnlabelledLineBecomesQuestion() {
			ClarificationRequest request = Clarifier.parse("Which measure?\n1. revenue\n2. quantity",
					AmbiguityKind.ORDERING, false);

			assertThat(request.question()).isEqualTo("Which measure?");
			assertThat(request.options()).containsExactly("revenue", "quantity");
		}

		@Test
		void fallsBackToDefaultsForEmptyResponse() {
			ClarificationRequest english = Clarifier.parse("", AmbiguityKind.TIME_RANGE, false);
			ClarificationRequest chinese = Clarifier.parse(null, AmbiguityKind.TIME_RANGE, true);

			assertThat(english.question()).isEqualTo("Could you tell me which time period the question is about?");
			assertThat(english.options()).containsExactly("this year", "last year", "last 30 days", "all time");
			assertThat(chinese.question()).isEqualTo("您想查询哪个时间范围？");
			assertThat(chinese.options()).contains("今年");
		}

		@Test
		void rendersNumberedOptions() {
			ClarificationRequest request = new ClarificationRequest("Which period?", List.of("this year", "all time"),
					AmbiguityKind.TIME_RANGE);

			assertThat(request.render()).isEqualTo("Which period?\n1. this year\n2. all time");
		}
	}

	@Nested
	@DisplayName("Merging the answer")
	class Merge {

		private final List<String> options = List.of("this year", "last year", "all time");

		@Test
		void appendsAnswerInParentheses() {
			assertThat(Clarifier.merge("most popular genre", "this year", options))
					.isEqualTo("most popular genre (this year)");
		}

		@Test
		void chineseQuestionsUseFullWidthParentheses() {
			assertThat(Clarifier.merge("最受欢迎的流派", "今年", List.of())).isEqualTo("最受欢迎的流派（今年）");
		}

		@Test
		void optionNumberSelectsOption() {
			assertThat(Clarifier.merge("most popular genre", " 2 ", options))
					.isEqualTo("most popular genre (last year)");
			assertThat(Clarifier.resolveAnswer("7", options)).isEqualTo("7");
		}

		@Test
		void blankAnswerLeavesQuestionUnchanged() {
			assertThat(Clarifier.merge("most popular genre", "  ", options)).isEqualTo("most popular genre");
			assertThat(Clarifier.merge("most popular genre", null, options)).isEqualTo("most popular genre");
		}
	}
}
