package org.javai.nl2sql.workflow;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each turn as one JSON line at INFO on the {@value #LOGGER_NAME} logger,
 * so that the logging configuration can route turns to their own file.
 */
public class Slf4jTurnLog implements TurnLog {

	public static final String LOGGER_NAME = "nl2sql.turns";

	private static final Logger turns = LoggerFactory.getLogger(LOGGER_NAME);
	private static final Logger logger = LoggerFactory.getLogger(Slf4jTurnLog.class);

	private final ObjectMapper mapper;

	public Slf4jTurnLog() {
		this.mapper = new ObjectMapper()
				.registerModule(new JavaTimeModule())
				.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
				.disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
	}

	@Override
	public void record(TurnRecord turn) {
		if (!turns.isInfoEnabled()) {
			return;
		}
		try {
			turns.info(mapper.writeValueAsString(turn));
		}
		catch (JsonProcessingException e) {
			logger.warn("Could not serialise turn {} of session {}", turn.turnIndex(), turn.sessionId(), e);
		}
	}
}
