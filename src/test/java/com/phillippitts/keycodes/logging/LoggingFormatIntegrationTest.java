package com.phillippitts.keycodes.logging;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.Logger;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.filter.AbstractFilter;
import org.apache.logging.log4j.core.layout.PatternLayout;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Verifies that log lines written while handling a request carry the MDC values set by MdcFilter.
 */
@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = "keycodes.layout.source=none"
)
class LoggingFormatIntegrationTest {

    private static final String HANDLER_LOGGER =
            "com.phillippitts.keycodes.presentation.exception.GlobalExceptionHandler";

    @Autowired
    private TestRestTemplate restTemplate;

    private InMemoryAppender appender;
    private Logger logger;

    @BeforeEach
    void setUpAppender() {
        LoggerContext ctx = (LoggerContext) LogManager.getContext(false);
        logger = ctx.getLogger(HANDLER_LOGGER);
        appender = new InMemoryAppender("test-appender");
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDownAppender() {
        if (logger != null && appender != null) {
            logger.removeAppender(appender);
            appender.stop();
        }
    }

    @Test
    void unknownKeyLogCarriesRequestId() {
        HttpHeaders headers = new HttpHeaders();
        headers.add("X-Request-ID", "abc123");

        ResponseEntity<String> response = restTemplate.exchange(
                "/api/keys/NoSuchKey", HttpMethod.GET, new HttpEntity<>(headers), String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);

        await().atMost(3, SECONDS).until(() -> appender.getEvents().stream()
                .anyMatch(e -> e.getMessage().getFormattedMessage().contains("NoSuchKey")));

        LogEvent event = appender.getEvents().stream()
                .filter(e -> e.getMessage().getFormattedMessage().contains("NoSuchKey"))
                .findFirst()
                .orElseThrow();

        assertThat(event.getContextData().<String>getValue("requestId")).isEqualTo("abc123");
        assertThat(event.getContextData().<String>getValue("uri")).isEqualTo("/api/keys/NoSuchKey");
        assertThat(event.getLoggerName()).isEqualTo(HANDLER_LOGGER);
    }

    /**
     * Simple in-memory Log4j2 appender that captures LogEvents for assertions.
     */
    private static class InMemoryAppender extends AbstractAppender {
        private final List<LogEvent> events = new CopyOnWriteArrayList<>();

        protected InMemoryAppender(String name) {
            super(name, new AbstractFilter() {}, PatternLayout.createDefaultLayout(), true, null);
        }

        @Override
        public void append(LogEvent event) {
            events.add(event.toImmutable());
        }

        List<LogEvent> getEvents() {
            return Collections.unmodifiableList(events);
        }
    }
}
