package com.omnimcp.gateway.service;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.omnimcp.gateway.config.GatewayProperties;
import com.omnimcp.gateway.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class SessionTokenServiceTest {

    private MutableClock clock;
    private GatewayProperties properties;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        properties = new GatewayProperties();
        properties.setJwtSecret("test-secret-that-is-long-enough-for-hs256");
        properties.setTokenExpiry(Duration.ofHours(1));
    }

    @Test
    void tokenCarriesSessionId() {
        SessionTokenService service = new SessionTokenService(properties, clock);

        String token = service.generateToken("session-1");

        assertThat(service.validateToken(token)).contains("session-1");
    }

    @Test
    void expiredTokenIsRejected() {
        SessionTokenService service = new SessionTokenService(properties, clock);
        String token = service.generateToken("session-1");

        clock.advance(Duration.ofMinutes(61));

        assertThat(service.validateToken(token)).isEmpty();
    }

    @Test
    void tokenSignedWithAnotherSecretIsRejected() {
        String token = new SessionTokenService(properties, clock).generateToken("session-1");

        GatewayProperties other = new GatewayProperties();
        other.setJwtSecret("a-completely-different-secret-for-signing");
        SessionTokenService verifier = new SessionTokenService(other, clock);

        assertThat(verifier.validateToken(token)).isEmpty();
    }

    @Test
    void garbageAndBlankTokensAreRejected() {
        SessionTokenService service = new SessionTokenService(properties, clock);

        assertThat(service.validateToken("not.a.token")).isEmpty();
        assertThat(service.validateToken("")).isEmpty();
        assertThat(service.validateToken(null)).isEmpty();
    }

    @Test
    void shortSecretIsPaddedAndBlankSecretIsGenerated() {
        properties.setJwtSecret("short");
        SessionTokenService padded = new SessionTokenService(properties, clock);
        assertThat(padded.validateToken(padded.generateToken("s"))).contains("s");

        properties.setJwtSecret(null);
        SessionTokenService generated = new SessionTokenService(properties, clock);
        assertThat(generated.validateToken(generated.generateToken("s"))).contains("s");
    }

    @Test
    void shortSecretIsReportedAtStartup() {
        Logger logger = (Logger) LoggerFactory.getLogger(SessionTokenService.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            properties.setJwtSecret("short");
            new SessionTokenService(properties, clock);

            assertThat(appender.list)
                .anySatisfy(event -> {
                    assertThat(event.getLevel()).isEqualTo(Level.WARN);
                    assertThat(event.getFormattedMessage()).contains("shorter than the 32 bytes");
                });
        } finally {
            logger.detachAppender(appender);
        }
    }

    @Test
    void longSecretIsUsedSilently() {
        Logger logger = (Logger) LoggerFactory.getLogger(SessionTokenService.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            new SessionTokenService(properties, clock);

            assertThat(appender.list).noneMatch(event -> event.getLevel() == Level.WARN);
        } finally {
            logger.detachAppender(appender);
        }
    }
}
