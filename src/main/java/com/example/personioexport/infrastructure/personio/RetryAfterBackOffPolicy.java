package com.example.personioexport.infrastructure.personio;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.ExponentialRandomBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Backoff for Personio calls: randomized exponential delays capped at {@code maxDelay}, unless
 * the failed attempt left a {@code Retry-After} hint in the retry context, in which case the hint
 * is slept instead.
 */
public class RetryAfterBackOffPolicy implements BackOffPolicy {

	/**
	 * Retry context attribute holding the {@link Duration} requested by the last response.
	 */
    public static final String RETRY_AFTER_ATTRIBUTE = "personio.retry-after";

    private static final Logger log = LoggerFactory.getLogger(RetryAfterBackOffPolicy.class);
    private static final double MULTIPLIER = 2.0;
    private static final long MAX_DELTA_SECONDS = Long.MAX_VALUE / 1000;

    private final ExponentialRandomBackOffPolicy schedule = new ExponentialRandomBackOffPolicy();
    private final Sleeper sleeper;

	/**
	 * @param baseDelay delay after the first failed attempt, before jitter
	 * @param maxDelay  upper bound of any scheduled delay
	 * @param sleeper   pause between attempts
	 */
    public RetryAfterBackOffPolicy(Duration baseDelay, Duration maxDelay, Sleeper sleeper) {
        long cap = Math.max(1, maxDelay.toMillis());
        this.sleeper = sleeper;
        schedule.setInitialInterval(Math.max(1, baseDelay.toMillis()));
        schedule.setMultiplier(MULTIPLIER);
        schedule.setMaxInterval(cap);
        schedule.setSleeper(period -> sleeper.sleep(Math.min(period, cap)));
    }

    @Override
    public BackOffContext start(RetryContext context) {
        return new RetryAfterContext(context, schedule.start(context));
    }

    @Override
    public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
        RetryAfterContext context = (RetryAfterContext) backOffContext;
        Object hint = context.retryContext().getAttribute(RETRY_AFTER_ATTRIBUTE);
        if (!(hint instanceof Duration)) {
            schedule.backOff(context.schedule());
            return;
        }
        long millis = ((Duration) hint).toMillis();
        log.debug("Honoring Retry-After of {} ms", millis);
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new BackOffInterruptedException("Interrupted while honoring Retry-After", ex);
        }
    }

	/**
	 * Parses a {@code Retry-After} header given either as delta seconds or as an HTTP date.
	 *
	 * @param header raw header value, may be {@code null}
	 * @param clock  clock used to turn an HTTP date into a delay
	 * @return the hinted delay, or empty when the header is absent, unreadable or out of range
	 */
    public static Optional<Duration> parseRetryAfter(String header, Clock clock) {
        if (header == null || header.isBlank()) {
            return Optional.empty();
        }
        String value = header.strip();
        if (value.chars().allMatch(Character::isDigit)) {
            try {
                long seconds = Long.parseLong(value);
                return seconds > MAX_DELTA_SECONDS ? Optional.empty() : Optional.of(Duration.ofSeconds(seconds));
            } catch (NumberFormatException ex) {
                return Optional.empty();
            }
        }
        try {
            ZonedDateTime retryAt = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME);
            Duration delay = Duration.between(clock.instant(), retryAt.toInstant());
            return Optional.of(delay.isNegative() ? Duration.ZERO : delay);
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }

    private record RetryAfterContext(RetryContext retryContext, BackOffContext schedule) implements BackOffContext {
    }
}
