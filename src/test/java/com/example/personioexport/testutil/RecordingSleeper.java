package com.example.personioexport.testutil;

import org.springframework.retry.backoff.Sleeper;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link Sleeper} that records requested pauses instead of sleeping.
 */
public final class RecordingSleeper implements Sleeper {

    private final List<Duration> pauses = new CopyOnWriteArrayList<>();

    @Override
    public void sleep(long backOffPeriod) {
        pauses.add(Duration.ofMillis(backOffPeriod));
    }

    public List<Duration> pauses() {
        return List.copyOf(pauses);
    }
}
