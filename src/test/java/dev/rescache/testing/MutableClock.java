package dev.rescache.testing;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

/**
 * Clock whose instant only moves when a test moves it. Safe to read from several threads.
 */
public class MutableClock extends Clock {
    private volatile Instant instant;
    private final ZoneId zone;

    public MutableClock(Instant initial, ZoneId zone) {
        this.instant = initial;
        this.zone = zone;
    }

    public static MutableClock startingAtMillis(long millis) {
        return new MutableClock(Instant.ofEpochMilli(millis), ZoneId.of("UTC"));
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new MutableClock(instant, zone);
    }

    @Override
    public Instant instant() {
        return instant;
    }

    @Override
    public long millis() {
        return instant.toEpochMilli();
    }

    public void advanceMillis(long delta) {
        if (delta == 0) return;
        this.instant = this.instant.plusMillis(delta);
    }

    public void setMillis(long millis) {
        this.instant = Instant.ofEpochMilli(millis);
    }
}
