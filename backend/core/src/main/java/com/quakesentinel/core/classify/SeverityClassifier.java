package com.quakesentinel.core.classify;

import com.quakesentinel.core.model.EewEvent;
import com.quakesentinel.core.model.EewIssueKind;
import com.quakesentinel.core.model.QuakeEvent;
import com.quakesentinel.core.model.RawEventRecord;
import com.quakesentinel.core.model.SeverityLevel;
import com.quakesentinel.core.model.TsunamiArea;
import com.quakesentinel.core.model.TsunamiEvent;
import com.quakesentinel.core.model.TsunamiGrade;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Ranks raw feed records. Anything older than the freshness window ranks {@link SeverityLevel#NONE}
 * whatever its raw fields say, so a missed cancellation cannot keep an alert alive.
 */
public final class SeverityClassifier {
    public static final Duration DEFAULT_FRESHNESS_WINDOW = Duration.ofSeconds(180);

    static final int MAJOR_INTENSITY_CODE = 45;
    static final int ALERT_INTENSITY_CODE = 30;
    static final int WATCH_INTENSITY_CODE = 10;

    private final Clock clock;
    private final Duration freshnessWindow;

    public SeverityClassifier(Clock clock) {
        this(clock, DEFAULT_FRESHNESS_WINDOW);
    }

    public SeverityClassifier(Clock clock, Duration freshnessWindow) {
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.freshnessWindow = Objects.requireNonNull(freshnessWindow, "freshnessWindow is required");
        if (freshnessWindow.isNegative() || freshnessWindow.isZero()) {
            throw new IllegalArgumentException("freshnessWindow must be positive");
        }
    }

    public SeverityLevel classify(RawEventRecord event) {
        Objects.requireNonNull(event, "event is required");
        if (isStale(event.occurredAt())) {
            return SeverityLevel.NONE;
        }
        if (event instanceof EewEvent eew) {
            return classifyEew(eew);
        }
        if (event instanceof QuakeEvent quake) {
            return classifyIntensity(quake.maxIntensityCode());
        }
        if (event instanceof TsunamiEvent tsunami) {
            return classifyTsunami(tsunami);
        }
        throw new IllegalArgumentException("Unsupported event record: " + event.getClass().getName());
    }

    public boolean isStale(Instant occurredAt) {
        return Duration.between(occurredAt, clock.instant()).compareTo(freshnessWindow) > 0;
    }

    public Clock clock() {
        return clock;
    }

    public Duration freshnessWindow() {
        return freshnessWindow;
    }

    static SeverityLevel classifyEew(EewEvent eew) {
        if (eew.cancelled()) {
            return SeverityLevel.NONE;
        }
        return eew.issueKind() == EewIssueKind.WARNING ? SeverityLevel.EMERGENCY : SeverityLevel.ALERT;
    }

    static SeverityLevel classifyIntensity(int maxIntensityCode) {
        if (maxIntensityCode >= MAJOR_INTENSITY_CODE) {
            return SeverityLevel.MAJOR;
        }
        if (maxIntensityCode >= ALERT_INTENSITY_CODE) {
            return SeverityLevel.ALERT;
        }
        if (maxIntensityCode >= WATCH_INTENSITY_CODE) {
            return SeverityLevel.WATCH;
        }
        return SeverityLevel.NONE;
    }

    static SeverityLevel classifyTsunami(TsunamiEvent tsunami) {
        if (tsunami.cancelled() || tsunami.areas().isEmpty()) {
            return SeverityLevel.NONE;
        }
        return worstGrade(tsunami.areas()).severity();
    }

    public static TsunamiGrade worstGrade(List<TsunamiArea> areas) {
        TsunamiGrade worst = TsunamiGrade.UNKNOWN;
        for (TsunamiArea area : areas) {
            if (area.grade().compareTo(worst) > 0) {
                worst = area.grade();
            }
        }
        return worst;
    }
}
