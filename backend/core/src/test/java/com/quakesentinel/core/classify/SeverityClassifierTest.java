package com.quakesentinel.core.classify;

import com.quakesentinel.core.model.EewEvent;
import com.quakesentinel.core.model.EewIssueKind;
import com.quakesentinel.core.model.QuakeEvent;
import com.quakesentinel.core.model.SeverityLevel;
import com.quakesentinel.core.model.TsunamiArea;
import com.quakesentinel.core.model.TsunamiEvent;
import com.quakesentinel.core.model.TsunamiGrade;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SeverityClassifierTest {
    private static final Instant NOW = Instant.parse("2026-03-11T05:46:00Z");

    private final SeverityClassifier classifier = new SeverityClassifier(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void eewWarningIsEmergencyAndForecastIsAlert() {
        assertEquals(SeverityLevel.EMERGENCY, classifier.classify(eew(NOW.minusSeconds(5), false, EewIssueKind.WARNING)));
        assertEquals(SeverityLevel.ALERT, classifier.classify(eew(NOW.minusSeconds(5), false, EewIssueKind.FORECAST)));
        assertEquals(SeverityLevel.NONE, classifier.classify(eew(NOW.minusSeconds(5), true, EewIssueKind.WARNING)));
    }

    @Test
    void staleEventsClassifyAsNoneWhateverTheirRawSeverity() {
        assertEquals(SeverityLevel.NONE, classifier.classify(eew(NOW.minusSeconds(181), false, EewIssueKind.WARNING)));
        assertEquals(SeverityLevel.NONE, classifier.classify(quake(NOW.minusSeconds(600), 70)));
        assertEquals(SeverityLevel.NONE, classifier.classify(tsunami(NOW.minusSeconds(181), false, TsunamiGrade.MAJOR_WARNING)));
    }

    @Test
    void freshnessBoundaryIsInclusiveOfTheWindow() {
        assertFalse(classifier.isStale(NOW.minusSeconds(180)));
        assertTrue(classifier.isStale(NOW.minusSeconds(180).minusMillis(1)));
        assertFalse(classifier.isStale(NOW.plusSeconds(2)));
        assertEquals(SeverityLevel.EMERGENCY, classifier.classify(eew(NOW.minusSeconds(180), false, EewIssueKind.WARNING)));
    }

    @Test
    void quakeIntensityThresholds() {
        assertEquals(SeverityLevel.NONE, classifier.classify(quake(NOW, -1)));
        assertEquals(SeverityLevel.NONE, classifier.classify(quake(NOW, 0)));
        assertEquals(SeverityLevel.WATCH, classifier.classify(quake(NOW, 10)));
        assertEquals(SeverityLevel.WATCH, classifier.classify(quake(NOW, 20)));
        assertEquals(SeverityLevel.ALERT, classifier.classify(quake(NOW, 30)));
        assertEquals(SeverityLevel.ALERT, classifier.classify(quake(NOW, 40)));
        assertEquals(SeverityLevel.MAJOR, classifier.classify(quake(NOW, 45)));
        assertEquals(SeverityLevel.MAJOR, classifier.classify(quake(NOW, 70)));
    }

    @Test
    void tsunamiReducesAreasToWorstGrade() {
        TsunamiEvent mixed = new TsunamiEvent(NOW, false, List.of(
                new TsunamiArea(TsunamiGrade.WATCH, "北海道太平洋沿岸東部"),
                new TsunamiArea(TsunamiGrade.MAJOR_WARNING, "能登"),
                new TsunamiArea(TsunamiGrade.WARNING, "新潟県上中下越")
        ));

        assertEquals(SeverityLevel.MAJOR, classifier.classify(mixed));
        assertEquals(TsunamiGrade.MAJOR_WARNING, SeverityClassifier.worstGrade(mixed.areas()));
        assertEquals(SeverityLevel.WARNING, classifier.classify(tsunami(NOW, false, TsunamiGrade.WARNING)));
        assertEquals(SeverityLevel.ALERT, classifier.classify(tsunami(NOW, false, TsunamiGrade.WATCH)));
        assertEquals(SeverityLevel.WATCH, classifier.classify(tsunami(NOW, false, TsunamiGrade.UNKNOWN)));
    }

    @Test
    void cancelledOrEmptyTsunamiIsNone() {
        assertEquals(SeverityLevel.NONE, classifier.classify(tsunami(NOW, true, TsunamiGrade.MAJOR_WARNING)));
        assertEquals(SeverityLevel.NONE, classifier.classify(new TsunamiEvent(NOW, false, List.of())));
    }

    @Test
    void rejectsNonPositiveFreshnessWindow() {
        assertThrows(IllegalArgumentException.class, () -> new SeverityClassifier(Clock.systemUTC(), Duration.ZERO));
    }

    private static EewEvent eew(Instant at, boolean cancelled, EewIssueKind kind) {
        return new EewEvent(at, "宮城県沖", cancelled, kind);
    }

    private static QuakeEvent quake(Instant at, int intensityCode) {
        return new QuakeEvent(at, "宮城県沖", 6.1, intensityCode, 40.0);
    }

    private static TsunamiEvent tsunami(Instant at, boolean cancelled, TsunamiGrade grade) {
        return new TsunamiEvent(at, cancelled, List.of(new TsunamiArea(grade, "宮城県")));
    }
}
