package com.quakesentinel.core.classify;

import com.quakesentinel.core.model.EewEvent;
import com.quakesentinel.core.model.EewIssueKind;
import com.quakesentinel.core.model.FeedType;
import com.quakesentinel.core.model.JmaIntensity;
import com.quakesentinel.core.model.NormalizedEew;
import com.quakesentinel.core.model.NormalizedEvent;
import com.quakesentinel.core.model.NormalizedQuake;
import com.quakesentinel.core.model.NormalizedTsunami;
import com.quakesentinel.core.model.QuakeEvent;
import com.quakesentinel.core.model.SeverityLevel;
import com.quakesentinel.core.model.TsunamiArea;
import com.quakesentinel.core.model.TsunamiEvent;
import com.quakesentinel.core.model.TsunamiGrade;
import com.quakesentinel.core.translate.PlaceNameTranslator;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventNormalizerTest {
    private static final Instant NOW = Instant.parse("2026-01-01T07:10:30Z");

    private final EventNormalizer normalizer = new EventNormalizer(
            new SeverityClassifier(Clock.fixed(NOW, ZoneOffset.UTC)),
            PlaceNameTranslator.withDefaultDictionary()
    );

    @Test
    void normalizesQuakeWithTranslatedEpicenterAndIntensityLabel() {
        NormalizedEvent event = normalizer.normalize(new QuakeEvent(NOW.minusSeconds(30), "石川県能登地方", 7.6, 70, 10.0));

        NormalizedQuake quake = assertInstanceOf(NormalizedQuake.class, event);
        assertEquals(FeedType.QUAKE, quake.feedType());
        assertEquals("ISHIKAWA PREF NOTO REGION", quake.placeName());
        assertEquals(JmaIntensity.SEVEN, quake.maxIntensity());
        assertEquals("7", quake.maxIntensity().label());
        assertEquals(SeverityLevel.MAJOR, quake.severity());
        assertEquals(NOW.minusSeconds(30), quake.occurredAt());
    }

    @Test
    void normalizesTsunamiAreasAndWorstGrade() {
        NormalizedTsunami tsunami = normalizer.normalizeTsunami(new TsunamiEvent(NOW, false, List.of(
                new TsunamiArea(TsunamiGrade.WARNING, "新潟県"),
                new TsunamiArea(TsunamiGrade.MAJOR_WARNING, "能登"),
                new TsunamiArea(TsunamiGrade.WARNING, "能登")
        )));

        assertEquals(List.of("NIIGATA PREF", "NOTO"), tsunami.areaNames());
        assertEquals("NIIGATA PREF / NOTO", tsunami.placeName());
        assertEquals(TsunamiGrade.MAJOR_WARNING, tsunami.worstGrade());
        assertEquals(SeverityLevel.MAJOR, tsunami.severity());
        assertFalse(tsunami.cancelled());
    }

    @Test
    void normalizesEewAndFallsBackToUnknownPlace() {
        NormalizedEew eew = normalizer.normalizeEew(new EewEvent(NOW.minusSeconds(3), "", false, EewIssueKind.WARNING));

        assertEquals("UNKNOWN", eew.placeName());
        assertEquals(SeverityLevel.EMERGENCY, eew.severity());
        assertFalse(eew.synthetic());
        assertTrue(eew.asSynthetic().synthetic());
    }
}
