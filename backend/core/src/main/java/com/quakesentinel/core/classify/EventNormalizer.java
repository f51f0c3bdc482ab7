package com.quakesentinel.core.classify;

import com.quakesentinel.core.model.EewEvent;
import com.quakesentinel.core.model.JmaIntensity;
import com.quakesentinel.core.model.NormalizedEew;
import com.quakesentinel.core.model.NormalizedEvent;
import com.quakesentinel.core.model.NormalizedQuake;
import com.quakesentinel.core.model.NormalizedTsunami;
import com.quakesentinel.core.model.QuakeEvent;
import com.quakesentinel.core.model.RawEventRecord;
import com.quakesentinel.core.model.TsunamiArea;
import com.quakesentinel.core.model.TsunamiEvent;
import com.quakesentinel.core.translate.PlaceNameTranslator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class EventNormalizer {
    static final String UNKNOWN_PLACE = "UNKNOWN";

    private final SeverityClassifier classifier;
    private final PlaceNameTranslator translator;

    public EventNormalizer(SeverityClassifier classifier, PlaceNameTranslator translator) {
        this.classifier = Objects.requireNonNull(classifier, "classifier is required");
        this.translator = Objects.requireNonNull(translator, "translator is required");
    }

    public NormalizedEvent normalize(RawEventRecord raw) {
        if (raw instanceof QuakeEvent quake) {
            return normalizeQuake(quake);
        }
        if (raw instanceof TsunamiEvent tsunami) {
            return normalizeTsunami(tsunami);
        }
        if (raw instanceof EewEvent eew) {
            return normalizeEew(eew);
        }
        throw new IllegalArgumentException("Unsupported event record: " + raw);
    }

    public NormalizedQuake normalizeQuake(QuakeEvent quake) {
        return new NormalizedQuake(
                quake.occurredAt(),
                placeName(quake.epicenterRaw()),
                quake.magnitude(),
                JmaIntensity.fromCode(quake.maxIntensityCode()),
                quake.depthKm(),
                classifier.classify(quake)
        );
    }

    public NormalizedTsunami normalizeTsunami(TsunamiEvent tsunami) {
        List<String> names = new ArrayList<>();
        for (TsunamiArea area : tsunami.areas()) {
            String name = translator.translate(area.nameRaw());
            if (!name.isEmpty() && !names.contains(name)) {
                names.add(name);
            }
        }
        return new NormalizedTsunami(
                tsunami.occurredAt(),
                tsunami.cancelled(),
                names,
                SeverityClassifier.worstGrade(tsunami.areas()),
                classifier.classify(tsunami)
        );
    }

    public NormalizedEew normalizeEew(EewEvent eew) {
        return new NormalizedEew(
                eew.occurredAt(),
                placeName(eew.epicenterRaw()),
                eew.issueKind(),
                eew.cancelled(),
                classifier.classify(eew),
                false
        );
    }

    public SeverityClassifier classifier() {
        return classifier;
    }

    private String placeName(String raw) {
        String translated = translator.translate(raw);
        return translated.isEmpty() ? UNKNOWN_PLACE : translated;
    }
}
