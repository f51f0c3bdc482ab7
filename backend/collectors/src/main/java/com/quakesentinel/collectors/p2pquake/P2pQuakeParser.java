package com.quakesentinel.collectors.p2pquake;

import com.fasterxml.jackson.databind.JsonNode;
import com.quakesentinel.core.model.EewEvent;
import com.quakesentinel.core.model.EewIssueKind;
import com.quakesentinel.core.model.FeedType;
import com.quakesentinel.core.model.QuakeEvent;
import com.quakesentinel.core.model.RawEventRecord;
import com.quakesentinel.core.model.TsunamiArea;
import com.quakesentinel.core.model.TsunamiEvent;
import com.quakesentinel.core.model.TsunamiGrade;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns a P2PQuake history response (a JSON array, newest first) into the latest raw record of a feed.
 */
public final class P2pQuakeParser {
    static final int UNKNOWN_VALUE = -1;

    public Optional<RawEventRecord> parseLatest(FeedType feedType, JsonNode body) {
        if (body == null || !body.isArray()) {
            throw new FeedFormatException("Expected a JSON array of " + feedType + " records");
        }
        if (body.isEmpty()) {
            return Optional.empty();
        }
        JsonNode latest = body.get(0);
        if (!latest.isObject()) {
            throw new FeedFormatException("Expected a JSON object as the latest " + feedType + " record");
        }
        return Optional.of(switch (feedType) {
            case QUAKE -> parseQuake(latest);
            case TSUNAMI -> parseTsunami(latest);
            case EEW -> parseEew(latest);
        });
    }

    QuakeEvent parseQuake(JsonNode record) {
        JsonNode earthquake = record.path("earthquake");
        if (!earthquake.isObject()) {
            throw new FeedFormatException("Quake record has no earthquake object");
        }
        String time = earthquake.path("time").asText("");
        Instant occurredAt = P2pQuakeTimestamps.parse(time.isBlank() ? record.path("time").asText("") : time);
        JsonNode hypocenter = earthquake.path("hypocenter");
        JsonNode maxScale = earthquake.path("maxScale");
        return new QuakeEvent(
                occurredAt,
                hypocenter.path("name").asText(""),
                knownValue(hypocenter.path("magnitude")),
                maxScale.isNumber() ? maxScale.asInt() : UNKNOWN_VALUE,
                knownValue(hypocenter.path("depth"))
        );
    }

    TsunamiEvent parseTsunami(JsonNode record) {
        Instant occurredAt = P2pQuakeTimestamps.parse(record.path("time").asText(""));
        boolean cancelled = record.path("cancelled").asBoolean(false);
        List<TsunamiArea> areas = new ArrayList<>();
        JsonNode areaNodes = record.path("areas");
        if (!areaNodes.isMissingNode() && !areaNodes.isNull() && !areaNodes.isArray()) {
            throw new FeedFormatException("Tsunami areas must be an array");
        }
        for (JsonNode area : areaNodes) {
            areas.add(new TsunamiArea(
                    TsunamiGrade.fromWire(area.path("grade").asText(null)),
                    area.path("name").asText("")
            ));
        }
        return new TsunamiEvent(occurredAt, cancelled, areas);
    }

    EewEvent parseEew(JsonNode record) {
        Instant occurredAt = P2pQuakeTimestamps.parse(record.path("time").asText(""));
        boolean cancelled = record.path("cancelled").asBoolean(false);
        JsonNode earthquake = record.path("earthquake");
        if (!earthquake.isObject()) {
            if (cancelled) {
                return new EewEvent(occurredAt, "", true, issueKind(record));
            }
            throw new FeedFormatException("EEW record has no earthquake object");
        }
        return new EewEvent(
                occurredAt,
                earthquake.path("hypocenter").path("name").asText(""),
                cancelled,
                issueKind(record)
        );
    }

    private static EewIssueKind issueKind(JsonNode record) {
        JsonNode type = record.path("issue").path("type");
        if (!type.isTextual()) {
            return EewIssueKind.WARNING;
        }
        return "Warning".equalsIgnoreCase(type.asText()) ? EewIssueKind.WARNING : EewIssueKind.FORECAST;
    }

    // The feed encodes "unknown" as -1.
    private static Double knownValue(JsonNode node) {
        if (!node.isNumber()) {
            return null;
        }
        double value = node.asDouble();
        return value <= UNKNOWN_VALUE ? null : value;
    }
}
