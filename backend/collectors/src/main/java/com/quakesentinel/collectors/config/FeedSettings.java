package com.quakesentinel.collectors.config;

import com.quakesentinel.core.model.FeedType;

import java.time.Duration;

public record FeedSettings(
        String baseUrl,
        int historyLimit,
        int quakeCode,
        int tsunamiCode,
        int eewCode,
        Duration requestTimeout,
        Duration connectTimeout,
        String userAgent
) {
    public static final String DEFAULT_BASE_URL = "https://api.p2pquake.net/v2/history";
    public static final String DEFAULT_USER_AGENT = "quake-sentinel/0.1";

    public FeedSettings {
        baseUrl = baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : baseUrl;
        historyLimit = historyLimit <= 0 ? 3 : historyLimit;
        quakeCode = quakeCode <= 0 ? 551 : quakeCode;
        tsunamiCode = tsunamiCode <= 0 ? 552 : tsunamiCode;
        eewCode = eewCode <= 0 ? 556 : eewCode;
        requestTimeout = requestTimeout == null ? Duration.ofSeconds(4) : requestTimeout;
        connectTimeout = connectTimeout == null ? Duration.ofSeconds(3) : connectTimeout;
        userAgent = userAgent == null || userAgent.isBlank() ? DEFAULT_USER_AGENT : userAgent;
    }

    public static FeedSettings defaults() {
        return new FeedSettings(null, 0, 0, 0, 0, null, null, null);
    }

    public FeedSettings withBaseUrl(String url) {
        return new FeedSettings(url, historyLimit, quakeCode, tsunamiCode, eewCode, requestTimeout, connectTimeout, userAgent);
    }

    public int codeFor(FeedType feedType) {
        return switch (feedType) {
            case QUAKE -> quakeCode;
            case TSUNAMI -> tsunamiCode;
            case EEW -> eewCode;
        };
    }
}
