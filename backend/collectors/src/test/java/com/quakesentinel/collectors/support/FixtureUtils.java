package com.quakesentinel.collectors.support;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

public final class FixtureUtils {
    private FixtureUtils() {
    }

    public static String fixture(String relativePath) {
        try (InputStream in = FixtureUtils.class.getClassLoader().getResourceAsStream(relativePath)) {
            if (in == null) {
                throw new IllegalArgumentException("Fixture not found: " + relativePath);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read fixture: " + relativePath, e);
        }
    }
}
