package com.cruisetracker.tracker.support;

import com.cruisetracker.common.json.JacksonConfig;
import com.cruisetracker.tracker.domain.extraction.SelectorConfig;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

public final class Fixtures {

    private Fixtures() {
    }

    public static String read(String name) {
        try (var in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("Missing fixture " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** The bundled selector file shipped in the main resources. */
    public static SelectorConfig bundledSelectors() {
        try (var in = Fixtures.class.getResourceAsStream("/selectors.json")) {
            return JacksonConfig.createObjectMapper().readValue(in, SelectorConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static String bundledSelectorsText() {
        try (var in = Fixtures.class.getResourceAsStream("/selectors.json")) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
