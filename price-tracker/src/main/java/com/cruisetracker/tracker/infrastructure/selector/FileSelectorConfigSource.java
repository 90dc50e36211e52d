package com.cruisetracker.tracker.infrastructure.selector;

import com.cruisetracker.common.json.JacksonConfig;
import com.cruisetracker.tracker.application.config.TrackerProperties;
import com.cruisetracker.tracker.domain.exceptions.SelectorConfigException;
import com.cruisetracker.tracker.domain.extraction.SelectorConfig;
import com.cruisetracker.tracker.domain.extraction.SelectorConfigSource;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Loads the selector file ({@code classpath:} or {@code file:} location) and re-reads it whenever its
 * modification time changes. A broken edit keeps the previous configuration in service.
 */
@Slf4j
@Component
public class FileSelectorConfigSource implements SelectorConfigSource {

    private static final long UNKNOWN_MODIFICATION = -1L;

    private final Resource resource;
    private final String location;
    private final ObjectMapper objectMapper = JacksonConfig.createObjectMapper();

    private SelectorConfig current;
    private long loadedModification = Long.MIN_VALUE;

    public FileSelectorConfigSource(ResourceLoader resourceLoader, TrackerProperties properties) {
        this(resourceLoader.getResource(properties.extraction().selectorFile()), properties.extraction().selectorFile());
    }

    FileSelectorConfigSource(Resource resource, String location) {
        this.resource = resource;
        this.location = location;
    }

    @Override
    public synchronized SelectorConfig current() {
        var modification = lastModified();
        if (current != null && modification == loadedModification) {
            return current;
        }
        try {
            var loaded = load();
            current = loaded;
            loadedModification = modification;
            log.info("selectors.loaded: location={}, modified={}", location, modification);
        } catch (IOException | JacksonException e) {
            if (current == null) {
                throw SelectorConfigException.unreadable(location, e);
            }
            log.warn("selectors.reload-failed: location={}, reason={}, keeping previous configuration", location, e.getMessage());
        } catch (SelectorConfigException e) {
            if (current == null) {
                throw e;
            }
            log.warn("selectors.reload-failed: location={}, reason={}, keeping previous configuration", location, e.getMessage());
        }
        return current;
    }

    private SelectorConfig load() throws IOException {
        SelectorConfig loaded;
        try (var in = resource.getInputStream()) {
            loaded = objectMapper.readValue(in, SelectorConfig.class);
        }
        if (loaded == null) {
            throw SelectorConfigException.invalid(location, "empty document");
        }
        var problems = new ArrayList<>(loaded.problems());
        if (loaded.regex() != null) {
            problems.addAll(uncompilable(loaded.regex()));
        }
        if (!problems.isEmpty()) {
            throw SelectorConfigException.invalid(location, String.join("; ", problems));
        }
        return loaded;
    }

    private static List<String> uncompilable(SelectorConfig.Regex regex) {
        var problems = new ArrayList<String>();
        for (var pattern : new String[]{regex.price(), regex.ship(), regex.departurePort(), regex.nights(), regex.sailDate(), regex.cabin()}) {
            if (pattern == null) {
                continue;
            }
            try {
                Pattern.compile(pattern);
            } catch (PatternSyntaxException e) {
                problems.add("invalid regex '" + pattern + "': " + e.getDescription());
            }
        }
        return problems;
    }

    private long lastModified() {
        try {
            return resource.lastModified();
        } catch (IOException e) {
            log.debug("Modification time unavailable for {}: {}", location, e.getMessage());
            return UNKNOWN_MODIFICATION;
        }
    }
}
