package com.cruisetracker.tracker.infrastructure.selector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.cruisetracker.tracker.domain.exceptions.SelectorConfigException;
import com.cruisetracker.tracker.support.Fixtures;
import com.cruisetracker.tracker.support.TestProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.FileSystemResource;

class FileSelectorConfigSourceTest {

    private static final String MINIMAL = """
            {
              "defaultCurrency": "GBP",
              "structured": { "priceKeys": ["price"] },
              "dom": { "price": "%s" },
              "regex": { "price": "%s" }
            }
            """;

    @TempDir
    Path directory;

    private Path writeSelectors(String content) throws IOException {
        var file = directory.resolve("selectors.json");
        Files.writeString(file, content);
        return file;
    }

    private static void touchLater(Path file) throws IOException {
        var modified = Files.getLastModifiedTime(file).toInstant().plus(Duration.ofSeconds(10));
        Files.setLastModifiedTime(file, FileTime.from(modified));
    }

    private FileSelectorConfigSource sourceFor(Path file) {
        return new FileSelectorConfigSource(new FileSystemResource(file), "file:" + file);
    }

    @Nested
    class Loading {

        @Test
        void shouldLoadBundledSelectorsFromClasspath() {
            // given
            var source = new FileSelectorConfigSource(new DefaultResourceLoader(), TestProperties.defaults());

            // when
            var config = source.current();

            // then
            assertThat(config.defaultCurrency()).isEqualTo("GBP");
            assertThat(config.structured().priceKeys()).contains("price", "lowPrice");
            assertThat(config.dom().price()).isNotBlank();
            assertThat(config.regex().price()).isNotBlank();
        }

        @Test
        void shouldReturnSameInstanceWhileFileIsUnchanged() throws IOException {
            // given
            var source = sourceFor(writeSelectors(Fixtures.bundledSelectorsText()));

            // when
            var first = source.current();
            var second = source.current();

            // then
            assertThat(second).isSameAs(first);
        }

        @Test
        void shouldFailWhenFileIsMissing() {
            // given
            var source = sourceFor(directory.resolve("absent.json"));

            // when / then
            assertThatThrownBy(source::current)
                    .isInstanceOf(SelectorConfigException.class)
                    .hasMessageContaining("unreadable");
        }

        @Test
        void shouldRejectUncompilableRegex() throws IOException {
            // given
            var source = sourceFor(writeSelectors(MINIMAL.formatted(".price", "([0-9")));

            // when / then
            assertThatThrownBy(source::current)
                    .isInstanceOf(SelectorConfigException.class)
                    .hasMessageContaining("invalid regex '([0-9'");
        }

        @Test
        void shouldRejectConfigWithoutDomPrice() throws IOException {
            // given
            var content = """
                    {
                      "defaultCurrency": "GBP",
                      "structured": { "priceKeys": ["price"] },
                      "dom": { "ship": ".ship" },
                      "regex": { "price": "(\\\\d+)" }
                    }
                    """;
            var source = sourceFor(writeSelectors(content));

            // when / then
            assertThatThrownBy(source::current)
                    .isInstanceOf(SelectorConfigException.class)
                    .hasMessageContaining("dom.price is required");
        }
    }

    @Nested
    class HotReload {

        @Test
        void shouldPickUpEditedFile() throws IOException {
            // given
            var file = writeSelectors(Fixtures.bundledSelectorsText());
            var source = sourceFor(file);
            assertThat(source.current().defaultCurrency()).isEqualTo("GBP");

            // when
            Files.writeString(file, Fixtures.bundledSelectorsText()
                    .replace("\"defaultCurrency\": \"GBP\"", "\"defaultCurrency\": \"USD\""));
            touchLater(file);

            // then
            assertThat(source.current().defaultCurrency()).isEqualTo("USD");
        }

        @Test
        void shouldKeepPreviousConfigWhenEditIsBroken() throws IOException {
            // given
            var file = writeSelectors(Fixtures.bundledSelectorsText());
            var source = sourceFor(file);
            var loaded = source.current();

            // when
            Files.writeString(file, "{ \"defaultCurrency\": ");
            touchLater(file);

            // then
            assertThat(source.current()).isSameAs(loaded);
        }

        @Test
        void shouldKeepPreviousConfigWhenEditIsInvalid() throws IOException {
            // given
            var file = writeSelectors(Fixtures.bundledSelectorsText());
            var source = sourceFor(file);
            var loaded = source.current();

            // when
            Files.writeString(file, MINIMAL.formatted(".price", "[unclosed"));
            touchLater(file);

            // then
            assertThat(source.current()).isSameAs(loaded);
        }
    }
}
