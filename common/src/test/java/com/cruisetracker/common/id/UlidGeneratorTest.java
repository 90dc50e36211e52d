package com.cruisetracker.common.id;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class UlidGeneratorTest {

    @Test
    void generateReturns26CharString() {
        assertThat(UlidGenerator.generate()).hasSize(26);
    }

    @Test
    void generateUsesOnlyCrockfordBase32Characters() {
        assertThat(UlidGenerator.generate()).matches("^[0-7][0-9A-HJKMNP-TV-Z]{25}$");
    }

    @Test
    void generatedUlidsAreUnique() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            ids.add(UlidGenerator.generate());
        }
        assertThat(ids).hasSize(1000);
    }

    @Test
    void ulidsSortByTimestamp() {
        var earlier = UlidGenerator.generate(Instant.parse("2026-03-01T10:00:00Z"));
        var later = UlidGenerator.generate(Instant.parse("2026-03-01T10:00:00.001Z"));

        assertThat(earlier.compareTo(later)).isLessThan(0);
    }

    @Test
    void timestampPrefixIsStableForSameInstant() {
        var instant = Instant.parse("2026-03-01T10:00:00Z");

        var first = UlidGenerator.generate(instant);
        var second = UlidGenerator.generate(instant);

        assertThat(first.substring(0, 10)).isEqualTo(second.substring(0, 10));
    }

    @Test
    void epochEncodesAsZeroTimestamp() {
        assertThat(UlidGenerator.generate(Instant.EPOCH)).startsWith("0000000000");
    }
}
