package com.ziprenamer.core.analysis.detect;

import com.ziprenamer.core.analysis.AnalysisWarnings.InvalidChars;
import com.ziprenamer.core.analysis.Platform;
import com.ziprenamer.types.ArchiveEntry;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class InvalidCharsDetectorTest {

    private List<InvalidChars> detect(String... paths) {
        return new InvalidCharsDetector().detect(
                Arrays.stream(paths).map(p -> ArchiveEntry.file(p, 1)).toList(),
                new DetectorFailures());
    }

    @Test
    void reportsEachPlatformWithUniqueCharactersInOrder() {
        List<InvalidChars> warnings = detect("notes/a:b?c:d.txt");

        assertThat(warnings).extracting(InvalidChars::os).containsExactly(Platform.WINDOWS, Platform.MACOS);
        assertThat(warnings.get(0).invalidChars()).containsExactly(":", "?");
        assertThat(warnings.get(1).invalidChars()).containsExactly("/", ":");
    }

    @Test
    void controlCharactersAreRenderedAsHex() {
        List<InvalidChars> warnings = detect("tab\there\u001b.txt");

        assertThat(warnings).singleElement().satisfies(w -> {
            assertThat(w.os()).isEqualTo(Platform.WINDOWS);
            assertThat(w.invalidChars()).containsExactly("\\x09", "\\x1b");
        });
    }

    @Test
    void nulIsInvalidEverywhere() {
        assertThat(detect("a\u0000b"))
                .extracting(InvalidChars::os)
                .containsExactly(Platform.WINDOWS, Platform.MACOS, Platform.LINUX);
    }

    @Test
    void nestedPathsCarryMacSeparatorWarning() {
        assertThat(detect("dir/a.txt", "dir/b.txt", "top.txt"))
                .extracting(InvalidChars::path, InvalidChars::os, InvalidChars::invalidChars)
                .containsExactly(
                        tuple("dir/a.txt", Platform.MACOS, List.of("/")),
                        tuple("dir/b.txt", Platform.MACOS, List.of("/")));
    }

    @Test
    void reservedNamesIgnoreCaseAndExtension() {
        assertThat(detect("docs/lpt1.log", "aux", "Console.txt"))
                .filteredOn(w -> w.invalidChars().contains(InvalidChars.RESERVED_NAME))
                .extracting(InvalidChars::path)
                .containsExactly("docs/lpt1.log", "aux");
    }

    @Test
    void directoriesAreSkipped() {
        List<InvalidChars> warnings = new InvalidCharsDetector().detect(
                List.of(ArchiveEntry.directory("what?/")), new DetectorFailures());

        assertThat(warnings).isEmpty();
    }
}
