package com.ziprenamer.types;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ArchiveEntryTest {

    @Test
    void normalizesBackslashes() {
        ArchiveEntry entry = ArchiveEntry.file("docs\\notes\\a.txt", 12);
        assertThat(entry.path()).isEqualTo("docs/notes/a.txt");
    }

    @Test
    void directoryGetsTrailingSlash() {
        assertThat(ArchiveEntry.directory("Photos").path()).isEqualTo("Photos/");
        assertThat(ArchiveEntry.directory("Photos/").path()).isEqualTo("Photos/");
    }

    @Test
    void trimmedPathDropsTrailingSlashes() {
        assertThat(ArchiveEntry.directory("Photos/2024//").trimmedPath()).isEqualTo("Photos/2024");
        assertThat(ArchiveEntry.file("a.txt", 1).trimmedPath()).isEqualTo("a.txt");
    }

    @Test
    void rejectsNullPath() {
        assertThatNullPointerException()
                .isThrownBy(() -> new ArchiveEntry(null, 0, false));
    }

    @Test
    void rejectsNegativeSize() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> ArchiveEntry.file("a.txt", -1))
                .withMessageContaining(">= 0");
    }
}
