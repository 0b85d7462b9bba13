package com.ziprenamer.core.rename;

import com.ziprenamer.core.rule.RuleGroup;
import com.ziprenamer.core.rule.RuleScope;
import com.ziprenamer.types.ArchiveEntry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ScopeMatcherTest {

    private final ScopeMatcher matcher = new ScopeMatcher();

    private static final ArchiveEntry FILE = ArchiveEntry.file("docs/Report.PDF", 10);
    private static final ArchiveEntry DIR = ArchiveEntry.directory("docs/old/");

    @Test
    void globalMatchesFilesOnly() {
        RuleGroup group = RuleGroup.global("g", List.of());

        assertThat(matcher.matches(group, FILE)).isTrue();
        assertThat(matcher.matches(group, DIR)).isFalse();
    }

    @Test
    void foldersMatchesDirectoriesOnly() {
        RuleGroup group = RuleGroup.folders("f", List.of());

        assertThat(matcher.matches(group, FILE)).isFalse();
        assertThat(matcher.matches(group, DIR)).isTrue();
    }

    @Test
    void unscopedGroupMatchesFilesAndDirectories() {
        RuleGroup group = new RuleGroup("u", RuleScope.ANY, "", false, List.of());

        assertThat(matcher.matches(group, FILE)).isTrue();
        assertThat(matcher.matches(group, DIR)).isTrue();
        assertThat(matcher.matches(group, ArchiveEntry.directory("top/"))).isTrue();
    }

    @Test
    void extensionMatchIsCaseInsensitiveWithOrWithoutDot() {
        assertThat(matcher.matches(RuleGroup.extension("e", "pdf", false, List.of()), FILE)).isTrue();
        assertThat(matcher.matches(RuleGroup.extension("e", ".Pdf", false, List.of()), FILE)).isTrue();
        assertThat(matcher.matches(RuleGroup.extension("e", "txt", false, List.of()), FILE)).isFalse();
    }

    @Test
    void excludeInvertsExtensionButNeverSelectsDirectories() {
        RuleGroup notTxt = RuleGroup.extension("e", "txt", true, List.of());

        assertThat(matcher.matches(notTxt, FILE)).isTrue();
        assertThat(matcher.matches(notTxt, ArchiveEntry.file("a.txt", 1))).isFalse();
        assertThat(matcher.matches(notTxt, DIR)).isFalse();
    }

    @Test
    void extensionlessFileMatchesExcludedExtension() {
        RuleGroup notTxt = RuleGroup.extension("e", "txt", true, List.of());

        assertThat(matcher.matches(notTxt, ArchiveEntry.file("README", 1))).isTrue();
        assertThat(matcher.matches(notTxt, ArchiveEntry.file(".txt", 1))).isTrue();
    }

    @Test
    void folderMatchesFilesAndDirectoriesUnderPrefix() {
        RuleGroup group = RuleGroup.folder("p", "docs\\", List.of());

        assertThat(matcher.matches(group, FILE)).isTrue();
        assertThat(matcher.matches(group, DIR)).isTrue();
        assertThat(matcher.matches(group, ArchiveEntry.file("other/a.txt", 1))).isFalse();
    }

    @Test
    void topLevelEntriesAreMatched() {
        assertThat(matcher.matches(RuleGroup.global("g", List.of()), ArchiveEntry.file("a.txt", 1))).isTrue();
        assertThat(matcher.matches(RuleGroup.folders("f", List.of()), ArchiveEntry.directory("Photos/"))).isTrue();
    }

    @Test
    void groupRequiresScopeValue() {
        assertThatThrownBy(() -> RuleGroup.folder("p", "", List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("folder");
    }
}
