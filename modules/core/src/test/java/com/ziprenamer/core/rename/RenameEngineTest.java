package com.ziprenamer.core.rename;

import com.ziprenamer.core.rule.Rule;
import com.ziprenamer.core.rule.RuleGroup;
import com.ziprenamer.types.ArchiveEntry;
import com.ziprenamer.types.RenamedPath;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class RenameEngineTest {

    private final RenameEngine engine =
            new RenameEngine(Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));

    private static Rule.Numbering numbering(int start, int padding, String separator) {
        return new Rule.Numbering(start, padding, separator, Rule.Numbering.Position.END);
    }

    private static List<String> finalPaths(List<RenamedPath> renamed) {
        return renamed.stream().map(RenamedPath::finalPath).toList();
    }

    // --- properties ---

    @Test
    void noGroupsIsIdentity() {
        List<ArchiveEntry> entries = List.of(
                ArchiveEntry.directory("Photos/"),
                ArchiveEntry.directory("Photos/2024/"),
                ArchiveEntry.file("Photos/2024/img.JPG", 10),
                ArchiveEntry.file(".hidden", 1));

        List<RenamedPath> renamed = engine.rename(entries, List.of());

        assertThat(renamed).allSatisfy(r -> assertThat(r.isChanged()).isFalse());
        assertThat(finalPaths(renamed)).containsExactly(
                "Photos/", "Photos/2024/", "Photos/2024/img.JPG", ".hidden");
    }

    @Test
    void runsAreDeterministic() {
        List<ArchiveEntry> entries = List.of(
                ArchiveEntry.directory("a/"), ArchiveEntry.file("a/x.txt", 1), ArchiveEntry.file("y.txt", 1));
        List<RuleGroup> groups = List.of(
                RuleGroup.global("g", List.of(numbering(1, 2, "-"))),
                RuleGroup.folders("f", List.of(new Rule.Template("{name}_{date}"))));

        assertThat(engine.rename(entries, groups)).isEqualTo(engine.rename(entries, groups));
    }

    // --- documented examples ---

    @Test
    void extensionScopeIsCaseInsensitive() {
        List<RenamedPath> renamed = engine.rename(
                List.of(ArchiveEntry.file("a.TXT", 1)),
                List.of(RuleGroup.extension("e", ".txt", false, List.of(new Rule.Lowercase()))));

        assertThat(finalPaths(renamed)).containsExactly("a.txt");
    }

    @Test
    void extensionScopeWithTemplateOwningExtension() {
        List<RenamedPath> renamed = engine.rename(
                List.of(ArchiveEntry.file("A.TXT", 1)),
                List.of(RuleGroup.extension("e", ".txt", false,
                        List.of(new Rule.Template("{name}.{ext}"), new Rule.Lowercase()))));

        assertThat(finalPaths(renamed)).containsExactly("a.txt");
    }

    @Test
    void directoryRenamePropagatesToChildren() {
        List<RenamedPath> renamed = engine.rename(
                List.of(ArchiveEntry.directory("Photos/"), ArchiveEntry.file("Photos/img.jpg", 5)),
                List.of(RuleGroup.folders("f", List.of(new Rule.Prefix("new_")))));

        assertThat(renamed).containsExactly(
                new RenamedPath("Photos/", "new_Photos/"),
                new RenamedPath("Photos/img.jpg", "new_Photos/img.jpg"));
    }

    @Test
    void globalNumbering() {
        List<RenamedPath> renamed = engine.rename(
                List.of(ArchiveEntry.file("a.jpg", 1), ArchiveEntry.file("b.jpg", 1)),
                List.of(RuleGroup.global("g", List.of(numbering(1, 3, "_")))));

        assertThat(finalPaths(renamed)).containsExactly("a_001.jpg", "b_002.jpg");
    }

    // --- propagation ---

    @Test
    void nestedRenamesCompose() {
        List<ArchiveEntry> entries = List.of(
                ArchiveEntry.directory("Root/"),
                ArchiveEntry.directory("Root/Sub/"),
                ArchiveEntry.directory("Root/Sub/Deep/"),
                ArchiveEntry.file("Root/Sub/Deep/f.txt", 1),
                ArchiveEntry.file("Root/top.txt", 1));

        List<RenamedPath> renamed = engine.rename(entries,
                List.of(RuleGroup.folders("f", List.of(new Rule.Uppercase()))));

        assertThat(finalPaths(renamed)).containsExactly(
                "ROOT/", "ROOT/SUB/", "ROOT/SUB/DEEP/", "ROOT/SUB/DEEP/f.txt", "ROOT/top.txt");
    }

    @Test
    void implicitDirectoriesKeepTheirNames() {
        List<RenamedPath> renamed = engine.rename(
                List.of(ArchiveEntry.directory("a/b/"), ArchiveEntry.file("a/b/c.txt", 1)),
                List.of(RuleGroup.folders("f", List.of(new Rule.Suffix("2")))));

        assertThat(finalPaths(renamed)).containsExactly("a/b2/", "a/b2/c.txt");
    }

    @Test
    void countersAreSharedAcrossDirectoriesAndFilesOfOneGroup() {
        List<ArchiveEntry> entries = List.of(
                ArchiveEntry.file("docs/a.txt", 1),
                ArchiveEntry.directory("docs/"),
                ArchiveEntry.directory("docs/sub/"),
                ArchiveEntry.file("docs/b.txt", 1));

        List<RenamedPath> renamed = engine.rename(entries,
                List.of(RuleGroup.folder("p", "docs/", List.of(numbering(1, 1, "-")))));

        // directories are numbered first, then files in listing order
        assertThat(finalPaths(renamed)).containsExactly(
                "docs-1/a-3.txt", "docs-1/", "docs-1/sub-2/", "docs-1/b-4.txt");
    }

    @Test
    void groupsWithSameIdShareOneCounter() {
        List<ArchiveEntry> entries = List.of(
                ArchiveEntry.file("a.jpg", 1), ArchiveEntry.file("b.png", 1), ArchiveEntry.file("c.jpg", 1));
        List<RuleGroup> groups = List.of(
                RuleGroup.extension("n", "jpg", false, List.of(numbering(1, 1, "_"))),
                RuleGroup.extension("n", "png", false, List.of(numbering(1, 1, "_"))));

        assertThat(finalPaths(engine.rename(entries, groups))).containsExactly("a_1.jpg", "b_2.png", "c_3.jpg");
    }

    @Test
    void countersResetBetweenRuns() {
        List<ArchiveEntry> entries = List.of(ArchiveEntry.file("a.jpg", 1));
        List<RuleGroup> groups = List.of(RuleGroup.global("g", List.of(numbering(1, 1, "_"))));

        engine.rename(entries, groups);

        assertThat(finalPaths(engine.rename(entries, groups))).containsExactly("a_1.jpg");
    }

    @Test
    void emptyGroupsDoNotConsumeCounter() {
        List<ArchiveEntry> entries = List.of(ArchiveEntry.file("a.jpg", 1), ArchiveEntry.file("b.jpg", 1));
        List<RuleGroup> groups = List.of(
                RuleGroup.global("g", List.of()),
                RuleGroup.global("h", List.of(numbering(1, 1, "_"))));

        assertThat(finalPaths(engine.rename(entries, groups))).containsExactly("a_1.jpg", "b_2.jpg");
    }

    @Test
    void laterGroupsSeeEarlierResult() {
        List<RenamedPath> renamed = engine.rename(
                List.of(ArchiveEntry.file("My Photo.JPG", 1)),
                List.of(
                        RuleGroup.global("a", List.of(new Rule.Replace(" ", "_"))),
                        RuleGroup.extension("b", "jpg", false, List.of(new Rule.Lowercase()))));

        assertThat(finalPaths(renamed)).containsExactly("my_photo.jpg");
    }

    @Test
    void scopeUsesOriginalExtensionAfterTemplateChangesIt() {
        List<RenamedPath> renamed = engine.rename(
                List.of(ArchiveEntry.file("a.txt", 1)),
                List.of(
                        RuleGroup.global("a", List.of(new Rule.Template("{name}.{ext}.md"))),
                        RuleGroup.extension("b", "txt", false, List.of(new Rule.Suffix("!")))));

        // second group matched on .txt and splits the new base "a.txt.md" at its last dot
        assertThat(finalPaths(renamed)).containsExactly("a.txt!.md");
    }

    @Test
    void templateSeesRenamedParentAndRunDate() {
        List<RenamedPath> renamed = engine.rename(
                List.of(ArchiveEntry.directory("x/"), ArchiveEntry.directory("x/trip/"),
                        ArchiveEntry.file("x/trip/a.jpg", 1)),
                List.of(
                        RuleGroup.folder("f", "x/trip", List.of(new Rule.Uppercase())),
                        RuleGroup.global("g", List.of(new Rule.Template("{parent}-{depth}-{date}-{index}")))));

        assertThat(finalPaths(renamed)).containsExactly("x/", "x/TRIP/", "x/TRIP/TRIP-2-2024-05-01-001.JPG");
    }

    // --- sanitizing ---

    @Test
    void producedSeparatorsAreCutToLastSegment() {
        List<RenamedPath> renamed = engine.rename(
                List.of(ArchiveEntry.file("dir/a.txt", 1)),
                List.of(RuleGroup.global("g", List.of(new Rule.Prefix("../../etc/")))));

        assertThat(finalPaths(renamed)).containsExactly("dir/a.txt");
    }

    @Test
    void unusableNameFallsBackToPrevious() {
        List<RenamedPath> renamed = engine.rename(
                List.of(ArchiveEntry.directory("a/b/"), ArchiveEntry.file("a/b/c", 1)),
                List.of(RuleGroup.folders("f", List.of(new Rule.Template("..")))));

        assertThat(finalPaths(renamed)).containsExactly("a/b/", "a/b/c");
    }

    @Test
    void traversalSegmentsAreDropped() {
        List<RenamedPath> renamed = engine.rename(
                List.of(ArchiveEntry.file("../../evil.sh", 1), ArchiveEntry.file("a/./b//c.txt", 1)),
                List.of(RuleGroup.global("g", List.of(new Rule.Suffix("_x")))));

        assertThat(finalPaths(renamed)).containsExactly("evil_x.sh", "a/b/c_x.txt");
    }

    @Test
    void entriesWithoutSafeSegmentsAreDropped() {
        List<RenamedPath> renamed = engine.rename(
                List.of(ArchiveEntry.directory("../"), ArchiveEntry.file("..", 1),
                        ArchiveEntry.directory("./"), ArchiveEntry.file("ok.txt", 1)),
                List.of());

        assertThat(finalPaths(renamed)).containsExactly("", "", "", "ok.txt");
        assertThat(renamed).extracting(RenamedPath::isDropped)
                .containsExactly(true, true, true, false);
    }
}
