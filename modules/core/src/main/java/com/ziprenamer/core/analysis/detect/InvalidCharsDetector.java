package com.ziprenamer.core.analysis.detect;

import com.ziprenamer.core.analysis.AnalysisWarnings.InvalidChars;
import com.ziprenamer.core.analysis.Platform;
import com.ziprenamer.types.ArchiveEntry;
import com.ziprenamer.util.PathParts;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.IntPredicate;

/**
 * Finds characters each platform rejects in a file path, and Windows reserved
 * device names. The whole path is checked, so every nested file carries a macOS
 * warning for {@code /}.
 */
public class InvalidCharsDetector extends Detector<InvalidChars> {

    private static final Set<String> RESERVED_NAMES = Set.of(
            "CON", "PRN", "AUX", "NUL",
            "COM1", "COM2", "COM3", "COM4", "COM5", "COM6", "COM7", "COM8", "COM9",
            "LPT1", "LPT2", "LPT3", "LPT4", "LPT5", "LPT6", "LPT7", "LPT8", "LPT9");

    private static final IntPredicate WINDOWS = c -> c < 0x20 || "<>:\"|?*".indexOf(c) >= 0;
    private static final IntPredicate MACOS = c -> c == 0 || c == ':' || c == '/';
    private static final IntPredicate LINUX = c -> c == 0;

    private final List<InvalidChars> warnings = new ArrayList<>();

    @Override
    protected void inspect(ArchiveEntry entry) {
        String path = entry.path();
        check(path, Platform.WINDOWS, WINDOWS);
        check(path, Platform.MACOS, MACOS);
        check(path, Platform.LINUX, LINUX);

        String stem = PathParts.ofFile(path).stem();
        if (RESERVED_NAMES.contains(stem.toUpperCase(Locale.ROOT))) {
            warnings.add(new InvalidChars(path, List.of(InvalidChars.RESERVED_NAME), Platform.WINDOWS));
        }
    }

    @Override
    protected List<InvalidChars> results() {
        return warnings;
    }

    private void check(String path, Platform platform, IntPredicate forbidden) {
        Set<String> found = new LinkedHashSet<>();
        for (int i = 0; i < path.length(); i++) {
            char c = path.charAt(i);
            if (forbidden.test(c)) {
                found.add(render(c));
            }
        }
        if (!found.isEmpty()) {
            warnings.add(new InvalidChars(path, new ArrayList<>(found), platform));
        }
    }

    static String render(char c) {
        return c < 0x20 ? String.format("\\x%02x", (int) c) : String.valueOf(c);
    }
}
