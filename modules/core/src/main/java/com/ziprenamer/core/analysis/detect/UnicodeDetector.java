package com.ziprenamer.core.analysis.detect;

import com.ziprenamer.core.analysis.AnalysisWarnings.UnicodeIssue;
import com.ziprenamer.core.analysis.AnalysisWarnings.UnicodeIssueType;
import com.ziprenamer.types.ArchiveEntry;
import com.ziprenamer.util.Utf8;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;

public class UnicodeDetector extends Detector<UnicodeIssue> {

    static final String NFD_DETAILS = "Filename uses NFD normalization, may cause issues on Windows/Linux";
    static final String INVALID_DETAILS = "Invalid UTF-8 encoding detected";

    private final List<UnicodeIssue> issues = new ArrayList<>();

    @Override
    protected void inspect(ArchiveEntry entry) {
        String path = entry.path();
        String nfc = Normalizer.normalize(path, Normalizer.Form.NFC);
        String nfd = Normalizer.normalize(path, Normalizer.Form.NFD);
        if (!nfc.equals(nfd) && !path.equals(nfc)) {
            issues.add(new UnicodeIssue(path, UnicodeIssueType.NFC_NFD_MISMATCH, NFD_DETAILS));
        }
        if (!Utf8.roundTrips(path)) {
            issues.add(new UnicodeIssue(path, UnicodeIssueType.INVALID_SEQUENCE, INVALID_DETAILS));
        }
    }

    @Override
    protected List<UnicodeIssue> results() {
        return issues;
    }
}
