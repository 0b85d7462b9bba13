package com.ziprenamer.core.service;

/**
 * Thrown when a container lists more entries than the configured cap.
 */
public class ArchiveTooLargeException extends RuntimeException {

    private final int entryCount;
    private final int limit;

    public ArchiveTooLargeException(String archive, int entryCount, int limit) {
        super("Archive " + archive + " has " + entryCount + " entries, limit is " + limit);
        this.entryCount = entryCount;
        this.limit = limit;
    }

    public int entryCount() {
        return entryCount;
    }

    public int limit() {
        return limit;
    }
}
