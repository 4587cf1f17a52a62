package dev.fileops.engine.numbering;

/**
 * Persistable view of one numbering counter.
 * @param directory absolute directory the counter belongs to
 * @param baseName base name without suffix or extension
 * @param highest highest number issued in the current width
 * @param width digit width currently used for the base name
 */
public record CounterSnapshot(String directory, String baseName, long highest, int width) {
}
