package dev.mesh2dm.parse;

/**
 * A mesh node parsed from an {@code ND} card.
 */
public record NodeRecord(long id, double x, double y, double z) {
}
