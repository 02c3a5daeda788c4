package org.resultparity.canonical;

/**
 * One limit as found in the source document, before comparator normalization.
 *
 * @param comparator raw comparator token, possibly {@code null}
 * @param value raw bound or expected value, possibly {@code null}
 */
public record LimitEntry(String comparator, String value) {
}
