package com.libragraph.pack.util;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntPredicate;

/**
 * Forward scan for the next plausible anchor in a byte array.
 *
 * <p>An anchor is any offset accepted by a caller-supplied predicate. Every
 * search is bounded: at most {@code window} candidate offsets are tested,
 * starting at {@code from}. Literal-pattern searches are the special case
 * where the predicate is "pattern starts here".
 */
public final class AnchorScanner {

    /** Window size that covers the rest of the array. */
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    private AnchorScanner() {
    }

    /**
     * Returns the first offset in {@code [from, from + window)} accepted by
     * {@code isAnchor}, or -1 if none is.
     */
    public static int find(byte[] data, int from, int window, IntPredicate isAnchor) {
        if (from < 0) {
            from = 0;
        }
        long end = Math.min((long) data.length, (long) from + window);
        for (int offset = from; offset < end; offset++) {
            if (isAnchor.test(offset)) {
                return offset;
            }
        }
        return -1;
    }

    /**
     * Returns the first occurrence of {@code pattern} at or after {@code from}, or -1.
     */
    public static int indexOf(byte[] data, byte[] pattern, int from) {
        return indexOf(data, pattern, from, data.length);
    }

    /**
     * Returns the first occurrence of {@code pattern} that starts in {@code [from, to)}, or -1.
     * The match itself may extend past {@code to}.
     */
    public static int indexOf(byte[] data, byte[] pattern, int from, int to) {
        int start = Math.max(from, 0);
        int window = Math.max(0, Math.min(to, data.length) - start);
        return find(data, start, window, offset -> matchesAt(data, offset, pattern));
    }

    /**
     * Returns every non-overlapping occurrence of {@code pattern}, in order.
     */
    public static List<Integer> findAll(byte[] data, byte[] pattern) {
        List<Integer> positions = new ArrayList<>();
        int pos = indexOf(data, pattern, 0);
        while (pos != -1) {
            positions.add(pos);
            pos = indexOf(data, pattern, pos + pattern.length);
        }
        return positions;
    }

    /**
     * True if {@code pattern} is present in full at {@code pos}.
     */
    public static boolean matchesAt(byte[] data, int pos, byte[] pattern) {
        if (pos < 0 || pattern.length == 0 || pos + pattern.length > data.length) {
            return false;
        }
        for (int i = 0; i < pattern.length; i++) {
            if (data[pos + i] != pattern[i]) {
                return false;
            }
        }
        return true;
    }
}
