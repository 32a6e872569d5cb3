package io.mvfm.core.model;

import java.util.Objects;

/**
 * Mints node identifiers: strings over {@code a}..{@code z}, advanced by a base-26 increment with
 * carry ({@code "z" -> "aa"}, {@code "az" -> "ba"}, {@code "zz" -> "aaa"}). Identifiers have no
 * length bound, so graph size never overflows a numeric counter.
 */
public final class NodeIds {

    /** The first identifier an elaboration pass allocates. */
    public static final String FIRST = "a";

    private NodeIds() {}

    /**
     * Returns the identifier that follows {@code current}. The empty string is followed by
     * {@code "a"}.
     *
     * @param current the current identifier, lowercase letters only
     * @return the next identifier
     * @throws IllegalArgumentException if {@code current} contains a character outside a..z
     */
    public static String increment(String current) {
        Objects.requireNonNull(current, "current must not be null");
        char[] digits = current.toCharArray();
        for (char c : digits) {
            if (c < 'a' || c > 'z') {
                throw new IllegalArgumentException("Node id must contain only a-z, got: '" + current + "'");
            }
        }
        int i = digits.length - 1;
        while (i >= 0 && digits[i] == 'z') {
            digits[i] = 'a';
            i--;
        }
        if (i < 0) {
            // every digit carried out: grow by one position
            return "a" + new String(digits);
        }
        digits[i]++;
        return new String(digits);
    }

    /**
     * Orders identifiers by allocation order: shorter first, then lexicographically. Alias keys
     * ({@code @name}) sort after every node id.
     */
    public static int compare(String left, String right) {
        boolean leftAlias = left.startsWith("@");
        boolean rightAlias = right.startsWith("@");
        if (leftAlias != rightAlias) {
            return leftAlias ? 1 : -1;
        }
        if (left.length() != right.length()) {
            return Integer.compare(left.length(), right.length());
        }
        return left.compareTo(right);
    }
}
