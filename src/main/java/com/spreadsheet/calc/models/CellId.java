package com.spreadsheet.calc.models;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Identifies a single grid position: column letters plus a 1-based row,
 * e.g. "a1", "c12", "aa3". Always lower case; equality is structural.
 * Column letters use bijective base 26 (a=0, z=25, aa=26, ...).
 */
public final class CellId implements Comparable<CellId> {

    private static final Pattern CELL_ID_PATTERN = Pattern.compile("^([a-z]+)(\\d+)$");

    private final int column;
    private final int row;

    public CellId(int column, int row) {
        if (column < 0 || row < 1) {
            throw new IllegalArgumentException("Bad cell coordinates: column=" + column + ", row=" + row);
        }
        this.column = column;
        this.row = row;
    }

    /**
     * Parses "B12" or "b12". Returns null for anything that isn't
     * letters followed by a positive row number; bounds are not checked here.
     */
    public static CellId parse(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = CELL_ID_PATTERN.matcher(text.trim().toLowerCase(Locale.ROOT));
        if (!matcher.matches()) {
            return null;
        }
        if (matcher.group(1).length() > 6) {
            return null;
        }
        int row;
        try {
            row = Integer.parseInt(matcher.group(2));
        } catch (NumberFormatException e) {
            return null;
        }
        if (row < 1) {
            return null;
        }
        return new CellId(columnIndex(matcher.group(1)), row);
    }

    public static int columnIndex(String letters) {
        int index = 0;
        for (char c : letters.toLowerCase(Locale.ROOT).toCharArray()) {
            index = index * 26 + (c - 'a' + 1);
        }
        return index - 1;
    }

    public static String columnName(int column) {
        StringBuilder sb = new StringBuilder();
        int n = column + 1;
        while (n > 0) {
            int rem = (n - 1) % 26;
            sb.append((char) ('a' + rem));
            n = (n - 1) / 26;
        }
        return sb.reverse().toString();
    }

    public int getColumn() {
        return column;
    }

    public int getRow() {
        return row;
    }

    @Override
    public int compareTo(CellId other) {
        if (column != other.column) {
            return Integer.compare(column, other.column);
        }
        return Integer.compare(row, other.row);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellId)) {
            return false;
        }
        CellId other = (CellId) o;
        return column == other.column && row == other.row;
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, row);
    }

    @Override
    public String toString() {
        return columnName(column) + row;
    }
}
