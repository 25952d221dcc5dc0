package com.panelforge.plan.model;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed grid shape. The text form is {@code "CxR"}: <b>columns first</b>, then rows
 * (e.g. {@code "3x2"} is three columns and two rows). Both must be positive integers.
 */
public final class GridSpecification {

    private static final Pattern FORMAT = Pattern.compile("^(\\d+)[xX](\\d+)$");

    /** Appended to every parse error so transposed axes are easy to spot. */
    public static final String WORKED_EXAMPLE =
            "expected \"CxR\" (columns x rows), e.g. \"3x2\" = 3 columns, 2 rows; "
                    + "grid_position is [row, col] with row < 2 and col < 3";

    private final int cols;
    private final int rows;

    public GridSpecification(int cols, int rows) {
        if (cols <= 0 || rows <= 0) {
            throw new IllegalArgumentException("grid columns and rows must be positive (cols=" + cols
                    + ", rows=" + rows + "); " + WORKED_EXAMPLE);
        }
        this.cols = cols;
        this.rows = rows;
    }

    /**
     * Parses {@code "CxR"}. Throws {@link IllegalArgumentException} for a missing dimension, zero,
     * non-numeric or otherwise malformed value; nothing is partially parsed.
     */
    public static GridSpecification parse(String spec) {
        if (spec == null || spec.isBlank()) {
            throw new IllegalArgumentException("grid_specification is missing; " + WORKED_EXAMPLE);
        }
        Matcher m = FORMAT.matcher(spec.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("grid_specification \"" + spec + "\" is malformed; " + WORKED_EXAMPLE);
        }
        try {
            return new GridSpecification(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("grid_specification \"" + spec + "\" has an out-of-range dimension; "
                    + WORKED_EXAMPLE, e);
        }
    }

    public int getCols() {
        return cols;
    }

    public int getRows() {
        return rows;
    }

    /** Whether {@code position} addresses a cell of this grid. */
    public boolean contains(GridPosition position) {
        return position != null
                && position.getRow() >= 0 && position.getRow() < rows
                && position.getCol() >= 0 && position.getCol() < cols;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GridSpecification that = (GridSpecification) o;
        return cols == that.cols && rows == that.rows;
    }

    @Override
    public int hashCode() {
        return Objects.hash(cols, rows);
    }

    @Override
    public String toString() {
        return cols + "x" + rows;
    }
}
