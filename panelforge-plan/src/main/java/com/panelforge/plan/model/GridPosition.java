package com.panelforge.plan.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * Panel address inside the master grid: 0-based {@code row} and {@code col}, origin top-left.
 * Serialized as the two-element JSON array {@code [row, col]}; note the inverse order of
 * {@link GridSpecification}'s {@code "CxR"} text form.
 */
public final class GridPosition {

    private final int row;
    private final int col;

    public GridPosition(int row, int col) {
        this.row = row;
        this.col = col;
    }

    /** Reads the {@code [row, col]} JSON array form. */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static GridPosition fromArray(int[] rowCol) {
        if (rowCol == null || rowCol.length != 2) {
            throw new IllegalArgumentException("grid_position must be a two-element array [row, col]");
        }
        return new GridPosition(rowCol[0], rowCol[1]);
    }

    @JsonValue
    public int[] toArray() {
        return new int[]{row, col};
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GridPosition that = (GridPosition) o;
        return row == that.row && col == that.col;
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, col);
    }

    @Override
    public String toString() {
        return "[row=" + row + ", col=" + col + "]";
    }
}
