package com.crowd.exception;

/**
 * Raised when a geohash cell contains a character outside the base-32 alphabet.
 * Not retryable: the input itself is malformed.
 */
public class InvalidCellCharException extends IllegalArgumentException {

    private final String cell;
    private final int position;

    public InvalidCellCharException(String cell, int position) {
        super(position < 0
                ? "Empty geohash cell"
                : String.format("Invalid geohash character '%c' at position %d in '%s'",
                                cell.charAt(position), position, cell));
        this.cell = cell;
        this.position = position;
    }

    public String getCell() {
        return cell;
    }

    public int getPosition() {
        return position;
    }
}
