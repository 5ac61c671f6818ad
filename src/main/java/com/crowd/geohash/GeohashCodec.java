package com.crowd.geohash;

import com.crowd.exception.InvalidCellCharException;

import java.util.Arrays;

/**
 * Geohash encoding and decoding over the standard base-32 alphabet.
 *
 * Encoding bisects the longitude and latitude ranges alternately, longitude first,
 * and packs every five decisions into one character. A coordinate lying exactly on a
 * bisection midpoint falls into the lower half.
 *
 * Coordinates are not validated here; callers pass latitude in [-90, 90] and
 * longitude in [-180, 180].
 */
public final class GeohashCodec {

    public static final String ALPHABET = "0123456789bcdefghjkmnpqrstuvwxyz";

    public static final int MIN_PRECISION = 1;
    public static final int MAX_PRECISION = 12;

    /**
     * First character sorting after every alphabet character, used to close prefix ranges
     */
    public static final char PREFIX_RANGE_SENTINEL = (char) ('z' + 1);

    private static final char[] BASE32 = ALPHABET.toCharArray();

    // Inverse lookup by ASCII code, -1 for characters outside the alphabet
    private static final byte[] BASE32_INV = new byte['z' + 1];

    static {
        Arrays.fill(BASE32_INV, (byte) -1);
        for (int i = 0; i < BASE32.length; i++) {
            BASE32_INV[BASE32[i]] = (byte) i;
        }
    }

    private GeohashCodec() {
    }

    /**
     * Encode a coordinate into a cell of the given number of characters.
     */
    public static String encode(double latitude, double longitude, int precision) {
        if (precision < MIN_PRECISION || precision > MAX_PRECISION) {
            throw new IllegalArgumentException("Geohash precision must be between "
                    + MIN_PRECISION + " and " + MAX_PRECISION + ", got " + precision);
        }

        double latMin = -90.0;
        double latMax = 90.0;
        double lngMin = -180.0;
        double lngMax = 180.0;

        char[] cell = new char[precision];
        boolean longitudeBit = true;
        int bits = 0;
        int idx = 0;
        int length = 0;

        while (length < precision) {
            if (longitudeBit) {
                double mid = (lngMin + lngMax) / 2;
                if (longitude > mid) {
                    idx = (idx << 1) | 1;
                    lngMin = mid;
                } else {
                    idx = idx << 1;
                    lngMax = mid;
                }
            } else {
                double mid = (latMin + latMax) / 2;
                if (latitude > mid) {
                    idx = (idx << 1) | 1;
                    latMin = mid;
                } else {
                    idx = idx << 1;
                    latMax = mid;
                }
            }
            longitudeBit = !longitudeBit;

            if (++bits == 5) {
                cell[length++] = BASE32[idx];
                bits = 0;
                idx = 0;
            }
        }

        return new String(cell);
    }

    /**
     * Decode a cell into its centroid and half-extent error bounds.
     *
     * @throws InvalidCellCharException if the cell is empty or has a character outside the alphabet
     */
    public static DecodedCell decode(String cell) {
        if (cell.isEmpty()) {
            throw new InvalidCellCharException(cell, -1);
        }

        double latMin = -90.0;
        double latMax = 90.0;
        double lngMin = -180.0;
        double lngMax = 180.0;
        boolean longitudeBit = true;

        for (int i = 0; i < cell.length(); i++) {
            int idx = indexOf(cell.charAt(i));
            if (idx < 0) {
                throw new InvalidCellCharException(cell, i);
            }

            for (int n = 4; n >= 0; n--) {
                int bit = (idx >> n) & 1;
                if (longitudeBit) {
                    double mid = (lngMin + lngMax) / 2;
                    if (bit == 1) {
                        lngMin = mid;
                    } else {
                        lngMax = mid;
                    }
                } else {
                    double mid = (latMin + latMax) / 2;
                    if (bit == 1) {
                        latMin = mid;
                    } else {
                        latMax = mid;
                    }
                }
                longitudeBit = !longitudeBit;
            }
        }

        double latitude = (latMin + latMax) / 2;
        double longitude = (lngMin + lngMax) / 2;
        return new DecodedCell(cell, latitude, longitude, latMax - latitude, lngMax - longitude);
    }

    /**
     * Position of a character in the alphabet, or -1 when it is not part of it.
     */
    public static int indexOf(char c) {
        return c < BASE32_INV.length ? BASE32_INV[c] : -1;
    }

    /**
     * Alphabet character at the given position.
     */
    public static char charAt(int index) {
        return BASE32[index];
    }

    /**
     * Exclusive upper bound of the lexicographic range holding every cell that starts with the prefix.
     */
    public static String prefixUpperBound(String prefix) {
        return prefix + PREFIX_RANGE_SENTINEL;
    }

    /**
     * Shorten a cell to at most the given precision.
     */
    public static String truncate(String cell, int precision) {
        return cell.length() <= precision ? cell : cell.substring(0, precision);
    }
}
