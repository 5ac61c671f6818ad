package com.crowd.geohash;

import com.crowd.exception.InvalidCellCharException;

import java.util.List;

/**
 * Computes the cells adjacent to a geohash cell at the same precision.
 *
 * The last character of a cell maps to its neighbor through a per-direction table
 * that depends on the parity of the cell length. When that character sits on the
 * edge of its parent cell the step also crosses into the parent's neighbor, so the
 * lookup walks back through the cell until a character that is not on the border.
 *
 * Longitude wraps at the antimeridian. Latitude does not: the north neighbor of a
 * cell touching the north pole (and the south neighbor at the south pole) lands on
 * the opposite side of the globe and is not spatially adjacent.
 */
public final class NeighborResolver {

    private static final int EVEN = 0;
    private static final int ODD = 1;

    // Indexed by [direction ordinal][parity][alphabet position of the current char]
    private static final int[][][] NEIGHBORS = new int[Direction.values().length][2][];
    private static final boolean[][][] BORDERS = new boolean[Direction.values().length][2][];

    static {
        String north = "p0r21436x8zb9dcf5h7kjnmqesgutwvy";
        String south = "14365h7k9dcfesgujnmqp0r2twvyx8zb";
        String east = "bc01fg45238967deuvhjyznpkmstqrwx";
        String west = "238967debc01fg45kmstqrwxuvhjyznp";

        // Odd-length cells swap the roles of latitude and longitude
        register(Direction.NORTH, north, east, "prxz", "bcfguvyz");
        register(Direction.SOUTH, south, west, "028b", "0145hjnp");
        register(Direction.EAST, east, north, "bcfguvyz", "prxz");
        register(Direction.WEST, west, south, "0145hjnp", "028b");
    }

    private NeighborResolver() {
    }

    private static void register(Direction direction, String evenNeighbors, String oddNeighbors,
                                 String evenBorder, String oddBorder) {
        NEIGHBORS[direction.ordinal()][EVEN] = neighborTable(evenNeighbors);
        NEIGHBORS[direction.ordinal()][ODD] = neighborTable(oddNeighbors);
        BORDERS[direction.ordinal()][EVEN] = borderTable(evenBorder);
        BORDERS[direction.ordinal()][ODD] = borderTable(oddBorder);
    }

    private static int[] neighborTable(String layout) {
        int[] table = new int[GeohashCodec.ALPHABET.length()];
        for (int k = 0; k < layout.length(); k++) {
            table[GeohashCodec.indexOf(layout.charAt(k))] = k;
        }
        return table;
    }

    private static boolean[] borderTable(String edge) {
        boolean[] table = new boolean[GeohashCodec.ALPHABET.length()];
        for (int k = 0; k < edge.length(); k++) {
            table[GeohashCodec.indexOf(edge.charAt(k))] = true;
        }
        return table;
    }

    /**
     * The cell next to the given one in a cardinal direction.
     *
     * @throws InvalidCellCharException if the cell is empty or malformed
     */
    public static String adjacent(String cell, Direction direction) {
        char[] chars = validated(cell);
        int d = direction.ordinal();

        for (int i = chars.length - 1; i >= 0; i--) {
            int parity = (i + 1) % 2 == 0 ? EVEN : ODD;
            int idx = GeohashCodec.indexOf(chars[i]);
            chars[i] = GeohashCodec.charAt(NEIGHBORS[d][parity][idx]);
            if (!BORDERS[d][parity][idx]) {
                break;
            }
        }

        return new String(chars);
    }

    /**
     * The eight surrounding cells in the order N, S, E, W, NE, NW, SE, SW.
     */
    public static List<String> neighbors(String cell) {
        String north = adjacent(cell, Direction.NORTH);
        String south = adjacent(cell, Direction.SOUTH);
        String east = adjacent(cell, Direction.EAST);
        String west = adjacent(cell, Direction.WEST);

        return List.of(
                north,
                south,
                east,
                west,
                adjacent(north, Direction.EAST),
                adjacent(north, Direction.WEST),
                adjacent(south, Direction.EAST),
                adjacent(south, Direction.WEST));
    }

    private static char[] validated(String cell) {
        if (cell.isEmpty()) {
            throw new InvalidCellCharException(cell, -1);
        }
        char[] chars = cell.toCharArray();
        for (int i = 0; i < chars.length; i++) {
            if (GeohashCodec.indexOf(chars[i]) < 0) {
                throw new InvalidCellCharException(cell, i);
            }
        }
        return chars;
    }
}
