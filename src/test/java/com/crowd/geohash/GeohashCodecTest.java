package com.crowd.geohash;

import com.crowd.exception.InvalidCellCharException;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GeohashCodecTest {
    
    @Test
    void testEncodeKnownLocation() {
        assertEquals("u4pruydqqvj", GeohashCodec.encode(57.64911, 10.40744, 11));
        assertEquals("dr5regw3p", GeohashCodec.encode(40.7128, -74.0060, 9));
    }
    
    @Test
    void testEncodeIsPrefixConsistent() {
        String full = GeohashCodec.encode(40.7128, -74.0060, 12);
        for (int precision = 1; precision <= 12; precision++) {
            assertEquals(full.substring(0, precision), GeohashCodec.encode(40.7128, -74.0060, precision));
        }
    }
    
    @Test
    void testMidpointGoesToLowerHalf() {
        assertEquals("7", GeohashCodec.encode(0, 0, 1));
        assertEquals("7zzzz", GeohashCodec.encode(0, 0, 5));
    }
    
    @Test
    void testEncodeCorners() {
        assertEquals("000", GeohashCodec.encode(-90, -180, 3));
        assertEquals("zzz", GeohashCodec.encode(90, 180, 3));
    }
    
    @Test
    void testEncodeRejectsPrecisionOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> GeohashCodec.encode(0, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> GeohashCodec.encode(0, 0, 13));
    }
    
    @Test
    void testDecodeKnownCell() {
        DecodedCell cell = GeohashCodec.decode("ezs42");
        
        assertEquals(42.60498046875, cell.getLatitude(), 1e-12);
        assertEquals(-5.60302734375, cell.getLongitude(), 1e-12);
        assertEquals(0.02197265625, cell.getLatitudeError(), 1e-12);
        assertEquals(0.02197265625, cell.getLongitudeError(), 1e-12);
    }
    
    @Test
    void testDecodedCellContainsEncodedPoint() {
        double[][] points = {{57.64911, 10.40744}, {-33.8688, 151.2093}, {0.0001, -0.0001}, {89.9, -179.9}};
        for (double[] point : points) {
            for (int precision = 1; precision <= 12; precision++) {
                DecodedCell cell = GeohashCodec.decode(GeohashCodec.encode(point[0], point[1], precision));
                assertTrue(cell.contains(point[0], point[1]),
                        "cell " + cell.getCell() + " should contain " + point[0] + "," + point[1]);
            }
        }
    }
    
    @Test
    void testLongerCellHasSmallerError() {
        DecodedCell coarse = GeohashCodec.decode("dr5");
        DecodedCell fine = GeohashCodec.decode("dr5regw3p");
        
        assertTrue(fine.getLatitudeError() < coarse.getLatitudeError());
        assertTrue(fine.getLongitudeError() < coarse.getLongitudeError());
    }
    
    @Test
    void testDecodeRejectsInvalidCharacters() {
        InvalidCellCharException e = assertThrows(InvalidCellCharException.class, () -> GeohashCodec.decode("ezs4a"));
        assertEquals(4, e.getPosition());
        assertEquals("ezs4a", e.getCell());
        
        // Upper case is not part of the alphabet
        assertEquals(0, assertThrows(InvalidCellCharException.class, () -> GeohashCodec.decode("EZS42")).getPosition());
        assertThrows(InvalidCellCharException.class, () -> GeohashCodec.decode("u4p!"));
        assertThrows(InvalidCellCharException.class, () -> GeohashCodec.decode("é"));
    }
    
    @Test
    void testDecodeRejectsEmptyCell() {
        InvalidCellCharException e = assertThrows(InvalidCellCharException.class, () -> GeohashCodec.decode(""));
        assertEquals(-1, e.getPosition());
    }
    
    @Test
    void testPrefixUpperBoundCoversCellsEndingInZ() {
        String upper = GeohashCodec.prefixUpperBound("dr5");
        
        assertTrue("dr5zzzzzz".compareTo(upper) < 0);
        assertTrue("dr5".compareTo(upper) < 0);
        assertTrue("dr6".compareTo(upper) > 0);
    }
    
    @Test
    void testTruncate() {
        assertEquals("dr5re", GeohashCodec.truncate("dr5regw3p", 5));
        assertEquals("dr5", GeohashCodec.truncate("dr5", 5));
    }
}
