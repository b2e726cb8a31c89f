package com.modelviewer.customization.util;

import java.util.OptionalInt;

import lombok.experimental.UtilityClass;

/**
 * Integer encodings of geoset group/variant pairs, as consumed by the mesh renderer.
 */
@UtilityClass
public class GeosetKeys {

    /**
     * Encode a customization geoset as the two-digit zero-padded group followed by the two-digit
     * zero-padded variant, read as one number: (1, 5) -> "0105" -> 105, (12, 3) -> 1203.
     * Values wider than two digits are not truncated.
     *
     * @return the key, or empty when either part is negative or the key does not fit in an int
     */
    public static OptionalInt encodeCustomizationGeoset(int geosetType, int geosetId) {
        if (geosetType < 0 || geosetId < 0) {
            return OptionalInt.empty();
        }
        // Up to 20 digits for two ints; anything past 18 is beyond the int range and may overflow a long
        String digits = pad2(geosetType) + pad2(geosetId);
        if (digits.length() > 18) {
            return OptionalInt.empty();
        }
        long key = Long.parseLong(digits);
        return key > Integer.MAX_VALUE ? OptionalInt.empty() : OptionalInt.of((int) key);
    }

    /**
     * Encode a creature display's extra geoset: the hundreds carry the group, the low two digits the value.
     */
    public static int encodeCreatureGeoset(int geosetIndex, int geosetValue) {
        return (geosetIndex + 1) * 100 + geosetValue;
    }

    private static String pad2(int value) {
        String s = Integer.toString(value);
        return s.length() < 2 ? "0" + s : s;
    }
}
