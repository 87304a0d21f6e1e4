package com.dynop.roadnet.schema;

import com.dynop.roadnet.SchemaException;
import com.dynop.roadnet.model.RawSegmentRecord;
import org.locationtech.jts.geom.LineString;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Typed access to raw record attributes.
 * 
 * <p>Sources deliver numbers either as {@link Number} or as numeric text (CSV exports), so both are
 * accepted. A null value, a blank string and NaN all count as missing.
 */
final class RawFieldReader {
    
    // "42", "-7", "42.0"; ids outside long range stay textual
    private static final Pattern INTEGRAL_TEXT = Pattern.compile("([+-]?\\d{1,19})(?:\\.0+)?");
    
    // 2^53, largest magnitude up to which every integer has an exact double
    private static final double MAX_EXACT_DOUBLE = 9007199254740992d;
    
    private RawFieldReader() {
        // Utility class
    }
    
    static long requireLong(RawSegmentRecord record, int index, String field) {
        OptionalLong value = optionalLong(record, index, field);
        if (value.isEmpty()) {
            throw new SchemaException(index, field, "required integer value is missing");
        }
        return value.getAsLong();
    }
    
    /**
     * Read an integer field without going through {@code double}, so 17-digit Multinet ids keep every
     * digit. Floating point values are accepted only when integral and exactly representable.
     */
    static OptionalLong optionalLong(RawSegmentRecord record, int index, String field) {
        Object raw = record.get(field);
        if (raw == null) {
            return OptionalLong.empty();
        }
        if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
            return OptionalLong.of(((Number) raw).longValue());
        }
        if (raw instanceof Double || raw instanceof Float) {
            double d = ((Number) raw).doubleValue();
            if (Double.isNaN(d)) {
                return OptionalLong.empty();
            }
            if (Double.isInfinite(d) || d != Math.rint(d) || Math.abs(d) > MAX_EXACT_DOUBLE) {
                throw new SchemaException(index, field, "expected an exact integer but got " + raw);
            }
            return OptionalLong.of((long) d);
        }
        String text = raw.toString().trim();
        if (text.isEmpty() || "NaN".equalsIgnoreCase(text)) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(new BigDecimal(text).longValueExact());
        } catch (NumberFormatException | ArithmeticException e) {
            throw new SchemaException(index, field, "expected an integer within long range but got '" + text + "'", e);
        }
    }
    
    static OptionalDouble optionalDouble(RawSegmentRecord record, int index, String field) {
        Object raw = record.get(field);
        if (raw == null) {
            return OptionalDouble.empty();
        }
        if (raw instanceof Number) {
            double d = ((Number) raw).doubleValue();
            return Double.isNaN(d) ? OptionalDouble.empty() : OptionalDouble.of(d);
        }
        String text = raw.toString().trim();
        if (text.isEmpty() || "NaN".equalsIgnoreCase(text)) {
            return OptionalDouble.empty();
        }
        try {
            return OptionalDouble.of(Double.parseDouble(text));
        } catch (NumberFormatException e) {
            throw new SchemaException(index, field, "expected a number but got '" + text + "'", e);
        }
    }
    
    static Optional<String> optionalString(RawSegmentRecord record, String field) {
        Object raw = record.get(field);
        if (raw == null) {
            return Optional.empty();
        }
        String text = raw.toString().trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }
    
    /**
     * Read a road id that may be integral or textual. Integral values are returned in canonical
     * decimal form so that {@code 42}, {@code 42.0} and {@code "42"} yield the same id.
     */
    static String requireRoadId(RawSegmentRecord record, int index, String field) {
        Object raw = record.get(field);
        if (raw instanceof Number) {
            return Long.toString(requireLong(record, index, field));
        }
        Optional<String> text = optionalString(record, field);
        if (text.isEmpty()) {
            throw new SchemaException(index, field, "required road id is missing");
        }
        Matcher integral = INTEGRAL_TEXT.matcher(text.get());
        if (integral.matches()) {
            BigInteger id = new BigInteger(integral.group(1));
            if (id.bitLength() < Long.SIZE) {
                return Long.toString(id.longValueExact());
            }
        }
        return text.get();
    }
    
    static LineString requireGeometry(RawSegmentRecord record, int index, String field) {
        LineString geometry = record.getGeometry();
        if (geometry == null || geometry.isEmpty()) {
            throw new SchemaException(index, field, "geometry is missing");
        }
        if (geometry.getNumPoints() < 2) {
            throw new SchemaException(index, field, "geometry needs at least 2 points, got " + geometry.getNumPoints());
        }
        return geometry;
    }
    
    static double requireNonNegative(double value, int index, String field) {
        if (value < 0 || Double.isInfinite(value)) {
            throw new SchemaException(index, field, "expected a non-negative finite value but got " + value);
        }
        return value;
    }
}
