package com.dynop.roadnet.io;

import com.dynop.roadnet.model.RawSegmentRecord;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.MultiLineString;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;

import java.io.BufferedReader;
import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Loader for road segment exports in CSV form.
 * 
 * <p>The first line is a header naming the columns. One column holds the segment geometry as WKT
 * ({@code LINESTRING} or single-part {@code MULTILINESTRING}); every other column becomes a raw
 * attribute under its header name:
 * <ul>
 *   <li>blank cells become {@code null}</li>
 *   <li>integer cells become {@link Long} (text beyond long range), decimal cells {@link Double}</li>
 *   <li>anything else stays a {@link String}</li>
 * </ul>
 * 
 * <p>Fields may be quoted, and quoted fields may contain commas. Rows whose geometry cannot be
 * parsed, or whose column count does not match the header, are skipped and logged.
 */
public final class SegmentCsvLoader {
    
    private static final Logger LOGGER = Logger.getLogger(SegmentCsvLoader.class.getName());
    
    public static final String DEFAULT_GEOMETRY_COLUMN = "wkt";
    
    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][+-]?\\d+)?");
    
    private final String geometryColumn;
    
    public SegmentCsvLoader() {
        this(DEFAULT_GEOMETRY_COLUMN);
    }
    
    /**
     * @param geometryColumn Header name of the WKT geometry column
     */
    public SegmentCsvLoader(String geometryColumn) {
        this.geometryColumn = Objects.requireNonNull(geometryColumn, "geometryColumn");
    }
    
    /**
     * Load segment records from one or more CSV files, in file order.
     * 
     * @param csvFiles CSV exports; missing files are logged and skipped
     * @return Raw records
     * @throws IOException if reading fails or a file lacks the geometry column
     */
    public List<RawSegmentRecord> load(Path... csvFiles) throws IOException {
        List<RawSegmentRecord> records = new ArrayList<>();
        
        for (Path csvFile : csvFiles) {
            if (!Files.exists(csvFile)) {
                LOGGER.warning(() -> "Segment file not found: " + csvFile);
                continue;
            }
            
            int before = records.size();
            int skipped = loadFile(csvFile, records);
            int loaded = records.size() - before;
            LOGGER.info(() -> String.format("Loaded %d road segments from %s (%d rows skipped)",
                loaded, csvFile.getFileName(), skipped));
        }
        
        LOGGER.info(() -> String.format("Total road segments loaded: %d", records.size()));
        return records;
    }
    
    private int loadFile(Path csvFile, List<RawSegmentRecord> records) throws IOException {
        WKTReader wktReader = new WKTReader();
        int skipped = 0;
        
        try (BufferedReader reader = Files.newBufferedReader(csvFile, StandardCharsets.UTF_8)) {
            String[] header = null;
            int geometryIndex = -1;
            int lineNumber = 0;
            String line;
            
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                
                if (header == null) {
                    header = parseCSVLine(line);
                    for (int i = 0; i < header.length; i++) {
                        if (geometryColumn.equals(header[i])) {
                            geometryIndex = i;
                        }
                    }
                    if (geometryIndex < 0) {
                        throw new IOException(String.format("%s has no '%s' geometry column", csvFile, geometryColumn));
                    }
                    continue;
                }
                
                String[] cols = parseCSVLine(line);
                if (cols.length != header.length) {
                    skipped++;
                    final int currentLine = lineNumber;
                    final int found = cols.length;
                    final int expected = header.length;
                    LOGGER.warning(() -> String.format("Skipping line %d in %s: %d columns, expected %d",
                        currentLine, csvFile.getFileName(), found, expected));
                    continue;
                }
                
                LineString geometry;
                try {
                    geometry = toLineString(wktReader.read(cols[geometryIndex]));
                } catch (ParseException | IllegalArgumentException e) {
                    skipped++;
                    final int currentLine = lineNumber;
                    LOGGER.log(Level.WARNING, () -> String.format("Skipping line %d in %s: %s",
                        currentLine, csvFile.getFileName(), e.getMessage()));
                    continue;
                }
                
                Map<String, Object> attributes = new LinkedHashMap<>();
                for (int i = 0; i < header.length; i++) {
                    if (i != geometryIndex) {
                        attributes.put(header[i], toValue(cols[i]));
                    }
                }
                records.add(new RawSegmentRecord(geometry, attributes));
            }
        }
        return skipped;
    }
    
    private static LineString toLineString(Geometry geometry) {
        if (geometry instanceof LineString) {
            return (LineString) geometry;
        }
        if (geometry instanceof MultiLineString && geometry.getNumGeometries() == 1) {
            return (LineString) geometry.getGeometryN(0);
        }
        throw new IllegalArgumentException("expected a LINESTRING but got " + geometry.getGeometryType());
    }
    
    static Object toValue(String cell) {
        String text = cell.trim();
        if (text.isEmpty()) {
            return null;
        }
        if (INTEGER.matcher(text).matches()) {
            // ids beyond long range stay textual rather than rounding through double
            BigInteger value = new BigInteger(text);
            return value.bitLength() < Long.SIZE ? (Object) value.longValueExact() : text;
        }
        if (DECIMAL.matcher(text).matches()) {
            return Double.parseDouble(text);
        }
        return text;
    }
    
    /**
     * Split one CSV line into trimmed fields. Quoted fields may contain commas, and a doubled quote
     * inside them stands for one quote. A leading byte order mark is dropped.
     * 
     * @param line CSV line to parse
     * @return Field values, one more than the number of unquoted commas
     */
    static String[] parseCSVLine(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean quoted = false;
        int pos = !line.isEmpty() && line.charAt(0) == '\uFEFF' ? 1 : 0;
        
        while (pos < line.length()) {
            char c = line.charAt(pos++);
            if (quoted) {
                if (c != '"') {
                    field.append(c);
                } else if (pos < line.length() && line.charAt(pos) == '"') {
                    field.append('"');
                    pos++;
                } else {
                    quoted = false;
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                fields.add(field.toString().trim());
                field.setLength(0);
            } else {
                field.append(c);
            }
        }
        fields.add(field.toString().trim());
        
        return fields.toArray(new String[0]);
    }
}
