package com.dynop.roadnet.io;

import com.dynop.roadnet.model.RawSegmentRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SegmentCsvLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void loadsAttributesAndGeometry() throws IOException {
        Path csv = write("segments.csv",
            "netw_id,junction_id_from,junction_id_to,centimeters,speed_average_pos,name,wkt",
            "1001,1,2,150000.5,,\"Main St, North\",\"LINESTRING (4.9 52.3, 4.91 52.31, 4.92 52.3)\"");
        
        List<RawSegmentRecord> records = new SegmentCsvLoader().load(csv);
        
        assertEquals(1, records.size());
        RawSegmentRecord record = records.get(0);
        assertEquals(1001L, record.get("netw_id"));
        assertEquals(150000.5, record.get("centimeters"));
        assertNull(record.get("speed_average_pos"));
        assertFalse(record.has("speed_average_pos"));
        assertTrue(record.getAttributes().containsKey("speed_average_pos"));
        assertEquals("Main St, North", record.get("name"));
        assertFalse(record.has("wkt"));
        assertEquals(3, record.getGeometry().getNumPoints());
    }

    @Test
    void acceptsSinglePartMultiLineString() throws IOException {
        Path csv = write("multi.csv",
            "id,wkt",
            "7,\"MULTILINESTRING ((0 0, 1 1))\"");
        
        assertEquals(1, new SegmentCsvLoader().load(csv).size());
    }

    @Test
    void skipsUnparseableRows() throws IOException {
        Path csv = write("mixed.csv",
            "id,wkt",
            "1,\"LINESTRING (0 0, 1 1)\"",
            "2,\"LINESTRING (0 0, oops)\"",
            "3,\"POINT (1 1)\"",
            "4,\"MULTILINESTRING ((0 0, 1 1), (2 2, 3 3))\"",
            "5,\"LINESTRING (0 0, 1 1)\",extra",
            "",
            "6,\"LINESTRING (1 1, 2 2)\"");
        
        List<RawSegmentRecord> records = new SegmentCsvLoader().load(csv);
        
        assertEquals(2, records.size());
        assertEquals(1L, records.get(0).get("id"));
        assertEquals(6L, records.get(1).get("id"));
    }

    @Test
    void usesConfiguredGeometryColumnAndStripsByteOrderMark() throws IOException {
        Path csv = write("bom.csv",
            "\uFEFFid,wkb_geometry",
            "3,\"LINESTRING (0 0, 1 1)\"");
        
        List<RawSegmentRecord> records = new SegmentCsvLoader("wkb_geometry").load(csv);
        
        assertEquals(3L, records.get(0).get("id"));
    }

    @Test
    void failsWithoutGeometryColumn() throws IOException {
        Path csv = write("nogeom.csv", "id,name", "1,a");
        
        assertThrows(IOException.class, () -> new SegmentCsvLoader().load(csv));
    }

    @Test
    void skipsMissingFiles() throws IOException {
        Path csv = write("one.csv", "id,wkt", "1,\"LINESTRING (0 0, 1 1)\"");
        
        List<RawSegmentRecord> records = new SegmentCsvLoader().load(tempDir.resolve("absent.csv"), csv);
        
        assertEquals(1, records.size());
    }

    @Test
    void convertsCellValues() {
        assertNull(SegmentCsvLoader.toValue("  "));
        assertEquals(-12L, SegmentCsvLoader.toValue("-12"));
        assertEquals(2.5, SegmentCsvLoader.toValue("2.5"));
        assertEquals(1.0e3, SegmentCsvLoader.toValue("1e3"));
        assertEquals("FT", SegmentCsvLoader.toValue("FT"));
        assertEquals(12280000000012345L, SegmentCsvLoader.toValue("12280000000012345"));
        assertEquals(Long.MAX_VALUE, SegmentCsvLoader.toValue("9223372036854775807"));
        // too long for a long, kept exact as text
        assertEquals("12345678901234567890", SegmentCsvLoader.toValue("12345678901234567890"));
    }

    @Test
    void parsesQuotedFields() {
        String[] fields = SegmentCsvLoader.parseCSVLine("a,\"b, c\",\"say \"\"hi\"\"\",");
        
        assertArrayEquals(new String[]{"a", "b, c", "say \"hi\"", ""}, fields);
    }

    @Test
    void trimsFieldsAndDropsByteOrderMark() {
        String[] fields = SegmentCsvLoader.parseCSVLine("\uFEFF id , \" LINESTRING (0 0, 1 1) \" ,x");
        
        assertArrayEquals(new String[]{"id", "LINESTRING (0 0, 1 1)", "x"}, fields);
    }

    @Test
    void keepsLongJunctionIdsExact() throws IOException {
        Path csv = write("ids.csv",
            "netw_id,junction_id_from,junction_id_to,wkt",
            "12280000000099999,12280000000012345,12280000000012346,\"LINESTRING (0 0, 1 1)\"");
        
        RawSegmentRecord record = new SegmentCsvLoader().load(csv).get(0);
        
        assertEquals(12280000000012345L, record.get("junction_id_from"));
        assertEquals(12280000000012346L, record.get("junction_id_to"));
    }

    private Path write(String name, String... lines) throws IOException {
        Path file = tempDir.resolve(name);
        Files.write(file, List.of(lines), StandardCharsets.UTF_8);
        return file;
    }
}
