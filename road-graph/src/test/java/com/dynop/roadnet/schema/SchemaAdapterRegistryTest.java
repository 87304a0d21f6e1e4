package com.dynop.roadnet.schema;

import com.dynop.roadnet.UnsupportedVintageException;
import com.dynop.roadnet.model.RawSegmentRecord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.dynop.roadnet.RoadFixtures.multinet2021;
import static com.dynop.roadnet.RoadFixtures.raw;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SchemaAdapterRegistryTest {

    @Test
    void defaultsRegisterBothVintages() {
        SchemaAdapterRegistry registry = SchemaAdapterRegistry.defaults();
        
        assertEquals(Set.of("2021", "2017"), registry.getSupportedVintages());
        assertInstanceOf(Multinet2021SchemaAdapter.class, registry.getAdapter("2021"));
        assertInstanceOf(Multinet2017SchemaAdapter.class, registry.getAdapter(" 2017 "));
    }

    @Test
    void unknownVintageFailsBeforeNormalizing() {
        SchemaAdapter adapter = mock(SchemaAdapter.class);
        when(adapter.getVintageTag()).thenReturn("2021");
        SchemaAdapterRegistry registry = new SchemaAdapterRegistry(List.of(adapter));
        
        List<RawSegmentRecord> records = List.of(raw(multinet2021(1L, 1, 2, 1, 100), 1, 2));
        UnsupportedVintageException e = assertThrows(UnsupportedVintageException.class,
            () -> registry.normalize(records, "2019"));
        
        assertEquals("2019", e.getVintageTag());
        assertEquals(UnsupportedVintageException.ERROR_CODE, e.getErrorCode());
        assertTrue(e.getMessage().contains("2021"));
        verify(adapter, never()).normalize(any());
    }

    @Test
    void nullVintageIsUnsupported() {
        assertThrows(UnsupportedVintageException.class, () -> SchemaAdapterRegistry.defaults().getAdapter(null));
    }

    @Test
    void delegatesToSelectedAdapter() {
        SchemaAdapter adapter = mock(SchemaAdapter.class);
        when(adapter.getVintageTag()).thenReturn("custom");
        NormalizationResult expected = new NormalizationResult("custom", List.of(), 0, 0, List.of());
        when(adapter.normalize(any())).thenReturn(expected);
        
        SchemaAdapterRegistry registry = new SchemaAdapterRegistry(List.of(adapter));
        
        assertSame(expected, registry.normalize(List.of(), "custom"));
    }

    @Test
    void rejectsDuplicateTags() {
        assertThrows(IllegalArgumentException.class, () -> new SchemaAdapterRegistry(
            List.of(new Multinet2021SchemaAdapter(), new Multinet2021SchemaAdapter())));
    }
}
