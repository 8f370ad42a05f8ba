package com.routedesk.support.routing.value;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class ContextPathTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private ContextValue root() throws Exception {
        return ContextValues.fromJson(objectMapper.readTree("""
                {"data":{"productFamily":"acid","shipTo":{"country":"US"},
                         "items":[{"sku":"A-1"},{"sku":"B-2"}],"note":null}}
                """));
    }

    @Test
    void resolves_nested_mapping() throws Exception {
        assertEquals(ContextValue.text("US"), ContextPath.resolve(root(), "data.shipTo.country"));
    }

    @Test
    void numeric_segment_indexes_sequence() throws Exception {
        assertEquals(ContextValue.text("B-2"), ContextPath.resolve(root(), "data.items.1.sku"));
        assertFalse(ContextPath.resolve(root(), "data.items.5.sku").isPresent());
        assertFalse(ContextPath.resolve(root(), "data.items.first").isPresent());
    }

    @Test
    void missing_segment_is_absent() throws Exception {
        assertFalse(ContextPath.resolve(root(), "data.shipTo.state").isPresent());
        assertFalse(ContextPath.resolve(root(), "data.productFamily.name").isPresent());
        assertFalse(ContextPath.resolve(root(), "customer.name").isPresent());
    }

    @Test
    void null_member_is_absent() throws Exception {
        assertFalse(ContextPath.resolve(root(), "data.note").isPresent());
    }

    @Test
    void empty_segments_are_absent() throws Exception {
        assertFalse(ContextPath.resolve(root(), "data..productFamily").isPresent());
        assertFalse(ContextPath.resolve(root(), "").isPresent());
    }
}
