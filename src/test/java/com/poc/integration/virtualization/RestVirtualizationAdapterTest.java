package com.poc.integration.virtualization;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RestVirtualizationAdapterTest {

    @Test
    void shouldReadRowsFromElementsEnvelope() {
        // Given
        String body = """
            {"name": "category_search",
             "elements": [
               {"customer_id": "c-1", "full_name": "Alice Johnson", "category": "retail"},
               {"customer_id": "c-2", "full_name": "Bob Johnston", "category": "retail"}
             ],
             "links": []}
            """;

        // When
        List<Map<String, Object>> rows = RestVirtualizationAdapter.parseRows(body);

        // Then
        assertThat(rows).hasSize(2);
        assertThat(rows.get(0)).containsEntry("customer_id", "c-1").containsEntry("category", "retail");
    }

    @Test
    void shouldReadBareArray() {
        List<Map<String, Object>> rows = RestVirtualizationAdapter.parseRows(
            "[{\"customer_id\": \"c-9\", \"status\": \"active\"}]");

        assertThat(rows).singleElement().satisfies(row -> assertThat(row).containsEntry("status", "active"));
    }

    @Test
    void shouldDecodeJsonTextColumns() {
        String body = "{\"elements\": [{\"customer_id\": \"c-1\", "
            + "\"address\": \"{\\\"city\\\": \\\"Springfield\\\", \\\"state\\\": \\\"IL\\\"}\"}]}";

        List<Map<String, Object>> rows = RestVirtualizationAdapter.parseRows(body);

        assertThat(rows.get(0).get("address")).isInstanceOf(Map.class);
        @SuppressWarnings("unchecked")
        Map<String, Object> address = (Map<String, Object>) rows.get(0).get("address");
        assertThat(address).containsEntry("city", "Springfield");
    }

    @Test
    void shouldKeepTextThatOnlyLooksLikeJson() {
        String body = "{\"elements\": [{\"note\": \"{not json}\"}]}";

        List<Map<String, Object>> rows = RestVirtualizationAdapter.parseRows(body);

        assertThat(rows.get(0)).containsEntry("note", "{not json}");
    }

    @Test
    void shouldReturnNoRowsForEmptyBodyOrMissingElements() {
        assertThat(RestVirtualizationAdapter.parseRows("")).isEmpty();
        assertThat(RestVirtualizationAdapter.parseRows(null)).isEmpty();
        assertThat(RestVirtualizationAdapter.parseRows("{\"name\": \"get_customer\"}")).isEmpty();
    }
}
