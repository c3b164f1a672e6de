package org.healthdata.reporting.search;

import java.util.List;

import org.healthdata.reporting.jql.IndexResolver;
import org.healthdata.reporting.jql.JqlTranslator;
import org.healthdata.reporting.jql.ir.CompiledQuery;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SearchRequestTest {

    private final JqlTranslator translator = new JqlTranslator(IndexResolver.withoutMapping());

    @Test
    void jqlLimitOverridesRequestedSize() {
        CompiledQuery compiled = translator.translate("status = open limit 7", List.of("visits"));

        SearchRequest request = SearchRequest.forCompiledQuery(compiled, 0, SearchRequest.DEFAULT_SIZE);

        assertEquals(7, request.size());
        assertEquals(List.of("visits"), request.indices());
    }

    @Test
    void withoutJqlLimitTheRequestedSizeApplies() {
        CompiledQuery compiled = translator.translate("status = open order by admitted", List.of("visits"));

        SearchRequest request = SearchRequest.forCompiledQuery(compiled, 10, SearchRequest.DEFAULT_SIZE);

        assertEquals(50, request.size());
        assertEquals(10, request.from());
        assertTrue(request.toBody().has("sort"));
        assertFalse(request.toBody().has("_source"));
    }

    @Test
    void missingQueryDefaultsToMatchAll() {
        SearchRequest request = SearchRequest.builder().indices(List.of("visits")).size(1).build();

        assertTrue(request.query().has("match_all"));
    }

    @Test
    void negativePagingIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> SearchRequest.builder().from(-1).build());
        assertThrows(IllegalArgumentException.class, () -> SearchRequest.builder().size(-1).build());
    }
}
