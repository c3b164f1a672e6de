package org.healthdata.reporting.jql;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IndexResolverTest {

    private final IndexResolver resolver = new IndexResolver(Map.of(
        "Cardiology", "health-cardiology-v2",
        "labs", "labs-2024"
    ));

    @Test
    void noProjectsResolvesToTheWholeAllowList() {
        List<String> allowed = List.of("visits", "labs-*");

        assertEquals(allowed, resolver.resolve(List.of(), allowed));
    }

    @Test
    void mappedProjectIsLookedUpCaseInsensitively() {
        assertEquals(List.of("health-cardiology-v2"),
            resolver.resolve(List.of("CARDIOLOGY"), List.of("health-*")));
    }

    @Test
    void unmappedProjectIsTreatedAsAnIndexName() {
        assertEquals(List.of("metrics-2024"), resolver.resolve(List.of("metrics-2024"), List.of("metrics-*")));
    }

    @Test
    void wildcardAllowListRejectsOtherPrefixes() {
        assertEquals(List.of(), resolver.resolve(List.of("other-2024"), List.of("metrics-*")));
    }

    @Test
    void exactAllowListEntryRequiresEquality() {
        assertEquals(List.of("labs-2024"), resolver.resolve(List.of("labs"), List.of("labs-2024")));
        assertEquals(List.of(), resolver.resolve(List.of("labs"), List.of("labs-2025")));
    }

    @Test
    void resolverWithoutMappingUsesTokensVerbatim() {
        assertEquals(List.of("visits"), IndexResolver.withoutMapping().resolve(List.of("visits"), List.of("visits")));
    }

    @Test
    void mappingKeysAreNormalizedToLowerCase() {
        assertEquals("health-cardiology-v2", resolver.getProjectIndexMapping().get("cardiology"));
        assertEquals("health-cardiology-v2", resolver.indexFor("CardioLogy"));
    }
}
