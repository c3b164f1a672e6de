package org.healthdata.reporting.jql;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

import org.healthdata.reporting.common.IndexAllowList;

import lombok.extern.slf4j.Slf4j;

/**
 * Maps logical project names to physical index names and keeps only those the allow-list admits.
 * Names that fail the allow-list are dropped, not reported; {@link JqlValidator} surfaces the omission.
 */
@Slf4j
public class IndexResolver {

    private final Map<String, String> projectIndexMapping;

    /**
     * @param projectIndexMapping project token to index name; project keys are matched case-insensitively
     */
    public IndexResolver(Map<String, String> projectIndexMapping) {
        Map<String, String> normalized = new HashMap<>();
        projectIndexMapping.forEach((project, index) -> normalized.put(project.toLowerCase(Locale.ROOT), index));
        this.projectIndexMapping = Map.copyOf(normalized);
    }

    public static IndexResolver withoutMapping() {
        return new IndexResolver(Map.of());
    }

    public Map<String, String> getProjectIndexMapping() {
        return projectIndexMapping;
    }

    public List<String> resolve(List<String> projects, List<String> allowed) {
        if (projects == null || projects.isEmpty()) {
            return List.copyOf(allowed);
        }
        List<String> resolved = projects.stream()
            .map(this::indexFor)
            .filter(index -> IndexAllowList.isAllowed(index, allowed))
            .collect(Collectors.toList());
        if (resolved.size() < projects.size()) {
            log.debug("Dropped {} of {} project(s) not admitted by the allow-list {}",
                projects.size() - resolved.size(), projects.size(), allowed);
        }
        return resolved;
    }

    /** The mapped index for {@code project}, or the token itself when unmapped. */
    public String indexFor(String project) {
        return projectIndexMapping.getOrDefault(project.toLowerCase(Locale.ROOT), project);
    }
}
