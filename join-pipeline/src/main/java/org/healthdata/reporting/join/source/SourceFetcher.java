package org.healthdata.reporting.join.source;

import java.util.List;

import org.healthdata.reporting.join.ir.JoinSource;

import com.fasterxml.jackson.databind.node.ObjectNode;
import reactor.core.publisher.Mono;

/**
 * Port for reading the raw records of one join side.
 *
 * An index source fetches everything up to {@code limit}; a saved-query source runs its stored query
 * against its target index. Returns a cold Mono; subscription triggers the read.
 */
public interface SourceFetcher {
    Mono<List<ObjectNode>> fetch(JoinSource source, int limit);
}
