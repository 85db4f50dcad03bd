package com.dcruver.themerank.pipeline;

import java.util.List;

/**
 * Parameters of one ranking run.
 *
 * @param owner       who requested the run
 * @param job         job identifier, unique per owner
 * @param query       free-text problem description; blank disables relevance filtering
 * @param source      location understood by the document source (a file path for JSON input)
 * @param communities source communities to keep, empty for all
 */
public record RunRequest(String owner, String job, String query, String source, List<String> communities) {

    public RunRequest {
        communities = communities == null ? List.of() : List.copyOf(communities);
    }

    public RunKey key() {
        return new RunKey(owner, job);
    }

    public boolean hasQuery() {
        return query != null && !query.isBlank();
    }
}
