package com.shipyard.orchestrator.vcs;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shipyard.orchestrator.error.CollaboratorException;
import com.shipyard.orchestrator.http.CollaboratorHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * HTTP client for the version-control service.
 *
 *   GET  /projects/{projectId}/ref       current ref
 *   POST /projects/{projectId}/restore   reset the project to {ref}
 */
@Component
public class HttpVersionControlClient extends CollaboratorHttpClient implements VersionControlClient {

    private static final Logger log = LoggerFactory.getLogger(HttpVersionControlClient.class);

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RefResponse(String ref) {}

    public HttpVersionControlClient(@Value("${shipyard.vcs.base-url}") String baseUrl,
                                    ObjectMapper objectMapper) {
        super(baseUrl, objectMapper);
    }

    @Override
    public void restoreTo(String projectId, String ref) {
        log.info("Restoring project '{}' to ref '{}'", projectId, ref);
        post("/projects/" + projectId + "/restore", Map.of("ref", ref), "restoreTo for " + projectId);
    }

    @Override
    public String currentRef(String projectId) {
        String body = get("/projects/" + projectId + "/ref", "currentRef for " + projectId);
        RefResponse resp = parse(body, RefResponse.class, "currentRef");
        if (resp.ref() == null || resp.ref().isBlank()) {
            throw new CollaboratorException("currentRef for " + projectId + " returned no ref");
        }
        return resp.ref();
    }
}
