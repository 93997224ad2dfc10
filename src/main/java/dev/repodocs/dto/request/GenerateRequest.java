package dev.repodocs.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import tools.jackson.databind.JsonNode;

/**
 * Body of both generate endpoints, in the dashboard's snake_case. Generation uses
 * repo_url, doc_type, repo_name and auth_token; refinement ({@code action: "refine"}) uses
 * current_docs, prompt and repo_name.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GenerateRequest(
        @JsonProperty("repo_url") String repoUrl,
        @JsonProperty("doc_type") String docType,
        @JsonProperty("repo_name") String repoName,
        @JsonProperty("auth_token") String authToken,
        @JsonProperty("action") String action,
        @JsonProperty("current_docs") JsonNode currentDocs,
        @JsonProperty("prompt") String prompt
) {
    public static final String REFINE = "refine";

    public boolean isRefine() {
        return REFINE.equalsIgnoreCase(action);
    }
}
