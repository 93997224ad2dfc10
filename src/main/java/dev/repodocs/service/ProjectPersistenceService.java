package dev.repodocs.service;

import dev.repodocs.domain.valueobject.Slug;
import dev.repodocs.relay.PersistenceGateway;
import dev.repodocs.repository.ProjectRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

import java.util.UUID;

/**
 * Command-side persistence of generated docs. Upsert by derived slug: a regeneration for the
 * same owner and repository overwrites the stored docs instead of adding a row. The write is a
 * single insert-or-update statement, so racing regenerations of one slug are last-write-wins.
 */
@Service
public class ProjectPersistenceService implements PersistenceGateway {
    private static final Logger log = LoggerFactory.getLogger(ProjectPersistenceService.class);
    static final String DEFAULT_DOC_TYPE = "auto";

    private final ProjectRepository repository;
    private final ObjectMapper objectMapper;

    public ProjectPersistenceService(ProjectRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional
    public Slug upsert(String ownerIdentity, String repoUrl, String repoName, JsonNode docs) {
        if (docs == null || docs.isNull()) throw new IllegalArgumentException("docs required");
        Slug slug = Slug.derive(repoName, ownerIdentity);
        String docType = docTypeOf(docs);
        String json = objectMapper.writeValueAsString(docs);

        repository.upsertBySlug(UUID.randomUUID(), slug.value(), ownerIdentity,
                repoUrl != null ? repoUrl : "", repoName, docType, json);
        log.info("Upserted project {} ({})", slug, docType);
        return slug;
    }

    private String docTypeOf(JsonNode docs) {
        JsonNode type = docs.get("doc_type");
        if (type == null || !type.isValueNode() || type.isNull()) return DEFAULT_DOC_TYPE;
        try {
            String value = objectMapper.treeToValue(type, String.class);
            return value == null || value.isBlank() ? DEFAULT_DOC_TYPE : value;
        } catch (JacksonException e) {
            return DEFAULT_DOC_TYPE;
        }
    }
}
