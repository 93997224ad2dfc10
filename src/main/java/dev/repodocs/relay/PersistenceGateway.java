package dev.repodocs.relay;

import dev.repodocs.domain.valueobject.Slug;
import tools.jackson.databind.JsonNode;

/**
 * Durable storage for generated docs. Idempotent: an upsert keyed by a slug derived from
 * (repoName, ownerIdentity), so repeated calls with the same inputs return the same slug
 * and leave a single record.
 */
public interface PersistenceGateway {

    Slug upsert(String ownerIdentity, String repoUrl, String repoName, JsonNode docs);
}
