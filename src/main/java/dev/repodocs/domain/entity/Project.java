package dev.repodocs.domain.entity;

import dev.repodocs.domain.valueobject.Slug;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import java.time.Instant;
import java.util.UUID;

/**
 * A generated documentation site, addressable by its slug.
 *
 * <p>The slug is the natural key. Writes go through
 * {@link dev.repodocs.repository.ProjectRepository#upsertBySlug}; the entity is read-mostly.
 */
@Entity
@Table(name = "projects", indexes = {
        @Index(name = "idx_project_owner", columnList = "owner_identity"),
        @Index(name = "idx_project_updated", columnList = "updated_at")
})
public class Project {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Column(name = "slug", unique = true, nullable = false, length = Slug.MAX_LENGTH)
    private String slug;

    @Column(name = "owner_identity", nullable = false)
    private String ownerIdentity;

    @Column(name = "repo_url", nullable = false, length = 2000)
    private String repoUrl;

    @Column(name = "repo_name", nullable = false)
    private String repoName;

    @Column(name = "doc_type", nullable = false, length = 50)
    private String docType;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "docs", columnDefinition = "jsonb", nullable = false)
    private String docs;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected Project() {
    }

    public static Project create(String slug, String ownerIdentity, String repoUrl,
            String repoName, String docType, String docs) {
        Project p = new Project();
        p.id = UUID.randomUUID();
        p.slug = slug;
        p.ownerIdentity = ownerIdentity;
        p.repoUrl = repoUrl != null ? repoUrl : "";
        p.repoName = repoName;
        p.docType = docType;
        p.docs = docs;
        p.createdAt = Instant.now();
        p.updatedAt = p.createdAt;
        return p;
    }

    public UUID getId() {
        return id;
    }

    public String getSlug() {
        return slug;
    }

    public String getOwnerIdentity() {
        return ownerIdentity;
    }

    public String getRepoUrl() {
        return repoUrl;
    }

    public String getRepoName() {
        return repoName;
    }

    public String getDocType() {
        return docType;
    }

    public String getDocs() {
        return docs;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
