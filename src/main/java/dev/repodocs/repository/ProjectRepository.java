package dev.repodocs.repository;

import dev.repodocs.domain.entity.Project;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ProjectRepository extends JpaRepository<Project, UUID> {
    Optional<Project> findBySlug(String slug);

    /**
     * Inserts or overwrites the project under {@code slug} in one statement. Concurrent calls for
     * the same slug both succeed and the last one wins. A blank repoUrl keeps the stored one;
     * owner and creation time are never overwritten. {@code id} is used only on insert.
     */
    @Modifying(clearAutomatically = true)
    @Query(value = """
            INSERT INTO projects (id, slug, owner_identity, repo_url, repo_name, doc_type, docs, created_at, updated_at)
            VALUES (:id, :slug, :ownerIdentity, :repoUrl, :repoName, :docType, CAST(:docs AS jsonb), now(), now())
            ON CONFLICT (slug) DO UPDATE SET
                docs = EXCLUDED.docs,
                doc_type = EXCLUDED.doc_type,
                repo_name = EXCLUDED.repo_name,
                repo_url = COALESCE(NULLIF(EXCLUDED.repo_url, ''), projects.repo_url),
                updated_at = now()
            """, nativeQuery = true)
    int upsertBySlug(@Param("id") UUID id,
                     @Param("slug") String slug,
                     @Param("ownerIdentity") String ownerIdentity,
                     @Param("repoUrl") String repoUrl,
                     @Param("repoName") String repoName,
                     @Param("docType") String docType,
                     @Param("docs") String docs);
}
