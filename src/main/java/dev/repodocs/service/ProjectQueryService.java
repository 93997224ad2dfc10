package dev.repodocs.service;

import dev.repodocs.dto.response.ProjectResponse;
import dev.repodocs.domain.entity.Project;
import dev.repodocs.repository.ProjectRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import tools.jackson.databind.ObjectMapper;

import java.util.Optional;

/** Read-side service with read-only transactions. */
@Service
@Transactional(readOnly = true)
public class ProjectQueryService {
    private final ProjectRepository repository;
    private final ObjectMapper objectMapper;

    public ProjectQueryService(ProjectRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    public Optional<ProjectResponse> findBySlug(String slug) {
        return repository.findBySlug(slug).map(this::toResponse);
    }

    private ProjectResponse toResponse(Project p) {
        return new ProjectResponse(p.getSlug(), p.getRepoName(), p.getRepoUrl(), p.getDocType(),
                objectMapper.readTree(p.getDocs()), p.getUpdatedAt());
    }
}
