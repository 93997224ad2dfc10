package dev.repodocs.controller;

import dev.repodocs.dto.response.ProjectResponse;
import dev.repodocs.exception.ProjectNotFoundException;
import dev.repodocs.service.ProjectQueryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/projects")
public class ProjectController {
    private final ProjectQueryService queryService;
    public ProjectController(ProjectQueryService queryService) { this.queryService = queryService; }

    @GetMapping("/{slug}")
    public ResponseEntity<ProjectResponse> getProject(@PathVariable String slug) {
        return queryService.findBySlug(slug).map(ResponseEntity::ok)
                .orElseThrow(() -> new ProjectNotFoundException(slug));
    }
}
