package dev.reviewgate.controller;

import dev.reviewgate.dto.response.ProjectApprovalResponse;
import dev.reviewgate.service.ReviewQueryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Lets Kantata-side tooling ask whether a project's review is approved before it goes Live. */
@RestController
@RequestMapping("/integrations/kantata")
public class KantataIntegrationController {

    private final ReviewQueryService queryService;

    public KantataIntegrationController(ReviewQueryService queryService) {
        this.queryService = queryService;
    }

    @GetMapping("/projects/{projectId}/approval")
    public ResponseEntity<ProjectApprovalResponse> approval(@PathVariable String projectId) {
        return ResponseEntity.ok(queryService.projectApproval(projectId));
    }
}
