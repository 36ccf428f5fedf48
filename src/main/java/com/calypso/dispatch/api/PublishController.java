package com.calypso.dispatch.api;

import com.calypso.deploy.PublishManager;
import com.calypso.deploy.PublishRequest;
import com.calypso.deploy.PublishResult;
import com.calypso.deploy.PublishStatus;
import com.calypso.deploy.SlugAvailability;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST controller for publishing a project to its public subdomain.
 */
@RestController
@RequestMapping("/api/v1/projects/{projectId}/publish")
public class PublishController {

    private final PublishManager publishManager;

    public PublishController(PublishManager publishManager) {
        this.publishManager = publishManager;
    }

    /**
     * POST /publish: Publish or republish the latest complete build.
     */
    @PostMapping
    public ResponseEntity<?> publish(@PathVariable String projectId,
                                     @RequestBody(required = false) PublishRequest request) {
        try {
            PublishResult result = publishManager.publish(projectId,
                    request != null ? request : new PublishRequest(null, null));
            return ResponseEntity.ok(result);
        } catch (RuntimeException e) {
            return DeployErrors.toResponse(e);
        }
    }

    @GetMapping
    public ResponseEntity<PublishStatus> status(@PathVariable String projectId) {
        return ResponseEntity.ok(publishManager.status(projectId));
    }

    /**
     * DELETE /publish: Take the site offline. The slug stays reserved for the project.
     */
    @DeleteMapping
    public ResponseEntity<?> unpublish(@PathVariable String projectId) {
        try {
            publishManager.unpublish(projectId);
            return ResponseEntity.ok(Map.of("success", true));
        } catch (RuntimeException e) {
            return DeployErrors.toResponse(e);
        }
    }

    @GetMapping("/check-slug")
    public ResponseEntity<SlugAvailability> checkSlug(@PathVariable String projectId,
                                                      @RequestParam(required = false) String slug) {
        return ResponseEntity.ok(publishManager.checkSlug(projectId, slug));
    }
}
