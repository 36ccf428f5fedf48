package com.calypso.dispatch.api;

import com.calypso.deploy.PreviewAccessException;
import com.calypso.deploy.PreviewInfo;
import com.calypso.deploy.PreviewManager;
import com.calypso.deploy.PreviewSiteStatus;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST controller for private preview deployments.
 * <p>
 * {@code /status} is called cross-origin by the banner inside the preview, so it
 * answers with permissive CORS headers and authenticates by preview token only.
 */
@RestController
@RequestMapping("/api/v1/projects/{projectId}/preview")
public class PreviewController {

    private final PreviewManager previewManager;

    public PreviewController(PreviewManager previewManager) {
        this.previewManager = previewManager;
    }

    /**
     * POST /preview: Create a preview of the latest complete build, or reuse a live one.
     */
    @PostMapping
    public ResponseEntity<?> createPreview(@PathVariable String projectId) {
        try {
            PreviewInfo preview = previewManager.createPreview(projectId);
            return ResponseEntity.ok(preview);
        } catch (RuntimeException e) {
            return DeployErrors.toResponse(e);
        }
    }

    @GetMapping
    public ResponseEntity<PreviewInfo> getPreview(@PathVariable String projectId) {
        return ResponseEntity.ok(previewManager.getPreview(projectId));
    }

    @CrossOrigin(origins = "*", methods = {RequestMethod.GET, RequestMethod.OPTIONS}, allowedHeaders = "Content-Type")
    @GetMapping("/status")
    public ResponseEntity<?> previewStatus(@PathVariable String projectId,
                                           @RequestParam(required = false) String token) {
        try {
            PreviewSiteStatus status = previewManager.previewStatus(projectId, token);
            return ResponseEntity.ok().headers(corsHeaders()).body(status);
        } catch (PreviewAccessException e) {
            HttpStatus code = e.isMissing() ? HttpStatus.UNAUTHORIZED : HttpStatus.FORBIDDEN;
            return ResponseEntity.status(code).headers(corsHeaders()).body(Map.of("error", e.getMessage()));
        }
    }

    private static HttpHeaders corsHeaders() {
        var headers = new HttpHeaders();
        headers.add(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "*");
        headers.add(HttpHeaders.ACCESS_CONTROL_ALLOW_METHODS, "GET, OPTIONS");
        headers.add(HttpHeaders.ACCESS_CONTROL_ALLOW_HEADERS, "Content-Type");
        return headers;
    }
}
