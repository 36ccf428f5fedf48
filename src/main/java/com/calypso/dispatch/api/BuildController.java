package com.calypso.dispatch.api;

import com.calypso.core.build.BuildArchiver;
import com.calypso.core.build.BuildInProgressException;
import com.calypso.core.build.BuildService;
import com.calypso.core.build.NoCompletedBuildException;
import com.calypso.core.model.BuildOutput;
import com.calypso.core.model.Framework;
import com.calypso.core.model.StylingApproach;
import com.calypso.deploy.Slugs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * REST controller for build actions of a project.
 */
@RestController
@RequestMapping("/api/v1/projects/{projectId}/builds")
public class BuildController {

    private static final Logger log = LoggerFactory.getLogger(BuildController.class);

    private final BuildService buildService;
    private final SseStreamingService sseStreamingService;

    public BuildController(BuildService buildService, SseStreamingService sseStreamingService) {
        this.buildService = buildService;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /builds: Start a build. Runs asynchronously; progress is streamed from /events.
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> startBuild(@PathVariable String projectId,
                                                          @RequestBody BuildRequest request) {
        Framework framework;
        StylingApproach styling;
        try {
            framework = Framework.fromWireName(request.framework());
            styling = StylingApproach.fromWireName(request.styling());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
        if (request.includeTypeScript() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "includeTypeScript is required"));
        }
        if (request.specification() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "specification is required"));
        }

        try {
            BuildOutput output = buildService.startBuild(projectId, framework, styling,
                    request.includeTypeScript(), request.specification());
            return ResponseEntity.accepted().body(Map.of(
                    "buildId", output.id(),
                    "status", output.status().wireName()
            ));
        } catch (BuildInProgressException e) {
            log.info("Rejected build for project {}: build {} still running", projectId, e.getActiveBuildId());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                    "error", "A build is already running for this project",
                    "buildId", e.getActiveBuildId()
            ));
        }
    }

    /**
     * GET /builds/latest: Newest build of the project, or {@code {"output": null}}.
     */
    @GetMapping("/latest")
    public ResponseEntity<Map<String, BuildOutput>> latestBuild(@PathVariable String projectId) {
        Optional<BuildOutput> latest = buildService.latestBuild(projectId);
        return ResponseEntity.ok(Collections.singletonMap("output", latest.orElse(null)));
    }

    @GetMapping("/{buildId}")
    public ResponseEntity<BuildOutput> getBuild(@PathVariable String projectId, @PathVariable String buildId) {
        return buildService.findBuild(projectId, buildId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * GET /builds/{buildId}/events: SSE stream of build progress.
     */
    @GetMapping(value = "/{buildId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> streamEvents(@PathVariable String projectId, @PathVariable String buildId) {
        Optional<BuildOutput> build = buildService.findBuild(projectId, buildId);
        if (build.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(sseStreamingService.createEmitter(build.get()));
    }

    /**
     * DELETE /builds/{buildId}: Cancel a running build. Files persisted so far are kept.
     */
    @DeleteMapping("/{buildId}")
    public ResponseEntity<Map<String, Object>> cancelBuild(@PathVariable String projectId,
                                                           @PathVariable String buildId) {
        if (buildService.findBuild(projectId, buildId).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        boolean cancelled = buildService.cancel(buildId);
        return ResponseEntity.ok(Map.of("buildId", buildId, "cancelled", cancelled));
    }

    /**
     * GET /builds/latest/download: Zip of the latest complete build.
     *
     * @param name project name used for the archive file name
     */
    @GetMapping("/latest/download")
    public ResponseEntity<?> download(@PathVariable String projectId,
                                      @RequestParam(required = false) String name) {
        BuildOutput output;
        try {
            output = buildService.latestExportable(projectId);
        } catch (NoCompletedBuildException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "No completed build found"));
        }

        byte[] zip = BuildArchiver.zip(output.files());
        String base = Slugs.slugify(name);
        String filename = (base.isEmpty() ? "calypso" : base) + "-project.zip";
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType("application/zip"))
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(filename).build().toString())
                .body(zip);
    }
}
