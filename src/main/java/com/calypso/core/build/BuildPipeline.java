package com.calypso.core.build;

import com.calypso.core.brief.SpecificationAssembler;
import com.calypso.core.deadline.DeadlineGuard;
import com.calypso.core.events.BuildEvent;
import com.calypso.core.events.EventBus;
import com.calypso.core.extract.ExtractionEvent;
import com.calypso.core.extract.StreamingFileExtractor;
import com.calypso.core.llm.CodeGenerationClient;
import com.calypso.core.logging.MdcContext;
import com.calypso.core.metrics.CalypsoMetrics;
import com.calypso.core.model.Framework;
import com.calypso.core.model.GeneratedFile;
import com.calypso.core.persistence.BuildOutputStore;
import com.calypso.core.repair.RepairLoop;
import com.calypso.core.repair.RepairResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Runs one build end to end on the calling thread: stream generation, persist, verify and
 * repair, persist again, report.
 * <p>
 * State is written after every durable step. Each completed file overwrites the output's
 * file set while the stream runs; the output is marked {@code COMPLETE} as soon as the
 * stream ends with files, before verification starts, so a run killed during verification
 * still leaves a usable build. Errors after that point never downgrade the output.
 */
@Service
public class BuildPipeline {

    private static final Logger log = LoggerFactory.getLogger(BuildPipeline.class);

    static final String NO_FILES_ERROR = "No files parsed from AI response";

    private final SpecificationAssembler assembler;
    private final CodeGenerationClient client;
    private final RepairLoop repairLoop;
    private final BuildOutputStore store;
    private final EventBus eventBus;
    private final UsageMeter usageMeter;
    private final CalypsoMetrics metrics;
    private final BuildProperties properties;
    private final Clock clock;

    public BuildPipeline(SpecificationAssembler assembler, CodeGenerationClient client, RepairLoop repairLoop,
                         BuildOutputStore store, EventBus eventBus, UsageMeter usageMeter,
                         CalypsoMetrics metrics, BuildProperties properties, Clock clock) {
        this.assembler = assembler;
        this.client = client;
        this.repairLoop = repairLoop;
        this.store = store;
        this.eventBus = eventBus;
        this.usageMeter = usageMeter;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }

    public void execute(BuildJob job) {
        MdcContext.setBuild(job.projectId(), job.buildId());
        long start = System.currentTimeMillis();
        Framework framework = job.configuration().framework();
        var deadline = new DeadlineGuard(clock, properties.budget(), properties.safetyMargin());
        boolean savedAsComplete = false;
        List<GeneratedFile> savedFiles = List.of();
        String outcome = "failed";

        try {
            List<GeneratedFile> generated = generate(job, deadline);
            metrics.recordGeneratedFiles(generated.size());

            if (generated.isEmpty()) {
                String reason = job.isCancelled() ? "Build cancelled before any file was generated" : NO_FILES_ERROR;
                store.markFailed(job.buildId(), reason);
                publish(job, BuildEvent.ERROR, Map.of("message", job.isCancelled()
                        ? "Build cancelled."
                        : "Failed to generate project files. Please try again."));
                outcome = job.isCancelled() ? "cancelled" : "failed";
                return;
            }
            if (job.isCancelled()) {
                // Partial files stay on the failed record for inspection
                store.markFailed(job.buildId(), "Build cancelled by client");
                publish(job, BuildEvent.ERROR, Map.of("message", "Build cancelled."));
                outcome = "cancelled";
                return;
            }

            store.markComplete(job.buildId(), generated);
            savedAsComplete = true;
            savedFiles = generated;

            RepairResult repair;
            if (!framework.requiresBuild()) {
                repair = RepairResult.skipped(generated);
            } else if (!deadline.canContinue()) {
                log.info("Skipping verification: deadline reached during generation");
                metrics.incrementDeadlineAborts("verify");
                repair = RepairResult.skipped(generated);
            } else {
                repair = repairLoop.run(job.buildId(), generated, deadline, job::isCancelled);
                metrics.recordRepairRounds(repair.rounds());
            }

            List<GeneratedFile> finalFiles = repair.files();
            if (!finalFiles.equals(generated)) {
                store.updateFiles(job.buildId(), finalFiles);
                savedFiles = finalFiles;
            }
            store.updateVerified(job.buildId(), repair.verified());

            recordUsage(job);

            outcome = Boolean.FALSE.equals(repair.verified()) ? "unverified" : "complete";
            publishDone(job, finalFiles, repair.verified());
            log.info("Build complete: {} files, verified={}, stop={}", finalFiles.size(), repair.verified(),
                    repair.stopReason());
        } catch (RuntimeException e) {
            log.error("Build stream error", e);
            String message = e.getMessage() != null ? e.getMessage() : "Something went wrong.";
            if (savedAsComplete) {
                // Already persisted as complete; the client still gets the build id
                outcome = "complete";
                publishDone(job, savedFiles, null);
            } else {
                try {
                    store.markFailed(job.buildId(), message);
                } catch (RuntimeException storeError) {
                    log.warn("Could not mark build failed: {}", storeError.getMessage());
                }
                publish(job, BuildEvent.ERROR, Map.of("message", "Build failed: " + message));
            }
        } finally {
            metrics.recordBuildResult(outcome);
            metrics.recordBuildDuration(framework.wireName(), System.currentTimeMillis() - start);
            MdcContext.clear();
        }
    }

    /**
     * Streams the generation response through the extractor and returns the completed files.
     * The stream ends early at the deadline cutoff or on cancellation.
     */
    List<GeneratedFile> generate(BuildJob job, DeadlineGuard deadline) {
        String systemPrompt = assembler.systemPrompt(job.specification(), job.configuration());
        var extractor = new StreamingFileExtractor();
        var persisted = new PersistenceChain(job.buildId());

        Flux<String> deltas = client.streamProject(systemPrompt, assembler.userPrompt())
                .take(deadline.timeUntilCutoff())
                .takeUntilOther(job.cancellation());

        try {
            try (Stream<String> stream = deltas.toStream()) {
                Iterator<String> it = stream.iterator();
                while (it.hasNext()) {
                    handle(job, extractor, extractor.feed(it.next()), persisted);
                    if (job.isCancelled()) {
                        log.info("Build cancelled during generation");
                        break;
                    }
                }
            }
            if (deadline.isExpired()) {
                log.warn("Generation cut off at the deadline after {}s", deadline.elapsed().toSeconds());
                metrics.incrementDeadlineAborts("generation");
            }
            // Truncated output still yields its last file
            handle(job, extractor, extractor.finish(), persisted);
            return extractor.files();
        } finally {
            persisted.await();
        }
    }

    private void handle(BuildJob job, StreamingFileExtractor extractor, List<ExtractionEvent> events,
                        PersistenceChain persisted) {
        for (ExtractionEvent event : events) {
            if (event instanceof ExtractionEvent.FileStarted started) {
                publish(job, BuildEvent.FILE_START, Map.of("path", started.path()));
            } else if (event instanceof ExtractionEvent.FileChunk chunk) {
                publish(job, BuildEvent.FILE_CHUNK, Map.of("path", chunk.path(), "text", chunk.text()));
            } else if (event instanceof ExtractionEvent.FileCompleted completed) {
                persisted.write(extractor.files());
                publish(job, BuildEvent.FILE_COMPLETE, Map.of("path", completed.path(), "content", completed.content()));
            }
        }
    }

    private void recordUsage(BuildJob job) {
        try {
            usageMeter.recordGeneration(job.projectId(), job.buildId());
        } catch (RuntimeException e) {
            log.error("Failed to record usage: {}", e.getMessage(), e);
        }
    }

    private void publishDone(BuildJob job, List<GeneratedFile> files, Boolean verified) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("buildId", job.buildId());
        payload.put("files", files);
        payload.put("fileCount", files.size());
        payload.put("verified", verified);
        eventBus.publish(BuildEvent.of(BuildEvent.DONE, job.buildId(), payload));
    }

    private void publish(BuildJob job, String type, Map<String, Object> payload) {
        eventBus.publish(BuildEvent.of(type, job.buildId(), new LinkedHashMap<>(payload)));
    }

    /**
     * Fire-and-forget file set writes, chained so they land in order. A failed write is
     * logged and the chain continues.
     */
    private final class PersistenceChain {

        private final String buildId;
        private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);

        PersistenceChain(String buildId) {
            this.buildId = buildId;
        }

        void write(List<GeneratedFile> snapshot) {
            tail = tail.thenRunAsync(() -> {
                try {
                    store.updateFiles(buildId, snapshot);
                } catch (RuntimeException e) {
                    log.warn("Failed to persist partial files for build {}: {}", buildId, e.getMessage());
                }
            });
        }

        /** Lets queued writes land before the synchronous status write. */
        void await() {
            try {
                tail.join();
            } catch (RuntimeException e) {
                log.warn("Partial file persistence ended with error: {}", e.getMessage());
            }
        }
    }
}
