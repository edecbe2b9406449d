package ai.contract.segmenter.batch;

import ai.contract.segmenter.load.ContractLoadException;
import ai.contract.segmenter.load.ContractLoader;
import ai.contract.segmenter.segment.ContractSegmenter;
import ai.contract.segmenter.segment.SegmentationResult;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Loads and segments a set of contract documents, one independent task per document.
 *
 * <p>Documents share no segmentation state, so they run on a fixed pool of worker threads. Results are reported
 * in input order; a document that fails to load is recorded as a failure without affecting the others.
 */
public class BatchSegmentationService {

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchSegmentationService.class);

    static final String MDC_DOCUMENT = "document";

    private final ContractLoader loader;
    private final ContractSegmenter segmenter;
    private final int parallelism;

    public BatchSegmentationService(ContractLoader loader, ContractSegmenter segmenter, int parallelism) {
        this.loader = Objects.requireNonNull(loader, "loader");
        this.segmenter = Objects.requireNonNull(segmenter, "segmenter");
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1");
        }
        this.parallelism = parallelism;
    }

    public BatchOutcome process(List<Path> sources) {
        if (sources == null || sources.isEmpty()) {
            return new BatchOutcome(List.of(), List.of());
        }
        int threads = Math.min(parallelism, sources.size());
        if (threads == 1) {
            List<TaskResult> results = new ArrayList<>(sources.size());
            for (Path source : sources) {
                results.add(segmentDocument(source));
            }
            return collect(results);
        }

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<TaskResult>> futures = new ArrayList<>(sources.size());
            for (Path source : sources) {
                futures.add(executor.submit(() -> segmentDocument(source)));
            }
            List<TaskResult> results = new ArrayList<>(futures.size());
            for (Future<TaskResult> future : futures) {
                results.add(await(future));
            }
            return collect(results);
        } finally {
            executor.shutdownNow();
        }
    }

    private TaskResult segmentDocument(Path source) {
        MDC.put(MDC_DOCUMENT, String.valueOf(source.getFileName()));
        try {
            String text = loader.load(source);
            SegmentationResult result = segmenter.segment(text);
            LOGGER.info("Segmented {} into {} sections and {} clauses",
                    source.getFileName(), result.sections().size(), result.clauses().size());
            return TaskResult.success(new DocumentSegmentation(source, result));
        } catch (ContractLoadException ex) {
            LOGGER.error("Failed to load {}: {}", source, ex.getMessage(), ex);
            return TaskResult.failure(new DocumentFailure(source, ex.getMessage()));
        } finally {
            MDC.remove(MDC_DOCUMENT);
        }
    }

    private TaskResult await(Future<TaskResult> future) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for segmentation results", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException("Segmentation task failed", cause);
        }
    }

    private BatchOutcome collect(List<TaskResult> results) {
        List<DocumentSegmentation> segmentations = new ArrayList<>();
        List<DocumentFailure> failures = new ArrayList<>();
        for (TaskResult result : results) {
            if (result.segmentation() != null) {
                segmentations.add(result.segmentation());
            } else {
                failures.add(result.failure());
            }
        }
        return new BatchOutcome(segmentations, failures);
    }

    private record TaskResult(DocumentSegmentation segmentation, DocumentFailure failure) {

        static TaskResult success(DocumentSegmentation segmentation) {
            return new TaskResult(segmentation, null);
        }

        static TaskResult failure(DocumentFailure failure) {
            return new TaskResult(null, failure);
        }
    }
}
