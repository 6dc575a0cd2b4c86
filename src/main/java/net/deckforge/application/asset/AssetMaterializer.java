package net.deckforge.application.asset;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import net.deckforge.application.asset.AssetOutcome.FailureKind;
import net.deckforge.config.DeckForgeProperties;
import net.deckforge.exception.BuildStructureException;
import net.deckforge.exception.ImageDownloadException;
import net.deckforge.exception.ImageGenerationException;
import net.deckforge.exception.ImageProcessingException;
import net.deckforge.model.image.GeneratedImage;
import net.deckforge.model.image.ProcessedImage;
import net.deckforge.service.image.ImageDownloader;
import net.deckforge.service.image.ImageGenerator;
import net.deckforge.service.image.ImageProcessingService;
import net.deckforge.support.concurrent.BuildCancellation;
import net.deckforge.support.fs.AtomicFileWriter;
import net.deckforge.support.retry.RetrySupport;
import net.deckforge.support.retry.RetrySupport.RetryConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

/**
 * Ensures every asset spec exists as a file in an output directory.
 *
 * <p>Files already present are left untouched, which makes a re-run after a
 * partial failure pick up exactly the missing assets. Missing ones are generated,
 * downloaded when the generator returns a URL, resized to their final size and
 * written atomically. Each asset is independent: a failure becomes an
 * {@link AssetOutcome} and the rest of the batch continues.</p>
 *
 * <p>Assets run on the bounded {@code assetMaterializerExecutor}. Distinct specs
 * have distinct filenames, so workers never write the same file.</p>
 */
@Slf4j
@Service
public class AssetMaterializer {

    private final ImageGenerator imageGenerator;
    private final ImageDownloader imageDownloader;
    private final ImageProcessingService imageProcessingService;
    private final AsyncTaskExecutor executor;
    private final RetryConfig generationRetry;
    private final RetryConfig downloadRetry;

    public AssetMaterializer(ImageGenerator imageGenerator,
                             ImageDownloader imageDownloader,
                             ImageProcessingService imageProcessingService,
                             DeckForgeProperties properties,
                             @Qualifier("assetMaterializerExecutor") AsyncTaskExecutor executor) {
        this.imageGenerator = imageGenerator;
        this.imageDownloader = imageDownloader;
        this.imageProcessingService = imageProcessingService;
        this.executor = executor;
        this.generationRetry = RetryConfig.from(log, properties.getGeneration());
        this.downloadRetry = RetryConfig.from(log, properties.getDownload());
    }

    /**
     * Materializes all specs into {@code outputDir}.
     *
     * @param specs assets to ensure, with distinct filenames
     * @param outputDir directory receiving the files; created if missing
     * @param progress called once per processed spec, never concurrently
     * @param cancellation checked before each spec and during backoff waits
     * @return one outcome per spec, in spec order
     * @throws BuildStructureException if the output directory cannot be prepared
     */
    public MaterializationReport materialize(List<AssetSpec> specs,
                                             Path outputDir,
                                             Consumer<AssetOutcome> progress,
                                             BuildCancellation cancellation) {
        prepareOutputDirectory(outputDir);
        if (specs.isEmpty()) {
            return MaterializationReport.empty();
        }
        log.info("Materializing {} asset(s) into {}", specs.size(), outputDir);

        Object progressLock = new Object();
        Consumer<AssetOutcome> serializedProgress = outcome -> {
            synchronized (progressLock) {
                progress.accept(outcome);
            }
        };

        List<CompletableFuture<AssetOutcome>> futures = new ArrayList<>(specs.size());
        for (AssetSpec spec : specs) {
            futures.add(submit(spec, outputDir, cancellation, serializedProgress));
        }

        List<AssetOutcome> outcomes = new ArrayList<>(specs.size());
        for (CompletableFuture<AssetOutcome> future : futures) {
            outcomes.add(await(future, cancellation));
        }
        MaterializationReport report = new MaterializationReport(outcomes);
        log.info("Materialization finished: {} generated, {} already present, {} failed",
            report.generatedCount(), report.alreadyPresentCount(), report.failures().size());
        return report;
    }

    private CompletableFuture<AssetOutcome> submit(AssetSpec spec, Path outputDir,
                                                   BuildCancellation cancellation,
                                                   Consumer<AssetOutcome> progress) {
        try {
            return CompletableFuture.supplyAsync(() -> {
                AssetOutcome outcome = materializeOne(spec, outputDir, cancellation);
                progress.accept(outcome);
                return outcome;
            }, executor);
        } catch (TaskRejectedException rejected) {
            log.warn("Asset {} could not be scheduled: {}", spec.filename(), rejected.getMessage());
            AssetOutcome outcome = AssetOutcome.failure(spec.filename(), FailureKind.CANCELLED,
                "worker pool is shutting down");
            progress.accept(outcome);
            return CompletableFuture.completedFuture(outcome);
        }
    }

    /**
     * Waits for one asset. An interrupt of the calling thread cancels the run; the
     * remaining workers then finish quickly and are still collected.
     */
    private AssetOutcome await(CompletableFuture<AssetOutcome> future, BuildCancellation cancellation) {
        try {
            if (Thread.currentThread().isInterrupted()) {
                cancellation.cancel();
                return future.join();
            }
            return future.get();
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for assets; cancelling remaining work");
            cancellation.cancel();
            return future.join();
        } catch (ExecutionException executionFailure) {
            // materializeOne converts every failure into an outcome
            throw new IllegalStateException("Asset worker failed unexpectedly", executionFailure.getCause());
        }
    }

    AssetOutcome materializeOne(AssetSpec spec, Path outputDir, BuildCancellation cancellation) {
        String filename = spec.filename();
        if (cancellation.isCancelled()) {
            return AssetOutcome.failure(filename, FailureKind.CANCELLED, "build cancelled before start");
        }
        Path target = outputDir.resolve(filename);
        if (Files.exists(target)) {
            log.debug("Asset {} already present, skipping", filename);
            return AssetOutcome.alreadyPresent(filename, target);
        }

        GeneratedImage generated;
        try {
            generated = RetrySupport.execute(generationRetry, "generation of " + filename, cancellation,
                () -> imageGenerator.generate(spec.prompt(), spec.generationSize(), spec.generatorModel()));
        } catch (CancellationException cancelled) {
            return AssetOutcome.failure(filename, FailureKind.CANCELLED, cancelled.getMessage());
        } catch (ImageGenerationException generationFailure) {
            FailureKind kind = generationFailure.isRetryable()
                ? FailureKind.GENERATION_RETRIES_EXHAUSTED
                : FailureKind.GENERATION_FAILED;
            log.warn("Asset {} failed ({}): {}", filename, kind, generationFailure.getMessage());
            return AssetOutcome.failure(filename, kind, generationFailure.getMessage());
        } catch (RuntimeException unexpected) {
            log.error("Asset {}: unexpected generator error", filename, unexpected);
            return AssetOutcome.failure(filename, FailureKind.GENERATION_FAILED, describe(unexpected));
        }

        ProcessedImage processed;
        try {
            processed = generated.isInline()
                ? imageProcessingService.normalize(generated.inlineBytes(), spec.finalSize(), filename)
                : downloadAndNormalize(spec, generated.url(), cancellation);
        } catch (CancellationException cancelled) {
            return AssetOutcome.failure(filename, FailureKind.CANCELLED, cancelled.getMessage());
        } catch (ImageDownloadException downloadFailure) {
            log.warn("Asset {} download failed: {}", filename, downloadFailure.getMessage());
            return AssetOutcome.failure(filename, FailureKind.DOWNLOAD_FAILED, downloadFailure.getMessage());
        } catch (ImageProcessingException processingFailure) {
            log.warn("Asset {} processing failed: {}", filename, processingFailure.getMessage());
            return AssetOutcome.failure(filename, FailureKind.PROCESSING_FAILED, processingFailure.getMessage());
        } catch (RuntimeException unexpected) {
            FailureKind kind = generated.isInline() ? FailureKind.PROCESSING_FAILED : FailureKind.DOWNLOAD_FAILED;
            log.error("Asset {}: unexpected {} error", filename, kind, unexpected);
            return AssetOutcome.failure(filename, kind, describe(unexpected));
        }

        try {
            AtomicFileWriter.write(target, processed.pngBytes());
        } catch (IOException writeFailure) {
            log.error("Asset {}: failed to write {}", filename, target, writeFailure);
            return AssetOutcome.failure(filename, FailureKind.WRITE_FAILED, describe(writeFailure));
        }
        log.info("Generated asset {} ({})", filename, processed.size());
        return AssetOutcome.generated(filename, target);
    }

    /**
     * Downloads and decodes under one retry budget. Bytes that do not decode are
     * treated as a failed download, since a truncated transfer looks the same.
     */
    private ProcessedImage downloadAndNormalize(AssetSpec spec, String url, BuildCancellation cancellation) {
        return RetrySupport.execute(downloadRetry, "download of " + spec.filename(), cancellation, () -> {
            byte[] raw = imageDownloader.download(url);
            try {
                return imageProcessingService.normalize(raw, spec.finalSize(), spec.filename());
            } catch (ImageProcessingException unreadable) {
                throw new ImageDownloadException(url, "downloaded bytes are not a readable image", true, unreadable);
            }
        });
    }

    private static void prepareOutputDirectory(Path outputDir) {
        try {
            Files.createDirectories(outputDir);
            AtomicFileWriter.removeStalePartials(outputDir);
        } catch (IOException e) {
            throw new BuildStructureException("Cannot prepare asset directory", outputDir, e);
        }
    }

    private static String describe(Throwable failure) {
        return failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
    }
}
