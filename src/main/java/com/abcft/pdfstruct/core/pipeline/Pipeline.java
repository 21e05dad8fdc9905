package com.abcft.pdfstruct.core.pipeline;

import com.abcft.pdfstruct.core.ProcessContext;
import com.abcft.pdfstruct.core.model.Document;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs stages one after another against a single document.
 *
 * <p>A stage starts only when the previous one has completed, so no two stages ever touch the document
 * at the same time. Independent documents can go through independent runs concurrently, each with its
 * own {@link ProcessContext}.</p>
 */
public final class Pipeline {

    private final List<Stage> stages;

    public Pipeline(List<? extends Stage> stages) {
        this.stages = ImmutableList.copyOf(stages);
    }

    public Pipeline(Stage... stages) {
        this.stages = ImmutableList.copyOf(stages);
    }

    public List<Stage> getStages() {
        return stages;
    }

    public CompletableFuture<Document> run(Document document, ProcessContext context) {
        return run(document, stages, context, PipelineCallback.NONE);
    }

    public CompletableFuture<Document> run(Document document, ProcessContext context, PipelineCallback callback) {
        return run(document, stages, context, callback);
    }

    public Document execute(Document document, ProcessContext context) throws StageExecutionException {
        return execute(document, stages, context, PipelineCallback.NONE);
    }

    public static CompletableFuture<Document> run(Document document, List<? extends Stage> stages,
                                                  ProcessContext context) {
        return run(document, stages, context, PipelineCallback.NONE);
    }

    /**
     * Applies the stages in order.
     *
     * @param document the input document.
     * @param stages the stages, in execution order.
     * @param context the context of this run.
     * @param callback progress callback, may be {@code null}.
     * @return a future of the final document. When a stage fails the future completes exceptionally with
     * a {@link StageExecutionException} naming that stage, and the later stages are skipped.
     */
    public static CompletableFuture<Document> run(Document document, List<? extends Stage> stages,
                                                  ProcessContext context, PipelineCallback callback) {
        List<Stage> plan = ImmutableList.copyOf(stages);
        PipelineCallback cb = callback != null ? callback : PipelineCallback.NONE;
        Stopwatch total = Stopwatch.createStarted();
        context.info("Pipeline started with {} stages", plan.size());
        cb.onStart(document);

        CompletableFuture<Document> future = CompletableFuture.completedFuture(document);
        for (Stage stage : plan) {
            future = future.thenCompose(current -> runStage(stage, current, context, cb));
        }
        return future.thenApply(result -> {
            context.info("Pipeline finished in {} ms", total.elapsed(TimeUnit.MILLISECONDS));
            cb.onFinished(result);
            return result;
        });
    }

    /**
     * Blocking variant of {@link #run(Document, List, ProcessContext, PipelineCallback)}.
     *
     * @throws StageExecutionException if a stage fails.
     */
    public static Document execute(Document document, List<? extends Stage> stages, ProcessContext context,
                                   PipelineCallback callback) throws StageExecutionException {
        try {
            return run(document, stages, context, callback).get();
        } catch (ExecutionException e) {
            throw asStageException(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StageExecutionException("<interrupted>", e);
        }
    }

    private static StageExecutionException asStageException(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof StageExecutionException) {
            return (StageExecutionException) cause;
        }
        return new StageExecutionException("<pipeline>", cause);
    }

    private static CompletableFuture<Document> runStage(Stage stage, Document document, ProcessContext context,
                                                        PipelineCallback callback) {
        String name = stage.getName();
        Stopwatch stopwatch = Stopwatch.createStarted();
        context.info("Stage {} started", name);
        CompletableFuture<Document> stageFuture;
        try {
            stageFuture = stage.process(document, context);
            if (stageFuture == null) {
                stageFuture = CompletableFuture.failedFuture(
                        new IllegalStateException("Stage returned no future"));
            }
        } catch (RuntimeException e) {
            stageFuture = CompletableFuture.failedFuture(e);
        }
        return stageFuture.handle((result, error) -> {
            if (error == null && result == null) {
                error = new IllegalStateException("Stage returned no document");
            }
            if (error != null) {
                Throwable cause = unwrap(error);
                context.error(cause, "Stage {} failed after {} ms", name, stopwatch.elapsed(TimeUnit.MILLISECONDS));
                callback.onFatalError(name, cause);
                throw new CompletionException(new StageExecutionException(name, cause));
            }
            context.info("Stage {} finished in {} ms", name, stopwatch.elapsed(TimeUnit.MILLISECONDS));
            try {
                callback.onStageFinished(name, result);
            } catch (RuntimeException e) {
                context.error(e, "Callback of stage {} failed", name);
                throw new CompletionException(new StageExecutionException(name, e));
            }
            return result;
        });
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

}
