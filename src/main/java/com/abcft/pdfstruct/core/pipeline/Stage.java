package com.abcft.pdfstruct.core.pipeline;

import com.abcft.pdfstruct.core.ProcessContext;
import com.abcft.pdfstruct.core.model.Document;

import java.util.concurrent.CompletableFuture;

/**
 * One document-transforming step of a {@link Pipeline}.
 */
public interface Stage {

    /**
     * @return the name used in logs and in {@link StageExecutionException}.
     */
    String getName();

    /**
     * Transforms the document.
     *
     * <p>The returned future may complete on another thread, typically after awaiting an external
     * collaborator. A failed future aborts the pipeline.</p>
     *
     * @param document the document to transform.
     * @param context the context of the current run.
     * @return the transformed document.
     */
    CompletableFuture<Document> process(Document document, ProcessContext context);

}
