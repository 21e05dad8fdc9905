package com.abcft.pdfstruct.core.pipeline;

import com.abcft.pdfstruct.core.ProcessContext;
import com.abcft.pdfstruct.core.model.Document;

import java.util.concurrent.CompletableFuture;

/**
 * A {@link Stage} that does its work on the calling thread.
 */
public abstract class SyncStage implements Stage {

    private final String name;

    protected SyncStage(String name) {
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    protected abstract Document apply(Document document, ProcessContext context) throws Exception;

    @Override
    public final CompletableFuture<Document> process(Document document, ProcessContext context) {
        try {
            return CompletableFuture.completedFuture(apply(document, context));
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public String toString() {
        return "SyncStage[" + name + "]";
    }

}
