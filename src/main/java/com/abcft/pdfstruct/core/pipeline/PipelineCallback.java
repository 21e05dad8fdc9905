package com.abcft.pdfstruct.core.pipeline;

import com.abcft.pdfstruct.core.model.Document;

/**
 * Progress callback of a {@link Pipeline} run.
 *
 * <p>Methods may be called from the thread that completed the previous stage.</p>
 */
public interface PipelineCallback {

    PipelineCallback NONE = new PipelineCallback() {
    };

    /**
     * Called before the first stage runs.
     *
     * @param document the input document.
     */
    default void onStart(Document document) {

    }

    /**
     * Called after a stage completed normally.
     *
     * @param stageName name of the stage.
     * @param document the document returned by the stage.
     */
    default void onStageFinished(String stageName, Document document) {

    }

    /**
     * Called when a stage fails. No further stage runs after this.
     *
     * @param stageName name of the failing stage.
     * @param e the error occurred.
     */
    default void onFatalError(String stageName, Throwable e) {

    }

    /**
     * Called when every stage completed normally.
     *
     * @param document the final document.
     */
    default void onFinished(Document document) {

    }

}
