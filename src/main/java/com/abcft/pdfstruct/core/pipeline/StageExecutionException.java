package com.abcft.pdfstruct.core.pipeline;

/**
 * Thrown when a stage fails; the remaining stages of the pipeline are not run.
 */
public class StageExecutionException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String stageName;

    public StageExecutionException(String stageName, Throwable cause) {
        super(String.format("Stage '%s' failed: %s", stageName, cause), cause);
        this.stageName = stageName;
    }

    /**
     * @return the name of the failing stage.
     */
    public String getStageName() {
        return stageName;
    }

}
