package com.abcft.pdfstruct.core;

import org.apache.logging.log4j.Logger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ProcessContextTest {

    @Mock
    private Logger logger;

    @Test
    void shouldRecordAndLogWarnings() {
        ProcessContext context = new ProcessContext("report.pdf", logger);

        context.warn("Page {}: table discarded", 3);
        IOException cause = new IOException("timeout");
        context.warn(cause, "Page {}: extraction failed", 4);

        assertThat(context.getWarnings()).containsExactly(
                "Page 3: table discarded",
                "Page 4: extraction failed: java.io.IOException: timeout");
        verify(logger).warn("[{}] {}", "report.pdf", "Page 3: table discarded");
        verify(logger).warn(eq("[report.pdf] Page 4: extraction failed"), eq(cause));
    }

    @Test
    void shouldNotRecordInfoMessages() {
        ProcessContext context = new ProcessContext("report.pdf", logger);

        context.info("Stage {} started", "table-detection");

        assertThat(context.hasWarnings()).isFalse();
        verify(logger).info("[{}] {}", "report.pdf", "Stage table-detection started");
    }

}
