package com.abcft.pdfstruct.core.pipeline;

import com.abcft.pdfstruct.core.ProcessContext;
import com.abcft.pdfstruct.core.model.BoundingBox;
import com.abcft.pdfstruct.core.model.Document;
import com.abcft.pdfstruct.core.model.Font;
import com.abcft.pdfstruct.core.model.Page;
import com.abcft.pdfstruct.core.model.Word;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isA;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class PipelineTest {

    @Mock
    private PipelineCallback callback;

    private ProcessContext context;
    private Document document;
    private List<String> trace;

    @BeforeEach
    void setUp() {
        context = new ProcessContext("pipeline-test");
        document = new Document(Collections.singletonList(
                new Page(1, Collections.emptyList(), new BoundingBox(0, 0, 612, 792))));
        trace = Collections.synchronizedList(new ArrayList<>());
    }

    private Stage recording(String name) {
        return new SyncStage(name) {
            @Override
            protected Document apply(Document document, ProcessContext context) {
                trace.add(name);
                return document;
            }
        };
    }

    private Stage failing(String name, Exception error) {
        return new SyncStage(name) {
            @Override
            protected Document apply(Document document, ProcessContext context) throws Exception {
                trace.add(name);
                throw error;
            }
        };
    }

    /**
     * Completes on another thread, like a stage waiting for an external tool.
     */
    private Stage async(String name) {
        return new Stage() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public CompletableFuture<Document> process(Document document, ProcessContext context) {
                return CompletableFuture.supplyAsync(() -> {
                    try {
                        Thread.sleep(10);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    trace.add(name);
                    return document;
                });
            }
        };
    }

    @Test
    void shouldRunStagesInDeclaredOrder() throws Exception {
        Document result = Pipeline.run(document,
                Arrays.asList(recording("first"), async("second"), recording("third")), context).get();

        assertThat(result).isSameAs(document);
        assertThat(trace).containsExactly("first", "second", "third");
    }

    @Test
    void shouldPassDocumentReturnedByPreviousStage() throws Exception {
        Stage replace = new SyncStage("replace") {
            @Override
            protected Document apply(Document input, ProcessContext context) {
                Page page = new Page(1, Collections.singletonList(
                        new Word(new BoundingBox(0, 0, 10, 10), "new", Font.UNDEFINED)), input.getPage(1).getBox());
                return new Document(Collections.singletonList(page), "replaced.pdf");
            }
        };
        List<Document> seen = new ArrayList<>();
        Stage inspect = new SyncStage("inspect") {
            @Override
            protected Document apply(Document input, ProcessContext context) {
                seen.add(input);
                return input;
            }
        };

        Document result = new Pipeline(replace, inspect).execute(document, context);

        assertThat(result.getInputFile()).isEqualTo("replaced.pdf");
        assertThat(seen).containsExactly(result);
    }

    @Test
    void shouldAbortOnFailureAndNameTheStage() {
        IOException error = new IOException("tool crashed");
        CompletableFuture<Document> future = Pipeline.run(document,
                Arrays.asList(recording("first"), failing("broken", error), recording("never")), context, callback);

        assertThatThrownBy(future::get)
                .isInstanceOf(ExecutionException.class)
                .cause()
                .isInstanceOf(StageExecutionException.class)
                .hasCause(error)
                .hasMessageContaining("broken");
        assertThat(trace).containsExactly("first", "broken");
        verify(callback).onFatalError("broken", error);
        verify(callback, never()).onFinished(any());
    }

    @Test
    void shouldThrowStageExecutionExceptionFromExecute() {
        IllegalStateException error = new IllegalStateException("bad state");
        Pipeline pipeline = new Pipeline(async("first"), failing("second", error));

        assertThatThrownBy(() -> pipeline.execute(document, context))
                .isInstanceOfSatisfying(StageExecutionException.class, e -> {
                    assertThat(e.getStageName()).isEqualTo("second");
                    assertThat(e.getCause()).isSameAs(error);
                });
    }

    @Test
    void shouldFailWhenStageReturnsNoDocument() {
        Stage empty = new SyncStage("empty") {
            @Override
            protected Document apply(Document document, ProcessContext context) {
                return null;
            }
        };

        assertThatThrownBy(() -> new Pipeline(empty).execute(document, context))
                .isInstanceOfSatisfying(StageExecutionException.class,
                        e -> assertThat(e.getStageName()).isEqualTo("empty"));
    }

    @Test
    void shouldNameTheStageWhoseCallbackFailed() {
        IllegalStateException error = new IllegalStateException("listener broke");
        doThrow(error).when(callback).onStageFinished("first", document);
        List<Stage> stages = Arrays.asList(recording("first"), recording("second"));

        assertThatThrownBy(() -> Pipeline.execute(document, stages, context, callback))
                .isInstanceOfSatisfying(StageExecutionException.class, e -> {
                    assertThat(e.getStageName()).isEqualTo("first");
                    assertThat(e.getCause()).isSameAs(error);
                });
        assertThat(trace).containsExactly("first");
    }

    @Test
    void shouldReportProgressToCallback() throws Exception {
        new Pipeline(recording("first"), recording("second")).run(document, context, callback).get();

        InOrder order = inOrder(callback);
        order.verify(callback).onStart(document);
        order.verify(callback).onStageFinished("first", document);
        order.verify(callback).onStageFinished("second", document);
        order.verify(callback).onFinished(same(document));
        verify(callback, never()).onFatalError(eq("first"), isA(Throwable.class));
    }

    @Test
    void shouldReturnInputForEmptyPipeline() throws Exception {
        assertThat(new Pipeline(Collections.emptyList()).run(document, context).get()).isSameAs(document);
    }

}
