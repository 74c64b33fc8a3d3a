package com.titlesearch.pipeline.service;

import com.titlesearch.pipeline.model.StageOutcome;
import com.titlesearch.pipeline.queue.QueueNames;
import com.titlesearch.pipeline.queue.StageTaskQueue;
import com.titlesearch.pipeline.queue.TaskFailedException;
import com.titlesearch.pipeline.queue.TaskNames;
import com.titlesearch.pipeline.queue.TaskTimeoutException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChildTaskFanOutTest {

    @Mock
    private StageTaskQueue queue;

    @Test
    void itemFailuresAreCountedNotPropagated() {
        List<Long> items = List.of(1L, 2L, 3L, 4L, 5L, 6L, 7L, 8L, 9L, 10L);
        when(queue.submit(eq(TaskNames.DOWNLOAD_DOCUMENT), eq(77L), any(), isNull(), eq(QueueNames.SCRAPING), any()))
            .thenAnswer(invocation -> "h" + invocation.getArgument(2));
        when(queue.getResult(anyString(), any())).thenAnswer(invocation -> {
            String handle = invocation.getArgument(0);
            if (handle.equals("h2") || handle.equals("h5") || handle.equals("h9")) {
                throw new TaskFailedException("DocumentDownloadException: nothing to download");
            }
            return StageOutcome.success("Downloaded");
        });

        StageOutcome outcome = new ChildTaskFanOut(queue).run(
            77L, TaskNames.DOWNLOAD_DOCUMENT, QueueNames.SCRAPING, items, Duration.ofSeconds(5), "Downloaded"
        );

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.total()).isEqualTo(10);
        assertThat(outcome.succeeded()).isEqualTo(7);
        assertThat(outcome.failed()).isEqualTo(3);
        assertThat(outcome.message()).isEqualTo("Downloaded 7 of 10 documents");
        verify(queue, times(3)).revoke(anyString());
    }

    @Test
    void stageFailsWhenEveryItemFails() {
        when(queue.submit(anyString(), anyLong(), any(), any(), anyString(), any())).thenReturn("h");
        when(queue.getResult(anyString(), any()))
            .thenThrow(new TaskTimeoutException("Timed out after 5s waiting for task analyze_document"));

        ChildTaskFanOut fanOut = new ChildTaskFanOut(queue);

        assertThatThrownBy(() -> fanOut.run(
            78L, TaskNames.ANALYZE_DOCUMENT, QueueNames.AI_ANALYSIS, List.of(1L, 2L), Duration.ofSeconds(5), "Analyzed"
        ))
            .isInstanceOf(StageFailedException.class)
            .hasMessageContaining("Analyzed 0 of 2 documents")
            .hasMessageContaining("Timed out after 5s");
    }

    @Test
    void skippedItemsAreNeitherSuccessesNorFailures() {
        when(queue.submit(anyString(), anyLong(), any(), any(), anyString(), any())).thenReturn("a", "b");
        when(queue.getResult(eq("a"), any())).thenReturn(StageOutcome.success("ok"));
        when(queue.getResult(eq("b"), any())).thenReturn(StageOutcome.skipped("already downloaded"));

        StageOutcome outcome = new ChildTaskFanOut(queue).run(
            79L, TaskNames.DOWNLOAD_DOCUMENT, QueueNames.SCRAPING, List.of(1L, 2L), Duration.ofSeconds(5), "Downloaded"
        );

        assertThat(outcome.succeeded()).isEqualTo(1);
        assertThat(outcome.failed()).isZero();
        verify(queue, never()).revoke(anyString());
    }

    @Test
    void noItemsIsASuccessWithoutDispatch() {
        StageOutcome outcome = new ChildTaskFanOut(queue).run(
            80L, TaskNames.DOWNLOAD_DOCUMENT, QueueNames.SCRAPING, List.of(), Duration.ofSeconds(5), "Downloaded"
        );

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.total()).isZero();
        verifyNoInteractions(queue);
    }
}
