package com.netcourier.rag.service.ingestion.statemachine;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
class IngestionStateTransitionsTest {

    @Autowired
    private IngestionStateTransitions transitions;

    @Test
    void walksTheHappyPath() {
        IngestionStates state = IngestionStates.RECEIVED;
        state = transitions.apply("doc-1:1", state, IngestionEvents.CHUNK);
        assertThat(state).isEqualTo(IngestionStates.CHUNKED);
        state = transitions.apply("doc-1:1", state, IngestionEvents.ENQUEUE);
        assertThat(state).isEqualTo(IngestionStates.QUEUED);
        state = transitions.apply("doc-1:1", state, IngestionEvents.EMBED);
        assertThat(state).isEqualTo(IngestionStates.EMBEDDING);
        state = transitions.apply("doc-1:1", state, IngestionEvents.COMPLETE);
        assertThat(state).isEqualTo(IngestionStates.INDEXED);
    }

    @Test
    void failedVersionsCanOnlyBeRetried() {
        IngestionStates failed = transitions.apply("doc-2:1", IngestionStates.EMBEDDING, IngestionEvents.FAIL);
        assertThat(failed).isEqualTo(IngestionStates.FAILED);

        assertThatThrownBy(() -> transitions.apply("doc-2:1", failed, IngestionEvents.COMPLETE))
                .isInstanceOf(IllegalStateException.class);
        assertThat(transitions.apply("doc-2:1", failed, IngestionEvents.RETRY)).isEqualTo(IngestionStates.QUEUED);
    }

    @Test
    void indexedIsTerminal() {
        assertThatThrownBy(() -> transitions.apply("doc-3:1", IngestionStates.INDEXED, IngestionEvents.FAIL))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("INDEXED");
        assertThatThrownBy(() -> transitions.apply("doc-3:1", IngestionStates.INDEXED, IngestionEvents.EMBED))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void cannotSkipStates() {
        assertThatThrownBy(() -> transitions.apply("doc-4:1", IngestionStates.RECEIVED, IngestionEvents.EMBED))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> transitions.apply("doc-4:1", IngestionStates.CHUNKED, IngestionEvents.COMPLETE))
                .isInstanceOf(IllegalStateException.class);
    }
}
