package dev.reviewgate.infrastructure.kantata;

import dev.reviewgate.config.KantataProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static dev.reviewgate.domain.enums.ReviewStatus.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

class KantataSyncAdapterTest {

    private final KantataApiClient client = mock(KantataApiClient.class);
    private final CustomFieldValueUpserter upserter = mock(CustomFieldValueUpserter.class);

    @Test
    void approvedMapsToApprovedEverythingElseToInProgress() {
        KantataSyncAdapter adapter = adapter("field-1");
        when(upserter.upsert(anyString(), anyString(), anyString())).thenReturn(UpsertOutcome.UPDATED);

        adapter.pushStatus("123", APPROVED);
        adapter.pushStatus("123", NEEDS_WORK);

        verify(upserter).upsert("123", "field-1", "Approved");
        verify(upserter).upsert("123", "field-1", "In Progress");
    }

    @Test
    void pushWithoutConfiguredFieldFailsWithoutCallingKantata() {
        KantataSyncAdapter adapter = adapter(" ");

        assertThatThrownBy(() -> adapter.pushStatus("123", APPROVED)).isInstanceOf(KantataApiException.class);
        verifyNoInteractions(upserter, client);
    }

    @Test
    void revertUsesSafeDefaultStatusKey() {
        adapter("field-1").revertToSafeDefault("123");

        verify(client).updateProjectStatusKey("123", 305);
    }

    @Test
    void liveIsMatchedByStatusMessage() {
        KantataSyncAdapter adapter = adapter("field-1");

        assertThat(adapter.isLive(new KantataProjectStatus("123", "t", 306, "Live"))).isTrue();
        assertThat(adapter.isLive(new KantataProjectStatus("123", "t", 305, "In Development"))).isFalse();
        assertThat(adapter.isLive(new KantataProjectStatus("123", "t", null, null))).isFalse();
    }

    private KantataSyncAdapter adapter(String fieldId) {
        KantataProperties properties = new KantataProperties("http://localhost", "token", fieldId,
                null, 0, null, null, Duration.ofSeconds(1), null);
        return new KantataSyncAdapter(client, upserter, new StatusVocabulary(properties), properties);
    }
}
