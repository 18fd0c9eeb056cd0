package dev.reviewgate.infrastructure.kantata;

import dev.reviewgate.config.KantataProperties;
import dev.reviewgate.domain.enums.ReviewStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Outbound side of the Kantata mirror. The local database is the system of record; every method here
 * is safe to repeat and throws {@link KantataApiException} without touching local state.
 */
@Component
public class KantataSyncAdapter {

    private static final Logger log = LoggerFactory.getLogger(KantataSyncAdapter.class);

    private final KantataApiClient client;
    private final CustomFieldValueUpserter upserter;
    private final StatusVocabulary vocabulary;
    private final KantataProperties properties;

    public KantataSyncAdapter(KantataApiClient client, CustomFieldValueUpserter upserter,
                              StatusVocabulary vocabulary, KantataProperties properties) {
        this.client = client;
        this.upserter = upserter;
        this.vocabulary = vocabulary;
        this.properties = properties;
    }

    public UpsertOutcome pushStatus(String externalProjectId, ReviewStatus status) {
        if (properties.statusFieldId() == null || properties.statusFieldId().isBlank()) {
            throw new KantataApiException("Kantata status field id is not configured");
        }
        String value = vocabulary.toExternal(status);
        UpsertOutcome outcome = upserter.upsert(externalProjectId, properties.statusFieldId(), value);
        log.info("Pushed status {} ({}) to Kantata workspace {}: {}", status, value, externalProjectId, outcome);
        return outcome;
    }

    public KantataProjectStatus fetchProjectStatus(String externalProjectId) {
        return client.fetchProjectStatus(externalProjectId);
    }

    /**
     * Moves a workspace back to the safe default status (In Development).
     */
    public void revertToSafeDefault(String externalProjectId) {
        client.updateProjectStatusKey(externalProjectId, properties.safeDefaultStatusKey());
        log.warn("Reverted Kantata workspace {} to status key {}", externalProjectId, properties.safeDefaultStatusKey());
    }

    public boolean isLive(KantataProjectStatus status) {
        return status.is(properties.liveStatus());
    }
}
