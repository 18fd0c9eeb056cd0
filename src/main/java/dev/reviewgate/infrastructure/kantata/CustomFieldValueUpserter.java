package dev.reviewgate.infrastructure.kantata;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Idempotent "set value" on top of Kantata's separate create and update calls.
 *
 * <p>Fetch first: an existing value is updated by its id, a missing one (404 or empty results)
 * is created. Any other lookup failure is thrown as-is; we never guess between create and update,
 * since calling the wrong one is an error on Kantata's side and a blind create can leave duplicates.
 */
@Component
public class CustomFieldValueUpserter {

    private static final Logger log = LoggerFactory.getLogger(CustomFieldValueUpserter.class);

    private final KantataApiClient client;

    public CustomFieldValueUpserter(KantataApiClient client) {
        this.client = client;
    }

    public UpsertOutcome upsert(String projectId, String fieldId, String value) {
        return client.findCustomFieldValue(projectId, fieldId)
                .map(existing -> {
                    log.debug("Custom field {} on workspace {} exists as {} ({} -> {})",
                            fieldId, projectId, existing.id(), existing.value(), value);
                    client.updateCustomFieldValue(existing.id(), value);
                    return UpsertOutcome.UPDATED;
                })
                .orElseGet(() -> {
                    client.createCustomFieldValue(projectId, fieldId, value);
                    return UpsertOutcome.CREATED;
                });
    }
}
