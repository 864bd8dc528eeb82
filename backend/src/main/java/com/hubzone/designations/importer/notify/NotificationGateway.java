package com.hubzone.designations.importer.notify;

import com.hubzone.designations.importer.model.AffectedBusinessChange;
import com.hubzone.designations.importer.model.ImportCompletionNotice;

import java.util.List;

/**
 * Boundary to the notification service. Implementations accept the list of businesses whose HUBZone
 * status changed and own channel selection and delivery; a thrown exception means the hand-off failed.
 */
public interface NotificationGateway {
    void handOff(long executionId, List<AffectedBusinessChange> changes);

    void notifyCompletion(ImportCompletionNotice notice);
}
