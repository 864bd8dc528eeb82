package com.hubzone.designations.importer.model;

import java.time.LocalDate;

public record AffectedBusinessChange(
    String businessId,
    String businessName,
    HubzoneMembership previousStatus,
    HubzoneMembership newStatus,
    BusinessChangeType changeType,
    String geoid,
    LocalDate gracePeriodEndDate,
    boolean notificationSent
) {
    public AffectedBusinessChange withNotificationSent(boolean sent) {
        return new AffectedBusinessChange(
            businessId,
            businessName,
            previousStatus,
            newStatus,
            changeType,
            geoid,
            gracePeriodEndDate,
            sent
        );
    }
}
