package com.hubzone.designations.importer.model;

public record BusinessLocation(
    String businessId,
    String businessName,
    String stateFips,
    Double latitude,
    Double longitude,
    boolean inHubzone
) {
    public boolean hasCoordinates() {
        return latitude != null
            && longitude != null
            && Double.isFinite(latitude)
            && Double.isFinite(longitude)
            && Math.abs(latitude) <= 90.0
            && Math.abs(longitude) <= 180.0;
    }
}
