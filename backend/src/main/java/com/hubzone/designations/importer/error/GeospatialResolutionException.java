package com.hubzone.designations.importer.error;

import com.hubzone.designations.importer.util.ImportErrorCodes;

public class GeospatialResolutionException extends ImportException {
    private final String businessId;

    public GeospatialResolutionException(String businessId, String message) {
        super(message, null, null);
        this.businessId = businessId;
    }

    @Override
    public String code() {
        return ImportErrorCodes.GEOSPATIAL_RESOLUTION_ERROR;
    }

    public String businessId() {
        return businessId;
    }
}
