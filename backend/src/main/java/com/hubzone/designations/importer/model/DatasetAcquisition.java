package com.hubzone.designations.importer.model;

import com.hubzone.designations.importer.error.DatasetUnavailableException;

public record DatasetAcquisition(
    DatasetRequest request,
    LocalDataset dataset,
    DatasetUnavailableException failure
) {
    public static DatasetAcquisition success(DatasetRequest request, LocalDataset dataset) {
        return new DatasetAcquisition(request, dataset, null);
    }

    public static DatasetAcquisition failure(DatasetRequest request, DatasetUnavailableException failure) {
        return new DatasetAcquisition(request, null, failure);
    }

    public boolean succeeded() {
        return dataset != null;
    }
}
