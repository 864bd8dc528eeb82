package com.hubzone.designations.importer.model;

import java.nio.file.Path;
import java.time.Instant;

public record LocalDataset(
    DatasetRequest request,
    Path path,
    String checksum,
    long byteSize,
    Instant downloadedAt,
    boolean fromCache
) {
}
