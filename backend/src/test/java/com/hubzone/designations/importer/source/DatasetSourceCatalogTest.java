package com.hubzone.designations.importer.source;

import com.hubzone.designations.config.ImportProperties;
import com.hubzone.designations.importer.model.DatasetFormat;
import com.hubzone.designations.importer.model.DatasetRequest;
import com.hubzone.designations.importer.model.DatasetSource;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DatasetSourceCatalogTest {
    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T00:00:00Z"), ZoneOffset.UTC);

    @Test
    void fallbackRequestsResolveTemplatesAndCacheSeparately() {
        ImportProperties properties = new ImportProperties();
        properties.getSources().getDesignations().setUrlTemplate("https://sba.example/designations.csv");
        properties.getSources().getDesignations().setFallbackUrlTemplates(Arrays.asList(
            "https://sba.example/{vintage}/qct.csv",
            "  ",
            "https://sba.example/{vintage}/indian-lands.csv"
        ));
        DatasetSourceCatalog catalog = new DatasetSourceCatalog(properties, clock);
        DatasetRequest primary = catalog.request(DatasetSource.DESIGNATIONS, null);

        List<DatasetRequest> fallbacks = catalog.fallbackRequests(primary);

        assertThat(primary.isFallback()).isFalse();
        assertThat(fallbacks).extracting(DatasetRequest::url).containsExactly(
            "https://sba.example/2023/qct.csv",
            "https://sba.example/2023/indian-lands.csv"
        );
        assertThat(fallbacks).allSatisfy(request -> {
            assertThat(request.isFallback()).isTrue();
            assertThat(request.format()).isEqualTo(DatasetFormat.CSV);
            assertThat(request.checksumUrl()).isNull();
        });
        assertThat(fallbacks).extracting(DatasetRequest::cacheKey).containsExactly(
            "sba_designations-fallback-1-2023",
            "sba_designations-fallback-2-2023"
        );
        assertThat(primary.cacheKey()).isEqualTo("sba_designations-2023");
    }

    @Test
    void sourceWithoutFallbacksYieldsNone() {
        ImportProperties properties = new ImportProperties();
        properties.getSources().getBoundaries().setUrlTemplate("https://tiger.example/{state}.geojson");
        DatasetSourceCatalog catalog = new DatasetSourceCatalog(properties, clock);

        DatasetRequest stateRequest = catalog.request(DatasetSource.BOUNDARIES, "11");

        assertThat(stateRequest.url()).isEqualTo("https://tiger.example/11.geojson");
        assertThat(catalog.fallbackRequests(stateRequest)).isEmpty();
    }
}
