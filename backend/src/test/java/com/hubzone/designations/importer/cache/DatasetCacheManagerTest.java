package com.hubzone.designations.importer.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hubzone.designations.config.ImportProperties;
import com.hubzone.designations.importer.error.DatasetUnavailableException;
import com.hubzone.designations.importer.http.PoliteHttpClient;
import com.hubzone.designations.importer.model.CacheEntry;
import com.hubzone.designations.importer.model.DatasetAcquisition;
import com.hubzone.designations.importer.model.DatasetFormat;
import com.hubzone.designations.importer.model.DatasetRequest;
import com.hubzone.designations.importer.model.DatasetSource;
import com.hubzone.designations.importer.model.LocalDataset;
import com.hubzone.designations.importer.persistence.DatasetCacheJdbcRepository;
import com.hubzone.designations.importer.util.HashUtils;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DatasetCacheManagerTest {
    private static final String CSV = "geoid,state,county,type,status,designation_date,expiration_date\n"
        + "11001000100,11,001,qct,active,2020-01-01,\n";

    @TempDir
    Path cacheDir;

    private final Clock clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);
    private final DatasetCacheJdbcRepository repository = Mockito.mock(DatasetCacheJdbcRepository.class);
    private MockWebServer server;
    private ExecutorService httpExecutor;
    private ExecutorService fetchExecutor;
    private DatasetCacheManager cacheManager;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();

        ImportProperties properties = new ImportProperties();
        properties.getCache().setDirectory(cacheDir.toString());
        properties.getCache().setTtlDays(30);
        properties.getFetch().setMaxAttempts(2);
        properties.getFetch().setPerHostDelayMs(1);
        properties.getFetch().setRetryBaseDelayMs(1);
        properties.getFetch().setRetryMaxDelayMs(5);
        properties.getFetch().setRequestTimeoutSeconds(5);

        httpExecutor = Executors.newFixedThreadPool(2);
        fetchExecutor = Executors.newFixedThreadPool(2);
        cacheManager = new DatasetCacheManager(
            new PoliteHttpClient(properties, httpExecutor),
            repository,
            new DatasetPayloadValidator(new ObjectMapper()),
            properties,
            fetchExecutor,
            clock
        );
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        httpExecutor.shutdownNow();
        fetchExecutor.shutdownNow();
    }

    @Test
    void missDownloadsAndRecordsEntry() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(CSV));
        DatasetRequest request = request(server.url("/designations.csv").toString(), null);

        LocalDataset dataset = cacheManager.acquire(request);

        assertThat(dataset.fromCache()).isFalse();
        assertThat(Files.readString(dataset.path())).isEqualTo(CSV);
        assertThat(dataset.checksum()).isEqualTo(HashUtils.sha256Hex(CSV.getBytes(StandardCharsets.UTF_8)));

        ArgumentCaptor<CacheEntry> captor = ArgumentCaptor.forClass(CacheEntry.class);
        verify(repository).upsert(captor.capture());
        CacheEntry entry = captor.getValue();
        assertThat(entry.cacheKey()).isEqualTo("sba_designations-2022");
        assertThat(entry.expiresAt()).isEqualTo(clock.instant().plus(Duration.ofDays(30)));
        assertThat(entry.sourceUrl()).isEqualTo(request.url());
    }

    @Test
    void freshEntryIsServedWithoutNetwork() throws Exception {
        DatasetRequest request = request(server.url("/designations.csv").toString(), null);
        Path file = Files.writeString(cacheDir.resolve("cached.csv"), CSV);
        when(repository.findByKey(request.cacheKey())).thenReturn(entry(request, file, clock.instant().plusSeconds(3600), HashUtils.sha256Hex(file)));

        LocalDataset dataset = cacheManager.acquire(request);

        assertThat(dataset.fromCache()).isTrue();
        assertThat(dataset.path()).isEqualTo(file);
        assertThat(server.getRequestCount()).isZero();
        verify(repository, never()).upsert(any());
    }

    @Test
    void staleEntryIsRefetched() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(CSV));
        DatasetRequest request = request(server.url("/designations.csv").toString(), null);
        Path file = Files.writeString(cacheDir.resolve("stale.csv"), CSV);
        when(repository.findByKey(request.cacheKey())).thenReturn(entry(request, file, clock.instant(), HashUtils.sha256Hex(file)));

        LocalDataset dataset = cacheManager.acquire(request);

        assertThat(dataset.fromCache()).isFalse();
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void corruptedCachedFileIsRefetched() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(CSV));
        DatasetRequest request = request(server.url("/designations.csv").toString(), null);
        Path file = Files.writeString(cacheDir.resolve("corrupt.csv"), "geoid,state\n");
        when(repository.findByKey(request.cacheKey())).thenReturn(
            entry(request, file, clock.instant().plusSeconds(3600), HashUtils.sha256Hex(CSV.getBytes(StandardCharsets.UTF_8))));

        LocalDataset dataset = cacheManager.acquire(request);

        assertThat(dataset.fromCache()).isFalse();
        assertThat(Files.readString(dataset.path())).isEqualTo(CSV);
    }

    @Test
    void publishedChecksumMismatchFailsAfterRetries() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("0".repeat(64) + "  designations.csv\n"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody(CSV));
        server.enqueue(new MockResponse().setResponseCode(200).setBody(CSV));
        DatasetRequest request = request(
            server.url("/designations.csv").toString(),
            server.url("/designations.csv.sha256").toString()
        );

        assertThatThrownBy(() -> cacheManager.acquire(request))
            .isInstanceOf(DatasetUnavailableException.class)
            .hasMessageContaining("checksum mismatch");
        assertThat(server.getRequestCount()).isEqualTo(3);
        verify(repository, never()).upsert(any());
    }

    @Test
    void acquireAllReportsFailuresPerRequest() {
        server.enqueue(new MockResponse().setResponseCode(500));
        server.enqueue(new MockResponse().setResponseCode(500));
        DatasetRequest request = request(server.url("/down.csv").toString(), null);

        List<DatasetAcquisition> outcomes = cacheManager.acquireAll(List.of(request));

        assertThat(outcomes).hasSize(1);
        assertThat(outcomes.get(0).succeeded()).isFalse();
        assertThat(outcomes.get(0).failure().source()).isEqualTo(DatasetSource.DESIGNATIONS);
        assertThat(outcomes.get(0).failure().getMessage()).contains("http_500");
    }

    @Test
    void evictExpiredRemovesFileAndEntry() throws Exception {
        DatasetRequest request = request("https://example.test/designations.csv", null);
        Path file = Files.writeString(cacheDir.resolve("old.csv"), CSV);
        CacheEntry expired = entry(request, file, clock.instant().minusSeconds(1), "x");
        when(repository.findExpired(clock.instant())).thenReturn(List.of(expired));

        int evicted = cacheManager.evictExpired();

        assertThat(evicted).isEqualTo(1);
        assertThat(Files.exists(file)).isFalse();
        verify(repository).delete(expired.cacheKey());
    }

    private static DatasetRequest request(String url, String checksumUrl) {
        return new DatasetRequest(DatasetSource.DESIGNATIONS, DatasetFormat.CSV, null, url, checksumUrl, 2022);
    }

    private CacheEntry entry(DatasetRequest request, Path file, Instant expiresAt, String checksum) throws Exception {
        return new CacheEntry(
            request.cacheKey(),
            request.source(),
            request.stateFips(),
            request.url(),
            file.toString(),
            clock.instant().minusSeconds(60),
            expiresAt,
            checksum,
            Files.size(file)
        );
    }
}
