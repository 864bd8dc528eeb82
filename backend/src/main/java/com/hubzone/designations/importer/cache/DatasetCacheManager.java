package com.hubzone.designations.importer.cache;

import com.hubzone.designations.config.ImportProperties;
import com.hubzone.designations.importer.error.DatasetUnavailableException;
import com.hubzone.designations.importer.http.PayloadValidator;
import com.hubzone.designations.importer.http.PoliteHttpClient;
import com.hubzone.designations.importer.model.CacheEntry;
import com.hubzone.designations.importer.model.CacheStats;
import com.hubzone.designations.importer.model.DatasetAcquisition;
import com.hubzone.designations.importer.model.DatasetFormat;
import com.hubzone.designations.importer.model.DatasetRequest;
import com.hubzone.designations.importer.model.HttpFetchResult;
import com.hubzone.designations.importer.model.LocalDataset;
import com.hubzone.designations.importer.persistence.DatasetCacheJdbcRepository;
import com.hubzone.designations.importer.util.HashUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

@Service
public class DatasetCacheManager {
    private static final Logger log = LoggerFactory.getLogger(DatasetCacheManager.class);

    private final PoliteHttpClient httpClient;
    private final DatasetCacheJdbcRepository repository;
    private final DatasetPayloadValidator payloadValidator;
    private final ImportProperties properties;
    private final ExecutorService fetchExecutor;
    private final Clock clock;

    public DatasetCacheManager(
        PoliteHttpClient httpClient,
        DatasetCacheJdbcRepository repository,
        DatasetPayloadValidator payloadValidator,
        ImportProperties properties,
        @Qualifier("datasetFetchExecutor") ExecutorService fetchExecutor,
        Clock clock
    ) {
        this.httpClient = httpClient;
        this.repository = repository;
        this.payloadValidator = payloadValidator;
        this.properties = properties;
        this.fetchExecutor = fetchExecutor;
        this.clock = clock;
    }

    public LocalDataset acquire(DatasetRequest request) {
        LocalDataset cached = findValidCacheEntry(request);
        if (cached != null) {
            log.debug("Cache hit for {} at {}", request.describe(), cached.path());
            return cached;
        }
        return download(request);
    }

    public List<DatasetAcquisition> acquireAll(List<DatasetRequest> requests) {
        List<CompletableFuture<DatasetAcquisition>> futures = requests.stream()
            .map(request -> CompletableFuture.supplyAsync(() -> acquireSafely(request), fetchExecutor))
            .toList();
        return futures.stream()
            .map(CompletableFuture::join)
            .toList();
    }

    public int evictExpired() {
        Instant now = clock.instant();
        List<CacheEntry> expired = repository.findExpired(now);
        for (CacheEntry entry : expired) {
            deleteFile(entry);
            repository.delete(entry.cacheKey());
        }
        if (!expired.isEmpty()) {
            log.info("Evicted {} expired dataset cache entries", expired.size());
        }
        return expired.size();
    }

    public int clear() {
        List<CacheEntry> entries = repository.findAll();
        entries.forEach(this::deleteFile);
        repository.deleteAll();
        log.info("Cleared {} dataset cache entries", entries.size());
        return entries.size();
    }

    public CacheStats stats() {
        return repository.stats(clock.instant());
    }

    private DatasetAcquisition acquireSafely(DatasetRequest request) {
        try {
            return DatasetAcquisition.success(request, acquire(request));
        } catch (DatasetUnavailableException e) {
            log.warn("Dataset {} unavailable: {}", request.describe(), e.getMessage());
            return DatasetAcquisition.failure(request, e);
        } catch (RuntimeException e) {
            log.warn("Unexpected failure acquiring dataset {}", request.describe(), e);
            return DatasetAcquisition.failure(
                request,
                new DatasetUnavailableException(request.source(), request.stateFips(), e.getMessage(), e)
            );
        }
    }

    private LocalDataset findValidCacheEntry(DatasetRequest request) {
        CacheEntry entry = repository.findByKey(request.cacheKey());
        if (entry == null) {
            return null;
        }
        if (entry.isExpired(clock.instant())) {
            log.debug("Cache entry {} is stale (expired {})", entry.cacheKey(), entry.expiresAt());
            return null;
        }
        if (!entry.sourceUrl().equals(request.url())) {
            log.debug("Cache entry {} was fetched from a different URL; refetching", entry.cacheKey());
            return null;
        }
        Path path = Paths.get(entry.localPath());
        if (!Files.isRegularFile(path)) {
            log.debug("Cache entry {} points at missing file {}", entry.cacheKey(), path);
            return null;
        }
        try {
            String checksum = HashUtils.sha256Hex(path);
            if (!checksum.equals(entry.checksum())) {
                log.warn("Cached file {} failed checksum verification; refetching", path);
                return null;
            }
        } catch (IOException e) {
            log.warn("Unable to read cached file {}; refetching", path, e);
            return null;
        }
        return new LocalDataset(request, path, entry.checksum(), entry.byteSize(), entry.downloadedAt(), true);
    }

    private LocalDataset download(DatasetRequest request) {
        String expectedChecksum = fetchExpectedChecksum(request);
        PayloadValidator structural = payloadValidator.forFormat(request.format());
        PayloadValidator validator = body -> {
            String problem = structural.validate(body);
            if (problem != null) {
                return problem;
            }
            if (expectedChecksum != null && !expectedChecksum.equals(HashUtils.sha256Hex(body))) {
                return "checksum mismatch";
            }
            return null;
        };

        HttpFetchResult result = httpClient.get(request.url(), acceptHeader(request.format()), validator);
        if (result == null || !result.isSuccessful()) {
            String reason = result == null ? "no response" : result.describeFailure();
            throw new DatasetUnavailableException(request.source(), request.stateFips(), reason);
        }

        byte[] body = result.bodyBytes();
        Instant now = clock.instant();
        Path target;
        try {
            target = writeAtomically(request, body);
        } catch (IOException e) {
            throw new DatasetUnavailableException(request.source(), request.stateFips(), "cache write failed", e);
        }
        String checksum = HashUtils.sha256Hex(body);
        CacheEntry entry = new CacheEntry(
            request.cacheKey(),
            request.source(),
            request.stateFips(),
            request.url(),
            target.toString(),
            now,
            now.plus(Duration.ofDays(properties.getCache().getTtlDays())),
            checksum,
            body.length
        );
        repository.upsert(entry);
        log.info("Downloaded {} ({} bytes) in {} ms", request.describe(), body.length, result.duration().toMillis());
        return new LocalDataset(request, target, checksum, body.length, now, false);
    }

    private String fetchExpectedChecksum(DatasetRequest request) {
        if (request.checksumUrl() == null || request.checksumUrl().isBlank()) {
            return null;
        }
        HttpFetchResult result = httpClient.get(request.checksumUrl(), "text/plain");
        if (result == null || !result.isSuccessful() || result.bodyBytes() == null) {
            String reason = result == null ? "no response" : result.describeFailure();
            throw new DatasetUnavailableException(request.source(), request.stateFips(), "checksum unavailable: " + reason);
        }
        String text = new String(result.bodyBytes(), StandardCharsets.UTF_8).trim();
        String token = text.isEmpty() ? "" : text.split("\\s+")[0].toLowerCase(Locale.ROOT);
        if (!token.matches("[0-9a-f]{64}")) {
            throw new DatasetUnavailableException(request.source(), request.stateFips(), "checksum file is not a sha-256 digest");
        }
        return token;
    }

    private Path writeAtomically(DatasetRequest request, byte[] body) throws IOException {
        Path directory = Paths.get(properties.getCache().getDirectory());
        Files.createDirectories(directory);
        Path target = directory.resolve(request.cacheKey() + extension(request.format()));
        Path temp = Files.createTempFile(directory, request.cacheKey(), ".part");
        Files.write(temp, body);
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
        return target;
    }

    private void deleteFile(CacheEntry entry) {
        try {
            Files.deleteIfExists(Paths.get(entry.localPath()));
        } catch (IOException e) {
            log.warn("Failed to delete cached file {}", entry.localPath(), e);
        }
    }

    private String acceptHeader(DatasetFormat format) {
        return switch (format) {
            case GEOJSON -> "application/geo+json, application/json";
            case JSON_TABLE -> "application/json";
            case CSV -> "text/csv, text/plain";
        };
    }

    private String extension(DatasetFormat format) {
        return switch (format) {
            case GEOJSON -> ".geojson";
            case JSON_TABLE -> ".json";
            case CSV -> ".csv";
        };
    }
}
