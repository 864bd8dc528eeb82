package com.hubzone.designations.importer.service;

import com.hubzone.designations.importer.error.ActiveImportExecutionException;
import com.hubzone.designations.importer.model.AffectedBusinessChange;
import com.hubzone.designations.importer.model.BusinessChangeType;
import com.hubzone.designations.importer.model.BusinessLocation;
import com.hubzone.designations.importer.model.Designation;
import com.hubzone.designations.importer.model.DesignationStatus;
import com.hubzone.designations.importer.model.DesignationType;
import com.hubzone.designations.importer.model.ImportExecution;
import com.hubzone.designations.importer.model.ImportExecutionStatus;
import com.hubzone.designations.importer.model.ImportIssue;
import com.hubzone.designations.importer.model.ImportOptions;
import com.hubzone.designations.importer.model.ImportRunResult;
import com.hubzone.designations.importer.model.TriggerType;
import com.hubzone.designations.importer.persistence.AffectedBusinessJdbcRepository;
import com.hubzone.designations.importer.persistence.BusinessLocationJdbcRepository;
import com.hubzone.designations.importer.persistence.DesignationJdbcRepository;
import com.hubzone.designations.importer.persistence.ImportExecutionJdbcRepository;
import com.hubzone.designations.importer.persistence.ImportLockRepository;
import com.hubzone.designations.importer.util.ImportErrorCodes;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.PrecisionModel;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
class ImportExecutionServiceIntegrationTest {
    private static final String TRACT_ONE = "11001000100";
    private static final String TRACT_TWO = "11001000200";
    private static final ImportOptions DC_ONLY = new ImportOptions(false, false, List.of("11"));

    private static final MockWebServer SERVER = new MockWebServer();
    private static final Path CACHE_DIR;
    private static volatile boolean failEconomicProfiles;
    private static volatile boolean failDesignations;
    private static volatile boolean failFallbacks;

    static {
        try {
            SERVER.setDispatcher(new FixtureDispatcher());
            SERVER.start();
            CACHE_DIR = Files.createTempDirectory("hubzone-import-it");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Autowired
    private ImportExecutionService executionService;

    @Autowired
    private ImportOperatorService operatorService;

    @Autowired
    private ImportExecutionJdbcRepository executionRepository;

    @Autowired
    private ImportLockRepository lockRepository;

    @Autowired
    private DesignationJdbcRepository designationRepository;

    @Autowired
    private BusinessLocationJdbcRepository businessRepository;

    @Autowired
    private AffectedBusinessJdbcRepository affectedBusinessRepository;

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    private final GeometryFactory geometryFactory = new GeometryFactory(new PrecisionModel(), 4326);

    @DynamicPropertySource
    static void sources(DynamicPropertyRegistry registry) {
        String base = SERVER.url("/").toString();
        registry.add("importer.sources.boundaries.url-template", () -> base + "boundaries/{state}.geojson");
        registry.add("importer.sources.designations.url-template", () -> base + "designations.csv");
        registry.add("importer.sources.designations.fallback-url-templates[0]", () -> base + "fallback/qct.csv");
        registry.add("importer.sources.designations.fallback-url-templates[1]", () -> base + "fallback/indian-lands.csv");
        registry.add("importer.job.admin-recipients", () -> "ops@hubzone.example,gis@hubzone.example");
        registry.add("importer.sources.economic-profiles.url-template", () -> base + "acs/{vintage}/{state}.json");
        registry.add("importer.cache.directory", CACHE_DIR::toString);
    }

    @AfterAll
    static void stopServer() throws IOException {
        SERVER.shutdown();
    }

    @BeforeEach
    void resetState() {
        failEconomicProfiles = false;
        failDesignations = false;
        failFallbacks = false;
        operatorService.clearCache();
        MapSqlParameterSource none = new MapSqlParameterSource();
        jdbc.update("DELETE FROM import_completion_notices", none);
        jdbc.update("DELETE FROM hubzone_change_notifications", none);
        jdbc.update("DELETE FROM affected_business_changes", none);
        jdbc.update("DELETE FROM hubzone_designations", none);
        jdbc.update("DELETE FROM business_locations", none);
        jdbc.update("DELETE FROM import_executions", none);
        jdbc.update(
            """
                UPDATE import_execution_lock
                SET holder_execution_id = NULL, holder_instance = NULL, acquired_at = NULL, lease_expires_at = NULL
                """,
            none
        );
    }

    @Test
    void newlyQualifyingTractIsDesignatedAndBusinessGainsStatus() {
        businessRepository.upsert(new BusinessLocation("B-100", "Anacostia Fabrication", "11", 38.5, -77.5, false));
        businessRepository.upsert(new BusinessLocation("B-200", "Capitol Supply", "11", 38.5, -76.5, false));

        ImportRunResult result = executionService.runNow(TriggerType.MANUAL, "test", DC_ONLY);

        assertThat(result.status()).isEqualTo(ImportExecutionStatus.COMPLETED);
        assertThat(result.errors()).isEmpty();
        assertThat(result.statistics().totalUnits()).isEqualTo(2);
        assertThat(result.statistics().newDesignations()).isEqualTo(1);
        assertThat(result.statistics().totalActiveHubzones()).isEqualTo(1L);
        assertThat(result.statistics().statesProcessed()).isEqualTo(1);
        assertThat(result.statistics().affectedBusinesses()).isEqualTo(1);
        assertThat(result.notificationsHandedOff()).isEqualTo(1);

        Designation stored = designationRepository.findByGeoid(TRACT_ONE);
        assertThat(stored.status()).isEqualTo(DesignationStatus.ACTIVE);
        assertThat(stored.type()).isEqualTo(DesignationType.QUALIFIED_CENSUS_TRACT);
        assertThat(stored.sourceDataset()).isEqualTo("census_acs:2022");
        assertThat(designationRepository.findByGeoid(TRACT_TWO)).isNull();
        assertThat(designationRepository.findGeometries(List.of(TRACT_ONE))).containsKey(TRACT_ONE);

        assertThat(businessRepository.findById("B-100").inHubzone()).isTrue();
        assertThat(businessRepository.findById("B-200").inHubzone()).isFalse();

        List<AffectedBusinessChange> affected = affectedBusinessRepository.findByExecution(result.executionId());
        assertThat(affected).hasSize(1);
        assertThat(affected.get(0).businessId()).isEqualTo("B-100");
        assertThat(affected.get(0).changeType()).isEqualTo(BusinessChangeType.GAINED_HUBZONE);
        assertThat(affected.get(0).notificationSent()).isTrue();
        assertThat(countRows("hubzone_change_notifications")).isEqualTo(1L);

        ImportExecution execution = executionRepository.findById(result.executionId());
        assertThat(execution.status()).isEqualTo(ImportExecutionStatus.COMPLETED);
        assertThat(execution.triggeredBy()).isEqualTo("test");
        assertThat(execution.finishedAt()).isNotNull();
        assertThat(execution.statistics().newDesignations()).isEqualTo(1);
        assertThat(operatorService.result(result.executionId())).contains("\"status\":\"COMPLETED\"");
        assertThat(lockRepository.currentHolder()).isNull();

        assertThat(completionNoticeStatuses(result.executionId())).containsExactly("COMPLETED");
        String recipients = jdbc.queryForObject(
            "SELECT recipients FROM import_completion_notices WHERE import_execution_id = :id",
            new MapSqlParameterSource("id", result.executionId()),
            String.class
        );
        assertThat(recipients).isEqualTo("ops@hubzone.example,gis@hubzone.example");
    }

    @Test
    void rerunWithSameDataChangesNothingAndUsesCache() {
        ImportRunResult first = executionService.runNow(TriggerType.MANUAL, "test", DC_ONLY);
        int requestsAfterFirst = SERVER.getRequestCount();

        ImportRunResult second = executionService.runNow(TriggerType.MANUAL, "test", DC_ONLY);

        assertThat(first.statistics().newDesignations()).isEqualTo(1);
        assertThat(second.status()).isEqualTo(ImportExecutionStatus.COMPLETED);
        assertThat(second.changeset().changeCount()).isZero();
        assertThat(second.statistics().unchangedDesignations()).isEqualTo(1);
        assertThat(second.statistics().totalActiveHubzones()).isEqualTo(1L);
        assertThat(second.affectedBusinesses()).isEmpty();
        assertThat(SERVER.getRequestCount()).isEqualTo(requestsAfterFirst);
        assertThat(operatorService.cacheStats().entryCount()).isEqualTo(3L);
    }

    @Test
    void lapsedTractEntersGracePeriodAndBusinessKeepsStatus() {
        designationRepository.upsert(activeTract(TRACT_TWO), box(-77.0, -76.0), 0L);
        businessRepository.upsert(new BusinessLocation("B-200", "Capitol Supply", "11", 38.5, -76.5, true));

        ImportRunResult result = executionService.runNow(TriggerType.MANUAL, "test", DC_ONLY);

        assertThat(result.status()).isEqualTo(ImportExecutionStatus.COMPLETED);
        assertThat(result.statistics().redesignatedAreas()).isEqualTo(1);
        Designation stored = designationRepository.findByGeoid(TRACT_TWO);
        assertThat(stored.status()).isEqualTo(DesignationStatus.REDESIGNATED);
        assertThat(stored.gracePeriodEndDate()).isEqualTo(result.runDate().plusMonths(36));

        assertThat(result.affectedBusinesses()).hasSize(1);
        AffectedBusinessChange change = result.affectedBusinesses().get(0);
        assertThat(change.changeType()).isEqualTo(BusinessChangeType.HUBZONE_REDESIGNATED);
        assertThat(change.gracePeriodEndDate()).isEqualTo(result.runDate().plusMonths(36));
        assertThat(businessRepository.findById("B-200").inHubzone()).isTrue();
    }

    @Test
    void gracePeriodEndExpiresUnitAndBusinessLosesStatus() {
        LocalDate yesterday = LocalDate.now(ZoneOffset.UTC).minusDays(1);
        designationRepository.upsert(activeTract(TRACT_TWO).redesignate(yesterday), box(-77.0, -76.0), 0L);
        businessRepository.upsert(new BusinessLocation("B-200", "Capitol Supply", "11", 38.5, -76.5, true));

        ImportRunResult result = executionService.runNow(TriggerType.MANUAL, "test", DC_ONLY);

        assertThat(result.statistics().expiredDesignations()).isEqualTo(1);
        assertThat(designationRepository.findByGeoid(TRACT_TWO).status()).isEqualTo(DesignationStatus.EXPIRED);
        assertThat(result.affectedBusinesses()).extracting(AffectedBusinessChange::changeType)
            .containsExactly(BusinessChangeType.LOST_HUBZONE);
        assertThat(businessRepository.findById("B-200").inHubzone()).isFalse();
    }

    @Test
    void unavailableStateDatasetSkipsStateWithoutFailingRun() {
        failEconomicProfiles = true;

        ImportRunResult result = executionService.runNow(TriggerType.MANUAL, "test", DC_ONLY);

        assertThat(result.status()).isEqualTo(ImportExecutionStatus.COMPLETED);
        assertThat(result.statistics().statesSkipped()).isEqualTo(1);
        assertThat(result.statistics().statesProcessed()).isZero();
        assertThat(result.warnings()).extracting(ImportIssue::code).contains(ImportErrorCodes.DATASET_UNAVAILABLE);
        assertThat(countRows("hubzone_designations")).isZero();
    }

    @Test
    void unavailableDesignationFeedFallsBackToMergedPublicResources() {
        failDesignations = true;

        ImportRunResult result = executionService.runNow(TriggerType.MANUAL, "test", DC_ONLY);

        assertThat(result.status()).isEqualTo(ImportExecutionStatus.COMPLETED);
        assertThat(result.errors()).isEmpty();
        assertThat(result.warnings()).extracting(ImportIssue::code).contains(ImportErrorCodes.FEED_FALLBACK_USED);
        assertThat(result.statistics().newDesignations()).isEqualTo(2);
        Designation fallbackTract = designationRepository.findByGeoid(TRACT_TWO);
        assertThat(fallbackTract.type()).isEqualTo(DesignationType.INDIAN_LANDS);
        assertThat(fallbackTract.designationDate()).isEqualTo(LocalDate.of(2021, 6, 1));
        assertThat(designationRepository.findByGeoid(TRACT_ONE).type()).isEqualTo(DesignationType.QUALIFIED_CENSUS_TRACT);
    }

    @Test
    void unavailableNationalFeedFailsRunAndReleasesLease() {
        failDesignations = true;
        failFallbacks = true;

        ImportRunResult result = executionService.runNow(TriggerType.MANUAL, "test", DC_ONLY);

        assertThat(result.status()).isEqualTo(ImportExecutionStatus.FAILED);
        assertThat(result.errors()).extracting(ImportIssue::code).containsExactly(ImportErrorCodes.DATASET_UNAVAILABLE);
        assertThat(executionRepository.findById(result.executionId()).status()).isEqualTo(ImportExecutionStatus.FAILED);
        assertThat(lockRepository.currentHolder()).isNull();
        assertThat(countRows("hubzone_designations")).isZero();
        assertThat(completionNoticeStatuses(result.executionId())).containsExactly("FAILED");
    }

    @Test
    void dryRunReportsChangesWithoutPersistingThem() {
        businessRepository.upsert(new BusinessLocation("B-100", "Anacostia Fabrication", "11", 38.5, -77.5, false));

        ImportRunResult result = executionService.runNow(
            TriggerType.MANUAL, "test", new ImportOptions(true, false, List.of("11")));

        assertThat(result.status()).isEqualTo(ImportExecutionStatus.COMPLETED);
        assertThat(result.dryRun()).isTrue();
        assertThat(result.changeset().created()).hasSize(1);
        assertThat(result.affectedBusinesses()).hasSize(1);
        assertThat(designationRepository.findByGeoid(TRACT_ONE)).isNull();
        assertThat(businessRepository.findById("B-100").inHubzone()).isFalse();
        assertThat(affectedBusinessRepository.findByExecution(result.executionId())).isEmpty();
        assertThat(countRows("hubzone_change_notifications")).isZero();
    }

    @Test
    void dryRunStatisticsMatchTheRealRunOnTheSameInput() {
        businessRepository.upsert(new BusinessLocation("B-100", "Anacostia Fabrication", "11", 38.5, -77.5, false));
        designationRepository.upsert(activeTract(TRACT_TWO), box(-77.0, -76.0), 0L);

        ImportRunResult dryRun = executionService.runNow(
            TriggerType.MANUAL, "test", new ImportOptions(true, false, List.of("11")));
        ImportRunResult realRun = executionService.runNow(TriggerType.MANUAL, "test", DC_ONLY);

        assertThat(dryRun.status()).isEqualTo(ImportExecutionStatus.COMPLETED);
        assertThat(realRun.status()).isEqualTo(ImportExecutionStatus.COMPLETED);
        assertThat(dryRun.statistics()).isEqualTo(realRun.statistics());
        assertThat(realRun.statistics().newDesignations()).isEqualTo(1);
        assertThat(realRun.statistics().redesignatedAreas()).isEqualTo(1);
    }

    @Test
    void triggerIsRejectedWithTheRunningExecutionIdWhileAnotherImportHoldsTheLease() {
        Instant now = Instant.now();
        long running = executionRepository.insertPending(TriggerType.SCHEDULED, "scheduler", DC_ONLY, now);
        assertThat(lockRepository.tryClaim("other-instance", now, now.plus(Duration.ofMinutes(10)))).isTrue();
        lockRepository.assignHolder("other-instance", running);

        assertThatThrownBy(() -> operatorService.trigger(DC_ONLY, "ops"))
            .isInstanceOfSatisfying(ActiveImportExecutionException.class,
                e -> assertThat(e.activeExecutionId()).isEqualTo(running));
        assertThat(executionRepository.countAll()).isEqualTo(1L);
        assertThat(executionRepository.findById(running).status()).isEqualTo(ImportExecutionStatus.PENDING);
        assertThat(lockRepository.currentHolder()).isEqualTo(running);
    }

    @Test
    void runThatNoLongerHoldsTheLeaseFailsWithoutCommitting() {
        Instant now = Instant.now();
        long executionId = executionRepository.insertPending(TriggerType.MANUAL, "test", DC_ONLY, now);
        assertThat(lockRepository.tryClaim("other-instance", now, now.plus(Duration.ofMinutes(10)))).isTrue();
        lockRepository.assignHolder("other-instance", 999L);

        ImportRunResult result = executionService.execute(executionId, DC_ONLY);

        assertThat(result.status()).isEqualTo(ImportExecutionStatus.FAILED);
        assertThat(result.errors()).extracting(ImportIssue::code).containsExactly(ImportErrorCodes.LEASE_LOST);
        assertThat(countRows("hubzone_designations")).isZero();
        assertThat(lockRepository.currentHolder()).isEqualTo(999L);
        ImportExecution stored = executionRepository.findById(executionId);
        assertThat(stored.status()).isEqualTo(ImportExecutionStatus.FAILED);

        boolean overwritten = executionRepository.complete(
            executionId, ImportExecutionStatus.COMPLETED, Instant.now(), stored.statistics(), List.of(), List.of(), null);
        assertThat(overwritten).isFalse();
        assertThat(executionRepository.findById(executionId).status()).isEqualTo(ImportExecutionStatus.FAILED);
    }

    @Test
    void lapsedLeaseIsTakenOverAndPreviousRunMarkedFailed() {
        Instant past = Instant.now().minus(Duration.ofHours(1));
        long stale = executionRepository.insertPending(TriggerType.SCHEDULED, "scheduler", DC_ONLY, past);
        executionRepository.markRunning(stale, past);
        assertThat(lockRepository.tryClaim("crashed-instance", past, past.plus(Duration.ofMinutes(10)))).isTrue();
        lockRepository.assignHolder("crashed-instance", stale);

        ImportRunResult result = executionService.runNow(TriggerType.MANUAL, "test", DC_ONLY);

        assertThat(result.status()).isEqualTo(ImportExecutionStatus.COMPLETED);
        ImportExecution previous = executionRepository.findById(stale);
        assertThat(previous.status()).isEqualTo(ImportExecutionStatus.FAILED);
        assertThat(previous.errors()).extracting(ImportIssue::code).containsExactly(ImportErrorCodes.LEASE_EXPIRED);
    }

    @Test
    void unknownStateIsRejectedBeforeAnyRecordIsCreated() {
        assertThatThrownBy(() -> operatorService.trigger(new ImportOptions(false, false, List.of("99")), "ops"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining(ImportErrorCodes.UNKNOWN_STATE);
        assertThat(executionRepository.countAll()).isZero();
    }

    @Test
    void cancellationRequestedBeforeStartEndsCancelled() {
        long executionId = executionRepository.insertPending(TriggerType.MANUAL, "test", DC_ONLY, Instant.now());
        assertThat(executionService.cancel(executionId)).isTrue();

        ImportRunResult result = executionService.execute(executionId, DC_ONLY);

        assertThat(result.status()).isEqualTo(ImportExecutionStatus.CANCELLED);
        assertThat(result.warnings()).extracting(ImportIssue::code).contains(ImportErrorCodes.IMPORT_CANCELLED);
        assertThat(result.errors()).isEmpty();
        assertThat(executionRepository.findById(executionId).status()).isEqualTo(ImportExecutionStatus.CANCELLED);
        assertThat(countRows("hubzone_designations")).isZero();
    }

    private List<String> completionNoticeStatuses(long executionId) {
        return jdbc.queryForList(
            "SELECT status FROM import_completion_notices WHERE import_execution_id = :id",
            new MapSqlParameterSource("id", executionId),
            String.class
        );
    }

    private long countRows(String table) {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM " + table, new MapSqlParameterSource(), Long.class);
        return count == null ? 0L : count;
    }

    private static Designation activeTract(String geoid) {
        return new Designation(
            geoid,
            "11",
            "11001",
            DesignationType.QUALIFIED_CENSUS_TRACT,
            DesignationStatus.ACTIVE,
            LocalDate.of(2019, 1, 1),
            null,
            null,
            "census_acs:2017"
        );
    }

    private Geometry box(double minX, double maxX) {
        return geometryFactory.createPolygon(new Coordinate[] {
            new Coordinate(minX, 38.0),
            new Coordinate(maxX, 38.0),
            new Coordinate(maxX, 39.0),
            new Coordinate(minX, 39.0),
            new Coordinate(minX, 38.0)
        });
    }

    private static final class FixtureDispatcher extends Dispatcher {
        @Override
        public MockResponse dispatch(RecordedRequest request) {
            String path = request.getPath() == null ? "" : request.getPath();
            if (path.startsWith("/boundaries/11.geojson")) {
                return fixture("fixtures/boundaries-11.geojson", "application/geo+json");
            }
            if (path.startsWith("/acs/2022/11.json")) {
                return failEconomicProfiles
                    ? new MockResponse().setResponseCode(503)
                    : fixture("fixtures/acs-2022-11.json", "application/json");
            }
            if (path.startsWith("/fallback/qct.csv")) {
                return failFallbacks
                    ? new MockResponse().setResponseCode(500)
                    : fixture("fixtures/fallback-qct.csv", "text/csv");
            }
            if (path.startsWith("/fallback/indian-lands.csv")) {
                return failFallbacks
                    ? new MockResponse().setResponseCode(500)
                    : fixture("fixtures/fallback-indian-lands.csv", "text/csv");
            }
            if (path.startsWith("/designations.csv")) {
                return failDesignations
                    ? new MockResponse().setResponseCode(500)
                    : fixture("fixtures/designations.csv", "text/csv");
            }
            return new MockResponse().setResponseCode(404);
        }

        private static MockResponse fixture(String resource, String contentType) {
            try {
                String body = new String(
                    new ClassPathResource(resource).getInputStream().readAllBytes(),
                    StandardCharsets.UTF_8
                );
                return new MockResponse().setResponseCode(200).setHeader("Content-Type", contentType).setBody(body);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }
}
