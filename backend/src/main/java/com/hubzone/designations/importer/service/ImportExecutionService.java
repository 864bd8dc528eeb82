package com.hubzone.designations.importer.service;

import com.hubzone.designations.config.ImportProperties;
import com.hubzone.designations.importer.cache.DatasetCacheManager;
import com.hubzone.designations.importer.error.ActiveImportExecutionException;
import com.hubzone.designations.importer.error.DatasetUnavailableException;
import com.hubzone.designations.importer.error.ImportAbortedException;
import com.hubzone.designations.importer.error.ImportException;
import com.hubzone.designations.importer.geo.AffectedBusinessResolver;
import com.hubzone.designations.importer.geo.BusinessResolution;
import com.hubzone.designations.importer.model.AffectedBusinessChange;
import com.hubzone.designations.importer.model.Changeset;
import com.hubzone.designations.importer.model.DatasetAcquisition;
import com.hubzone.designations.importer.model.DatasetRequest;
import com.hubzone.designations.importer.model.DatasetSource;
import com.hubzone.designations.importer.model.Designation;
import com.hubzone.designations.importer.model.DesignationChange;
import com.hubzone.designations.importer.model.EconomicProfile;
import com.hubzone.designations.importer.model.FeedDesignation;
import com.hubzone.designations.importer.model.GeographicUnit;
import com.hubzone.designations.importer.model.ImportCompletionNotice;
import com.hubzone.designations.importer.model.ImportExecution;
import com.hubzone.designations.importer.model.ImportExecutionStatus;
import com.hubzone.designations.importer.model.ImportIssue;
import com.hubzone.designations.importer.model.ImportOptions;
import com.hubzone.designations.importer.model.ImportProgressEvent;
import com.hubzone.designations.importer.model.ImportRunResult;
import com.hubzone.designations.importer.model.ImportStage;
import com.hubzone.designations.importer.model.ImportStatistics;
import com.hubzone.designations.importer.model.LocalDataset;
import com.hubzone.designations.importer.model.StateFips;
import com.hubzone.designations.importer.model.TriggerType;
import com.hubzone.designations.importer.notify.NotificationGateway;
import com.hubzone.designations.importer.persistence.AffectedBusinessJdbcRepository;
import com.hubzone.designations.importer.persistence.BusinessLocationJdbcRepository;
import com.hubzone.designations.importer.persistence.DesignationJdbcRepository;
import com.hubzone.designations.importer.persistence.ImportExecutionJdbcRepository;
import com.hubzone.designations.importer.persistence.ImportLockRepository;
import com.hubzone.designations.importer.reconcile.DesignationDiffEngine;
import com.hubzone.designations.importer.source.BoundaryFeedParser;
import com.hubzone.designations.importer.source.CandidateAssembler;
import com.hubzone.designations.importer.source.DatasetSourceCatalog;
import com.hubzone.designations.importer.source.DesignationFeedParser;
import com.hubzone.designations.importer.source.EconomicProfileFeedParser;
import com.hubzone.designations.importer.source.FeedParseResult;
import com.hubzone.designations.importer.source.FeedProblem;
import com.hubzone.designations.importer.source.StateCandidates;
import com.hubzone.designations.importer.util.ImportErrorCodes;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs designation imports: acquire, evaluate, reconcile, resolve, commit, hand off.
 * <p>
 * Only one import runs at a time across every instance; the guard is the lease row in
 * {@code import_execution_lock}, claimed before the execution record is created. A rejected trigger
 * therefore leaves no record behind.
 */
@Service
public class ImportExecutionService {
    private static final Logger log = LoggerFactory.getLogger(ImportExecutionService.class);

    private final ImportProperties properties;
    private final DatasetSourceCatalog sourceCatalog;
    private final DatasetCacheManager cacheManager;
    private final BoundaryFeedParser boundaryParser;
    private final DesignationFeedParser designationParser;
    private final EconomicProfileFeedParser profileParser;
    private final CandidateAssembler candidateAssembler;
    private final DesignationDiffEngine diffEngine;
    private final AffectedBusinessResolver businessResolver;
    private final ChangesetCommitter committer;
    private final DesignationJdbcRepository designationRepository;
    private final BusinessLocationJdbcRepository businessRepository;
    private final AffectedBusinessJdbcRepository affectedBusinessRepository;
    private final ImportExecutionJdbcRepository executionRepository;
    private final ImportLockRepository lockRepository;
    private final NotificationGateway notificationGateway;
    private final TransactionTemplate transactionTemplate;
    private final ApplicationEventPublisher eventPublisher;
    private final ExecutorService importRunExecutor;
    private final Clock clock;
    private final String instanceId;
    private final Set<Long> lostLeases = ConcurrentHashMap.newKeySet();

    public ImportExecutionService(
        ImportProperties properties,
        DatasetSourceCatalog sourceCatalog,
        DatasetCacheManager cacheManager,
        BoundaryFeedParser boundaryParser,
        DesignationFeedParser designationParser,
        EconomicProfileFeedParser profileParser,
        CandidateAssembler candidateAssembler,
        DesignationDiffEngine diffEngine,
        AffectedBusinessResolver businessResolver,
        ChangesetCommitter committer,
        DesignationJdbcRepository designationRepository,
        BusinessLocationJdbcRepository businessRepository,
        AffectedBusinessJdbcRepository affectedBusinessRepository,
        ImportExecutionJdbcRepository executionRepository,
        ImportLockRepository lockRepository,
        NotificationGateway notificationGateway,
        TransactionTemplate transactionTemplate,
        ApplicationEventPublisher eventPublisher,
        @Qualifier("importRunExecutor") ExecutorService importRunExecutor,
        Clock clock
    ) {
        this.properties = properties;
        this.sourceCatalog = sourceCatalog;
        this.cacheManager = cacheManager;
        this.boundaryParser = boundaryParser;
        this.designationParser = designationParser;
        this.profileParser = profileParser;
        this.candidateAssembler = candidateAssembler;
        this.diffEngine = diffEngine;
        this.businessResolver = businessResolver;
        this.committer = committer;
        this.designationRepository = designationRepository;
        this.businessRepository = businessRepository;
        this.affectedBusinessRepository = affectedBusinessRepository;
        this.executionRepository = executionRepository;
        this.lockRepository = lockRepository;
        this.notificationGateway = notificationGateway;
        this.transactionTemplate = transactionTemplate;
        this.eventPublisher = eventPublisher;
        this.importRunExecutor = importRunExecutor;
        this.clock = clock;
        this.instanceId = "importer-" + ManagementFactory.getRuntimeMXBean().getName();
    }

    public long trigger(TriggerType triggerType, String triggeredBy, ImportOptions options) {
        ImportOptions safeOptions = validate(options);
        long executionId = reserve(triggerType, triggeredBy, safeOptions);
        importRunExecutor.submit(() -> {
            try {
                execute(executionId, safeOptions);
            } catch (RuntimeException e) {
                log.warn("Import {} ended with an unhandled error", executionId, e);
            }
        });
        return executionId;
    }

    public ImportRunResult runNow(TriggerType triggerType, String triggeredBy, ImportOptions options) {
        ImportOptions safeOptions = validate(options);
        long executionId = reserve(triggerType, triggeredBy, safeOptions);
        return execute(executionId, safeOptions);
    }

    public boolean cancel(long executionId) {
        boolean requested = executionRepository.requestCancel(executionId);
        if (requested) {
            log.info("Cancellation requested for import {}", executionId);
        }
        return requested;
    }

    private ImportOptions validate(ImportOptions options) {
        ImportOptions safeOptions = options == null ? ImportOptions.defaults() : options;
        List<String> unknown = safeOptions.states().stream()
            .filter(state -> !StateFips.isKnown(state))
            .toList();
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException(ImportErrorCodes.UNKNOWN_STATE + ": " + unknown);
        }
        return safeOptions;
    }

    private long reserve(TriggerType triggerType, String triggeredBy, ImportOptions options) {
        Instant now = clock.instant();
        Instant leaseUntil = now.plus(Duration.ofMinutes(properties.getJob().getLeaseMinutes()));
        Long executionId = transactionTemplate.execute(status -> {
            Long previousHolder = lockRepository.currentHolder();
            if (!lockRepository.tryClaim(instanceId, now, leaseUntil)) {
                throw new ActiveImportExecutionException(previousHolder);
            }
            if (previousHolder != null) {
                abandonLapsedHolder(previousHolder, now);
            }
            long id = executionRepository.insertPending(triggerType, triggeredBy, options, now);
            lockRepository.assignHolder(instanceId, id);
            return id;
        });
        if (executionId == null) {
            throw new IllegalStateException("Import execution could not be reserved");
        }
        log.info("Import {} reserved ({} by {}, options={})", executionId, triggerType, triggeredBy, options);
        return executionId;
    }

    private void abandonLapsedHolder(long previousHolder, Instant now) {
        ImportExecution previous = executionRepository.findById(previousHolder);
        if (previous == null || previous.status().isTerminal()) {
            return;
        }
        List<ImportIssue> errors = new ArrayList<>(previous.errors());
        errors.add(ImportIssue.fatal(
            ImportErrorCodes.LEASE_EXPIRED,
            "Import lease lapsed without a heartbeat; taken over by a new execution",
            null,
            now
        ));
        executionRepository.complete(
            previousHolder,
            ImportExecutionStatus.FAILED,
            now,
            previous.statistics(),
            errors,
            previous.warnings(),
            null
        );
        log.warn("Import {} lost its lease and was marked FAILED", previousHolder);
    }

    ImportRunResult execute(long executionId, ImportOptions options) {
        Instant startedAt = clock.instant();
        LocalDate runDate = LocalDate.ofInstant(startedAt, clock.getZone());
        Instant deadline = startedAt.plus(Duration.ofMinutes(properties.getJob().getTimeoutMinutes()));

        List<ImportIssue> errors = new ArrayList<>();
        List<ImportIssue> warnings = new ArrayList<>();
        ImportExecutionStatus status = ImportExecutionStatus.FAILED;
        ImportStatistics statistics = ImportStatistics.empty();
        Changeset changeset = Changeset.empty();
        List<AffectedBusinessChange> affected = List.of();
        int handedOff = 0;

        ScheduledExecutorService heartbeat = null;
        try {
            executionRepository.markRunning(executionId, startedAt);
            log.info("Import {} started (runDate={}, dryRun={}, states={})", executionId, runDate, options.dryRun(), options.states());
            heartbeat = Executors.newSingleThreadScheduledExecutor();
            int heartbeatSeconds = properties.getJob().getHeartbeatSeconds();
            heartbeat.scheduleAtFixedRate(
                () -> beat(executionId),
                heartbeatSeconds,
                heartbeatSeconds,
                TimeUnit.SECONDS
            );

            cacheManager.evictExpired();
            PipelineOutcome outcome = runWithRetries(executionId, options, runDate, deadline, warnings);
            errors.addAll(outcome.errors());
            warnings.addAll(outcome.warnings());
            statistics = outcome.statistics();
            changeset = outcome.changeset();
            affected = outcome.affectedBusinesses();

            if (!options.dryRun()) {
                checkpoint(executionId, deadline, ImportStage.COMMIT, null);
                committer.commit(executionId, changeset, outcome.boundaries(), affected, clock.instant());
            }
            if (!options.dryRun() && !options.skipNotifications() && !affected.isEmpty()) {
                publish(executionId, ImportStage.NOTIFY, null, "Handing off " + affected.size() + " business changes");
                if (handOff(executionId, affected, warnings)) {
                    handedOff = affected.size();
                    affected = affected.stream().map(change -> change.withNotificationSent(true)).toList();
                }
            }
            status = ImportExecutionStatus.COMPLETED;
        } catch (ImportAbortedException e) {
            status = e.terminalStatus();
            ImportIssue issue = ImportIssue.fatal(e.code(), e.getMessage(), null, clock.instant());
            if (status == ImportExecutionStatus.CANCELLED) {
                warnings.add(issue);
            } else {
                errors.add(issue);
            }
            log.info("Import {} stopped: {}", executionId, e.getMessage());
        } catch (ImportException e) {
            status = ImportExecutionStatus.FAILED;
            errors.add(ImportIssue.fatal(e.code(), e.getMessage(), e.geoid(), clock.instant()));
            log.warn("Import {} failed: {}", executionId, e.getMessage(), e);
        } catch (RuntimeException e) {
            status = ImportExecutionStatus.FAILED;
            errors.add(ImportIssue.fatal(
                ImportErrorCodes.UNEXPECTED_ERROR,
                e.getClass().getSimpleName() + ": " + e.getMessage(),
                null,
                clock.instant()
            ));
            log.warn("Import {} failed unexpectedly", executionId, e);
        } finally {
            if (heartbeat != null) {
                heartbeat.shutdownNow();
            }
            lostLeases.remove(executionId);
        }

        Instant finishedAt = clock.instant();
        notifyAdmins(executionId, status, options, startedAt, finishedAt, statistics, errors, warnings);
        ImportRunResult result = new ImportRunResult(
            executionId,
            status,
            runDate,
            options.dryRun(),
            statistics,
            changeset,
            affected,
            List.copyOf(errors),
            List.copyOf(warnings),
            handedOff
        );
        try {
            if (!executionRepository.complete(executionId, status, finishedAt, statistics, errors, warnings, result)) {
                log.warn("Import {} was already finalised elsewhere; its {} outcome was not recorded", executionId, status);
            }
        } catch (RuntimeException e) {
            log.warn("Failed to record the outcome of import {}", executionId, e);
        } finally {
            releaseLease(executionId);
        }
        publish(executionId, ImportStage.FINISHED, null, status.name());
        log.info(
            "Import {} finished with status {} in {} ms: {}",
            executionId,
            status,
            Duration.between(startedAt, finishedAt).toMillis(),
            statistics
        );
        return result;
    }

    private PipelineOutcome runWithRetries(
        long executionId,
        ImportOptions options,
        LocalDate runDate,
        Instant deadline,
        List<ImportIssue> warnings
    ) {
        int maxRetries = properties.getJob().getMaxRetries();
        int attempt = 0;
        while (true) {
            try {
                return runPipeline(executionId, options, runDate, deadline);
            } catch (DatasetUnavailableException e) {
                if (attempt >= maxRetries) {
                    throw e;
                }
                attempt++;
                warnings.add(ImportIssue.warning(
                    ImportErrorCodes.ATTEMPT_FAILED,
                    "Attempt " + attempt + " failed: " + e.getMessage(),
                    null,
                    clock.instant()
                ));
                executionRepository.updateRetryCount(executionId, attempt);
                executionRepository.updateIssues(executionId, List.of(), warnings);
                long delayMs = properties.getJob().getRetryDelayMs() * attempt;
                log.warn("Import {} attempt {} failed ({}); retrying in {} ms", executionId, attempt, e.getMessage(), delayMs);
                sleepBeforeRetry(delayMs);
                checkpoint(executionId, deadline, ImportStage.ACQUIRE, null);
            }
        }
    }

    private PipelineOutcome runPipeline(long executionId, ImportOptions options, LocalDate runDate, Instant deadline) {
        List<ImportIssue> errors = new ArrayList<>();
        List<ImportIssue> warnings = new ArrayList<>();
        List<String> states = options.isScoped() ? options.states() : StateFips.allCodes();
        int vintageYear = sourceCatalog.vintageYear();

        checkpoint(executionId, deadline, ImportStage.ACQUIRE, null);
        AcquiredDatasets datasets = acquire(executionId, states, warnings);

        FeedSlices slices = new FeedSlices(vintageYear, warnings);
        Changeset changeset = Changeset.empty();
        List<AffectedBusinessChange> affected = new ArrayList<>();
        Map<String, Geometry> boundaries = new HashMap<>();
        int totalUnits = 0;
        int unitsSkipped = 0;
        int statesProcessed = 0;
        int statesSkipped = 0;

        for (String state : new TreeSet<>(states)) {
            checkpoint(executionId, deadline, ImportStage.EVALUATE, state);
            if (datasets.failedStates().contains(state)) {
                statesSkipped++;
                publish(executionId, ImportStage.EVALUATE, state, "skipped, dataset unavailable");
                continue;
            }

            List<GeographicUnit> units;
            List<EconomicProfile> profiles;
            try {
                units = slices.units(datasets, state);
                profiles = sourceCatalog.isConfigured(DatasetSource.ECONOMIC_PROFILES)
                    ? slices.profiles(datasets, state)
                    : null;
            } catch (DatasetUnavailableException e) {
                if (e.stateFips() == null) {
                    throw e;
                }
                warnings.add(ImportIssue.warning(e.code(), e.getMessage(), null, clock.instant()));
                statesSkipped++;
                continue;
            }
            List<FeedDesignation> feedRows = slices.feedRows(datasets, state);
            StateCandidates candidates = candidateAssembler.assemble(state, units, profiles, feedRows, runDate, vintageYear);
            warnings.addAll(candidates.issues());

            checkpoint(executionId, deadline, ImportStage.RECONCILE, state);
            List<Designation> current = designationRepository.findCurrentByState(state).stream()
                .filter(designation -> !candidates.skippedGeoids().contains(designation.geoid()))
                .toList();
            Changeset stateChanges = diffEngine.reconcile(candidates.candidates(), current, runDate);
            errors.addAll(stateChanges.conflicts());

            checkpoint(executionId, deadline, ImportStage.RESOLVE, state);
            Map<String, Geometry> geometries = geometriesFor(stateChanges, candidates);
            BusinessResolution resolution = businessResolver.resolve(
                stateChanges,
                businessRepository.findByState(state),
                geometries
            );
            warnings.addAll(resolution.warnings());

            for (DesignationChange change : stateChanges.created()) {
                putBoundary(boundaries, candidates, change.geoid());
            }
            for (DesignationChange change : stateChanges.updated()) {
                putBoundary(boundaries, candidates, change.geoid());
            }
            changeset = changeset.merge(stateChanges);
            affected.addAll(resolution.changes());
            totalUnits += candidates.totalUnits();
            unitsSkipped += candidates.skippedGeoids().size();
            statesProcessed++;
            publish(
                executionId,
                ImportStage.RESOLVE,
                state,
                stateChanges.changeCount() + " designation changes, " + resolution.changes().size() + " affected businesses"
            );
        }

        long activeAfter = designationRepository.countActive() + changeset.activeDelta();
        ImportStatistics statistics = new ImportStatistics(
            totalUnits,
            changeset.created().size(),
            changeset.updated().size(),
            changeset.unchangedGeoids().size(),
            changeset.expired().size(),
            changeset.redesignated().size(),
            changeset.conflicts().size(),
            activeAfter,
            statesProcessed,
            statesSkipped,
            unitsSkipped,
            affected.size()
        );
        return new PipelineOutcome(statistics, changeset, affected, boundaries, errors, warnings);
    }

    private AcquiredDatasets acquire(long executionId, List<String> states, List<ImportIssue> warnings) {
        List<DatasetRequest> requests = new ArrayList<>();
        for (DatasetSource source : DatasetSource.values()) {
            requests.addAll(sourceCatalog.requestsFor(source, states));
        }
        publish(executionId, ImportStage.ACQUIRE, null, "Acquiring " + requests.size() + " datasets");

        Map<DatasetSource, List<LocalDataset>> national = new EnumMap<>(DatasetSource.class);
        Map<DatasetSource, Map<String, List<LocalDataset>>> perState = new EnumMap<>(DatasetSource.class);
        Set<String> failedStates = new LinkedHashSet<>();
        Set<DatasetSource> servedByFallback = EnumSet.noneOf(DatasetSource.class);
        for (DatasetAcquisition acquisition : cacheManager.acquireAll(requests)) {
            DatasetRequest request = acquisition.request();
            List<LocalDataset> datasets;
            if (acquisition.succeeded()) {
                datasets = List.of(acquisition.dataset());
            } else {
                datasets = acquireFallbacks(executionId, request, acquisition.failure(), warnings);
                if (datasets.isEmpty()) {
                    if (!request.isStateScoped()) {
                        throw acquisition.failure();
                    }
                    failedStates.add(request.stateFips());
                    warnings.add(ImportIssue.warning(
                        ImportErrorCodes.DATASET_UNAVAILABLE,
                        acquisition.failure().getMessage(),
                        null,
                        clock.instant()
                    ));
                    continue;
                }
                servedByFallback.add(request.source());
            }
            if (request.isStateScoped()) {
                perState.computeIfAbsent(request.source(), key -> new HashMap<>())
                    .put(request.stateFips(), datasets);
            } else {
                national.put(request.source(), datasets);
            }
        }
        return new AcquiredDatasets(national, perState, failedStates, servedByFallback);
    }

    private List<LocalDataset> acquireFallbacks(
        long executionId,
        DatasetRequest failed,
        DatasetUnavailableException failure,
        List<ImportIssue> warnings
    ) {
        List<DatasetRequest> fallbacks = sourceCatalog.fallbackRequests(failed);
        if (fallbacks.isEmpty()) {
            return List.of();
        }
        publish(executionId, ImportStage.ACQUIRE, failed.stateFips(),
            failed.describe() + " unavailable, trying " + fallbacks.size() + " fallback resources");
        List<LocalDataset> acquired = new ArrayList<>();
        for (DatasetAcquisition acquisition : cacheManager.acquireAll(fallbacks)) {
            if (acquisition.succeeded()) {
                acquired.add(acquisition.dataset());
            } else {
                warnings.add(ImportIssue.warning(
                    ImportErrorCodes.DATASET_UNAVAILABLE,
                    acquisition.failure().getMessage(),
                    null,
                    clock.instant()
                ));
            }
        }
        if (!acquired.isEmpty()) {
            warnings.add(ImportIssue.warning(
                ImportErrorCodes.FEED_FALLBACK_USED,
                failed.describe() + " unavailable (" + failure.getMessage() + "); merged "
                    + acquired.size() + " of " + fallbacks.size() + " fallback resources",
                null,
                clock.instant()
            ));
            log.warn("Import {} fell back to {} of {} alternative resources for {}",
                executionId, acquired.size(), fallbacks.size(), failed.describe());
        }
        return acquired;
    }

    private Map<String, Geometry> geometriesFor(Changeset changes, StateCandidates candidates) {
        Set<String> needed = new LinkedHashSet<>(changes.activeAfterGeoids());
        changes.expired().forEach(change -> needed.add(change.geoid()));
        changes.redesignated().forEach(change -> needed.add(change.geoid()));

        Map<String, Geometry> geometries = new HashMap<>();
        List<String> missing = new ArrayList<>();
        for (String geoid : needed) {
            GeographicUnit unit = candidates.unitsByGeoid().get(geoid);
            if (unit != null && unit.boundary() != null) {
                geometries.put(geoid, unit.boundary());
            } else {
                missing.add(geoid);
            }
        }
        if (!missing.isEmpty()) {
            geometries.putAll(designationRepository.findGeometries(missing));
        }
        return geometries;
    }

    private static void putBoundary(Map<String, Geometry> boundaries, StateCandidates candidates, String geoid) {
        GeographicUnit unit = candidates.unitsByGeoid().get(geoid);
        if (unit != null && unit.boundary() != null) {
            boundaries.put(geoid, unit.boundary());
        }
    }

    private boolean handOff(long executionId, List<AffectedBusinessChange> affected, List<ImportIssue> warnings) {
        try {
            notificationGateway.handOff(executionId, affected);
            affectedBusinessRepository.markNotificationSent(executionId);
            return true;
        } catch (RuntimeException e) {
            log.warn("Notification hand-off failed for import {}", executionId, e);
            warnings.add(ImportIssue.warning(
                ImportErrorCodes.NOTIFICATION_HANDOFF_FAILED,
                "Notification hand-off failed: " + e.getMessage(),
                null,
                clock.instant()
            ));
            return false;
        }
    }

    private void notifyAdmins(
        long executionId,
        ImportExecutionStatus status,
        ImportOptions options,
        Instant startedAt,
        Instant finishedAt,
        ImportStatistics statistics,
        List<ImportIssue> errors,
        List<ImportIssue> warnings
    ) {
        List<String> recipients = properties.getJob().getAdminRecipients();
        if (recipients.isEmpty()) {
            return;
        }
        try {
            ImportExecution execution = executionRepository.findById(executionId);
            notificationGateway.notifyCompletion(new ImportCompletionNotice(
                executionId,
                execution == null ? null : execution.triggerType(),
                status,
                options.dryRun(),
                startedAt,
                finishedAt,
                Duration.between(startedAt, finishedAt).toMillis(),
                statistics,
                errors.isEmpty() ? null : errors.get(0).message(),
                recipients
            ));
        } catch (RuntimeException e) {
            log.warn("Completion notice for import {} could not be handed off", executionId, e);
            warnings.add(ImportIssue.warning(
                ImportErrorCodes.ADMIN_NOTICE_FAILED,
                "Completion notice hand-off failed: " + e.getMessage(),
                null,
                clock.instant()
            ));
        }
    }

    private void checkpoint(long executionId, Instant deadline, ImportStage stage, String stateFips) {
        if (lostLeases.contains(executionId)) {
            throw new ImportAbortedException(
                ImportErrorCodes.LEASE_LOST,
                ImportExecutionStatus.FAILED,
                "Import lease was taken over by another execution before " + stage
            );
        }
        if (executionRepository.isCancelRequested(executionId)) {
            throw new ImportAbortedException(
                ImportErrorCodes.IMPORT_CANCELLED,
                ImportExecutionStatus.CANCELLED,
                "Import cancelled before " + stage + (stateFips == null ? "" : " of state " + stateFips)
            );
        }
        if (clock.instant().isAfter(deadline)) {
            throw new ImportAbortedException(
                ImportErrorCodes.IMPORT_TIMEOUT,
                ImportExecutionStatus.FAILED,
                "Import exceeded its " + properties.getJob().getTimeoutMinutes() + " minute limit before " + stage
            );
        }
    }

    private void sleepBeforeRetry(long delayMs) {
        try {
            TimeUnit.MILLISECONDS.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ImportAbortedException(
                ImportErrorCodes.IMPORT_CANCELLED,
                ImportExecutionStatus.CANCELLED,
                "Import interrupted while waiting to retry"
            );
        }
    }

    private void beat(long executionId) {
        try {
            Instant now = clock.instant();
            executionRepository.updateHeartbeat(executionId, now);
            if (!lockRepository.extendLease(executionId, now.plus(Duration.ofMinutes(properties.getJob().getLeaseMinutes())))) {
                lostLeases.add(executionId);
                log.warn("Import {} no longer holds the import lease; stopping at the next stage boundary", executionId);
            }
        } catch (RuntimeException e) {
            log.warn("Heartbeat failed for import {}", executionId, e);
        }
    }

    private void releaseLease(long executionId) {
        try {
            if (!lockRepository.release(executionId)) {
                log.warn("Import {} no longer held the lease at release", executionId);
            }
        } catch (RuntimeException e) {
            log.warn("Failed to release the import lease for {}", executionId, e);
        }
    }

    private void publish(long executionId, ImportStage stage, String stateFips, String message) {
        eventPublisher.publishEvent(new ImportProgressEvent(executionId, stage, stateFips, message, clock.instant()));
    }

    private record PipelineOutcome(
        ImportStatistics statistics,
        Changeset changeset,
        List<AffectedBusinessChange> affectedBusinesses,
        Map<String, Geometry> boundaries,
        List<ImportIssue> errors,
        List<ImportIssue> warnings
    ) {
    }

    private record AcquiredDatasets(
        Map<DatasetSource, List<LocalDataset>> national,
        Map<DatasetSource, Map<String, List<LocalDataset>>> perState,
        Set<String> failedStates,
        Set<DatasetSource> servedByFallback
    ) {
        List<LocalDataset> forState(DatasetSource source, String stateFips) {
            Map<String, List<LocalDataset>> byState = perState.get(source);
            return byState == null ? null : byState.get(stateFips);
        }
    }

    private final class FeedSlices {
        private final int vintageYear;
        private final List<ImportIssue> warnings;
        private final Map<DatasetSource, Map<String, List<?>>> nationalByState = new EnumMap<>(DatasetSource.class);

        FeedSlices(int vintageYear, List<ImportIssue> warnings) {
            this.vintageYear = vintageYear;
            this.warnings = warnings;
        }

        List<GeographicUnit> units(AcquiredDatasets datasets, String stateFips) {
            return slice(datasets, DatasetSource.BOUNDARIES, stateFips, path -> boundaryParser.parse(path), GeographicUnit::stateFips);
        }

        List<EconomicProfile> profiles(AcquiredDatasets datasets, String stateFips) {
            return slice(datasets, DatasetSource.ECONOMIC_PROFILES, stateFips, path -> profileParser.parse(path, vintageYear), EconomicProfile::stateFips);
        }

        List<FeedDesignation> feedRows(AcquiredDatasets datasets, String stateFips) {
            List<FeedDesignation> rows = slice(datasets, DatasetSource.DESIGNATIONS, stateFips, path -> designationParser.parse(path), FeedDesignation::stateFips);
            return datasets.servedByFallback().contains(DatasetSource.DESIGNATIONS)
                ? DesignationFeedParser.mergeByGeoid(rows)
                : rows;
        }

        @SuppressWarnings("unchecked")
        private <T> List<T> slice(
            AcquiredDatasets datasets,
            DatasetSource source,
            String stateFips,
            DatasetParser<T> parser,
            Function<T, String> stateOf
        ) {
            List<LocalDataset> stateDatasets = datasets.forState(source, stateFips);
            if (stateDatasets != null) {
                return parseAll(source, stateDatasets, parser).stream()
                    .filter(record -> stateFips.equals(stateOf.apply(record)))
                    .toList();
            }
            List<LocalDataset> nationalDatasets = datasets.national().get(source);
            if (nationalDatasets == null) {
                return List.of();
            }
            Map<String, List<?>> byState = nationalByState.computeIfAbsent(source, key -> {
                Map<String, List<T>> grouped = parseAll(source, nationalDatasets, parser).stream()
                    .filter(record -> stateOf.apply(record) != null)
                    .collect(Collectors.groupingBy(stateOf, LinkedHashMap::new, Collectors.toList()));
                return new LinkedHashMap<>(grouped);
            });
            return (List<T>) byState.getOrDefault(stateFips, List.of());
        }

        private <T> List<T> parseAll(DatasetSource source, List<LocalDataset> sourceDatasets, DatasetParser<T> parser) {
            List<T> records = new ArrayList<>();
            for (LocalDataset dataset : sourceDatasets) {
                records.addAll(parse(source, dataset, parser).records());
            }
            return records;
        }

        private <T> FeedParseResult<T> parse(DatasetSource source, LocalDataset dataset, DatasetParser<T> parser) {
            FeedParseResult<T> result;
            try {
                result = parser.parse(dataset.path());
            } catch (IOException | RuntimeException e) {
                throw new DatasetUnavailableException(
                    source,
                    dataset.request().stateFips(),
                    "unreadable " + dataset.request().format() + " file: " + e.getMessage(),
                    e
                );
            }
            for (FeedProblem problem : result.problems()) {
                warnings.add(ImportIssue.warning(
                    ImportErrorCodes.MALFORMED_FEED_ROW,
                    source.id() + ": " + problem.message(),
                    problem.geoid(),
                    clock.instant()
                ));
            }
            return result;
        }
    }

    @FunctionalInterface
    private interface DatasetParser<T> {
        FeedParseResult<T> parse(Path path) throws IOException;
    }
}
