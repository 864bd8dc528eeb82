package com.hubzone.designations.importer.service;

import com.hubzone.designations.config.ImportProperties;
import com.hubzone.designations.importer.cache.DatasetCacheManager;
import com.hubzone.designations.importer.model.AffectedBusinessChange;
import com.hubzone.designations.importer.model.CacheStats;
import com.hubzone.designations.importer.model.ImportExecution;
import com.hubzone.designations.importer.model.ImportOptions;
import com.hubzone.designations.importer.model.SchedulerStatus;
import com.hubzone.designations.importer.model.TriggerType;
import com.hubzone.designations.importer.persistence.AffectedBusinessJdbcRepository;
import com.hubzone.designations.importer.persistence.ImportExecutionJdbcRepository;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.NoSuchElementException;

@Service
public class ImportOperatorService {
    private final ImportExecutionService executionService;
    private final QuarterlyImportScheduler scheduler;
    private final ImportExecutionJdbcRepository executionRepository;
    private final AffectedBusinessJdbcRepository affectedBusinessRepository;
    private final DatasetCacheManager cacheManager;
    private final ImportProperties properties;

    public ImportOperatorService(
        ImportExecutionService executionService,
        QuarterlyImportScheduler scheduler,
        ImportExecutionJdbcRepository executionRepository,
        AffectedBusinessJdbcRepository affectedBusinessRepository,
        DatasetCacheManager cacheManager,
        ImportProperties properties
    ) {
        this.executionService = executionService;
        this.scheduler = scheduler;
        this.executionRepository = executionRepository;
        this.affectedBusinessRepository = affectedBusinessRepository;
        this.cacheManager = cacheManager;
        this.properties = properties;
    }

    public long trigger(ImportOptions options, String actor) {
        String triggeredBy = actor == null || actor.isBlank() ? "operator" : actor.trim();
        return executionService.trigger(TriggerType.MANUAL, triggeredBy, options);
    }

    public ImportExecution status(long executionId) {
        ImportExecution execution = executionRepository.findById(executionId);
        if (execution == null) {
            throw new NoSuchElementException("Unknown import execution " + executionId);
        }
        return execution;
    }

    public ImportExecution current() {
        List<ImportExecution> unfinished = executionRepository.findUnfinished();
        return unfinished.isEmpty() ? null : unfinished.get(unfinished.size() - 1);
    }

    public List<ImportExecution> history(Integer limit) {
        int safeLimit = limit == null ? properties.getJob().getHistoryLimit() : Math.max(1, Math.min(limit, 500));
        return executionRepository.findRecent(safeLimit);
    }

    public String result(long executionId) {
        status(executionId);
        return executionRepository.findResultJson(executionId);
    }

    public List<AffectedBusinessChange> affectedBusinesses(long executionId) {
        status(executionId);
        return affectedBusinessRepository.findByExecution(executionId);
    }

    public boolean cancel(long executionId) {
        status(executionId);
        return executionService.cancel(executionId);
    }

    public SchedulerStatus startScheduler() {
        scheduler.start();
        return scheduler.status();
    }

    public SchedulerStatus stopScheduler() {
        scheduler.stop();
        return scheduler.status();
    }

    public SchedulerStatus schedulerStatus() {
        return scheduler.status();
    }

    public CacheStats cacheStats() {
        return cacheManager.stats();
    }

    public int clearCache() {
        return cacheManager.clear();
    }
}
