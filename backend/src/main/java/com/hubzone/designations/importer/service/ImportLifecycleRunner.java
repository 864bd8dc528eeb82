package com.hubzone.designations.importer.service;

import com.hubzone.designations.config.ImportProperties;
import com.hubzone.designations.importer.model.ImportExecution;
import com.hubzone.designations.importer.model.ImportExecutionStatus;
import com.hubzone.designations.importer.model.ImportIssue;
import com.hubzone.designations.importer.persistence.ImportExecutionJdbcRepository;
import com.hubzone.designations.importer.persistence.ImportLockRepository;
import com.hubzone.designations.importer.util.ImportErrorCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class ImportLifecycleRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ImportLifecycleRunner.class);

    private final ImportExecutionJdbcRepository executionRepository;
    private final ImportLockRepository lockRepository;
    private final ImportProperties properties;
    private final Clock clock;

    public ImportLifecycleRunner(
        ImportExecutionJdbcRepository executionRepository,
        ImportLockRepository lockRepository,
        ImportProperties properties,
        Clock clock
    ) {
        this.executionRepository = executionRepository;
        this.lockRepository = lockRepository;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        recoverAbandoned();
    }

    public int recoverAbandoned() {
        List<ImportExecution> unfinished;
        try {
            unfinished = executionRepository.findUnfinished();
        } catch (RuntimeException e) {
            log.warn("Skipping import cleanup because the database is unreachable", e);
            return 0;
        }
        Instant now = clock.instant();
        Instant cutoff = now.minus(Duration.ofMinutes(properties.getJob().getStaleMinutes()));
        int recovered = 0;
        for (ImportExecution execution : unfinished) {
            Instant lastSeen = lastActivity(execution);
            if (lastSeen != null && lastSeen.isAfter(cutoff)) {
                continue;
            }
            List<ImportIssue> errors = new ArrayList<>(execution.errors());
            errors.add(ImportIssue.fatal(
                ImportErrorCodes.ABANDONED_ON_STARTUP,
                "Import was still " + execution.status() + " at startup with no heartbeat since " + lastSeen,
                null,
                now
            ));
            executionRepository.complete(
                execution.id(),
                ImportExecutionStatus.FAILED,
                now,
                execution.statistics(),
                errors,
                execution.warnings(),
                null
            );
            lockRepository.release(execution.id());
            recovered++;
            log.info("Marked abandoned import {} as FAILED (last activity {})", execution.id(), lastSeen);
        }
        return recovered;
    }

    private static Instant lastActivity(ImportExecution execution) {
        Instant latest = execution.createdAt();
        for (Instant candidate : new Instant[] {execution.startedAt(), execution.lastHeartbeatAt()}) {
            if (candidate != null && (latest == null || candidate.isAfter(latest))) {
                latest = candidate;
            }
        }
        return latest;
    }
}
