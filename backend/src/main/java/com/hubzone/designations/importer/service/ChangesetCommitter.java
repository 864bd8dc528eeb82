package com.hubzone.designations.importer.service;

import com.hubzone.designations.importer.error.ImportAbortedException;
import com.hubzone.designations.importer.error.PersistenceFailureException;
import com.hubzone.designations.importer.model.AffectedBusinessChange;
import com.hubzone.designations.importer.model.Changeset;
import com.hubzone.designations.importer.model.DesignationChange;
import com.hubzone.designations.importer.model.HubzoneMembership;
import com.hubzone.designations.importer.model.ImportExecutionStatus;
import com.hubzone.designations.importer.persistence.AffectedBusinessJdbcRepository;
import com.hubzone.designations.importer.persistence.BusinessLocationJdbcRepository;
import com.hubzone.designations.importer.persistence.DesignationJdbcRepository;
import com.hubzone.designations.importer.persistence.ImportLockRepository;
import com.hubzone.designations.importer.util.ImportErrorCodes;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Map;

// The lease row stays locked for the whole transaction so a run that lost its lease cannot write.
@Service
public class ChangesetCommitter {
    private static final Logger log = LoggerFactory.getLogger(ChangesetCommitter.class);

    private final DesignationJdbcRepository designationRepository;
    private final AffectedBusinessJdbcRepository affectedBusinessRepository;
    private final BusinessLocationJdbcRepository businessLocationRepository;
    private final ImportLockRepository lockRepository;
    private final TransactionTemplate transactionTemplate;

    public ChangesetCommitter(
        DesignationJdbcRepository designationRepository,
        AffectedBusinessJdbcRepository affectedBusinessRepository,
        BusinessLocationJdbcRepository businessLocationRepository,
        ImportLockRepository lockRepository,
        TransactionTemplate transactionTemplate
    ) {
        this.designationRepository = designationRepository;
        this.affectedBusinessRepository = affectedBusinessRepository;
        this.businessLocationRepository = businessLocationRepository;
        this.lockRepository = lockRepository;
        this.transactionTemplate = transactionTemplate;
    }

    public void commit(
        long executionId,
        Changeset changeset,
        Map<String, Geometry> boundaries,
        List<AffectedBusinessChange> affectedBusinesses,
        Instant committedAt
    ) {
        try {
            transactionTemplate.executeWithoutResult(status -> {
                if (!lockRepository.lockIfHeldBy(executionId)) {
                    throw new ImportAbortedException(
                        ImportErrorCodes.LEASE_LOST,
                        ImportExecutionStatus.FAILED,
                        "Import " + executionId + " no longer holds the import lease; nothing was committed"
                    );
                }
                for (DesignationChange change : changeset.allChanges()) {
                    designationRepository.upsert(change.next(), boundaries.get(change.geoid()), executionId);
                }
                affectedBusinessRepository.insertAll(executionId, affectedBusinesses);
                for (AffectedBusinessChange change : affectedBusinesses) {
                    businessLocationRepository.updateHubzoneStatus(
                        change.businessId(),
                        change.newStatus() == HubzoneMembership.IN_HUBZONE,
                        change.geoid(),
                        committedAt
                    );
                }
            });
        } catch (ImportAbortedException e) {
            log.warn("Commit of import {} refused: {}", executionId, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.warn("Commit of import {} failed and was rolled back", executionId, e);
            throw new PersistenceFailureException("Commit failed: " + e.getMessage(), e);
        }
        log.info(
            "Committed import {}: {} designation changes, {} affected businesses",
            executionId,
            changeset.changeCount(),
            affectedBusinesses.size()
        );
    }
}
