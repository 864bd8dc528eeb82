package com.hubzone.designations.importer.reconcile;

import com.hubzone.designations.config.ImportProperties;
import com.hubzone.designations.importer.error.ReconciliationConflictException;
import com.hubzone.designations.importer.model.CandidateDesignation;
import com.hubzone.designations.importer.model.ChangeKind;
import com.hubzone.designations.importer.model.Changeset;
import com.hubzone.designations.importer.model.Designation;
import com.hubzone.designations.importer.model.DesignationChange;
import com.hubzone.designations.importer.model.DesignationStatus;
import com.hubzone.designations.importer.model.DesignationType;
import com.hubzone.designations.importer.model.EligibleDesignation;
import com.hubzone.designations.importer.model.ImportIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Compares the freshly computed candidates against the stored designations of the same scope and
 * classifies every unit as new, updated, unchanged, expired or redesignated. Has no side effects.
 */
@Component
public class DesignationDiffEngine {
    private static final Logger log = LoggerFactory.getLogger(DesignationDiffEngine.class);

    private final int gracePeriodMonths;
    private final Set<DesignationType> graceTypes;
    private final TieBreakPolicy tieBreakPolicy;
    private final Clock clock;

    @Autowired
    public DesignationDiffEngine(ImportProperties properties, Clock clock) {
        this(
            properties.getReconciliation().getGracePeriodMonths(),
            properties.getReconciliation().getGracePeriodTypes(),
            TieBreakPolicy.fromProperties(properties.getReconciliation()),
            clock
        );
    }

    public DesignationDiffEngine(
        int gracePeriodMonths,
        List<DesignationType> graceTypes,
        TieBreakPolicy tieBreakPolicy,
        Clock clock
    ) {
        if (gracePeriodMonths <= 0) {
            throw new IllegalArgumentException("gracePeriodMonths must be positive");
        }
        this.gracePeriodMonths = gracePeriodMonths;
        this.graceTypes = graceTypes == null || graceTypes.isEmpty()
            ? EnumSet.noneOf(DesignationType.class)
            : EnumSet.copyOf(graceTypes);
        this.tieBreakPolicy = tieBreakPolicy;
        this.clock = clock;
    }

    /**
     * @param candidates units that qualify under at least one type, for the units in scope
     * @param current    stored ACTIVE and REDESIGNATED designations for the same scope
     * @param runDate    effective date of the run
     */
    public Changeset reconcile(List<CandidateDesignation> candidates, List<Designation> current, LocalDate runDate) {
        Map<String, CandidateDesignation> candidatesByGeoid = new HashMap<>();
        for (CandidateDesignation candidate : candidates) {
            candidatesByGeoid.put(candidate.geoid(), candidate);
        }
        Map<String, Designation> currentByGeoid = new HashMap<>();
        for (Designation designation : current) {
            currentByGeoid.put(designation.geoid(), designation);
        }
        TreeSet<String> geoids = new TreeSet<>(candidatesByGeoid.keySet());
        geoids.addAll(currentByGeoid.keySet());

        List<DesignationChange> created = new ArrayList<>();
        List<DesignationChange> updated = new ArrayList<>();
        List<DesignationChange> expired = new ArrayList<>();
        List<DesignationChange> redesignated = new ArrayList<>();
        List<String> unchanged = new ArrayList<>();
        List<ImportIssue> conflicts = new ArrayList<>();

        for (String geoid : geoids) {
            CandidateDesignation candidate = candidatesByGeoid.get(geoid);
            Designation existing = currentByGeoid.get(geoid);

            if (candidate == null) {
                DesignationChange change = lapse(existing, runDate);
                if (change == null) {
                    continue;
                }
                if (change.kind() == ChangeKind.REDESIGNATED) {
                    redesignated.add(change);
                } else {
                    expired.add(change);
                }
                continue;
            }

            Designation incumbent = existing != null && existing.isActive() ? existing : null;
            EligibleDesignation chosen;
            try {
                chosen = tieBreakPolicy.resolve(geoid, candidate.eligibilities(), incumbent);
            } catch (ReconciliationConflictException e) {
                log.warn("Reconciliation conflict for {}: {}", geoid, e.candidates());
                conflicts.add(ImportIssue.error(e.code(), e.getMessage(), geoid, clock.instant()));
                continue;
            }

            if (incumbent == null) {
                created.add(new DesignationChange(
                    ChangeKind.NEW,
                    geoid,
                    existing,
                    activeDesignation(candidate, chosen, chosen.designationDate()),
                    candidate.qualification()
                ));
            } else if (incumbent.type() == chosen.type()
                && Objects.equals(incumbent.expirationDate(), chosen.expirationDate())) {
                unchanged.add(geoid);
            } else {
                LocalDate designationDate = incumbent.type() == chosen.type()
                    ? incumbent.designationDate()
                    : chosen.designationDate();
                updated.add(new DesignationChange(
                    ChangeKind.UPDATED,
                    geoid,
                    incumbent,
                    activeDesignation(candidate, chosen, designationDate),
                    candidate.qualification()
                ));
            }
        }

        return new Changeset(created, updated, expired, redesignated, unchanged, conflicts);
    }

    public int gracePeriodMonths() {
        return gracePeriodMonths;
    }

    private DesignationChange lapse(Designation existing, LocalDate runDate) {
        if (existing == null) {
            return null;
        }
        if (existing.isActive()) {
            if (graceTypes.contains(existing.type())) {
                return new DesignationChange(
                    ChangeKind.REDESIGNATED,
                    existing.geoid(),
                    existing,
                    existing.redesignate(runDate.plusMonths(gracePeriodMonths)),
                    null
                );
            }
            return new DesignationChange(ChangeKind.EXPIRED, existing.geoid(), existing, existing.expire(runDate), null);
        }
        if (existing.status() == DesignationStatus.REDESIGNATED
            && existing.gracePeriodEndDate() != null
            && !existing.gracePeriodEndDate().isAfter(runDate)) {
            return new DesignationChange(ChangeKind.EXPIRED, existing.geoid(), existing, existing.expire(runDate), null);
        }
        return null;
    }

    private static Designation activeDesignation(
        CandidateDesignation candidate,
        EligibleDesignation chosen,
        LocalDate designationDate
    ) {
        return new Designation(
            candidate.geoid(),
            candidate.stateFips(),
            candidate.countyFips(),
            chosen.type(),
            DesignationStatus.ACTIVE,
            designationDate,
            chosen.expirationDate(),
            null,
            chosen.sourceDataset()
        );
    }
}
