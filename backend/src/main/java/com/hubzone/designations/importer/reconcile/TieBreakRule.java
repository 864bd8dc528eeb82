package com.hubzone.designations.importer.reconcile;

import com.hubzone.designations.importer.model.Designation;
import com.hubzone.designations.importer.model.EligibleDesignation;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

public interface TieBreakRule {

    TieBreakRuleKind kind();

    List<EligibleDesignation> narrow(List<EligibleDesignation> options, Designation incumbent);

    static TieBreakRule noExpirationFirst() {
        return new TieBreakRule() {
            @Override
            public TieBreakRuleKind kind() {
                return TieBreakRuleKind.NO_EXPIRATION_FIRST;
            }

            @Override
            public List<EligibleDesignation> narrow(List<EligibleDesignation> options, Designation incumbent) {
                return options.stream().filter(option -> !option.hasExpiration()).toList();
            }
        };
    }

    static TieBreakRule incumbentTypeFirst() {
        return new TieBreakRule() {
            @Override
            public TieBreakRuleKind kind() {
                return TieBreakRuleKind.INCUMBENT_TYPE_FIRST;
            }

            @Override
            public List<EligibleDesignation> narrow(List<EligibleDesignation> options, Designation incumbent) {
                if (incumbent == null || !incumbent.isActive()) {
                    return List.of();
                }
                return options.stream().filter(option -> option.type() == incumbent.type()).toList();
            }
        };
    }

    static TieBreakRule latestExpirationFirst() {
        return new TieBreakRule() {
            @Override
            public TieBreakRuleKind kind() {
                return TieBreakRuleKind.LATEST_EXPIRATION_FIRST;
            }

            @Override
            public List<EligibleDesignation> narrow(List<EligibleDesignation> options, Designation incumbent) {
                LocalDate latest = options.stream()
                    .map(EligibleDesignation::expirationDate)
                    .filter(Objects::nonNull)
                    .max(Comparator.naturalOrder())
                    .orElse(null);
                if (latest == null) {
                    return List.of();
                }
                return options.stream().filter(option -> latest.equals(option.expirationDate())).toList();
            }
        };
    }
}
