package com.hubzone.designations.importer.reconcile;

import com.hubzone.designations.config.ImportProperties;
import com.hubzone.designations.importer.error.ReconciliationConflictException;
import com.hubzone.designations.importer.model.Designation;
import com.hubzone.designations.importer.model.DesignationType;
import com.hubzone.designations.importer.model.EligibleDesignation;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered list of tie-break rules used when a unit is eligible under more than one designation type.
 * Rules run in order; each one narrows the remaining options unless it would leave none.
 */
public class TieBreakPolicy {
    private static final Comparator<EligibleDesignation> SAME_TYPE_PREFERENCE = Comparator
        .comparing((EligibleDesignation option) -> option.expirationDate() == null ? 0 : 1)
        .thenComparing(EligibleDesignation::expirationDate, Comparator.nullsFirst(Comparator.<LocalDate>reverseOrder()))
        .thenComparing(EligibleDesignation::designationDate, Comparator.nullsLast(Comparator.<LocalDate>naturalOrder()));

    private final List<TieBreakRule> rules;

    public TieBreakPolicy(List<TieBreakRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static TieBreakPolicy fromProperties(ImportProperties.Reconciliation properties) {
        List<TieBreakRule> rules = new ArrayList<>();
        for (TieBreakRuleKind kind : properties.getTieBreakRules()) {
            rules.add(ruleFor(kind, properties.getTypePrecedence()));
        }
        return new TieBreakPolicy(rules);
    }

    static TieBreakRule ruleFor(TieBreakRuleKind kind, List<DesignationType> precedence) {
        return switch (kind) {
            case NO_EXPIRATION_FIRST -> TieBreakRule.noExpirationFirst();
            case INCUMBENT_TYPE_FIRST -> TieBreakRule.incumbentTypeFirst();
            case LATEST_EXPIRATION_FIRST -> TieBreakRule.latestExpirationFirst();
            case TYPE_PRECEDENCE -> new TypePrecedenceRule(precedence);
        };
    }

    public List<TieBreakRule> rules() {
        return rules;
    }

    /**
     * Picks the single eligibility a unit is designated under.
     *
     * @throws ReconciliationConflictException when more than one type survives every rule
     * @throws IllegalArgumentException when there are no options at all
     */
    public EligibleDesignation resolve(String geoid, List<EligibleDesignation> eligibilities, Designation incumbent) {
        List<EligibleDesignation> options = distinctByType(eligibilities);
        if (options.isEmpty()) {
            throw new IllegalArgumentException("No eligibilities to choose from for " + geoid);
        }
        for (TieBreakRule rule : rules) {
            if (options.size() == 1) {
                break;
            }
            List<EligibleDesignation> narrowed = rule.narrow(options, incumbent);
            if (!narrowed.isEmpty()) {
                options = narrowed;
            }
        }
        if (options.size() > 1) {
            throw new ReconciliationConflictException(
                geoid,
                options.stream().map(EligibleDesignation::type).toList()
            );
        }
        return options.get(0);
    }

    /**
     * Collapses eligibilities of the same type into one, keeping the open-ended or latest-expiring one
     * and, among those, the earliest designation date.
     */
    public static List<EligibleDesignation> distinctByType(List<EligibleDesignation> eligibilities) {
        if (eligibilities == null || eligibilities.isEmpty()) {
            return List.of();
        }
        Map<DesignationType, EligibleDesignation> byType = new LinkedHashMap<>();
        for (EligibleDesignation option : eligibilities) {
            byType.merge(option.type(), option, TieBreakPolicy::preferred);
        }
        return List.copyOf(byType.values());
    }

    private static EligibleDesignation preferred(EligibleDesignation left, EligibleDesignation right) {
        return SAME_TYPE_PREFERENCE.compare(left, right) <= 0 ? left : right;
    }
}
