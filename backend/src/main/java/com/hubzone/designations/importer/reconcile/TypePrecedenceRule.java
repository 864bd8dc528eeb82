package com.hubzone.designations.importer.reconcile;

import com.hubzone.designations.importer.model.Designation;
import com.hubzone.designations.importer.model.DesignationType;
import com.hubzone.designations.importer.model.EligibleDesignation;

import java.util.List;

// Unlisted types rank below every listed type.
public class TypePrecedenceRule implements TieBreakRule {
    private final List<DesignationType> precedence;

    public TypePrecedenceRule(List<DesignationType> precedence) {
        this.precedence = precedence == null ? List.of() : List.copyOf(precedence);
    }

    @Override
    public TieBreakRuleKind kind() {
        return TieBreakRuleKind.TYPE_PRECEDENCE;
    }

    @Override
    public List<EligibleDesignation> narrow(List<EligibleDesignation> options, Designation incumbent) {
        for (DesignationType type : precedence) {
            List<EligibleDesignation> matching = options.stream()
                .filter(option -> option.type() == type)
                .toList();
            if (!matching.isEmpty()) {
                return matching;
            }
        }
        return List.of();
    }

    public List<DesignationType> precedence() {
        return precedence;
    }
}
