package com.platform.paas.catalog;

import java.math.BigDecimal;

/**
 * Effective floor and ceiling for one resource kind within a plan.
 * Amounts are pre-parsed so admission never re-parses catalog values.
 */
public record ResourceBounds(
    ResourceKind kind,
    String specId,
    String floor,
    String ceiling,
    BigDecimal floorAmount,
    BigDecimal ceilingAmount
) {
    
    public static ResourceBounds of(LimitSpec spec, String ceilingOverride) {
        String ceiling = ceilingOverride != null ? ceilingOverride : spec.ceiling();
        return new ResourceBounds(
            spec.kind(),
            spec.id(),
            spec.floor(),
            ceiling,
            spec.floor() != null ? ResourceQuantities.amount(spec.floor()) : null,
            ceiling != null ? ResourceQuantities.amount(ceiling) : null
        );
    }
    
    public boolean isBelowFloor(BigDecimal amount) {
        return floorAmount != null && amount.compareTo(floorAmount) < 0;
    }
    
    public boolean isAboveCeiling(BigDecimal amount) {
        return ceilingAmount != null && amount.compareTo(ceilingAmount) > 0;
    }
}
