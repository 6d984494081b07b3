package com.platform.paas.catalog;

import io.fabric8.kubernetes.api.model.Quantity;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Kubernetes quantity arithmetic ("100m", "0.5", "512Mi", "10G").
 * Values are normalized to base units: cores for cpu, bytes for everything else.
 */
public final class ResourceQuantities {
    
    private ResourceQuantities() {
    }
    
    /**
     * Parse a quantity string into its base-unit amount.
     *
     * @throws IllegalArgumentException if the value is not a valid quantity
     */
    public static BigDecimal amount(String quantity) {
        if (quantity == null || quantity.isBlank()) {
            throw new IllegalArgumentException("Quantity must not be empty");
        }
        try {
            return Quantity.getAmountInBytes(new Quantity(quantity.trim()));
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Invalid quantity: " + quantity, e);
        }
    }
    
    public static int compare(String left, String right) {
        return amount(left).compareTo(amount(right));
    }
    
    public static boolean isValid(String quantity) {
        try {
            amount(quantity);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
    
    /**
     * Size in whole bytes, rounding half up. Suffix-less values are bytes.
     */
    public static long toBytes(String quantity) {
        return amount(quantity).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }
}
