package com.platform.paas.admission;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Naming constraints for workloads and volumes.
 * <p>
 * A name must be a valid Kubernetes label value (lowercase letters, digits, hyphens)
 * and must not start with a match for any reserved pattern.
 */
public final class ReservedNamePolicy {
    
    private static final Pattern LABEL_PATTERN = Pattern.compile("^[a-z0-9-]+$");
    
    private final List<Pattern> reservedPatterns;
    
    private ReservedNamePolicy(List<Pattern> reservedPatterns) {
        this.reservedPatterns = List.copyOf(reservedPatterns);
    }
    
    /**
     * @param reservedNames literal names, matched exactly
     * @param patterns      regular expressions, matched from the start of the name
     * @throws PatternSyntaxException if a pattern does not compile
     */
    public static ReservedNamePolicy of(Collection<String> reservedNames, Collection<String> patterns) {
        List<Pattern> compiled = new ArrayList<>();
        for (String name : reservedNames) {
            if (!name.isBlank()) {
                compiled.add(Pattern.compile(Pattern.quote(name.trim()) + "$"));
            }
        }
        for (String pattern : patterns) {
            if (!pattern.isBlank()) {
                compiled.add(Pattern.compile(pattern.trim()));
            }
        }
        return new ReservedNamePolicy(compiled);
    }
    
    public static ReservedNamePolicy none() {
        return new ReservedNamePolicy(List.of());
    }
    
    /**
     * @return the reason the name is refused, or empty when it is acceptable
     */
    public Optional<String> check(String name) {
        if (name == null || !LABEL_PATTERN.matcher(name).matches()) {
            return Optional.of(String.format("'%s' can only contain a-z (lowercase), 0-9 and hyphens", name));
        }
        for (Pattern pattern : reservedPatterns) {
            if (pattern.matcher(name).lookingAt()) {
                return Optional.of(String.format("'%s' is a reserved name", name));
            }
        }
        return Optional.empty();
    }
    
    public int size() {
        return reservedPatterns.size();
    }
}
