package com.creatorradar.discovery.identity;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Named extraction rule: one identifier field looked up in the record itself and then in each nested scope,
 * in order. Values are normalized to a lowercase trimmed string; blanks, NaN, infinities and negative numbers
 * count as absent.
 */
public record IdentityRule(String name, String field, List<String> scopes) {

    /** Root marker in {@link #scopes()}. */
    public static final String ROOT = "";

    public IdentityRule {
        scopes = List.copyOf(scopes);
    }

    /**
     * First normalized candidate for this field across the configured scopes.
     */
    public Optional<String> extract(Map<String, Object> record) {
        if (record == null) {
            return Optional.empty();
        }
        for (String scope : scopes) {
            Object container = ROOT.equals(scope) ? record : record.get(scope);
            if (container instanceof Map<?, ?> map) {
                Optional<String> candidate = normalize(map.get(field));
                if (candidate.isPresent()) {
                    return candidate;
                }
            }
        }
        return Optional.empty();
    }

    static Optional<String> normalize(Object value) {
        if (value instanceof CharSequence cs) {
            String s = cs.toString().trim().toLowerCase(Locale.ROOT);
            return s.isEmpty() ? Optional.empty() : Optional.of(s);
        }
        if (value instanceof Number number) {
            return normalizeNumber(number);
        }
        return Optional.empty();
    }

    private static Optional<String> normalizeNumber(Number number) {
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d) || d < 0) {
                return Optional.empty();
            }
            return Optional.of(new BigDecimal(Double.toString(d)).stripTrailingZeros().toPlainString());
        }
        BigDecimal decimal = number instanceof BigDecimal bd ? bd : new BigDecimal(number.toString());
        if (decimal.signum() < 0) {
            return Optional.empty();
        }
        return Optional.of(decimal.stripTrailingZeros().toPlainString());
    }
}
