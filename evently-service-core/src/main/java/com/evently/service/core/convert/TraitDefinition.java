package com.evently.service.core.convert;

import com.evently.event.model.Trait;
import com.evently.event.model.TraitType;
import com.evently.service.core.path.PathQuery;
import com.evently.service.core.path.PathSyntaxException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts one named, typed trait from a notification.
 *
 * <p>Config keys:
 * <ul>
 *   <li>{@code type} (optional): text, int, float or datetime; defaults to text.
 *   <li>{@code fields} (required): a path, or a list of paths tried in order. The trait takes the value of the first
 *       path that resolves to a non-null value.
 * </ul>
 */
public final class TraitDefinition {

    private static final Pattern NON_FINITE = Pattern.compile("([+-]?)(nan|inf|infinity)", Pattern.CASE_INSENSITIVE);

    private final String name;
    private final TraitType type;
    private final PathQuery fields;

    public TraitDefinition(String name, Map<String, ?> traitConfig) {
        this.name = Objects.requireNonNull(name, "name");
        if (traitConfig == null || !traitConfig.containsKey("fields")) {
            throw new EventDefinitionException(
                    "Required field in trait definition not specified: 'fields'", traitConfig);
        }
        List<String> paths = fieldPaths(name, traitConfig);
        try {
            this.fields = PathQuery.compile(paths);
        } catch (PathSyntaxException ex) {
            throw new EventDefinitionException(
                    "Parse error in path specification '" + ex.getExpression() + "' for trait " + name + ": "
                            + ex.getMessage(),
                    traitConfig,
                    ex);
        }
        this.type = resolveType(name, traitConfig);
    }

    public String name() {
        return name;
    }

    public TraitType type() {
        return type;
    }

    public PathQuery fields() {
        return fields;
    }

    /**
     * Resolves and coerces this trait. The first non-null value is final: a value that fails coercion is an error
     * and later paths are not consulted.
     *
     * @return empty when no path yields a non-null value
     * @throws TraitConversionException when the chosen value cannot be coerced to the declared type
     */
    public Optional<Trait> toTrait(Map<String, ?> notification) {
        Optional<Object> raw = fields.first(notification);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        Object value = raw.get();
        try {
            return Optional.of(new Trait(name, type, convertValue(type, value)));
        } catch (IllegalArgumentException ex) {
            throw new TraitConversionException(name, type, value, ex);
        }
    }

    static Object convertValue(TraitType type, Object value) {
        return switch (type) {
            case INT -> toLong(value);
            case FLOAT -> toDouble(value);
            case DATETIME -> Timestamps.parse(value);
            case TEXT -> String.valueOf(value);
        };
    }

    private static Long toLong(Object value) {
        try {
            if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
                return ((Number) value).longValue();
            }
            if (value instanceof BigInteger big) {
                return big.longValueExact();
            }
            if (value instanceof BigDecimal decimal) {
                return decimal.toBigInteger().longValueExact();
            }
            if (value instanceof Number number) {
                double d = number.doubleValue();
                if (!Double.isFinite(d)) {
                    throw new IllegalArgumentException("not a finite number: " + d);
                }
                return BigDecimal.valueOf(d).toBigInteger().longValueExact();
            }
        } catch (ArithmeticException ex) {
            throw new IllegalArgumentException("integer out of range: " + value, ex);
        }
        if (value instanceof CharSequence text) {
            return Long.parseLong(text.toString().trim());
        }
        throw new IllegalArgumentException("not an integer: " + value.getClass().getSimpleName());
    }

    private static Double toDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof CharSequence text) {
            return parseDecimal(text.toString().trim());
        }
        throw new IllegalArgumentException("not a number: " + value.getClass().getSimpleName());
    }

    // Plain decimal or scientific notation, plus nan/inf/infinity. Java literal forms (10f, 0x1p3) are rejected.
    private static double parseDecimal(String text) {
        Matcher special = NON_FINITE.matcher(text);
        if (special.matches()) {
            if (special.group(2).equalsIgnoreCase("nan")) {
                return Double.NaN;
            }
            return "-".equals(special.group(1)) ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        return new BigDecimal(text).doubleValue();
    }

    private static List<String> fieldPaths(String name, Map<String, ?> traitConfig) {
        Object fields = traitConfig.get("fields");
        if (fields instanceof String single) {
            return List.of(single);
        }
        if (fields instanceof Collection<?> many && !many.isEmpty()) {
            List<String> paths = new ArrayList<>(many.size());
            for (Object path : many) {
                if (!(path instanceof String p)) {
                    throw new EventDefinitionException(
                            "Path specification for trait " + name + " must be a string, got: " + path, traitConfig);
                }
                paths.add(p);
            }
            return paths;
        }
        throw new EventDefinitionException(
                "'fields' for trait " + name + " must be a path or a non-empty list of paths", traitConfig);
    }

    private static TraitType resolveType(String name, Map<String, ?> traitConfig) {
        Object declared = traitConfig.get("type");
        try {
            return TraitType.fromConfigValue(declared == null ? null : declared.toString());
        } catch (IllegalArgumentException ex) {
            throw new EventDefinitionException(
                    "Invalid trait type '" + declared + "' for trait " + name, traitConfig, ex);
        }
    }

    @Override
    public String toString() {
        return "TraitDefinition{name=" + name + ", type=" + type.configValue() + ", fields=" + fields + "}";
    }
}
