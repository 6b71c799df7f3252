package com.realtycrm.mlssync.service.mapping;

import com.realtycrm.mlssync.exception.MappingException;
import com.realtycrm.mlssync.model.CanonicalField;
import com.realtycrm.mlssync.model.FieldMappingRule;
import com.realtycrm.mlssync.model.FieldTransform;
import com.realtycrm.mlssync.model.PropertyStatus;
import com.realtycrm.mlssync.service.provider.ProviderRecord;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Translates a provider record into a {@link CanonicalProperty} by applying a provider's mapping table.
 * Stateless; fields not named by any rule are ignored.
 */
@Component
public class FieldMapper {

    /**
     * @param record     The provider-native record.
     * @param rules      The provider's mapping table.
     * @param providerId Identifier of the provider the record came from.
     *
     * @return the canonical record.
     *
     * @throws MappingException naming the offending field when a value cannot be converted or a required
     *                          field is missing.
     */
    public CanonicalProperty map(final ProviderRecord record, final List<FieldMappingRule> rules,
                                 final String providerId) {
        final CanonicalProperty.CanonicalPropertyBuilder builder = CanonicalProperty.builder().providerId(providerId);
        final Set<CanonicalField> populated = EnumSet.noneOf(CanonicalField.class);

        for (FieldMappingRule rule : rules) {
            Object raw = record.valueAt(rule.getSourcePath());
            if (isBlank(raw)) {
                raw = rule.getDefaultValue();
            }
            if (isBlank(raw)) {
                continue;
            }
            final Object value = convert(rule.effectiveTransform(), raw, rule.getSourcePath());
            if (value != null) {
                assign(builder, rule.getTargetField(), value, rule.getSourcePath());
                populated.add(rule.getTargetField());
            }
        }

        for (CanonicalField field : CanonicalField.values()) {
            if (field.isRequired() && !populated.contains(field)) {
                throw new MappingException(sourcePathFor(rules, field),
                                           "Required field " + field + " is missing");
            }
        }
        if (!populated.contains(CanonicalField.STATUS)) {
            builder.status(PropertyStatus.ACTIVE);
        }
        return builder.build();
    }

    private static Object convert(final FieldTransform transform, final Object raw, final String path) {
        final String text = raw.toString().trim();
        return switch (transform) {
            case NONE, TEXT -> text.isEmpty() ? null : text;
            case UPPER_CASE -> text.isEmpty() ? null : text.toUpperCase(Locale.ROOT);
            case DECIMAL -> toDecimal(raw, path);
            case INTEGER -> toInteger(raw, path);
            case LISTING_STATUS -> PropertyStatus.normalize(text).orElseThrow(
                    () -> new MappingException(path, "Unknown listing status '" + text + "'"));
            case TIMESTAMP -> toInstant(text, path);
        };
    }

    private static BigDecimal toDecimal(final Object raw, final String path) {
        if (raw instanceof BigDecimal decimal) {
            return decimal;
        }
        if (raw instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        final String cleaned = raw.toString().replace("$", "").replace(",", "").replaceAll("\\s+", "");
        try {
            return new BigDecimal(cleaned);
        } catch (NumberFormatException e) {
            throw new MappingException(path, "Value '" + raw + "' is not numeric", e);
        }
    }

    private static Integer toInteger(final Object raw, final String path) {
        final BigDecimal decimal = toDecimal(raw, path);
        try {
            return decimal.stripTrailingZeros().intValueExact();
        } catch (ArithmeticException e) {
            throw new MappingException(path, "Value '" + raw + "' is not a whole number", e);
        }
    }

    private static Instant toInstant(final String text, final String path) {
        try {
            return SourceTimestamps.parse(text);
        } catch (DateTimeParseException e) {
            throw new MappingException(path, "Value '" + text + "' is not a timestamp", e);
        }
    }

    private static void assign(final CanonicalProperty.CanonicalPropertyBuilder builder, final CanonicalField field,
                               final Object value, final String path) {
        try {
            switch (field) {
                case EXTERNAL_ID -> builder.externalId(value.toString());
                case STATUS -> builder.status((PropertyStatus) value);
                case PRICE -> builder.price(nonNegative((BigDecimal) value, path));
                case ADDRESS_LINE -> builder.addressLine(value.toString());
                case CITY -> builder.city(value.toString());
                case STATE -> builder.state(value.toString());
                case POSTAL_CODE -> builder.postalCode(value.toString());
                case PROPERTY_TYPE -> builder.propertyType(value.toString());
                case BEDROOMS -> builder.bedrooms(nonNegative((Integer) value, path));
                case BATHROOMS -> builder.bathrooms(nonNegative((BigDecimal) value, path));
                case SQUARE_FEET -> builder.squareFeet(nonNegative((Integer) value, path));
                case LOT_SIZE -> builder.lotSize(nonNegative((BigDecimal) value, path));
                case YEAR_BUILT -> builder.yearBuilt((Integer) value);
                case LATITUDE -> builder.latitude((BigDecimal) value);
                case LONGITUDE -> builder.longitude((BigDecimal) value);
                case DESCRIPTION -> builder.description(value.toString());
                case AGENT_NAME -> builder.agentName(value.toString());
                case OFFICE_NAME -> builder.officeName(value.toString());
                case LISTED_AT -> builder.listedAt((Instant) value);
                case SOURCE_MODIFIED_AT -> builder.sourceModifiedAt((Instant) value);
            }
        } catch (ClassCastException e) {
            throw new MappingException(path, "Transform " + value.getClass().getSimpleName()
                                             + " does not fit canonical field " + field, e);
        }
    }

    private static BigDecimal nonNegative(final BigDecimal value, final String path) {
        if (value.signum() < 0) {
            throw new MappingException(path, "Value " + value.toPlainString() + " must not be negative");
        }
        return value;
    }

    private static Integer nonNegative(final Integer value, final String path) {
        if (value < 0) {
            throw new MappingException(path, "Value " + value + " must not be negative");
        }
        return value;
    }

    private static boolean isBlank(final Object value) {
        return value == null || value.toString().isBlank();
    }

    private static String sourcePathFor(final List<FieldMappingRule> rules, final CanonicalField field) {
        return rules.stream()
                    .filter(rule -> rule.getTargetField() == field)
                    .map(FieldMappingRule::getSourcePath)
                    .findFirst()
                    .orElse(field.name());
    }
}
