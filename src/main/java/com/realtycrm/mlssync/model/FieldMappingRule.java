package com.realtycrm.mlssync.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One row of a provider's declarative mapping table: where to read a value in the provider record,
 * which canonical field receives it, and how it is converted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Embeddable
public class FieldMappingRule {

    /**
     * Dotted path into the provider record, e.g. {@code Address.City}.
     */
    @Column(name = "source_path", nullable = false)
    private String sourcePath;

    @Enumerated(EnumType.STRING)
    @Column(name = "target_field", nullable = false)
    private CanonicalField targetField;

    @Enumerated(EnumType.STRING)
    @Column(name = "transform")
    private FieldTransform transform;

    /**
     * Raw value used when the source path is missing or blank; converted like a provider value.
     */
    @Column(name = "default_value")
    private String defaultValue;

    public static FieldMappingRule of(String sourcePath, CanonicalField targetField) {
        return new FieldMappingRule(sourcePath, targetField, FieldTransform.NONE, null);
    }

    public FieldTransform effectiveTransform() {
        return transform == null || transform == FieldTransform.NONE ? targetField.getNaturalTransform() : transform;
    }
}
