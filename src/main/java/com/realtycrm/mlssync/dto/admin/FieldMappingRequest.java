package com.realtycrm.mlssync.dto.admin;

import com.realtycrm.mlssync.model.CanonicalField;
import com.realtycrm.mlssync.model.FieldMappingRule;
import com.realtycrm.mlssync.model.FieldTransform;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record FieldMappingRequest(
        @NotBlank(message = "The 'sourcePath' cannot be empty.") String sourcePath,
        @NotNull(message = "The 'targetField' is required.") CanonicalField targetField,
        FieldTransform transform,
        String defaultValue
) {

    public FieldMappingRule toRule() {
        return new FieldMappingRule(sourcePath.trim(), targetField,
                                    transform == null ? FieldTransform.NONE : transform, defaultValue);
    }
}
