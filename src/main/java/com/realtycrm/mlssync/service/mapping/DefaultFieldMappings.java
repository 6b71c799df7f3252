package com.realtycrm.mlssync.service.mapping;

import com.realtycrm.mlssync.model.CanonicalField;
import com.realtycrm.mlssync.model.FieldMappingRule;
import com.realtycrm.mlssync.model.ProviderType;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Mapping tables applied when a provider is created without explicit rules.
 */
public final class DefaultFieldMappings {

    private static final List<FieldMappingRule> RESO_DATA_DICTIONARY = List.of(
            FieldMappingRule.of("ListingKey", CanonicalField.EXTERNAL_ID),
            FieldMappingRule.of("StandardStatus", CanonicalField.STATUS),
            FieldMappingRule.of("ListPrice", CanonicalField.PRICE),
            FieldMappingRule.of("UnparsedAddress", CanonicalField.ADDRESS_LINE),
            FieldMappingRule.of("City", CanonicalField.CITY),
            FieldMappingRule.of("StateOrProvince", CanonicalField.STATE),
            FieldMappingRule.of("PostalCode", CanonicalField.POSTAL_CODE),
            FieldMappingRule.of("PropertyType", CanonicalField.PROPERTY_TYPE),
            FieldMappingRule.of("BedroomsTotal", CanonicalField.BEDROOMS),
            FieldMappingRule.of("BathroomsTotalInteger", CanonicalField.BATHROOMS),
            FieldMappingRule.of("LivingArea", CanonicalField.SQUARE_FEET),
            FieldMappingRule.of("LotSizeSquareFeet", CanonicalField.LOT_SIZE),
            FieldMappingRule.of("YearBuilt", CanonicalField.YEAR_BUILT),
            FieldMappingRule.of("Latitude", CanonicalField.LATITUDE),
            FieldMappingRule.of("Longitude", CanonicalField.LONGITUDE),
            FieldMappingRule.of("PublicRemarks", CanonicalField.DESCRIPTION),
            FieldMappingRule.of("ListAgentFullName", CanonicalField.AGENT_NAME),
            FieldMappingRule.of("ListOfficeName", CanonicalField.OFFICE_NAME),
            FieldMappingRule.of("ListingContractDate", CanonicalField.LISTED_AT),
            FieldMappingRule.of("ModificationTimestamp", CanonicalField.SOURCE_MODIFIED_AT));

    private DefaultFieldMappings() {
    }

    /**
     * RESO Data Dictionary field names are shared by RESO Web API providers and by fixtures, which use the
     * same payload shape.
     */
    public static List<FieldMappingRule> forType(ProviderType providerType) {
        return RESO_DATA_DICTIONARY.stream()
                                   .map(rule -> FieldMappingRule.builder()
                                                                .sourcePath(rule.getSourcePath())
                                                                .targetField(rule.getTargetField())
                                                                .transform(rule.getTransform())
                                                                .defaultValue(rule.getDefaultValue())
                                                                .build())
                                   .collect(Collectors.toCollection(ArrayList::new));
    }
}
