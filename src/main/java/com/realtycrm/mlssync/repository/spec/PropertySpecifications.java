package com.realtycrm.mlssync.repository.spec;

import com.realtycrm.mlssync.dto.property.PropertySearchCriteria;
import com.realtycrm.mlssync.model.Property;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the JPA criteria for the property read API.
 */
public final class PropertySpecifications {

    private PropertySpecifications() {
    }

    public static Specification<Property> matching(final PropertySearchCriteria criteria) {
        return (root, query, cb) -> {
            final List<Predicate> predicates = new ArrayList<>();

            if (StringUtils.hasText(criteria.providerId())) {
                predicates.add(cb.equal(root.get("providerId"), criteria.providerId()));
            }
            if (criteria.status() != null) {
                predicates.add(cb.equal(root.get("status"), criteria.status()));
            }
            if (StringUtils.hasText(criteria.city())) {
                predicates.add(cb.equal(cb.lower(root.get("city")), criteria.city().trim().toLowerCase(Locale.ROOT)));
            }
            if (StringUtils.hasText(criteria.state())) {
                predicates.add(cb.equal(root.get("state"), criteria.state().trim().toUpperCase(Locale.ROOT)));
            }
            if (StringUtils.hasText(criteria.postalCode())) {
                predicates.add(cb.equal(root.get("postalCode"), criteria.postalCode().trim()));
            }
            if (criteria.minPrice() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("price"), criteria.minPrice()));
            }
            if (criteria.maxPrice() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.get("price"), criteria.maxPrice()));
            }
            if (criteria.minBedrooms() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("bedrooms"), criteria.minBedrooms()));
            }
            if (StringUtils.hasText(criteria.query())) {
                final String pattern = "%" + criteria.query().trim().toLowerCase(Locale.ROOT) + "%";
                predicates.add(cb.or(
                        cb.like(cb.lower(root.get("addressLine")), pattern),
                        cb.like(cb.lower(root.get("city")), pattern),
                        cb.like(cb.lower(root.get("externalListingId")), pattern),
                        cb.like(cb.lower(root.get("description")), pattern)));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
