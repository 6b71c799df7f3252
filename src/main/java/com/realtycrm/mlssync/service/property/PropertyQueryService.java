package com.realtycrm.mlssync.service.property;

import com.realtycrm.mlssync.dto.property.PropertyChangeEventView;
import com.realtycrm.mlssync.dto.property.PropertyMediaView;
import com.realtycrm.mlssync.dto.property.PropertySearchCriteria;
import com.realtycrm.mlssync.dto.property.PropertyView;
import com.realtycrm.mlssync.exception.ResourceNotFoundException;
import com.realtycrm.mlssync.repository.PropertyChangeEventRepository;
import com.realtycrm.mlssync.repository.PropertyMediaRepository;
import com.realtycrm.mlssync.repository.PropertyRepository;
import com.realtycrm.mlssync.repository.spec.PropertySpecifications;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Read-only access to the canonical property table.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class PropertyQueryService {

    private final PropertyRepository propertyRepository;
    private final PropertyMediaRepository mediaRepository;
    private final PropertyChangeEventRepository changeEventRepository;

    public Page<PropertyView> search(final PropertySearchCriteria criteria, final int page, final int size) {
        final PageRequest pageable = PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "updatedAt")
                                                                    .and(Sort.by("id")));
        return propertyRepository.findAll(PropertySpecifications.matching(criteria), pageable).map(PropertyView::from);
    }

    public PropertyView get(final Long propertyId) {
        return propertyRepository.findById(propertyId)
                                 .map(PropertyView::from)
                                 .orElseThrow(() -> notFound(propertyId));
    }

    public List<PropertyMediaView> getMedia(final Long propertyId) {
        requireExists(propertyId);
        return mediaRepository.findByPropertyIdOrderByDisplayOrderAsc(propertyId)
                              .stream()
                              .map(PropertyMediaView::from)
                              .toList();
    }

    public List<PropertyChangeEventView> getTimeline(final Long propertyId) {
        requireExists(propertyId);
        return changeEventRepository.findByPropertyIdOrderByOccurredAtAscIdAsc(propertyId)
                                    .stream()
                                    .map(PropertyChangeEventView::from)
                                    .toList();
    }

    private void requireExists(final Long propertyId) {
        if (!propertyRepository.existsById(propertyId)) {
            throw notFound(propertyId);
        }
    }

    private static ResourceNotFoundException notFound(final Long propertyId) {
        return new ResourceNotFoundException("Property " + propertyId + " not found");
    }
}
