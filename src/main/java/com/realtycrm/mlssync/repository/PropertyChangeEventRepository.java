package com.realtycrm.mlssync.repository;

import com.realtycrm.mlssync.model.PropertyChangeEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PropertyChangeEventRepository extends JpaRepository<PropertyChangeEvent, Long> {

    List<PropertyChangeEvent> findByPropertyIdOrderByOccurredAtAscIdAsc(Long propertyId);
}
