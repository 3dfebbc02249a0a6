package org.holdem.repo;

import org.holdem.model.HandHistoryEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface HandHistoryRepository extends JpaRepository<HandHistoryEntity, Long> {
    List<HandHistoryEntity> findByTableIdOrderByHandNumberDesc(Long tableId, Pageable page);
}
