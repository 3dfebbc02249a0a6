package org.holdem.repo;

import org.holdem.model.poker.PokerTableEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PokerTableRepository extends JpaRepository<PokerTableEntity, Long> {
}
