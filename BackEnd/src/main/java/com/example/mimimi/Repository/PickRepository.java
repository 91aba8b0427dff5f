package com.example.mimimi.Repository;

import com.example.mimimi.Entity.Pick;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface PickRepository extends JpaRepository<Pick, Long> {

    long countByRoundId(Long roundId);

    boolean existsByRoundIdAndPlayerId(Long roundId, Long playerId);

    List<Pick> findByRoundIdOrderByCreatedAtAsc(Long roundId);
}
