package com.example.mimimi.Repository;

import com.example.mimimi.Entity.Player;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface PlayerRepository extends JpaRepository<Player, Long> {

    Optional<Player> findByGameIdAndUserId(Long gameId, String userId);

    List<Player> findByGameIdOrderByCreatedAtAsc(Long gameId);

    long countByGameId(Long gameId);

    // 점수 높은 순, 동점이면 먼저 들어온 순
    List<Player> findByGameIdOrderByPointsDescCreatedAtAsc(Long gameId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from Player p where p.gameId = :gameId")
    int deleteAllByGameId(@Param("gameId") Long gameId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Player p set p.points = p.points + :points where p.id = :playerId")
    int addPoints(@Param("playerId") Long playerId, @Param("points") int points);
}
