package com.example.mimimi.Repository;

import com.example.mimimi.Entity.GameInvite;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Optional;

public interface GameInviteRepository extends JpaRepository<GameInvite, Long> {

    boolean existsByShortCode(String shortCode);

    Optional<GameInvite> findByShortCode(String shortCode);

    // 아직 유효한 초대 중 가장 최근 것
    Optional<GameInvite> findFirstByGameIdAndExpiresAtAfterOrderByCreatedAtDesc(Long gameId, LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from GameInvite i where i.gameId = :gameId")
    int deleteAllByGameId(@Param("gameId") Long gameId);
}
