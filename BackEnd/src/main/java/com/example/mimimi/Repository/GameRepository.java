package com.example.mimimi.Repository;

import com.example.mimimi.Domain.GameStatus;
import com.example.mimimi.Entity.Game;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

public interface GameRepository extends JpaRepository<Game, Long> {

    long countByStateIn(Collection<GameStatus> states);

    // 로비 타임아웃 대상 (대기 상태로 너무 오래 남은 방)
    List<Game> findAllByStateAndCreatedAtLessThanEqual(GameStatus state, LocalDateTime threshold);

    /*
        상태 전이 (expected 상태일 때만 반영). 반환값 0 이면 다른 쪽이 먼저 바꾼 것
    */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
    update Game g
    set g.state = :next,
        g.updatedAt = :now
    where g.id = :gameId
      and g.state = :expected
""")
    int transitionState(
            @Param("gameId") Long gameId,
            @Param("expected") GameStatus expected,
            @Param("next") GameStatus next,
            @Param("now") LocalDateTime now
    );

    /*
        종료 전이. from 상태 중 하나일 때만 반영되므로 호스트 이탈 / 수동 종료 / 마지막 라운드가 겹쳐도 한쪽만 이긴다
    */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
    update Game g
    set g.state = :next,
        g.updatedAt = :now
    where g.id = :gameId
      and g.state in :from
""")
    int transitionStateFrom(
            @Param("gameId") Long gameId,
            @Param("from") Collection<GameStatus> from,
            @Param("next") GameStatus next,
            @Param("now") LocalDateTime now
    );

    // 대기 중인 게임만 삭제 (호스트 취소)
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
    delete from Game g
    where g.id = :gameId
      and g.state = com.example.mimimi.Domain.GameStatus.WAITING_FOR_PLAYERS
""")
    int deleteIfWaiting(@Param("gameId") Long gameId);

    // 대기 -> 진행. 시작 시각도 같이 기록
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
    update Game g
    set g.state = com.example.mimimi.Domain.GameStatus.GAME_RUNNING,
        g.startedAt = :now,
        g.updatedAt = :now
    where g.id = :gameId
      and g.state = com.example.mimimi.Domain.GameStatus.WAITING_FOR_PLAYERS
""")
    int markStarted(@Param("gameId") Long gameId, @Param("now") LocalDateTime now);
}
