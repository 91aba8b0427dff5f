package com.example.mimimi.Repository;

import com.example.mimimi.Domain.RoundState;
import com.example.mimimi.Entity.Round;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface RoundRepository extends JpaRepository<Round, Long> {

    List<Round> findAllByGameIdOrderByPositionAsc(Long gameId);

    // 진행 중이거나 대기 중인 라운드 중 가장 앞 라운드
    Optional<Round> findFirstByGameIdAndStateInOrderByPositionAsc(Long gameId, List<RoundState> states);

    Optional<Round> findFirstByGameIdAndStateOrderByPositionAsc(Long gameId, RoundState state);

    Optional<Round> findByGameIdAndState(Long gameId, RoundState state);

    @Query("select r.wordId from Round r where r.gameId = :gameId")
    List<Long> findWordIdsByGameId(@Param("gameId") Long gameId);

    /*
        라운드 상태 전이 (expected 상태일 때만). 타임아웃과 전원 선택이 동시에 와도 한쪽만 성공한다
    */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
    update Round r
    set r.state = :next
    where r.id = :roundId
      and r.state = :expected
""")
    int transitionState(
            @Param("roundId") Long roundId,
            @Param("expected") RoundState expected,
            @Param("next") RoundState next
    );
}
