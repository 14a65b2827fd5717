package com.wordlegame.service.repository;

import com.wordlegame.service.entity.DailyResult;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DailyResultRepository extends JpaRepository<DailyResult, Long> {

    boolean existsByUserIdAndDate(String userId, String date);

    List<DailyResult> findTop20ByDateOrderByElapsedMsAscGuessesAscCreatedAtAsc(String date);
}
