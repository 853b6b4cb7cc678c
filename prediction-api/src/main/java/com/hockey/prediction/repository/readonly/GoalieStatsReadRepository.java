package com.hockey.prediction.repository.readonly;

import com.hockey.prediction.model.readonly.GoalieStatsDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Read-only repository for goalie season lines.
 */
@Repository
public interface GoalieStatsReadRepository extends MongoRepository<GoalieStatsDocument, String> {

    Optional<GoalieStatsDocument> findFirstByPlayerIdAndSeason(Long playerId, String season);

    List<GoalieStatsDocument> findBySeasonAndGamesStartedGreaterThan(String season, int minStarts);
}
