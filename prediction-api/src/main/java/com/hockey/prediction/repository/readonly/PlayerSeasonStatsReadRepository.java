package com.hockey.prediction.repository.readonly;

import com.hockey.prediction.model.readonly.PlayerSeasonStatsDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Read-only repository for player season aggregates.
 */
@Repository
public interface PlayerSeasonStatsReadRepository extends MongoRepository<PlayerSeasonStatsDocument, String> {

    Optional<PlayerSeasonStatsDocument> findFirstByPlayerIdAndSeason(Long playerId, String season);

    List<PlayerSeasonStatsDocument> findBySeasonAndTeamAbbrev(String season, String teamAbbrev);
}
