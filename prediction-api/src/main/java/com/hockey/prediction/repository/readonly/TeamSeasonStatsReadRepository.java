package com.hockey.prediction.repository.readonly;

import com.hockey.prediction.model.readonly.TeamSeasonStatsDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Read-only repository for team season aggregates.
 */
@Repository
public interface TeamSeasonStatsReadRepository extends MongoRepository<TeamSeasonStatsDocument, String> {

    Optional<TeamSeasonStatsDocument> findFirstByTeamAbbrevAndSeason(String teamAbbrev, String season);
}
