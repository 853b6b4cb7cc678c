package com.hockey.prediction.repository.readonly;

import com.hockey.prediction.model.readonly.GameLogDocument;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Read-only repository for per-game player lines.
 * All lookups are point-in-time: only games strictly before the given date.
 */
@Repository
public interface GameLogReadRepository extends MongoRepository<GameLogDocument, String> {

    List<GameLogDocument> findByPlayerIdAndGameDateBeforeOrderByGameDateDescGameIdDesc(
            Long playerId, LocalDate beforeDate, Pageable pageable);

    @Query("{ 'playerId': ?0, 'season': ?1, 'gameDate': { $lt: ?2 } }")
    List<GameLogDocument> findSeasonGames(Long playerId, String season, LocalDate beforeDate);

    @Query("{ 'playerId': ?0, 'opponent': ?1, 'gameDate': { $lt: ?2 } }")
    List<GameLogDocument> findHeadToHead(Long playerId, String opponent, LocalDate beforeDate);

    Optional<GameLogDocument> findFirstByPlayerIdAndSeasonOrderByGameDateDescGameIdDesc(Long playerId, String season);

    @Query(value = "{ 'season': ?0, 'teamAbbrev': ?1 }", fields = "{ 'playerId': 1, 'playerName': 1, 'teamAbbrev': 1 }")
    List<GameLogDocument> findPlayersBySeasonAndTeam(String season, String teamAbbrev);
}
