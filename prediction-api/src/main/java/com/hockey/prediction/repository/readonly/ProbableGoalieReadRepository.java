package com.hockey.prediction.repository.readonly;

import com.hockey.prediction.model.readonly.ProbableGoalieDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

/**
 * Read-only repository for probable starting goalies.
 */
@Repository
public interface ProbableGoalieReadRepository extends MongoRepository<ProbableGoalieDocument, String> {

    List<ProbableGoalieDocument> findByTeamAbbrevAndGameDate(String teamAbbrev, LocalDate gameDate);
}
