package com.hockey.prediction.repository.readonly;

import com.hockey.prediction.model.readonly.GameDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

/**
 * Read-only repository for the game schedule.
 */
@Repository
public interface GameReadRepository extends MongoRepository<GameDocument, String> {

    List<GameDocument> findByGameDateOrderByGameIdAsc(LocalDate gameDate);
}
