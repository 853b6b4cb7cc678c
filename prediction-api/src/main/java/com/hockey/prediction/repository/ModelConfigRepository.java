package com.hockey.prediction.repository;

import com.hockey.prediction.model.ModelConfigDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Read/write repository for stored scoring models.
 */
@Repository
public interface ModelConfigRepository extends MongoRepository<ModelConfigDocument, String> {

    Optional<ModelConfigDocument> findByModelId(String modelId);

    List<ModelConfigDocument> findByActiveTrue();

    Optional<ModelConfigDocument> findFirstByActiveTrue();

    List<ModelConfigDocument> findAllByOrderByModelIdAsc();
}
