package com.example.zenflow.repo;

import com.example.zenflow.model.PracticeSession;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;

import java.time.Instant;
import java.util.List;

public interface PracticeSessionRepo extends MongoRepository<PracticeSession, String> {
    List<PracticeSession> findAllByOrderByTimestampAsc();
    List<PracticeSession> findAllByOrderByTimestampDesc();

    /**
     * {@code from <= timestamp <= to}, newest first.
     */
    @Query(value = "{ 'timestamp': { $gte: ?0, $lte: ?1 } }", sort = "{ 'timestamp': -1 }")
    List<PracticeSession> findInRange(Instant from, Instant to);

    /**
     * {@code from <= timestamp < until}, newest first.
     */
    @Query(value = "{ 'timestamp': { $gte: ?0, $lt: ?1 } }", sort = "{ 'timestamp': -1 }")
    List<PracticeSession> findFromUntil(Instant from, Instant until);
}
