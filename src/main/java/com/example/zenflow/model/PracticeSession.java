package com.example.zenflow.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One completed practice interval. Appended once, never updated.
 */
@Value
@Builder
@Jacksonized
@Document("sessions")
public class PracticeSession {
    @Id
    @With
    String id;
    Instant timestamp;
    int durationMinutes;
}
