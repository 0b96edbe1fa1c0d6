package com.al.radiologyfiller.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;

/**
 * Last issued accession sequence value for one date key. A new date key starts a new document, which
 * is what resets the sequence.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "accession_sequences")
public class SequenceCounter {

    @Id
    private String id;

    private String dateKey;
    private long value;
    private LocalDateTime updatedAt;
}
