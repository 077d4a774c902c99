package com.vmcplatform.report.model;

import com.vmcplatform.common.model.CoderCode;
import com.vmcplatform.common.model.CodingEvent;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Read projection of one accepted coding with the coder's display name and the annotation's
 * parent category resolved.
 */
@Data
@NoArgsConstructor
@Table("utterance_coding")
public class CoderCodeRow {

    @Id
    private Long codingId;

    private Long utteranceId;

    private String coder;

    private int totalSyllableCount;

    private int canonicalSyllableCount;

    private int nonCanonicalSyllableCount;

    private int wordSyllableCount;

    private int wordCount;

    private String utteranceType;

    private String annotation;

    private LocalDateTime codedAt;

    public CoderCode toCode() {
        return new CoderCode(utteranceId, coder, totalSyllableCount, canonicalSyllableCount,
                             nonCanonicalSyllableCount, wordSyllableCount, wordCount,
                             utteranceType, annotation);
    }

    public CodingEvent toEvent() {
        return new CodingEvent(coder, utteranceId, codedAt);
    }
}
