package com.vmcplatform.common.consensus;

import com.vmcplatform.common.model.CoderCode;

import java.util.function.Function;

/**
 * The seven per-utterance attributes raters code. Numeric fields also get a scoped average.
 */
public enum CodedField {
    TOTAL_SYLLABLES(true, CoderCode::totalSyllables),
    CANONICAL_SYLLABLES(true, CoderCode::canonicalSyllables),
    NON_CANONICAL_SYLLABLES(true, CoderCode::nonCanonicalSyllables),
    WORD_SYLLABLES(true, CoderCode::wordSyllables),
    WORDS(true, CoderCode::words),
    UTTERANCE_TYPE(false, CoderCode::utteranceType),
    ANNOTATION(false, CoderCode::annotation);

    private final boolean numeric;
    private final Function<CoderCode, ?> extractor;

    CodedField(boolean numeric, Function<CoderCode, ?> extractor) {
        this.numeric   = numeric;
        this.extractor = extractor;
    }

    public boolean numeric() {
        return numeric;
    }

    public Object valueOf(CoderCode code) {
        return extractor.apply(code);
    }
}
