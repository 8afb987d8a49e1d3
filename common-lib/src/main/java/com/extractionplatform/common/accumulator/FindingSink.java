package com.extractionplatform.common.accumulator;

import com.extractionplatform.common.model.FindingDraft;
import com.extractionplatform.common.model.SectionName;

/**
 * A worker's only write path into the accumulator. Each sink appends to its own worker's
 * partition; nothing written here is visible to other workers until the partition is
 * committed at a barrier.
 */
public interface FindingSink {

    /**
     * Scores and appends a draft.
     *
     * @return false if the draft was rejected by validation or arrived after the
     *         partition was sealed
     */
    boolean emit(FindingDraft draft);

    /**
     * Records that {@code section} is legitimately empty, with a documented reason.
     *
     * @return false if the declaration was invalid or arrived after sealing
     */
    boolean declareAbsent(SectionName section, String reason);
}
