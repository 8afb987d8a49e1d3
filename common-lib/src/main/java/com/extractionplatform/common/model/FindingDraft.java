package com.extractionplatform.common.model;

import java.util.List;

/**
 * A worker's unscored claim. Scores are never supplied by the worker; they are computed
 * from the evidence when the draft is turned into a {@link Finding}.
 */
public record FindingDraft(
    SectionName    section,
    String         key,
    String         value,
    FindingType    findingType,
    List<Evidence> evidence,
    boolean        declaredUnknown
) {

    public FindingDraft {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        findingType = findingType == null ? FindingType.GENERIC : findingType;
    }

    public static FindingDraft of(SectionName section, String key, String value,
                                  FindingType type, List<Evidence> evidence) {
        return new FindingDraft(section, key, value, type, evidence, false);
    }

    /**
     * A claim the worker could not support with any evidence. Allowed to carry an empty
     * evidence set; always classified {@link CertaintyClass#UNKNOWN}.
     */
    public static FindingDraft unknown(SectionName section, String key, String value, FindingType type) {
        return new FindingDraft(section, key, value, type, List.of(), true);
    }
}
