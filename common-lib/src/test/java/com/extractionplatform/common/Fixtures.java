package com.extractionplatform.common;

import com.extractionplatform.common.model.Evidence;
import com.extractionplatform.common.model.Finding;
import com.extractionplatform.common.model.FindingDraft;
import com.extractionplatform.common.model.FindingType;
import com.extractionplatform.common.model.SectionName;
import com.extractionplatform.common.synthesis.SynthesisComponents;
import com.extractionplatform.common.config.SynthesisConfig;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Shared builders for synthesis tests. Fixed clock, default tables.
 */
public final class Fixtures {

    public static final Instant T0 = Instant.parse("2026-01-15T10:00:00Z");
    public static final Clock CLOCK = Clock.fixed(T0, ZoneOffset.UTC);
    public static final SynthesisComponents COMPONENTS =
        SynthesisComponents.create(SynthesisConfig.defaults(), CLOCK);

    private Fixtures() {}

    public static Evidence ev(String kind, double weight, String locator) {
        return Evidence.of(kind, weight, locator, "", T0);
    }

    public static Evidence ev(String kind, double weight, String locator, String snippet) {
        return Evidence.of(kind, weight, locator, snippet, T0);
    }

    public static Finding finding(String workerId, SectionName section, String key, String value,
                                  FindingType type, Evidence... evidence) {
        return COMPONENTS.findingFactory().create(workerId,
            FindingDraft.of(section, key, value, type, List.of(evidence)));
    }

    public static Finding generic(String workerId, SectionName section, String key, String value,
                                  Evidence... evidence) {
        return finding(workerId, section, key, value, FindingType.GENERIC, evidence);
    }
}
