package com.extractionplatform.orchestrator.render;

import com.extractionplatform.orchestrator.run.RunReport;

/**
 * Turns a finalized run into a document for people or downstream tools. Implementations
 * only read the report; formatting is entirely theirs.
 */
public interface ReportRenderer {

    /** Media type of the rendered document, e.g. {@code application/json}. */
    String mediaType();

    String render(RunReport report);
}
