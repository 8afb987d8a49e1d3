package com.extractionplatform.orchestrator.run;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param corpusReference path of the directory to analyse
 */
public record RunRequest(@JsonProperty("corpusReference") String corpusReference) {}
