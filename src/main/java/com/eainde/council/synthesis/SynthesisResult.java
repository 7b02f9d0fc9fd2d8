package com.eainde.council.synthesis;

import java.io.Serializable;

/**
 * @param fallback true when the text was produced from the template because the model call failed
 */
public record SynthesisResult(String synthesis, String applicantFeedback, boolean fallback) implements Serializable {}
