package com.boundgen.domain.generation.service;

import com.boundgen.domain.clarification.model.MergedClarifications;
import com.boundgen.domain.document.model.GeneratedDocument;
import com.boundgen.domain.generation.model.JudgeVerdict;

/**
 * External judge checking a reconciled document against caller-supplied policy text.
 * Implementations throw {@code JudgeUnavailableException} when the judge cannot be reached.
 */
public interface SemanticQaJudge {

    JudgeVerdict judge(MergedClarifications clarifications, GeneratedDocument document, String policyText);
}
