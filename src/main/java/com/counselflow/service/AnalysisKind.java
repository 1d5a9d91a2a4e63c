package com.counselflow.service;

import java.util.Arrays;

/**
 * Analysis prompts. Each asks for a JSON object so answers can be aggregated.
 */
public enum AnalysisKind {

    RISK_ASSESSMENT("""
            Analyze the following contract for legal risks and provide a structured assessment.

            Contract Text:
            %s

            Provide:
            1. Risk Score (1-10, where 10 is highest risk)
            2. Key Risk Areas (list of specific concerns)
            3. Recommendations (actionable suggestions)
            4. Critical Clauses (problematic sections)
            5. Missing Provisions (standard clauses that should be added)

            Format your response as JSON with these exact keys:
            risk_score, risk_areas, recommendations, critical_clauses, missing_provisions
            """),

    CLAUSE_EXTRACTION("""
            Extract and categorize key clauses from this contract.

            Contract Text:
            %s

            Identify and extract:
            1. Payment Terms
            2. Termination Clauses
            3. Liability Limitations
            4. Intellectual Property Clauses
            5. Confidentiality Provisions
            6. Governing Law

            Format as JSON with the clause type in snake_case as keys and the extracted text as values.
            """),

    COMPLIANCE_CHECK("""
            Review this contract for compliance with common legal standards.

            Contract Text:
            %s

            Check for compliance with:
            1. GDPR (if applicable)
            2. Industry-specific regulations
            3. Standard legal requirements
            4. Best practices

            Format your response as JSON with these keys:
            compliance_score (1-10), issues (list), regulations_checked (list), recommendations (list)
            """),

    LEGAL_STRATEGY("""
            Assess the following matter and propose a litigation strategy.

            Matter Summary:
            %s

            Format your response as JSON with these keys:
            success_probability (0-100), strengths (list), weaknesses (list),
            recommended_actions (list), estimated_duration_months, summary
            """),

    LEGAL_RESEARCH("""
            Research the following legal question.

            Question:
            %s

            Format your response as JSON with these keys:
            summary, key_authorities (list), relevant_principles (list), open_issues (list), confidence (0-100)
            """),

    DOCUMENT_REVIEW("""
            Review the following legal document for quality, consistency and enforceability.

            Document:
            %s

            Format your response as JSON with these keys:
            quality_score (1-10), issues (list), suggested_edits (list), summary
            """);

    private final String template;

    AnalysisKind(String template) {
        this.template = template;
    }

    public String code() {
        return name().toLowerCase();
    }

    public String prompt(String content) {
        return template.formatted(content);
    }

    public static AnalysisKind fromCode(String code) {
        return Arrays.stream(values())
                .filter(kind -> kind.code().equalsIgnoreCase(code) || kind.name().equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown analysis kind: " + code));
    }
}
