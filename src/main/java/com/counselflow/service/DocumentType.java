package com.counselflow.service;

/**
 * Legal document templates.
 */
public enum DocumentType {

    NDA("Non-Disclosure Agreement", """
            Include standard NDA clauses:
            - Definition of confidential information
            - Obligations of receiving party
            - Permitted disclosures
            - Term and termination
            - Remedies for breach
            """),

    SERVICE_AGREEMENT("Service Agreement", """
            Include:
            - Scope of services
            - Payment terms
            - Deliverables and timelines
            - Intellectual property rights
            - Limitation of liability
            - Termination provisions
            """),

    PRIVACY_POLICY("Privacy Policy", """
            Ensure compliance with:
            - GDPR requirements
            - CCPA requirements
            - General privacy best practices

            Include all necessary sections for data collection, use, and protection.
            """),

    EMPLOYMENT_AGREEMENT("Employment Agreement", """
            Include:
            - Position, duties and reporting line
            - Compensation and benefits
            - Working hours and leave
            - Confidentiality and IP assignment
            - Restrictive covenants where lawful
            - Termination and notice
            """),

    LICENSE_AGREEMENT("License Agreement", """
            Include:
            - Grant of license and its scope
            - Restrictions on use
            - Fees and royalties
            - Warranties and disclaimers
            - Term, termination and effect of termination
            """),

    PARTNERSHIP_AGREEMENT("Partnership Agreement", """
            Include:
            - Capital contributions
            - Profit and loss allocation
            - Management and voting
            - Admission and withdrawal of partners
            - Dispute resolution
            - Dissolution
            """);

    private final String title;
    private final String requirements;

    DocumentType(String title, String requirements) {
        this.title = title;
        this.requirements = requirements;
    }

    public String code() {
        return name().toLowerCase();
    }

    public String prompt(String parametersJson) {
        return "Generate a " + title + " with the following parameters:\n"
                + parametersJson + "\n\n"
                + requirements + "\n"
                + "Make it legally sound and professionally formatted.";
    }
}
