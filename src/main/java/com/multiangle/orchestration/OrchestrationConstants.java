package com.multiangle.orchestration;

public final class OrchestrationConstants {

    private OrchestrationConstants() {
        // Private constructor to prevent instantiation
    }

    // LLM Request Purposes
    public static final String PURPOSE_ANGLES = "angle-generation";
    public static final String PURPOSE_CONTRADICTIONS = "contradiction-analysis";
    public static final String PURPOSE_SYNTHESIS = "synthesis";

    // Branch error codes
    public static final String ERROR_CREATE_CONVERSATION_FAILED = "create_conversation_failed";
    public static final String ERROR_NO_MESSAGE_ID = "no_message_id";
    public static final String ERROR_MESSAGE_FAILED = "message_failed";
    public static final String ERROR_NO_VALID_RESPONSES = "no_valid_responses";

    // Degraded-result prefixes
    public static final String CONTRADICTION_ERROR_PREFIX = "Error analyzing contradictions: ";
    public static final String SYNTHESIS_ERROR_PREFIX = "Failed to synthesize report: ";
    public static final String BRANCH_EXCEPTION_MESSAGE = "Exception processing angle '%s': %s";

    public static final String DEFAULT_FEEDBACK = "success";

    public static final String ANGLE_GENERATION_PROMPT = """
            Given the following query: "%s"

            Generate 3-5 different analytical angles or perspectives to approach this query.
            Each angle should be a specific, focused question that would provide valuable insights.

            Return only the questions, one per line, without numbering or bullet points.
            """;

    public static final String CONTRADICTION_PROMPT = """
            Analyze the following responses for contradictions or conflicting information:

            %s

            Identify any contradictions or conflicting information between these responses.
            Return only a JSON object with:
            - "has_contradictions": boolean
            - "contradictions": list of contradiction descriptions
            - "confidence": confidence level (0-1)
            """;

    public static final String SYNTHESIS_PROMPT = """
            Original Query: "%s"

            Based on the following multi-angle analysis, create a comprehensive, structured report:

            %s

            Create a structured report with:
            1. Executive Summary
            2. Key Findings (organized by theme)
            3. Detailed Analysis
            4. Contradictions or Inconsistencies (if any)
            5. Recommendations or Next Steps
            6. Confidence Assessment

            Make the report comprehensive yet concise, and ensure it directly addresses the original query.
            """;

    public static final String CONTRADICTION_CONTEXT_NOTE = """

            Automated contradiction check: %s
            """;
}
