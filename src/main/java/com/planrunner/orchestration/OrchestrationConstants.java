package com.planrunner.orchestration;

public final class OrchestrationConstants {

    private OrchestrationConstants() {
    }

    public static final String NONE = "None.";
    public static final String STEP_FAILED_SUMMARY = "Tool execution failed";
    public static final String EXECUTION_CANCELLED = "Execution cancelled";
    public static final String ITERATION_LIMIT_REACHED = "Planning iteration limit reached";
    public static final String UNEXPECTED_FAILURE = "Unexpected failure while driving the plan";
    public static final String QUESTION_PREFIX = "Question: ";
    public static final String ANSWER_PREFIX = "Answer: ";
    public static final int PROGRESS_RECENT_STEPS = 3;
    public static final int STEP_CONTEXT_RECENT_STEPS = 5;
    public static final int KNOWLEDGE_SEARCH_DEFAULT_LIMIT = 5;
    public static final int STEP_OUTPUT_PREVIEW = 1200;

    public static final String INVALID_JSON_RETRY_PROMPT = """

            Your previous response was not valid JSON for the requested schema.
            Return only a single JSON object that matches the schema exactly. Do not add prose or code fences.
            """;

    // System prompts
    public static final String TASK_INTAKE_SYSTEM_PROMPT = """
            You are the intake agent. Detect the language of the user's instruction and restate it in clear English.
            List the open questions the final answer must cover, and propose short knowledge base queries
            that could surface relevant prior information. Queries are optional; return an empty list when none help.
            Return only JSON that matches: {"originalLanguage": "ISO 639-1 code", "englishText": "...", "questionChecklist": ["..."], "initialKnowledgeQueries": ["..."]}.
            """;

    public static final String PLANNER_SYSTEM_PROMPT = """
            You are the Planner agent. Decide what still has to happen to fully satisfy the user's request.
            Describe each needed outcome as one short requirement. Do not name tools and do not write tool parameters.
            Use the plan context: never repeat a requirement that a completed step already satisfied.
            When a step failed, either describe a different way to reach the same outcome or move on.
            Return at most %d requirements, in execution order.
            If the request is fully answered by the completed steps, return an empty requirements list.
            Return only JSON that matches: {"requirements": ["requirement 1", "requirement 2"]}.
            """;

    public static final String TOOL_REASONING_SYSTEM_PROMPT = """
            You are the tool reasoning agent. Map every requirement to exactly one tool from the tool catalog.
            Return exactly one selection per requirement, in the same order as the requirements.
            Use only tool names that appear in the catalog, spelled exactly as listed.
            Fill parameters following the catalog example for the chosen tool.
            Keep reasoning to one sentence.
            Return only JSON that matches: {"selections": [{"toolName": "TOOL_NAME", "reasoning": "...", "parameters": {"key": "value"}}]}.
            """;

    public static final String CONTEXT_COMPACTION_SYSTEM_PROMPT = """
            You are the context compaction agent. The plan history has grown too large for the model context.
            Pick ranges of consecutive finished steps (status DONE or FAILED) that can be replaced by a short summary
            without losing facts the final answer depends on. Never include PENDING or RUNNING steps in a range.
            Keep concrete values, file names, URLs and errors in the summaries.
            Step numbers are the zero-based order values shown in the step list.
            Return only JSON that matches: {"compactionRanges": [{"fromStep": 0, "toStep": 2, "summary": "..."}]}.
            """;

    public static final String FINALIZER_SYSTEM_PROMPT = """
            You are the answer agent. Write the final answer to the user's request from the executed steps.
            Base every claim on the completed step outputs. If some steps failed or the plan could not finish,
            say what could not be done and why, in plain words, and give the best answer the available results allow.
            Cover each item of the question checklist.
            Do not repeat the question and do not prefix the answer with a label.
            Return only JSON that matches: {"answer": "..."}.
            """;

    public static final String ANALYSIS_SYSTEM_PROMPT = """
            You are the analysis agent. Reason about the question using only the supplied context.
            State the conclusion first, then the findings that support it. Say plainly when the context is insufficient.
            Return only JSON that matches: {"conclusion": "...", "keyFindings": ["..."]}.
            """;

    public static final String OUTPUT_LANGUAGE_INSTRUCTION = "\nWrite the answer in the language with ISO 639-1 code '%s'.\n";

    // User templates
    public static final String TASK_INTAKE_USER_TEMPLATE = """
            User instruction:
            {instruction}

            Client:
            {clientDescription}

            Project:
            {projectDescription}
            """;

    public static final String PLANNER_USER_TEMPLATE = """
            User request:
            {userRequest}

            Client:
            {clientDescription}

            Project:
            {projectDescription}

            Question checklist:
            {questionChecklist}

            Plan context:
            {planContext}
            """;

    public static final String TOOL_REASONING_USER_TEMPLATE = """
            User request:
            {userRequest}

            Requirements:
            {requirements}

            Tool catalog:
            {toolCatalog}

            Progress:
            {progress}
            """;

    public static final String CONTEXT_COMPACTION_USER_TEMPLATE = """
            User request:
            {userRequest}

            Estimated context tokens:
            {estimatedTokens} of {maxTokens}

            Steps ({stepCount}):
            {steps}
            """;

    public static final String FINALIZER_USER_TEMPLATE = """
            Original request:
            {originalInstruction}

            Request in English:
            {normalizedInstruction}

            Client:
            {clientDescription}

            Project:
            {projectDescription}

            Question checklist:
            {questionChecklist}

            Plan status:
            {planStatus}

            Completed steps:
            {completedSteps}

            Failed steps:
            {failedSteps}
            """;

    public static final String ANALYSIS_USER_TEMPLATE = """
            Question:
            {question}

            Focus:
            {focus}

            Overall request:
            {userRequest}

            Context from completed steps:
            {context}
            """;
}
