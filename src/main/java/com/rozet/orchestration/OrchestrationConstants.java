package com.rozet.orchestration;

import java.util.List;

public final class OrchestrationConstants {

    private OrchestrationConstants() {
        // Private constructor to prevent instantiation
    }

    // LLM request purposes
    public static final String PURPOSE_PLAN = "plan";
    public static final String PURPOSE_WORKER_TASK = "worker-task";
    public static final String PURPOSE_CONTEXT_SUMMARY = "context-summary";

    // Task ids
    public static final String TASK_ID_PREFIX = "T";
    public static final String TASK_ID_FALLBACK = "T1";

    // Fallback plan
    public static final String FALLBACK_DESCRIPTION_PREFIX = "Implement user request: ";
    public static final String FALLBACK_SUCCESS_CRITERION = "Request completed and verified";
    public static final List<String> FALLBACK_FILE_EXTENSIONS = List.of(".py", ".md", ".json", ".yaml", ".yml", ".txt");

    // Tool names reported by worker models
    public static final String TOOL_READ_FILE = "read_file";
    public static final String TOOL_WRITE_FILE = "write_file";
    public static final String TOOL_EXECUTE_BASH = "execute_bash";
    public static final String TOOL_LIST_FILES = "list_files";

    // Result messages
    public static final String VERIFICATION_FAILED_MESSAGE = "Verification failed: claimed files do not exist";
    public static final String INVALID_JSON_MESSAGE = "Invalid JSON response: ";
    public static final String TASK_CANCELLED_MESSAGE = "Task cancelled before execution";
    public static final String TOOL_RESULTS_HEADER = "\n\nTool Execution Results:\n";
    public static final int RAW_RESPONSE_LOG_LIMIT = 500;

    // Conversation context
    public static final int CHARS_PER_TOKEN = 4;

    public static final String CONTEXT_SUMMARY_SYSTEM_PROMPT = """
            You maintain the running summary of a conversation between a user and a coding
            orchestrator. Merge the new lines into the existing summary. Keep requests, decisions,
            files touched and failures. Reply with the updated summary as plain text, no preamble.
            """;

    public static final String PLANNER_SYSTEM_PROMPT = """
            You are a senior software architect who coordinates multiple coding agents.
            Break the user's request into atomic tasks. For each task provide:
            - description: short imperative sentence
            - files: list of files to read/write (empty list allowed)
            - success_criteria: bullet-style list of verifiable checks
            - budget: estimated token/effort budget (small, medium, large)
            - dependencies: optional list of task_ids this task depends on
            Return JSON with the schema:
            {
              "tasks": [
                 {
                   "task_id": "T1",
                   "description": "...",
                   "files": ["path/to/file"],
                   "success_criteria": ["..."],
                   "budget": "medium",
                   "dependencies": ["T0"]
                 }
              ]
            }
            Keep tasks between 1 and %d items. Respond with JSON only.
            """;

    public static final String WORKER_SYSTEM_PROMPT = """
            You are a coding agent working inside a project directory.
            Perform the task you are given with the available tools and answer with a single JSON object.
            """;

    public static final String WORKER_TOOLS_SECTION = """
            AVAILABLE TOOLS:
            You have access to the following tools to execute this task:

            1. read_file(file_path): Read a file's contents
               Example: read_file('config.py')

            2. write_file(file_path, content): Write content to a file
               Example: write_file('hello.py', 'print("Hello")')

            3. execute_bash(command): Execute a bash command
               Example: execute_bash('python hello.py')

            4. list_files(directory, pattern): List files in a directory
               Example: list_files('.', '*.py')

            TOOL USAGE INSTRUCTIONS:
            - Use tools to actually perform file operations and run commands
            - After using tools, verify the results
            - Include tool usage in your logs
            """;

    public static final String WORKER_RESULT_SCHEMA = """
            Execute this task and return a JSON response with this exact format:
            {
              "success": true/false,
              "tools_used": [{"tool": "tool_name", "file": "file_path", "content": "written content", "command": "bash command", "result": "success/failure"}],
              "files_modified": ["list of file paths"],
              "files_created": ["list of new file paths"],
              "tests_run": [{"name": "test name", "status": "passed/failed", "duration_ms": 123}],
              "verification_passed": true/false,
              "errors": ["list of error messages"],
              "logs": "execution log text including tool usage"
            }

            IMPORTANT:
            - Use the available tools to actually perform operations
            - Verify all changes before claiming success
            - Read files back after writing to confirm
            - Run tests if applicable
            - Report actual errors, not assumptions
            - Include tool usage details in your logs

            Begin execution:
            """;
}
