package bigo.conductor.worker;

import bigo.conductor.model.Task;

/**
 * Prompt text sent to the backends.
 */
public final class PromptBuilder {

    private PromptBuilder() {
    }

    /** Structured prompt for raw model endpoints (Ollama, Gemini). */
    public static String taskPrompt(Task task) {
        StringBuilder sb = new StringBuilder()
                .append("You are an expert software engineer. Complete the following task:\n\n")
                .append("## Task\n").append(task.title()).append("\n\n");
        if (!task.description().isEmpty()) {
            sb.append("## Details\n").append(task.description()).append("\n\n");
        }
        sb.append("## Instructions\n")
                .append("- Provide clear, working code\n")
                .append("- Include brief explanations for non-obvious decisions\n")
                .append("- If the task is ambiguous, state your assumptions\n")
                .append("- Format code properly with appropriate language tags\n\n")
                .append("## Response\n");
        return sb.toString();
    }

    /** Plain prompt for the Claude CLI, which brings its own agent instructions. */
    public static String cliPrompt(Task task) {
        if (task.description().isEmpty()) {
            return task.title();
        }
        return task.title() + "\n\n" + task.description();
    }
}
