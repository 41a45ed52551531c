package dev.opscrew.domain.system.toolloop;

/**
 * Outcome of one agent loop run.
 *
 * @param finalText
 *            assistant text of the last generation turn
 * @param streamedText
 *            every content delta the run produced, concatenated in order
 * @param iterations
 *            number of model calls made
 * @param toolExecutions
 *            number of capability calls answered
 * @param stopReason
 *            why the run ended
 * @param errorMessage
 *            model failure message, set only for {@link StopReason#MODEL_ERROR}
 */
public record AgentRunResult(String finalText, String streamedText, int iterations, int toolExecutions,
        StopReason stopReason, String errorMessage) {

    public boolean isCancelled() {
        return stopReason == StopReason.CANCELLED;
    }
}
