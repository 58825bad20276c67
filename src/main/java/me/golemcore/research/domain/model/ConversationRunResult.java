package me.golemcore.research.domain.model;

/**
 * Terminal state of a conversation engine run.
 *
 * @param conversation
 *            the complete message log
 * @param stopReason
 *            why the run stopped
 * @param steps
 *            number of model calls made
 * @param toolExecutions
 *            number of tool requests dispatched (real or synthetic)
 */
public record ConversationRunResult(Conversation conversation, StopReason stopReason, int steps,
        int toolExecutions) {

    public boolean finishedNormally() {
        return stopReason == StopReason.FINAL_ANSWER;
    }
}
