package me.golemcore.research.domain.engine;

import me.golemcore.research.domain.model.ConversationRequest;
import me.golemcore.research.domain.model.ConversationRunResult;

/**
 * Drives one model/tool exchange to a terminal state.
 *
 * <p>
 * A run owns its conversation exclusively. Claim validation uses the same
 * engine recursively with its own conversation, tool set and step budget.
 */
public interface ConversationEngine {

    ConversationRunResult run(ConversationRequest request);
}
