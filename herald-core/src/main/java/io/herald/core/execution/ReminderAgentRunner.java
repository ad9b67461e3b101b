package io.herald.core.execution;

import io.herald.core.model.AgentResult;

/**
 * Runner without a reasoning model: the job message itself is the session's result.
 */
public final class ReminderAgentRunner implements AgentRunner {

    @Override
    public AgentResult run(ExecutionSession session) {
        return AgentResult.of(session.message());
    }
}
