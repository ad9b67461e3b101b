package io.herald.core.execution;

import io.herald.core.model.AgentResult;

@FunctionalInterface
public interface AgentRunner {
    AgentResult run(ExecutionSession session);
}
