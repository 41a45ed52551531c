package dev.opscrew.domain.system.toolloop;

/**
 * Bounded reason-act-observe loop of one agent.
 */
public interface ToolLoopSystem {

    /**
     * Runs the agent until it answers without capability calls, its iteration
     * budget is used up, the model stream fails, or the run is cancelled. Never
     * throws for tool or model failures; those surface as events and history.
     */
    AgentRunResult run(LoopContext context);
}
