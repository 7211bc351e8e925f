package com.casepilot.core.agent;

/**
 * Roles that talk to the completion capability. Drives model and system prompt
 * selection in LLMClient implementations.
 */
public enum AgentType {
    INVESTIGATOR,
    CRITIC,
    PARAPHRASER
}
