package com.canihazhouze.agent.llm;

import com.canihazhouze.agent.model.Message;
import com.canihazhouze.agent.tool.ToolDescriptor;

import java.util.List;

/**
 * Boundary to the conversational model. The engine depends only on this
 * contract; how inference happens is up to the implementation.
 */
public interface ChatModelPort {

    /**
     * Send the assembled conversation and the tools the agent may use.
     *
     * @param messages  system prompt followed by the run's history
     * @param options   the agent's generation options, passed through untouched
     * @param tools     tool schemas the model may request; may be empty
     * @return assistant text plus zero or more tool call requests
     * @throws ChatModelException tagged transient, malformed or fatal
     */
    ChatCompletion complete(List<Message> messages, GenerationOptions options, List<ToolDescriptor> tools);
}
