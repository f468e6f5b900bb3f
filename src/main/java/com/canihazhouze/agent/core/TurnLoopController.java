package com.canihazhouze.agent.core;

import com.canihazhouze.agent.config.EngineProperties;
import com.canihazhouze.agent.exception.ConfigurationException;
import com.canihazhouze.agent.llm.ChatCompletion;
import com.canihazhouze.agent.llm.ChatModelException;
import com.canihazhouze.agent.llm.ChatModelPort;
import com.canihazhouze.agent.llm.GenerationOptions;
import com.canihazhouze.agent.llm.ToolCallRequest;
import com.canihazhouze.agent.model.Agent;
import com.canihazhouze.agent.model.AgentConfig;
import com.canihazhouze.agent.model.AgentRun;
import com.canihazhouze.agent.model.AgentRunLog;
import com.canihazhouze.agent.model.ConversationTurn;
import com.canihazhouze.agent.model.Message;
import com.canihazhouze.agent.model.ToolCall;
import com.canihazhouze.agent.tool.ToolDescriptor;
import com.canihazhouze.agent.tool.ToolProviderPort;
import com.canihazhouze.agent.tool.ToolResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Drives one claimed run from its current turn until it completes, fails,
 * or is suspended by a pause or cancel signal.
 *
 * Per iteration:
 * 1. Checkpoint: cancel, pause, run timeout
 * 2. Append a continuation user turn if the model spoke last
 * 3. Checkpoint: cancel; then call the model with the full history
 * 4. Append the assistant turn, then one tool turn per requested tool call
 *    (checkpoint: cancel before each invocation)
 * 5. Count the iteration; stop at maxTurns
 * 6. If a goal is configured, ask the goal evaluator
 *
 * The history is the only state carried between iterations, so a paused
 * run picks up exactly where it stopped when a worker claims it again.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TurnLoopController {

    private final ChatModelPort chatModel;
    private final ToolProviderPort toolProvider;
    private final GoalEvaluator goalEvaluator;
    private final PromptRenderer promptRenderer;
    private final EngineProperties engineProperties;

    public RunOutcome drive(RunExecution exec) {
        AgentRun run = exec.getRun();
        Agent agent = exec.getAgent();
        RunSignals signals = exec.getSignals();
        AgentConfig config = agent.getConfig();

        if (run.getConversationHistory().isEmpty()) {
            String systemPrompt;
            try {
                systemPrompt = promptRenderer.render(agent.getPrompt(), agent.getInputVariables(), run.getInputValues());
            } catch (ConfigurationException e) {
                exec.log(AgentRunLog.ERROR, "Prompt template error: " + e.getMessage());
                return RunOutcome.failed(e.getMessage());
            }
            exec.appendTurn(ConversationTurn.builder()
                    .role(Message.Role.system)
                    .content(systemPrompt)
                    .build());
            exec.log(AgentRunLog.INFO, "Starting " + (config.isEnableMultiTurn() ? "multi-turn" : "single-turn")
                    + " conversation with model: " + config.getModel());
        } else {
            exec.log(AgentRunLog.INFO, "Resuming at turn " + (run.getTurnCount() + 1) + "/" + run.getMaxTurns());
        }

        GenerationOptions options = GenerationOptions.from(config);
        List<ToolDescriptor> tools = declaredTools(exec);

        while (true) {
            if (signals.isCancelRequested()) {
                return RunOutcome.cancelled();
            }
            if (signals.isPauseRequested()) {
                exec.log(AgentRunLog.INFO, "Execution paused by user");
                return RunOutcome.paused();
            }
            if (runTimedOut(exec)) {
                String msg = "Run exceeded its time budget of " + engineProperties.getRunTimeout();
                exec.log(AgentRunLog.ERROR, msg);
                return RunOutcome.failed(msg);
            }
            if (run.getTurnCount() >= run.getMaxTurns()) {
                return maxTurnsReached(exec);
            }

            if (lastTurnRole(run) == Message.Role.assistant) {
                exec.appendTurn(ConversationTurn.builder()
                        .role(Message.Role.user)
                        .content(engineProperties.getContinuationPrompt())
                        .build());
            }

            int turn = run.getTurnCount() + 1;
            exec.log(AgentRunLog.INFO, "Starting turn " + turn + "/" + run.getMaxTurns());

            if (signals.isCancelRequested()) {
                return RunOutcome.cancelled();
            }

            ChatCompletion completion;
            try {
                completion = chatModel.complete(
                        ConversationAssembler.toMessages(run.getConversationHistory()), options, tools);
            } catch (ChatModelException e) {
                exec.log(AgentRunLog.ERROR, "Error in turn " + turn + ": " + e.getMessage());
                return RunOutcome.failed(e.getMessage());
            }
            run.addUsage(completion.getPromptTokens(), completion.getCompletionTokens());

            String content = completion.getContent() != null ? completion.getContent() : "";
            exec.appendTurn(ConversationTurn.builder()
                    .role(Message.Role.assistant)
                    .content(content)
                    .build());
            exec.log(AgentRunLog.INFO, "Turn " + turn + ": Generated response (" + content.length() + " chars)");

            for (ToolCallRequest request : completion.getToolCalls()) {
                if (signals.isCancelRequested()) {
                    return RunOutcome.cancelled();
                }
                invokeTool(exec, request);
            }

            run.setTurnCount(turn);
            signals.progress(turn);
            exec.checkpoint();

            if (!config.isEnableMultiTurn()) {
                return RunOutcome.completed(content);
            }
            if (turn >= run.getMaxTurns()) {
                return maxTurnsReached(exec);
            }
            if (hasGoal(run) && goalAchieved(exec, options)) {
                run.setGoalAchieved(true);
                exec.log(AgentRunLog.INFO, "Goal achieved! Completing execution");
                return RunOutcome.completed("Goal achieved");
            }
        }
    }

    private void invokeTool(RunExecution exec, ToolCallRequest request) {
        String name = request.getName();
        String callId = request.getId() != null ? request.getId() : "call_" + UUID.randomUUID();

        ToolResult result;
        if (!exec.getAgent().declaresTool(name)) {
            exec.log(AgentRunLog.WARNING, "Model requested undeclared tool " + name + ", not invoked");
            result = ToolResult.error(ToolResult.ErrorKind.NOT_DECLARED,
                    "Tool '" + name + "' is not available to this agent");
        } else {
            exec.log(AgentRunLog.INFO, "Calling tool " + name);
            try {
                result = toolProvider.invoke(name, request.getArguments());
            } catch (RuntimeException e) {
                log.error("Tool provider threw for [{}] [runId={}]", name, exec.getRun().getId(), e);
                result = ToolResult.error(ToolResult.ErrorKind.INVOCATION_FAILED, e.getMessage());
            }
            if (!result.ok()) {
                exec.log(AgentRunLog.WARNING, "Tool " + name + " failed: " + result.content());
            }
        }

        ToolCall call = ToolCall.builder()
                .id(callId)
                .name(name)
                .arguments(request.getArguments())
                .result(result.content())
                .error(!result.ok())
                .build();

        exec.appendTurn(ConversationTurn.builder()
                .role(Message.Role.tool)
                .content(result.content())
                .toolCalls(List.of(call))
                .toolCallId(callId)
                .toolName(name)
                .build());
    }

    private boolean goalAchieved(RunExecution exec, GenerationOptions options) {
        AgentRun run = exec.getRun();
        GoalVerdict verdict = goalEvaluator.evaluate(run.getGoal(), run.getConversationHistory(), options);
        run.addUsage(verdict.promptTokens(), verdict.completionTokens());
        if (verdict.failed()) {
            exec.log(AgentRunLog.WARNING, "Goal check failed, assuming not achieved: " + verdict.detail());
        }
        return verdict.achieved();
    }

    private RunOutcome maxTurnsReached(RunExecution exec) {
        exec.log(AgentRunLog.INFO, "Agent completed after reaching max turns (" + exec.getRun().getMaxTurns() + ")");
        return RunOutcome.completed("Max turns reached");
    }

    private List<ToolDescriptor> declaredTools(RunExecution exec) {
        Agent agent = exec.getAgent();
        List<ToolDescriptor> available = toolProvider.listTools().stream()
                .filter(d -> agent.declaresTool(d.getName()))
                .toList();
        if (agent.getTools() != null && available.size() < agent.getTools().size()) {
            exec.log(AgentRunLog.WARNING, "Some declared tools are not registered: " + agent.getTools());
        }
        return available;
    }

    private boolean runTimedOut(RunExecution exec) {
        return engineProperties.hasRunTimeout()
                && exec.elapsedRunningMillis() >= engineProperties.getRunTimeout().toMillis();
    }

    private static boolean hasGoal(AgentRun run) {
        return run.getGoal() != null && !run.getGoal().isBlank();
    }

    private static Message.Role lastTurnRole(AgentRun run) {
        List<ConversationTurn> history = run.getConversationHistory();
        return history.isEmpty() ? null : history.get(history.size() - 1).getRole();
    }
}
