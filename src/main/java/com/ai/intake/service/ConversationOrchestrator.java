package com.ai.intake.service;

import com.ai.intake.component.ResponsePhrases;
import com.ai.intake.conversation.CallSession;
import com.ai.intake.conversation.IntakeNodes;
import com.ai.intake.dto.ChatMessage;
import com.ai.intake.dto.ModelToolCall;
import com.ai.intake.dto.ModelTurn;
import com.ai.intake.flow.FlowListener;
import com.ai.intake.flow.FlowManager;
import com.ai.intake.flow.FlowResult;
import com.ai.intake.flow.SessionState;
import com.ai.intake.flow.ToolContractViolationException;
import com.ai.intake.flow.ToolInvocationResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single entry for conversation turns. Keeps one {@link CallSession} per call,
 * feeds the caller's words to the model together with the tools of the current
 * node, executes the tool the model asks for and loops until the model has
 * something to say.
 */
@Service
public class ConversationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ConversationOrchestrator.class);

    private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };

    private final Map<String, CallSession> sessions = new ConcurrentHashMap<>();
    private final ObjectMapper mapper = new ObjectMapper();

    private final IntakeNodes nodes;
    private final ChatModelClient chatModel;
    private final IntakeArchiveService archiveService;
    private final ResponsePhrases phrases;
    private final int maxToolHops;

    public ConversationOrchestrator(IntakeNodes nodes,
                                    ChatModelClient chatModel,
                                    IntakeArchiveService archiveService,
                                    ResponsePhrases phrases,
                                    @Value("${flow.max-tool-hops:6}") int maxToolHops) {
        this.nodes = nodes;
        this.chatModel = chatModel;
        this.archiveService = archiveService;
        this.phrases = phrases;
        this.maxToolHops = maxToolHops;
    }

    /**
     * Opens the session for a call and lets the assistant speak first. A call
     * that already has a session (media stream reconnect) gets nothing to say.
     */
    public OrchestratorResult start(String callSid, String fromNumber) {
        CallSession session = new CallSession(callSid, fromNumber);
        session.getFlow().addListener(new FlowListener() {
            @Override
            public void onConversationEnded(SessionState finalState) {
                archiveService.archive(callSid, session.getFromNumber(), finalState);
            }
        });
        synchronized (session) {
            if (sessions.putIfAbsent(callSid, session) != null) {
                log.debug("[{}] session already open", callSid);
                return OrchestratorResult.silent();
            }
            session.getFlow().initialize(nodes.initialNode());
            log.info("[{}] session started from={}", callSid, fromNumber);
            return runModel(session);
        }
    }

    /**
     * Process one caller utterance and return text to speak and whether to end the call.
     */
    public OrchestratorResult process(String callSid, String userText) {
        CallSession session = sessions.get(callSid);
        if (session == null) {
            log.warn("[{}] no session for utterance, ignoring", callSid);
            return OrchestratorResult.silent();
        }
        synchronized (session) {
            if (session.isCancelled()) {
                return OrchestratorResult.silent();
            }
            if (session.getFlow().isEnded()) {
                return new OrchestratorResult(phrases.goodbye(), true);
            }
            session.append(ChatMessage.user(userText));
            return runModel(session);
        }
    }

    /**
     * Drops the session. A call that never reached the end has its collected data discarded.
     */
    public void end(String callSid) {
        CallSession session = sessions.remove(callSid);
        if (session == null) {
            return;
        }
        if (session.cancel()) {
            log.info("[{}] session closed after completed intake", callSid);
        } else {
            log.info("[{}] session cancelled, intake discarded", callSid);
        }
    }

    public boolean hasSession(String callSid) {
        return sessions.containsKey(callSid);
    }

    CallSession getSession(String callSid) {
        return sessions.get(callSid);
    }

    private OrchestratorResult runModel(CallSession session) {
        String callSid = session.getCallSid();
        FlowManager flow = session.getFlow();

        for (int hop = 0; hop <= maxToolHops; hop++) {
            if (session.isCancelled()) {
                log.info("[{}] session cancelled mid-turn, not speaking", callSid);
                return OrchestratorResult.silent();
            }

            ModelTurn turn;
            try {
                turn = chatModel.complete(session.getContext(), flow.getAvailableTools());
            } catch (ChatModelException e) {
                log.error("[{}] model call failed at node={}", callSid, flow.getCurrentNode().getName(), e);
                return new OrchestratorResult(phrases.couldYouRepeat(), false);
            }

            if (session.isCancelled()) {
                log.info("[{}] session cancelled while the model was answering, dropping reply", callSid);
                return OrchestratorResult.silent();
            }

            if (!turn.isToolCall()) {
                String text = turn.getText();
                if (StringUtils.isBlank(text)) {
                    log.warn("[{}] model returned an empty reply", callSid);
                    return new OrchestratorResult(flow.isEnded() ? phrases.goodbye() : phrases.couldYouRepeat(),
                            flow.isEnded());
                }
                session.append(ChatMessage.assistant(text));
                logFlow(callSid, flow.getCurrentNode().getName(), "reply");
                return new OrchestratorResult(text, flow.isEnded());
            }

            ModelToolCall call = turn.getToolCall();
            session.append(ChatMessage.assistantToolCall(call));
            session.append(ChatMessage.toolResult(call.getId(), executeTool(callSid, flow, call)));
        }

        log.warn("[{}] tool hop limit {} reached at node={}", callSid, maxToolHops, flow.getCurrentNode().getName());
        return new OrchestratorResult(phrases.technicalTrouble(), false);
    }

    /**
     * Runs a model-requested tool and renders its outcome for the model. Contract
     * violations are reported back to the model rather than to the caller.
     */
    private String executeTool(String callSid, FlowManager flow, ModelToolCall call) {
        FlowResult result;
        try {
            Map<String, Object> arguments = parseArguments(call.getArgumentsJson());
            ToolInvocationResult invocation = flow.invokeTool(call.getName(), arguments);
            result = invocation.getResult();
            logFlow(callSid, flow.getCurrentNode().getName(), call.getName());
        } catch (ToolContractViolationException e) {
            log.warn("[{}] rejected tool call {} in node={}: {}", callSid, e.getToolName(), e.getNodeName(), e.getMessage());
            result = FlowResult.error(e.getMessage());
        } catch (JsonProcessingException e) {
            log.warn("[{}] unparseable arguments for {}: {}", callSid, call.getName(), call.getArgumentsJson());
            result = FlowResult.error("Arguments for " + call.getName() + " are not valid JSON");
        }
        try {
            return mapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize tool result " + result, e);
        }
    }

    private Map<String, Object> parseArguments(String json) throws JsonProcessingException {
        if (StringUtils.isBlank(json)) {
            return Map.of();
        }
        Map<String, Object> arguments = mapper.readValue(json, ARGUMENTS_TYPE);
        return arguments != null ? arguments : Map.of();
    }

    private void logFlow(String callSid, String node, String source) {
        log.debug("[{}] node={} source={}", callSid, node, source);
    }

    public static final class OrchestratorResult {
        private final String textToSpeak;
        private final boolean endCall;

        public OrchestratorResult(String textToSpeak, boolean endCall) {
            this.textToSpeak = textToSpeak != null ? textToSpeak : "";
            this.endCall = endCall;
        }

        static OrchestratorResult silent() {
            return new OrchestratorResult("", false);
        }

        public String getTextToSpeak() {
            return textToSpeak;
        }

        public boolean isEndCall() {
            return endCall;
        }

        public boolean hasSpeech() {
            return !textToSpeak.isEmpty();
        }
    }
}
