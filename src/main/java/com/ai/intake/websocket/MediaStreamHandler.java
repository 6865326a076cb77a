package com.ai.intake.websocket;

import com.ai.intake.component.ResponsePhrases;
import com.ai.intake.service.ConversationOrchestrator;
import com.ai.intake.service.ConversationOrchestrator.OrchestratorResult;
import com.ai.intake.service.SttService;
import com.ai.intake.service.TelephonyBridge;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.ByteArrayOutputStream;
import java.util.Base64;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Twilio media stream endpoint. Buffers caller audio, cuts it into utterances
 * on silence and hands the transcript to the orchestrator.
 */
@Component
public class MediaStreamHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(MediaStreamHandler.class);

    static final int SILENCE_FRAMES = 20;
    static final int MIN_AUDIO_BYTES = 12000;

    private final ObjectMapper mapper = new ObjectMapper();
    private final Map<String, StreamState> streams = new ConcurrentHashMap<>();
    /** Persists From number across stream reconnects (continue-call does not pass custom params) */
    private final Map<String, String> callSidToFrom = new ConcurrentHashMap<>();

    private final SttService sttService;
    private final TelephonyBridge telephony;
    private final ConversationOrchestrator orchestrator;
    private final ResponsePhrases phrases;

    public MediaStreamHandler(SttService sttService,
                              TelephonyBridge telephony,
                              ConversationOrchestrator orchestrator,
                              ResponsePhrases phrases) {
        this.sttService = sttService;
        this.telephony = telephony;
        this.orchestrator = orchestrator;
        this.phrases = phrases;
    }

    static class StreamState {
        final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        int silenceFrames = 0;
        volatile boolean processing = false;
        volatile boolean closed = false;
        /** Consecutive unclear or silent utterances. */
        int unclearUtterances = 0;
        String callSid;
        String fromNumber;
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        JsonNode root = mapper.readTree(message.getPayload());
        String event = root.path("event").asText();
        String streamSid = root.path("streamSid").asText();

        switch (event) {
            case "start":
                handleStart(streamSid, root);
                break;
            case "media":
                handleMedia(streamSid, root);
                break;
            case "stop":
                log.info("Stream ended | {}", streamSid);
                cleanup(streamSid);
                break;
            default:
                break;
        }
    }

    private void handleStart(String streamSid, JsonNode root) {
        StreamState state = new StreamState();
        JsonNode start = root.path("start");
        state.callSid = start.path("callSid").asText("");
        String from = start.path("customParameters").path("From").asText("");
        if (!from.isEmpty()) {
            callSidToFrom.put(state.callSid, from);
        }
        state.fromNumber = callSidToFrom.get(state.callSid);
        streams.put(streamSid, state);

        if (state.callSid.isEmpty()) {
            log.warn("Stream {} started without callSid", streamSid);
            return;
        }
        if (orchestrator.hasSession(state.callSid)) {
            log.info("Stream reconnected | streamSid={} callSid={}", streamSid, state.callSid);
            return;
        }

        log.info("Call started | streamSid={} callSid={} from={}", streamSid, state.callSid, state.fromNumber);
        state.processing = true;
        CompletableFuture.runAsync(() -> {
            try {
                speak(state, orchestrator.start(state.callSid, state.fromNumber));
            } catch (RuntimeException e) {
                log.error("Failed to open conversation for call {}", state.callSid, e);
            } finally {
                state.processing = false;
            }
        });
    }

    private void handleMedia(String streamSid, JsonNode root) {
        StreamState state = streams.get(streamSid);
        if (state == null || state.closed || state.processing) return;

        String payload = root.path("media").path("payload").asText(null);
        if (StringUtils.isBlank(payload)) return;

        byte[] frame = Base64.getDecoder().decode(payload);
        state.buffer.write(frame, 0, frame.length);

        if (isSilent(frame)) {
            state.silenceFrames++;
        } else {
            state.silenceFrames = 0;
        }

        if (state.silenceFrames >= SILENCE_FRAMES && state.buffer.size() >= MIN_AUDIO_BYTES) {
            state.processing = true;
            byte[] utterance = state.buffer.toByteArray();
            state.buffer.reset();
            state.silenceFrames = 0;
            processUtteranceAsync(streamSid, utterance, state);
        }
    }

    static boolean isSilent(byte[] frame) {
        if (frame.length == 0) return true;
        long sum = 0;
        for (byte b : frame) sum += Math.abs(b);
        return (sum / frame.length) < 4;
    }

    /**
     * Gently re-prompts when speech could not be made out. After repeated misses
     * assume the caller has gone and hang up.
     */
    private void handleUnclearUtterance(StreamState state) {
        state.unclearUtterances++;
        String prompt;
        boolean endCall = false;
        switch (state.unclearUtterances) {
            case 1:
                prompt = phrases.couldYouRepeat();
                break;
            case 2:
                prompt = phrases.stillHere();
                break;
            case 3:
                prompt = phrases.stillThere();
                break;
            default:
                prompt = phrases.goodbye();
                endCall = true;
        }
        speak(state, new OrchestratorResult(prompt, endCall));
    }

    private void processUtteranceAsync(String streamSid, byte[] audio, StreamState state) {
        CompletableFuture.runAsync(() -> {
            try {
                if (state.closed) return;
                if (StringUtils.isEmpty(state.callSid)) {
                    log.warn("No callSid for stream {}; cannot speak response", streamSid);
                    return;
                }

                String userText = StringUtils.trimToEmpty(sttService.transcribe(audio));
                if (userText.length() < 2) {
                    handleUnclearUtterance(state);
                    return;
                }
                state.unclearUtterances = 0;

                log.info("USER | {}", userText);
                speak(state, orchestrator.process(state.callSid, userText));
            } catch (RuntimeException e) {
                log.error("Pipeline error", e);
            } finally {
                state.processing = false;
            }
        });
    }

    private void speak(StreamState state, OrchestratorResult result) {
        if (!result.hasSpeech() || state.closed) {
            return;
        }
        log.info("AI | {}", result.getTextToSpeak());
        if (result.isEndCall()) {
            log.info("Conversation ended -> will hang up after speaking");
            state.closed = true;
        }
        telephony.speak(state.callSid, result.getTextToSpeak(), result.isEndCall());
    }

    /**
     * Forgets per-call data once the call itself is over.
     */
    public void onCallEnded(String callSid) {
        callSidToFrom.remove(callSid);
        streams.values().removeIf(state -> {
            if (callSid.equals(state.callSid)) {
                state.closed = true;
                return true;
            }
            return false;
        });
    }

    private void cleanup(String streamSid) {
        StreamState state = streams.remove(streamSid);
        if (state != null) {
            state.closed = true;
        }
    }
}
