package com.ai.intake.controller;

import com.ai.intake.service.CallForwardingService;
import com.ai.intake.service.ConversationOrchestrator;
import com.ai.intake.service.TelephonyException;
import com.ai.intake.websocket.MediaStreamHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Set;

@RestController
public class VoiceController {

    private static final Logger log = LoggerFactory.getLogger(VoiceController.class);

    private static final String VOICE = "Polly.Joanna-Neural";

    /** Call statuses after which the caller is gone. */
    static final Set<String> FINAL_STATUSES = Set.of("completed", "busy", "failed", "no-answer", "canceled");

    private final ConversationOrchestrator orchestrator;
    private final CallForwardingService forwardingService;
    private final MediaStreamHandler mediaStreamHandler;
    private final String mediaStreamUrl;
    private final String baseUrl;
    private final String defaultSipUri;

    public VoiceController(ConversationOrchestrator orchestrator,
                           CallForwardingService forwardingService,
                           MediaStreamHandler mediaStreamHandler,
                           @Value("${twilio.media-stream-url:wss://localhost:8080/media-stream}") String mediaStreamUrl,
                           @Value("${twilio.base-url:}") String baseUrl,
                           @Value("${twilio.sip-uri:}") String defaultSipUri) {
        this.orchestrator = orchestrator;
        this.forwardingService = forwardingService;
        this.mediaStreamHandler = mediaStreamHandler;
        this.mediaStreamUrl = mediaStreamUrl;
        this.baseUrl = baseUrl;
        this.defaultSipUri = defaultSipUri;
    }

    /**
     * Connects the call to the media stream. The assistant opens the conversation
     * itself, so no greeting is played here.
     */
    @PostMapping(value = "/twilio/voice/inbound", produces = MediaType.APPLICATION_XML_VALUE)
    public ResponseEntity<String> inbound(@RequestParam(required = false) Map<String, String> params) {
        String from = params != null ? params.getOrDefault("From", "") : "";
        String callSid = params != null ? params.getOrDefault("CallSid", "") : "";
        String streamParams = "";
        if (StringUtils.hasText(from)) {
            streamParams = "<Parameter name=\"From\" value=\"" + escapeXml(from) + "\"/>";
        }
        String connectTwiml = "<Connect><Stream url=\"" + escapeXml(mediaStreamUrl) + "\">" + streamParams + "</Stream></Connect>";
        log.info("Inbound call -> stream to {} | callSid={} from={}", mediaStreamUrl, callSid, from);
        return ResponseEntity.ok("<Response>" + connectTwiml + "</Response>");
    }

    @RequestMapping(value = "/twilio/voice/say", method = {RequestMethod.GET, RequestMethod.POST}, produces = MediaType.APPLICATION_XML_VALUE)
    public ResponseEntity<String> say(
            @RequestParam(value = "text", required = false) String text,
            @RequestParam(value = "end", required = false) String end) {
        if (!StringUtils.hasText(text)) {
            return ResponseEntity.badRequest().body("<Response><Say>No text.</Say></Response>");
        }
        boolean endCall = "1".equals(end) || "true".equalsIgnoreCase(end);
        String sayTwiml = "<Say voice=\"" + escapeXml(VOICE) + "\"><prosody rate=\"1.1\">" + escapeXml(text) + "</prosody></Say>";
        if (endCall) {
            log.info("Conversation ended -> hanging up call");
            return ResponseEntity.ok("<Response>" + sayTwiml + "<Hangup/></Response>");
        }
        String redirectPath = "/twilio/voice/continue-call";
        String redirectUrl = StringUtils.hasText(baseUrl)
            ? baseUrl.trim().replaceAll("/$", "") + redirectPath
            : redirectPath;
        return ResponseEntity.ok("<Response>" + sayTwiml + "<Redirect>" + escapeXml(redirectUrl) + "</Redirect></Response>");
    }

    /**
     * After the assistant speaks: re-connect the stream only. Redirecting to
     * inbound would look like a new call.
     */
    @RequestMapping(value = "/twilio/voice/continue-call", method = {RequestMethod.GET, RequestMethod.POST}, produces = MediaType.APPLICATION_XML_VALUE)
    public ResponseEntity<String> continueCall() {
        String connectTwiml = "<Connect><Stream url=\"" + escapeXml(mediaStreamUrl) + "\"/></Connect>";
        log.debug("Continue call -> re-connect stream");
        return ResponseEntity.ok("<Response>" + connectTwiml + "</Response>");
    }

    /**
     * Twilio status callback. Once the call is over its session is dropped; an
     * intake that never reached the end is discarded.
     */
    @PostMapping("/twilio/voice/status")
    public ResponseEntity<Void> status(@RequestParam("CallSid") String callSid,
                                       @RequestParam(value = "CallStatus", required = false) String callStatus) {
        log.info("Call status | callSid={} status={}", callSid, callStatus);
        if (callStatus != null && FINAL_STATUSES.contains(callStatus.toLowerCase())) {
            orchestrator.end(callSid);
            forwardingService.forget(callSid);
            mediaStreamHandler.onCallEnded(callSid);
        }
        return ResponseEntity.noContent().build();
    }

    /**
     * Signals that the SIP endpoint for a call is provisioned. May arrive once per
     * endpoint; the call is forwarded on the first one only.
     */
    @PostMapping(value = "/twilio/voice/dialin-ready", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> dialinReady(@RequestParam("CallSid") String callSid,
                                                           @RequestParam(value = "sipUri", required = false) String sipUri) {
        String target = StringUtils.hasText(sipUri) ? sipUri : defaultSipUri;
        if (!StringUtils.hasText(target)) {
            return ResponseEntity.badRequest().body(Map.of("error", "No SIP URI configured"));
        }
        try {
            boolean forwarded = forwardingService.forward(callSid, target);
            return ResponseEntity.ok(Map.of("callSid", callSid, "forwarded", forwarded));
        } catch (TelephonyException e) {
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                    .body(Map.of("callSid", callSid, "forwarded", false, "error", e.getMessage()));
        }
    }

    static String escapeXml(String raw) {
        if (raw == null) return "";
        return raw
            .replace("&", "&amp;")
            .replace("<", "&lt;")
            .replace(">", "&gt;")
            .replace("\"", "&quot;")
            .replace("'", "&apos;");
    }
}
