package com.ai.intake.controller;

import com.ai.intake.service.CallForwardingService;
import com.ai.intake.service.ConversationOrchestrator;
import com.ai.intake.service.TelephonyException;
import com.ai.intake.websocket.MediaStreamHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class VoiceControllerTest {

    private ConversationOrchestrator orchestrator;
    private CallForwardingService forwardingService;
    private MediaStreamHandler mediaStreamHandler;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        orchestrator = mock(ConversationOrchestrator.class);
        forwardingService = mock(CallForwardingService.class);
        mediaStreamHandler = mock(MediaStreamHandler.class);
        VoiceController controller = new VoiceController(orchestrator, forwardingService, mediaStreamHandler,
                "wss://intake.example.test/media-stream", "https://intake.example.test", "sip:default@sip.example.test");
        mvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    @Test
    void inboundConnectsMediaStreamWithCallerNumber() throws Exception {
        mvc.perform(post("/twilio/voice/inbound").param("From", "+15550100").param("CallSid", "CA1"))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("<Connect><Stream url=\"wss://intake.example.test/media-stream\">")))
                .andExpect(content().string(containsString("<Parameter name=\"From\" value=\"+15550100\"/>")));
    }

    @Test
    void sayRedirectsBackToStream() throws Exception {
        mvc.perform(get("/twilio/voice/say").param("text", "What's your name?"))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("What&apos;s your name?")))
                .andExpect(content().string(containsString("<Redirect>https://intake.example.test/twilio/voice/continue-call</Redirect>")));
    }

    @Test
    void sayWithEndFlagHangsUp() throws Exception {
        mvc.perform(post("/twilio/voice/say").param("text", "Goodbye").param("end", "1"))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("<Hangup/>")));
    }

    @Test
    void sayWithoutTextIsRejected() throws Exception {
        mvc.perform(post("/twilio/voice/say"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void finalStatusEndsSession() throws Exception {
        mvc.perform(post("/twilio/voice/status").param("CallSid", "CA1").param("CallStatus", "completed"))
                .andExpect(status().isNoContent());

        verify(orchestrator).end("CA1");
        verify(forwardingService).forget("CA1");
        verify(mediaStreamHandler).onCallEnded("CA1");
    }

    @Test
    void inProgressStatusKeepsSession() throws Exception {
        mvc.perform(post("/twilio/voice/status").param("CallSid", "CA1").param("CallStatus", "in-progress"))
                .andExpect(status().isNoContent());

        verify(orchestrator, never()).end(any());
    }

    @Test
    void dialinReadyForwardsToConfiguredSipUri() throws Exception {
        when(forwardingService.forward("CA1", "sip:default@sip.example.test")).thenReturn(true);

        mvc.perform(post("/twilio/voice/dialin-ready").param("CallSid", "CA1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.forwarded").value(true));
    }

    @Test
    void repeatedDialinReadyIsNotAnError() throws Exception {
        when(forwardingService.forward("CA1", "sip:room@sip.example.test")).thenReturn(false);

        mvc.perform(post("/twilio/voice/dialin-ready").param("CallSid", "CA1").param("sipUri", "sip:room@sip.example.test"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.forwarded").value(false));
    }

    @Test
    void forwardingFailureIsBadGateway() throws Exception {
        when(forwardingService.forward(any(), any())).thenThrow(new TelephonyException("twilio down"));

        mvc.perform(post("/twilio/voice/dialin-ready").param("CallSid", "CA1"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.forwarded").value(false));
    }
}
