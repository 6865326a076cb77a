package com.ai.intake.service;

import com.twilio.exception.ApiException;
import com.twilio.http.TwilioRestClient;
import com.twilio.rest.api.v2010.account.Call;
import com.twilio.twiml.VoiceResponse;
import com.twilio.twiml.voice.Dial;
import com.twilio.twiml.voice.Sip;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

@Service
public class TwilioService implements TelephonyBridge {

    private static final Logger log = LoggerFactory.getLogger(TwilioService.class);

    static final String SAY_PATH = "/twilio/voice/say";

    private final String baseUrl;
    private final TwilioRestClient client;

    public TwilioService(@Value("${twilio.account-sid:}") String accountSid,
                         @Value("${twilio.auth-token:}") String authToken,
                         @Value("${twilio.base-url:}") String baseUrl) {
        this.baseUrl = baseUrl;
        this.client = StringUtils.isAnyBlank(accountSid, authToken)
                ? null
                : new TwilioRestClient.Builder(accountSid, authToken).build();
    }

    /**
     * Updates the active call so Twilio fetches TwiML that speaks the text, then
     * re-connects the media stream or hangs up when endCall is true.
     */
    @Override
    public void speak(String callSid, String text, boolean endCall) {
        if (StringUtils.isAnyBlank(callSid, text)) {
            return;
        }
        if (client == null) {
            log.warn("Twilio credentials not set; skipping speak");
            return;
        }
        try {
            Call.updater(callSid)
                    .setUrl(URI.create(buildSayUrl(text, endCall)))
                    .update(client);
        } catch (ApiException e) {
            log.error("Twilio Call Update failed for call {}", callSid, e);
        }
    }

    @Override
    public void redirectToSip(String callSid, String sipUri) {
        if (client == null) {
            throw new TelephonyException("Twilio credentials not set; cannot forward call " + callSid);
        }
        try {
            Call.updater(callSid)
                    .setTwiml(sipTwiml(sipUri))
                    .update(client);
            log.info("Call {} forwarded to {}", callSid, sipUri);
        } catch (ApiException e) {
            throw new TelephonyException("Failed to forward call " + callSid + " to " + sipUri, e);
        }
    }

    String buildSayUrl(String text, boolean endCall) {
        String base = StringUtils.isNotBlank(baseUrl)
            ? baseUrl.trim().replaceAll("/$", "")
            : "";
        String url = base + SAY_PATH + "?text=" + URLEncoder.encode(text, StandardCharsets.UTF_8);
        if (endCall) {
            url = url + "&end=1";
        }
        return url;
    }

    static String sipTwiml(String sipUri) {
        Dial dial = new Dial.Builder()
                .sip(new Sip.Builder(sipUri).build())
                .build();
        return new VoiceResponse.Builder().dial(dial).build().toXml();
    }
}
