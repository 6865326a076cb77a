package com.ai.intake.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Duration;

/**
 * Speech-to-Text using OpenAI Whisper.
 * Twilio media streams carry 8kHz mu-law; Whisper gets 16-bit PCM WAV.
 */
@Service
public class SttService {

    private static final Logger log = LoggerFactory.getLogger(SttService.class);

    private static final float SAMPLE_RATE = 8000f;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final String apiKey;
    private final String transcriptionUrl;
    private final String model;
    private final int maxRetries;

    public SttService(RestTemplateBuilder builder,
                      @Value("${openai.api-key:}") String apiKey,
                      @Value("${openai.base-url:https://api.openai.com}") String baseUrl,
                      @Value("${stt.model:whisper-1}") String model,
                      @Value("${stt.connect-timeout:30s}") Duration connectTimeout,
                      @Value("${stt.read-timeout:120s}") Duration readTimeout,
                      @Value("${stt.max-retries:3}") int maxRetries) {
        this.restTemplate = builder
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .build();
        this.apiKey = apiKey;
        this.transcriptionUrl = baseUrl.replaceAll("/$", "") + "/v1/audio/transcriptions";
        this.model = model;
        this.maxRetries = Math.max(1, maxRetries);
    }

    /**
     * @return the transcript, or an empty string when nothing usable came back
     */
    public String transcribe(byte[] mulawAudio) {
        if (StringUtils.isBlank(apiKey)) {
            log.error("openai.api-key is not set");
            return "";
        }

        try {
            byte[] wavAudio = convertMulawToWav(mulawAudio);
            log.debug("WAV bytes={} (~{} ms)", wavAudio.length, (wavAudio.length - 44) / 16);

            HttpHeaders headers = new HttpHeaders();
            headers.setBearerAuth(apiKey.trim());
            headers.setContentType(MediaType.MULTIPART_FORM_DATA);

            MultiValueMap<String, Object> form = new LinkedMultiValueMap<>();
            form.add("model", model);
            form.add("response_format", "json");
            form.add("file", new ByteArrayResource(wavAudio) {
                @Override
                public String getFilename() {
                    return "audio.wav";
                }
            });

            ResponseEntity<String> response = postWithRetry(new HttpEntity<>(form, headers));
            if (response == null || response.getBody() == null) {
                return "";
            }
            JsonNode node = objectMapper.readTree(response.getBody());
            return node.path("text").asText("").trim();

        } catch (HttpClientErrorException.Unauthorized e) {
            log.error("OpenAI API returned 401 Unauthorized. Check openai.api-key");
            return "";
        } catch (RestClientException | IOException e) {
            log.error("Failed to transcribe audio", e);
            return "";
        }
    }

    private ResponseEntity<String> postWithRetry(HttpEntity<MultiValueMap<String, Object>> request) {
        for (int attempt = 1; ; attempt++) {
            try {
                return restTemplate.postForEntity(transcriptionUrl, request, String.class);
            } catch (ResourceAccessException e) {
                if (attempt >= maxRetries) {
                    log.error("STT failed after {} attempts", maxRetries);
                    throw e;
                }
                long delayMs = 1000L * attempt;
                log.warn("STT attempt {}/{} failed ({}), retrying in {}ms", attempt, maxRetries, e.getMessage(), delayMs);
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("STT retry interrupted");
                    return null;
                }
            }
        }
    }

    /**
     * Convert Twilio mu-law (8kHz, mono, 1 byte per frame) to PCM WAV.
     */
    static byte[] convertMulawToWav(byte[] mulaw) throws IOException {
        AudioFormat mulawFormat = new AudioFormat(
                AudioFormat.Encoding.ULAW, SAMPLE_RATE, 8, 1, 1, SAMPLE_RATE, false);
        AudioFormat pcmFormat = new AudioFormat(
                AudioFormat.Encoding.PCM_SIGNED, SAMPLE_RATE, 16, 1, 2, SAMPLE_RATE, false);

        try (
                ByteArrayInputStream bais = new ByteArrayInputStream(mulaw);
                AudioInputStream mulawStream = new AudioInputStream(bais, mulawFormat, mulaw.length);
                AudioInputStream pcmStream = AudioSystem.getAudioInputStream(pcmFormat, mulawStream);
                ByteArrayOutputStream baos = new ByteArrayOutputStream()
        ) {
            AudioSystem.write(pcmStream, AudioFileFormat.Type.WAVE, baos);
            return baos.toByteArray();
        }
    }
}
