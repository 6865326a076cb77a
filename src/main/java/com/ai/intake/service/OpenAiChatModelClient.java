package com.ai.intake.service;

import com.ai.intake.dto.ChatMessage;
import com.ai.intake.dto.ModelToolCall;
import com.ai.intake.dto.ModelTurn;
import com.ai.intake.flow.ToolSchema;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chat completions with function calling against the OpenAI API.
 */
@Service
public class OpenAiChatModelClient implements ChatModelClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiChatModelClient.class);

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String apiKey;
    private final String model;
    private final String baseUrl;
    private final double temperature;

    public OpenAiChatModelClient(RestTemplateBuilder builder,
                                 @Value("${openai.api-key:}") String apiKey,
                                 @Value("${openai.model:gpt-4o}") String model,
                                 @Value("${openai.base-url:https://api.openai.com}") String baseUrl,
                                 @Value("${openai.temperature:0.2}") double temperature,
                                 @Value("${openai.read-timeout:30s}") Duration readTimeout) {
        this.restTemplate = builder
                .setConnectTimeout(Duration.ofSeconds(10))
                .setReadTimeout(readTimeout)
                .build();
        this.apiKey = apiKey;
        this.model = model;
        this.baseUrl = baseUrl.replaceAll("/$", "");
        this.temperature = temperature;
    }

    @Override
    public ModelTurn complete(List<ChatMessage> context, List<ToolSchema> tools) {
        if (StringUtils.isBlank(apiKey)) {
            throw new ChatModelException("OPENAI_API_KEY is not set");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiKey.trim());
        headers.setContentType(MediaType.APPLICATION_JSON);

        Map<String, Object> body = requestBody(context, tools);
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(
                    baseUrl + "/v1/chat/completions", new HttpEntity<>(body, headers), String.class);
            return parse(mapper.readTree(response.getBody()));
        } catch (RestClientException | JsonProcessingException e) {
            throw new ChatModelException("Chat completion failed", e);
        }
    }

    Map<String, Object> requestBody(List<ChatMessage> context, List<ToolSchema> tools) {
        List<Map<String, Object>> messages = new ArrayList<>();
        for (ChatMessage msg : context) {
            messages.add(toWire(msg));
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("temperature", temperature);
        body.put("messages", messages);
        if (tools != null && !tools.isEmpty()) {
            List<Map<String, Object>> definitions = new ArrayList<>();
            for (ToolSchema tool : tools) {
                definitions.add(tool.toFunctionDefinition());
            }
            body.put("tools", definitions);
            body.put("tool_choice", "auto");
        }
        return body;
    }

    private static Map<String, Object> toWire(ChatMessage msg) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("role", msg.getRole());
        if (msg.getToolCall() != null) {
            ModelToolCall call = msg.getToolCall();
            Map<String, Object> function = new LinkedHashMap<>();
            function.put("name", call.getName());
            function.put("arguments", call.getArgumentsJson());
            Map<String, Object> wireCall = new LinkedHashMap<>();
            wireCall.put("id", call.getId());
            wireCall.put("type", "function");
            wireCall.put("function", function);
            m.put("content", null);
            m.put("tool_calls", List.of(wireCall));
            return m;
        }
        m.put("content", msg.getContent());
        if (msg.getToolCallId() != null) {
            m.put("tool_call_id", msg.getToolCallId());
        }
        return m;
    }

    ModelTurn parse(JsonNode root) {
        JsonNode message = root.path("choices").path(0).path("message");
        if (message.isMissingNode()) {
            throw new ChatModelException("Chat completion had no message: " + root.path("error").path("message").asText(""));
        }
        JsonNode toolCalls = message.path("tool_calls");
        if (toolCalls.isArray() && !toolCalls.isEmpty()) {
            if (toolCalls.size() > 1) {
                log.debug("Model requested {} tool calls; executing the first", toolCalls.size());
            }
            JsonNode call = toolCalls.get(0);
            return ModelTurn.toolCall(new ModelToolCall(
                    call.path("id").asText(""),
                    call.path("function").path("name").asText(""),
                    call.path("function").path("arguments").asText("{}")));
        }
        return ModelTurn.text(message.path("content").asText("").trim());
    }
}
