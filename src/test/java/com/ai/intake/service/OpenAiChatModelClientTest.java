package com.ai.intake.service;

import com.ai.intake.dto.ChatMessage;
import com.ai.intake.dto.ModelToolCall;
import com.ai.intake.dto.ModelTurn;
import com.ai.intake.flow.ToolParameter;
import com.ai.intake.flow.ToolSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.web.client.MockServerRestTemplateCustomizer;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OpenAiChatModelClientTest {

    private static final String COMPLETIONS_URL = "https://llm.example.test/v1/chat/completions";

    private final ToolSchema collectName = ToolSchema.builder()
            .name("collect_name")
            .description("Record customer's name")
            .parameter("name", ToolParameter.requiredString())
            .build();

    private MockRestServiceServer server;
    private OpenAiChatModelClient client;

    @BeforeEach
    void setUp() {
        MockServerRestTemplateCustomizer customizer = new MockServerRestTemplateCustomizer();
        client = new OpenAiChatModelClient(new RestTemplateBuilder(customizer), "sk-test", "gpt-4o",
                "https://llm.example.test/", 0.2, Duration.ofSeconds(5));
        server = customizer.getServer();
    }

    @Test
    void sendsToolsAndReturnsFirstToolCall() {
        server.expect(requestTo(COMPLETIONS_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer sk-test"))
                .andExpect(jsonPath("$.model").value("gpt-4o"))
                .andExpect(jsonPath("$.tool_choice").value("auto"))
                .andExpect(jsonPath("$.tools[0].function.name").value("collect_name"))
                .andExpect(jsonPath("$.tools[0].function.parameters.required[0]").value("name"))
                .andRespond(withSuccess("{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":null,"
                        + "\"tool_calls\":["
                        + "{\"id\":\"call_1\",\"type\":\"function\",\"function\":{\"name\":\"collect_name\",\"arguments\":\"{\\\"name\\\":\\\"Jane\\\"}\"}},"
                        + "{\"id\":\"call_2\",\"type\":\"function\",\"function\":{\"name\":\"collect_name\",\"arguments\":\"{}\"}}"
                        + "]}}]}", MediaType.APPLICATION_JSON));

        ModelTurn turn = client.complete(List.of(ChatMessage.system("Be nice."), ChatMessage.user("I'm Jane")),
                List.of(collectName));

        assertThat(turn.isToolCall()).isTrue();
        assertThat(turn.getToolCall().getId()).isEqualTo("call_1");
        assertThat(turn.getToolCall().getArgumentsJson()).isEqualTo("{\"name\":\"Jane\"}");
        server.verify();
    }

    @Test
    void returnsTrimmedTextReply() {
        server.expect(requestTo(COMPLETIONS_URL))
                .andExpect(jsonPath("$.tools").doesNotExist())
                .andRespond(withSuccess("{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\" Thank you, goodbye! \"}}]}",
                        MediaType.APPLICATION_JSON));

        ModelTurn turn = client.complete(List.of(ChatMessage.system("Say goodbye.")), List.of());

        assertThat(turn.isToolCall()).isFalse();
        assertThat(turn.getText()).isEqualTo("Thank you, goodbye!");
    }

    @Test
    @SuppressWarnings("unchecked")
    void rendersToolCallHistoryInWireFormat() {
        ModelToolCall call = new ModelToolCall("call_9", "collect_name", "{\"name\":\"Jane\"}");
        Map<String, Object> body = client.requestBody(List.of(
                ChatMessage.assistantToolCall(call),
                ChatMessage.toolResult("call_9", "{\"status\":\"success\"}")), List.of(collectName));

        List<Map<String, Object>> messages = (List<Map<String, Object>>) body.get("messages");
        assertThat(messages.get(0)).containsEntry("role", "assistant").containsEntry("content", null);
        List<Map<String, Object>> toolCalls = (List<Map<String, Object>>) messages.get(0).get("tool_calls");
        assertThat(toolCalls.get(0)).containsEntry("id", "call_9").containsEntry("type", "function");
        assertThat(messages.get(1)).containsEntry("role", "tool").containsEntry("tool_call_id", "call_9");
    }

    @Test
    void serverErrorBecomesChatModelException() {
        server.expect(requestTo(COMPLETIONS_URL)).andRespond(withServerError());

        assertThatThrownBy(() -> client.complete(List.of(ChatMessage.user("hi")), List.of()))
                .isInstanceOf(ChatModelException.class);
    }

    @Test
    void missingApiKeyFailsFast() {
        OpenAiChatModelClient unconfigured = new OpenAiChatModelClient(new RestTemplateBuilder(), " ", "gpt-4o",
                "https://llm.example.test", 0.2, Duration.ofSeconds(5));

        assertThatThrownBy(() -> unconfigured.complete(List.of(), List.of()))
                .isInstanceOf(ChatModelException.class);
    }
}
