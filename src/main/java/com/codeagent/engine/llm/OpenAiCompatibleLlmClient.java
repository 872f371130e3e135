package com.codeagent.engine.llm;

import com.codeagent.engine.exception.LlmException;
import com.codeagent.engine.model.ContentBlock;
import com.codeagent.engine.model.FinishReason;
import com.codeagent.engine.model.LlmResponse;
import com.codeagent.engine.model.Message;
import com.codeagent.engine.model.Usage;
import com.codeagent.engine.tool.ToolDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible chat completions client. Serves OpenAI, Azure OpenAI and any
 * gateway speaking the same dialect (Groq, vLLM, Ollama).
 *
 * Error mapping:
 *
 * | Response            | LlmException kind               |
 * |---------------------|---------------------------------|
 * | 401 / 403           | AUTHENTICATION                  |
 * | other 4xx / 5xx     | API_ERROR with status and body  |
 * | I/O failure         | NETWORK                         |
 * | unreadable body     | NETWORK                         |
 */
@Slf4j
public class OpenAiCompatibleLlmClient implements LlmClient {

    private final LlmProviderProperties props;
    private final ObjectMapper objectMapper;
    private final String providerName;
    private final RestClient restClient;

    public OpenAiCompatibleLlmClient(LlmProviderProperties props,
                                     ObjectMapper objectMapper,
                                     String providerName,
                                     RestClient.Builder restClientBuilder) {
        if (props.getApiKey() == null || props.getApiKey().isBlank()) {
            throw new LlmException(LlmException.Kind.AUTHENTICATION,
                    "No API key found for " + providerName);
        }
        this.props = props;
        this.objectMapper = objectMapper;
        this.providerName = providerName;

        RestClient.Builder builder = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Content-Type", "application/json");
        if (props.getProtocol() == Protocol.AZURE_OPENAI) {
            builder.defaultHeader("api-key", props.getApiKey());
        } else {
            builder.defaultHeader("Authorization", "Bearer " + props.getApiKey());
        }
        props.getHeaders().forEach(builder::defaultHeader);
        this.restClient = builder.build();
    }

    @Override
    public LlmResponse chatCompletion(List<Message> messages, List<ToolDefinition> tools, ChatOptions options) {
        Map<String, Object> requestBody = buildRequestBody(messages, tools, options);

        log.debug("Sending {} messages to {} [model={}]", messages.size(), providerName, props.getModel());

        Map<String, Object> response;
        try {
            response = restClient.post()
                    .uri("/chat/completions")
                    .body(requestBody)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        int status = res.getStatusCode().value();
                        log.error("{} error [{}]: {}", providerName, status, body);
                        if (status == 401 || status == 403) {
                            throw new LlmException(LlmException.Kind.AUTHENTICATION,
                                    providerName + " rejected the API key [" + status + "]: " + body);
                        }
                        throw LlmException.apiError(status, body);
                    })
                    .body(new ParameterizedTypeReference<>() {});
        } catch (ResourceAccessException e) {
            throw new LlmException(LlmException.Kind.NETWORK, providerName + " unreachable: " + e.getMessage(), e);
        } catch (LlmException e) {
            throw e;
        } catch (RestClientException e) {
            throw new LlmException(LlmException.Kind.NETWORK, "Failed to parse response: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new LlmException(LlmException.Kind.NETWORK, providerName + " returned an empty body");
        }
        return parseResponse(response);
    }

    @Override
    public String modelName() {
        return props.getModel();
    }

    @Override
    public String providerName() {
        return providerName;
    }

    private Map<String, Object> buildRequestBody(List<Message> messages, List<ToolDefinition> tools,
                                                 ChatOptions options) {
        List<Map<String, Object>> formattedMessages = messages.stream()
                .flatMap(m -> formatMessage(m).stream())
                .toList();

        Map<String, Object> body = new HashMap<>();
        body.put("model", props.getModel());
        body.put("max_tokens", options != null && options.getMaxTokens() != null
                ? options.getMaxTokens() : props.getMaxTokens());
        body.put("temperature", options != null && options.getTemperature() != null
                ? options.getTemperature() : props.getTemperature());
        body.put("messages", formattedMessages);
        if (options != null && options.getStop() != null && !options.getStop().isEmpty()) {
            body.put("stop", options.getStop());
        }

        if (tools != null && !tools.isEmpty()) {
            body.put("tools", tools.stream().map(ToolDefinition::toOpenAiSchema).toList());
            body.put("tool_choice", "auto");
        }
        return body;
    }

    /**
     * One conversation message can expand into several wire messages: each
     * tool_result block becomes its own "tool" message.
     */
    private List<Map<String, Object>> formatMessage(Message msg) {
        return switch (msg.getRole()) {
            case tool -> msg.toolResults().stream()
                    .map(r -> {
                        Map<String, Object> m = new HashMap<>();
                        m.put("role", "tool");
                        m.put("tool_call_id", r.getToolUseId());
                        m.put("content", r.getContent() != null ? r.getContent() : "");
                        return m;
                    })
                    .toList();
            case assistant -> List.of(formatAssistant(msg));
            default -> List.of(formatPlain(msg));
        };
    }

    private Map<String, Object> formatAssistant(Message msg) {
        Map<String, Object> m = new HashMap<>();
        m.put("role", "assistant");
        // content may be null when the assistant only made tool calls
        m.put("content", msg.textContent().orElse(null));
        if (msg.hasToolUse()) {
            m.put("tool_calls", msg.toolUses().stream()
                    .map(tu -> {
                        Map<String, Object> fn = new HashMap<>();
                        fn.put("name", tu.getName());
                        fn.put("arguments", writeArguments(tu.getInput()));

                        Map<String, Object> tc = new HashMap<>();
                        tc.put("id", tu.getId());
                        tc.put("type", "function");
                        tc.put("function", fn);
                        return tc;
                    })
                    .toList());
        }
        return m;
    }

    private Map<String, Object> formatPlain(Message msg) {
        Map<String, Object> m = new HashMap<>();
        m.put("role", msg.getRole().name());

        List<ContentBlock> blocks = msg.getContent() != null ? msg.getContent().blocks() : List.of();
        boolean hasImage = blocks.stream().anyMatch(ContentBlock.Image.class::isInstance);
        if (!hasImage) {
            m.put("content", msg.textContent().orElse(""));
            return m;
        }

        List<Map<String, Object>> parts = new ArrayList<>();
        for (ContentBlock block : blocks) {
            if (block instanceof ContentBlock.Text text) {
                parts.add(Map.of("type", "text", "text", text.getText()));
            } else if (block instanceof ContentBlock.Image image) {
                String url = "data:" + image.getMimeType() + ";base64," + image.getData();
                parts.add(Map.of("type", "image_url", "image_url", Map.of("url", url)));
            }
        }
        m.put("content", parts);
        return m;
    }

    private String writeArguments(Map<String, Object> input) {
        try {
            return objectMapper.writeValueAsString(input != null ? input : Map.of());
        } catch (JsonProcessingException e) {
            throw new LlmException(LlmException.Kind.INVALID_REQUEST, "Failed to serialize tool arguments", e);
        }
    }

    @SuppressWarnings("unchecked")
    private LlmResponse parseResponse(Map<String, Object> response) {
        List<Map<String, Object>> choices = (List<Map<String, Object>>) response.get("choices");
        if (choices == null || choices.isEmpty()) {
            throw new LlmException(LlmException.Kind.NETWORK, providerName + " returned no choices in response");
        }

        Usage usage = null;
        Map<String, Object> usageMap = (Map<String, Object>) response.get("usage");
        if (usageMap != null) {
            int prompt = ((Number) usageMap.getOrDefault("prompt_tokens", 0)).intValue();
            int completion = ((Number) usageMap.getOrDefault("completion_tokens", 0)).intValue();
            int total = ((Number) usageMap.getOrDefault("total_tokens", prompt + completion)).intValue();
            usage = new Usage(prompt, completion, total);
            log.debug("Token usage: prompt={} completion={}", prompt, completion);
        }

        Map<String, Object> choice = choices.get(0);
        Map<String, Object> message = (Map<String, Object>) choice.get("message");
        String finishReason = (String) choice.get("finish_reason");
        log.debug("{} finish_reason: {}", providerName, finishReason);

        String content = message != null ? (String) message.get("content") : null;
        List<Map<String, Object>> toolCalls = message != null
                ? (List<Map<String, Object>>) message.get("tool_calls") : null;

        Message assistant;
        if (toolCalls == null || toolCalls.isEmpty()) {
            assistant = Message.assistant(content != null ? content : "");
        } else {
            List<ContentBlock> blocks = new ArrayList<>();
            if (content != null && !content.isBlank()) {
                blocks.add(ContentBlock.text(content));
            }
            for (Map<String, Object> tc : toolCalls) {
                Map<String, Object> function = (Map<String, Object>) tc.get("function");
                blocks.add(ContentBlock.toolUse(
                        (String) tc.get("id"),
                        (String) function.get("name"),
                        readArguments((String) function.get("arguments"))));
            }
            assistant = Message.assistant(blocks);
        }

        return LlmResponse.builder()
                .message(assistant)
                .usage(usage)
                .model((String) response.getOrDefault("model", props.getModel()))
                .finishReason(FinishReason.fromProvider(finishReason))
                .build();
    }

    private Map<String, Object> readArguments(String json) {
        if (json == null || json.isBlank()) return Map.of();
        try {
            return objectMapper.readValue(json, new TypeReference<>() {});
        } catch (JsonProcessingException e) {
            throw new LlmException(LlmException.Kind.NETWORK, "Failed to parse tool arguments: " + json, e);
        }
    }
}
