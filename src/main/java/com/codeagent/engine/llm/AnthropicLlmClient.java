package com.codeagent.engine.llm;

import com.codeagent.engine.exception.LlmException;
import com.codeagent.engine.model.ContentBlock;
import com.codeagent.engine.model.FinishReason;
import com.codeagent.engine.model.LlmResponse;
import com.codeagent.engine.model.Message;
import com.codeagent.engine.model.Usage;
import com.codeagent.engine.tool.ToolDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Anthropic Messages API client.
 *
 * System messages are lifted into the top-level {@code system} field, tool
 * results travel as {@code tool_result} blocks in a user turn, and consecutive
 * turns of the same role are merged since the API requires alternation.
 */
@Slf4j
public class AnthropicLlmClient implements LlmClient {

    static final String API_VERSION = "2023-06-01";

    private final LlmProviderProperties props;
    private final RestClient restClient;

    public AnthropicLlmClient(LlmProviderProperties props, RestClient.Builder restClientBuilder) {
        if (props.getApiKey() == null || props.getApiKey().isBlank()) {
            throw new LlmException(LlmException.Kind.AUTHENTICATION, "No API key found for anthropic");
        }
        this.props = props;

        RestClient.Builder builder = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Content-Type", "application/json")
                .defaultHeader("x-api-key", props.getApiKey())
                .defaultHeader("anthropic-version", API_VERSION);
        props.getHeaders().forEach(builder::defaultHeader);
        this.restClient = builder.build();
    }

    @Override
    public LlmResponse chatCompletion(List<Message> messages, List<ToolDefinition> tools, ChatOptions options) {
        Map<String, Object> requestBody = buildRequestBody(messages, tools, options);

        log.debug("Sending {} messages to anthropic [model={}]", messages.size(), props.getModel());

        Map<String, Object> response;
        try {
            response = restClient.post()
                    .uri("/v1/messages")
                    .body(requestBody)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        int status = res.getStatusCode().value();
                        log.error("anthropic error [{}]: {}", status, body);
                        if (status == 401 || status == 403) {
                            throw new LlmException(LlmException.Kind.AUTHENTICATION,
                                    "anthropic rejected the API key [" + status + "]: " + body);
                        }
                        throw LlmException.apiError(status, body);
                    })
                    .body(new ParameterizedTypeReference<>() {});
        } catch (ResourceAccessException e) {
            throw new LlmException(LlmException.Kind.NETWORK, "anthropic unreachable: " + e.getMessage(), e);
        } catch (LlmException e) {
            throw e;
        } catch (RestClientException e) {
            throw new LlmException(LlmException.Kind.NETWORK, "Failed to parse response: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new LlmException(LlmException.Kind.NETWORK, "anthropic returned an empty body");
        }
        return parseResponse(response);
    }

    @Override
    public String modelName() {
        return props.getModel();
    }

    @Override
    public String providerName() {
        return "anthropic";
    }

    Map<String, Object> buildRequestBody(List<Message> messages, List<ToolDefinition> tools, ChatOptions options) {
        String system = messages.stream()
                .filter(m -> m.getRole() == Message.Role.system)
                .map(m -> m.textContent().orElse(""))
                .collect(Collectors.joining("\n\n"));

        List<Map<String, Object>> turns = new ArrayList<>();
        for (Message msg : messages) {
            if (msg.getRole() == Message.Role.system) continue;

            String role = msg.getRole() == Message.Role.assistant ? "assistant" : "user";
            List<Map<String, Object>> blocks = formatBlocks(msg);
            if (blocks.isEmpty()) continue;

            Map<String, Object> last = turns.isEmpty() ? null : turns.get(turns.size() - 1);
            if (last != null && role.equals(last.get("role"))) {
                @SuppressWarnings("unchecked")
                List<Map<String, Object>> lastBlocks = (List<Map<String, Object>>) last.get("content");
                lastBlocks.addAll(blocks);
            } else {
                Map<String, Object> turn = new HashMap<>();
                turn.put("role", role);
                turn.put("content", new ArrayList<>(blocks));
                turns.add(turn);
            }
        }

        Map<String, Object> body = new HashMap<>();
        body.put("model", props.getModel());
        body.put("max_tokens", options != null && options.getMaxTokens() != null
                ? options.getMaxTokens() : props.getMaxTokens());
        body.put("temperature", options != null && options.getTemperature() != null
                ? options.getTemperature() : props.getTemperature());
        body.put("messages", turns);
        if (!system.isBlank()) {
            body.put("system", system);
        }
        if (options != null && options.getStop() != null && !options.getStop().isEmpty()) {
            body.put("stop_sequences", options.getStop());
        }
        if (tools != null && !tools.isEmpty()) {
            body.put("tools", tools.stream().map(ToolDefinition::toAnthropicSchema).toList());
        }
        return body;
    }

    private List<Map<String, Object>> formatBlocks(Message msg) {
        if (msg.getContent() == null) return List.of();
        if (msg.getContent().isText()) {
            String text = msg.getContent().text();
            return text.isEmpty() ? List.of() : List.of(textBlock(text));
        }

        List<Map<String, Object>> out = new ArrayList<>();
        for (ContentBlock block : msg.getContent().blocks()) {
            if (block instanceof ContentBlock.Text text) {
                out.add(textBlock(text.getText()));
            } else if (block instanceof ContentBlock.Image image) {
                Map<String, Object> source = new LinkedHashMap<>();
                source.put("type", "base64");
                source.put("media_type", image.getMimeType());
                source.put("data", image.getData());
                out.add(Map.of("type", "image", "source", source));
            } else if (block instanceof ContentBlock.ToolUse toolUse) {
                Map<String, Object> m = new LinkedHashMap<>();
                m.put("type", "tool_use");
                m.put("id", toolUse.getId());
                m.put("name", toolUse.getName());
                m.put("input", toolUse.getInput() != null ? toolUse.getInput() : Map.of());
                out.add(m);
            } else if (block instanceof ContentBlock.ToolResult result) {
                Map<String, Object> m = new LinkedHashMap<>();
                m.put("type", "tool_result");
                m.put("tool_use_id", result.getToolUseId());
                m.put("content", result.getContent() != null ? result.getContent() : "");
                m.put("is_error", Boolean.TRUE.equals(result.getIsError()));
                out.add(m);
            }
        }
        return out;
    }

    private static Map<String, Object> textBlock(String text) {
        return Map.of("type", "text", "text", text);
    }

    @SuppressWarnings("unchecked")
    LlmResponse parseResponse(Map<String, Object> response) {
        List<Map<String, Object>> content = (List<Map<String, Object>>) response.get("content");
        if (content == null) {
            throw new LlmException(LlmException.Kind.NETWORK, "anthropic returned no content in response");
        }

        List<ContentBlock> blocks = new ArrayList<>();
        for (Map<String, Object> block : content) {
            String type = (String) block.get("type");
            if ("text".equals(type)) {
                blocks.add(ContentBlock.text((String) block.get("text")));
            } else if ("tool_use".equals(type)) {
                blocks.add(ContentBlock.toolUse(
                        (String) block.get("id"),
                        (String) block.get("name"),
                        (Map<String, Object>) block.getOrDefault("input", Map.of())));
            } else {
                log.debug("Skipping unsupported anthropic block type: {}", type);
            }
        }

        Usage usage = null;
        Map<String, Object> usageMap = (Map<String, Object>) response.get("usage");
        if (usageMap != null) {
            int input = ((Number) usageMap.getOrDefault("input_tokens", 0)).intValue();
            int output = ((Number) usageMap.getOrDefault("output_tokens", 0)).intValue();
            usage = Usage.of(input, output);
        }

        boolean onlyText = blocks.stream().allMatch(ContentBlock.Text.class::isInstance);
        Message assistant;
        if (onlyText) {
            String text = blocks.stream()
                    .map(b -> ((ContentBlock.Text) b).getText())
                    .collect(Collectors.joining("\n"));
            assistant = Message.assistant(text);
        } else {
            assistant = Message.assistant(blocks);
        }

        return LlmResponse.builder()
                .message(assistant)
                .usage(usage)
                .model((String) response.getOrDefault("model", props.getModel()))
                .finishReason(FinishReason.fromProvider((String) response.get("stop_reason")))
                .build();
    }
}
