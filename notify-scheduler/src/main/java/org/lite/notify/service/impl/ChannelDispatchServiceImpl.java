package org.lite.notify.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.lite.notify.config.SchedulerProperties;
import org.lite.notify.enums.ChannelType;
import org.lite.notify.exception.DeliveryException;
import org.lite.notify.exception.InvalidChannelConfigException;
import org.lite.notify.service.ChannelDispatchService;
import org.lite.notify.util.MessageTemplateRenderer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
public class ChannelDispatchServiceImpl implements ChannelDispatchService {

    private static final int MAX_ERROR_BODY = 500;

    private final WebClient webClient;
    private final MessageTemplateRenderer templateRenderer;
    private final ObjectMapper objectMapper;
    private final SchedulerProperties properties;

    public ChannelDispatchServiceImpl(@Qualifier("dispatchWebClient") WebClient webClient,
                                      MessageTemplateRenderer templateRenderer,
                                      ObjectMapper objectMapper,
                                      SchedulerProperties properties) {
        this.webClient = webClient;
        this.templateRenderer = templateRenderer;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public void send(ChannelType channelType, Map<String, Object> config, String title, String body) {
        Map<String, Object> channelConfig = config != null ? config : Map.of();
        for (String field : channelType.getRequiredFields()) {
            requireValue(channelType, channelConfig, field);
        }

        String renderedTitle = templateRenderer.render(title);
        String renderedBody = templateRenderer.render(body);

        ProviderRequest request = buildRequest(channelType, channelConfig, renderedTitle, renderedBody);
        ProviderResponse response = exchange(channelType, request);
        verifyAcknowledged(channelType, response);

        log.info("[Dispatch] Sent '{}' via {}", renderedTitle, channelType.getValue());
    }

    private ProviderRequest buildRequest(ChannelType channelType, Map<String, Object> config, String title, String body) {
        return switch (channelType) {
            case WEBHOOK -> json(requireValue(channelType, config, "webhook_url"), Map.of(
                    "title", title,
                    "content", body));
            case WECOM_WEBHOOK -> json(requireValue(channelType, config, "webhook_url"), Map.of(
                    "msgtype", "text",
                    "text", Map.of("content", title + "\n" + body)));
            case FEISHU_WEBHOOK -> json(requireValue(channelType, config, "webhook_url"), Map.of(
                    "msg_type", "text",
                    "content", Map.of("text", title + "\n\n" + body)));
            case DINGTALK_WEBHOOK -> json(requireValue(channelType, config, "webhook_url"), Map.of(
                    "msgtype", "text",
                    "text", Map.of("content", title + "\n\n" + body)));
            case PUSHPLUS -> json(properties.getDispatch().getPushplusUrl(), Map.of(
                    "token", requireValue(channelType, config, "token"),
                    "title", title,
                    "content", body,
                    "template", "txt"));
            case SERVERCHAN -> {
                MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
                form.add("title", title);
                form.add("desp", body);
                String url = String.format(properties.getDispatch().getServerchanUrlTemplate(),
                        requireValue(channelType, config, "token"));
                yield new ProviderRequest(url, MediaType.APPLICATION_FORM_URLENCODED, form);
            }
            case SLACK_WEBHOOK -> {
                Map<String, Object> attachment = new LinkedHashMap<>();
                attachment.put("color", optionalValue(config, "color", "#36a64f"));
                attachment.put("title", title);
                attachment.put("text", body);
                attachment.put("footer", "Notify Scheduler");
                yield json(requireValue(channelType, config, "webhook_url"), Map.of("attachments", List.of(attachment)));
            }
        };
    }

    private ProviderResponse exchange(ChannelType channelType, ProviderRequest request) {
        Duration timeout = properties.getDispatch().getTimeout();
        ProviderResponse response;
        try {
            response = webClient.post()
                    .uri(URI.create(request.url()))
                    .contentType(request.contentType())
                    .bodyValue(request.body())
                    .exchangeToMono(clientResponse -> clientResponse.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(responseBody -> new ProviderResponse(clientResponse.statusCode().value(), responseBody)))
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            log.error("[Dispatch] {} request failed: {}", channelType.getValue(), e.getMessage());
            throw new DeliveryException(String.format("%s request failed: %s", channelType.getValue(), rootMessage(e)), e);
        }
        if (response == null) {
            throw new DeliveryException(String.format("%s returned no response", channelType.getValue()));
        }
        return response;
    }

    private void verifyAcknowledged(ChannelType channelType, ProviderResponse response) {
        if (response.status() < 200 || response.status() >= 300) {
            throw new DeliveryException(String.format("%s returned HTTP %d: %s",
                    channelType.getValue(), response.status(), truncate(response.body())));
        }

        String providerError = switch (channelType) {
            case WEBHOOK, SLACK_WEBHOOK -> null;
            case WECOM_WEBHOOK, DINGTALK_WEBHOOK -> providerError(channelType, response, "errcode", 0, "errmsg");
            case FEISHU_WEBHOOK -> providerError(channelType, response, "code", 0, "msg");
            case PUSHPLUS -> providerError(channelType, response, "code", 200, "msg");
            case SERVERCHAN -> providerError(channelType, response, "code", 0, "message");
        };

        if (providerError != null) {
            log.warn("[Dispatch] {} rejected message: {}", channelType.getValue(), providerError);
            throw new DeliveryException(String.format("%s rejected message: %s", channelType.getValue(), providerError));
        }
    }

    /**
     * Reads a provider's JSON acknowledgement. Returns null when the code field is
     * absent or equals the success code, otherwise the provider's message.
     */
    private String providerError(ChannelType channelType, ProviderResponse response,
                                 String codeField, int successCode, String messageField) {
        JsonNode root;
        try {
            root = objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new DeliveryException(String.format("%s returned an unreadable response: %s",
                    channelType.getValue(), truncate(response.body())), e);
        }
        if (root == null || !root.has(codeField)) {
            return null;
        }
        int code = root.get(codeField).asInt(successCode);
        if (code == successCode) {
            return null;
        }
        String message = root.has(messageField) ? root.get(messageField).asText() : truncate(response.body());
        return String.format("[%d] %s", code, message);
    }

    private String requireValue(ChannelType channelType, Map<String, Object> config, String field) {
        Object value = config.get(field);
        if (value == null || String.valueOf(value).isBlank()) {
            throw new InvalidChannelConfigException(channelType.getValue(), field);
        }
        return String.valueOf(value).trim();
    }

    private String optionalValue(Map<String, Object> config, String field, String defaultValue) {
        Object value = config.get(field);
        return value == null || String.valueOf(value).isBlank() ? defaultValue : String.valueOf(value);
    }

    private ProviderRequest json(String url, Map<String, Object> payload) {
        return new ProviderRequest(url, MediaType.APPLICATION_JSON, payload);
    }

    private static String truncate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > MAX_ERROR_BODY ? text.substring(0, MAX_ERROR_BODY) + "..." : text;
    }

    private static String rootMessage(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }

    private record ProviderRequest(String url, MediaType contentType, Object body) {
    }

    private record ProviderResponse(int status, String body) {
    }
}
