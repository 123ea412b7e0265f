package com.secretai.sdk.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.secretai.sdk.config.TimeoutConfig;
import com.secretai.sdk.model.ChatRequest;
import com.secretai.sdk.model.GenerateRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * Non-streaming HTTP/JSON transport for the Ollama-compatible Secret AI API.
 */
public class RestTemplateTransport implements SecretAiTransport {
    private static final Logger logger = LoggerFactory.getLogger(RestTemplateTransport.class);

    static final String GENERATE_PATH = "/api/generate";
    static final String CHAT_PATH = "/api/chat";

    private final String host;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public RestTemplateTransport(String host, RestTemplate restTemplate, ObjectMapper objectMapper) {
        this.host = host;
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Factory for clients: every request carries {@code headers}, the connect and read
     * timeouts of the underlying request factory come from {@link TimeoutConfig}.
     */
    public static TransportFactory factory(ObjectMapper objectMapper) {
        return (host, headers, timeouts) -> {
            logger.info("Creating HTTP transport: host={}, requestTimeout={}, connectTimeout={}",
                    host, timeouts.requestTimeout(), timeouts.connectTimeout());
            RestTemplateBuilder builder = new RestTemplateBuilder()
                    .rootUri(host)
                    .setConnectTimeout(timeouts.connectTimeout())
                    .setReadTimeout(timeouts.requestTimeout())
                    .messageConverters(new MappingJackson2HttpMessageConverter(objectMapper))
                    .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE);
            for (Map.Entry<String, String> header : headers.entrySet()) {
                builder = builder.defaultHeader(header.getKey(), header.getValue());
            }
            return new RestTemplateTransport(host, builder.build(), objectMapper);
        };
    }

    @Override
    public JsonNode generate(GenerateRequest request) {
        return post(GENERATE_PATH, objectMapper.valueToTree(request));
    }

    @Override
    public JsonNode chat(ChatRequest request) {
        return post(CHAT_PATH, objectMapper.valueToTree(request));
    }

    @Override
    public String host() {
        return host;
    }

    RestTemplate restTemplate() {
        return restTemplate;
    }

    private JsonNode post(String path, ObjectNode body) {
        body.put("stream", false);
        logger.debug("POST {}{}", host, path);
        return restTemplate.postForObject(path, body, JsonNode.class);
    }
}
