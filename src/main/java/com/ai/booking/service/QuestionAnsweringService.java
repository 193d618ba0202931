package com.ai.booking.service;

import com.ai.booking.component.ChatMessage;
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
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Answers general questions that are not part of a booking flow, using OpenAI Chat Completions.
 * Returns an empty string when no answer could be produced.
 */
@Service
public class QuestionAnsweringService {

    private static final Logger log = LoggerFactory.getLogger(QuestionAnsweringService.class);

    private static final String URL = "https://api.openai.com/v1/chat/completions";
    private static final int HISTORY_LIMIT = 10;

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper = new ObjectMapper();

    @Value("${openai.api-key:}")
    private String openAiApiKey;

    @Value("${openai.model:gpt-4o-mini}")
    private String openAiModel;

    @Value("${openai.assistant-context:}")
    private String assistantContext;

    public QuestionAnsweringService(RestTemplateBuilder builder) {
        this.restTemplate = builder.build();
    }

    public String answer(String sessionId, List<ChatMessage> history) {
        if (StringUtils.isBlank(openAiApiKey)) {
            log.warn("[{}] OPENAI_API_KEY is not set, cannot answer question", sessionId);
            return "";
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(openAiApiKey);
        headers.setContentType(MediaType.APPLICATION_JSON);

        StringBuilder system = new StringBuilder();
        system.append("You are the assistant on a company website. You answer questions briefly and you can book meetings.\n");
        system.append("- Answer in 1-3 short sentences. If you do not know, say so; never make facts up.\n");
        system.append("- Never claim a meeting is booked. Booking happens through a separate flow.\n");
        system.append("- If the user seems interested, offer to book a meeting: they only need to say so.\n");
        if (StringUtils.isNotBlank(assistantContext)) {
            system.append("\nKNOWLEDGE:\n").append(assistantContext).append('\n');
        }

        List<Map<String, String>> messages = new ArrayList<>();
        messages.add(Map.of("role", "system", "content", system.toString()));
        int from = Math.max(0, history.size() - HISTORY_LIMIT);
        for (ChatMessage msg : history.subList(from, history.size())) {
            messages.add(Map.of("role", msg.role(), "content", msg.content()));
        }

        Map<String, Object> body = new HashMap<>();
        body.put("model", openAiModel);
        body.put("temperature", 0.2);
        body.put("messages", messages);

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(URL, new HttpEntity<>(body, headers), String.class);
            JsonNode root = mapper.readTree(response.getBody());
            return root.path("choices").path(0).path("message").path("content").asText("").trim();
        } catch (Exception ex) {
            log.error("[{}] Failed to get answer from language model", sessionId, ex);
            return "";
        }
    }
}
