package com.ai.booking.service;

import com.ai.booking.conversation.ConversationIntent;
import com.ai.booking.conversation.ExtractedFields;
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

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Intent classification and field extraction through OpenAI Chat Completions. Falls back to
 * {@link IntentClassifier} and {@link RuleBasedFieldExtractor} when no API key is set or the
 * call fails.
 */
@Service
public class OpenAiLanguageUnderstandingClient implements LanguageUnderstandingClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiLanguageUnderstandingClient.class);

    private static final String URL = "https://api.openai.com/v1/chat/completions";

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper = new ObjectMapper();
    private final IntentClassifier intentClassifier;
    private final RuleBasedFieldExtractor ruleBasedFieldExtractor;
    private final Clock clock;

    @Value("${openai.api-key:}")
    private String openAiApiKey;

    @Value("${openai.model:gpt-4o-mini}")
    private String openAiModel;

    public OpenAiLanguageUnderstandingClient(RestTemplateBuilder builder, IntentClassifier intentClassifier,
                                             RuleBasedFieldExtractor ruleBasedFieldExtractor, Clock clock) {
        this.restTemplate = builder.build();
        this.intentClassifier = intentClassifier;
        this.ruleBasedFieldExtractor = ruleBasedFieldExtractor;
        this.clock = clock;
    }

    @Override
    public ConversationIntent classifyIntent(String utterance, List<String> recentTurns) {
        if (StringUtils.isBlank(openAiApiKey)) {
            return intentClassifier.classify(utterance);
        }
        String prompt = "Classify the last user message. Output JSON only: {\"intent\": \"booking\"|\"rag\"}.\n" +
                "booking: the user wants to book, schedule or arrange a meeting, call or demo, or is answering booking questions.\n" +
                "rag: any other question (about the company, product, pricing, general info).\n\n" +
                "Conversation:\n" + context(recentTurns) + "\n\nLast user: " + utterance + "\n\nJSON:";
        JsonNode json = complete(prompt);
        if (json == null) {
            return intentClassifier.classify(utterance);
        }
        return "booking".equalsIgnoreCase(json.path("intent").asText(""))
                ? ConversationIntent.BOOKING
                : ConversationIntent.RAG;
    }

    @Override
    public ExtractedFields extractFields(String utterance, List<String> recentTurns) {
        if (StringUtils.isBlank(openAiApiKey)) {
            return ruleBasedFieldExtractor.extract(utterance);
        }
        LocalDate today = LocalDate.now(clock);
        String prompt = "Extract booking details from the last user message. Output JSON only. Today is " +
                today.format(DateTimeFormatter.ISO_LOCAL_DATE) + " (" + today.getDayOfWeek() + ").\n" +
                "name: the user's name if they gave it, else empty.\n" +
                "email: the user's email address if they gave it, else empty.\n" +
                "timePreference: when the user wants to meet, in their own words (e.g. 'tomorrow afternoon', " +
                "'friday at 3pm', '" + today.plusDays(1).format(DateTimeFormatter.ISO_LOCAL_DATE) + " morning'), else empty.\n" +
                "Do not invent values. Do not reuse values from earlier turns.\n\n" +
                "Conversation:\n" + context(recentTurns) + "\n\nLast user: " + utterance + "\n\nJSON:";
        JsonNode json = complete(prompt);
        if (json == null) {
            return ruleBasedFieldExtractor.extract(utterance);
        }
        return new ExtractedFields(
                nullIfEmpty(json.path("name").asText("")),
                nullIfEmpty(json.path("email").asText("")),
                nullIfEmpty(json.path("timePreference").asText("")));
    }

    private JsonNode complete(String prompt) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(openAiApiKey);
        headers.setContentType(MediaType.APPLICATION_JSON);

        Map<String, Object> body = new HashMap<>();
        body.put("model", openAiModel);
        body.put("temperature", 0);
        body.put("messages", List.of(Map.of("role", "user", "content", prompt)));

        try {
            ResponseEntity<String> resp = restTemplate.postForEntity(URL, new HttpEntity<>(body, headers), String.class);
            JsonNode root = mapper.readTree(resp.getBody());
            String content = root.path("choices").path(0).path("message").path("content").asText("");
            int start = content.indexOf('{');
            int end = content.lastIndexOf('}');
            if (start >= 0 && end > start) {
                return mapper.readTree(content.substring(start, end + 1));
            }
            log.warn("Language model returned no JSON object");
        } catch (Exception e) {
            log.warn("Language understanding call failed: {}", e.getMessage());
        }
        return null;
    }

    private static String context(List<String> recentTurns) {
        if (recentTurns == null || recentTurns.isEmpty()) return "";
        return String.join("\n", recentTurns.subList(Math.max(0, recentTurns.size() - 6), recentTurns.size()));
    }

    private static String nullIfEmpty(String s) {
        return StringUtils.isBlank(s) ? null : s.trim();
    }
}
