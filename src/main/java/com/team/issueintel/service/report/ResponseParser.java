package com.team.issueintel.service.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.team.issueintel.model.GeneratedReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses generated report text into {@link GeneratedReport}.
 * Handles JSON inside markdown code blocks as well as a bare JSON object.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ResponseParser {

    private static final Pattern JSON_BLOCK_PATTERN = Pattern.compile("```json\\s*\\n?(.*?)\\n?```", Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    /**
     * @throws IllegalArgumentException if the text holds no parseable JSON object
     */
    public GeneratedReport parseIncidentReport(String aiResponse) {
        if (aiResponse == null || aiResponse.isBlank()) {
            throw new IllegalArgumentException("Empty AI response");
        }
        Map<String, Object> parsed;
        try {
            parsed = objectMapper.readValue(extractJson(aiResponse), new TypeReference<>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("AI response is not valid JSON: " + e.getOriginalMessage(), e);
        }

        return GeneratedReport.builder()
                .title(asString(parsed.get("title")))
                .summary(asString(parsed.get("summary")))
                .impactAnalysis(asString(parsed.get("impactAnalysis")))
                .affectedServices(parseStringList(parsed.get("affectedServices")))
                .timeline(asString(parsed.get("timeline")))
                .currentStatus(asString(parsed.get("currentStatus")))
                .nextSteps(parseStringList(parsed.get("nextSteps")))
                .brandSpecificNotes(asString(parsed.get("brandSpecificNotes")))
                .estimatedResolution(asString(parsed.get("estimatedResolution")))
                .fallback(false)
                .build();
    }

    /**
     * Extract JSON content from a response that may contain markdown code blocks.
     */
    String extractJson(String text) {
        Matcher matcher = JSON_BLOCK_PATTERN.matcher(text);
        if (matcher.find()) {
            return matcher.group(1).trim();
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return text.substring(start, end + 1);
        }
        throw new IllegalArgumentException("No JSON found in AI response");
    }

    private String asString(Object value) {
        if (value == null) return null;
        if (value instanceof List<?> list) {
            return String.join("\n", list.stream().map(String::valueOf).toList());
        }
        return String.valueOf(value);
    }

    private List<String> parseStringList(Object obj) {
        if (obj instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        if (obj instanceof String single && !single.isBlank()) {
            return List.of(single);
        }
        return List.of();
    }
}
