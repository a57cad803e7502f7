package com.chicu.botjobs.common.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Аргументы задачи хранятся как JSON-массив строк.
 * Перед передачей в CommandExecutor массив склеивается через ", "
 * и режется обратно по одиночным пробелам.
 */
@Component
@RequiredArgsConstructor
public class JobArgsCodec {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    /** null → null (поле отсутствует), пустой список → "[]" */
    public String encode(List<String> args) {
        if (args == null) return null;
        try {
            return objectMapper.writeValueAsString(args);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode job args: " + e.getOriginalMessage(), e);
        }
    }

    public List<String> decode(String json) {
        if (json == null || json.isEmpty()) return List.of();
        try {
            List<String> parsed = objectMapper.readValue(json, STRING_LIST);
            return parsed == null ? List.of() : parsed;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed job args: " + json, e);
        }
    }

    /**
     * Токены для исполнителя команды.
     * ["BTC 100", "EUR"] → "BTC 100, EUR" → [BTC, 100,, EUR]
     */
    public List<String> toTokens(String json) {
        List<String> parts = decode(json);
        if (parts.isEmpty()) return List.of();

        String flat = String.join(", ", parts);
        if (flat.isEmpty()) return List.of();

        return List.of(flat.split(" ", -1));
    }
}
