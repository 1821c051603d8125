package org.nowstart.scoring.service.param;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class ParameterSetParser {

    private static final TypeReference<LinkedHashMap<String, Object>> PARAMETER_MAP = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    /**
     * Converts a stored parameter payload into a name-to-value mapping.
     *
     * @param raw a JSON object, or a JSON string holding object text
     * @return the mapping, or {@code null} when the payload is absent, not an object, or malformed
     */
    public Map<String, Object> parse(JsonNode raw) {
        if (raw == null || raw.isNull() || raw.isMissingNode()) {
            return null;
        }
        JsonNode node = raw;
        if (raw.isTextual()) {
            try {
                node = objectMapper.readTree(raw.textValue());
            } catch (JsonProcessingException e) {
                log.debug("event=parameter_parse_failed reason={}", e.getOriginalMessage());
                return null;
            }
        }
        if (node == null || !node.isObject()) {
            return null;
        }
        return objectMapper.convertValue(node, PARAMETER_MAP);
    }
}
