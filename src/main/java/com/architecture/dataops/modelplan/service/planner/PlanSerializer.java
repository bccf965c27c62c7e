package com.architecture.dataops.modelplan.service.planner;

import com.architecture.dataops.modelplan.dto.plan.Plan;
import com.architecture.dataops.modelplan.exception.PlanSerializationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes plans as canonical JSON.
 *
 * Output uses snake_case keys in alphabetical order, ISO-8601 dates and two-space
 * indentation, so identical plans always serialize to identical bytes.
 */
@Service
@Slf4j
public class PlanSerializer {

    private final ObjectMapper objectMapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    public String serialize(Plan plan) {
        try {
            return objectMapper.writeValueAsString(plan);
        } catch (JsonProcessingException e) {
            throw new PlanSerializationException("Failed to serialize plan " + plan.getPlanId(), e);
        }
    }

    public Plan deserialize(String json) {
        try {
            return objectMapper.readValue(json, Plan.class);
        } catch (JsonProcessingException e) {
            throw new PlanSerializationException("Failed to deserialize plan: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Structural checks on a serialized plan.
     *
     * @return human-readable problems, empty when the plan is well formed
     */
    public List<String> validatePlanSchema(String json) {
        List<String> errors = new ArrayList<>();

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            errors.add("Malformed JSON: " + e.getOriginalMessage());
            return errors;
        }
        if (root == null || !root.isObject()) {
            errors.add("Plan must be a JSON object");
            return errors;
        }

        requireText(root, "plan_id", "plan_id", errors);

        JsonNode summary = root.get("summary");
        if (summary != null && summary.isObject()) {
            requireNonNegative(summary, "estimated_cost_usd", "summary.estimated_cost_usd", errors);
        }

        JsonNode steps = root.get("steps");
        if (steps == null || !steps.isArray()) {
            errors.add("Missing required field: steps");
            return errors;
        }

        for (int i = 0; i < steps.size(); i++) {
            JsonNode step = steps.get(i);
            String prefix = "steps[" + i + "]";
            if (!step.isObject()) {
                errors.add(prefix + " must be an object");
                continue;
            }
            requireText(step, "step_id", prefix + ".step_id", errors);
            requireText(step, "model", prefix + ".model", errors);
            requireNonNegative(step, "parallel_group", prefix + ".parallel_group", errors);
            requireNonNegative(step, "estimated_compute_seconds", prefix + ".estimated_compute_seconds", errors);
            requireNonNegative(step, "estimated_cost_usd", prefix + ".estimated_cost_usd", errors);
            validateRange(step.get("input_range"), prefix + ".input_range", errors);
        }

        if (!errors.isEmpty()) {
            log.debug("Plan failed schema validation with {} error(s)", errors.size());
        }
        return errors;
    }

    private void requireText(JsonNode node, String field, String path, List<String> errors) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            errors.add("Missing required field: " + path);
        }
    }

    private void requireNonNegative(JsonNode node, String field, String path, List<String> errors) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return;
        }
        if (!value.isNumber()) {
            errors.add(path + " must be a number");
        } else if (value.asDouble() < 0) {
            errors.add(path + " must be >= 0, got " + value.asText());
        }
    }

    private void validateRange(JsonNode range, String path, List<String> errors) {
        if (range == null || range.isNull()) {
            return;
        }
        try {
            LocalDate start = LocalDate.parse(range.path("start").asText());
            LocalDate end = LocalDate.parse(range.path("end").asText());
            if (start.isAfter(end)) {
                errors.add(path + " start " + start + " is after end " + end);
            }
        } catch (DateTimeParseException e) {
            errors.add(path + " has an invalid date: " + e.getParsedString());
        }
    }
}
