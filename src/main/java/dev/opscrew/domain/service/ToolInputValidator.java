/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package dev.opscrew.domain.service;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Validates tool-call arguments against the subset of JSON Schema the tools use:
 * {@code required}, per-property {@code type} and {@code enum}.
 *
 * <p>
 * Unknown properties are accepted. The first violation is reported and names
 * the offending field.
 */
@Component
public class ToolInputValidator {

    private static final String KEY_PROPERTIES = "properties";
    private static final String KEY_REQUIRED = "required";
    private static final String KEY_TYPE = "type";
    private static final String KEY_ENUM = "enum";

    @SuppressWarnings("unchecked")
    public Optional<String> validate(Map<String, Object> schema, Map<String, Object> arguments) {
        if (schema == null) {
            return Optional.empty();
        }
        Map<String, Object> args = arguments != null ? arguments : Map.of();

        Object required = schema.get(KEY_REQUIRED);
        if (required instanceof Collection<?> requiredFields) {
            for (Object field : requiredFields) {
                Object value = args.get(String.valueOf(field));
                if (value == null) {
                    return Optional.of("Missing required field: " + field);
                }
            }
        }

        Object properties = schema.get(KEY_PROPERTIES);
        if (!(properties instanceof Map<?, ?>)) {
            return Optional.empty();
        }
        Map<String, Object> props = (Map<String, Object>) properties;
        for (Map.Entry<String, Object> entry : args.entrySet()) {
            Object propertySchema = props.get(entry.getKey());
            if (!(propertySchema instanceof Map<?, ?>) || entry.getValue() == null) {
                continue;
            }
            Optional<String> error = validateValue(entry.getKey(), (Map<String, Object>) propertySchema,
                    entry.getValue());
            if (error.isPresent()) {
                return error;
            }
        }
        return Optional.empty();
    }

    private Optional<String> validateValue(String field, Map<String, Object> propertySchema, Object value) {
        Object allowed = propertySchema.get(KEY_ENUM);
        if (allowed instanceof List<?> enumValues && !enumValues.isEmpty() && !enumValues.contains(value)) {
            return Optional.of("Invalid value for field '" + field + "': expected one of " + enumValues);
        }

        Object type = propertySchema.get(KEY_TYPE);
        if (!(type instanceof String expected)) {
            return Optional.empty();
        }
        boolean matches = switch (expected) {
        case "string" -> value instanceof String;
        case "integer" -> isIntegral(value);
        case "number" -> value instanceof Number;
        case "boolean" -> value instanceof Boolean;
        case "array" -> value instanceof List<?>;
        case "object" -> value instanceof Map<?, ?>;
        default -> true;
        };
        if (!matches) {
            return Optional.of("Invalid type for field '" + field + "': expected " + expected);
        }
        return Optional.empty();
    }

    private boolean isIntegral(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return true;
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return d == Math.rint(d) && !Double.isInfinite(d);
        }
        return false;
    }
}
