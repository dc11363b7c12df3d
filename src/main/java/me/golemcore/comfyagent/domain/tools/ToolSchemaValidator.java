package me.golemcore.comfyagent.domain.tools;

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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Checks tool arguments against the subset of JSON Schema that tool
 * definitions use: required keys, primitive JSON types and enums.
 */
public final class ToolSchemaValidator {

    private ToolSchemaValidator() {
    }

    /**
     * @return violations in schema order, empty when the arguments are valid
     */
    @SuppressWarnings("unchecked")
    public static List<String> validate(Map<String, Object> schema, Map<String, Object> arguments) {
        List<String> violations = new ArrayList<>();
        if (schema == null) {
            return violations;
        }
        Map<String, Object> args = arguments != null ? arguments : Map.of();

        Object required = schema.get("required");
        if (required instanceof Collection<?> requiredNames) {
            for (Object name : requiredNames) {
                if (args.get(String.valueOf(name)) == null) {
                    violations.add("Missing required parameter: " + name);
                }
            }
        }

        Object properties = schema.get("properties");
        if (!(properties instanceof Map<?, ?> propertyMap)) {
            return violations;
        }
        for (Map.Entry<?, ?> entry : propertyMap.entrySet()) {
            String name = String.valueOf(entry.getKey());
            Object value = args.get(name);
            if (value == null || !(entry.getValue() instanceof Map<?, ?>)) {
                continue;
            }
            Map<String, Object> property = (Map<String, Object>) entry.getValue();
            Object type = property.get("type");
            if (type instanceof String typeName && !matchesType(typeName, value)) {
                violations.add("Parameter '" + name + "' must be of type " + typeName);
                continue;
            }
            Object allowed = property.get("enum");
            if (allowed instanceof Collection<?> allowedValues && !allowedValues.contains(value)) {
                violations.add("Parameter '" + name + "' must be one of " + allowedValues);
            }
        }
        return violations;
    }

    static boolean matchesType(String type, Object value) {
        return switch (type) {
        case "string" -> value instanceof CharSequence;
        case "integer" -> isInteger(value);
        case "number" -> value instanceof Number;
        case "boolean" -> value instanceof Boolean;
        case "object" -> value instanceof Map<?, ?>;
        case "array" -> value instanceof Collection<?>;
        default -> true;
        };
    }

    private static boolean isInteger(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte
                || value instanceof BigInteger) {
            return true;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return !Double.isInfinite(d) && d == Math.rint(d);
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().scale() <= 0;
        }
        return false;
    }
}
