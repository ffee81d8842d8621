package org.Aayush.allocator.external;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import lombok.experimental.UtilityClass;
import org.Aayush.allocator.error.ExternalServiceException;

import java.math.BigDecimal;

/**
 * Strict accessors for service payloads; any shape mismatch is a permanent failure.
 */
@UtilityClass
class ServiceJson {

    static String requireString(JsonObject object, String field, String service) {
        JsonElement value = object.get(field);
        if (value == null || !value.isJsonPrimitive() || !value.getAsJsonPrimitive().isString()) {
            throw malformed(service, "missing string field '" + field + "'");
        }
        return value.getAsString();
    }

    static String optionalString(JsonObject object, String field) {
        JsonElement value = object.get(field);
        if (value == null || !value.isJsonPrimitive()) {
            return null;
        }
        return value.getAsString();
    }

    static JsonArray requireArray(JsonObject object, String field, String service) {
        JsonElement value = object.get(field);
        if (value == null || !value.isJsonArray()) {
            throw malformed(service, "missing array field '" + field + "'");
        }
        return value.getAsJsonArray();
    }

    static JsonObject requireObject(JsonElement element, String what, String service) {
        if (element == null || !element.isJsonObject()) {
            throw malformed(service, what + " is not an object");
        }
        return element.getAsJsonObject();
    }

    static double requireNumber(JsonObject object, String field, String service) {
        JsonElement value = object.get(field);
        if (value == null || !value.isJsonPrimitive() || !value.getAsJsonPrimitive().isNumber()) {
            throw malformed(service, "missing numeric field '" + field + "'");
        }
        return value.getAsDouble();
    }

    /**
     * Reads a numeric cell, mapping JSON null (unreachable) to NaN.
     */
    static double numberOrNaN(JsonElement element, String service) {
        if (element == null || element.isJsonNull()) {
            return Double.NaN;
        }
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
            throw malformed(service, "table cell is not numeric: " + element);
        }
        return element.getAsDouble();
    }

    /**
     * Formats a coordinate without scientific notation for use in request urls.
     */
    static String plain(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    static ExternalServiceException malformed(String service, String message) {
        return new ExternalServiceException(HttpJsonTransport.REASON_MALFORMED_RESPONSE, service, message, false);
    }
}
