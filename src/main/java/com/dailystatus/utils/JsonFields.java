package com.dailystatus.utils;

import com.dailystatus.core.ContractViolationException;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Field access on API payloads. A missing required field means the upstream
 * response shape changed, which is reported as a contract violation.
 */
public final class JsonFields {

    private JsonFields() {
    }

    public static String requireString(JSONObject obj, String key) {
        Object value = obj.opt(key);
        if (value == null || JSONObject.NULL.equals(value)) {
            throw new ContractViolationException("missing field '" + key + "'");
        }
        return value.toString();
    }

    /**
     * Returns null for absent or JSON-null fields.
     */
    public static String optText(JSONObject obj, String key) {
        Object value = obj.opt(key);
        if (value == null || JSONObject.NULL.equals(value)) {
            return null;
        }
        return value.toString();
    }

    public static long requireLong(JSONObject obj, String key) {
        String raw = requireString(obj, key);
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new ContractViolationException("field '" + key + "' is not an integer: " + raw, e);
        }
    }

    public static JSONObject requireObject(JSONObject obj, String key) {
        JSONObject value = obj.optJSONObject(key);
        if (value == null) {
            throw new ContractViolationException("missing object '" + key + "'");
        }
        return value;
    }

    /**
     * Objects of the named array; an absent array is treated as empty.
     */
    public static List<JSONObject> objects(JSONObject obj, String key) {
        JSONArray arr = obj.optJSONArray(key);
        if (arr == null || arr.isEmpty()) {
            return List.of();
        }
        List<JSONObject> out = new ArrayList<>(arr.length());
        for (int i = 0; i < arr.length(); i++) {
            JSONObject item = arr.optJSONObject(i);
            if (item == null) {
                throw new ContractViolationException("non-object element in '" + key + "' at index " + i);
            }
            out.add(item);
        }
        return out;
    }
}
