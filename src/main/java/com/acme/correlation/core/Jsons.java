package com.acme.correlation.core;

import com.fasterxml.jackson.databind.ObjectMapper;

public final class Jsons {
    private static final ObjectMapper M = new ObjectMapper();

    private Jsons() {
    }

    public static String toJson(Object o) {
        try {
            return M.writeValueAsString(o);
        } catch(Exception e) {
            throw new RuntimeException(e);
        }
    }

    public static <T> T fromJson(String json, Class<T> clazz) {
        try {
            return M.readValue(json, clazz);
        } catch(Exception e) {
            throw new RuntimeException(e);
        }
    }
}
