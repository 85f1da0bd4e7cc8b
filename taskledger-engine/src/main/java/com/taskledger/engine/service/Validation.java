package com.taskledger.engine.service;

import com.taskledger.core.exception.ValidationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Input checks shared by the mutation paths. All failures are {@link ValidationException}s.
 */
public final class Validation {

    public static final int MAX_TITLE_LENGTH = 500;
    public static final int MAX_TEXT_LENGTH = 10_000;
    public static final int MAX_ID_LENGTH = 100;
    public static final int MAX_ITEMS = 50;

    private Validation() {
    }

    /**
     * Non-blank, trimmed, at most {@code maxLength} characters.
     */
    public static String requireText(String field, String value, int maxLength) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, "must not be blank");
        }
        return optionalText(field, value, maxLength);
    }

    /**
     * Null passes through; otherwise trimmed and at most {@code maxLength} characters.
     */
    public static String optionalText(String field, String value, int maxLength) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.length() > maxLength) {
            throw new ValidationException(field, "longer than " + maxLength + " characters");
        }
        return trimmed;
    }

    public static String requireId(String field, String value) {
        return requireText(field, value, MAX_ID_LENGTH);
    }

    /**
     * Null passes through; otherwise every item must be a valid id and the items are de-duplicated.
     */
    public static Set<String> optionalIds(String field, Collection<String> values) {
        if (values == null) {
            return null;
        }
        if (values.size() > MAX_ITEMS) {
            throw new ValidationException(field, "more than " + MAX_ITEMS + " items");
        }
        Set<String> ids = new LinkedHashSet<>();
        for (String value : values) {
            ids.add(requireId(field, value));
        }
        return ids;
    }

    /**
     * Like {@link #optionalIds} but null becomes an empty set.
     */
    public static Set<String> ids(String field, Collection<String> values) {
        Set<String> ids = optionalIds(field, values);
        return ids == null ? Set.of() : ids;
    }

    /**
     * Every item must be a valid id and appear once.
     */
    public static List<String> distinctIds(String field, List<String> values) {
        if (values == null) {
            throw new ValidationException(field, "must not be null");
        }
        List<String> ids = new ArrayList<>(values.size());
        Set<String> seen = new LinkedHashSet<>();
        for (String value : values) {
            String id = requireId(field, value);
            if (!seen.add(id)) {
                throw new ValidationException(field, "contains '" + id + "' more than once");
            }
            ids.add(id);
        }
        return ids;
    }
}
