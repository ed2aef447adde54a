package com.netcourier.knowledge.service.vectorstore;

import java.util.Objects;

/**
 * Equality condition on a keyword-indexed payload field.
 */
public record PayloadFilter(String field, Operator operator, String value) {

    public enum Operator {
        EQUALS
    }

    public PayloadFilter {
        Objects.requireNonNull(operator, "operator");
        if (field == null || !PayloadFields.FILTERABLE.contains(field)) {
            throw new IllegalArgumentException("Field is not filterable: " + field);
        }
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Filter value for " + field + " must not be blank");
        }
    }

    public static PayloadFilter equalTo(String field, String value) {
        return new PayloadFilter(field, Operator.EQUALS, value);
    }

    public static PayloadFilter byDocument(String documentId) {
        return equalTo(PayloadFields.DOCUMENT_ID, documentId);
    }

    public static PayloadFilter byCategory(String category) {
        return equalTo(PayloadFields.CATEGORY, category);
    }
}
