package com.gatehouse.backend.global.error;

import org.springframework.web.server.ResponseStatusException;

public class ProblemException extends ResponseStatusException {

    private static final String DEFAULT_TYPE_PREFIX = "urn:problem:gatehouse:";

    private final ProblemKind kind;
    private final String code;
    private final String detail;
    private final String type;

    public ProblemException(ProblemKind kind, String code) {
        this(kind, code, null, null);
    }

    public ProblemException(ProblemKind kind, String code, String detail) {
        this(kind, code, detail, null);
    }

    public ProblemException(ProblemKind kind, String code, String detail, Throwable cause) {
        super(kind.getStatus(), code, cause);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.kind = kind;
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
        String normalized = code.toLowerCase().replaceAll("[^a-z0-9\\-_.:]+", "-");
        this.type = DEFAULT_TYPE_PREFIX + normalized;
    }

    public static ProblemException invalidRequest(String code, String detail) {
        return new ProblemException(ProblemKind.INVALID_REQUEST, code, detail);
    }

    public static ProblemException notFound(String code, String detail) {
        return new ProblemException(ProblemKind.NOT_FOUND, code, detail);
    }

    public static ProblemException forbidden(String code, String detail) {
        return new ProblemException(ProblemKind.FORBIDDEN, code, detail);
    }

    public static ProblemException unauthorized(String code, String detail) {
        return new ProblemException(ProblemKind.UNAUTHORIZED, code, detail);
    }

    public static ProblemException invalidState(String code, String detail) {
        return new ProblemException(ProblemKind.INVALID_STATE, code, detail);
    }

    public static ProblemException internal(String code, String detail) {
        return new ProblemException(ProblemKind.INTERNAL, code, detail);
    }

    public ProblemKind getKind() {
        return kind;
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }

    public String getProblemType() {
        return type;
    }
}
