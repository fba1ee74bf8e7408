package org.energysaving.datapipeline.api.exceptions;

import java.io.PrintWriter;
import java.io.StringWriter;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * User-visible failure: a message, a status code and, in debug mode, the full stack trace.
 * <p>
 * Serialized with Gson; {@code traceback} is omitted from the JSON when null.
 */
public final class ErrorResponse {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private final String message;
    private final int status;
    private final String traceback;

    private ErrorResponse(String message, int status, String traceback) {
        this.message = message;
        this.status = status;
        this.traceback = traceback;
    }

    /**
     * Builds the response for any throwable. Core exceptions keep their status code,
     * everything else is reported as 500.
     *
     * @param error The failure
     * @param debug Whether to attach the stack trace
     * @return Response object
     */
    public static ErrorResponse from(Throwable error, boolean debug) {
        int status = error instanceof DatabaseException ? ((DatabaseException) error).getStatusCode() : 500;
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new ErrorResponse(message, status, debug ? stackTrace(error) : null);
    }

    public String getMessage() {
        return message;
    }

    public int getStatus() {
        return status;
    }

    public String getTraceback() {
        return traceback;
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    private static String stackTrace(Throwable error) {
        StringWriter writer = new StringWriter();
        error.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }
}
