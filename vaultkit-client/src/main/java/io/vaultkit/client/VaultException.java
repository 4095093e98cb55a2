package io.vaultkit.client;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exception thrown when a Vault operation fails.
 *
 * <p>Every failure carries an {@link ErrorKind}. API errors additionally carry the HTTP
 * status code and the messages from Vault's {@code {"errors": [...]}} body; status code 0
 * means no response was received. Certificate errors carry the offending file path.
 */
public class VaultException extends Exception {

    private static final Logger logger = LoggerFactory.getLogger(VaultException.class);

    private static final int MAX_BODY_IN_MESSAGE = 200;

    private final ErrorKind kind;
    private final int httpStatusCode;
    private final List<String> errors;
    private final String path;
    private final String responseBody;
    private final boolean cancelled;

    /**
     * Creates a new VaultException.
     *
     * @param kind    the error classification
     * @param message the error message
     */
    public VaultException(ErrorKind kind, String message) {
        this(kind, message, 0, List.of(), null, null, false, null);
    }

    /**
     * Creates a new VaultException with a cause.
     *
     * @param kind    the error classification
     * @param message the error message
     * @param cause   the underlying cause
     */
    public VaultException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, 0, List.of(), null, null, false, cause);
    }

    private VaultException(ErrorKind kind, String message, int httpStatusCode, List<String> errors,
                           String path, String responseBody, boolean cancelled, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.httpStatusCode = httpStatusCode;
        this.errors = List.copyOf(errors);
        this.path = path;
        this.responseBody = responseBody;
        this.cancelled = cancelled;
    }

    /**
     * Creates a VaultException from an HTTP error response.
     *
     * @param statusCode the HTTP status code
     * @param body       the response body (may contain JSON error details)
     * @return a new API exception with parsed error messages
     */
    public static VaultException fromResponse(int statusCode, String body) {
        List<String> errors = parseErrors(body);
        String message;
        if (!errors.isEmpty()) {
            message = String.join("; ", errors);
        } else if (body == null || body.isBlank()) {
            message = "Vault returned status " + statusCode;
        } else {
            String truncated = body.length() > MAX_BODY_IN_MESSAGE
                    ? body.substring(0, MAX_BODY_IN_MESSAGE) + "..."
                    : body;
            message = "Vault returned status " + statusCode + ": " + truncated;
        }
        return new VaultException(ErrorKind.API, message, statusCode, errors, null,
                errors.isEmpty() ? body : null, false, null);
    }

    /**
     * Creates a transport failure for a request that received no response.
     */
    public static VaultException transport(String message, Throwable cause) {
        return new VaultException(ErrorKind.TRANSPORT, message, 0, List.of(), null, null, false, cause);
    }

    /**
     * Creates a transport failure for a request aborted by thread interruption or
     * an explicit close.
     */
    public static VaultException cancelled(String message, Throwable cause) {
        return new VaultException(ErrorKind.TRANSPORT, message, 0, List.of(), null, null, true, cause);
    }

    /**
     * Creates a failure to read a certificate or key file.
     */
    public static VaultException certRead(String path, Throwable cause) {
        return new VaultException(ErrorKind.CERT_READ, "Cannot read certificate file: " + path,
                0, List.of(), path, null, false, cause);
    }

    /**
     * Creates a failure to parse a certificate or key file.
     */
    public static VaultException certParse(String path, String reason, Throwable cause) {
        return new VaultException(ErrorKind.CERT_PARSE, "Cannot parse certificate file " + path + ": " + reason,
                0, List.of(), path, null, false, cause);
    }

    /**
     * Returns a copy of an API error re-classified as {@link ErrorKind#WRAP_INVALID}.
     */
    static VaultException wrapInvalid(VaultException apiError) {
        return new VaultException(ErrorKind.WRAP_INVALID, apiError.getMessage(), apiError.httpStatusCode,
                apiError.errors, null, apiError.responseBody, false, apiError);
    }

    private static List<String> parseErrors(String body) {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        try {
            // Vault error responses have format: {"errors": ["message1", "message2"]}
            JsonNode errorsNode = VaultJson.MAPPER.readTree(body).path("errors");
            List<String> errors = new ArrayList<>();
            for (JsonNode error : errorsNode) {
                if (error.isTextual() && !error.asText().isBlank()) {
                    errors.add(error.asText());
                }
            }
            return errors;
        } catch (IOException e) {
            logger.debug("Vault error body is not JSON: {}", e.getMessage());
            return List.of();
        }
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Gets the HTTP status code from the Vault response.
     *
     * @return the status code, or 0 if the request failed before receiving a response
     */
    public int getHttpStatusCode() {
        return httpStatusCode;
    }

    /**
     * Gets the messages Vault returned in its {@code errors} array.
     *
     * @return the messages, empty when the body had none or was not JSON
     */
    public List<String> getErrors() {
        return errors;
    }

    /** The certificate or key file path, for {@code CERT_READ} and {@code CERT_PARSE}. */
    public String getPath() {
        return path;
    }

    /** The raw body of an API error whose messages could not be parsed. */
    public String getResponseBody() {
        return responseBody;
    }

    /** Whether a transport error was caused by cancellation. */
    public boolean isCancelled() {
        return cancelled;
    }

    @Override
    public String toString() {
        return "VaultException{" +
                "kind=" + kind +
                ", message='" + getMessage() + '\'' +
                ", httpStatusCode=" + httpStatusCode +
                '}';
    }
}
