package io.vaultkit.client;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Represents a successful response from the Vault API, decoded from the standard
 * envelope.
 *
 * <p>Vault responses typically have this structure:
 * <pre>{@code
 * {
 *   "request_id": "...",
 *   "lease_id": "...",
 *   "lease_duration": 3600,
 *   "renewable": true,
 *   "data": { ... },       // For secret/logical operations
 *   "auth": { ... },       // For authentication operations
 *   "wrap_info": { ... },  // When the response was wrapped
 *   "warnings": [ ... ]
 * }
 * }</pre>
 *
 * <p>A 204 or an empty body yields an {@linkplain #isEmpty() empty} response with every
 * field unset.
 *
 * @param <R> the type of the {@code data} block
 */
public final class VaultResponse<R> {

    private final int status;
    private final boolean empty;
    private final String requestId;
    private final String leaseId;
    private final long leaseDuration;
    private final boolean renewable;
    private final R data;
    private final AuthInfo auth;
    private final WrapInfo wrapInfo;
    private final List<String> warnings;

    private VaultResponse(int status, boolean empty, String requestId, String leaseId, long leaseDuration,
                          boolean renewable, R data, AuthInfo auth, WrapInfo wrapInfo, List<String> warnings) {
        this.status = status;
        this.empty = empty;
        this.requestId = requestId;
        this.leaseId = leaseId;
        this.leaseDuration = leaseDuration;
        this.renewable = renewable;
        this.data = data;
        this.auth = auth;
        this.wrapInfo = wrapInfo;
        this.warnings = List.copyOf(warnings);
    }

    /**
     * Returns the response for a 204 or a body-less 2xx.
     */
    public static <R> VaultResponse<R> empty(int status) {
        return new VaultResponse<>(status, true, null, null, 0, false, null, null, null, List.of());
    }

    /**
     * Parses a JSON envelope.
     *
     * @param status   the HTTP status code
     * @param json     the response body
     * @param dataType the type to decode {@code data} as; {@code Void.class} discards it
     * @return the parsed response
     * @throws VaultException {@code SERIALIZATION} if the body is not a JSON object or
     *                        {@code data} does not match {@code dataType}
     */
    public static <R> VaultResponse<R> fromJson(int status, byte[] json, Class<R> dataType) throws VaultException {
        if (json == null || json.length == 0) {
            return empty(status);
        }

        JsonNode root;
        try {
            root = VaultJson.MAPPER.readTree(json);
        } catch (IOException e) {
            throw new VaultException(ErrorKind.SERIALIZATION, "Cannot parse Vault response: " + e.getMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            return empty(status);
        }
        if (!root.isObject()) {
            throw new VaultException(ErrorKind.SERIALIZATION,
                    "Expected a JSON object from Vault but got " + root.getNodeType());
        }

        R data = null;
        JsonNode dataNode = root.path("data");
        if (!dataNode.isMissingNode() && !dataNode.isNull() && dataType != Void.class) {
            data = convert(dataNode, dataType, "data");
        }

        List<String> warnings = new ArrayList<>();
        for (JsonNode warning : root.path("warnings")) {
            warnings.add(warning.asText());
        }

        return new VaultResponse<>(status, false,
                textOrNull(root.get("request_id")),
                textOrNull(root.get("lease_id")),
                root.path("lease_duration").asLong(0),
                root.path("renewable").asBoolean(false),
                data,
                convertOrNull(root.get("auth"), AuthInfo.class, "auth"),
                convertOrNull(root.get("wrap_info"), WrapInfo.class, "wrap_info"),
                warnings);
    }

    private static <T> T convertOrNull(JsonNode node, Class<T> type, String field) throws VaultException {
        if (node == null || node.isNull()) {
            return null;
        }
        return convert(node, type, field);
    }

    private static <T> T convert(JsonNode node, Class<T> type, String field) throws VaultException {
        try {
            return VaultJson.MAPPER.treeToValue(node, type);
        } catch (IOException | IllegalArgumentException e) {
            throw new VaultException(ErrorKind.SERIALIZATION,
                    "Cannot decode '" + field + "' as " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }

    public int getStatus() {
        return status;
    }

    /** True when the response had no body. */
    public boolean isEmpty() {
        return empty;
    }

    /** True when Vault returned a wrapping token instead of the payload. */
    public boolean isWrapped() {
        return wrapInfo != null;
    }

    public String getRequestId() {
        return requestId;
    }

    public String getLeaseId() {
        return leaseId;
    }

    public long getLeaseDuration() {
        return leaseDuration;
    }

    public boolean isRenewable() {
        return renewable;
    }

    /** Contains response data for secret/logical operations, decoded to the endpoint's response type. */
    public R getData() {
        return data;
    }

    /** Contains authentication info (token, policies) for login operations. */
    public AuthInfo getAuth() {
        return auth;
    }

    public WrapInfo getWrapInfo() {
        return wrapInfo;
    }

    public List<String> getWarnings() {
        return warnings;
    }
}
