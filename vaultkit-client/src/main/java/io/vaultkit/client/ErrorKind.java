package io.vaultkit.client;

/**
 * Classification of a {@link VaultException}.
 */
public enum ErrorKind {

    /** Vault answered with an HTTP error status. */
    API,

    /** The request never produced a response: connect, TLS, timeout or cancellation. */
    TRANSPORT,

    /** A request body could not be encoded or a response could not be decoded. */
    SERIALIZATION,

    /** A payload was expected but the response had no body. */
    EMPTY_RESPONSE,

    /** The envelope was present but carried no {@code data} block. */
    EMPTY_DATA,

    /** A wrapping token is expired, unknown or already unwrapped. */
    WRAP_INVALID,

    /** A certificate or key file could not be read. */
    CERT_READ,

    /** A certificate or key file could not be parsed. */
    CERT_PARSE,

    /** Client settings are invalid or the HTTP client could not be created. */
    CLIENT_BUILD,

    /** A login method is not known or not supported. */
    INVALID_LOGIN_METHOD
}
