package io.vaultkit.client;

import io.vaultkit.client.api.sys.WrappingLookupResponse;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A response Vault stored behind a single-use wrapping token, together with the type its
 * payload decodes to.
 *
 * <p>After a successful {@link #unwrap(VaultClient)} this instance refuses further use with
 * {@link ErrorKind#WRAP_INVALID} without contacting Vault. A failed unwrap that did not
 * consume the token may be retried.
 *
 * @param <R> the payload type of the wrapped endpoint
 */
public final class WrappedResponse<R> {

    private final WrapInfo info;
    private final Class<R> responseType;
    private final AtomicBoolean consumed = new AtomicBoolean();

    public WrappedResponse(WrapInfo info, Class<R> responseType) {
        this.info = info;
        this.responseType = responseType;
    }

    public WrapInfo getInfo() {
        return info;
    }

    public Class<R> getResponseType() {
        return responseType;
    }

    /** True once the payload has been unwrapped through this instance. */
    public boolean isConsumed() {
        return consumed.get();
    }

    /**
     * Reads the wrapping token's metadata.
     *
     * @param client the client to send the lookup with
     * @return the metadata
     * @throws VaultException {@code WRAP_INVALID} if the token was unwrapped or has expired
     */
    public WrappingLookupResponse lookup(VaultClient client) throws VaultException {
        requireNotConsumed();
        return client.wrapLookup(info);
    }

    /**
     * Exchanges the wrapping token for the payload.
     *
     * @param client the client to send the unwrap with
     * @return the payload
     * @throws VaultException {@code WRAP_INVALID} if the token was unwrapped or has expired
     */
    public R unwrap(VaultClient client) throws VaultException {
        if (!consumed.compareAndSet(false, true)) {
            throw alreadyConsumed();
        }
        try {
            return client.unwrap(info, responseType);
        } catch (VaultException e) {
            if (e.getKind() != ErrorKind.WRAP_INVALID) {
                consumed.set(false);
            }
            throw e;
        } catch (RuntimeException e) {
            consumed.set(false);
            throw e;
        }
    }

    private void requireNotConsumed() throws VaultException {
        if (consumed.get()) {
            throw alreadyConsumed();
        }
    }

    private VaultException alreadyConsumed() {
        return new VaultException(ErrorKind.WRAP_INVALID,
                "Wrapping token for " + info.creationPath() + " has already been unwrapped");
    }

    @Override
    public String toString() {
        return "WrappedResponse{info=" + info + ", responseType=" + responseType.getSimpleName() + '}';
    }
}
