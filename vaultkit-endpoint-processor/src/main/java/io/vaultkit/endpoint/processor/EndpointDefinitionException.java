package io.vaultkit.endpoint.processor;

import javax.lang.model.element.Element;

/**
 * Raised when a {@code @VaultEndpoint} declaration cannot be turned into an endpoint.
 * The processor reports it as a compile error against {@link #getElement()}.
 */
class EndpointDefinitionException extends Exception {

    private final transient Element element;

    EndpointDefinitionException(String message, Element element) {
        super(message);
        this.element = element;
    }

    Element getElement() {
        return element;
    }
}
