package io.vaultkit.endpoint;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares a record as a Vault endpoint.
 *
 * <p>The endpoint processor generates a {@code <Record>Endpoint} interface next to the
 * annotated record, which the record is expected to implement:
 * <pre>{@code
 * @VaultEndpoint(path = "{self.mount}/data/{self.path}", response = ReadSecretResponse.class, builder = true)
 * public record ReadSecretRequest(
 *         String mount,
 *         String path,
 *         @VaultEndpoint.Query Integer version) implements ReadSecretRequestEndpoint {
 * }
 * }</pre>
 *
 * <p>Component roles:
 * <ul>
 *   <li>components named by a placeholder in {@link #path()} fill the path</li>
 *   <li>{@link Query} components go to the query string</li>
 *   <li>{@link Skip} components are never sent</li>
 *   <li>a single {@link Body} component is sent as the whole body</li>
 *   <li>everything else is a body field, keyed by its snake_case name or its
 *       Jackson {@code @JsonProperty} value</li>
 * </ul>
 */
@Documented
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.TYPE)
public @interface VaultEndpoint {

    /**
     * Path template relative to the versioned API root. Placeholders are written
     * {@code {self.name}} or {@code {name}} and must name a {@code String} component.
     */
    String path();

    /**
     * HTTP verb, case-insensitive. Empty infers {@code POST} when the record has body
     * fields and {@code GET} otherwise.
     */
    String method() default "";

    /**
     * Type of the envelope's {@code data} block. {@code Void} means no payload.
     */
    Class<?> response() default Void.class;

    /**
     * Whether to also generate a fluent {@code <Record>Builder}.
     */
    boolean builder() default false;

    /**
     * Marks a component that is never sent, neither in the body nor in the query.
     */
    @Documented
    @Retention(RetentionPolicy.SOURCE)
    @Target(ElementType.RECORD_COMPONENT)
    @interface Skip {
    }

    /**
     * Marks a component that is sent as a query parameter.
     */
    @Documented
    @Retention(RetentionPolicy.SOURCE)
    @Target(ElementType.RECORD_COMPONENT)
    @interface Query {

        /**
         * Parameter name; empty uses the snake_case component name.
         */
        String value() default "";
    }

    /**
     * Marks the component whose value is the entire request body.
     */
    @Documented
    @Retention(RetentionPolicy.SOURCE)
    @Target(ElementType.RECORD_COMPONENT)
    @interface Body {
    }
}
