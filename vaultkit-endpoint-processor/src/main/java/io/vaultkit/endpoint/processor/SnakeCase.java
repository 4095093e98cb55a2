package io.vaultkit.endpoint.processor;

/**
 * Converts Java component names to the snake_case keys Vault uses on the wire.
 */
final class SnakeCase {

    private SnakeCase() {
    }

    /**
     * Converts a camelCase name: {@code roleId} becomes {@code role_id}, and runs of
     * capitals stay together, so {@code tokenTTL} becomes {@code token_ttl}.
     *
     * @param name the name to convert
     * @return the snake_case form
     */
    static String toSnakeCase(String name) {
        StringBuilder bld = new StringBuilder();
        boolean prevWasCapitalized = true;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isUpperCase(c)) {
                if (!prevWasCapitalized) {
                    bld.append('_');
                }
                bld.append(Character.toLowerCase(c));
                prevWasCapitalized = true;
            } else {
                bld.append(c);
                prevWasCapitalized = false;
            }
        }
        return bld.toString();
    }
}
