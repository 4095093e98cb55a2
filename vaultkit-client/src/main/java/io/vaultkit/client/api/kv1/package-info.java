/**
 * Key/value secrets engine, version 1. Secrets are flat JSON objects stored under a
 * path; writes replace the whole secret and there is no versioning.
 */
package io.vaultkit.client.api.kv1;
