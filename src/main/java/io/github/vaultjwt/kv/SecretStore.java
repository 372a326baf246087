package io.github.vaultjwt.kv;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import io.github.vaultjwt.client.DecodeException;
import io.github.vaultjwt.client.JsonUtil;
import io.github.vaultjwt.client.Preconditions;
import io.github.vaultjwt.client.SchemaException;
import io.github.vaultjwt.client.SecretNotFoundException;
import io.github.vaultjwt.client.UnexpectedStatusException;
import io.github.vaultjwt.client.VaultException;
import io.github.vaultjwt.client.VaultHttpClient;
import io.github.vaultjwt.client.VaultResponse;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Operations on a KV v2 secrets engine.
 *
 * <p>Every operation is a single synchronous request. The token is taken from
 * the supplier at call time and not kept, so a session swapped in by the
 * lifecycle loop is used by the very next call.
 *
 * <p>Paths used, relative to the engine mount:
 * <ul>
 *   <li>{@code data/{key}} - read (optionally {@code ?version=N}), write, soft delete</li>
 *   <li>{@code metadata/{key}} - purge; {@code metadata} - list keys</li>
 *   <li>{@code undelete/{key}}, {@code destroy/{key}} - with {@code {"versions": ["1", ...]}}</li>
 * </ul>
 */
public class SecretStore {

    private static final Logger logger = LoggerFactory.getLogger(SecretStore.class);

    private final VaultHttpClient client;
    private final String engine;
    private final Supplier<String> tokenSupplier;

    /**
     * Creates a store for one KV v2 mount.
     *
     * @param client        the Vault HTTP client
     * @param engine        the mount path of the KV v2 engine, e.g. {@code secret}
     * @param tokenSupplier supplies the token to present on each call
     */
    public SecretStore(VaultHttpClient client, String engine, Supplier<String> tokenSupplier) {
        this.client = client;
        this.engine = trimSlashes(Preconditions.requireNonBlank(engine, "Secret engine"));
        this.tokenSupplier = tokenSupplier;
    }

    private static String trimSlashes(String path) {
        String trimmed = path;
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    // --- Reads ---

    /**
     * Reads the latest version of a secret.
     *
     * @param key the secret key
     * @return the secret data
     * @throws SecretNotFoundException if the key does not exist or its latest version is deleted
     * @throws SchemaException         if the response does not look like a KV v2 read
     * @throws VaultException          on any other failure
     */
    public Map<String, Object> read(String key) throws VaultException {
        return extractData(key, client.read(dataPath(key), token()));
    }

    /**
     * Reads a specific version of a secret.
     *
     * @param key     the secret key
     * @param version the version, starting at 1
     * @return the secret data
     * @throws SecretNotFoundException if the key or version does not exist, or the version is deleted
     * @throws VaultException          on any other failure
     */
    public Map<String, Object> readVersion(String key, int version) throws VaultException {
        requireVersion(version);
        return extractData(key, client.read(dataPath(key) + "?version=" + version, token()));
    }

    /**
     * Reads the latest version of a secret into the given type.
     *
     * @param key  the secret key
     * @param type the target class
     * @param <T>  the target type
     * @return the converted secret
     * @throws DecodeException if the secret does not fit the type
     * @throws VaultException  on any read failure
     */
    public <T> T readInto(String key, Class<T> type) throws VaultException {
        return JsonUtil.convert(read(key), javaType(type));
    }

    /**
     * Reads the latest version of a secret into a generic type.
     *
     * @param key  the secret key
     * @param type the target type reference
     * @param <T>  the target type
     * @return the converted secret
     * @throws DecodeException if the secret does not fit the type
     * @throws VaultException  on any read failure
     */
    public <T> T readInto(String key, TypeReference<T> type) throws VaultException {
        return JsonUtil.convert(read(key), JsonUtil.mapper().getTypeFactory().constructType(type));
    }

    /**
     * Reads a specific version of a secret into the given type.
     *
     * @param key     the secret key
     * @param version the version, starting at 1
     * @param type    the target class
     * @param <T>     the target type
     * @return the converted secret
     * @throws DecodeException if the secret does not fit the type
     * @throws VaultException  on any read failure
     */
    public <T> T readVersionInto(String key, int version, Class<T> type) throws VaultException {
        return JsonUtil.convert(readVersion(key, version), javaType(type));
    }

    /**
     * Returns the metadata of the latest version of a secret. Works for
     * soft-deleted versions too, whose {@link SecretMetadata#getDeletionTime()} is set.
     *
     * @param key the secret key
     * @return the metadata
     * @throws SecretNotFoundException if the key does not exist
     * @throws SchemaException         if the response carries no metadata object
     * @throws VaultException          on any other failure
     */
    public SecretMetadata getMetadata(String key) throws VaultException {
        VaultResponse response = client.read(dataPath(key), token());
        if (response == null) {
            throw notFound(key);
        }
        Map<String, Object> metadata = response.getDataMap("metadata");
        if (metadata == null) {
            throw new SchemaException("Response for '" + key + "' has no metadata object",
                    response.getStatus());
        }
        return SecretMetadata.fromMap(metadata, response.getStatus());
    }

    /**
     * Lists the keys directly under the engine mount, in the order Vault returns
     * them. Sub-paths are listed with a trailing slash.
     *
     * @return the keys, empty if the engine holds no secrets
     * @throws SchemaException if the key list is not a list of strings
     * @throws VaultException  on any other failure
     */
    public List<String> listKeys() throws VaultException {
        VaultResponse response = client.list("/v1/" + engine + "/metadata", token());
        if (response == null || response.getData() == null) {
            return Collections.emptyList();
        }

        Object keys = response.getData().get("keys");
        if (keys == null) {
            return Collections.emptyList();
        }
        if (!(keys instanceof List)) {
            throw new SchemaException("Unexpected type of keys in list response", response.getStatus());
        }

        List<String> result = new ArrayList<>();
        for (Object item : (List<?>) keys) {
            if (!(item instanceof String)) {
                throw new SchemaException("Unexpected key type in list response: " + item,
                        response.getStatus());
            }
            result.add((String) item);
        }
        return result;
    }

    // --- Writes ---

    /**
     * Writes a new version of a secret.
     *
     * @param key  the secret key
     * @param data the secret data
     * @return metadata of the version just created
     * @throws VaultException if the write fails
     */
    public SecretMetadata write(String key, Map<String, Object> data) throws VaultException {
        if (data == null) {
            throw new IllegalArgumentException("Secret data cannot be null");
        }
        VaultResponse response = client.write(dataPath(key), Map.of("data", data), token());
        logger.debug("Wrote secret '{}' to engine '{}'", key, engine);

        if (response.getData() == null) {
            // Older Vault versions answer 204 without a body
            return null;
        }
        return SecretMetadata.fromMap(response.getData(), response.getStatus());
    }

    /**
     * Encodes a value into a map and writes it as a new version of a secret.
     *
     * @param key   the secret key
     * @param value any value that serializes to a JSON object
     * @return metadata of the version just created
     * @throws DecodeException if the value does not serialize to a JSON object
     * @throws VaultException  if the write fails
     */
    public SecretMetadata writeFrom(String key, Object value) throws VaultException {
        return write(key, JsonUtil.toMap(value));
    }

    /**
     * Soft-deletes the latest version of a secret. Reversible with {@link #undelete}.
     *
     * @param key the secret key
     * @throws UnexpectedStatusException if Vault rejects the request
     * @throws VaultException            on any other failure
     */
    public void delete(String key) throws VaultException {
        client.delete(dataPath(key), token());
        logger.debug("Soft-deleted latest version of '{}'", key);
    }

    /**
     * Restores soft-deleted versions of a secret.
     *
     * @param key      the secret key
     * @param versions the versions to restore
     * @throws UnexpectedStatusException if Vault answers with a non-2xx status
     * @throws VaultException            on any other failure
     */
    public void undelete(String key, List<Integer> versions) throws VaultException {
        client.write(enginePath("undelete", key), versionsBody(versions), token());
        logger.debug("Undeleted versions {} of '{}'", versions, key);
    }

    /**
     * Permanently removes the key, its metadata and all of its versions.
     * WARNING: this cannot be undone.
     *
     * @param key the secret key
     * @throws UnexpectedStatusException if Vault answers with a non-2xx status
     * @throws VaultException            on any other failure
     */
    public void purge(String key) throws VaultException {
        client.delete(enginePath("metadata", key), token());
        logger.debug("Purged '{}'", key);
    }

    /**
     * Permanently destroys the data of the given versions. The key stays listed.
     * WARNING: this cannot be undone.
     *
     * @param key      the secret key
     * @param versions the versions to destroy
     * @throws UnexpectedStatusException if Vault answers with a non-2xx status
     * @throws VaultException            on any other failure
     */
    public void destroyVersions(String key, List<Integer> versions) throws VaultException {
        client.write(enginePath("destroy", key), versionsBody(versions), token());
        logger.debug("Destroyed versions {} of '{}'", versions, key);
    }

    // --- Helpers ---

    private String token() {
        return tokenSupplier.get();
    }

    private String dataPath(String key) {
        return enginePath("data", key);
    }

    private String enginePath(String operation, String key) {
        Preconditions.requireNonBlank(key, "Secret key");
        return "/v1/" + engine + "/" + operation + "/" + VaultHttpClient.encodePath(trimSlashes(key));
    }

    private static void requireVersion(int version) {
        if (version < 1) {
            throw new IllegalArgumentException("Secret version must be >= 1, got " + version);
        }
    }

    private static Map<String, Object> versionsBody(List<Integer> versions) {
        if (versions == null || versions.isEmpty()) {
            throw new IllegalArgumentException("At least one version is required");
        }
        List<String> asStrings = new ArrayList<>(versions.size());
        for (Integer version : versions) {
            if (version == null) {
                throw new IllegalArgumentException("Secret versions cannot contain null");
            }
            requireVersion(version);
            asStrings.add(String.valueOf(version));
        }
        return Map.of("versions", asStrings);
    }

    private static JavaType javaType(Class<?> type) {
        return JsonUtil.mapper().getTypeFactory().constructType(type);
    }

    private static SecretNotFoundException notFound(String key) {
        return new SecretNotFoundException(key, "Secret '" + key + "' not found");
    }

    private static Map<String, Object> extractData(String key, VaultResponse response)
            throws VaultException {
        if (response == null) {
            throw notFound(key);
        }
        if (response.getData() == null) {
            throw new SchemaException("Response for '" + key + "' has no data object",
                    response.getStatus());
        }

        Object data = response.getData().get("data");
        if (data == null || response.getStatus() == 404) {
            throw new SecretNotFoundException(key, "Secret '" + key + "' is deleted or destroyed");
        }
        if (!(data instanceof Map)) {
            throw new SchemaException("Unexpected type of secret data for '" + key + "'",
                    response.getStatus());
        }

        @SuppressWarnings("unchecked")
        Map<String, Object> result = (Map<String, Object>) data;
        return result;
    }

    public String getEngine() {
        return engine;
    }
}
