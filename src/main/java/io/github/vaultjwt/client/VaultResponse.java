package io.github.vaultjwt.client;

import java.util.Map;

/**
 * Represents a response from the Vault API.
 *
 * <p>Vault responses typically have this structure:
 * <pre>{@code
 * {
 *   "data": { ... },       // For secret/logical operations
 *   "auth": { ... },       // For authentication operations
 *   "lease_id": "...",
 *   "lease_duration": 3600,
 *   "renewable": true
 * }
 * }</pre>
 *
 * <p>A KV v2 read of a soft-deleted version comes back as a 404 that still
 * carries {@code data.metadata}; such responses are kept with their status.
 */
public class VaultResponse {

    private final int status;
    private final Map<String, Object> data;
    private final Map<String, Object> auth;
    private final String leaseId;
    private final long leaseDuration;
    private final boolean renewable;

    private VaultResponse(int status, Map<String, Object> data, Map<String, Object> auth,
                          String leaseId, long leaseDuration, boolean renewable) {
        this.status = status;
        this.data = data;
        this.auth = auth;
        this.leaseId = leaseId;
        this.leaseDuration = leaseDuration;
        this.renewable = renewable;
    }

    /**
     * Parses a JSON response body into a VaultResponse.
     *
     * @param status the HTTP status code
     * @param json   the JSON response body
     * @return the parsed response; blank or malformed bodies give an empty response
     */
    public static VaultResponse fromJson(int status, String json) {
        Map<String, Object> root = JsonUtil.parseObject(json);
        if (root == null) {
            return new VaultResponse(status, null, null, null, 0, false);
        }

        Map<String, Object> data = asMap(root.get("data"));
        Map<String, Object> auth = asMap(root.get("auth"));
        Object leaseIdObj = root.get("lease_id");
        String leaseId = leaseIdObj instanceof String ? (String) leaseIdObj : null;

        long leaseDuration = 0;
        Object leaseDurationObj = root.get("lease_duration");
        if (leaseDurationObj instanceof Number) {
            leaseDuration = ((Number) leaseDurationObj).longValue();
        }

        boolean renewable = Boolean.TRUE.equals(root.get("renewable"));

        return new VaultResponse(status, data, auth, leaseId, leaseDuration, renewable);
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> asMap(Object value) {
        return value instanceof Map ? (Map<String, Object>) value : null;
    }

    public int getStatus() {
        return status;
    }

    /** Contains response data for secret operations. */
    public Map<String, Object> getData() {
        return data;
    }

    /** Contains authentication info (token, policies) for login and renewal operations. */
    public Map<String, Object> getAuth() {
        return auth;
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

    public String getDataString(String key) {
        if (data == null) {
            return null;
        }
        Object value = data.get(key);
        return value instanceof String ? (String) value : null;
    }

    /**
     * Returns a nested object of {@code data}, e.g. {@code data.data} or
     * {@code data.metadata} in KV v2 responses.
     *
     * @param key the field name
     * @return the nested map, or null if absent or not an object
     */
    public Map<String, Object> getDataMap(String key) {
        if (data == null) {
            return null;
        }
        return asMap(data.get(key));
    }

    public String getAuthString(String key) {
        if (auth == null) {
            return null;
        }
        Object value = auth.get(key);
        return value instanceof String ? (String) value : null;
    }

    public long getAuthLong(String key, long defaultValue) {
        if (auth == null) {
            return defaultValue;
        }
        Object value = auth.get(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return defaultValue;
    }

    public boolean getAuthBoolean(String key) {
        return auth != null && Boolean.TRUE.equals(auth.get(key));
    }
}
