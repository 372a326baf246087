package io.github.vaultjwt.kv;

import io.github.vaultjwt.client.SchemaException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Metadata of one version of a KV v2 secret.
 *
 * <p>{@link #getDeletionTime()} is null unless the version is soft-deleted.
 */
public final class SecretMetadata {

    // Vault reports "never" as the zero time in some versions
    private static final Instant ZERO_TIME = Instant.parse("0001-01-01T00:00:00Z");

    private final Instant createdTime;
    private final Instant deletionTime;
    private final boolean destroyed;
    private final int version;
    private final Map<String, Object> customMetadata;

    public SecretMetadata(Instant createdTime, Instant deletionTime, boolean destroyed, int version,
                          Map<String, Object> customMetadata) {
        this.createdTime = createdTime;
        this.deletionTime = deletionTime;
        this.destroyed = destroyed;
        this.version = version;
        this.customMetadata = customMetadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(customMetadata))
                : Collections.emptyMap();
    }

    /**
     * Parses the {@code metadata} object of a KV v2 read, or the {@code data}
     * object of a KV v2 write.
     *
     * @param fields the metadata fields
     * @param status HTTP status of the response, for error reporting
     * @return the metadata
     * @throws SchemaException if a field has an unexpected type or format
     */
    @SuppressWarnings("unchecked")
    static SecretMetadata fromMap(Map<String, Object> fields, int status) throws SchemaException {
        Instant createdTime = parseTime(fields.get("created_time"), "created_time", status);
        if (createdTime == null) {
            throw new SchemaException("Secret metadata missing 'created_time'", status);
        }
        Instant deletionTime = parseTime(fields.get("deletion_time"), "deletion_time", status);

        Object versionObj = fields.get("version");
        if (versionObj != null && !(versionObj instanceof Number)) {
            throw new SchemaException("Secret metadata field 'version' is not a number", status);
        }
        int version = versionObj != null ? ((Number) versionObj).intValue() : 0;

        Object customObj = fields.get("custom_metadata");
        if (customObj != null && !(customObj instanceof Map)) {
            throw new SchemaException("Secret metadata field 'custom_metadata' is not an object", status);
        }

        return new SecretMetadata(
                createdTime,
                deletionTime,
                Boolean.TRUE.equals(fields.get("destroyed")),
                version,
                (Map<String, Object>) customObj);
    }

    private static Instant parseTime(Object value, String field, int status) throws SchemaException {
        if (value == null) {
            return null;
        }
        if (!(value instanceof String)) {
            throw new SchemaException("Secret metadata field '" + field + "' is not a string", status);
        }
        String text = (String) value;
        if (text.isBlank()) {
            return null;
        }
        try {
            Instant parsed = Instant.parse(text);
            return ZERO_TIME.equals(parsed) ? null : parsed;
        } catch (DateTimeParseException e) {
            throw new SchemaException(
                    "Secret metadata field '" + field + "' is not an RFC 3339 time: " + text, status, e);
        }
    }

    public Instant getCreatedTime() {
        return createdTime;
    }

    public Instant getDeletionTime() {
        return deletionTime;
    }

    public boolean isDeleted() {
        return deletionTime != null;
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    public int getVersion() {
        return version;
    }

    public Map<String, Object> getCustomMetadata() {
        return customMetadata;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SecretMetadata)) {
            return false;
        }
        SecretMetadata that = (SecretMetadata) o;
        return destroyed == that.destroyed
                && version == that.version
                && Objects.equals(createdTime, that.createdTime)
                && Objects.equals(deletionTime, that.deletionTime)
                && customMetadata.equals(that.customMetadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(createdTime, deletionTime, destroyed, version, customMetadata);
    }

    @Override
    public String toString() {
        return "SecretMetadata{version=" + version + ", createdTime=" + createdTime
                + ", deletionTime=" + deletionTime + ", destroyed=" + destroyed
                + ", customMetadata=" + customMetadata + '}';
    }
}
