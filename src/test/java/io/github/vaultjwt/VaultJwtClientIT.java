package io.github.vaultjwt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.vaultjwt.client.AuthDeniedException;
import io.github.vaultjwt.client.JsonUtil;
import io.github.vaultjwt.client.SecretNotFoundException;
import io.github.vaultjwt.client.VaultHttpClient;
import io.github.vaultjwt.kv.SecretMetadata;
import io.github.vaultjwt.kv.SecretStore;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.wait.strategy.Wait;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.MountableFile;
import org.testcontainers.vault.VaultContainer;

/**
 * Integration tests for VaultJwtClient using Testcontainers with a real Vault
 * server and a real Keycloak.
 */
@Testcontainers
class VaultJwtClientIT {

    private static final String ROOT_TOKEN = "root-test-token";
    private static final String REALM = "test";
    private static final String CLIENT_ID = "vault-client";
    private static final String CLIENT_SECRET = "25e49180-e71a-4a78-a89b-d3658e857527";
    private static final String ROLE = "billing";
    private static final String VAULT_VERSION = System.getenv("VAULT_TEST_VERSION") != null
            ? System.getenv("VAULT_TEST_VERSION")
            : "1.15";

    @Container
    static VaultContainer<?> vaultContainer = new VaultContainer<>("hashicorp/vault:" + VAULT_VERSION)
            .withVaultToken(ROOT_TOKEN);

    @Container
    static GenericContainer<?> keycloakContainer = new GenericContainer<>("quay.io/keycloak/keycloak:24.0")
            .withEnv("KEYCLOAK_ADMIN", "admin")
            .withEnv("KEYCLOAK_ADMIN_PASSWORD", "admin")
            .withCopyFileToContainer(MountableFile.forClasspathResource("keycloak/test-realm.json"),
                    "/opt/keycloak/data/import/test-realm.json")
            .withCommand("start-dev", "--import-realm", "--http-relative-path=/auth")
            .withExposedPorts(8080)
            .waitingFor(Wait.forHttp("/auth/realms/" + REALM).forPort(8080)
                    .withStartupTimeout(Duration.ofMinutes(3)));

    private static String vaultAddr;
    private static String keycloakAddr;

    private VaultJwtClient client;

    @BeforeAll
    static void configureVault() throws Exception {
        vaultAddr = "http://" + vaultContainer.getHost() + ":" + vaultContainer.getFirstMappedPort();
        keycloakAddr = "http://" + keycloakContainer.getHost() + ":" + keycloakContainer.getMappedPort(8080);

        VaultHttpClient admin = new VaultHttpClient(vaultAddr);
        admin.write("/v1/sys/policies/acl/kv-rw", Map.of("policy",
                "path \"secret/*\" {\n  capabilities = [\"create\", \"read\", \"update\", \"delete\", \"list\"]\n}"),
                ROOT_TOKEN);
        admin.write("/v1/sys/auth/jwt", Map.of("type", "jwt"), ROOT_TOKEN);
        admin.write("/v1/auth/jwt/config",
                Map.of("jwt_validation_pubkeys", List.of(realmPublicKeyPem())), ROOT_TOKEN);

        // Short TTLs so the tests see the token reach its max TTL
        admin.write("/v1/auth/jwt/role/" + ROLE, Map.of(
                "role_type", "jwt",
                "user_claim", "sub",
                "bound_audiences", List.of("vault"),
                "token_policies", List.of("kv-rw"),
                "token_ttl", "10s",
                "token_max_ttl", "30s"), ROOT_TOKEN);
    }

    private static String realmPublicKeyPem() throws Exception {
        HttpResponse<String> response = HttpClient.newHttpClient().send(
                HttpRequest.newBuilder(URI.create(keycloakAddr + "/auth/realms/" + REALM)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
        String key = (String) JsonUtil.parseObject(response.body()).get("public_key");
        return "-----BEGIN PUBLIC KEY-----\n" + key + "\n-----END PUBLIC KEY-----";
    }

    @AfterEach
    void tearDown() {
        if (client != null) {
            client.close();
        }
    }

    private VaultJwtConfig.Builder config() {
        return VaultJwtConfig.builder()
                .vaultAddr(vaultAddr)
                .vaultRole(ROLE)
                .authEndpoint(keycloakAddr)
                .authRealm(REALM)
                .clientId(CLIENT_ID)
                .clientSecret(CLIENT_SECRET)
                .engine("secret")
                .reloginInitialBackoff(Duration.ofMillis(200))
                .reloginMaxBackoff(Duration.ofSeconds(2));
    }

    // --- Secret operations ---

    @Test
    void writeAndRead_roundTrips() throws Exception {
        client = VaultJwtClient.create(config().build());
        Map<String, Object> value = Map.of("username", "billing", "port", 5432, "tags", List.of("a", "b"));

        SecretMetadata metadata = client.secrets().write("it-roundtrip", value);

        assertThat(metadata.getVersion()).isGreaterThanOrEqualTo(1);
        assertThat(client.secrets().read("it-roundtrip")).isEqualTo(value);
    }

    @Test
    void deleteUndeletePurge_followKvSemantics() throws Exception {
        client = VaultJwtClient.create(config().build());
        SecretStore secrets = client.secrets();
        SecretMetadata written = secrets.write("it-lifecycle", Map.of("password", "s3cr3t"));

        secrets.delete("it-lifecycle");
        assertThatThrownBy(() -> secrets.read("it-lifecycle")).isInstanceOf(SecretNotFoundException.class);
        assertThat(secrets.listKeys()).contains("it-lifecycle");
        assertThat(secrets.getMetadata("it-lifecycle").getDeletionTime()).isNotNull();

        secrets.undelete("it-lifecycle", List.of(written.getVersion()));
        assertThat(secrets.read("it-lifecycle")).containsEntry("password", "s3cr3t");

        secrets.purge("it-lifecycle");
        assertThat(secrets.listKeys()).doesNotContain("it-lifecycle");
        assertThatThrownBy(() -> secrets.read("it-lifecycle")).isInstanceOf(SecretNotFoundException.class);
    }

    @Test
    void destroyVersions_keepsOtherVersions() throws Exception {
        client = VaultJwtClient.create(config().build());
        SecretStore secrets = client.secrets();
        SecretMetadata first = secrets.write("it-destroy", Map.of("v", "one"));
        SecretMetadata second = secrets.write("it-destroy", Map.of("v", "two"));

        secrets.destroyVersions("it-destroy", List.of(second.getVersion()));

        assertThat(secrets.readVersion("it-destroy", first.getVersion())).containsEntry("v", "one");
        assertThat(secrets.getMetadata("it-destroy").isDestroyed()).isTrue();
    }

    // --- Session lifecycle ---

    @Test
    void session_survivesMaxTtl() throws Exception {
        client = VaultJwtClient.create(config().renewalIncrementSeconds(10).build());
        String firstToken = client.session().currentToken();
        client.secrets().write("it-continuity", Map.of("v", "before"));

        long deadline = System.nanoTime() + Duration.ofSeconds(90).toNanos();
        while (firstToken.equals(client.session().currentToken()) && System.nanoTime() < deadline) {
            Thread.sleep(500);
        }

        assertThat(client.session().currentToken()).isNotEqualTo(firstToken);
        assertThat(client.secrets().read("it-continuity")).containsEntry("v", "before");
    }

    @Test
    void create_withWrongClientSecret_throwsAuthDenied() {
        assertThatThrownBy(() -> VaultJwtClient.create(config().clientSecret("wrong").build()))
                .isInstanceOf(AuthDeniedException.class);
    }
}
