package com.aigreentick.services.setupwizard.client;

import com.aigreentick.services.setupwizard.constants.ServiceStatus;
import com.aigreentick.services.setupwizard.service.model.ServiceCheckResult;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;

/**
 * Connectivity probes for the primary database and the optional external services.
 *
 * Every probe is best-effort: it never throws, a failure is reported as an
 * ERROR result with the cause in the message. Probes run against the address
 * the operator entered, so each opens and closes its own connection.
 */
@Component
@Slf4j
public class ServiceProbeClient {

    private static final ParameterizedTypeReference<Map<String, Object>> MAP_TYPE =
            new ParameterizedTypeReference<>() {};

    private final WebClient webClient;
    private final DataSource dataSource;

    public ServiceProbeClient(@Qualifier("probeWebClient") WebClient webClient, DataSource dataSource) {
        this.webClient = webClient;
        this.dataSource = dataSource;
    }

    public record PostgresqlTarget(String host, int port, String database, String user, String password,
                                   int timeoutSeconds) {
    }

    public record RedisTarget(String host, int port, String password, int timeoutMillis) {
    }

    public record AiServiceTarget(String url, String apiKey, int timeoutSeconds) {
    }

    // ════════════════════════════════════════════════════════════
    // PRIMARY DATABASE
    // ════════════════════════════════════════════════════════════

    /**
     * The application's own database. Connected but without the settings
     * table is a warning: the schema has not been created yet.
     */
    public ServiceCheckResult checkPrimaryDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String version = metaData.getDatabaseProductName() + " " + metaData.getDatabaseProductVersion();
            if (!hasTable(metaData, "settings")) {
                return new ServiceCheckResult(ServiceStatus.WARNING,
                        "Database connected but core tables not found", version);
            }
            return ServiceCheckResult.ok("Database connection successful", version);
        } catch (SQLException ex) {
            log.warn("Primary database probe failed: {}", ex.getMessage());
            return ServiceCheckResult.error("Database connection failed: " + ex.getMessage());
        }
    }

    private boolean hasTable(DatabaseMetaData metaData, String table) throws SQLException {
        for (String candidate : new String[]{table, table.toUpperCase()}) {
            try (ResultSet tables = metaData.getTables(null, null, candidate, new String[]{"TABLE"})) {
                if (tables.next()) {
                    return true;
                }
            }
        }
        return false;
    }

    // ════════════════════════════════════════════════════════════
    // POSTGRESQL
    // ════════════════════════════════════════════════════════════

    public ServiceCheckResult checkPostgresql(PostgresqlTarget target) {
        String url = "jdbc:postgresql://" + target.host() + ":" + target.port() + "/" + target.database();
        Properties props = new Properties();
        props.setProperty("user", target.user() == null ? "" : target.user());
        props.setProperty("password", target.password() == null ? "" : target.password());
        props.setProperty("connectTimeout", String.valueOf(target.timeoutSeconds()));
        props.setProperty("loginTimeout", String.valueOf(target.timeoutSeconds()));

        try (Connection connection = DriverManager.getConnection(url, props)) {
            String version = connection.getMetaData().getDatabaseProductVersion();
            return ServiceCheckResult.ok("PostgreSQL connection successful", version);
        } catch (SQLException ex) {
            log.warn("PostgreSQL probe to {}:{} failed: {}", target.host(), target.port(), ex.getMessage());
            return ServiceCheckResult.error("PostgreSQL connection failed: " + ex.getMessage());
        }
    }

    // ════════════════════════════════════════════════════════════
    // REDIS
    // ════════════════════════════════════════════════════════════

    public ServiceCheckResult checkRedis(RedisTarget target) {
        RedisStandaloneConfiguration standalone = new RedisStandaloneConfiguration(target.host(), target.port());
        if (target.password() != null && !target.password().isBlank()) {
            standalone.setPassword(RedisPassword.of(target.password()));
        }
        Duration timeout = Duration.ofMillis(target.timeoutMillis());
        LettuceClientConfiguration clientConfig = LettuceClientConfiguration.builder()
                .commandTimeout(timeout)
                .clientOptions(ClientOptions.builder()
                        .socketOptions(SocketOptions.builder().connectTimeout(timeout).build())
                        .build())
                .build();

        LettuceConnectionFactory factory = new LettuceConnectionFactory(standalone, clientConfig);
        try {
            factory.afterPropertiesSet();
            try (RedisConnection connection = factory.getConnection()) {
                String pong = connection.ping();
                if (!"PONG".equalsIgnoreCase(pong)) {
                    return ServiceCheckResult.error("Redis connection failed: unexpected reply " + pong);
                }
                Properties info = connection.serverCommands().info("server");
                String version = info == null ? null : info.getProperty("redis_version");
                return ServiceCheckResult.ok("Redis connection successful", version);
            }
        } catch (RuntimeException ex) {
            log.warn("Redis probe to {}:{} failed: {}", target.host(), target.port(), ex.getMessage());
            return ServiceCheckResult.error("Redis connection failed: " + ex.getMessage());
        } finally {
            factory.destroy();
        }
    }

    // ════════════════════════════════════════════════════════════
    // AI SERVICE
    // ════════════════════════════════════════════════════════════

    /**
     * GET {url}/health. A non-2xx answer means the service is reachable but
     * unhealthy, reported as a warning.
     */
    public ServiceCheckResult checkAiService(AiServiceTarget target) {
        String healthUrl = stripTrailingSlash(target.url()) + "/health";
        try {
            ResponseEntity<Map<String, Object>> response = webClient.get()
                    .uri(healthUrl)
                    .headers(headers -> {
                        if (target.apiKey() != null && !target.apiKey().isBlank()) {
                            headers.set(HttpHeaders.AUTHORIZATION, "Bearer " + target.apiKey());
                        }
                    })
                    .retrieve()
                    .toEntity(MAP_TYPE)
                    .block(Duration.ofSeconds(target.timeoutSeconds()));

            Map<String, Object> body = response == null ? null : response.getBody();
            Object version = body == null ? null : body.get("version");
            return ServiceCheckResult.ok("AI service connection successful", version == null ? null : version.toString());

        } catch (WebClientResponseException ex) {
            log.warn("AI service health check returned HTTP {}", ex.getStatusCode().value());
            return ServiceCheckResult.warning("AI service responded with HTTP " + ex.getStatusCode().value());
        } catch (RuntimeException ex) {
            log.warn("AI service probe to {} failed: {}", healthUrl, ex.getMessage());
            return ServiceCheckResult.error("AI service connection failed: " + ex.getMessage());
        }
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
