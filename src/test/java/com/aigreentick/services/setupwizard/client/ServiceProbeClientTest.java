package com.aigreentick.services.setupwizard.client;

import com.aigreentick.services.setupwizard.client.ServiceProbeClient.AiServiceTarget;
import com.aigreentick.services.setupwizard.constants.ServiceStatus;
import com.aigreentick.services.setupwizard.service.model.ServiceCheckResult;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import javax.sql.DataSource;
import java.net.ConnectException;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

@DisplayName("ServiceProbeClient")
class ServiceProbeClientTest {

    private static DataSource h2(String name) {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:" + name + ";DB_CLOSE_DELAY=-1");
        dataSource.setUser("sa");
        return dataSource;
    }

    @Nested
    @DisplayName("checkPrimaryDatabase()")
    class PrimaryDatabaseTests {

        @Test
        @DisplayName("should warn when connected but the settings table is missing")
        void shouldWarnWithoutTables() {
            ServiceProbeClient client = new ServiceProbeClient(WebClient.create(), h2("probe_empty"));

            ServiceCheckResult result = client.checkPrimaryDatabase();

            assertThat(result.status()).isEqualTo(ServiceStatus.WARNING);
            assertThat(result.message()).isEqualTo("Database connected but core tables not found");
            assertThat(result.version()).startsWith("H2");
        }

        @Test
        @DisplayName("should be ok once the settings table exists")
        void shouldBeOkWithTables() throws SQLException {
            DataSource dataSource = h2("probe_ready");
            try (Connection connection = dataSource.getConnection(); Statement statement = connection.createStatement()) {
                statement.execute("CREATE TABLE settings (id BIGINT PRIMARY KEY)");
            }
            ServiceProbeClient client = new ServiceProbeClient(WebClient.create(), dataSource);

            assertThat(client.checkPrimaryDatabase().status()).isEqualTo(ServiceStatus.OK);
        }
    }

    @Nested
    @DisplayName("checkAiService()")
    class AiServiceTests {

        private ServiceProbeClient clientAnswering(AtomicReference<ClientRequest> captured, Mono<ClientResponse> answer) {
            WebClient webClient = WebClient.builder()
                    .exchangeFunction(request -> {
                        captured.set(request);
                        return answer;
                    })
                    .build();
            return new ServiceProbeClient(webClient, mock(DataSource.class));
        }

        @Test
        @DisplayName("should call the health endpoint with the bearer key and read the version")
        void shouldReportVersion() {
            AtomicReference<ClientRequest> captured = new AtomicReference<>();
            ServiceProbeClient client = clientAnswering(captured, Mono.just(ClientResponse.create(HttpStatus.OK)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body("{\"status\":\"healthy\",\"version\":\"2.1.0\"}")
                    .build()));

            ServiceCheckResult result = client.checkAiService(new AiServiceTarget("http://ai.internal:8000/", "sk-test", 5));

            assertThat(result).isEqualTo(ServiceCheckResult.ok("AI service connection successful", "2.1.0"));
            assertThat(captured.get().url().toString()).isEqualTo("http://ai.internal:8000/health");
            assertThat(captured.get().headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer sk-test");
        }

        @Test
        @DisplayName("should warn when the service answers with an error status")
        void shouldWarnOnHttpError() {
            ServiceProbeClient client = clientAnswering(new AtomicReference<>(),
                    Mono.just(ClientResponse.create(HttpStatus.SERVICE_UNAVAILABLE).build()));

            ServiceCheckResult result = client.checkAiService(new AiServiceTarget("http://ai.internal:8000", null, 5));

            assertThat(result).isEqualTo(ServiceCheckResult.warning("AI service responded with HTTP 503"));
        }

        @Test
        @DisplayName("should report an error when the service is unreachable")
        void shouldErrorWhenUnreachable() {
            ServiceProbeClient client = clientAnswering(new AtomicReference<>(),
                    Mono.error(new ConnectException("Connection refused")));

            ServiceCheckResult result = client.checkAiService(new AiServiceTarget("http://ai.internal:8000", null, 5));

            assertThat(result.status()).isEqualTo(ServiceStatus.ERROR);
            assertThat(result.message()).startsWith("AI service connection failed");
        }
    }
}
