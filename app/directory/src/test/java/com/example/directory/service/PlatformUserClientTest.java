package com.example.directory.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.GET;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.example.directory.service.dto.PlatformUserResponse;
import java.net.ConnectException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

class PlatformUserClientTest {

  private static final String ME_URL = PlatformClientFixtures.BASE_URL + "/users/@me";

  @Test
  void fetchCurrentUserSendsTokenTypeAndMapsSnakeCase() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(ME_URL))
        .andExpect(method(GET))
        .andExpect(header("Authorization", "Bearer at-1"))
        .andRespond(
            withSuccess(
                """
                {"id":"42","username":"alice","global_name":"Alice","discriminator":"0","avatar":"a1"}
                """,
                MediaType.APPLICATION_JSON));

    final PlatformUserResponse user = fixture.client.fetchCurrentUser("Bearer", "at-1");

    assertThat(user.id()).isEqualTo("42");
    assertThat(user.globalName()).isEqualTo("Alice");
    assertThat(user.avatar()).isEqualTo("a1");
    fixture.server.verify();
  }

  @Test
  void fetchCurrentUserWithoutIdIsInvalidResponse() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(ME_URL))
        .andRespond(withSuccess("{\"username\":\"alice\"}", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> fixture.client.fetchCurrentUser("Bearer", "at-1"))
        .isInstanceOf(PlatformIntegrationException.class)
        .extracting(ex -> ((PlatformIntegrationException) ex).reason())
        .isEqualTo(PlatformIntegrationException.Reason.INVALID_RESPONSE);
  }

  @Test
  void tokenCheckReturnsTrueOnSuccess() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(ME_URL))
        .andExpect(header("Authorization", "Bearer at-1"))
        .andRespond(withSuccess("{\"id\":\"42\"}", MediaType.APPLICATION_JSON));

    assertThat(fixture.client.isAccessTokenAccepted("at-1")).isTrue();
  }

  @Test
  void tokenCheckReturnsFalseOnUnauthorized() {
    final ClientFixture fixture = newFixture();
    fixture.server.expect(requestTo(ME_URL)).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

    assertThat(fixture.client.isAccessTokenAccepted("at-expired")).isFalse();
  }

  @Test
  void tokenCheckPropagatesConnectionFailure() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(ME_URL))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "connection refused", new ConnectException("Connection refused"));
            });

    assertThatThrownBy(() -> fixture.client.isAccessTokenAccepted("at-1"))
        .isInstanceOf(PlatformIntegrationException.class)
        .extracting(ex -> ((PlatformIntegrationException) ex).reason())
        .isEqualTo(PlatformIntegrationException.Reason.BAD_GATEWAY);
  }

  private ClientFixture newFixture() {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final RestClient restClient = builder.baseUrl(PlatformClientFixtures.BASE_URL).build();
    return new ClientFixture(new PlatformUserClient(restClient), server);
  }

  private record ClientFixture(PlatformUserClient client, MockRestServiceServer server) {}
}
