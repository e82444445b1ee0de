package com.telegram.geolocation.config;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.telegram.geolocation.config.properties.GeocodingConfigurationProperties;
import com.telegram.geolocation.dto.GeocodingMatch;
import com.telegram.geolocation.geocoding.GeocodingClient;
import com.telegram.geolocation.geocoding.MapboxGeocodingClient;
import com.telegram.geolocation.geocoding.RateLimitedGeocodingClient;
import com.telegram.geolocation.service.ProcessingMetricsService;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import lombok.RequiredArgsConstructor;
import reactor.netty.http.client.HttpClient;

/**
 * Configuration for the WebClient used to call the geocoding service, and for the rate-limited
 * {@link GeocodingClient} the pipeline depends on.
 */
@Configuration
@RequiredArgsConstructor
public class WebClientConfig {

  private final GeocodingConfigurationProperties properties;

  /**
   * Creates a WebClient configured with the geocoding service timeouts.
   *
   * @return Configured WebClient instance
   */
  @Bean
  public WebClient geocodingWebClient() {
    HttpClient httpClient =
        HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, properties.connectTimeoutMs().intValue())
            .responseTimeout(Duration.ofMillis(properties.readTimeoutMs()))
            .doOnConnected(
                conn ->
                    conn.addHandlerLast(
                        new ReadTimeoutHandler(properties.readTimeoutMs(), TimeUnit.MILLISECONDS)));

    return WebClient.builder().clientConnector(new ReactorClientHttpConnector(httpClient)).build();
  }

  /** Mapbox client wrapped with the fixed inter-call delay. Every call is counted by outcome. */
  @Bean
  public GeocodingClient geocodingClient(
      WebClient geocodingWebClient,
      ObjectMapper objectMapper,
      ProcessingMetricsService metricsService) {
    GeocodingClient rateLimited =
        new RateLimitedGeocodingClient(
            new MapboxGeocodingClient(geocodingWebClient, properties, objectMapper),
            Duration.ofMillis(properties.rateLimitDelayMs()));

    return (query, countryHint) -> {
      Optional<GeocodingMatch> match = rateLimited.geocode(query, countryHint);
      metricsService.recordGeocodingCall(match.isPresent());
      return match;
    };
  }
}
