package org.springaicommunity.team.validator;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;

/**
 * HTTP client for the Zulip REST API using the JDK HttpClient and basic authentication
 * with a bot's email address and API key.
 */
public class ZulipHttpClient implements ZulipClient {

	private static final Logger logger = LoggerFactory.getLogger(ZulipHttpClient.class);

	private final HttpClient httpClient;

	private final String baseUrl;

	private final String authorization;

	public ZulipHttpClient(String baseUrl, String username, String token) {
		this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
		this.authorization = "Basic "
				+ Base64.getEncoder().encodeToString((username + ":" + token).getBytes(StandardCharsets.UTF_8));
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(Duration.ofSeconds(30))
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	@Override
	public String get(String path) {
		String url = baseUrl + path;
		logger.debug("GET {}", url);
		long start = System.currentTimeMillis();

		HttpRequest request = HttpRequest.newBuilder()
			.uri(URI.create(url))
			.header("Authorization", authorization)
			.header("User-Agent", "team-validator")
			.GET()
			.build();

		try {
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
			logger.debug("GET {} completed in {}ms with status {}", url, System.currentTimeMillis() - start,
					response.statusCode());
			int statusCode = response.statusCode();
			if (statusCode >= 200 && statusCode < 300) {
				return response.body();
			}
			else if (statusCode == 401) {
				throw new ZulipApiException("Unauthorized: check ZULIP_USERNAME and ZULIP_TOKEN", statusCode,
						response.body());
			}
			else {
				throw new ZulipApiException("Zulip API error: " + statusCode, statusCode, response.body());
			}
		}
		catch (IOException e) {
			logger.error("HTTP request failed: {}", e.getMessage());
			throw new ZulipApiException("HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new ZulipApiException("HTTP request interrupted", e);
		}
	}

	/**
	 * Exception thrown when Zulip API calls fail.
	 */
	public static class ZulipApiException extends RuntimeException {

		private final int statusCode;

		private final @Nullable String responseBody;

		public ZulipApiException(String message, int statusCode, @Nullable String responseBody) {
			super(message);
			this.statusCode = statusCode;
			this.responseBody = responseBody;
		}

		public ZulipApiException(String message, Throwable cause) {
			super(message, cause);
			this.statusCode = -1;
			this.responseBody = null;
		}

		public int getStatusCode() {
			return statusCode;
		}

		public @Nullable String getResponseBody() {
			return responseBody;
		}

	}

}
