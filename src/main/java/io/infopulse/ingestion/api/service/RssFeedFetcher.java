package io.infopulse.ingestion.api.service;

import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.SyndFeedInput;
import com.rometools.rome.io.XmlReader;
import io.infopulse.ingestion.api.dto.IntelligenceItem;
import io.infopulse.ingestion.api.exception.ErrorCategory;
import io.infopulse.ingestion.api.exception.FeedException;
import io.infopulse.ingestion.config.FeedSource;
import io.infopulse.ingestion.config.HttpConfig;
import io.infopulse.ingestion.config.IngestionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.ConnectException;
import java.net.HttpURLConnection;
import java.net.MalformedURLException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.zip.GZIPInputStream;

/**
 * Fetches RSS and Atom feeds over HTTP with Rome. One attempt per call, bounded by the
 * configured connect and read timeouts.
 */
@Component
public class RssFeedFetcher implements FeedFetcher {

    private static final Logger logger = LoggerFactory.getLogger(RssFeedFetcher.class);

    public static final String FETCH_METHOD = "rss";

    private final AtomicInteger userAgentIndex = new AtomicInteger();
    private final HttpConfig httpConfig;
    private final FeedEntryNormalizer normalizer;

    public RssFeedFetcher(IngestionConfig config, FeedEntryNormalizer normalizer) {
        this.httpConfig = config.http();
        this.normalizer = normalizer;
    }

    @Override
    public String fetchMethod() {
        return FETCH_METHOD;
    }

    @Override
    public List<IntelligenceItem> fetch(FeedSource source) throws FeedException {
        logger.info("Fetching feed: {} ({})", source.name(), source.url());

        byte[] payload = download(source.url());
        Instant fetchedAt = Instant.now();

        List<IntelligenceItem> items = normalizer.normalize(parse(payload, source.url()), source, fetchedAt);

        logger.info("Fetched {} items from {}", items.size(), source.name());
        return items;
    }

    private byte[] download(String url) throws FeedException {
        HttpURLConnection connection = null;

        try {
            if (url == null || url.trim().isEmpty()) {
                throw new FeedException("URL is null or empty", ErrorCategory.INVALID_URL);
            }

            connection = (HttpURLConnection) new URI(url.trim()).toURL().openConnection();

            configureConnection(connection);

            connection.connect();

            validateHttpResponse(connection, url);

            return readBody(connection);

        } catch (URISyntaxException | MalformedURLException | IllegalArgumentException e) {
            throw new FeedException("Invalid URL format: " + url, e, ErrorCategory.INVALID_URL);

        } catch (SocketTimeoutException e) {
            throw new FeedException("Connection timeout for: " + url, e, ErrorCategory.TIMEOUT);

        } catch (ConnectException e) {
            throw new FeedException("Connection refused: " + url, e, ErrorCategory.CONNECTION_REFUSED);

        } catch (UnknownHostException e) {
            throw new FeedException("Unknown host: " + url, e, ErrorCategory.DNS_ERROR);

        } catch (SocketException e) {
            throw new FeedException("Network error: " + url, e, ErrorCategory.NETWORK_ERROR);

        } catch (IOException e) {
            throw new FeedException("I/O error reading: " + url, e, ErrorCategory.IO_ERROR);

        } finally {
            if (connection != null) {
                connection.disconnect();
            }
        }
    }

    /**
     * Configure HTTP connection with proper headers and timeouts
     */
    private void configureConnection(HttpURLConnection connection) {
        connection.setConnectTimeout(httpConfig.connectTimeout());
        connection.setReadTimeout(httpConfig.readTimeout());

        connection.setRequestProperty("User-Agent", nextUserAgent());
        connection.setRequestProperty("Accept", "application/rss+xml, application/atom+xml, application/xml, text/xml, */*");
        connection.setRequestProperty("Accept-Language", "en-US,en;q=0.9");
        connection.setRequestProperty("Accept-Encoding", "gzip");
        connection.setRequestProperty("Cache-Control", "no-cache");
        connection.setRequestProperty("Connection", "close");

        connection.setInstanceFollowRedirects(true);
        connection.setUseCaches(false);
        connection.setDoInput(true);
        connection.setDoOutput(false);
    }

    /**
     * Anything but 200 fails the source for this cycle.
     */
    private void validateHttpResponse(HttpURLConnection connection, String url) throws IOException, FeedException {
        int responseCode = connection.getResponseCode();
        String responseMessage = connection.getResponseMessage();

        switch (responseCode) {
            case HttpURLConnection.HTTP_OK -> {
                String contentType = connection.getContentType();
                if (contentType != null && !isFeedContentType(contentType)) {
                    logger.warn("Unexpected content type for {}: {}", url, contentType);
                }
            }
            case HttpURLConnection.HTTP_NOT_FOUND ->
                    throw new FeedException("Feed not found (404): " + url, ErrorCategory.NOT_FOUND);
            case HttpURLConnection.HTTP_FORBIDDEN ->
                    throw new FeedException("Access forbidden (403): " + url, ErrorCategory.ACCESS_FORBIDDEN);
            case HttpURLConnection.HTTP_UNAUTHORIZED ->
                    throw new FeedException("Authentication required (401): " + url, ErrorCategory.AUTH_REQUIRED);
            case 429 ->
                    throw new FeedException("Rate limited (429): " + url, ErrorCategory.RATE_LIMITED);
            case HttpURLConnection.HTTP_INTERNAL_ERROR ->
                    throw new FeedException("Server error (500): " + url, ErrorCategory.SERVER_ERROR);
            case HttpURLConnection.HTTP_BAD_GATEWAY, HttpURLConnection.HTTP_UNAVAILABLE, HttpURLConnection.HTTP_GATEWAY_TIMEOUT ->
                    throw new FeedException("Server temporarily unavailable (" + responseCode + "): " + url,
                            ErrorCategory.SERVER_UNAVAILABLE);
            default -> throw new FeedException(
                    String.format("HTTP status %d (%s): %s", responseCode, responseMessage, url),
                    ErrorCategory.HTTP_ERROR);
        }
    }

    private byte[] readBody(HttpURLConnection connection) throws IOException {
        InputStream inputStream = connection.getInputStream();

        if ("gzip".equalsIgnoreCase(connection.getContentEncoding())) {
            inputStream = new GZIPInputStream(inputStream);
        }

        try (InputStream body = inputStream) {
            return body.readAllBytes();
        }
    }

    private SyndFeed parse(byte[] payload, String url) throws FeedException {
        try {
            var input = new SyndFeedInput();
            SyndFeed feed = input.build(new XmlReader(new ByteArrayInputStream(payload)));

            if (feed == null) {
                throw new FeedException("Feed is null: " + url, ErrorCategory.PARSE_ERROR);
            }
            return feed;

        } catch (com.rometools.rome.io.FeedException | IllegalArgumentException e) {
            throw new FeedException("Feed parsing error for " + url + ": " + e.getMessage(), e,
                    ErrorCategory.PARSE_ERROR);
        } catch (IOException e) {
            throw new FeedException("I/O error decoding feed " + url + ": " + e.getMessage(), e,
                    ErrorCategory.PARSE_ERROR);
        }
    }

    private String nextUserAgent() {
        List<String> userAgents = httpConfig.userAgents();
        return userAgents.get(Math.floorMod(userAgentIndex.getAndIncrement(), userAgents.size()));
    }

    private static boolean isFeedContentType(String contentType) {
        String lowerContentType = contentType.toLowerCase(Locale.ROOT);
        return lowerContentType.contains("xml") ||
                lowerContentType.contains("rss") ||
                lowerContentType.contains("atom") ||
                lowerContentType.contains("text");
    }
}
