package io.github.wphillipmoore.dynamiq.client;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonSyntaxException;
import com.google.gson.ToNumberPolicy;
import io.github.wphillipmoore.dynamiq.client.exception.DynamiqAcknowledgementException;
import io.github.wphillipmoore.dynamiq.client.exception.DynamiqAlreadyExistsException;
import io.github.wphillipmoore.dynamiq.client.exception.DynamiqConnectionException;
import io.github.wphillipmoore.dynamiq.client.exception.DynamiqDeliveryException;
import io.github.wphillipmoore.dynamiq.client.exception.DynamiqInvalidArgumentException;
import io.github.wphillipmoore.dynamiq.client.exception.DynamiqNotFoundException;
import io.github.wphillipmoore.dynamiq.client.exception.DynamiqRequestException;
import io.github.wphillipmoore.dynamiq.client.exception.DynamiqResponseException;
import io.github.wphillipmoore.dynamiq.client.exception.DynamiqStatusException;
import io.github.wphillipmoore.dynamiq.client.exception.DynamiqTimeoutException;
import io.github.wphillipmoore.dynamiq.client.exception.ErrorKind;
import io.github.wphillipmoore.dynamiq.client.message.ReceivedMessage;
import io.github.wphillipmoore.dynamiq.client.queue.QueueConfig;
import io.github.wphillipmoore.dynamiq.client.retry.RetryPolicy;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client for the Dynamiq REST API.
 *
 * <p>Every operation builds a request under the {@code v1} prefix, runs it through the {@link
 * RetryPolicy} with the terminal statuses of its {@link DynamiqOperation}, classifies the last
 * response and either decodes the body or throws the matching {@link
 * io.github.wphillipmoore.dynamiq.client.exception.DynamiqException}. Operations never return a
 * sentinel value in place of an error.
 *
 * <p>Instances are created via the {@link Builder}:
 *
 * <pre>{@code
 * DynamiqClient client = new DynamiqClient.Builder("http://example.io", 9999)
 *     .connectionTimeout(Duration.ofSeconds(5))
 *     .retryCount(3)
 *     .build();
 * client.createQueue("jobs");
 * String id = client.enqueue("jobs", "{\"task\":\"resize\"}");
 * }</pre>
 *
 * <p>A client owns its transport. The default {@link HttpClientTransport} is safe for concurrent
 * use; a custom transport carries its own guarantees.
 */
public final class DynamiqClient {

  /** API version path segment prefixed to every request. */
  public static final String API_VERSION = "v1";

  /** Default connection timeout (2 seconds). */
  public static final Duration DEFAULT_CONNECTION_TIMEOUT = Duration.ofSeconds(2);

  /** Default number of retries after the first attempt (2). */
  public static final int DEFAULT_RETRY_COUNT = RetryPolicy.DEFAULT_RETRY_COUNT;

  /** Default batch size for {@link #receive(String)} (10). */
  public static final int DEFAULT_BATCH_SIZE = 10;

  static final String JSON_CONTENT_TYPE = "application/json";
  static final String RAW_CONTENT_TYPE = "text/plain; charset=UTF-8";

  private static final Logger LOGGER = LoggerFactory.getLogger(DynamiqClient.class);
  // Numbers keep their wire text so large message ids are not rounded.
  private static final Gson GSON =
      new GsonBuilder().setObjectToNumberStrategy(ToNumberPolicy.LAZILY_PARSED_NUMBER).create();

  private final String baseUri;
  private final Duration connectionTimeout;
  private final boolean persistentConnections;
  private final RetryPolicy retryPolicy;
  private final DynamiqTransport transport;

  private DynamiqClient(Builder builder) {
    this.baseUri =
        stripTrailingSlashes(builder.baseUrl) + ":" + builder.port + "/" + API_VERSION;
    this.connectionTimeout = builder.connectionTimeout;
    this.persistentConnections = builder.persistentConnections;
    this.retryPolicy = new RetryPolicy(builder.retryCount);
    this.transport =
        builder.transport != null
            ? builder.transport
            : new HttpClientTransport(connectionTimeout, persistentConnections);
  }

  /** Returns the URL prefix every request path is appended to: {@code {url}:{port}/v1}. */
  public String getBaseUri() {
    return baseUri;
  }

  /** Returns the connection timeout applied to every request. */
  public Duration getConnectionTimeout() {
    return connectionTimeout;
  }

  /** Returns the number of retries after the first attempt. */
  public int getRetryCount() {
    return retryPolicy.getRetryCount();
  }

  /** Returns whether the default transport keeps connections alive between requests. */
  public boolean isPersistentConnections() {
    return persistentConnections;
  }

  /**
   * Creates a topic.
   *
   * @param topic the topic name
   * @return {@code true} once the topic has been created
   * @throws DynamiqAlreadyExistsException if the topic already exists
   */
  public boolean createTopic(String topic) {
    execute(DynamiqOperation.CREATE_TOPIC, "topics/" + segment(topic, "topic"));
    return true;
  }

  /**
   * Creates a queue.
   *
   * @param queue the queue name
   * @return {@code true} once the queue has been created
   * @throws DynamiqAlreadyExistsException if the queue already exists
   */
  public boolean createQueue(String queue) {
    execute(DynamiqOperation.CREATE_QUEUE, "queues/" + segment(queue, "queue"));
    return true;
  }

  /**
   * Deletes a topic.
   *
   * @param topic the topic name
   * @return {@code true} once the topic has been deleted
   * @throws DynamiqNotFoundException if the topic does not exist
   */
  public boolean deleteTopic(String topic) {
    execute(DynamiqOperation.DELETE_TOPIC, "topics/" + segment(topic, "topic"));
    return true;
  }

  /**
   * Deletes a queue.
   *
   * @param queue the queue name
   * @return {@code true} once the queue has been deleted
   * @throws DynamiqNotFoundException if the queue does not exist
   */
  public boolean deleteQueue(String queue) {
    execute(DynamiqOperation.DELETE_QUEUE, "queues/" + segment(queue, "queue"));
    return true;
  }

  /**
   * Subscribes a queue to a topic.
   *
   * @param topic the topic name
   * @param queue the queue name
   * @return the names of all queues subscribed to the topic
   * @throws DynamiqRequestException if the server rejects the subscription
   */
  public List<String> subscribeQueue(String topic, String queue) {
    TransportResponse response =
        execute(
            DynamiqOperation.SUBSCRIBE_QUEUE,
            "topics/" + segment(topic, "topic") + "/queues/" + segment(queue, "queue"));
    return stringList(parseObject(response.body()), "Queues", response.body());
  }

  /**
   * Configures a queue. Attributes not set in {@code config} keep their current server value.
   *
   * @param queue the queue name
   * @param config the settings to apply
   * @return {@code true} once the settings have been applied
   */
  public boolean configureQueue(String queue, QueueConfig config) {
    String path = "queues/" + segment(queue, "queue");
    Objects.requireNonNull(config, "config");
    execute(
        DynamiqOperation.CONFIGURE_QUEUE, path, GSON.toJson(config.toPayload()), JSON_CONTENT_TYPE);
    return true;
  }

  /**
   * Publishes a message to a topic, which enqueues it on every subscribed queue.
   *
   * @param topic the topic name
   * @param data the raw message body
   * @return the id assigned to the message on each subscribed queue, keyed by queue name
   * @throws DynamiqDeliveryException if the message was not accepted
   */
  public Map<String, Object> publish(String topic, String data) {
    String path = "topics/" + segment(topic, "topic") + "/message";
    Objects.requireNonNull(data, "data");
    TransportResponse response = execute(DynamiqOperation.PUBLISH, path, data, RAW_CONTENT_TYPE);
    return parseObject(response.body());
  }

  /**
   * Enqueues a message directly on a queue.
   *
   * @param queue the queue name
   * @param data the raw message body
   * @return the message id, exactly as the server sent it
   * @throws DynamiqDeliveryException if the message was not accepted
   */
  public String enqueue(String queue, String data) {
    String path = "queues/" + segment(queue, "queue") + "/message";
    Objects.requireNonNull(data, "data");
    TransportResponse response = execute(DynamiqOperation.ENQUEUE, path, data, RAW_CONTENT_TYPE);
    return response.body();
  }

  /**
   * Acknowledges (deletes) a processed message.
   *
   * @param queue the queue name
   * @param messageId the id of the message
   * @return {@code true} once the message has been deleted
   * @throws DynamiqAcknowledgementException if the message was not deleted
   */
  public boolean acknowledge(String queue, String messageId) {
    execute(
        DynamiqOperation.ACKNOWLEDGE,
        "queues/" + segment(queue, "queue") + "/message/" + segment(messageId, "messageId"));
    return true;
  }

  /**
   * Acknowledges (deletes) several processed messages with one request.
   *
   * @param queue the queue name
   * @param messageIds the ids of the messages, at least one
   * @return the number of messages the server deleted
   * @throws DynamiqAcknowledgementException if the messages were not deleted
   */
  public long acknowledgeMany(String queue, List<String> messageIds) {
    String queueSegment = segment(queue, "queue");
    Objects.requireNonNull(messageIds, "messageIds");
    if (messageIds.isEmpty()) {
      throw new IllegalArgumentException("messageIds must not be empty");
    }
    List<String> encoded = new ArrayList<>(messageIds.size());
    for (String messageId : messageIds) {
      encoded.add(segment(messageId, "messageId"));
    }
    TransportResponse response =
        execute(
            DynamiqOperation.ACKNOWLEDGE_MANY,
            "queues/" + queueSegment + "/messages/" + String.join(",", encoded));
    Object decoded = parseJson(response.body());
    if (!(decoded instanceof Number count)) {
      throw new DynamiqResponseException("Deletion count is not a number", response.body());
    }
    return count.longValue();
  }

  /**
   * Receives a batch of at most {@link #DEFAULT_BATCH_SIZE} messages.
   *
   * @param queue the queue name
   * @return the received messages, possibly empty
   */
  public List<ReceivedMessage> receive(String queue) {
    return receive(queue, DEFAULT_BATCH_SIZE);
  }

  /**
   * Receives a batch of messages. Received messages stay invisible to other receivers for the
   * queue's visibility timeout and must be acknowledged once processed.
   *
   * @param queue the queue name
   * @param batchSize the maximum number of messages to receive (must be &gt; 0)
   * @return the received messages, possibly empty
   * @throws DynamiqNotFoundException if the queue does not exist
   * @throws DynamiqInvalidArgumentException if the server rejects the batch size
   */
  public List<ReceivedMessage> receive(String queue, int batchSize) {
    String queueSegment = segment(queue, "queue");
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    TransportResponse response =
        execute(DynamiqOperation.RECEIVE, "queues/" + queueSegment + "/messages/" + batchSize);
    return toMessages(parseJson(response.body()), response.body());
  }

  /**
   * Reads the details of a queue (configuration and partition statistics).
   *
   * @param queue the queue name
   * @return the details as decoded from the server's JSON object
   * @throws DynamiqNotFoundException if the queue does not exist
   */
  public Map<String, Object> queueDetails(String queue) {
    TransportResponse response =
        execute(DynamiqOperation.QUEUE_DETAILS, "queues/" + segment(queue, "queue"));
    return parseObject(response.body());
  }

  /** Lists the names of all queues known to the server. */
  public List<String> knownQueues() {
    TransportResponse response = execute(DynamiqOperation.KNOWN_QUEUES, "queues");
    return stringList(parseObject(response.body()), "queues", response.body());
  }

  /** Lists the names of all topics known to the server. */
  public List<String> knownTopics() {
    TransportResponse response = execute(DynamiqOperation.KNOWN_TOPICS, "topics");
    return stringList(parseObject(response.body()), "topics", response.body());
  }

  private TransportResponse execute(DynamiqOperation operation, String path) {
    return execute(operation, path, null, null);
  }

  private TransportResponse execute(
      DynamiqOperation operation,
      String path,
      @Nullable String body,
      @Nullable String contentType) {
    TransportRequest request =
        new TransportRequest(
            operation.method(),
            baseUri + "/" + path,
            body,
            buildHeaders(contentType),
            connectionTimeout);

    TransportResponse response;
    try {
      response = retryPolicy.execute(operation::isTerminal, () -> send(request));
    } catch (DynamiqConnectionException | DynamiqTimeoutException e) {
      LOGGER.warn("Failed to {}: {} ({})", operation.description(), e.getMessage(), request.url());
      throw e;
    }

    ClassifiedResponse classified = operation.classify(response);
    if (!classified.isSuccess()) {
      DynamiqStatusException failure = toException(classified, request.url());
      LOGGER.warn("{} [{}]", failure.getMessage(), failure.getKind());
      throw failure;
    }
    return response;
  }

  private TransportResponse send(TransportRequest request) {
    TransportResponse response = transport.send(request);
    LOGGER.debug("{} {} -> {}", request.method(), request.url(), response.statusCode());
    return response;
  }

  static Map<String, String> buildHeaders(@Nullable String contentType) {
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put("Accept", JSON_CONTENT_TYPE);
    if (contentType != null) {
      headers.put("Content-Type", contentType);
    }
    return headers;
  }

  static DynamiqStatusException toException(ClassifiedResponse classified, String url) {
    ErrorKind kind = Objects.requireNonNull(classified.errorKind(), "errorKind");
    int status = classified.response().statusCode();
    String body = classified.response().body();
    String serverError = extractServerError(body);

    StringBuilder message = new StringBuilder(64);
    message
        .append("Failed to ")
        .append(classified.operation().description())
        .append(". status: ")
        .append(status);
    if (serverError != null) {
      message.append(" error: ").append(serverError);
    } else {
      message.append(" response: ").append(body);
    }

    return switch (kind) {
      case ALREADY_EXISTS -> new DynamiqAlreadyExistsException(
          serverError != null ? serverError : message.toString(), url, status, body);
      case NOT_FOUND -> new DynamiqNotFoundException(message.toString(), url, status, body);
      case INVALID_ARGUMENT -> new DynamiqInvalidArgumentException(
          message.toString(), url, status, body);
      case DELIVERY_FAILURE -> new DynamiqDeliveryException(message.toString(), url, status, body);
      case ACKNOWLEDGEMENT_FAILURE -> new DynamiqAcknowledgementException(
          message.toString(), url, status, body);
      default -> new DynamiqRequestException(message.toString(), url, status, body);
    };
  }

  /** Returns the server's {@code error} field when the body is a JSON object carrying one. */
  static @Nullable String extractServerError(String body) {
    try {
      Object decoded = GSON.fromJson(body, Object.class);
      if (decoded instanceof Map<?, ?> map && map.get("error") instanceof String error) {
        return error;
      }
    } catch (JsonSyntaxException e) {
      LOGGER.debug("Error response is not JSON: {}", e.getMessage());
    }
    return null;
  }

  static Object parseJson(String text) {
    Object decoded;
    try {
      decoded = GSON.fromJson(text, Object.class);
    } catch (JsonSyntaxException e) {
      throw new DynamiqResponseException("Invalid JSON in response", text, e);
    }
    if (decoded == null) {
      throw new DynamiqResponseException("Empty response", text);
    }
    return decoded;
  }

  static Map<String, Object> parseObject(String text) {
    Object decoded = parseJson(text);
    if (!(decoded instanceof Map)) {
      throw new DynamiqResponseException("Response is not a JSON object", text);
    }
    @SuppressWarnings("unchecked")
    Map<String, Object> result = (Map<String, Object>) decoded;
    return result;
  }

  static List<String> stringList(Map<String, Object> payload, String key, String text) {
    Object value = payload.get(key);
    if (value == null) {
      return new ArrayList<>();
    }
    if (!(value instanceof List<?> items)) {
      throw new DynamiqResponseException(key + " is not a list", text);
    }
    List<String> result = new ArrayList<>(items.size());
    for (Object item : items) {
      result.add(scalarToString(item));
    }
    return result;
  }

  static List<ReceivedMessage> toMessages(@Nullable Object decoded, String text) {
    if (!(decoded instanceof List<?> items)) {
      throw new DynamiqResponseException("Message batch is not a list", text);
    }
    List<ReceivedMessage> messages = new ArrayList<>(items.size());
    for (Object item : items) {
      if (!(item instanceof Map<?, ?> fields)) {
        throw new DynamiqResponseException("Message is not an object", text);
      }
      Object id = fields.get("id");
      if (id == null) {
        throw new DynamiqResponseException("Message has no id", text);
      }
      Object body = fields.get("body");
      String bodyText;
      if (body == null) {
        bodyText = "";
      } else if (body instanceof String s) {
        bodyText = s;
      } else {
        bodyText = GSON.toJson(body);
      }
      messages.add(new ReceivedMessage(scalarToString(id), bodyText));
    }
    return messages;
  }

  /** Renders a decoded scalar; numbers come back exactly as they appeared in the response. */
  static String scalarToString(@Nullable Object value) {
    return String.valueOf(value);
  }

  static String segment(String value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isBlank()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
    return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
  }

  private static String stripTrailingSlashes(String url) {
    int end = url.length();
    while (end > 0 && url.charAt(end - 1) == '/') {
      end--;
    }
    return url.substring(0, end);
  }

  /** Builder for {@link DynamiqClient}. */
  public static final class Builder {

    private final String baseUrl;
    private final int port;
    private Duration connectionTimeout = DEFAULT_CONNECTION_TIMEOUT;
    private int retryCount = DEFAULT_RETRY_COUNT;
    private boolean persistentConnections = true;
    private @Nullable DynamiqTransport transport;

    /**
     * Creates a builder with the required client parameters.
     *
     * @param baseUrl the server URL without port, e.g. {@code http://example.io}
     * @param port the server port (1-65535)
     * @throws IllegalArgumentException if the URL is malformed or the port is out of range
     */
    public Builder(String baseUrl, int port) {
      this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
      validateBaseUrl(baseUrl);
      if (port < 1 || port > 65_535) {
        throw new IllegalArgumentException("port must be between 1 and 65535");
      }
      this.port = port;
    }

    private static void validateBaseUrl(String baseUrl) {
      URI uri;
      try {
        uri = URI.create(stripTrailingSlashes(baseUrl));
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("baseUrl is not a valid URL: " + baseUrl, e);
      }
      if (uri.getScheme() == null || uri.getHost() == null) {
        throw new IllegalArgumentException("baseUrl must include a scheme and host: " + baseUrl);
      }
      if (uri.getPort() != -1) {
        throw new IllegalArgumentException("baseUrl must not include a port: " + baseUrl);
      }
    }

    /** Sets the connection timeout. Defaults to 2 seconds. */
    public Builder connectionTimeout(Duration connectionTimeout) {
      Objects.requireNonNull(connectionTimeout, "connectionTimeout");
      if (connectionTimeout.isNegative() || connectionTimeout.isZero()) {
        throw new IllegalArgumentException("connectionTimeout must be > 0");
      }
      this.connectionTimeout = connectionTimeout;
      return this;
    }

    /** Sets the number of retries after the first attempt. Defaults to 2. */
    public Builder retryCount(int retryCount) {
      if (retryCount < 0) {
        throw new IllegalArgumentException("retryCount must be >= 0");
      }
      this.retryCount = retryCount;
      return this;
    }

    /**
     * Sets whether the default transport keeps connections alive between requests. Defaults to
     * {@code true}. Ignored when a custom transport is set.
     */
    public Builder persistentConnections(boolean persistentConnections) {
      this.persistentConnections = persistentConnections;
      return this;
    }

    /** Sets a custom transport. Defaults to an {@link HttpClientTransport}. */
    public Builder transport(DynamiqTransport transport) {
      this.transport = Objects.requireNonNull(transport, "transport");
      return this;
    }

    /**
     * Builds the client.
     *
     * @return the configured client
     */
    public DynamiqClient build() {
      return new DynamiqClient(this);
    }
  }
}
