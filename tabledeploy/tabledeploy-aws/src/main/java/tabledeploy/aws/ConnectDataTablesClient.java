package tabledeploy.aws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.signer.Aws4Signer;
import software.amazon.awssdk.auth.signer.params.Aws4SignerParams;
import software.amazon.awssdk.http.AbortableInputStream;
import software.amazon.awssdk.http.HttpExecuteRequest;
import software.amazon.awssdk.http.HttpExecuteResponse;
import software.amazon.awssdk.http.SdkHttpClient;
import software.amazon.awssdk.http.SdkHttpFullRequest;
import software.amazon.awssdk.http.SdkHttpMethod;
import software.amazon.awssdk.http.SdkHttpResponse;
import software.amazon.awssdk.utils.http.SdkHttpUtils;
import tabledeploy.remote.RemoteConflictException;
import tabledeploy.remote.RemoteServiceException;
import tabledeploy.remote.TransportException;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * SigV4-signed calls to the Amazon Connect data-tables REST API of one instance.
 * <p/>
 * Requests and responses are plain JSON trees; interpreting them is left to the adapters in this package. Error
 * responses are thrown as {@link ConnectServiceException} ({@link RemoteConflictException} for HTTP 409 or a
 * {@code ConflictException}), and I/O failures as {@link TransportException}.
 */
@Singleton
public class ConnectDataTablesClient {
  private static final Logger LOG = LoggerFactory.getLogger(ConnectDataTablesClient.class);
  private static final String SIGNING_NAME = "connect";
  private static final String ERROR_TYPE_HEADER = "x-amzn-ErrorType";
  private static final String NEXT_TOKEN = "NextToken";

  private final SdkHttpClient httpClient;
  private final ConnectClientConfig config;
  private final AwsCredentialsProvider credentialsProvider;
  private final Aws4Signer signer = Aws4Signer.create();
  private final ObjectMapper mapper;

  @Inject
  public ConnectDataTablesClient(
          SdkHttpClient httpClient,
          ConnectClientConfig config,
          AwsCredentialsProvider credentialsProvider,
          ObjectMapper mapper
  ) {
    this.httpClient = httpClient;
    this.config = config;
    this.credentialsProvider = credentialsProvider;
    this.mapper = mapper;
  }

  public ConnectClientConfig config() {
    return config;
  }

  public ObjectMapper json() {
    return mapper;
  }

  public List<JsonNode> listDataTables() {
    return paginate("DataTableSummaryList", Integer.MAX_VALUE, nextToken -> call(
            SdkHttpMethod.GET,
            instancePath(),
            pageQuery(nextToken),
            null
    ));
  }

  public JsonNode createDataTable(ObjectNode request) {
    return call(SdkHttpMethod.PUT, instancePath(), ImmutableMap.of(), request);
  }

  public JsonNode describeDataTable(String tableId) {
    return call(SdkHttpMethod.GET, tablePath(tableId), ImmutableMap.of(), null);
  }

  public void deleteDataTable(String tableId) {
    call(SdkHttpMethod.DELETE, tablePath(tableId), ImmutableMap.of(), null);
  }

  public List<JsonNode> listAttributes(String tableId) {
    return paginate("Attributes", Integer.MAX_VALUE, nextToken -> call(
            SdkHttpMethod.GET,
            tablePath(tableId) + "/attributes",
            pageQuery(nextToken),
            null
    ));
  }

  public JsonNode createAttribute(String tableId, ObjectNode request) {
    return call(SdkHttpMethod.PUT, tablePath(tableId) + "/attributes", ImmutableMap.of(), request);
  }

  /**
   * @return the response, with {@code Successful} and {@code Failed} value entries
   */
  public JsonNode batchUpdateValues(String tableId, ArrayNode values) {
    return call(SdkHttpMethod.POST, tablePath(tableId) + "/values/update", ImmutableMap.of(), valuesRequest(values));
  }

  public JsonNode batchCreateValues(String tableId, ArrayNode values) {
    return call(SdkHttpMethod.POST, tablePath(tableId) + "/values/create", ImmutableMap.of(), valuesRequest(values));
  }

  /**
   * @param filter extra request fields narrowing the listing (e.g. {@code PrimaryAttributeValues})
   * @return up to {@code limit} stored value entries
   */
  public List<JsonNode> listValues(String tableId, ObjectNode filter, int limit) {
    return paginate("Values", limit, nextToken -> {
      ObjectNode request = filter.deepCopy();
      request.put("MaxResults", Math.min(limit, config.pageSize()));
      nextToken.ifPresent(token -> request.put(NEXT_TOKEN, token));
      return call(SdkHttpMethod.POST, tablePath(tableId) + "/values/list", ImmutableMap.of(), request);
    });
  }

  JsonNode call(SdkHttpMethod method, String path, Map<String, String> query, JsonNode body) {
    SdkHttpFullRequest.Builder request = SdkHttpFullRequest.builder()
            .method(method)
            .uri(config.resolvedEndpoint())
            .encodedPath(path)
            .putHeader("Accept", "application/json");
    query.forEach(request::putRawQueryParameter);
    if (body != null) {
      byte[] content = serialize(body);
      request.putHeader("Content-Type", "application/json")
              .putHeader("Content-Length", Integer.toString(content.length))
              .contentStreamProvider(() -> new ByteArrayInputStream(content));
    }

    SdkHttpFullRequest signed = signer.sign(request.build(), Aws4SignerParams.builder()
            .awsCredentials(credentialsProvider.resolveCredentials())
            .signingName(SIGNING_NAME)
            .signingRegion(config.sdkRegion())
            .build());

    HttpExecuteRequest.Builder execute = HttpExecuteRequest.builder().request(signed);
    signed.contentStreamProvider().ifPresent(execute::contentStreamProvider);

    LOG.debug("{} {}", method, path);
    HttpExecuteResponse response;
    String responseText;
    try {
      response = httpClient.prepareRequest(execute.build()).call();
      responseText = readBody(response.responseBody());
    } catch (IOException e) {
      throw new TransportException(method + " " + path + " failed: " + e.getMessage(), e);
    }

    SdkHttpResponse httpResponse = response.httpResponse();
    if (httpResponse.isSuccessful()) {
      return parse(responseText).orElseThrow(() -> new RemoteServiceException(
              "Unparseable response from " + method + " " + path + ": " + responseText));
    }
    throw errorFor(httpResponse, responseText);
  }

  private RemoteServiceException errorFor(SdkHttpResponse response, String responseText) {
    Optional<JsonNode> body = parse(responseText);
    String errorCode = response.firstMatchingHeader(ERROR_TYPE_HEADER)
            .map(type -> type.split(":", 2)[0])
            .or(() -> body.map(json -> json.path("__type").asText(null))
                    .map(type -> type.substring(type.lastIndexOf('#') + 1)))
            .or(() -> body.map(json -> json.path("Code").asText(null)))
            .filter(code -> !code.isEmpty())
            .orElse("HTTP" + response.statusCode());
    String message = body
            .map(json -> json.has("message") ? json.path("message").asText() : json.path("Message").asText(""))
            .filter(m -> !m.isEmpty())
            .orElse(responseText);

    if (response.statusCode() == 409 || "ConflictException".equals(errorCode)) {
      return new RemoteConflictException(errorCode + ": " + message);
    }
    return new ConnectServiceException(errorCode, response.statusCode(), message);
  }

  private Optional<JsonNode> parse(String text) {
    if (text.isBlank()) return Optional.of(mapper.createObjectNode());
    try {
      return Optional.of(mapper.readTree(text));
    } catch (JsonProcessingException e) {
      return Optional.empty();
    }
  }

  private static String readBody(Optional<AbortableInputStream> body) throws IOException {
    if (body.isEmpty()) return "";
    try (InputStream in = body.get()) {
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
  }

  private byte[] serialize(JsonNode body) {
    try {
      return mapper.writeValueAsBytes(body);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to serialize request", e);
    }
  }

  private ObjectNode valuesRequest(ArrayNode values) {
    ObjectNode request = mapper.createObjectNode();
    request.set("Values", values);
    return request;
  }

  private Map<String, String> pageQuery(Optional<String> nextToken) {
    ImmutableMap.Builder<String, String> query = ImmutableMap.<String, String>builder()
            .put("maxResults", Integer.toString(config.pageSize()));
    nextToken.ifPresent(token -> query.put("nextToken", token));
    return query.build();
  }

  private String instancePath() {
    return "/data-tables/" + SdkHttpUtils.urlEncode(config.instanceId());
  }

  private String tablePath(String tableId) {
    return instancePath() + "/" + SdkHttpUtils.urlEncode(tableId);
  }

  private static List<JsonNode> paginate(String itemsField, int limit, Function<Optional<String>, JsonNode> fetchPage) {
    List<JsonNode> items = new ArrayList<>();
    Optional<String> nextToken = Optional.empty();
    do {
      JsonNode page = fetchPage.apply(nextToken);
      for (JsonNode item : page.path(itemsField)) {
        if (items.size() >= limit) return items;
        items.add(item);
      }
      nextToken = Optional.ofNullable(page.path(NEXT_TOKEN).textValue()).filter(token -> !token.isEmpty());
    } while (nextToken.isPresent() && items.size() < limit);
    return items;
  }
}
