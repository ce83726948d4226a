package tabledeploy.aws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tabledeploy.model.LockScope;
import tabledeploy.model.LockVersion;
import tabledeploy.model.NamedValue;
import tabledeploy.model.PrimaryKey;
import tabledeploy.model.TableHandle;
import tabledeploy.remote.RemoteConflictException;
import tabledeploy.remote.RemoteMutationApi;
import tabledeploy.remote.RemoteServiceException;
import tabledeploy.remote.RowMutation;
import tabledeploy.remote.RowResult;
import tabledeploy.remote.TransportException;

import javax.inject.Inject;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiFunction;

/**
 * Writes rows through BatchUpdateDataTableValue and BatchCreateDataTableValue.
 * <p/>
 * The service stores one value per (row, attribute), so each row expands into one entry per attribute it carries.
 * Rows are packed whole into calls of at most {@link ConnectClientConfig#maxValuesPerCall()} entries; only a row
 * with more values than that spans several calls. A call that fails affects only the rows it carried: they come
 * back as {@link RowResult.Status#CONFLICT CONFLICT} or {@link RowResult.Status#ERROR ERROR}, while rows settled
 * by other calls keep their results. Only when every call of the batch fails is the failure thrown.
 * <p/>
 * The entries' outcomes are folded back into one {@link RowResult} per row. An update that wrote some entries and
 * found the others missing reports the row {@link RowResult.Status#INCOMPLETE INCOMPLETE}, naming the missing
 * attributes, so that only those are created afterwards.
 */
public class ConnectRemoteMutationApi implements RemoteMutationApi {
  private static final Logger LOG = LoggerFactory.getLogger(ConnectRemoteMutationApi.class);
  static final String NOT_FOUND_MARKER = "Value not found";
  static final String CONFLICT_MARKER = "Concurrency conflict";

  private final ConnectDataTablesClient client;
  private final ConnectValueEncoding encoding;

  @Inject
  public ConnectRemoteMutationApi(ConnectDataTablesClient client) {
    this.client = client;
    this.encoding = new ConnectValueEncoding(client.json());
  }

  @Override
  public List<RowResult> batchUpdate(TableHandle table, List<RowMutation> mutations) {
    return write(table, mutations, client::batchUpdateValues);
  }

  @Override
  public List<RowResult> batchCreate(TableHandle table, List<RowMutation> mutations) {
    return write(table, mutations, client::batchCreateValues);
  }

  @Override
  public int maxBatchSize() {
    return ConnectClientConfig.MAX_VALUES_PER_CALL;
  }

  private List<RowResult> write(TableHandle table, List<RowMutation> mutations, BiFunction<String, ArrayNode, JsonNode> call) {
    Map<EntryKey, RowProgress> rowsByEntry = new HashMap<>();
    Map<PrimaryKey, RowProgress> rows = new LinkedHashMap<>();
    for (RowMutation mutation : mutations) {
      RowProgress row = new RowProgress(mutation.primaryKey(), entriesFor(table, mutation));
      rows.put(row.key, row);
      for (ObjectNode entry : row.entries) {
        rowsByEntry.put(EntryKey.of(entry), row);
      }
    }

    List<Chunk> chunks = packRows(rows.values(), client.config().maxValuesPerCall());
    RemoteServiceException firstFailure = null;
    int failedCalls = 0;
    for (Chunk chunk : chunks) {
      ArrayNode values = client.json().createArrayNode().addAll(chunk.entries());
      JsonNode response;
      try {
        response = call.apply(table.id(), values);
      } catch (RemoteServiceException e) {
        LOG.warn("Call with {} values of table '{}' failed: {}", values.size(), table.name(), e.getMessage());
        failedCalls++;
        if (firstFailure == null) firstFailure = e;
        chunk.rows().forEach(row -> row.callFailed(e));
        continue;
      }

      for (JsonNode entry : response.path("Successful")) {
        RowProgress row = rowsByEntry.get(EntryKey.of(entry));
        if (row == null) {
          LOG.warn("Ignoring result for an entry that was not submitted: {}", entry);
        } else {
          row.succeeded++;
        }
      }
      for (JsonNode entry : response.path("Failed")) {
        RowProgress row = rowsByEntry.get(EntryKey.of(entry));
        if (row == null) {
          LOG.warn("Ignoring failure for an entry that was not submitted: {}", entry);
        } else {
          row.entryFailed(entry.path("AttributeName").asText(), entry.path("Message").asText(""));
        }
      }
    }
    if (firstFailure != null && failedCalls == chunks.size()) throw firstFailure;

    ImmutableList.Builder<RowResult> results = ImmutableList.builder();
    for (RowProgress row : rows.values()) {
      if (row.failure != null) {
        results.add(row.failure);
      } else if (!row.missing.isEmpty()) {
        results.add(row.succeeded > 0 && row.missingOnlyNonKeyAttributes()
                ? RowResult.incomplete(row.key, row.missing)
                : RowResult.notFound(row.key, row.notFoundDetail));
      } else if (row.succeeded >= row.entries.size()) {
        results.add(RowResult.success(row.key));
      } else {
        LOG.warn("Table '{}' reported {} of {} values of row [{}]", table.name(), row.succeeded, row.entries.size(), row.key);
      }
    }
    return results.build();
  }

  /**
   * Groups rows, in order, into calls of at most {@code maxValues} entries without splitting a row across calls.
   * A row with more entries than that gets calls of its own.
   */
  static List<Chunk> packRows(Iterable<RowProgress> rows, int maxValues) {
    List<Chunk> chunks = new ArrayList<>();
    List<RowProgress> current = new ArrayList<>();
    List<ObjectNode> currentEntries = new ArrayList<>();
    for (RowProgress row : rows) {
      if (!current.isEmpty() && currentEntries.size() + row.entries.size() > maxValues) {
        chunks.add(new Chunk(current, currentEntries));
        current = new ArrayList<>();
        currentEntries = new ArrayList<>();
      }
      if (row.entries.size() > maxValues) {
        for (List<ObjectNode> part : Lists.partition(row.entries, maxValues)) {
          chunks.add(new Chunk(List.of(row), part));
        }
      } else {
        current.add(row);
        currentEntries.addAll(row.entries);
      }
    }
    if (!current.isEmpty()) chunks.add(new Chunk(current, currentEntries));
    return chunks;
  }

  private List<ObjectNode> entriesFor(TableHandle table, RowMutation mutation) {
    PrimaryKey key = mutation.primaryKey();
    ArrayNode primaryValues = encoding.primaryValues(key);
    List<NamedValue> written = mutation.row().attributes().isEmpty() ? key.values() : mutation.row().attributes();

    List<ObjectNode> entries = new ArrayList<>(written.size());
    for (NamedValue value : written) {
      ObjectNode entry = client.json().createObjectNode();
      entry.set("PrimaryValues", primaryValues.deepCopy());
      entry.put("AttributeName", value.attributeName());
      entry.put("Value", encoding.encode(value.value()));
      LockVersion lockVersion = LockScope.forValue(table.lockLevel(), key, value.attributeName())
              .map(mutation::lockVersion)
              .orElse(LockVersion.none());
      if (lockVersion.isPresent()) entry.set("LockVersion", encoding.lockVersionNode(lockVersion));
      entries.add(entry);
    }
    return entries;
  }

  static RowResult classify(PrimaryKey key, String attributeName, String message) {
    String detail = attributeName.isEmpty() ? message : attributeName + ": " + message;
    if (message.contains(NOT_FOUND_MARKER)) return RowResult.notFound(key, detail);
    if (message.contains(CONFLICT_MARKER)) return RowResult.conflict(key, detail);
    return RowResult.validationError(key, detail);
  }

  private static RowResult moreSevere(RowResult a, RowResult b) {
    return severity(b.status()) > severity(a.status()) ? b : a;
  }

  private static int severity(RowResult.Status status) {
    return switch (status) {
      case SUCCESS, NOT_FOUND, INCOMPLETE -> 0;
      case CONFLICT -> 1;
      case VALIDATION_ERROR -> 2;
      case ERROR -> 3;
    };
  }

  /**
   * The entries of one row and what the service said about them so far.
   */
  static class RowProgress {
    final PrimaryKey key;
    final List<ObjectNode> entries;
    final Set<String> missing = new LinkedHashSet<>();
    int succeeded;
    String notFoundDetail = "";
    RowResult failure;

    RowProgress(PrimaryKey key, List<ObjectNode> entries) {
      this.key = key;
      this.entries = entries;
    }

    void entryFailed(String attributeName, String message) {
      RowResult result = classify(key, attributeName, message);
      if (result.status() == RowResult.Status.NOT_FOUND) {
        missing.add(attributeName);
        if (notFoundDetail.isEmpty()) notFoundDetail = result.message();
      } else {
        fail(result);
      }
    }

    void callFailed(RemoteServiceException e) {
      if (e instanceof RemoteConflictException) {
        fail(RowResult.conflict(key, e.getMessage()));
      } else if (e instanceof TransportException) {
        fail(RowResult.error(key, "transport error: " + e.getMessage()));
      } else {
        fail(RowResult.error(key, "remote error: " + e.getMessage()));
      }
    }

    private void fail(RowResult result) {
      failure = failure == null ? result : moreSevere(failure, result);
    }

    boolean missingOnlyNonKeyAttributes() {
      return key.values().stream().noneMatch(value -> missing.contains(value.attributeName()));
    }
  }

  /**
   * The entries sent in one call, and the rows they belong to.
   */
  record Chunk(List<RowProgress> rows, List<ObjectNode> entries) {
  }

  /**
   * Identifies a value entry in a response: its primary values (in any order) and attribute name.
   */
  record EntryKey(Map<String, String> primaryValues, String attributeName) {
    static EntryKey of(JsonNode entry) {
      return new EntryKey(ConnectValueEncoding.primaryValuesOf(entry), entry.path("AttributeName").asText());
    }
  }
}
