package tabledeploy.aws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import tabledeploy.model.AttributeSpec;
import tabledeploy.model.LockLevel;
import tabledeploy.model.TableHandle;
import tabledeploy.model.TableSpec;
import tabledeploy.model.ValidationRule;
import tabledeploy.model.ValueKind;
import tabledeploy.remote.AttributeProvisioning;
import tabledeploy.remote.TableProvisioning;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.google.common.truth.Truth.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConnectTableProvisionerTest {
  private final ObjectMapper mapper = new ObjectMapper();
  private final ConnectDataTablesClient client = mock(ConnectDataTablesClient.class);
  private final ConnectTableProvisioner provisioner = new ConnectTableProvisioner(client);

  @BeforeEach
  void setUp() {
    when(client.json()).thenReturn(mapper);
  }

  @Test
  void existingTableIsMatchedByName() {
    when(client.listDataTables()).thenReturn(List.of(summary("t7", "Other"), summary("t9", "Customers")));

    TableProvisioning provisioning = provisioner.ensureTable(spec());

    assertThat(provisioning.created()).isFalse();
    assertThat(provisioning.table()).isEqualTo(TableHandle.of("t9", "Customers", LockLevel.DATA_TABLE));
    verify(client, never()).createDataTable(any());
  }

  @Test
  void missingTableIsCreatedPublished() {
    when(client.listDataTables()).thenReturn(List.of());
    when(client.createDataTable(any())).thenReturn(mapper.createObjectNode().put("Id", "t1"));

    TableProvisioning provisioning = provisioner.ensureTable(spec());

    assertThat(provisioning.created()).isTrue();
    assertThat(provisioning.table().id()).isEqualTo("t1");
    ArgumentCaptor<ObjectNode> request = ArgumentCaptor.forClass(ObjectNode.class);
    verify(client).createDataTable(request.capture());
    assertThat(request.getValue().path("Status").asText()).isEqualTo("PUBLISHED");
    assertThat(request.getValue().path("ValueLockLevel").asText()).isEqualTo("DATA_TABLE");
    assertThat(request.getValue().path("TimeZone").asText()).isEqualTo("US/Eastern");
    assertThat(request.getValue().path("Tags").path("team").asText()).isEqualTo("billing");
  }

  @Test
  void existingAttributesAreSkippedAndFailuresReported() {
    TableHandle table = TableHandle.of("t1", "Customers", LockLevel.NONE);
    when(client.listAttributes("t1")).thenReturn(List.of(mapper.createObjectNode().put("Name", "Id")));
    when(client.createAttribute(eq("t1"), argThat(request -> request != null && request.path("Name").asText().equals("Score"))))
            .thenThrow(new ConnectServiceException("ServiceQuotaExceededException", 402, "too many attributes"));

    List<AttributeProvisioning> results = provisioner.ensureAttributes(table, List.of(
            AttributeSpec.primary("Id", ValueKind.TEXT),
            AttributeSpec.builder()
                    .name("Region")
                    .valueType(ValueKind.TEXT)
                    .validation(ValidationRule.builder()
                            .maxLength(5)
                            .enumeration(ValidationRule.EnumRule.builder().addValues("east", "west").build())
                            .build())
                    .build(),
            AttributeSpec.of("Score", ValueKind.NUMBER)));

    assertThat(results.stream().map(AttributeProvisioning::status).collect(Collectors.toList())).containsExactly(
            AttributeProvisioning.Status.SKIPPED,
            AttributeProvisioning.Status.CREATED,
            AttributeProvisioning.Status.FAILED
    ).inOrder();
    assertThat(results.get(2).error().orElseThrow()).contains("too many attributes");
  }

  @Test
  void validationRulesUseServiceFieldNames() {
    JsonNode request = provisioner.attributeRequest(AttributeSpec.builder()
            .name("Region")
            .valueType(ValueKind.TEXT)
            .primary(true)
            .validation(ValidationRule.builder()
                    .maxLength(5)
                    .ignoreCase(true)
                    .enumeration(ValidationRule.EnumRule.builder().addValues("east", "west").build())
                    .build())
            .build());

    assertThat(request.path("Primary").asBoolean()).isTrue();
    assertThat(request.path("ValueType").asText()).isEqualTo("TEXT");
    JsonNode validation = request.path("Validation");
    assertThat(validation.path("MaxLength").asInt()).isEqualTo(5);
    assertThat(validation.path("IgnoreCase").asBoolean()).isTrue();
    assertThat(validation.path("Enum").path("Strict").asBoolean()).isTrue();
    assertThat(validation.path("Enum").path("Values").size()).isEqualTo(2);
    assertThat(validation.has("Minimum")).isFalse();
  }

  private ObjectNode summary(String id, String name) {
    return mapper.createObjectNode().put("Id", id).put("Name", name);
  }

  private static TableSpec spec() {
    return TableSpec.builder()
            .name("Customers")
            .lockLevel(LockLevel.DATA_TABLE)
            .putAllTags(Map.of("team", "billing"))
            .build();
  }
}
