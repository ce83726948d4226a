package tabledeploy.deploy;

import org.junit.jupiter.api.Test;
import tabledeploy.config.Deployment;
import tabledeploy.config.TableDeclaration;
import tabledeploy.model.AttributeSpec;
import tabledeploy.model.AttributeValue;
import tabledeploy.model.DesiredRow;
import tabledeploy.model.LockLevel;
import tabledeploy.model.NamedValue;
import tabledeploy.model.PrimaryKey;
import tabledeploy.model.TableSpec;
import tabledeploy.model.ValidationRule;
import tabledeploy.model.ValueKind;
import tabledeploy.reconcile.ReconcilerConfig;
import tabledeploy.reconcile.ReconciliationSummary;
import tabledeploy.reconcile.ValueReconciler;
import tabledeploy.remote.AttributeProvisioning;
import tabledeploy.remote.RemoteServiceException;
import tabledeploy.remote.TableProvisioner;
import tabledeploy.test.InMemoryDataTableService;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth8.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DeploymentPipelineTest {
  private static final List<AttributeSpec> ATTRIBUTES = List.of(
          AttributeSpec.primary("Id", ValueKind.TEXT),
          AttributeSpec.of("Color", ValueKind.TEXT));

  private final InMemoryDataTableService service = new InMemoryDataTableService();
  private final ValueReconciler reconciler = new ValueReconciler(service, service, ReconcilerConfig.defaults(), duration -> { });
  private final DeploymentPipeline pipeline = new DeploymentPipeline(service, reconciler);

  @Test
  void createsTableAttributesAndValues() {
    DeploymentReport report = pipeline.deploy(deployment(table("Colors", rows("a", "red", "b", "blue"))));

    TableDeploymentResult result = report.tables().get(0);
    assertThat(result.status()).isEqualTo(TableDeploymentResult.Status.CREATED);
    assertThat(result.tableId()).isEqualTo(service.table("Colors").map(t -> t.id()));
    assertThat(statuses(result.attributes().orElseThrow()))
            .containsExactly(AttributeProvisioning.Status.CREATED, AttributeProvisioning.Status.CREATED);
    ReconciliationSummary values = result.values().orElseThrow();
    assertThat(values.created()).isEqualTo(2);
    assertThat(values.updated()).isEqualTo(0);
    assertThat(report.isSuccessful()).isTrue();
    assertThat(service.row("Colors", key("b")).orElseThrow()).containsEntry("Color", AttributeValue.text("blue"));
  }

  @Test
  void secondRunFindsEverythingInPlace() {
    pipeline.deploy(deployment(table("Colors", rows("a", "red"))));

    DeploymentReport report = pipeline.deploy(deployment(table("Colors", rows("a", "green", "c", "cyan"))));

    TableDeploymentResult result = report.tables().get(0);
    assertThat(result.status()).isEqualTo(TableDeploymentResult.Status.EXISTING);
    assertThat(statuses(result.attributes().orElseThrow()))
            .containsExactly(AttributeProvisioning.Status.SKIPPED, AttributeProvisioning.Status.SKIPPED);
    assertThat(result.values().orElseThrow().updated()).isEqualTo(1);
    assertThat(result.values().orElseThrow().created()).isEqualTo(1);
    assertThat(service.row("Colors", key("a")).orElseThrow()).containsEntry("Color", AttributeValue.text("green"));
  }

  @Test
  void tableWithoutDeclarationsSkipsAttributesAndValues() {
    DeploymentReport report = pipeline.deploy(deployment(
            new TableDeclaration(TableSpec.builder().name("Empty").build(), Optional.empty(), Optional.empty())));

    TableDeploymentResult result = report.tables().get(0);
    assertThat(result.status()).isEqualTo(TableDeploymentResult.Status.CREATED);
    assertThat(result.attributes()).isEmpty();
    assertThat(result.values()).isEmpty();
    assertThat(service.calls()).isEmpty();
  }

  @Test
  void failedTableDoesNotStopTheOthers() {
    TableProvisioner provisioner = mock(TableProvisioner.class);
    when(provisioner.ensureTable(any())).thenAnswer(invocation -> {
      TableSpec spec = invocation.getArgument(0);
      if (spec.name().equals("Broken")) throw new RemoteServiceException("AccessDeniedException: not allowed");
      return service.ensureTable(spec);
    });
    when(provisioner.ensureAttributes(any(), any())).thenAnswer(invocation ->
            service.ensureAttributes(invocation.getArgument(0), invocation.getArgument(1)));

    DeploymentReport report = new DeploymentPipeline(provisioner, reconciler).deploy(deployment(
            table("Broken", rows("a", "red")),
            table("Colors", rows("a", "red"))));

    assertThat(report.tables().get(0).status()).isEqualTo(TableDeploymentResult.Status.FAILED);
    assertThat(report.tables().get(0).error().orElseThrow()).contains("not allowed");
    assertThat(report.tables().get(1).status()).isEqualTo(TableDeploymentResult.Status.CREATED);
    assertThat(report.tables().get(1).values().orElseThrow().created()).isEqualTo(1);
    assertThat(report.isSuccessful()).isFalse();
  }

  @Test
  void duplicateRowsFailOnlyTheirTable() {
    DeploymentReport report = pipeline.deploy(deployment(
            table("Dupes", rows("a", "red", "a", "blue")),
            table("Colors", rows("a", "red"))));

    assertThat(report.tables().get(0).status()).isEqualTo(TableDeploymentResult.Status.FAILED);
    assertThat(report.tables().get(0).error().orElseThrow()).contains("more than one row");
    assertThat(service.calls()).hasSize(2);
    assertThat(report.tables().get(1).isSuccessful()).isTrue();
  }

  @Test
  void rowFailuresMakeTheReportUnsuccessful() {
    List<AttributeSpec> attributes = List.of(
            AttributeSpec.primary("Id", ValueKind.TEXT),
            AttributeSpec.builder()
                    .name("Color")
                    .valueType(ValueKind.TEXT)
                    .validation(ValidationRule.builder().maxLength(4).build())
                    .build());
    TableDeclaration table = new TableDeclaration(
            TableSpec.builder().name("Colors").build(), Optional.of(attributes), Optional.of(rows("a", "red", "b", "purple")));

    DeploymentReport report = pipeline.deploy(deployment(table));

    ReconciliationSummary values = report.tables().get(0).values().orElseThrow();
    assertThat(values.created()).isEqualTo(1);
    assertThat(values.failed()).isEqualTo(1);
    assertThat(report.isSuccessful()).isFalse();
  }

  @Test
  void interruptedDeploymentReportsRemainingTablesAsFailed() {
    Thread.currentThread().interrupt();
    try {
      DeploymentReport report = pipeline.deploy(deployment(table("Colors", rows("a", "red"))));

      assertThat(report.tables().get(0).status()).isEqualTo(TableDeploymentResult.Status.FAILED);
      assertThat(report.tables().get(0).error()).isEqualTo(Optional.of(DeploymentPipeline.CANCELLED));
      assertThat(service.table("Colors")).isEmpty();
    } finally {
      Thread.interrupted();
    }
  }

  private static Deployment deployment(TableDeclaration... tables) {
    return new Deployment("arn:aws:connect:ca-central-1:123456789012:instance/test", List.of(tables));
  }

  private static TableDeclaration table(String name, List<DesiredRow> rows) {
    return new TableDeclaration(
            TableSpec.builder().name(name).lockLevel(LockLevel.DATA_TABLE).build(),
            Optional.of(ATTRIBUTES),
            Optional.of(rows));
  }

  /**
   * @param idsAndColors alternating ids and colors
   */
  private static List<DesiredRow> rows(String... idsAndColors) {
    DesiredRow[] rows = new DesiredRow[idsAndColors.length / 2];
    for (int i = 0; i < rows.length; i++) {
      rows[i] = DesiredRow.of(key(idsAndColors[2 * i]), List.of(NamedValue.of("Color", AttributeValue.text(idsAndColors[2 * i + 1]))));
    }
    return List.of(rows);
  }

  private static PrimaryKey key(String id) {
    return PrimaryKey.of("Id", AttributeValue.text(id));
  }

  private static List<AttributeProvisioning.Status> statuses(List<AttributeProvisioning> attributes) {
    return attributes.stream().map(AttributeProvisioning::status).collect(Collectors.toList());
  }
}
