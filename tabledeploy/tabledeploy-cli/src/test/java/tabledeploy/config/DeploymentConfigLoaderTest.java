package tabledeploy.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tabledeploy.model.AttributeValue;
import tabledeploy.model.ConfigurationException;
import tabledeploy.model.DesiredRow;
import tabledeploy.model.LockLevel;
import tabledeploy.model.TableSpec;
import tabledeploy.model.ValueKind;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth8.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DeploymentConfigLoaderTest {
  private final DeploymentConfigLoader loader = new DeploymentConfigLoader(DeploymentConfigLoader.buildObjectMapper());

  @TempDir Path tempDir;

  @Test
  void loadsTablesAttributesAndTypedValues() throws Exception {
    Deployment deployment = loader.load(fixture("basic"));

    assertThat(deployment.instanceArn()).endsWith("instance/11111111-2222-3333-4444-555555555555");
    assertThat(deployment.tables()).hasSize(2);

    TableDeclaration customers = deployment.tables().get(0);
    assertThat(customers.table().lockLevel()).isEqualTo(LockLevel.DATA_TABLE);
    assertThat(customers.table().tags()).containsExactly("Environment", "Test");
    assertThat(customers.attributes().orElseThrow()).hasSize(6);
    assertThat(customers.schema().orElseThrow().attribute("Tier").orElseThrow().validation().orElseThrow()
            .enumeration().orElseThrow().values()).containsExactly("gold", "silver", "bronze");

    List<DesiredRow> rows = customers.rows().orElseThrow();
    assertThat(rows).hasSize(3);
    DesiredRow first = rows.get(0);
    assertThat(first.primaryKey().valueOf("CustomerId")).hasValue(AttributeValue.text("c-100"));
    assertThat(first.attribute("Priority")).hasValue(AttributeValue.number("1"));
    assertThat(first.attribute("Vip")).hasValue(AttributeValue.bool(true));
    assertThat(first.attribute("Queues")).hasValue(AttributeValue.textList(List.of("billing", "support")));
    assertThat(first.attribute("Weights").orElseThrow())
            .isEqualTo(AttributeValue.numberList(List.of(new BigDecimal("0.5"), new BigDecimal("1.5"))));
    assertThat(rows.get(1).attribute("Weights").orElseThrow().kind()).isEqualTo(ValueKind.NUMBER_LIST);
  }

  @Test
  void missingFilesSkipTheirSteps() throws Exception {
    TableDeclaration regions = loader.load(fixture("basic")).tables().get(1);

    assertThat(regions.table().timeZone()).isEqualTo(TableSpec.DEFAULT_TIME_ZONE);
    assertThat(regions.table().lockLevel()).isEqualTo(LockLevel.NONE);
    assertThat(regions.attributes()).isEmpty();
    assertThat(regions.rows()).isEmpty();
  }

  @Test
  void rejectsTableNamesThatEscapeTheConfigDirectory() throws IOException {
    for (String name : List.of("../secrets", "a/b", "a\\b", "..")) {
      writeDeployment("{\"instanceARN\": \"abc\", \"dataTables\": [{\"name\": \"" + name.replace("\\", "\\\\") + "\"}]}");
      ConfigurationException e = assertThrows(ConfigurationException.class, () -> loader.load(tempDir));
      assertThat(e).hasMessageThat().contains("Invalid table name");
    }
  }

  @Test
  void missingDeploymentFileIsAConfigurationError() {
    ConfigurationException e = assertThrows(ConfigurationException.class, () -> loader.load(tempDir));
    assertThat(e).hasMessageThat().contains("not found");
  }

  @Test
  void malformedJsonIsAConfigurationError() throws IOException {
    writeDeployment("{\"instanceARN\": ");
    assertThrows(ConfigurationException.class, () -> loader.load(tempDir));
  }

  @Test
  void duplicateTablesAreRejected() throws IOException {
    writeDeployment("{\"instanceARN\": \"abc\", \"dataTables\": [{\"name\": \"T\"}, {\"name\": \"T\"}]}");
    ConfigurationException e = assertThrows(ConfigurationException.class, () -> loader.loadDeploymentConfig(tempDir));
    assertThat(e).hasMessageThat().contains("more than once");
  }

  @Test
  void valuesNeedAttributeDeclarations() throws IOException {
    writeDeployment("{\"instanceARN\": \"abc\", \"dataTables\": [{\"name\": \"T\"}]}");
    write("attribute_values/T.json", "{\"values\": []}");

    ConfigurationException e = assertThrows(ConfigurationException.class, () -> loader.load(tempDir));
    assertThat(e).hasMessageThat().contains("no attributes");
  }

  @Test
  void valuesNamingUndeclaredAttributesAreRejected() throws IOException {
    writeDeployment("{\"instanceARN\": \"abc\", \"dataTables\": [{\"name\": \"T\"}]}");
    write("attributes/T.json", "{\"attributes\": [{\"name\": \"Id\", \"valueType\": \"TEXT\", \"primary\": true}]}");
    write("attribute_values/T.json", "{\"values\": [{\"primaryValues\": [{\"attributeName\": \"Id\", \"value\": \"1\"}],"
            + " \"attributes\": [{\"attributeName\": \"Color\", \"value\": \"red\"}]}]}");

    ConfigurationException e = assertThrows(ConfigurationException.class, () -> loader.load(tempDir));
    assertThat(e).hasMessageThat().contains("no attribute 'Color'");
  }

  private void writeDeployment(String json) throws IOException {
    write(DeploymentConfigLoader.DEPLOYMENT_FILE, json);
  }

  private void write(String relativePath, String content) throws IOException {
    Path file = tempDir.resolve(relativePath);
    Files.createDirectories(file.getParent());
    Files.writeString(file, content);
  }

  static Path fixture(String name) throws URISyntaxException {
    return Path.of(DeploymentConfigLoaderTest.class.getResource("/deployments/" + name + "/" + DeploymentConfigLoader.DEPLOYMENT_FILE).toURI())
            .getParent();
  }
}
