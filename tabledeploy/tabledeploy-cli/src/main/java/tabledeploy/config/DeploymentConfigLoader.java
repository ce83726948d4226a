package tabledeploy.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tabledeploy.model.AttributeSpec;
import tabledeploy.model.ConfigurationException;
import tabledeploy.model.DesiredRow;
import tabledeploy.model.NamedValue;
import tabledeploy.model.TableSchema;
import tabledeploy.model.TableSpec;

import javax.inject.Inject;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Reads a config directory laid out as:
 * <pre>
 *   data_tables_config.json
 *   attributes/&lt;table&gt;.json
 *   attribute_values/&lt;table&gt;.json
 * </pre>
 * Values are typed against the table's attribute declarations as they are read, so every
 * {@link ConfigurationException} surfaces before anything is deployed.
 */
public class DeploymentConfigLoader {
  private static final Logger LOG = LoggerFactory.getLogger(DeploymentConfigLoader.class);
  public static final String DEPLOYMENT_FILE = "data_tables_config.json";
  public static final String ATTRIBUTES_DIR = "attributes";
  public static final String VALUES_DIR = "attribute_values";

  private final ObjectMapper mapper;

  @Inject
  public DeploymentConfigLoader(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  public static ObjectMapper buildObjectMapper() {
    return new ObjectMapper()
            .registerModule(new Jdk8Module())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  /**
   * Loads the whole directory: the deployment file and every declared table's attributes and values.
   */
  public Deployment load(Path configDir) {
    DeploymentConfig config = loadDeploymentConfig(configDir);
    List<TableDeclaration> tables = config.dataTables().stream()
            .map(table -> loadTable(configDir, table))
            .collect(ImmutableList.toImmutableList());
    return new Deployment(config.instanceArn(), tables);
  }

  /**
   * Loads {@value #DEPLOYMENT_FILE} alone, checking its table names.
   */
  public DeploymentConfig loadDeploymentConfig(Path configDir) {
    Path file = configDir.resolve(DEPLOYMENT_FILE);
    DeploymentConfig config = readFile(file, DeploymentConfig.class)
            .orElseThrow(() -> ConfigurationException.format("Configuration file not found: %s", file));
    if (config.instanceArn().isBlank()) {
      throw ConfigurationException.format("%s declares no instanceARN", file);
    }
    Set<String> names = new HashSet<>();
    for (TableSpec table : config.dataTables()) {
      checkTableName(table.name());
      if (!names.add(table.name())) {
        throw ConfigurationException.format("%s declares table '%s' more than once", file, table.name());
      }
    }
    return config;
  }

  public TableDeclaration loadTable(Path configDir, TableSpec table) {
    checkTableName(table.name());
    Optional<List<AttributeSpec>> attributes = readFile(tableFile(configDir, ATTRIBUTES_DIR, table.name()), AttributesFile.class)
            .map(AttributesFile::attributes);
    Optional<ValuesFile> values = readFile(tableFile(configDir, VALUES_DIR, table.name()), ValuesFile.class);

    TableDeclaration declaration = new TableDeclaration(table, attributes, Optional.empty());
    if (values.isEmpty()) {
      LOG.info("No values declared for table '{}'", table.name());
      return declaration;
    }
    TableSchema schema = declaration.schema().orElseThrow(() -> ConfigurationException.format(
            "Table '%s' declares values but no attributes to type them", table.name()));
    List<DesiredRow> rows = values.get().values().stream()
            .map(row -> toDesiredRow(schema, row))
            .collect(ImmutableList.toImmutableList());
    LOG.info("Loaded {} attributes and {} rows for table '{}'", schema.attributes().size(), rows.size(), table.name());
    return new TableDeclaration(table, attributes, Optional.of(rows));
  }

  static void checkTableName(String tableName) {
    if (tableName.isEmpty() || tableName.contains("..") || tableName.contains("/") || tableName.contains("\\")) {
      throw ConfigurationException.format("Invalid table name: '%s'", tableName);
    }
  }

  private static Path tableFile(Path configDir, String subdirectory, String tableName) {
    return configDir.resolve(subdirectory).resolve(tableName + ".json");
  }

  private static DesiredRow toDesiredRow(TableSchema schema, ValuesFile.Row row) {
    return DesiredRow.builder()
            .primaryValues(typed(schema, row.primaryValues()))
            .attributes(typed(schema, row.attributes()))
            .build();
  }

  private static List<NamedValue> typed(TableSchema schema, List<ValuesFile.Entry> entries) {
    return entries.stream()
            .map(entry -> {
              AttributeSpec attribute = schema.attribute(entry.attributeName())
                      .orElseThrow(() -> ConfigurationException.format(
                              "Table '%s' has no attribute '%s'", schema.tableName(), entry.attributeName()));
              return NamedValue.of(
                      attribute.name(),
                      AttributeValueParser.parse(attribute.name(), attribute.valueType(), entry.value()));
            })
            .collect(ImmutableList.toImmutableList());
  }

  private <T> Optional<T> readFile(Path file, Class<T> type) {
    if (!Files.exists(file)) {
      LOG.debug("No {} at {}", type.getSimpleName(), file);
      return Optional.empty();
    }
    try {
      return Optional.of(mapper.readValue(file.toFile(), type));
    } catch (IOException e) {
      throw new ConfigurationException("Cannot read configuration file " + file + ": " + e.getMessage(), e);
    }
  }
}
