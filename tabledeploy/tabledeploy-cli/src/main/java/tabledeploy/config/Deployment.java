package tabledeploy.config;

import java.util.List;

/**
 * A fully loaded config directory.
 */
public record Deployment(String instanceArn, List<TableDeclaration> tables) {
  public Deployment {
    tables = List.copyOf(tables);
  }
}
