package tabledeploy.model;

public enum ValueKind {
  TEXT,
  NUMBER,
  BOOLEAN,
  TEXT_LIST,
  NUMBER_LIST;

  public boolean isList() {
    return this == TEXT_LIST || this == NUMBER_LIST;
  }
}
