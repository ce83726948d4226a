package tabledeploy.reconcile;

public enum Phase {
  UPDATE,
  CREATE
}
