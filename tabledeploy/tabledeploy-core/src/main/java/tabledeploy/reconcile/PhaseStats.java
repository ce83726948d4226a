package tabledeploy.reconcile;

public record PhaseStats(int rows, int batches, int calls, int conflictRetries, int notFound) {
  public static final PhaseStats EMPTY = new PhaseStats(0, 0, 0, 0, 0);
}
