package com.gruelbox.migrator;

import java.util.ArrayList;
import java.util.List;
import lombok.Value;

/**
 * The outcome of a {@link Migrator} command.
 *
 * <p>A migration whose up script fails does not cause the command to throw. Instead, the command
 * stops at that migration and returns normally with {@link #getFailure()} set, leaving the
 * partially-applied state for an operator to inspect. Callers who need a hard failure signal
 * should check {@link #isSuccess()}.
 */
@Value
public class MigrationResult {

  public static final MigrationResult EMPTY = new MigrationResult(List.of(), List.of(), null);

  /** Migrations brought up, in the order applied. */
  List<Migration> applied;

  /** Migrations brought down, in the order reverted. */
  List<Migration> reverted;

  /** The migration whose up script failed, or null. */
  Migration failure;

  public MigrationResult(List<Migration> applied, List<Migration> reverted, Migration failure) {
    this.applied = List.copyOf(applied);
    this.reverted = List.copyOf(reverted);
    this.failure = failure;
  }

  static MigrationResult applied(List<Migration> applied) {
    return new MigrationResult(applied, List.of(), null);
  }

  static MigrationResult stoppedAt(List<Migration> applied, Migration failure) {
    return new MigrationResult(applied, List.of(), failure);
  }

  static MigrationResult reverted(List<Migration> reverted) {
    return new MigrationResult(List.of(), reverted, null);
  }

  /**
   * @return true unless an up script failed.
   */
  public boolean isSuccess() {
    return failure == null;
  }

  /**
   * @return true if nothing was applied or reverted and nothing failed.
   */
  public boolean isEmpty() {
    return applied.isEmpty() && reverted.isEmpty() && failure == null;
  }

  /**
   * Combines the outcome of two consecutive commands.
   *
   * @param next The result of the command which ran after this one.
   * @return The combined result. The first failure wins.
   */
  public MigrationResult merge(MigrationResult next) {
    List<Migration> allApplied = new ArrayList<>(applied);
    allApplied.addAll(next.applied);
    List<Migration> allReverted = new ArrayList<>(reverted);
    allReverted.addAll(next.reverted);
    return new MigrationResult(
        allApplied, allReverted, failure == null ? next.failure : failure);
  }
}
