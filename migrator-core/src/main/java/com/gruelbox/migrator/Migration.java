package com.gruelbox.migrator;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;

/**
 * A single reversible schema change. Migrations are identified and ordered by {@link #getId()}:
 * ascending order is the order in which they are brought up, descending the order in which they
 * are brought down.
 *
 * <p>The {@link #getUp()} and {@link #getDown()} scripts are opaque to the migrator; how they are
 * executed is entirely up to the {@link Store}. The {@link com.gruelbox.migrator.jdbc.JdbcStore},
 * for example, treats them as SQL.
 */
@Value
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
@ToString(of = {"id", "name"})
public class Migration {

  @EqualsAndHashCode.Include long id;
  String name;
  String up;
  String down;

  /**
   * @return The name used in logs and reports, in the form {@code <id>-<name>}.
   */
  public String displayName() {
    return id + "-" + name;
  }
}
