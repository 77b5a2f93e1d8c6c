package io.recurra.reconcile;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The outcome of regenerating a series: instances to delete, then instances to create.
 *
 * @param deleteIds ids of instances that may be deleted
 * @param creates instances to create after the deletions
 */
public record RegenerationPlan(List<String> deleteIds, List<CreateInstanceCommand> creates) {
  /** Creates a new RegenerationPlan with defensive copies of lists. */
  public RegenerationPlan {
    deleteIds = List.copyOf(deleteIds);
    creates = List.copyOf(creates);
  }

  /**
   * Returns a plan that changes nothing.
   *
   * @return an empty plan
   */
  public static RegenerationPlan empty() {
    return new RegenerationPlan(List.of(), List.of());
  }

  /**
   * Returns the dates to create as canonical strings.
   *
   * @return the create dates, ascending
   */
  public List<String> createDates() {
    return creates.stream()
        .map(c -> c.instanceDate().toString())
        .collect(Collectors.toList());
  }

  /**
   * Returns whether the plan changes nothing.
   *
   * @return true if there is nothing to delete or create
   */
  public boolean isEmpty() {
    return deleteIds.isEmpty() && creates.isEmpty();
  }
}
