package ca.gc.cra.midscan.domain.mailbox;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Ordered, duplicate-free list of mailboxes visited for one identifier.
 * <p><strong>Why:</strong> Messages that "disappear" usually sit in trash, junk, sent or archive folders, so those
 * are visited right after the active mailbox and before the long tail of user folders.</p>
 * <p><strong>Role:</strong> Domain value built fresh per identifier by the scan planner.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public final class ScanPlan implements Iterable<String> {
  private final List<String> mailboxes;

  private ScanPlan(List<String> mailboxes) {
    this.mailboxes = List.copyOf(mailboxes);
  }

  /**
   * Builds a plan from a start mailbox, a priority list and the candidate set.
   *
   * <p>Order is: the start mailbox, then priority names that are also candidates (priority order), then the
   * remaining candidates (candidate order). Duplicates keep their first position. Names in {@code excluded}
   * never appear.</p>
   *
   * @param start mailbox to visit first; may be {@code null} or blank to skip
   * @param priority conventionally important mailbox names
   * @param candidates mailboxes available for scanning
   * @param excluded names flagged not selectable by the enumerator
   * @return immutable plan
   */
  public static ScanPlan build(
      String start,
      List<String> priority,
      Collection<String> candidates,
      Set<String> excluded) {
    Objects.requireNonNull(priority, "priority");
    Objects.requireNonNull(candidates, "candidates");
    Objects.requireNonNull(excluded, "excluded");

    Set<String> ordered = new LinkedHashSet<>();
    if (start != null && !start.isBlank()) {
      ordered.add(start);
    }
    Set<String> candidateSet = new LinkedHashSet<>(candidates);
    for (String name : priority) {
      if (candidateSet.contains(name)) {
        ordered.add(name);
      }
    }
    ordered.addAll(candidateSet);
    ordered.removeIf(name -> name == null || name.isBlank() || excluded.contains(name));
    return new ScanPlan(new ArrayList<>(ordered));
  }

  /**
   * Creates a plan that visits exactly the given mailboxes in order, dropping duplicates.
   *
   * @param mailboxes mailbox names
   * @return plan
   */
  public static ScanPlan of(String... mailboxes) {
    return new ScanPlan(new ArrayList<>(new LinkedHashSet<>(List.of(mailboxes))));
  }

  /**
   * Returns the planned mailboxes.
   *
   * @return immutable ordered list
   */
  public List<String> mailboxes() {
    return mailboxes;
  }

  /**
   * Returns the number of planned mailboxes.
   *
   * @return plan size
   */
  public int size() {
    return mailboxes.size();
  }

  /**
   * Indicates whether there is nothing to scan.
   *
   * @return {@code true} for an empty plan
   */
  public boolean isEmpty() {
    return mailboxes.isEmpty();
  }

  @Override
  public Iterator<String> iterator() {
    return mailboxes.iterator();
  }

  @Override
  public String toString() {
    return "ScanPlan" + mailboxes;
  }
}
