package io.recurra.reconcile;

import io.recurra.calendar.CalendarDate;
import io.recurra.eval.OccurrenceGenerator;
import io.recurra.model.GenerationBounds;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the materialized instances of a series consistent with its template.
 *
 * <p>Every operation is a pure function of its arguments: the caller supplies the template, the
 * instances the store already holds and "today", and receives commands to apply. Decisions are
 * made by diffing against the supplied state, so running an operation again after its commands
 * were applied produces no further creates.
 *
 * <p>Instances with registrations and exception instances are never offered for deletion.
 * Template-driven generation never creates a second instance on a date that still has one.
 *
 * <p>The reconciler does not serialize concurrent calls for the same series; the store is
 * expected to do so, for example with a per-series transaction.
 */
public final class SeriesReconciler {
  private static final Logger logger = LoggerFactory.getLogger(SeriesReconciler.class);

  private final ReconcilerConfig config;

  /** Creates a reconciler with the default horizons. */
  public SeriesReconciler() {
    this(ReconcilerConfig.defaults());
  }

  /**
   * Creates a reconciler.
   *
   * @param config the horizons to use
   */
  public SeriesReconciler(ReconcilerConfig config) {
    this.config = Objects.requireNonNull(config, "config");
  }

  /**
   * Returns the configuration in use.
   *
   * @return the configuration
   */
  public ReconcilerConfig config() {
    return config;
  }

  /**
   * First materialization of a freshly created series.
   *
   * @param template the series template
   * @param today the current day
   * @return the instances to create
   */
  public List<CreateInstanceCommand> initial(SeriesTemplate template, CalendarDate today) {
    return initial(template, today, SlugIndex.none());
  }

  /**
   * First materialization of a freshly created series.
   *
   * <p>Dates run from the template start through today plus the initial horizon.
   *
   * @param template the series template
   * @param today the current day
   * @param slugs the slugs already taken in the store
   * @return the instances to create
   */
  public List<CreateInstanceCommand> initial(
      SeriesTemplate template, CalendarDate today, SlugIndex slugs) {
    if (!isGenerating(template, "initial")) {
      return List.of();
    }
    CalendarDate horizon = today.plusMonths(config.initialHorizonMonths());
    GenerationBounds bounds =
        template.bounds(template.startDate(), horizon, template.maxOccurrences());
    List<CalendarDate> dates = OccurrenceGenerator.dates(template.rule(), bounds);

    logger.debug(
        "Series {}: initial materialization of {} dates through {}",
        template.id(),
        dates.size(),
        horizon);
    return commands(template, dates, slugs);
  }

  /**
   * Extends a series further ahead ("generate more").
   *
   * @param template the series template
   * @param existingDates the instance dates the store holds for the series
   * @param today the current day
   * @return the instances to create
   */
  public List<CreateInstanceCommand> extend(
      SeriesTemplate template, Collection<CalendarDate> existingDates, CalendarDate today) {
    return extend(template, existingDates, today, SlugIndex.none());
  }

  /**
   * Extends a series further ahead ("generate more").
   *
   * <p>Generation restarts at the latest existing date (or the template start when there are no
   * instances, or when the start was moved past them) and runs through today plus the extension
   * horizon. Dates already present are dropped. With an occurrence limit, the existing instances
   * count against it, so repeated extensions never grow the series past its limit.
   *
   * @param template the series template
   * @param existingDates the instance dates the store holds for the series
   * @param today the current day
   * @param slugs the slugs already taken in the store
   * @return the instances to create
   */
  public List<CreateInstanceCommand> extend(
      SeriesTemplate template,
      Collection<CalendarDate> existingDates,
      CalendarDate today,
      SlugIndex slugs) {
    if (!isGenerating(template, "extend")) {
      return List.of();
    }
    Set<CalendarDate> existing = new HashSet<>(existingDates);
    CalendarDate anchor =
        existing.stream()
            .max(Comparator.naturalOrder())
            .filter(latest -> latest.isAfter(template.startDate()))
            .orElse(template.startDate());
    CalendarDate horizon = today.plusMonths(config.extendHorizonMonths());

    Integer runLimit = null;
    long remaining = Long.MAX_VALUE;
    if (template.maxOccurrences() != null) {
      remaining = (long) template.maxOccurrences() - existing.size();
      if (remaining <= 0) {
        logger.info(
            "Series {}: occurrence limit {} already reached, nothing to extend",
            template.id(),
            template.maxOccurrences());
        return List.of();
      }
      long before = existing.stream().filter(d -> d.isBefore(anchor)).count();
      runLimit = (int) (template.maxOccurrences() - before);
    }

    List<CalendarDate> dates =
        OccurrenceGenerator.occurrences(template.rule(), template.bounds(anchor, horizon, runLimit))
            .filter(d -> !existing.contains(d))
            .limit(remaining)
            .collect(Collectors.toList());

    logger.debug(
        "Series {}: extending from {} through {}, {} existing, {} new",
        template.id(),
        anchor,
        horizon,
        existing.size(),
        dates.size());
    return commands(template, dates, slugs);
  }

  /**
   * Rebuilds the future of a series from its current template.
   *
   * @param template the series template
   * @param instances the instances the store holds for the series
   * @param today the current day
   * @return the instances to delete and to create
   */
  public RegenerationPlan regenerate(
      SeriesTemplate template, Collection<ExistingInstance> instances, CalendarDate today) {
    return regenerate(template, instances, today, SlugIndex.none());
  }

  /**
   * Rebuilds the future of a series from its current template.
   *
   * <p>Upcoming instances (dated today or later) without registrations and without manual edits
   * are offered for deletion. The template's dates from today through today plus the
   * regeneration horizon are then created, except on dates a surviving instance still holds.
   *
   * <p>The rule is re-run from today (or from the template start while that is still ahead), so
   * week alternation restarts at today's week and an occurrence limit counts from today.
   *
   * @param template the series template
   * @param instances the instances the store holds for the series
   * @param today the current day
   * @param slugs the slugs already taken in the store; slugs of deleted instances are reusable
   * @return the instances to delete and to create
   */
  public RegenerationPlan regenerate(
      SeriesTemplate template,
      Collection<ExistingInstance> instances,
      CalendarDate today,
      SlugIndex slugs) {
    if (!isGenerating(template, "regenerate")) {
      return RegenerationPlan.empty();
    }
    List<String> deleteIds = new ArrayList<>();
    Set<String> freedSlugs = new HashSet<>();
    Set<CalendarDate> remaining = new HashSet<>();
    for (ExistingInstance instance : instances) {
      if (instance.isUpcoming(today) && !instance.isPinned()) {
        deleteIds.add(instance.id());
        if (instance.slug() != null) {
          freedSlugs.add(instance.slug());
        }
      } else {
        remaining.add(instance.instanceDate());
      }
    }

    CalendarDate from = today.isBefore(template.startDate()) ? template.startDate() : today;
    CalendarDate horizon = today.plusMonths(config.regenerateHorizonMonths());
    GenerationBounds bounds = template.bounds(from, horizon, template.maxOccurrences());
    List<CalendarDate> dates =
        OccurrenceGenerator.occurrences(template.rule(), bounds)
            .filter(d -> !remaining.contains(d))
            .collect(Collectors.toList());

    SlugIndex afterDeletes = slug -> !freedSlugs.contains(slug) && slugs.isTaken(slug);
    logger.debug(
        "Series {}: regenerating through {}, {} deletable, {} kept, {} new",
        template.id(),
        horizon,
        deleteIds.size(),
        remaining.size(),
        dates.size());
    return new RegenerationPlan(deleteIds, commands(template, dates, afterDeletes));
  }

  /**
   * Selects the instances a template content edit propagates to: upcoming, non-exception ones.
   * Past instances and exceptions keep their content.
   *
   * @param instances the instances the store holds for the series
   * @param today the current day
   * @return ids of the instances to update
   */
  public List<String> contentUpdateTargets(
      Collection<ExistingInstance> instances, CalendarDate today) {
    return upcoming(instances, today)
        .filter(i -> !i.isException())
        .map(ExistingInstance::id)
        .collect(Collectors.toList());
  }

  /**
   * Selects the instances that may be deleted when a series is removed: upcoming instances with
   * no registrations and no manual edits.
   *
   * @param instances the instances the store holds for the series
   * @param today the current day
   * @return ids of the instances that may be deleted
   */
  public List<String> retire(Collection<ExistingInstance> instances, CalendarDate today) {
    return upcoming(instances, today)
        .filter(i -> !i.isPinned())
        .map(ExistingInstance::id)
        .collect(Collectors.toList());
  }

  private static Stream<ExistingInstance> upcoming(
      Collection<ExistingInstance> instances, CalendarDate today) {
    return instances.stream().filter(i -> i.isUpcoming(today));
  }

  private static boolean isGenerating(SeriesTemplate template, String operation) {
    if (template.isActive()) {
      return true;
    }
    logger.info(
        "Series {} is {}, skipping {} generation", template.id(), template.status(), operation);
    return false;
  }

  private static List<CreateInstanceCommand> commands(
      SeriesTemplate template, List<CalendarDate> dates, SlugIndex slugs) {
    SlugAllocator allocator = new SlugAllocator(template.name(), slugs);
    List<CreateInstanceCommand> commands = new ArrayList<>(dates.size());
    for (CalendarDate date : dates) {
      String slug = allocator.allocate(date);
      if (!slug.endsWith(date.toString())) {
        logger.debug("Series {}: slug collision on {}, using {}", template.id(), date, slug);
      }
      commands.add(CreateInstanceCommand.generated(template.id(), date, slug));
    }
    return commands;
  }
}
