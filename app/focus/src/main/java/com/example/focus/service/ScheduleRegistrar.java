/*
 * どこで: Focus サービス層
 * 何を: 計画した window 列と host の登録済み集合を突き合わせる
 * なぜ: agent の起動予約を冪等に保ち、登録拒否を再認可フラグとして伝えるため
 */
package com.example.focus.service;

import com.example.common.model.AuthorizationFlag;
import com.example.common.model.Window;
import com.example.common.model.WindowId;
import com.example.focus.config.FocusProperties;
import com.example.focus.host.ActivityMonitoringService;
import com.example.focus.host.ActivityRegistrationException;
import com.example.focus.model.ReconcileResult;
import com.example.focus.repository.BlockingStateRepository;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ScheduleRegistrar {

  private static final Logger logger = LoggerFactory.getLogger(ScheduleRegistrar.class);
  private static final int NEAR_DUPLICATE_MINUTES = 5;

  private final ActivityMonitoringService activityMonitoringService;
  private final BlockingStateRepository repository;
  private final FocusProperties properties;
  private final FocusMetrics metrics;
  private final Clock clock;

  /**
   * 役割: 計画と登録済み集合の差分だけを host へ反映する。
   * 動作: 不要になった id を解除し、新しい id と区間が変わった id を登録し直す。進行中の window は
   *       end callback を失わないよう登録済みの区間のまま維持し、その件数分だけ plan の末尾を
   *       次回へ回す。拒否された window は登録済み集合へ入れず次回再試行する。
   * 前提: plan は PrayerWindowPlanner の出力(開始時刻順、上限以内)であること。
   */
  public ReconcileResult reconcile(List<Window> plan) {
    final Instant now = Instant.now(clock);
    final List<WindowId> previousIds = prune(repository.registeredWindowIds(), now);
    final Map<WindowId, Window> previousPlan = new HashMap<>();
    repository.plannedWindows().forEach(window -> previousPlan.put(window.id(), window));
    final List<Window> inProgress = inProgressWindows(previousIds, previousPlan, now);
    final List<Window> upcoming = withinCeiling(plan, inProgress);

    final Set<WindowId> keep = new LinkedHashSet<>();
    inProgress.forEach(window -> keep.add(window.id()));
    upcoming.forEach(window -> keep.add(window.id()));

    final List<WindowId> unregistered =
        previousIds.stream().filter(id -> !keep.contains(id)).toList();
    if (!unregistered.isEmpty()) {
      activityMonitoringService.unregister(unregistered);
    }

    final Set<WindowId> nowRegistered = new TreeSet<>();
    previousIds.stream().filter(keep::contains).forEach(nowRegistered::add);
    final List<WindowId> registered = new ArrayList<>();
    final List<WindowId> unchanged = new ArrayList<>();
    final List<WindowId> failed = new ArrayList<>();
    final List<Window> planned = new ArrayList<>(inProgress);
    String failureReason = null;
    for (Window window : upcoming) {
      if (nowRegistered.contains(window.id()) && window.equals(previousPlan.get(window.id()))) {
        unchanged.add(window.id());
        planned.add(window);
        continue;
      }
      // 同じ id の再登録は host 側で区間を置き換える
      try {
        activityMonitoringService.unregister(nearDuplicates(window.id(), keep));
        activityMonitoringService.register(
            window.id(), window.startTime(), window.endTime(), properties.warningOffset());
        nowRegistered.add(window.id());
        registered.add(window.id());
        planned.add(window);
      } catch (ActivityRegistrationException ex) {
        failed.add(window.id());
        // 置き換えに失敗した id は host に残る旧区間のまま計画へ残し、次回の差分で再試行する
        planned.add(
            nowRegistered.contains(window.id())
                ? previousPlan.getOrDefault(window.id(), window)
                : window);
        failureReason = ex.getMessage();
        logger.warn("window registration rejected windowId={}", window.id(), ex);
      }
    }

    planned.sort(Comparator.comparing(Window::startTime));
    repository.savePlannedWindows(planned);
    repository.saveRegisteredWindowIds(cap(new ArrayList<>(nowRegistered)));
    updateAuthorizationFlag(failed, failureReason, now);

    final ReconcileResult result = new ReconcileResult(registered, unregistered, failed, unchanged);
    metrics.recordRegistrations("registered", registered.size());
    metrics.recordRegistrations("unregistered", unregistered.size());
    metrics.recordRegistrations("failed", failed.size());
    metrics.recordRegistrations("unchanged", unchanged.size());
    metrics.updatePlannedWindows(planned.size());
    logger.info("schedule reconciled {} planned={}", result.summary(), planned.size());
    return result;
  }

  /**
   * 役割: 把握しているすべての登録を解除し、計画を空にする。
   * 動作: 登録済み集合と計画の双方に含まれる id を解除対象とする。
   * 前提: 進行中の window も解除されるため、その end callback は届かない。
   */
  public ReconcileResult unregisterAll() {
    final Set<WindowId> known = new TreeSet<>(repository.registeredWindowIds());
    repository.plannedWindows().forEach(window -> known.add(window.id()));
    final List<WindowId> unregistered = List.copyOf(known);
    if (!unregistered.isEmpty()) {
      activityMonitoringService.unregister(unregistered);
    }
    repository.savePlannedWindows(List.of());
    repository.saveRegisteredWindowIds(List.of());
    metrics.recordRegistrations("unregistered", unregistered.size());
    metrics.updatePlannedWindows(0);
    logger.info("all window registrations stopped count={}", unregistered.size());
    return ReconcileResult.unregisteredOnly(unregistered);
  }

  /** すべて解除してから plan を新規に登録し直す。 */
  public ReconcileResult forceReschedule(List<Window> plan) {
    final ReconcileResult stopped = unregisterAll();
    final ReconcileResult result = reconcile(plan);
    return new ReconcileResult(
        result.registered(), stopped.unregistered(), result.failed(), result.unchanged());
  }

  @VisibleForTesting
  static List<WindowId> nearDuplicates(WindowId windowId, Set<WindowId> keep) {
    final List<WindowId> neighbours = new ArrayList<>();
    for (int offset = -NEAR_DUPLICATE_MINUTES; offset <= NEAR_DUPLICATE_MINUTES; offset++) {
      if (offset == 0) {
        continue;
      }
      final WindowId neighbour =
          WindowId.of(
              windowId.prayerName(), windowId.startTime().plus(Duration.ofMinutes(offset)));
      if (!keep.contains(neighbour)) {
        neighbours.add(neighbour);
      }
    }
    return neighbours;
  }

  private List<WindowId> prune(List<WindowId> registeredIds, Instant now) {
    final Instant cutoff = now.minus(properties.registeredIdsRetention());
    return registeredIds.stream().filter(id -> !id.startTime().isBefore(cutoff)).toList();
  }

  private List<Window> inProgressWindows(
      List<WindowId> previousIds, Map<WindowId, Window> previousPlan, Instant now) {
    final Duration fallbackDuration = repository.windowDuration();
    final List<Window> inProgress = new ArrayList<>();
    for (WindowId id : previousIds) {
      final Window window =
          previousPlan.getOrDefault(
              id, new Window(id, id.prayerName(), id.startTime(), fallbackDuration));
      if (window.contains(now)) {
        inProgress.add(window);
      }
    }
    return inProgress;
  }

  /** 進行中の window が占める枠を差し引いた件数まで plan を切り詰める。 */
  private List<Window> withinCeiling(List<Window> plan, List<Window> inProgress) {
    final Set<WindowId> inProgressIds = new HashSet<>();
    inProgress.forEach(window -> inProgressIds.add(window.id()));
    final List<Window> upcoming =
        plan.stream().filter(window -> !inProgressIds.contains(window.id())).toList();
    final int slots = Math.max(0, properties.registrationCeiling() - inProgress.size());
    if (upcoming.size() <= slots) {
      return upcoming;
    }
    logger.info(
        "plan truncated for in-progress windows planned={} slots={} inProgress={}",
        upcoming.size(),
        slots,
        inProgress.size());
    return upcoming.subList(0, slots);
  }

  private List<WindowId> cap(List<WindowId> sortedIds) {
    final int max = properties.registeredIdsMax();
    if (sortedIds.size() <= max) {
      return sortedIds;
    }
    return sortedIds.subList(sortedIds.size() - max, sortedIds.size());
  }

  private void updateAuthorizationFlag(List<WindowId> failed, String reason, Instant now) {
    final boolean wasRequired = repository.authorizationFlag().required();
    if (!failed.isEmpty()) {
      repository.saveAuthorizationFlag(new AuthorizationFlag(true, now, reason));
      metrics.updateAuthorizationRequired(true);
      if (!wasRequired) {
        logger.warn("host authorization required failedWindows={}", failed.size());
      }
      return;
    }
    if (wasRequired) {
      repository.saveAuthorizationFlag(AuthorizationFlag.notRequired());
      logger.info("host authorization restored");
    }
    metrics.updateAuthorizationRequired(false);
  }
}
