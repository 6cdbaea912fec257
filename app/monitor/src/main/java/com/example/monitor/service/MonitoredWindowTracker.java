package com.example.monitor.service;

import com.example.common.model.WindowId;
import com.example.monitor.config.MonitorProperties;
import com.example.monitor.repository.EnforcementStateRepository;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** currently-monitored-window-ids の追加・削除と刈り込み。 */
@Component
@RequiredArgsConstructor
public class MonitoredWindowTracker {

  private final EnforcementStateRepository repository;
  private final MonitorProperties properties;

  public void add(WindowId windowId, Instant now) {
    final List<WindowId> ids = new ArrayList<>(repository.monitoredWindowIds());
    ids.remove(windowId);
    ids.add(windowId);
    repository.saveMonitoredWindowIds(prune(ids, now));
  }

  public void remove(WindowId windowId, Instant now) {
    final List<WindowId> ids = new ArrayList<>(repository.monitoredWindowIds());
    ids.remove(windowId);
    repository.saveMonitoredWindowIds(prune(ids, now));
  }

  // 開始から保持期間を過ぎた id を落とし、上限を超えたら末尾 keep 件だけ残す
  private List<WindowId> prune(List<WindowId> ids, Instant now) {
    final Instant cutoff = now.minus(properties.monitoredIdsRetention());
    final List<WindowId> recent =
        ids.stream().filter(id -> !id.startTime().isBefore(cutoff)).toList();
    if (recent.size() <= properties.monitoredIdsMax()) {
      return recent;
    }
    return recent.subList(recent.size() - properties.monitoredIdsKeep(), recent.size());
  }
}
