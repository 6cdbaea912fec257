/*
 * どこで: Focus ドメインモデル
 * 何を: 登録突き合わせ 1 回分の結果を表現する
 * なぜ: ログ・メトリクス・再認可フラグ判定を同じ集計から行うため
 */
package com.example.focus.model;

import com.example.common.model.WindowId;
import java.util.List;

public record ReconcileResult(
    List<WindowId> registered,
    List<WindowId> unregistered,
    List<WindowId> failed,
    List<WindowId> unchanged) {

  public ReconcileResult {
    registered = List.copyOf(registered);
    unregistered = List.copyOf(unregistered);
    failed = List.copyOf(failed);
    unchanged = List.copyOf(unchanged);
  }

  public static ReconcileResult unregisteredOnly(List<WindowId> unregistered) {
    return new ReconcileResult(List.of(), unregistered, List.of(), List.of());
  }

  public boolean fullySucceeded() {
    return failed.isEmpty();
  }

  public String summary() {
    return "registered="
        + registered.size()
        + " unregistered="
        + unregistered.size()
        + " failed="
        + failed.size()
        + " unchanged="
        + unchanged.size();
  }
}
