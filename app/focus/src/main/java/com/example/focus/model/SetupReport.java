/*
 * どこで: Focus ドメインモデル
 * 何を: ブロック機能の設定状況の診断結果を表現する
 * なぜ: 「何も起きない」原因を起動時ログと画面の双方で同じ形で示すため
 */
package com.example.focus.model;

import java.util.List;

public record SetupReport(
    boolean selectionPresent,
    int selectionSize,
    int plannedWindowCount,
    int hostRegistrationCount,
    boolean windowActiveNow,
    boolean authorizationRequired,
    boolean noSelectionWarning,
    boolean currentlyEnforced,
    int monitoredWindowCount,
    List<String> issues) {

  public SetupReport {
    issues = List.copyOf(issues);
  }

  public boolean healthy() {
    return issues.isEmpty();
  }
}
