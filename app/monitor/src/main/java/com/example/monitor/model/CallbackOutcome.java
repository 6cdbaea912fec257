package com.example.monitor.model;

/** 1 回の callback 処理の結果。メトリクスのタグにも使う。 */
public enum CallbackOutcome {
  APPLIED,
  SKIPPED_DESELECTED,
  SKIPPED_NO_SELECTION,
  SKIPPED_EXPIRED,
  CLEARED,
  AWAITING_CONFIRMATION,
  DIAGNOSTICS,
  NO_CHANGE
}
