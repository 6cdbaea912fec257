/*
 * どこで: 共通ドメインモデル
 * 何を: window 開始時に agent が実際に行った処理の結果を定義する
 * なぜ: 計画と実施の乖離(スキップ理由)を記録に残すため
 */
package com.example.common.model;

public enum EnforcementOutcome {
  APPLIED,
  SKIPPED_DESELECTED,
  SKIPPED_NO_SELECTION,
  SKIPPED_EXPIRED
}
