/*
 * どこで: 共有状態ストア
 * 何を: キー変更通知の購読口を提供する
 * なぜ: main process がポーリングせずに状態の再計算契機を得るため
 */
package com.example.common.state;

public interface StateChangeFeed {

  /**
   * 役割: 変更通知を購読する。
   * 動作: 書き込み/削除のたびに論理キー名で listener を呼び出す。戻り値の close で購読解除する。
   * 前提: listener は短時間で戻ること。
   */
  StateSubscription subscribe(StateChangeListener listener);
}
