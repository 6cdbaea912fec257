/*
 * どこで: 共有状態ストア
 * 何を: 文字列キー/値の永続化と変更通知の送信を抽象化する
 * なぜ: Redis 実装とインメモリ実装を差し替え可能にするため
 */
package com.example.common.state;

import java.util.Optional;

public interface StateBackend {

  /**
   * 役割: 物理キーの値を取得する。
   * 動作: 値が存在しなければ empty を返す。
   * 前提: key は空でないこと。
   */
  Optional<String> get(String key);

  /**
   * 役割: 物理キーへ値を書き込む。
   * 動作: キー単位で原子的に置き換える。
   * 前提: key/value は null でないこと。
   */
  void set(String key, String value);

  void delete(String key);

  /** 変更チャネルへ論理キー名を通知する。購読者がいなくても失敗しない。 */
  void publish(String channel, String message);
}
