/*
 * どこで: host 連携ポート
 * 何を: 選択された app/category/domain への制限の適用と解除を抽象化する
 * なぜ: OS 側の制限機構をドメインロジックから切り離すため
 */
package com.example.common.host;

import com.example.common.model.RestrictionSelection;
import java.util.Optional;

public interface RestrictionEnforcementService {

  /**
   * 役割: 選択に対する制限を適用する。
   * 動作: 同じ選択での再適用は冪等。直前の適用内容は置き換えられる。
   * 前提: selection は空でないこと。空選択の扱いは呼び出し側が決める。
   */
  void apply(RestrictionSelection selection);

  /** すべての制限を解除する。未適用時の呼び出しも安全。 */
  void clear();

  /** 診断用。判定には EnforcementRecord を使う。 */
  Optional<RestrictionSelection> currentlyApplied();
}
