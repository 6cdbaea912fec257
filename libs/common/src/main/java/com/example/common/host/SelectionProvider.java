package com.example.common.host;

import com.example.common.model.RestrictionSelection;

public interface SelectionProvider {

  /** 呼び出し時点の選択。未設定なら空の選択を返す。 */
  RestrictionSelection currentSelection();
}
