package com.example.common.host;

import com.example.common.model.RestrictionSelection;
import com.example.common.state.SharedStateStore;
import com.example.common.state.StateKeys;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class StoredSelectionProvider implements SelectionProvider {

  private final SharedStateStore store;

  @Override
  public RestrictionSelection currentSelection() {
    return store.read(StateKeys.SELECTION).orElseGet(RestrictionSelection::empty);
  }
}
