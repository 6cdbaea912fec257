package com.example.focus.model;

public enum EarlyUnlockResult {
  GRANTED,
  NOT_AVAILABLE,
  ALREADY_USED,
  STRICT_MODE,
  NO_ACTIVE_WINDOW
}
