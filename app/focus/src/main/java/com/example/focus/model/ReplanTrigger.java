package com.example.focus.model;

public enum ReplanTrigger {
  DAY_ROLLOVER,
  SETTINGS_CHANGED,
  FOREGROUND,
  PERIODIC,
  FORCED
}
