package com.example.focus.model;

public enum SessionState {
  IDLE,
  SCHEDULED,
  ACTIVE,
  AWAITING_CONFIRMATION,
  CLEARED
}
