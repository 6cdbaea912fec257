package com.example.focus.model;

import com.example.common.model.BlockingMode;
import com.example.common.model.PrayerName;
import com.example.common.model.RestrictionSelection;
import java.time.Duration;
import java.util.Set;

public record FocusSettings(
    BlockingMode mode,
    Set<PrayerName> enabledPrayers,
    Duration windowDuration,
    RestrictionSelection selection) {}
