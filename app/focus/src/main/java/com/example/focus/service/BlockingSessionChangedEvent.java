package com.example.focus.service;

import com.example.focus.model.BlockingSession;

/** previous は起動直後の初回判定では null。 */
public record BlockingSessionChangedEvent(BlockingSession previous, BlockingSession current) {}
