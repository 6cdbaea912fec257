/*
 * どこで: 共通ドメインモデル
 * 何を: STRICT モードの確認待ちを解除するユーザー確認を表現する
 * なぜ: main process から agent へ単一書き込み者のまま解除意図を渡すため
 */
package com.example.common.model;

import java.time.Instant;

public record ConfirmationIntent(WindowId windowId, Instant confirmedAt) {}
