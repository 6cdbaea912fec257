/*
 * どこで: 共通ドメインモデル
 * 何を: 選択が空で制限を適用できなかった警告
 * なぜ: 何もブロックしない「成功」を利用者へ通知可能な状態として残すため
 */
package com.example.common.model;

import java.time.Instant;

public record NoSelectionWarning(boolean active, Instant raisedAt, WindowId windowId) {}
