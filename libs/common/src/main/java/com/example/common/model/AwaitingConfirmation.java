/*
 * どこで: 共通ドメインモデル
 * 何を: STRICT モードで window 終了後も制限を維持している事実
 * なぜ: どの window の確認待ちかを main process が判別できるようにするため
 */
package com.example.common.model;

import java.time.Instant;

public record AwaitingConfirmation(WindowId windowId, Instant since) {}
