/*
 * どこで: Focus 設定
 * 何を: ローカル host アダプタの認可状態と登録上限を保持する
 * なぜ: 認可取り消しや上限到達をローカル環境で再現できるようにするため
 */
package com.example.focus.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "blocking.host")
public record HostProperties(boolean authorized, @Min(1) int registrationCeiling) {}
