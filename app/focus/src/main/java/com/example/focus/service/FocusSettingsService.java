/*
 * どこで: Focus サービス層
 * 何を: モード・有効礼拝・window 長・選択の設定を書き込む
 * なぜ: 設定キーの唯一の書き込み者として、変更後の再計画まで責任を持つため
 */
package com.example.focus.service;

import com.example.common.model.BlockingMode;
import com.example.common.model.PrayerName;
import com.example.common.model.RestrictionSelection;
import com.example.focus.config.FocusProperties;
import com.example.focus.model.BlockingSession;
import com.example.focus.model.FocusSettings;
import com.example.focus.model.ReconcileResult;
import com.example.focus.model.ReplanTrigger;
import com.example.focus.model.SessionState;
import com.example.focus.repository.BlockingStateRepository;
import java.time.Duration;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class FocusSettingsService {

  private static final Logger logger = LoggerFactory.getLogger(FocusSettingsService.class);

  private final BlockingStateRepository repository;
  private final ReplanService replanService;
  private final BlockingSessionService sessionService;
  private final FocusProperties properties;

  public FocusSettings settings() {
    return new FocusSettings(
        repository.mode(),
        repository.enabledPrayers(),
        repository.windowDuration(),
        repository.selection());
  }

  /**
   * 役割: ブロックモードを切り替える。
   * 動作: 適用中の window がある間に STRICT へ切り替える操作は FocusSettingsConflictException。
   * 前提: モードは計画に影響しないため再計画しない。end callback 時点のモードが使われる。
   */
  public void updateMode(BlockingMode mode) {
    final BlockingMode current = repository.mode();
    if (current == mode) {
      return;
    }
    if (mode == BlockingMode.STRICT) {
      final BlockingSession session = sessionService.currentSession();
      if (session.state() == SessionState.ACTIVE) {
        throw new FocusSettingsConflictException(
            "strict mode cannot be enabled while window " + session.windowId() + " is active");
      }
    }
    repository.saveMode(mode);
    logger.info("blocking mode updated from={} to={}", current, mode);
  }

  public ReconcileResult updateEnabledPrayers(Set<PrayerName> prayers) {
    repository.saveEnabledPrayers(prayers);
    logger.info("enabled prayers updated prayers={}", prayers);
    return replanService.replan(ReplanTrigger.SETTINGS_CHANGED);
  }

  /** host の最小区間より短い値は最小値へ丸める。登録済みの window には影響しない。 */
  public ReconcileResult updateWindowDuration(Duration duration) {
    final Duration minimum = properties.minimumWindowDuration();
    final Duration effective = duration.compareTo(minimum) < 0 ? minimum : duration;
    if (!effective.equals(duration)) {
      logger.warn("window duration raised to minimum requested={} minimum={}", duration, minimum);
    }
    repository.saveWindowDuration(effective);
    return replanService.replan(ReplanTrigger.SETTINGS_CHANGED);
  }

  /** 次の window 開始時に agent が読む。適用中の制限は変えない。 */
  public void updateSelection(RestrictionSelection selection) {
    repository.saveSelection(selection);
    logger.info("restriction selection updated {}", selection.summary());
  }
}
