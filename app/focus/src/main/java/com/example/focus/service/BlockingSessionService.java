/*
 * どこで: Focus サービス層
 * 何を: 現在のセッション取得と、確認・早期解除のユーザー操作を提供する
 * なぜ: 解除意図を FOCUS 所有キーとして書き、agent の所有キーに触れずに即時解除するため
 */
package com.example.focus.service;

import com.example.common.host.RestrictionEnforcementService;
import com.example.common.model.BlockingMode;
import com.example.common.model.ConfirmationIntent;
import com.example.common.model.EarlyUnlockToken;
import com.example.focus.model.BlockingFacts;
import com.example.focus.model.BlockingSession;
import com.example.focus.model.EarlyUnlockResult;
import com.example.focus.model.SessionState;
import com.example.focus.repository.BlockingStateRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class BlockingSessionService {

  private static final Logger logger = LoggerFactory.getLogger(BlockingSessionService.class);

  private final BlockingStateRepository repository;
  private final BlockingStateMachine stateMachine;
  private final RestrictionEnforcementService restrictionEnforcementService;
  private final FocusMetrics metrics;
  private final Clock clock;

  public BlockingSession currentSession() {
    return stateMachine.evaluate(Instant.now(clock), repository.snapshot());
  }

  /**
   * 役割: STRICT モードの確認待ちを解除する。
   * 動作: 確認意図を書き、制限を即時解除する。確認待ちでなければ何もしない。
   * 前提: agent は次回起動時に意図を取り込み、記録へ clearedAt を書く。
   */
  public boolean confirm() {
    final Instant now = Instant.now(clock);
    final BlockingSession session = stateMachine.evaluate(now, repository.snapshot());
    if (session.state() != SessionState.AWAITING_CONFIRMATION) {
      logger.info("confirmation ignored state={}", session.state());
      return false;
    }
    repository.saveConfirmation(new ConfirmationIntent(session.windowId(), now));
    restrictionEnforcementService.clear();
    metrics.recordConfirmation();
    logger.info("strict hold confirmed windowId={}", session.windowId());
    return true;
  }

  /**
   * 役割: NORMAL モードの適用中 window を早期解除する。
   * 動作: 可能であればトークンを書いて制限を即時解除する。不可なら理由を返し何もしない。
   * 前提: トークンは window 単位で、次の window では無効になる。
   */
  public EarlyUnlockResult requestEarlyUnlock() {
    final Instant now = Instant.now(clock);
    final BlockingFacts facts = repository.snapshot();
    final BlockingSession session = stateMachine.evaluate(now, facts);
    final EarlyUnlockResult result = decide(facts, session);
    if (result == EarlyUnlockResult.GRANTED) {
      repository.saveEarlyUnlockToken(new EarlyUnlockToken(session.windowId(), now));
      restrictionEnforcementService.clear();
    }
    metrics.recordEarlyUnlock(result.name().toLowerCase(Locale.ROOT));
    logger.info("early unlock requested result={} windowId={}", result, session.windowId());
    return result;
  }

  private EarlyUnlockResult decide(BlockingFacts facts, BlockingSession session) {
    if (session.state() == SessionState.CLEARED
        && session.windowId() != null
        && facts.earlyUnlockUsedFor(session.windowId())) {
      return EarlyUnlockResult.ALREADY_USED;
    }
    if (session.state() == SessionState.AWAITING_CONFIRMATION) {
      return EarlyUnlockResult.STRICT_MODE;
    }
    if (session.state() != SessionState.ACTIVE) {
      return EarlyUnlockResult.NO_ACTIVE_WINDOW;
    }
    if (facts.mode() == BlockingMode.STRICT) {
      return EarlyUnlockResult.STRICT_MODE;
    }
    if (facts.earlyUnlockUsedFor(session.windowId())) {
      return EarlyUnlockResult.ALREADY_USED;
    }
    if (!session.earlyUnlockAvailable()) {
      return EarlyUnlockResult.NOT_AVAILABLE;
    }
    return EarlyUnlockResult.GRANTED;
  }
}
