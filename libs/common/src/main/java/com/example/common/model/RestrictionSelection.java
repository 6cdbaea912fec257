/*
 * どこで: 共通ドメインモデル
 * 何を: 制限対象の app/category/domain トークン集合を表現する
 * なぜ: 選択 UI の内部表現に依存せず不変スナップショットとして扱うため
 */
package com.example.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Set;

public record RestrictionSelection(
    Set<String> applicationTokens, Set<String> categoryTokens, Set<String> webDomainTokens) {

  public RestrictionSelection {
    applicationTokens = applicationTokens == null ? Set.of() : Set.copyOf(applicationTokens);
    categoryTokens = categoryTokens == null ? Set.of() : Set.copyOf(categoryTokens);
    webDomainTokens = webDomainTokens == null ? Set.of() : Set.copyOf(webDomainTokens);
  }

  public static RestrictionSelection empty() {
    return new RestrictionSelection(Set.of(), Set.of(), Set.of());
  }

  public static RestrictionSelection ofApplications(String... tokens) {
    return new RestrictionSelection(Set.of(tokens), Set.of(), Set.of());
  }

  @JsonIgnore
  public boolean isEmpty() {
    return applicationTokens.isEmpty() && categoryTokens.isEmpty() && webDomainTokens.isEmpty();
  }

  @JsonIgnore
  public int size() {
    return applicationTokens.size() + categoryTokens.size() + webDomainTokens.size();
  }

  /** ログ出力用の件数サマリ。トークン自体は出さない。 */
  public String summary() {
    return "apps="
        + applicationTokens.size()
        + " categories="
        + categoryTokens.size()
        + " domains="
        + webDomainTokens.size();
  }
}
