/*
 * どこで: Auth サービス層
 * 何を: ログイン/登録/トークン検証の結果をメトリクスとして記録する
 * なぜ: 認証失敗の急増や署名不一致の発生を Prometheus から直接観測できるようにするため
 */
package com.example.auth.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class AuthMetrics {

  private static final String METRIC_LOGIN_TOTAL = "auth.login.total";
  private static final String METRIC_REGISTER_TOTAL = "auth.register.total";
  private static final String METRIC_TOKEN_VERIFY_TOTAL = "auth.token.verify.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();

  public AuthMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordLoginResult(String result) {
    increment(METRIC_LOGIN_TOTAL, "Login outcomes", result);
  }

  public void recordRegistrationResult(String result) {
    increment(METRIC_REGISTER_TOTAL, "Registration outcomes", result);
  }

  public void recordTokenVerification(String result) {
    increment(METRIC_TOKEN_VERIFY_TOTAL, "Access token verification outcomes", result);
  }

  private void increment(String name, String description, String result) {
    counters
        .computeIfAbsent(
            name + "|" + result,
            ignored ->
                Counter.builder(name)
                    .description(description)
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }
}
