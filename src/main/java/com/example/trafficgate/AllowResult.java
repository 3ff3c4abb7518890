package com.example.trafficgate;

/**
 * 1回のアドミッション判定の結果。
 *
 * @param allowed           許可されたか
 * @param remaining         判定後に残っているトークン数（整数部）
 * @param resetAfterMillis  許可時は満タンまで、不許可時は次の1トークンまでの見込みミリ秒
 * @param retryAfterSeconds 不許可時の Retry-After 秒数（許可時は 0）
 */
public record AllowResult(boolean allowed, long remaining, long resetAfterMillis, long retryAfterSeconds) {}
