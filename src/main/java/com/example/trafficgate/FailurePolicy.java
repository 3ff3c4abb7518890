package com.example.trafficgate;

/**
 * バックグラウンドの掃除・フラッシュが失敗したときに、どう振る舞うか。
 *
 * CONTINUE:
 *   ログとメトリクスに残して次の周期も動かし続ける = 機能維持優先
 *   (一時的な失敗で掃除やフラッシュが永久に止まるのを避けたい)
 *
 * STOP:
 *   最初の失敗でタイマーを止める = fail-fast
 *   (止まったことはヘルスチェックが DOWN になることで外から分かる。復旧はプロセス再起動)
 */
public enum FailurePolicy {
    CONTINUE,
    STOP
}
