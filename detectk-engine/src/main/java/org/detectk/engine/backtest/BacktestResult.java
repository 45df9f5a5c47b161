package org.detectk.engine.backtest;

import java.util.List;
import lombok.Value;
import org.detectk.engine.check.CheckResult;

@Value
public class BacktestResult {
  String metricName;
  int totalChecks;
  int anomaliesDetected;
  int alertsSent;
  int failedChecks;
  List<CheckResult> results;

  static BacktestResult aggregate(String metricName, List<CheckResult> results) {
    int anomalies = 0;
    int alerts = 0;
    int failed = 0;
    for (CheckResult result : results) {
      anomalies += result.getAnomalies().size();
      alerts += result.getAlertsSent();
      if (!result.isSuccessful()) {
        failed++;
      }
    }
    return new BacktestResult(
        metricName, results.size(), anomalies, alerts, failed, List.copyOf(results));
  }
}
