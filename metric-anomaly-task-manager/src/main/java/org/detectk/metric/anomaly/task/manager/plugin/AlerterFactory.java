package org.detectk.metric.anomaly.task.manager.plugin;

import com.typesafe.config.Config;
import org.detectk.metric.anomaly.datamodel.Alerter;

@FunctionalInterface
public interface AlerterFactory {
  Alerter create(Config params);
}
