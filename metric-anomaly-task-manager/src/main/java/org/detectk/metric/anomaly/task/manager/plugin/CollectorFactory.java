package org.detectk.metric.anomaly.task.manager.plugin;

import com.typesafe.config.Config;
import org.detectk.metric.anomaly.datamodel.Collector;

@FunctionalInterface
public interface CollectorFactory {
  Collector create(Config params);
}
