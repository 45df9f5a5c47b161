package org.detectk.metric.anomaly.detector.identity;

import com.typesafe.config.ConfigFactory;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.detectk.metric.anomaly.detector.config.DetectorDefaults;
import org.detectk.metric.anomaly.detector.config.DetectorKind;
import org.detectk.metric.anomaly.detector.config.DetectorSpec;
import org.detectk.metric.anomaly.detector.config.DetectorSpecs;
import org.detectk.metric.anomaly.detector.config.MadParams;
import org.detectk.metric.anomaly.detector.config.ThresholdOperator;
import org.detectk.metric.anomaly.detector.config.ThresholdParams;
import org.detectk.metric.anomaly.detector.config.ZScoreParams;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class DetectorIdGeneratorTest {

  private final DetectorIdGenerator generator = new DetectorIdGenerator(DetectorDefaults.V1);

  @Test
  void testIdIsEightHexCharacters() {
    String id = generator.generate(DetectorSpec.of(MadParams.defaults()));
    Assertions.assertTrue(id.matches("[0-9a-f]{8}"), id);
  }

  @Test
  void testReorderedKeysAndOmittedDefaultsGiveSameId() {
    DetectorSpec explicit =
        DetectorSpecs.fromConfig(
            ConfigFactory.parseString(
                "kind = mad, params { n_sigma = 3.0, window_size = 30d, min_window_size = 100,"
                    + " use_weighted = false, seasonal_features = [hour_of_day, day_of_week] }"));
    DetectorSpec reordered =
        DetectorSpecs.fromConfig(
            ConfigFactory.parseString(
                "params { seasonal_features = [day_of_week, hour_of_day], n_sigma = 3 },"
                    + " kind = mad"));

    Assertions.assertEquals(generator.generate(explicit), generator.generate(reordered));
  }

  @Test
  void testDefaultsOnlySpecMatchesEmptyParams() {
    DetectorSpec fromConfig =
        DetectorSpecs.fromConfig(ConfigFactory.parseString("kind = zscore"));
    DetectorSpec built =
        DetectorSpec.of(
            ZScoreParams.builder()
                .windowSize(Duration.ofHours(720))
                .decayFactor(0.10)
                .useCombinedSeasonality(true)
                .build());
    Assertions.assertEquals(generator.generate(fromConfig), generator.generate(built));
    Assertions.assertTrue(
        new ParamsCanonicalizer(DetectorDefaults.V1)
            .canonicalize(DetectorKind.ZSCORE, built.getParams().toParamMap())
            .isEmpty());
  }

  @Test
  void testChangedParamChangesId() {
    String base = generator.generate(DetectorSpec.of(MadParams.defaults()));
    Assertions.assertNotEquals(
        base, generator.generate(DetectorSpec.of(MadParams.builder().nSigma(3.5).build())));
    Assertions.assertNotEquals(
        base,
        generator.generate(
            DetectorSpec.of(MadParams.builder().useCombinedSeasonality(false).build())));
    Assertions.assertNotEquals(
        base,
        generator.generate(
            DetectorSpec.of(MadParams.builder().seasonalFeatures(List.of("month")).build())));
  }

  @Test
  void testKindIsPartOfId() {
    Assertions.assertNotEquals(
        generator.generate(DetectorSpec.of(MadParams.defaults())),
        generator.generate(DetectorSpec.of(ZScoreParams.defaults())));
  }

  @Test
  void testExplicitIdTakesPrecedence() {
    DetectorSpec spec =
        DetectorSpec.of(
            "p95-hard-limit",
            ThresholdParams.builder().operator(ThresholdOperator.GT).value(250.0).build());
    Assertions.assertEquals("p95-hard-limit", generator.resolveId(spec));
    Assertions.assertNotEquals("p95-hard-limit", generator.generate(spec));
  }

  @Test
  void testDefaultsTableVersionAffectsId() {
    DetectorDefaults v2 =
        new DetectorDefaults("v2", Map.of(DetectorKind.MAD, Map.of("n_sigma", 3.5)));
    DetectorSpec spec = DetectorSpec.of(MadParams.builder().nSigma(3.5).build());

    Assertions.assertNotEquals(
        generator.generate(spec), new DetectorIdGenerator(v2).generate(spec));
  }

  @Test
  void testLongerIdsArePrefixExtensions() {
    DetectorSpec spec = DetectorSpec.of(MadParams.defaults());
    String longId = new DetectorIdGenerator(DetectorDefaults.V1, 16).generate(spec);
    Assertions.assertEquals(16, longId.length());
    Assertions.assertTrue(longId.startsWith(generator.generate(spec)));
    Assertions.assertThrows(
        IllegalArgumentException.class, () -> new DetectorIdGenerator(DetectorDefaults.V1, 4));
  }
}
