package org.detectk.metric.anomaly.detector.identity;

import com.google.common.base.Preconditions;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import org.detectk.metric.anomaly.detector.config.DetectorDefaults;
import org.detectk.metric.anomaly.detector.config.DetectorSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives stable detector ids: SHA-256 over {@code kind + ":" + canonical params}, truncated to
 * {@link #DEFAULT_ID_LENGTH} hex characters. Explicit ids on a DetectorSpec are returned unchanged.
 */
public class DetectorIdGenerator {
  private static final Logger LOGGER = LoggerFactory.getLogger(DetectorIdGenerator.class);
  public static final int DEFAULT_ID_LENGTH = 8;
  private static final int MAX_ID_LENGTH = 64;

  private final ParamsCanonicalizer canonicalizer;
  private final int idLength;

  public DetectorIdGenerator(DetectorDefaults defaults) {
    this(defaults, DEFAULT_ID_LENGTH);
  }

  public DetectorIdGenerator(DetectorDefaults defaults, int idLength) {
    Preconditions.checkArgument(
        idLength >= DEFAULT_ID_LENGTH && idLength <= MAX_ID_LENGTH,
        "idLength must be within [%s, %s]: %s",
        DEFAULT_ID_LENGTH,
        MAX_ID_LENGTH,
        idLength);
    this.canonicalizer = new ParamsCanonicalizer(defaults);
    this.idLength = idLength;
  }

  public String generate(DetectorSpec spec) {
    String canonical =
        spec.getKind().getLabel()
            + ":"
            + canonicalizer.toCanonicalJson(spec.getKind(), spec.getParams().toParamMap());
    String id =
        Hashing.sha256()
            .hashString(canonical, StandardCharsets.UTF_8)
            .toString()
            .substring(0, idLength);
    LOGGER.debug(
        "Derived detector id {} from {} with defaults {}",
        id,
        canonical,
        canonicalizer.getDefaults());
    return id;
  }

  /** Returns the explicit id when one is set, or the derived one. */
  public String resolveId(DetectorSpec spec) {
    return spec.getExplicitId().orElseGet(() -> generate(spec));
  }
}
