/**
 * Sliding-window statistical detectors.
 *
 * <p>
 * All detectors implement the
 * {@link com.ensemblesentinel.core.detection.AnomalyDetector}
 * interface and are instantiated via
 * {@link com.ensemblesentinel.core.detection.DetectorFactory}.
 * Built-in variants, each extending
 * {@link com.ensemblesentinel.core.detection.SlidingWindowDetector}:
 * </p>
 * <ul>
 * <li>{@link com.ensemblesentinel.core.detection.ZScoreDetector}: |x − μ| / σ
 * over the full window</li>
 * <li>{@link com.ensemblesentinel.core.detection.MovingAverageDetector}:
 * latest value against the mean of the preceding values ± N × σ</li>
 * <li>{@link com.ensemblesentinel.core.detection.IqrDetector}: Tukey fences
 * around the interquartile range</li>
 * </ul>
 *
 * <h3>Extending</h3>
 * <p>
 * To add a new variant, extend {@code SlidingWindowDetector}, add its id to
 * {@code DetectorType} and map it in {@code DetectorFactory.create()}.
 * </p>
 *
 * @since 1.0.0
 */
package com.ensemblesentinel.core.detection;
