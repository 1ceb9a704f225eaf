/**
 * Domain model classes for Ensemble Sentinel.
 *
 * <ul>
 * <li>{@link com.ensemblesentinel.core.model.DataPoint}: one immutable
 * observation of the time series</li>
 * <li>{@link com.ensemblesentinel.core.model.Verdict}: one detector's vote
 * for one fan-out round</li>
 * <li>{@link com.ensemblesentinel.core.model.DetectorType}: the closed set of
 * detector variants</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ensemblesentinel.core.model;
