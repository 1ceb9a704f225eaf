/**
 * Input validation for data points entering the ensemble.
 *
 * @since 1.0.0
 */
package com.ensemblesentinel.core.validation;
