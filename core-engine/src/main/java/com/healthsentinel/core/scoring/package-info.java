/**
 * Deterministic 0–100 health scoring of metric records.
 */
package com.healthsentinel.core.scoring;
