/**
 * Provides a budget-aware retry dispatch engine for asynchronous integration work.
 * This includes the worker contract, handler resolution, the dispatch pipeline, persistence models, and retry rules.
 */
package com.sailfish.retrydispatch;
