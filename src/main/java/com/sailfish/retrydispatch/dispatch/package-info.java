/**
 * The dispatch pipeline: {@link com.sailfish.retrydispatch.dispatch.CandidateSelector} publishes
 * {@link com.sailfish.retrydispatch.dispatch.DispatchMessage}s onto a
 * {@link com.sailfish.retrydispatch.dispatch.DispatchQueue}, the
 * {@link com.sailfish.retrydispatch.dispatch.RetryDispatcher} consumes them under the dispatch budget, and the
 * {@link com.sailfish.retrydispatch.dispatch.OverflowRepublisher} puts whatever did not fit back onto the queue.
 */
package com.sailfish.retrydispatch.dispatch;
