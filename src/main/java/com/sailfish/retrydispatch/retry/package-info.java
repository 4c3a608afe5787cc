/**
 * Contains the retry eligibility rules: {@link com.sailfish.retrydispatch.retry.RetryStrategy},
 * its policy-driven default {@link com.sailfish.retrydispatch.retry.PolicyRetryStrategy}, and the
 * {@link com.sailfish.retrydispatch.retry.RetryCriteria} passed to the candidate query.
 */
package com.sailfish.retrydispatch.retry;
