/**
 * Defines the data access layer interfaces, such as {@link com.sailfish.retrydispatch.repository.ExecutionRecordRepository},
 * responsible for loading execution records, answering the retry candidate query, and storing outcomes.
 * The JPA implementations expect an {@code EntityManager} injected through {@code @PersistenceContext}
 * or passed to their constructor.
 */
package com.sailfish.retrydispatch.repository;
