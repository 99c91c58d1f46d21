/**
 * <strong>Purpose:</strong> Validator library coercing raw setting input into typed values.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation; the user and
 * group validators may block on identity lookups.</p>
 * <p><strong>Observability:</strong> No logging; failures surface as {@link ca.gc.cra.rigging.validation.ValidationException}
 * or {@link ca.gc.cra.rigging.validation.ConfigException}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.rigging.validation;
