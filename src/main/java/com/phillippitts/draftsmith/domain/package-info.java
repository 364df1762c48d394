/**
 * Immutable domain values: the iteration model driven by the step state machine and the
 * session records owned by the orchestrator.
 */
package com.phillippitts.draftsmith.domain;
