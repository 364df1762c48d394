/**
 * Spring configuration: typed properties, the provider thread pool, and bean wiring for the
 * provider hub and the generation orchestrator.
 */
package com.phillippitts.draftsmith.config;
