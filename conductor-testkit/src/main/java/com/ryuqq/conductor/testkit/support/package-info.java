/**
 * Test doubles and fixtures: a mutable clock, a scripted generation capability,
 * ready-made templates and event log builders.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.testkit.support;
