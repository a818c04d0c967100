/**
 * Recording pipeline that turns captures into classified, persisted events and alerts.
 *
 * @since 0.1.0
 */
package ca.gc.cra.snare.application.pipeline;
