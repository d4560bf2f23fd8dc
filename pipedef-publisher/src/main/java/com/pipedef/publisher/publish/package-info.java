/**
 * Publish run: {@link com.pipedef.publisher.publish.PublishOrchestrator} drives validate → fingerprint →
 * publish → fingerprint → classify for each definition and aggregates a
 * {@link com.pipedef.publisher.publish.RunResult}.
 */
package com.pipedef.publisher.publish;
